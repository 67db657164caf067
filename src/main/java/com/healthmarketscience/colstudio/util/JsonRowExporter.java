/*
Copyright (c) 2026 Health Market Science, Inc.

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.colstudio.util;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;

import com.fasterxml.jackson.core.JsonGenerator;

/**
 * Writes a JSON array holding one object per row, keyed by column name.
 * Numbers and booleans are written as JSON literals, binary values as
 * base64, everything else (including non-finite floating point values) in
 * its canonical text form.
 */
class JsonRowExporter extends RowExporter
{
  private final JsonGenerator _gen;

  JsonRowExporter(JsonGenerator gen) {
    _gen = gen;
    _gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
  }

  @Override
  protected void writeHeader() throws IOException {
    _gen.writeStartArray();
  }

  @Override
  public void writeRow(int rowIndex, Object[] rowData) throws IOException {
    _gen.writeStartObject();
    for(int i = 0; i < getColumns().size(); ++i) {
      _gen.writeFieldName(getColumns().get(i).getName());
      writeValue(rowData[i]);
    }
    _gen.writeEndObject();
  }

  private void writeValue(Object value) throws IOException {
    if(value == null) {
      _gen.writeNull();
    } else if(value instanceof Boolean) {
      _gen.writeBoolean((Boolean)value);
    } else if((value instanceof Integer) || (value instanceof Long) ||
              (value instanceof Short) || (value instanceof Byte)) {
      _gen.writeNumber(((Number)value).longValue());
    } else if(value instanceof BigInteger) {
      _gen.writeNumber((BigInteger)value);
    } else if(value instanceof BigDecimal) {
      _gen.writeNumber((BigDecimal)value);
    } else if(value instanceof Float) {
      float f = (Float)value;
      if(Float.isNaN(f) || Float.isInfinite(f)) {
        _gen.writeString(CellFormatter.format(value));
      } else {
        _gen.writeNumber(f);
      }
    } else if(value instanceof Double) {
      double d = (Double)value;
      if(Double.isNaN(d) || Double.isInfinite(d)) {
        _gen.writeString(CellFormatter.format(value));
      } else {
        _gen.writeNumber(d);
      }
    } else if(value instanceof byte[]) {
      _gen.writeBinary((byte[])value);
    } else {
      _gen.writeString(CellFormatter.format(value));
    }
  }

  @Override
  public void finish() throws IOException {
    _gen.writeEndArray();
    _gen.flush();
    _gen.close();
  }
}
