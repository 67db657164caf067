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

package com.healthmarketscience.colstudio.impl;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.healthmarketscience.colstudio.Cell;
import com.healthmarketscience.colstudio.Row;
import com.healthmarketscience.colstudio.SchemaCatalog;
import com.healthmarketscience.colstudio.SchemaMismatchException;

/**
 * An immutable row of cells.
 * <p>
 * Note that the {@link #equals} and {@link #hashCode} methods work on the row
 * contents <i>only</i> (i.e. they ignore the id).
 */
public class RowImpl implements Row
{
  private final SchemaCatalog _schema;
  private final RowIdImpl _id;
  private final Cell[] _cells;

  public RowImpl(SchemaCatalog schema, RowIdImpl id, Cell[] cells) {
    if(cells.length != schema.size()) {
      throw new SchemaMismatchException(
          "Row has " + cells.length + " cells, schema has " + schema.size() +
          " columns");
    }
    _schema = schema;
    _id = id;
    _cells = cells.clone();
  }

  @Override
  public RowIdImpl getId() {
    return _id;
  }

  @Override
  public SchemaCatalog getSchema() {
    return _schema;
  }

  @Override
  public int size() {
    return _cells.length;
  }

  @Override
  public Cell getCell(int columnIndex) {
    return _cells[columnIndex];
  }

  @Override
  public Cell getCell(String name) {
    return _cells[_schema.columnIndex(name)];
  }

  @Override
  public List<Cell> getCells() {
    return Collections.unmodifiableList(Arrays.asList(_cells));
  }

  /**
   * @return a copy of this row (with the same id) holding the given cell at
   *         the given position
   */
  public RowImpl withCell(int columnIndex, Cell cell) {
    Cell[] cells = _cells.clone();
    cells[columnIndex] = cell;
    return new RowImpl(_schema, _id, cells);
  }

  @Override
  public Object getValue(String name) {
    Cell cell = getCell(name);
    return (cell.isRawEdit() ? cell.getText() : cell.getValue());
  }

  @Override
  public Boolean getBoolean(String name) {
    return (Boolean)getTypedValue(name);
  }

  @Override
  public Integer getInt(String name) {
    return (Integer)getTypedValue(name);
  }

  @Override
  public Long getLong(String name) {
    return (Long)getTypedValue(name);
  }

  @Override
  public Float getFloat(String name) {
    return (Float)getTypedValue(name);
  }

  @Override
  public Double getDouble(String name) {
    return (Double)getTypedValue(name);
  }

  @Override
  public String getString(String name) {
    return (String)getTypedValue(name);
  }

  @Override
  public byte[] getBytes(String name) {
    return (byte[])getTypedValue(name);
  }

  @Override
  public LocalDate getLocalDate(String name) {
    return (LocalDate)getTypedValue(name);
  }

  @Override
  public LocalDateTime getLocalDateTime(String name) {
    return (LocalDateTime)getTypedValue(name);
  }

  @Override
  public Instant getInstant(String name) {
    return (Instant)getTypedValue(name);
  }

  @Override
  public BigDecimal getBigDecimal(String name) {
    return (BigDecimal)getTypedValue(name);
  }

  private Object getTypedValue(String name) {
    Cell cell = getCell(name);
    if(cell.isRawEdit()) {
      throw new ClassCastException(
          "Column '" + name + "' holds an uncommitted edit " + cell);
    }
    return cell.getValue();
  }

  @Override
  public boolean equals(Object o) {
    if(this == o) {
      return true;
    }
    if(!(o instanceof RowImpl)) {
      return false;
    }
    return Arrays.equals(_cells, ((RowImpl)o)._cells);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(_cells);
  }

  @Override
  public String toString() {
    return CustomToStringStyle.valueBuilder("Row[" + _id + "]")
      .append(null, Arrays.asList(_cells))
      .toString();
  }
}
