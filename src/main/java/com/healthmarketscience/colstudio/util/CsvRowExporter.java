/*
Copyright (c) 2007 Health Market Science, Inc.

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

import java.io.BufferedWriter;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;

import com.healthmarketscience.colstudio.Column;

/**
 * Writes delimited text.  Values containing the delimiter, the quote
 * character or a line break are quoted, nulls are written as empty fields.
 */
class CsvRowExporter extends RowExporter
{
  private final BufferedWriter _out;
  private final boolean _header;
  private final String _delimiter;
  private final char _quote;
  private final Pattern _needsQuotePattern;

  CsvRowExporter(BufferedWriter out, boolean header, String delimiter,
                 char quote)
  {
    _out = out;
    _header = header;
    _delimiter = delimiter;
    _quote = quote;

    // create pattern which will indicate whether or not a value needs to be
    // quoted or not (contains delimiter, separator, or newline)
    _needsQuotePattern = Pattern.compile(
        "(?:" + Pattern.quote(delimiter) + ")|(?:" +
        Pattern.quote("" + quote) + ")|(?:[\n\r])");
  }

  @Override
  protected void writeHeader() throws IOException {
    if(!_header) {
      return;
    }
    List<Column> columns = getColumns();
    for(Iterator<Column> iter = columns.iterator(); iter.hasNext();) {

      writeValue(iter.next().getName());

      if(iter.hasNext()) {
        _out.write(_delimiter);
      }
    }
    _out.newLine();
  }

  @Override
  public void writeRow(int rowIndex, Object[] rowData) throws IOException {
    int numCols = getColumns().size();
    for(int i = 0; i < numCols; i++) {

      String value = CellFormatter.format(rowData[i]);
      if(value != null) {
        writeValue(value);
      }

      if(i < numCols - 1) {
        _out.write(_delimiter);
      }
    }
    _out.newLine();
  }

  @Override
  public void finish() throws IOException {
    _out.flush();
  }

  private void writeValue(String value) throws IOException
  {
    if(!_needsQuotePattern.matcher(value).find()) {

      // no quotes necessary
      _out.write(value);
      return;
    }

    // wrap the value in quotes and handle internal quotes
    _out.write(_quote);
    for(int i = 0; i < value.length(); ++i) {
      char c = value.charAt(i);

      if(c == _quote) {
        _out.write(_quote);
      }
      _out.write(c);
    }
    _out.write(_quote);
  }
}
