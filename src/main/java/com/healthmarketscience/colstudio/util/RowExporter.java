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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.healthmarketscience.colstudio.Column;

/**
 * Writes the rows of one export in a specific format.
 */
abstract class RowExporter
{
  private final List<ExportWarning> _warnings = new ArrayList<ExportWarning>();
  private List<Column> _columns = Collections.emptyList();

  protected RowExporter() {}

  protected List<Column> getColumns() {
    return _columns;
  }

  public List<ExportWarning> getWarnings() {
    return _warnings;
  }

  /**
   * Called once, before any row, with the (filtered) exported columns.
   */
  public void start(List<Column> columns) throws IOException {
    _columns = columns;
    writeHeader();
  }

  protected abstract void writeHeader() throws IOException;

  /**
   * Writes the values of the row at the given position of the exported
   * snapshot, one value per exported column.
   */
  public abstract void writeRow(int rowIndex, Object[] rowData)
    throws IOException;

  /**
   * Called once after the last row.  Must flush, but not close, the
   * underlying output.
   */
  public abstract void finish() throws IOException;

  protected void addWarning(Column column, int rowIndex, String message) {
    _warnings.add(new ExportWarning(column.getName(), rowIndex, message));
  }
}
