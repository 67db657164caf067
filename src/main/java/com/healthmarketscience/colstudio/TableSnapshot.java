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

package com.healthmarketscience.colstudio;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only view of an {@link EditBuffer} at one point in time: the schema
 * and the rows, in display order.  Later edits to the buffer are not visible
 * through a snapshot.
 */
public final class TableSnapshot
{
  private final SchemaCatalog _schema;
  private final List<Row> _rows;
  private final long _modCount;

  public TableSnapshot(SchemaCatalog schema, List<? extends Row> rows,
                       long modCount)
  {
    _schema = schema;
    _rows = Collections.unmodifiableList(new ArrayList<Row>(rows));
    _modCount = modCount;
  }

  public SchemaCatalog getSchema() {
    return _schema;
  }

  /**
   * @return the rows of this snapshot, in display order (unmodifiable)
   */
  public List<Row> getRows() {
    return _rows;
  }

  public int getRowCount() {
    return _rows.size();
  }

  public Row getRow(int rowIndex) {
    return _rows.get(rowIndex);
  }

  /**
   * @return the number of modifications applied to the buffer when this
   *         snapshot was taken
   */
  public long getModificationCount() {
    return _modCount;
  }
}
