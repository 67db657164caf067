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

import java.util.Collection;
import java.util.SortedSet;

/**
 * The single mutable surface of a loaded table: the live row sequence plus
 * the current selection.  Rows are addressed by their 0-based position in
 * display order, which shifts when earlier rows are deleted.  The selection
 * is tracked per row (by {@link RowId}) and therefore follows a row when
 * earlier rows are deleted.
 * <p>
 * An EditBuffer never changes the {@link SchemaCatalog} it was created with,
 * and never performs any I/O.  It is meant to be used by a single thread.
 */
public interface EditBuffer
{
  public SchemaCatalog getSchema();

  public int getRowCount();

  /**
   * @throws IndexOutOfBoundsException if the row index is out of range
   */
  public Row getRow(int rowIndex);

  /**
   * Stores the given user input for a cell.  {@code null} input (and empty
   * input if empty strings are treated as null) stores a null cell, text for
   * a UTF8 column is stored as a value directly, any other text is stored as
   * a raw edit which is coerced to the column type at commit time.
   *
   * @throws IndexOutOfBoundsException if the row index is out of range
   * @throws UnknownColumnException if there is no such column
   */
  public void setCell(int rowIndex, String columnName, String rawInput);

  /**
   * Stores a typed value for a cell, validating it immediately against the
   * column type (e.g. a boolean toggle).  Numeric values are converted to
   * the column type if that can be done exactly, text is coerced like a
   * committed raw edit.
   *
   * @throws TypeCoercionException if the value is not valid for the column,
   *         in which case the buffer is unchanged
   * @throws IndexOutOfBoundsException if the row index is out of range
   * @throws UnknownColumnException if there is no such column
   */
  public void setValue(int rowIndex, String columnName, Object value)
    throws TypeCoercionException;

  /**
   * Removes the rows at the given positions, preserving the relative order
   * of the remaining rows.  Positions are resolved against the current state,
   * positions out of range are ignored.
   *
   * @return the new row count
   */
  public int deleteRows(Collection<Integer> rowIndexes);

  /**
   * Adds the row at the given position to the selection.
   * @throws IndexOutOfBoundsException if the row index is out of range
   */
  public void select(int rowIndex);

  /**
   * Removes the row at the given position from the selection.
   * @throws IndexOutOfBoundsException if the row index is out of range
   */
  public void deselect(int rowIndex);

  public void clearSelection();

  public boolean isSelected(int rowIndex);

  /**
   * @return the current positions of the selected rows, ascending
   */
  public SortedSet<Integer> getSelectedIndexes();

  /**
   * Deletes all selected rows and clears the selection.
   *
   * @return the new row count
   */
  public int deleteSelectedRows();

  /**
   * @return a read-only view reflecting every edit applied so far
   */
  public TableSnapshot snapshot();

  /**
   * @return {@code true} if the buffer was modified since it was loaded or
   *         last marked saved
   */
  public boolean isModified();

  /**
   * Records that the state captured by the given snapshot has been saved.
   * Edits applied after the snapshot was taken keep the buffer modified.
   */
  public void markSaved(TableSnapshot savedSnapshot);
}
