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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import com.healthmarketscience.colstudio.Cell;
import com.healthmarketscience.colstudio.Column;
import com.healthmarketscience.colstudio.DataType;
import com.healthmarketscience.colstudio.EditBuffer;
import com.healthmarketscience.colstudio.RowId;
import com.healthmarketscience.colstudio.SchemaCatalog;
import com.healthmarketscience.colstudio.TableSnapshot;
import com.healthmarketscience.colstudio.TypeCoercionException;

/**
 * EditBuffer implementation holding the live rows of one generation.  Rows
 * are immutable, an edit replaces the row at its position with a copy
 * holding the new cell (keeping the row's id).
 */
public class EditBufferImpl implements EditBuffer
{
  private final SchemaCatalog _schema;
  private final List<RowImpl> _rows;
  private final Set<RowId> _selected = new HashSet<RowId>();
  private final boolean _emptyStringAsNull;
  /** number of modifications applied since load */
  private long _modCount;
  /** value of _modCount when the buffer was last saved */
  private long _savedModCount;

  public EditBufferImpl(SchemaCatalog schema, List<RowImpl> rows,
                        boolean emptyStringAsNull)
  {
    _schema = schema;
    _rows = new ArrayList<RowImpl>(rows);
    _emptyStringAsNull = emptyStringAsNull;
  }

  @Override
  public SchemaCatalog getSchema() {
    return _schema;
  }

  @Override
  public int getRowCount() {
    return _rows.size();
  }

  @Override
  public RowImpl getRow(int rowIndex) {
    checkRowIndex(rowIndex);
    return _rows.get(rowIndex);
  }

  public boolean isEmptyStringAsNull() {
    return _emptyStringAsNull;
  }

  @Override
  public void setCell(int rowIndex, String columnName, String rawInput) {
    checkRowIndex(rowIndex);
    Column col = _schema.getColumn(columnName);

    Cell cell = null;
    if((rawInput == null) || (_emptyStringAsNull && rawInput.isEmpty())) {
      cell = Cell.nullCell();
    } else if(col.getDataType() == DataType.UTF8) {
      cell = Cell.of(col.getType(), rawInput);
    } else {
      cell = Cell.rawEdit(rawInput);
    }
    replaceCell(rowIndex, col, cell);
  }

  @Override
  public void setValue(int rowIndex, String columnName, Object value)
    throws TypeCoercionException
  {
    checkRowIndex(rowIndex);
    Column col = _schema.getColumn(columnName);
    if((value instanceof String) && _emptyStringAsNull &&
       ((String)value).isEmpty()) {
      value = null;
    }
    Object coerced = ValueCoercer.coerceValue(col, rowIndex, value);
    replaceCell(rowIndex, col, Cell.of(col.getType(), coerced));
  }

  private void replaceCell(int rowIndex, Column col, Cell cell) {
    _rows.set(rowIndex, _rows.get(rowIndex).withCell(
                  col.getColumnIndex(), cell));
    ++_modCount;
  }

  @Override
  public int deleteRows(Collection<Integer> rowIndexes) {
    Set<Integer> toDelete = new HashSet<Integer>();
    for(Integer rowIndex : rowIndexes) {
      if((rowIndex != null) && (rowIndex >= 0) && (rowIndex < _rows.size())) {
        toDelete.add(rowIndex);
      }
    }
    if(toDelete.isEmpty()) {
      return _rows.size();
    }

    List<RowImpl> survivors = new ArrayList<RowImpl>(
        _rows.size() - toDelete.size());
    for(int i = 0; i < _rows.size(); ++i) {
      RowImpl row = _rows.get(i);
      if(toDelete.contains(i)) {
        _selected.remove(row.getId());
      } else {
        survivors.add(row);
      }
    }
    _rows.clear();
    _rows.addAll(survivors);
    ++_modCount;
    return _rows.size();
  }

  @Override
  public void select(int rowIndex) {
    _selected.add(getRow(rowIndex).getId());
  }

  @Override
  public void deselect(int rowIndex) {
    _selected.remove(getRow(rowIndex).getId());
  }

  @Override
  public void clearSelection() {
    _selected.clear();
  }

  @Override
  public boolean isSelected(int rowIndex) {
    return ((rowIndex >= 0) && (rowIndex < _rows.size()) &&
            _selected.contains(_rows.get(rowIndex).getId()));
  }

  @Override
  public SortedSet<Integer> getSelectedIndexes() {
    SortedSet<Integer> indexes = new TreeSet<Integer>();
    if(_selected.isEmpty()) {
      return indexes;
    }
    for(int i = 0; i < _rows.size(); ++i) {
      if(_selected.contains(_rows.get(i).getId())) {
        indexes.add(i);
      }
    }
    return indexes;
  }

  @Override
  public int deleteSelectedRows() {
    int rowCount = deleteRows(getSelectedIndexes());
    _selected.clear();
    return rowCount;
  }

  @Override
  public TableSnapshot snapshot() {
    return new TableSnapshot(_schema, _rows, _modCount);
  }

  @Override
  public boolean isModified() {
    return (_modCount != _savedModCount);
  }

  @Override
  public void markSaved(TableSnapshot savedSnapshot) {
    if(savedSnapshot.getSchema() != _schema) {
      throw new IllegalArgumentException(
          "Snapshot was not taken from this buffer");
    }
    _savedModCount = savedSnapshot.getModificationCount();
  }

  private void checkRowIndex(int rowIndex) {
    if((rowIndex < 0) || (rowIndex >= _rows.size())) {
      throw new IndexOutOfBoundsException(
          "Row " + rowIndex + " out of range, row count " + _rows.size());
    }
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("schema", _schema)
      .append("rowCount", _rows.size())
      .append("selected", _selected.size())
      .append("modified", isModified())
      .toString();
  }
}
