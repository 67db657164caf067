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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.healthmarketscience.colstudio.impl.ArrowSchemas;
import com.healthmarketscience.colstudio.impl.CustomToStringStyle;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Immutable, ordered description of the columns of a table.  A catalog is
 * derived once from a decoded table and shared read-only by the load, commit
 * and export code for the lifetime of one generation.  Column names are
 * unique and case sensitive.
 */
public final class SchemaCatalog
{
  private final List<Column> _columns;
  private final Map<String,Integer> _columnIndexes;
  private final Map<String,String> _metadata;

  SchemaCatalog(List<Column> columns, Map<String,String> metadata)
  {
    _columns = Collections.unmodifiableList(new ArrayList<Column>(columns));
    Map<String,Integer> indexes = new HashMap<String,Integer>();
    for(Column col : _columns) {
      if(indexes.put(col.getName(), col.getColumnIndex()) != null) {
        throw new IllegalArgumentException(
            "Duplicate column name '" + col.getName() + "'");
      }
    }
    _columnIndexes = indexes;
    _metadata = (metadata.isEmpty() ? Collections.<String,String>emptyMap() :
                 Collections.unmodifiableMap(
                     new LinkedHashMap<String,String>(metadata)));
  }

  /**
   * Reads the column descriptors of the given decoded table.
   *
   * @throws UnsupportedTypeException if any field uses a type which has no
   *         {@link LogicalType} counterpart, or field names are not unique
   */
  public static SchemaCatalog fromSourceTable(ColumnarTable table)
    throws UnsupportedTypeException
  {
    return ArrowSchemas.toSchemaCatalog(table.getSchema());
  }

  /**
   * @return the columns of this schema, in order
   */
  public List<Column> getColumns() {
    return _columns;
  }

  public int size() {
    return _columns.size();
  }

  public Column getColumn(int columnIndex) {
    return _columns.get(columnIndex);
  }

  /**
   * @return the column with the given name
   * @throws UnknownColumnException if there is no such column
   */
  public Column getColumn(String name) {
    return _columns.get(columnIndex(name));
  }

  /**
   * @return the 0-based position of the column with the given name
   * @throws UnknownColumnException if there is no such column
   */
  public int columnIndex(String name) {
    Integer idx = _columnIndexes.get(name);
    if(idx == null) {
      throw new UnknownColumnException(name);
    }
    return idx;
  }

  public boolean hasColumn(String name) {
    return _columnIndexes.containsKey(name);
  }

  /**
   * @return the column names, in order
   */
  public List<String> getColumnNames() {
    List<String> names = new ArrayList<String>(_columns.size());
    for(Column col : _columns) {
      names.add(col.getName());
    }
    return names;
  }

  /**
   * @return the (unmodifiable) schema level metadata, never {@code null}
   */
  public Map<String,String> getMetadata() {
    return _metadata;
  }

  /**
   * @return the Arrow schema described by this catalog, including field and
   *         schema metadata
   */
  public Schema toArrowSchema() {
    return ArrowSchemas.toArrowSchema(this);
  }

  @Override
  public boolean equals(Object o) {
    if(this == o) {
      return true;
    }
    if(!(o instanceof SchemaCatalog)) {
      return false;
    }
    SchemaCatalog other = (SchemaCatalog)o;
    return (_columns.equals(other._columns) &&
            _metadata.equals(other._metadata));
  }

  @Override
  public int hashCode() {
    return _columns.hashCode();
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("columns", _columns)
      .append("metadata", _metadata)
      .toString();
  }
}
