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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builder style class for constructing a {@link SchemaCatalog}.
 * <p/>
 * Example:
 * <pre>
 *   SchemaCatalog schema = new SchemaCatalogBuilder()
 *     .addColumn(new ColumnBuilder("id", LogicalType.int64())
 *                .setNullable(false))
 *     .addColumn(new ColumnBuilder("price", LogicalType.decimal(10, 2)))
 *     .toSchema();
 * </pre>
 */
public class SchemaCatalogBuilder
{
  /** columns for the new schema */
  private final List<ColumnBuilder> _columns = new ArrayList<ColumnBuilder>();
  /** schema metadata (if any) */
  private final Map<String,String> _metadata =
    new LinkedHashMap<String,String>();

  public SchemaCatalogBuilder() {
  }

  /**
   * Adds a Column to the new schema.
   */
  public SchemaCatalogBuilder addColumn(ColumnBuilder column) {
    _columns.add(column);
    return this;
  }

  /**
   * Adds the Columns to the new schema.
   */
  public SchemaCatalogBuilder addColumns(List<? extends ColumnBuilder> columns) {
    if(columns != null) {
      for(ColumnBuilder col : columns) {
        addColumn(col);
      }
    }
    return this;
  }

  public List<ColumnBuilder> getColumns() {
    return _columns;
  }

  /**
   * Adds a schema level metadata entry.
   */
  public SchemaCatalogBuilder putMetadata(String key, String value) {
    _metadata.put(key, value);
    return this;
  }

  public SchemaCatalogBuilder putMetadata(Map<String,String> metadata) {
    if(metadata != null) {
      _metadata.putAll(metadata);
    }
    return this;
  }

  /**
   * Creates a new SchemaCatalog from the current state of this builder.
   *
   * @throws IllegalArgumentException if a column definition is invalid or
   *         column names are not unique
   */
  public SchemaCatalog toSchema() {
    List<Column> columns = new ArrayList<Column>(_columns.size());
    for(ColumnBuilder col : _columns) {
      columns.add(col.toColumn(columns.size()));
    }
    return new SchemaCatalog(columns, _metadata);
  }
}
