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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builder style class for constructing a {@link Column}.  See {@link
 * SchemaCatalogBuilder} for example usage.
 */
public class ColumnBuilder
{
  /** name of the new column */
  private String _name;
  /** the type of the new column */
  private LogicalType _type;
  /** whether or not the column allows null values */
  private boolean _nullable = true;
  /** field metadata (if any) */
  private final Map<String,String> _metadata =
    new LinkedHashMap<String,String>();

  public ColumnBuilder(String name) {
    this(name, null);
  }

  public ColumnBuilder(String name, LogicalType type) {
    _name = name;
    _type = type;
  }

  public String getName() {
    return _name;
  }

  /**
   * Sets the type for the new column.
   */
  public ColumnBuilder setType(LogicalType type) {
    _type = type;
    return this;
  }

  public LogicalType getType() {
    return _type;
  }

  /**
   * Sets whether or not the new column allows null values (defaults to
   * {@code true}).
   */
  public ColumnBuilder setNullable(boolean nullable) {
    _nullable = nullable;
    return this;
  }

  public boolean isNullable() {
    return _nullable;
  }

  /**
   * Adds a field metadata entry for the new column.
   */
  public ColumnBuilder putMetadata(String key, String value) {
    _metadata.put(key, value);
    return this;
  }

  /**
   * Adds all the given field metadata entries for the new column.
   */
  public ColumnBuilder putMetadata(Map<String,String> metadata) {
    if(metadata != null) {
      _metadata.putAll(metadata);
    }
    return this;
  }

  public Map<String,String> getMetadata() {
    return _metadata;
  }

  /**
   * Checks that this column definition is valid.
   *
   * @throws IllegalArgumentException if this column definition is invalid.
   */
  public void validate() {
    if((_name == null) || (_name.length() == 0)) {
      throw new IllegalArgumentException("Column name must not be empty");
    }
    if(_type == null) {
      throw new IllegalArgumentException(
          "Column '" + _name + "' must have a type");
    }
  }

  Column toColumn(int columnIndex) {
    validate();
    return new Column(_name, _type, _nullable, columnIndex, _metadata);
  }
}
