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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.healthmarketscience.colstudio.impl.CustomToStringStyle;

/**
 * Describes a single column of a {@link SchemaCatalog}: its name, logical
 * type, nullability and position.  Any key/value metadata attached to the
 * source field is retained so that it is written back with the column.
 * <p>
 * Columns are immutable, use {@link ColumnBuilder} to create them.
 */
public final class Column
{
  private final String _name;
  private final LogicalType _type;
  private final boolean _nullable;
  private final int _columnIndex;
  private final Map<String,String> _metadata;

  Column(String name, LogicalType type, boolean nullable, int columnIndex,
         Map<String,String> metadata)
  {
    _name = name;
    _type = type;
    _nullable = nullable;
    _columnIndex = columnIndex;
    _metadata = (metadata.isEmpty() ? Collections.<String,String>emptyMap() :
                 Collections.unmodifiableMap(
                     new LinkedHashMap<String,String>(metadata)));
  }

  public String getName() {
    return _name;
  }

  public LogicalType getType() {
    return _type;
  }

  /**
   * Convenience method for {@code getType().getType()}.
   */
  public DataType getDataType() {
    return _type.getType();
  }

  public boolean isNullable() {
    return _nullable;
  }

  /**
   * @return the 0-based position of this column within its schema
   */
  public int getColumnIndex() {
    return _columnIndex;
  }

  /**
   * @return the (unmodifiable) field metadata of this column, never
   *         {@code null}
   */
  public Map<String,String> getMetadata() {
    return _metadata;
  }

  @Override
  public boolean equals(Object o) {
    if(this == o) {
      return true;
    }
    if(!(o instanceof Column)) {
      return false;
    }
    Column other = (Column)o;
    return (_name.equals(other._name) && _type.equals(other._type) &&
            (_nullable == other._nullable) &&
            (_columnIndex == other._columnIndex) &&
            _metadata.equals(other._metadata));
  }

  @Override
  public int hashCode() {
    return Objects.hash(_name, _type, _nullable, _columnIndex);
  }

  @Override
  public String toString() {
    return CustomToStringStyle.valueBuilder(this)
      .append("name", _name)
      .append("type", _type)
      .append("nullable", _nullable)
      .append("index", _columnIndex)
      .toString();
  }
}
