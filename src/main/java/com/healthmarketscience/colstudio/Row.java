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

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * A row of data as an ordered sequence of {@link Cell}s, positionally aligned
 * to the columns of its {@link SchemaCatalog}.  Rows are immutable, editing a
 * row replaces it in its {@link EditBuffer} with an updated copy carrying the
 * same {@link RowId}.
 * <p>
 * The typed convenience getters return {@code null} for null cells and fail
 * with a {@link ClassCastException} if the cell holds a value of another type
 * or an uncommitted raw edit.
 */
public interface Row
{
  /**
   * @return the id of this row
   */
  public RowId getId();

  /**
   * @return the schema this row is aligned to
   */
  public SchemaCatalog getSchema();

  /**
   * @return the number of cells in this row (always the schema size)
   */
  public int size();

  public Cell getCell(int columnIndex);

  /**
   * @throws UnknownColumnException if there is no such column
   */
  public Cell getCell(String name);

  /**
   * @return the cells of this row, in column order (unmodifiable)
   */
  public List<Cell> getCells();

  /**
   * @return the typed value of the named column, the text of a raw edit, or
   *         {@code null}
   */
  public Object getValue(String name);

  /**
   * Convenience method which gets the value for the column with the given
   * name, casting it to a Boolean (DataType BOOLEAN).
   */
  public Boolean getBoolean(String name);

  /**
   * Convenience method which gets the value for the column with the given
   * name, casting it to an Integer (DataType INT32).
   */
  public Integer getInt(String name);

  /**
   * Convenience method which gets the value for the column with the given
   * name, casting it to a Long (DataType INT64).
   */
  public Long getLong(String name);

  /**
   * Convenience method which gets the value for the column with the given
   * name, casting it to a Float (DataType FLOAT32).
   */
  public Float getFloat(String name);

  /**
   * Convenience method which gets the value for the column with the given
   * name, casting it to a Double (DataType FLOAT64).
   */
  public Double getDouble(String name);

  /**
   * Convenience method which gets the value for the column with the given
   * name, casting it to a String (DataType UTF8).
   */
  public String getString(String name);

  /**
   * Convenience method which gets the value for the column with the given
   * name, casting it to a byte[] (DataType BINARY).
   */
  public byte[] getBytes(String name);

  /**
   * Convenience method which gets the value for the column with the given
   * name, casting it to a LocalDate (DataType DATE).
   */
  public LocalDate getLocalDate(String name);

  /**
   * Convenience method which gets the value for the column with the given
   * name, casting it to a LocalDateTime (DataType TIMESTAMP without time
   * zone).
   */
  public LocalDateTime getLocalDateTime(String name);

  /**
   * Convenience method which gets the value for the column with the given
   * name, casting it to an Instant (DataType TIMESTAMP with time zone).
   */
  public Instant getInstant(String name);

  /**
   * Convenience method which gets the value for the column with the given
   * name, casting it to a BigDecimal (DataType DECIMAL).
   */
  public BigDecimal getBigDecimal(String name);
}
