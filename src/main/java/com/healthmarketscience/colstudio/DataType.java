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

/**
 * Supported column data types.  A {@link LogicalType} combines one of these
 * tags with its parameters (time unit, time zone, precision, scale).
 */
public enum DataType {

  /**
   * Corresponds to a java {@link Boolean}.  Edited text is accepted as
   * (case-insensitive) "true", "false", "yes", "no", "1" or "0".
   */
  BOOLEAN(Boolean.class),
  /**
   * Corresponds to a java {@link Integer}.  Edited text must be an integer
   * within the 32 bit signed range.
   */
  INT32(Integer.class),
  /**
   * Corresponds to a java {@link Long}.  Edited text must be an integer
   * within the 64 bit signed range.
   */
  INT64(Long.class),
  /**
   * Corresponds to a java {@link Float}.  Edited text is parsed as a decimal
   * or scientific number, "NaN", "Infinity" or "-Infinity".
   */
  FLOAT32(Float.class),
  /**
   * Corresponds to a java {@link Double}.  Same textual forms as
   * {@link #FLOAT32}.
   */
  FLOAT64(Double.class),
  /**
   * Corresponds to a java {@link String}.  Edited text is taken verbatim.
   */
  UTF8(String.class),
  /**
   * Corresponds to a java {@code byte[]}.  Edited text is hexadecimal, pairs
   * of hex digits optionally separated by whitespace.
   */
  BINARY(byte[].class),
  /**
   * Corresponds to a java {@link LocalDate}.  Edited text is ISO-8601
   * {@code yyyy-MM-dd}.
   */
  DATE(LocalDate.class),
  /**
   * Corresponds to a java {@link LocalDateTime} if the column has no time
   * zone, otherwise a java {@link Instant}.  Edited text is an ISO-8601 local
   * date-time ({@code 2024-01-31T12:30:00.25}) or an ISO-8601 offset
   * date-time ({@code 2024-01-31T12:30:00.25Z}) respectively.
   */
  TIMESTAMP(LocalDateTime.class),
  /**
   * Corresponds to a java {@link BigDecimal} carrying exactly the scale of
   * the column.  Edited text is a plain or scientific decimal number which
   * must fit the column precision and scale without rounding.
   */
  DECIMAL(BigDecimal.class);

  private final Class<?> _valueClass;

  private DataType(Class<?> valueClass) {
    _valueClass = valueClass;
  }

  /**
   * @return the java class of values of this type (for {@link #TIMESTAMP},
   *         the class used by columns without a time zone)
   */
  public Class<?> getValueClass() {
    return _valueClass;
  }

  public boolean isNumeric() {
    switch(this) {
    case INT32:
    case INT64:
    case FLOAT32:
    case FLOAT64:
    case DECIMAL:
      return true;
    default:
      return false;
    }
  }

  public boolean isTemporal() {
    return ((this == DATE) || (this == TIMESTAMP));
  }
}
