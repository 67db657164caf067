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

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import com.healthmarketscience.colstudio.Cell;
import com.healthmarketscience.colstudio.impl.ByteUtil;

/**
 * Renders cell values in their canonical text form.  The canonical forms are
 * exactly the forms accepted for edits of the respective column types, so a
 * formatted value can always be entered again:
 * <ul>
 *   <li>booleans as {@code true}/{@code false}</li>
 *   <li>floating point values as by {@link Double#toString}, including
 *       {@code NaN} and {@code Infinity}</li>
 *   <li>decimals in plain notation, with all digits of the scale</li>
 *   <li>dates and timestamps as ISO-8601 text, zoned timestamps in UTC</li>
 *   <li>binary values as uppercase hex digits</li>
 * </ul>
 *
 * @usage _general_class_
 */
public class CellFormatter
{
  private CellFormatter() {}

  /**
   * @return the canonical text of the given value, {@code null} for
   *         {@code null}
   */
  public static String format(Object value) {
    if(value == null) {
      return null;
    }
    if(value instanceof String) {
      return (String)value;
    }
    if(value instanceof byte[]) {
      return ByteUtil.toHexString((byte[])value);
    }
    if(value instanceof BigDecimal) {
      return ((BigDecimal)value).toPlainString();
    }
    if(value instanceof LocalDateTime) {
      return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(
          (LocalDateTime)value);
    }
    if(value instanceof Instant) {
      return DateTimeFormatter.ISO_INSTANT.format((Instant)value);
    }
    return String.valueOf(value);
  }

  /**
   * @return the canonical text of the given cell's value, the text of a raw
   *         edit, {@code null} for a null cell
   */
  public static String format(Cell cell) {
    switch(cell.getKind()) {
    case NULL:
      return null;
    case RAW_EDIT:
      return cell.getText();
    default:
      return format(cell.getValue());
    }
  }

  /**
   * @return the value to export for the given cell: the typed value, the
   *         text of a raw edit, or {@code null}
   */
  public static Object exportValue(Cell cell) {
    return (cell.isRawEdit() ? cell.getText() : cell.getValue());
  }
}
