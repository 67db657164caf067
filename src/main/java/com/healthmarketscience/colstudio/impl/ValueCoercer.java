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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

import com.healthmarketscience.colstudio.Cell;
import com.healthmarketscience.colstudio.Column;
import com.healthmarketscience.colstudio.DataType;
import com.healthmarketscience.colstudio.InvalidValueException;
import com.healthmarketscience.colstudio.LogicalType;
import com.healthmarketscience.colstudio.NullabilityViolationException;
import com.healthmarketscience.colstudio.SchemaMismatchException;
import com.healthmarketscience.colstudio.TypeCoercionException;

/**
 * Schema directed conversion of cell contents to the type of their column.
 * The target type always comes from the column, never from the value, so
 * committing an edited cell can never change the type of its column.
 */
public final class ValueCoercer
{
  private static final Pattern INTEGER_PAT = Pattern.compile("[+-]?\\d+");
  private static final Pattern NUMBER_PAT = Pattern.compile(
      "[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private ValueCoercer() {}

  /**
   * Resolves the given cell to a value of the given column.
   *
   * @return the value to store, {@code null} for a (permitted) null cell
   * @throws NullabilityViolationException if the cell is null and the column
   *         does not allow nulls
   * @throws TypeCoercionException if a raw edit cannot be coerced
   * @throws SchemaMismatchException if the cell holds a value of another
   *         type
   */
  public static Object resolve(Column col, int rowIndex, Cell cell)
    throws InvalidValueException
  {
    switch(cell.getKind()) {
    case NULL:
      if(!col.isNullable()) {
        throw new NullabilityViolationException(col.getName(), rowIndex);
      }
      return null;
    case VALUE:
      if(!col.getType().equals(cell.getType())) {
        throw new SchemaMismatchException(
            "Cell of type " + cell.getType() + " in column '" +
            col.getName() + "' of type " + col.getType() + " (Row=" +
            rowIndex + ")");
      }
      return cell.getValue();
    case RAW_EDIT:
      return coerceText(col, rowIndex, cell.getText());
    default:
      throw new IllegalStateException("Unknown cell kind " + cell.getKind());
    }
  }

  /**
   * Converts the given (non-null) text to a value of the given column, using
   * the canonical text form of the column's type (see {@link DataType}).
   */
  public static Object coerceText(Column col, int rowIndex, String text)
    throws TypeCoercionException
  {
    LogicalType type = col.getType();
    String trimmed = text.trim();
    switch(type.getType()) {
    case UTF8:
      return text;
    case BOOLEAN:
      return parseBoolean(col, rowIndex, text, trimmed);
    case INT32:
    case INT64:
      return parseInteger(col, rowIndex, text, trimmed);
    case FLOAT32:
    case FLOAT64:
      return parseFloatingPoint(col, rowIndex, text, trimmed);
    case DECIMAL:
      if(!NUMBER_PAT.matcher(trimmed).matches()) {
        throw fail(col, rowIndex, text, "Not a decimal number");
      }
      BigDecimal bd = null;
      try {
        bd = new BigDecimal(trimmed);
      } catch(NumberFormatException e) {
        throw fail(col, rowIndex, text, "Out of range for " + type, e);
      }
      return toDecimal(col, rowIndex, text, bd);
    case DATE:
      try {
        return checkTemporal(col, rowIndex, text, LocalDate.parse(trimmed));
      } catch(DateTimeParseException e) {
        throw fail(col, rowIndex, text, "Not an ISO-8601 date (yyyy-MM-dd)",
                   e);
      }
    case TIMESTAMP:
      try {
        Object value = (type.isZoned() ?
                        OffsetDateTime.parse(trimmed).toInstant() :
                        LocalDateTime.parse(trimmed));
        return checkTemporal(col, rowIndex, text, value);
      } catch(DateTimeParseException e) {
        throw fail(col, rowIndex, text, (type.isZoned() ?
                   "Not an ISO-8601 offset date-time" :
                   "Not an ISO-8601 local date-time"), e);
      }
    case BINARY:
      try {
        return ByteUtil.parseHexString(trimmed);
      } catch(IllegalArgumentException e) {
        throw fail(col, rowIndex, text, "Not a hex string: " + e.getMessage(),
                   e);
      }
    default:
      throw new IllegalStateException("Unknown data type " + type.getType());
    }
  }

  /**
   * Converts the given value to a value of the given column.  Values of the
   * column's value class are checked against the column's range and
   * precision, other numbers are converted only if that is exact, text is
   * coerced as by {@link #coerceText}.
   *
   * @return the value to store, {@code null} for {@code null}
   */
  public static Object coerceValue(Column col, int rowIndex, Object value)
    throws TypeCoercionException
  {
    if(value == null) {
      return null;
    }
    if(value instanceof CharSequence) {
      return coerceText(col, rowIndex, value.toString());
    }

    LogicalType type = col.getType();
    switch(type.getType()) {
    case BOOLEAN:
    case UTF8:
    case BINARY:
      if(type.isValidValue(value)) {
        return value;
      }
      break;
    case INT32:
    case INT64:
    case FLOAT32:
    case FLOAT64:
    case DECIMAL:
      if(value instanceof Number) {
        return convertNumber(col, rowIndex, (Number)value);
      }
      break;
    case DATE:
      if(value instanceof LocalDate) {
        return checkTemporal(col, rowIndex, value.toString(), value);
      }
      break;
    case TIMESTAMP:
      Object ts = value;
      if(type.isZoned()) {
        if(value instanceof OffsetDateTime) {
          ts = ((OffsetDateTime)value).toInstant();
        } else if(value instanceof ZonedDateTime) {
          ts = ((ZonedDateTime)value).toInstant();
        }
      }
      if(type.getValueClass().isInstance(ts)) {
        return checkTemporal(col, rowIndex, value.toString(), ts);
      }
      break;
    default:
      throw new IllegalStateException("Unknown data type " + type.getType());
    }

    throw fail(col, rowIndex, String.valueOf(value),
               "Value of " + value.getClass().getName() +
               " cannot be stored in a " + type + " column");
  }

  private static Boolean parseBoolean(Column col, int rowIndex, String text,
                                      String trimmed)
    throws TypeCoercionException
  {
    String lower = trimmed.toLowerCase(Locale.ROOT);
    if("true".equals(lower) || "yes".equals(lower) || "1".equals(lower)) {
      return Boolean.TRUE;
    }
    if("false".equals(lower) || "no".equals(lower) || "0".equals(lower)) {
      return Boolean.FALSE;
    }
    throw fail(col, rowIndex, text,
               "Not a boolean (true, false, yes, no, 1, 0)");
  }

  private static Object parseInteger(Column col, int rowIndex, String text,
                                     String trimmed)
    throws TypeCoercionException
  {
    if(!INTEGER_PAT.matcher(trimmed).matches()) {
      throw fail(col, rowIndex, text, "Not an integer");
    }
    return convertNumber(col, rowIndex, new BigInteger(trimmed));
  }

  private static Object parseFloatingPoint(Column col, int rowIndex,
                                           String text, String trimmed)
    throws TypeCoercionException
  {
    boolean single = (col.getDataType() == DataType.FLOAT32);
    Double special = parseSpecialFloat(trimmed);
    if(special != null) {
      return (single ? (Object)special.floatValue() : (Object)special);
    }
    if(!NUMBER_PAT.matcher(trimmed).matches()) {
      throw fail(col, rowIndex, text, "Not a number");
    }
    if(single) {
      float f = Float.parseFloat(trimmed);
      if(Float.isInfinite(f) || ((f == 0.0f) && hasNonZeroDigit(trimmed))) {
        throw fail(col, rowIndex, text, "Out of range for " + col.getType());
      }
      return f;
    }
    double d = Double.parseDouble(trimmed);
    if(Double.isInfinite(d) || ((d == 0.0d) && hasNonZeroDigit(trimmed))) {
      throw fail(col, rowIndex, text, "Out of range for " + col.getType());
    }
    return d;
  }

  /**
   * @return {@code true} if the mantissa of the given number text has a non
   *         zero digit
   */
  private static boolean hasNonZeroDigit(String number) {
    for(int i = 0; i < number.length(); ++i) {
      char c = number.charAt(i);
      if((c == 'e') || (c == 'E')) {
        break;
      }
      if((c >= '1') && (c <= '9')) {
        return true;
      }
    }
    return false;
  }

  private static Double parseSpecialFloat(String trimmed) {
    if("NaN".equalsIgnoreCase(trimmed)) {
      return Double.NaN;
    }
    if("Infinity".equalsIgnoreCase(trimmed) ||
       "+Infinity".equalsIgnoreCase(trimmed)) {
      return Double.POSITIVE_INFINITY;
    }
    if("-Infinity".equalsIgnoreCase(trimmed)) {
      return Double.NEGATIVE_INFINITY;
    }
    return null;
  }

  private static Object convertNumber(Column col, int rowIndex, Number num)
    throws TypeCoercionException
  {
    LogicalType type = col.getType();
    String input = num.toString();

    if((num instanceof Double) || (num instanceof Float)) {
      double d = num.doubleValue();
      if(type.getType() == DataType.FLOAT64) {
        return d;
      }
      if(type.getType() == DataType.FLOAT32) {
        if(Double.isNaN(d) || Double.isInfinite(d) ||
           ((double)(float)d == d)) {
          return (float)d;
        }
        throw fail(col, rowIndex, input,
                   "Value cannot be represented exactly as " + type);
      }
      if(Double.isNaN(d) || Double.isInfinite(d)) {
        throw fail(col, rowIndex, input, "Not a finite number");
      }
    }

    BigDecimal bd = toBigDecimal(num);
    try {
      switch(type.getType()) {
      case INT32:
        return bd.intValueExact();
      case INT64:
        return bd.longValueExact();
      case FLOAT32:
        float f = bd.floatValue();
        if(Float.isInfinite(f) || (new BigDecimal(f).compareTo(bd) != 0)) {
          throw fail(col, rowIndex, input,
                     "Value cannot be represented exactly as " + type);
        }
        return f;
      case FLOAT64:
        double d = bd.doubleValue();
        if(Double.isInfinite(d) || (new BigDecimal(d).compareTo(bd) != 0)) {
          throw fail(col, rowIndex, input,
                     "Value cannot be represented exactly as " + type);
        }
        return d;
      case DECIMAL:
        return toDecimal(col, rowIndex, input, bd);
      default:
        throw new IllegalStateException("Not a numeric type " + type);
      }
    } catch(ArithmeticException e) {
      String reason = (((bd.signum() != 0) && (bd.stripTrailingZeros().scale() > 0)) ?
                       "Not an integer" : "Out of range for " + type);
      throw fail(col, rowIndex, input, reason, e);
    }
  }

  private static BigDecimal toBigDecimal(Number num) {
    if(num instanceof BigDecimal) {
      return (BigDecimal)num;
    }
    if(num instanceof BigInteger) {
      return new BigDecimal((BigInteger)num);
    }
    if((num instanceof Double) || (num instanceof Float)) {
      // note, uses the shortest decimal representation, not the binary one
      return new BigDecimal(num.toString());
    }
    return BigDecimal.valueOf(num.longValue());
  }

  private static BigDecimal toDecimal(Column col, int rowIndex, String input,
                                      BigDecimal bd)
    throws TypeCoercionException
  {
    LogicalType type = col.getType();
    if(bd.signum() == 0) {
      return BigDecimal.ZERO.setScale(type.getScale());
    }

    // check the digits before rescaling, the exponent may be huge
    BigDecimal stripped = bd.stripTrailingZeros();
    if(stripped.scale() > type.getScale()) {
      throw fail(col, rowIndex, input,
                 "More than " + type.getScale() + " fractional digits for " +
                 type);
    }
    if((stripped.precision() - stripped.scale()) >
       (type.getPrecision() - type.getScale())) {
      throw fail(col, rowIndex, input,
                 "More than " + type.getPrecision() + " digits for " + type);
    }
    return stripped.setScale(type.getScale(), RoundingMode.UNNECESSARY);
  }

  private static Object checkTemporal(Column col, int rowIndex, String input,
                                      Object value)
    throws TypeCoercionException
  {
    try {
      Temporals.toEpochAmount(col.getType(), value);
      return value;
    } catch(ArithmeticException e) {
      throw fail(col, rowIndex, input,
                 "Value cannot be stored as " + col.getType() + ": " +
                 e.getMessage(), e);
    }
  }

  private static TypeCoercionException fail(Column col, int rowIndex,
                                            String input, String reason) {
    return fail(col, rowIndex, input, reason, null);
  }

  private static TypeCoercionException fail(Column col, int rowIndex,
                                            String input, String reason,
                                            Throwable cause) {
    return new TypeCoercionException(col.getName(), rowIndex, input, reason,
                                      cause);
  }
}
