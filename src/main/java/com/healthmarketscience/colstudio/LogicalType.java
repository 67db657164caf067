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
import java.util.Objects;

/**
 * The semantic type of a column: a {@link DataType} tag plus the parameters
 * which that tag requires.  Every column is bound to exactly one LogicalType
 * when the table is loaded, and committed tables always use that same type.
 * <p>
 * Instances are immutable and compare by value.
 */
public final class LogicalType
{
  /** max precision of a 128 bit decimal */
  public static final int MAX_DECIMAL128_PRECISION = 38;
  /** max precision of a 256 bit decimal */
  public static final int MAX_DECIMAL256_PRECISION = 76;

  private static final LogicalType BOOLEAN_TYPE =
    new LogicalType(DataType.BOOLEAN, null, null, 0, 0, 0);
  private static final LogicalType INT32_TYPE =
    new LogicalType(DataType.INT32, null, null, 0, 0, 0);
  private static final LogicalType INT64_TYPE =
    new LogicalType(DataType.INT64, null, null, 0, 0, 0);
  private static final LogicalType FLOAT32_TYPE =
    new LogicalType(DataType.FLOAT32, null, null, 0, 0, 0);
  private static final LogicalType FLOAT64_TYPE =
    new LogicalType(DataType.FLOAT64, null, null, 0, 0, 0);
  private static final LogicalType UTF8_TYPE =
    new LogicalType(DataType.UTF8, null, null, 0, 0, 0);
  private static final LogicalType BINARY_TYPE =
    new LogicalType(DataType.BINARY, null, null, 0, 0, 0);

  private final DataType _type;
  private final TimeUnit _unit;
  private final String _timeZone;
  private final int _precision;
  private final int _scale;
  private final int _bitWidth;

  private LogicalType(DataType type, TimeUnit unit, String timeZone,
                      int precision, int scale, int bitWidth)
  {
    _type = type;
    _unit = unit;
    _timeZone = timeZone;
    _precision = precision;
    _scale = scale;
    _bitWidth = bitWidth;
  }

  public static LogicalType booleanType() {
    return BOOLEAN_TYPE;
  }

  public static LogicalType int32() {
    return INT32_TYPE;
  }

  public static LogicalType int64() {
    return INT64_TYPE;
  }

  public static LogicalType float32() {
    return FLOAT32_TYPE;
  }

  public static LogicalType float64() {
    return FLOAT64_TYPE;
  }

  public static LogicalType utf8() {
    return UTF8_TYPE;
  }

  public static LogicalType binary() {
    return BINARY_TYPE;
  }

  /**
   * A date stored as days since the epoch.
   */
  public static LogicalType date() {
    return date(TimeUnit.DAY);
  }

  /**
   * A date stored either as days ({@link TimeUnit#DAY}) or as milliseconds
   * ({@link TimeUnit#MILLISECOND}) since the epoch.
   */
  public static LogicalType date(TimeUnit unit) {
    if((unit != TimeUnit.DAY) && (unit != TimeUnit.MILLISECOND)) {
      throw new IllegalArgumentException("Invalid date unit " + unit);
    }
    return new LogicalType(DataType.DATE, unit, null, 0, 0, 0);
  }

  /**
   * A timestamp without time zone (wall clock date-time).
   */
  public static LogicalType timestamp(TimeUnit unit) {
    return timestamp(unit, null);
  }

  /**
   * A timestamp with the given resolution.  If {@code timeZone} is
   * non-{@code null}, values are instants and the zone id is carried along
   * so that it is written back unchanged.
   */
  public static LogicalType timestamp(TimeUnit unit, String timeZone) {
    if((unit == null) || (unit == TimeUnit.DAY)) {
      throw new IllegalArgumentException("Invalid timestamp unit " + unit);
    }
    return new LogicalType(DataType.TIMESTAMP, unit, timeZone, 0, 0, 0);
  }

  /**
   * A 128 bit decimal with the given precision and scale.
   */
  public static LogicalType decimal(int precision, int scale) {
    return decimal(precision, scale, 128);
  }

  public static LogicalType decimal(int precision, int scale, int bitWidth) {
    int maxPrecision;
    if(bitWidth == 128) {
      maxPrecision = MAX_DECIMAL128_PRECISION;
    } else if(bitWidth == 256) {
      maxPrecision = MAX_DECIMAL256_PRECISION;
    } else {
      throw new IllegalArgumentException(
          "Invalid decimal bit width " + bitWidth);
    }
    if((precision < 1) || (precision > maxPrecision)) {
      throw new IllegalArgumentException(
          "Invalid decimal precision " + precision + " for bit width " +
          bitWidth);
    }
    if((scale < 0) || (scale > precision)) {
      throw new IllegalArgumentException(
          "Invalid decimal scale " + scale + " for precision " + precision);
    }
    return new LogicalType(DataType.DECIMAL, null, null, precision, scale,
                           bitWidth);
  }

  public DataType getType() {
    return _type;
  }

  /**
   * @return the resolution of a DATE or TIMESTAMP type, {@code null}
   *         otherwise
   */
  public TimeUnit getUnit() {
    return _unit;
  }

  /**
   * @return the time zone id of a zoned TIMESTAMP type, {@code null}
   *         otherwise
   */
  public String getTimeZone() {
    return _timeZone;
  }

  public boolean isZoned() {
    return (_timeZone != null);
  }

  public int getPrecision() {
    return _precision;
  }

  public int getScale() {
    return _scale;
  }

  public int getBitWidth() {
    return _bitWidth;
  }

  /**
   * @return the java class which non-null values of this type must have
   */
  public Class<?> getValueClass() {
    if((_type == DataType.TIMESTAMP) && isZoned()) {
      return Instant.class;
    }
    return _type.getValueClass();
  }

  /**
   * Returns {@code true} if the given (non-null) value is a valid value of
   * this type as it would be stored in a cell.  This checks the java class
   * and, for decimals, that the value carries the exact scale and fits the
   * precision.
   */
  public boolean isValidValue(Object value) {
    if(!getValueClass().isInstance(value)) {
      return false;
    }
    if(_type == DataType.DECIMAL) {
      BigDecimal bd = (BigDecimal)value;
      return ((bd.scale() == _scale) && (bd.precision() <= _precision));
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if(this == o) {
      return true;
    }
    if(!(o instanceof LogicalType)) {
      return false;
    }
    LogicalType other = (LogicalType)o;
    return ((_type == other._type) && (_unit == other._unit) &&
            Objects.equals(_timeZone, other._timeZone) &&
            (_precision == other._precision) && (_scale == other._scale) &&
            (_bitWidth == other._bitWidth));
  }

  @Override
  public int hashCode() {
    return Objects.hash(_type, _unit, _timeZone, _precision, _scale,
                        _bitWidth);
  }

  @Override
  public String toString() {
    switch(_type) {
    case DATE:
      return _type + "(" + _unit + ")";
    case TIMESTAMP:
      return _type + "(" + _unit + ((_timeZone != null) ? ", " + _timeZone : "") +
        ")";
    case DECIMAL:
      return _type + "(" + _precision + ", " + _scale +
        ((_bitWidth != 128) ? ", " + _bitWidth : "") + ")";
    default:
      return _type.toString();
    }
  }
}
