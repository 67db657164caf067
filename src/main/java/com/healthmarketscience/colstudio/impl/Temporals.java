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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import com.healthmarketscience.colstudio.DataType;
import com.healthmarketscience.colstudio.LogicalType;
import com.healthmarketscience.colstudio.TimeUnit;

/**
 * Conversions between DATE/TIMESTAMP cell values and the epoch based amounts
 * stored in columnar vectors.  Timestamps without a time zone are wall clock
 * values, they are stored relative to the epoch as if they were UTC.
 */
final class Temporals
{
  static final long MILLIS_PER_DAY = 86_400_000L;

  private Temporals() {}

  /**
   * @return the stored amount for the given DATE or TIMESTAMP value
   * @throws ArithmeticException if the value does not fit the type's storage
   *         or has more precision than its unit holds
   */
  static long toEpochAmount(LogicalType type, Object value) {
    if(type.getType() == DataType.DATE) {
      long epochDay = ((LocalDate)value).toEpochDay();
      if(type.getUnit() == TimeUnit.DAY) {
        return Math.toIntExact(epochDay);
      }
      return Math.multiplyExact(epochDay, MILLIS_PER_DAY);
    }
    Instant instant = (type.isZoned() ? (Instant)value :
                       ((LocalDateTime)value).toInstant(ZoneOffset.UTC));
    return type.getUnit().fromInstant(instant);
  }

  /**
   * @return the DATE or TIMESTAMP value for the given stored amount
   * @throws ArithmeticException if a millisecond date is not a whole day
   */
  static Object fromEpochAmount(LogicalType type, long amount) {
    if(type.getType() == DataType.DATE) {
      if(type.getUnit() == TimeUnit.DAY) {
        return LocalDate.ofEpochDay(amount);
      }
      if((amount % MILLIS_PER_DAY) != 0L) {
        throw new ArithmeticException(
            "Date value " + amount + " is not a whole day");
      }
      return LocalDate.ofEpochDay(amount / MILLIS_PER_DAY);
    }
    Instant instant = type.getUnit().toInstant(amount);
    if(type.isZoned()) {
      return instant;
    }
    return LocalDateTime.ofEpochSecond(instant.getEpochSecond(),
                                       instant.getNano(), ZoneOffset.UTC);
  }
}
