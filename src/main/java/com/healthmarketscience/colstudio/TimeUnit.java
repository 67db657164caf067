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

import java.time.Instant;

/**
 * Resolution of {@link DataType#TIMESTAMP} values, and of {@link
 * DataType#DATE} values stored as milliseconds.
 */
public enum TimeUnit {

  DAY(0, 0L),
  SECOND(0, 1L),
  MILLISECOND(3, 1_000L),
  MICROSECOND(6, 1_000_000L),
  NANOSECOND(9, 1_000_000_000L);

  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  private final int _fractionDigits;
  private final long _perSecond;

  private TimeUnit(int fractionDigits, long perSecond) {
    _fractionDigits = fractionDigits;
    _perSecond = perSecond;
  }

  /**
   * @return the number of fractional second digits this unit can hold
   */
  public int getFractionDigits() {
    return _fractionDigits;
  }

  /**
   * @return {@code true} if the given nano-of-second can be represented in
   *         this unit without loss
   */
  public boolean holdsNanos(int nanoOfSecond) {
    if(this == DAY) {
      return (nanoOfSecond == 0);
    }
    return ((nanoOfSecond % (NANOS_PER_SECOND / _perSecond)) == 0);
  }

  /**
   * Converts an amount of this unit since the epoch to an Instant.
   */
  public Instant toInstant(long amount) {
    checkTimeUnit();
    long seconds = Math.floorDiv(amount, _perSecond);
    long fraction = Math.floorMod(amount, _perSecond);
    return Instant.ofEpochSecond(seconds,
                                 fraction * (NANOS_PER_SECOND / _perSecond));
  }

  /**
   * Converts an Instant to an amount of this unit since the epoch.
   * @throws ArithmeticException if the instant does not fit in a long of
   *         this unit, or has more precision than this unit holds
   */
  public long fromInstant(Instant instant) {
    checkTimeUnit();
    if(!holdsNanos(instant.getNano())) {
      throw new ArithmeticException(
          "Value has more precision than " + this + " resolution");
    }
    return Math.addExact(
        Math.multiplyExact(instant.getEpochSecond(), _perSecond),
        instant.getNano() / (NANOS_PER_SECOND / _perSecond));
  }

  private void checkTimeUnit() {
    if(this == DAY) {
      throw new IllegalStateException("DAY is not a timestamp resolution");
    }
  }
}
