// =================================================================================================
// Copyright 2026 The Dimensional Commons Authors
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.dimensional.common.quantity;

import com.google.common.base.Preconditions;

import static com.dimensional.common.quantity.TimeUnit.DAYS;
import static com.dimensional.common.quantity.TimeUnit.HOURS;
import static com.dimensional.common.quantity.TimeUnit.MICROSECONDS;
import static com.dimensional.common.quantity.TimeUnit.MILLISECONDS;
import static com.dimensional.common.quantity.TimeUnit.MINUTES;
import static com.dimensional.common.quantity.TimeUnit.NANOSECONDS;
import static com.dimensional.common.quantity.TimeUnit.SECONDS;

/**
 * A duration.  Canonical values are in seconds.
 *
 * <p>The legacy display names {@code us}, {@code secs}, {@code mins}, {@code hrs} and
 * {@code days} are accepted as aliases when parsing.
 */
public final class Time extends Quantity<Time> {

  public static final Dimension<Time> DIMENSION =
      Dimension.builder("Time", new Dimension.Factory<Time>() {
        @Override public Time create(double canonical) {
          return new Time(canonical);
        }
      })
      .units(TimeUnit.class)
      .alias("us", MICROSECONDS)
      .alias("secs", SECONDS)
      .alias("mins", MINUTES)
      .alias("hrs", HOURS)
      .alias("days", DAYS)
      .display(1.0, DAYS)
      .display(1.0, HOURS)
      .display(1.0, MINUTES)
      .display(1.0, SECONDS)
      .display(1.0, MILLISECONDS)
      .display(1.0, MICROSECONDS)
      .displayFallback(NANOSECONDS)
      .build();

  Time(double seconds) {
    super(seconds);
  }

  @Override
  public Dimension<Time> dimension() {
    return DIMENSION;
  }

  public static ParseResult<Time> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  /**
   * Converts a {@code java.util.concurrent} duration.
   *
   * @param duration the number of {@code unit}s.
   * @param unit the unit {@code duration} is expressed in.
   * @return the equivalent time.
   */
  public static Time of(long duration, java.util.concurrent.TimeUnit unit) {
    Preconditions.checkNotNull(unit);
    for (TimeUnit candidate : TimeUnit.values()) {
      if (candidate.getTimeUnit() == unit) {
        return candidate.of(duration);
      }
    }
    throw new IllegalArgumentException("Unsupported time unit " + unit);
  }

  public static Time nanoseconds(double value) {
    return NANOSECONDS.of(value);
  }

  public static Time milliseconds(double value) {
    return MILLISECONDS.of(value);
  }

  public static Time seconds(double value) {
    return SECONDS.of(value);
  }

  public static Time minutes(double value) {
    return MINUTES.of(value);
  }

  public static Time hours(double value) {
    return HOURS.of(value);
  }

  public static Time days(double value) {
    return DAYS.of(value);
  }
}
