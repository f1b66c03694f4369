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

/**
 * Units of {@link Time}.  The value unit is the second.
 */
public enum TimeUnit implements UnitOfMeasure<Time> {
  NANOSECONDS("ns", MetricSystem.NANO, java.util.concurrent.TimeUnit.NANOSECONDS),
  MICROSECONDS("µs", MetricSystem.MICRO, java.util.concurrent.TimeUnit.MICROSECONDS),
  MILLISECONDS("ms", MetricSystem.MILLI, java.util.concurrent.TimeUnit.MILLISECONDS),
  SECONDS("s", UnitConversion.VALUE, 1, java.util.concurrent.TimeUnit.SECONDS),
  MINUTES("min", 60, SECONDS, java.util.concurrent.TimeUnit.MINUTES),
  HOURS("h", 60, MINUTES, java.util.concurrent.TimeUnit.HOURS),
  DAYS("d", 24, HOURS, java.util.concurrent.TimeUnit.DAYS);

  private final String symbol;
  private final UnitConversion conversion;
  private final double multiplier;
  private final java.util.concurrent.TimeUnit timeUnit;

  private TimeUnit(String symbol, UnitConversion conversion, double multiplier,
      java.util.concurrent.TimeUnit timeUnit) {
    this.symbol = symbol;
    this.conversion = conversion;
    this.multiplier = multiplier;
    this.timeUnit = timeUnit;
  }

  private TimeUnit(String symbol, double multiplier, java.util.concurrent.TimeUnit timeUnit) {
    this(symbol, UnitConversion.linear(multiplier), multiplier, timeUnit);
  }

  private TimeUnit(String symbol, double multiplier, TimeUnit base,
      java.util.concurrent.TimeUnit timeUnit) {
    this(symbol, multiplier * base.multiplier, timeUnit);
  }

  @Override
  public String symbol() {
    return symbol;
  }

  @Override
  public UnitConversion conversion() {
    return conversion;
  }

  @Override
  public Dimension<Time> dimension() {
    return Time.DIMENSION;
  }

  @Override
  public Time of(double value) {
    return new Time(conversion.toCanonical(value));
  }

  /**
   * Returns the equivalent {@code java.util.concurrent.TimeUnit}.
   */
  public java.util.concurrent.TimeUnit getTimeUnit() {
    return timeUnit;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
