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

package com.dimensional.common.quantity.motion;

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.MetricSystem;
import com.dimensional.common.quantity.UnitConversion;
import com.dimensional.common.quantity.UnitOfMeasure;

import static com.dimensional.common.quantity.UnitConversion.linear;

/**
 * Units of {@link Velocity}.  The value unit is the meter per second.
 */
public enum VelocityUnit implements UnitOfMeasure<Velocity> {
  METERS_PER_SECOND("m/s", UnitConversion.VALUE),
  KILOMETERS_PER_HOUR("km/h", linear(MetricSystem.KILO / 3600)),
  FEET_PER_SECOND("ft/s", linear(0.3048)),
  MILES_PER_HOUR("mph", linear(1609.344 / 3600)),
  KNOTS("kn", linear(1852.0 / 3600));

  private final String symbol;
  private final UnitConversion conversion;

  private VelocityUnit(String symbol, UnitConversion conversion) {
    this.symbol = symbol;
    this.conversion = conversion;
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
  public Dimension<Velocity> dimension() {
    return Velocity.DIMENSION;
  }

  @Override
  public Velocity of(double value) {
    return new Velocity(conversion.toCanonical(value));
  }

  @Override
  public String toString() {
    return symbol;
  }
}
