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

package com.dimensional.common.quantity.space;

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.MetricSystem;
import com.dimensional.common.quantity.UnitConversion;
import com.dimensional.common.quantity.UnitOfMeasure;

import static com.dimensional.common.quantity.UnitConversion.linear;

/**
 * Units of {@link Length}.  The value unit is the meter.
 */
public enum LengthUnit implements UnitOfMeasure<Length> {
  NANOMETERS("nm", linear(MetricSystem.NANO)),
  MICROMETERS("µm", linear(MetricSystem.MICRO)),
  MILLIMETERS("mm", linear(MetricSystem.MILLI)),
  CENTIMETERS("cm", linear(MetricSystem.CENTI)),
  METERS("m", UnitConversion.VALUE),
  KILOMETERS("km", linear(MetricSystem.KILO)),
  INCHES("in", linear(0.0254)),
  FEET("ft", linear(0.3048)),
  YARDS("yd", linear(0.9144)),
  MILES("mi", linear(1609.344)),
  NAUTICAL_MILES("nmi", linear(1852.0));

  private final String symbol;
  private final UnitConversion conversion;

  private LengthUnit(String symbol, UnitConversion conversion) {
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
  public Dimension<Length> dimension() {
    return Length.DIMENSION;
  }

  @Override
  public Length of(double value) {
    return new Length(conversion.toCanonical(value));
  }

  @Override
  public String toString() {
    return symbol;
  }
}
