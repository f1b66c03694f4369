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

package com.dimensional.common.quantity.thermal;

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.UnitConversion;
import com.dimensional.common.quantity.UnitOfMeasure;

import static com.dimensional.common.quantity.UnitConversion.linear;
import static com.dimensional.common.quantity.UnitConversion.offset;

/**
 * Units of {@link Temperature}.  The value unit is the kelvin; the Celsius and Fahrenheit scales
 * are offset from absolute zero and so are not linear.
 */
public enum TemperatureUnit implements UnitOfMeasure<Temperature> {
  KELVIN("K", UnitConversion.VALUE),
  CELSIUS("°C", offset(1.0, 273.15)),
  FAHRENHEIT("°F", offset(5.0 / 9, 459.67)),
  RANKINE("°R", linear(5.0 / 9));

  private final String symbol;
  private final UnitConversion conversion;

  private TemperatureUnit(String symbol, UnitConversion conversion) {
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
  public Dimension<Temperature> dimension() {
    return Temperature.DIMENSION;
  }

  @Override
  public Temperature of(double value) {
    return new Temperature(conversion.toCanonical(value));
  }

  @Override
  public String toString() {
    return symbol;
  }
}
