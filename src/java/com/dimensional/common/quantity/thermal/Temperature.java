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
import com.dimensional.common.quantity.ParseResult;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.energy.Energy;

import static com.dimensional.common.quantity.thermal.TemperatureUnit.CELSIUS;
import static com.dimensional.common.quantity.thermal.TemperatureUnit.FAHRENHEIT;
import static com.dimensional.common.quantity.thermal.TemperatureUnit.KELVIN;

/**
 * Absolute temperature.  Canonical values are in kelvin, so same-family arithmetic is on
 * absolute temperatures; celsius and fahrenheit are offset scales over kelvin.
 */
public final class Temperature extends Quantity<Temperature> {

  public static final Dimension<Temperature> DIMENSION =
      Dimension.builder("Temperature", new Dimension.Factory<Temperature>() {
        @Override public Temperature create(double canonical) {
          return new Temperature(canonical);
        }
      })
      .units(TemperatureUnit.class)
      .alias("C", CELSIUS)
      .alias("F", FAHRENHEIT)
      .build();

  Temperature(double kelvin) {
    super(kelvin);
  }

  @Override
  public Dimension<Temperature> dimension() {
    return DIMENSION;
  }

  public Energy times(ThermalCapacity capacity) {
    return ThermalRelations.TEMPERATURE_TIMES_CAPACITY.apply(this, capacity);
  }

  public static ParseResult<Temperature> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Temperature kelvin(double value) {
    return KELVIN.of(value);
  }

  public static Temperature celsius(double value) {
    return CELSIUS.of(value);
  }

  public static Temperature fahrenheit(double value) {
    return FAHRENHEIT.of(value);
  }
}
