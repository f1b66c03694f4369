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

/**
 * Heat capacity.  Canonical values are in joules per kelvin.
 */
public final class ThermalCapacity extends Quantity<ThermalCapacity> {

  public static final Dimension<ThermalCapacity> DIMENSION =
      Dimension.builder("ThermalCapacity", new Dimension.Factory<ThermalCapacity>() {
        @Override public ThermalCapacity create(double canonical) {
          return new ThermalCapacity(canonical);
        }
      })
      .units(ThermalCapacityUnit.class)
      .build();

  ThermalCapacity(double joulesPerKelvin) {
    super(joulesPerKelvin);
  }

  @Override
  public Dimension<ThermalCapacity> dimension() {
    return DIMENSION;
  }

  public Energy times(Temperature temperature) {
    return ThermalRelations.CAPACITY_TIMES_TEMPERATURE.apply(this, temperature);
  }

  public static ParseResult<ThermalCapacity> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static ThermalCapacity joulesPerKelvin(double value) {
    return ThermalCapacityUnit.JOULES_PER_KELVIN.of(value);
  }
}
