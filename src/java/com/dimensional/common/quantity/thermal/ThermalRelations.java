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

import com.google.common.collect.ImmutableList;

import com.dimensional.common.quantity.Relation;
import com.dimensional.common.quantity.energy.Energy;

import static com.dimensional.common.quantity.energy.EnergyUnit.JOULES;
import static com.dimensional.common.quantity.thermal.TemperatureUnit.KELVIN;
import static com.dimensional.common.quantity.thermal.ThermalCapacityUnit.JOULES_PER_KELVIN;

/**
 * Heat as thermal capacity times absolute temperature.
 */
public final class ThermalRelations {

  public static final Relation<ThermalCapacity, Temperature, Energy> CAPACITY_TIMES_TEMPERATURE =
      Relation.product(JOULES_PER_KELVIN, KELVIN, JOULES);

  public static final Relation<Temperature, ThermalCapacity, Energy> TEMPERATURE_TIMES_CAPACITY =
      Relation.product(KELVIN, JOULES_PER_KELVIN, JOULES);

  public static final Relation<Energy, Temperature, ThermalCapacity> ENERGY_OVER_TEMPERATURE =
      Relation.quotient(JOULES, KELVIN, JOULES_PER_KELVIN);

  public static final Relation<Energy, ThermalCapacity, Temperature> ENERGY_OVER_CAPACITY =
      Relation.quotient(JOULES, JOULES_PER_KELVIN, KELVIN);

  public static final ImmutableList<Relation<?, ?, ?>> ALL = ImmutableList.<Relation<?, ?, ?>>of(
      CAPACITY_TIMES_TEMPERATURE,
      TEMPERATURE_TIMES_CAPACITY,
      ENERGY_OVER_TEMPERATURE,
      ENERGY_OVER_CAPACITY);

  private ThermalRelations() {
    // relations
  }
}
