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

package com.dimensional.common.quantity.energy;

import com.google.common.collect.ImmutableList;

import com.dimensional.common.quantity.Relation;
import com.dimensional.common.quantity.TimeDerivativePair;
import com.dimensional.common.quantity.mass.ChemicalAmount;
import com.dimensional.common.quantity.mass.Mass;
import com.dimensional.common.quantity.space.Volume;

import static com.dimensional.common.quantity.TimeUnit.HOURS;
import static com.dimensional.common.quantity.energy.EnergyDensityUnit.JOULES_PER_CUBIC_METER;
import static com.dimensional.common.quantity.energy.EnergyUnit.JOULES;
import static com.dimensional.common.quantity.energy.EnergyUnit.WATT_HOURS;
import static com.dimensional.common.quantity.energy.MolarEnergyUnit.JOULES_PER_MOLE;
import static com.dimensional.common.quantity.energy.PowerUnit.WATTS;
import static com.dimensional.common.quantity.energy.SpecificEnergyUnit.GRAYS;
import static com.dimensional.common.quantity.mass.ChemicalAmountUnit.MOLES;
import static com.dimensional.common.quantity.mass.MassUnit.KILOGRAMS;
import static com.dimensional.common.quantity.space.VolumeUnit.CUBIC_METERS;

/**
 * Energy as the time-integral of power, and energy per mole, per kilogram and per cubic meter.
 */
public final class EnergyRelations {

  /**
   * One watt-hour per hour is one watt.
   */
  public static final TimeDerivativePair<Energy, Power> ENERGY_POWER =
      TimeDerivativePair.declare(WATT_HOURS, WATTS, HOURS);

  public static final Relation<Energy, ChemicalAmount, MolarEnergy> ENERGY_OVER_AMOUNT =
      Relation.quotient(JOULES, MOLES, JOULES_PER_MOLE);

  public static final Relation<Energy, MolarEnergy, ChemicalAmount> ENERGY_OVER_MOLAR_ENERGY =
      Relation.quotient(JOULES, JOULES_PER_MOLE, MOLES);

  public static final Relation<MolarEnergy, ChemicalAmount, Energy> MOLAR_ENERGY_TIMES_AMOUNT =
      Relation.product(JOULES_PER_MOLE, MOLES, JOULES);

  public static final Relation<Energy, Mass, SpecificEnergy> ENERGY_OVER_MASS =
      Relation.quotient(JOULES, KILOGRAMS, GRAYS);

  public static final Relation<Energy, SpecificEnergy, Mass> ENERGY_OVER_SPECIFIC_ENERGY =
      Relation.quotient(JOULES, GRAYS, KILOGRAMS);

  public static final Relation<SpecificEnergy, Mass, Energy> SPECIFIC_ENERGY_TIMES_MASS =
      Relation.product(GRAYS, KILOGRAMS, JOULES);

  public static final Relation<Mass, SpecificEnergy, Energy> MASS_TIMES_SPECIFIC_ENERGY =
      Relation.product(KILOGRAMS, GRAYS, JOULES);

  public static final Relation<Energy, Volume, EnergyDensity> ENERGY_OVER_VOLUME =
      Relation.quotient(JOULES, CUBIC_METERS, JOULES_PER_CUBIC_METER);

  public static final Relation<Energy, EnergyDensity, Volume> ENERGY_OVER_ENERGY_DENSITY =
      Relation.quotient(JOULES, JOULES_PER_CUBIC_METER, CUBIC_METERS);

  public static final Relation<EnergyDensity, Volume, Energy> ENERGY_DENSITY_TIMES_VOLUME =
      Relation.product(JOULES_PER_CUBIC_METER, CUBIC_METERS, JOULES);

  public static final ImmutableList<Relation<?, ?, ?>> ALL = ImmutableList.<Relation<?, ?, ?>>of(
      ENERGY_OVER_AMOUNT,
      ENERGY_OVER_MOLAR_ENERGY,
      MOLAR_ENERGY_TIMES_AMOUNT,
      ENERGY_OVER_MASS,
      ENERGY_OVER_SPECIFIC_ENERGY,
      SPECIFIC_ENERGY_TIMES_MASS,
      MASS_TIMES_SPECIFIC_ENERGY,
      ENERGY_OVER_VOLUME,
      ENERGY_OVER_ENERGY_DENSITY,
      ENERGY_DENSITY_TIMES_VOLUME);

  private EnergyRelations() {
    // relations
  }
}
