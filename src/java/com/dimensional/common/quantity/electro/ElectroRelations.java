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

package com.dimensional.common.quantity.electro;

import com.google.common.collect.ImmutableList;

import com.dimensional.common.quantity.Relation;
import com.dimensional.common.quantity.TimeDerivativePair;
import com.dimensional.common.quantity.energy.Energy;
import com.dimensional.common.quantity.energy.Power;
import com.dimensional.common.quantity.space.Length;

import static com.dimensional.common.quantity.TimeUnit.SECONDS;
import static com.dimensional.common.quantity.electro.ElectricChargeUnit.COULOMBS;
import static com.dimensional.common.quantity.electro.ElectricCurrentUnit.AMPERES;
import static com.dimensional.common.quantity.electro.ElectricPotentialUnit.VOLTS;
import static com.dimensional.common.quantity.electro.ElectricalConductanceUnit.SIEMENS;
import static com.dimensional.common.quantity.electro.ElectricalResistanceUnit.OHMS;
import static com.dimensional.common.quantity.electro.ResistivityUnit.OHM_METERS;
import static com.dimensional.common.quantity.energy.EnergyUnit.JOULES;
import static com.dimensional.common.quantity.energy.PowerUnit.WATTS;
import static com.dimensional.common.quantity.space.LengthUnit.METERS;

/**
 * Charge as the time-integral of current, Ohm's law, electrical power and energy, and the
 * resistivity of conductors.
 */
public final class ElectroRelations {

  public static final TimeDerivativePair<ElectricCharge, ElectricCurrent> CHARGE_CURRENT =
      TimeDerivativePair.declare(COULOMBS, AMPERES, SECONDS);

  // V = I * R
  public static final Relation<ElectricalResistance, ElectricCurrent, ElectricPotential>
      RESISTANCE_TIMES_CURRENT = Relation.product(OHMS, AMPERES, VOLTS);

  public static final Relation<ElectricCurrent, ElectricalResistance, ElectricPotential>
      CURRENT_TIMES_RESISTANCE = Relation.product(AMPERES, OHMS, VOLTS);

  public static final Relation<ElectricPotential, ElectricCurrent, ElectricalResistance>
      POTENTIAL_OVER_CURRENT = Relation.quotient(VOLTS, AMPERES, OHMS);

  public static final Relation<ElectricPotential, ElectricalResistance, ElectricCurrent>
      POTENTIAL_OVER_RESISTANCE = Relation.quotient(VOLTS, OHMS, AMPERES);

  // I = G * V
  public static final Relation<ElectricalConductance, ElectricPotential, ElectricCurrent>
      CONDUCTANCE_TIMES_POTENTIAL = Relation.product(SIEMENS, VOLTS, AMPERES);

  public static final Relation<ElectricPotential, ElectricalConductance, ElectricCurrent>
      POTENTIAL_TIMES_CONDUCTANCE = Relation.product(VOLTS, SIEMENS, AMPERES);

  public static final Relation<ElectricCurrent, ElectricPotential, ElectricalConductance>
      CURRENT_OVER_POTENTIAL = Relation.quotient(AMPERES, VOLTS, SIEMENS);

  public static final Relation<ElectricCurrent, ElectricalConductance, ElectricPotential>
      CURRENT_OVER_CONDUCTANCE = Relation.quotient(AMPERES, SIEMENS, VOLTS);

  // P = V * I
  public static final Relation<ElectricPotential, ElectricCurrent, Power>
      POTENTIAL_TIMES_CURRENT = Relation.product(VOLTS, AMPERES, WATTS);

  public static final Relation<ElectricCurrent, ElectricPotential, Power>
      CURRENT_TIMES_POTENTIAL = Relation.product(AMPERES, VOLTS, WATTS);

  public static final Relation<Power, ElectricCurrent, ElectricPotential> POWER_OVER_CURRENT =
      Relation.quotient(WATTS, AMPERES, VOLTS);

  public static final Relation<Power, ElectricPotential, ElectricCurrent> POWER_OVER_POTENTIAL =
      Relation.quotient(WATTS, VOLTS, AMPERES);

  // E = V * Q
  public static final Relation<ElectricPotential, ElectricCharge, Energy> POTENTIAL_TIMES_CHARGE =
      Relation.product(VOLTS, COULOMBS, JOULES);

  public static final Relation<ElectricCharge, ElectricPotential, Energy> CHARGE_TIMES_POTENTIAL =
      Relation.product(COULOMBS, VOLTS, JOULES);

  public static final Relation<Energy, ElectricCharge, ElectricPotential> ENERGY_OVER_CHARGE =
      Relation.quotient(JOULES, COULOMBS, VOLTS);

  public static final Relation<Energy, ElectricPotential, ElectricCharge> ENERGY_OVER_POTENTIAL =
      Relation.quotient(JOULES, VOLTS, COULOMBS);

  // rho = R * l
  public static final Relation<ElectricalResistance, Length, Resistivity> RESISTANCE_TIMES_LENGTH =
      Relation.product(OHMS, METERS, OHM_METERS);

  public static final Relation<Resistivity, Length, ElectricalResistance> RESISTIVITY_OVER_LENGTH =
      Relation.quotient(OHM_METERS, METERS, OHMS);

  public static final Relation<Resistivity, ElectricalResistance, Length>
      RESISTIVITY_OVER_RESISTANCE = Relation.quotient(OHM_METERS, OHMS, METERS);

  public static final ImmutableList<Relation<?, ?, ?>> ALL = ImmutableList.<Relation<?, ?, ?>>of(
      RESISTANCE_TIMES_CURRENT,
      CURRENT_TIMES_RESISTANCE,
      POTENTIAL_OVER_CURRENT,
      POTENTIAL_OVER_RESISTANCE,
      CONDUCTANCE_TIMES_POTENTIAL,
      POTENTIAL_TIMES_CONDUCTANCE,
      CURRENT_OVER_POTENTIAL,
      CURRENT_OVER_CONDUCTANCE,
      POTENTIAL_TIMES_CURRENT,
      CURRENT_TIMES_POTENTIAL,
      POWER_OVER_CURRENT,
      POWER_OVER_POTENTIAL,
      POTENTIAL_TIMES_CHARGE,
      CHARGE_TIMES_POTENTIAL,
      ENERGY_OVER_CHARGE,
      ENERGY_OVER_POTENTIAL,
      RESISTANCE_TIMES_LENGTH,
      RESISTIVITY_OVER_LENGTH,
      RESISTIVITY_OVER_RESISTANCE);

  private ElectroRelations() {
    // relations
  }
}
