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

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.ParseResult;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.Time;
import com.dimensional.common.quantity.TimeIntegral;
import com.dimensional.common.quantity.electro.ElectricCharge;
import com.dimensional.common.quantity.electro.ElectricPotential;
import com.dimensional.common.quantity.electro.ElectroRelations;
import com.dimensional.common.quantity.mass.ChemicalAmount;
import com.dimensional.common.quantity.mass.Mass;
import com.dimensional.common.quantity.motion.Dynamics;
import com.dimensional.common.quantity.motion.Force;
import com.dimensional.common.quantity.space.Length;
import com.dimensional.common.quantity.space.Volume;
import com.dimensional.common.quantity.thermal.Temperature;
import com.dimensional.common.quantity.thermal.ThermalCapacity;
import com.dimensional.common.quantity.thermal.ThermalRelations;

import static com.dimensional.common.quantity.energy.EnergyUnit.GIGAWATT_HOURS;
import static com.dimensional.common.quantity.energy.EnergyUnit.JOULES;
import static com.dimensional.common.quantity.energy.EnergyUnit.KILOWATT_HOURS;
import static com.dimensional.common.quantity.energy.EnergyUnit.MEGAWATT_HOURS;
import static com.dimensional.common.quantity.energy.EnergyUnit.WATT_HOURS;

/**
 * Canonical values are in watt-hours.  Energies of at least one watt-hour display in the largest
 * of GWh, MWh, kWh and Wh that amounts to at least one; smaller energies display in joules.
 */
public final class Energy extends Quantity<Energy> implements TimeIntegral<Power> {

  /**
   * One joule, in watt-hours.
   */
  public static final double JOULE = 1.0 / 3600;

  /**
   * One British thermal unit (IT), in watt-hours.
   */
  public static final double BTU = JOULE * 1055.05585262;

  public static final Dimension<Energy> DIMENSION =
      Dimension.builder("Energy", new Dimension.Factory<Energy>() {
        @Override public Energy create(double canonical) {
          return new Energy(canonical);
        }
      })
      .units(EnergyUnit.class)
      .alias("BTU", EnergyUnit.BRITISH_THERMAL_UNITS)
      .display(1.0, GIGAWATT_HOURS)
      .display(1.0, MEGAWATT_HOURS)
      .display(1.0, KILOWATT_HOURS)
      .display(1.0, WATT_HOURS)
      .displayFallback(JOULES)
      .build();

  Energy(double wattHours) {
    super(wattHours);
  }

  @Override
  public Dimension<Energy> dimension() {
    return DIMENSION;
  }

  @Override
  public Power dividedBy(Time time) {
    return EnergyRelations.ENERGY_POWER.derivative(this, time);
  }

  @Override
  public Time dividedBy(Power power) {
    return EnergyRelations.ENERGY_POWER.time(this, power);
  }

  public Force dividedBy(Length length) {
    return Dynamics.ENERGY_OVER_LENGTH.apply(this, length);
  }

  public Length dividedBy(Force force) {
    return Dynamics.ENERGY_OVER_FORCE.apply(this, force);
  }

  public SpecificEnergy dividedBy(Mass mass) {
    return EnergyRelations.ENERGY_OVER_MASS.apply(this, mass);
  }

  public Mass dividedBy(SpecificEnergy specificEnergy) {
    return EnergyRelations.ENERGY_OVER_SPECIFIC_ENERGY.apply(this, specificEnergy);
  }

  public EnergyDensity dividedBy(Volume volume) {
    return EnergyRelations.ENERGY_OVER_VOLUME.apply(this, volume);
  }

  public Volume dividedBy(EnergyDensity energyDensity) {
    return EnergyRelations.ENERGY_OVER_ENERGY_DENSITY.apply(this, energyDensity);
  }

  public MolarEnergy dividedBy(ChemicalAmount amount) {
    return EnergyRelations.ENERGY_OVER_AMOUNT.apply(this, amount);
  }

  public ChemicalAmount dividedBy(MolarEnergy molarEnergy) {
    return EnergyRelations.ENERGY_OVER_MOLAR_ENERGY.apply(this, molarEnergy);
  }

  public ElectricPotential dividedBy(ElectricCharge charge) {
    return ElectroRelations.ENERGY_OVER_CHARGE.apply(this, charge);
  }

  public ElectricCharge dividedBy(ElectricPotential potential) {
    return ElectroRelations.ENERGY_OVER_POTENTIAL.apply(this, potential);
  }

  public ThermalCapacity dividedBy(Temperature temperature) {
    return ThermalRelations.ENERGY_OVER_TEMPERATURE.apply(this, temperature);
  }

  public Temperature dividedBy(ThermalCapacity capacity) {
    return ThermalRelations.ENERGY_OVER_CAPACITY.apply(this, capacity);
  }

  public static ParseResult<Energy> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Energy wattHours(double value) {
    return WATT_HOURS.of(value);
  }

  public static Energy kilowattHours(double value) {
    return KILOWATT_HOURS.of(value);
  }

  public static Energy joules(double value) {
    return JOULES.of(value);
  }
}
