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

package com.dimensional.common.quantity.catalog;

import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.DimensionalAlgebra;
import com.dimensional.common.quantity.Time;
import com.dimensional.common.quantity.TimeDerivativePair;
import com.dimensional.common.quantity.electro.ElectricCharge;
import com.dimensional.common.quantity.electro.ElectricCurrent;
import com.dimensional.common.quantity.electro.ElectricPotential;
import com.dimensional.common.quantity.electro.ElectricalConductance;
import com.dimensional.common.quantity.electro.ElectricalResistance;
import com.dimensional.common.quantity.electro.ElectroRelations;
import com.dimensional.common.quantity.electro.Resistivity;
import com.dimensional.common.quantity.energy.Energy;
import com.dimensional.common.quantity.energy.EnergyDensity;
import com.dimensional.common.quantity.energy.EnergyRelations;
import com.dimensional.common.quantity.energy.MolarEnergy;
import com.dimensional.common.quantity.energy.Power;
import com.dimensional.common.quantity.energy.SpecificEnergy;
import com.dimensional.common.quantity.information.DataRate;
import com.dimensional.common.quantity.information.Information;
import com.dimensional.common.quantity.information.InformationRelations;
import com.dimensional.common.quantity.mass.ChemicalAmount;
import com.dimensional.common.quantity.mass.Density;
import com.dimensional.common.quantity.mass.Mass;
import com.dimensional.common.quantity.mass.MassFlowRate;
import com.dimensional.common.quantity.mass.MassRelations;
import com.dimensional.common.quantity.mass.SubstanceConcentration;
import com.dimensional.common.quantity.motion.Acceleration;
import com.dimensional.common.quantity.motion.Dynamics;
import com.dimensional.common.quantity.motion.Force;
import com.dimensional.common.quantity.motion.Jerk;
import com.dimensional.common.quantity.motion.Kinematics;
import com.dimensional.common.quantity.motion.Momentum;
import com.dimensional.common.quantity.motion.Velocity;
import com.dimensional.common.quantity.radio.RadiantIntensity;
import com.dimensional.common.quantity.radio.RadioRelations;
import com.dimensional.common.quantity.radio.SpectralPower;
import com.dimensional.common.quantity.space.Area;
import com.dimensional.common.quantity.space.Length;
import com.dimensional.common.quantity.space.SolidAngle;
import com.dimensional.common.quantity.space.SpaceRelations;
import com.dimensional.common.quantity.space.Volume;
import com.dimensional.common.quantity.thermal.Temperature;
import com.dimensional.common.quantity.thermal.ThermalCapacity;
import com.dimensional.common.quantity.thermal.ThermalRelations;

/**
 * The families and relations that ship with the library, assembled into a single
 * {@link DimensionalAlgebra} for code that only learns operand families at runtime.
 */
public final class StandardCatalog {

  private static final Logger LOG = Logger.getLogger(StandardCatalog.class.getName());

  private static class Global {
    private static ImmutableList<Dimension<?>> buildDimensions() {
      return ImmutableList.<Dimension<?>>builder()
          .add(Time.DIMENSION)
          .add(Length.DIMENSION, Area.DIMENSION, Volume.DIMENSION, SolidAngle.DIMENSION)
          .add(Mass.DIMENSION, MassFlowRate.DIMENSION, ChemicalAmount.DIMENSION,
              Density.DIMENSION, SubstanceConcentration.DIMENSION)
          .add(Velocity.DIMENSION, Acceleration.DIMENSION, Jerk.DIMENSION, Momentum.DIMENSION,
              Force.DIMENSION)
          .add(Energy.DIMENSION, Power.DIMENSION, MolarEnergy.DIMENSION, SpecificEnergy.DIMENSION,
              EnergyDensity.DIMENSION)
          .add(ElectricCurrent.DIMENSION, ElectricPotential.DIMENSION, ElectricCharge.DIMENSION,
              ElectricalResistance.DIMENSION, ElectricalConductance.DIMENSION,
              Resistivity.DIMENSION)
          .add(Temperature.DIMENSION, ThermalCapacity.DIMENSION)
          .add(Information.DIMENSION, DataRate.DIMENSION)
          .add(SpectralPower.DIMENSION, RadiantIntensity.DIMENSION)
          .build();
    }

    private static DimensionalAlgebra buildAlgebra() {
      DimensionalAlgebra.Builder builder = DimensionalAlgebra.builder();
      for (TimeDerivativePair<?, ?> pair : Kinematics.ALL) {
        builder.declare(pair);
      }
      builder.declare(MassRelations.MASS_FLOW);
      builder.declare(EnergyRelations.ENERGY_POWER);
      builder.declare(ElectroRelations.CHARGE_CURRENT);
      builder.declare(InformationRelations.INFORMATION_DATA_RATE);

      return builder
          .declareAll(SpaceRelations.ALL)
          .declareAll(Dynamics.ALL)
          .declareAll(MassRelations.ALL)
          .declareAll(EnergyRelations.ALL)
          .declareAll(ElectroRelations.ALL)
          .declareAll(ThermalRelations.ALL)
          .declareAll(RadioRelations.ALL)
          .build();
    }

    static final ImmutableList<Dimension<?>> DIMENSIONS = buildDimensions();
    static final DimensionalAlgebra ALGEBRA = buildAlgebra();

    static {
      LOG.info("Loaded standard catalog of " + DIMENSIONS.size() + " dimensions and "
          + ALGEBRA.relations().size() + " relations");
    }
  }

  /**
   * Returns every family in the standard catalog.
   */
  public static ImmutableList<Dimension<?>> dimensions() {
    return Global.DIMENSIONS;
  }

  /**
   * Returns the registry of every relation declared by the standard catalog.
   */
  public static DimensionalAlgebra algebra() {
    return Global.ALGEBRA;
  }

  private StandardCatalog() {
    // utility
  }
}
