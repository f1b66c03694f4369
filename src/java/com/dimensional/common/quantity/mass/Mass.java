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

package com.dimensional.common.quantity.mass;

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.ParseResult;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.Time;
import com.dimensional.common.quantity.TimeIntegral;
import com.dimensional.common.quantity.energy.Energy;
import com.dimensional.common.quantity.energy.EnergyRelations;
import com.dimensional.common.quantity.energy.SpecificEnergy;
import com.dimensional.common.quantity.motion.Acceleration;
import com.dimensional.common.quantity.motion.Dynamics;
import com.dimensional.common.quantity.motion.Force;
import com.dimensional.common.quantity.motion.Momentum;
import com.dimensional.common.quantity.motion.Velocity;
import com.dimensional.common.quantity.space.Volume;

import static com.dimensional.common.quantity.mass.MassUnit.GRAMS;
import static com.dimensional.common.quantity.mass.MassUnit.KILOGRAMS;
import static com.dimensional.common.quantity.mass.MassUnit.MILLIGRAMS;
import static com.dimensional.common.quantity.mass.MassUnit.POUNDS;
import static com.dimensional.common.quantity.mass.MassUnit.TONNES;

/**
 * Canonical values are in grams.  By default masses display in the largest of tonnes, kilograms
 * and grams that amounts to at least one, or else in milligrams.
 */
public final class Mass extends Quantity<Mass> implements TimeIntegral<MassFlowRate> {

  public static final Dimension<Mass> DIMENSION =
      Dimension.builder("Mass", new Dimension.Factory<Mass>() {
        @Override public Mass create(double canonical) {
          return new Mass(canonical);
        }
      })
      .units(MassUnit.class)
      .alias("tonnes", TONNES)
      .display(1.0, TONNES)
      .display(1.0, KILOGRAMS)
      .display(1.0, GRAMS)
      .displayFallback(MILLIGRAMS)
      .build();

  Mass(double grams) {
    super(grams);
  }

  @Override
  public Dimension<Mass> dimension() {
    return DIMENSION;
  }

  public Momentum times(Velocity velocity) {
    return Dynamics.MASS_TIMES_VELOCITY.apply(this, velocity);
  }

  public Force times(Acceleration acceleration) {
    return Dynamics.MASS_TIMES_ACCELERATION.apply(this, acceleration);
  }

  public Energy times(SpecificEnergy specificEnergy) {
    return EnergyRelations.MASS_TIMES_SPECIFIC_ENERGY.apply(this, specificEnergy);
  }

  @Override
  public MassFlowRate dividedBy(Time time) {
    return MassRelations.MASS_FLOW.derivative(this, time);
  }

  @Override
  public Time dividedBy(MassFlowRate flowRate) {
    return MassRelations.MASS_FLOW.time(this, flowRate);
  }

  public Density dividedBy(Volume volume) {
    return MassRelations.MASS_OVER_VOLUME.apply(this, volume);
  }

  public Volume dividedBy(Density density) {
    return MassRelations.MASS_OVER_DENSITY.apply(this, density);
  }

  public static ParseResult<Mass> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Mass milligrams(double value) {
    return MILLIGRAMS.of(value);
  }

  public static Mass grams(double value) {
    return GRAMS.of(value);
  }

  public static Mass kilograms(double value) {
    return KILOGRAMS.of(value);
  }

  public static Mass tonnes(double value) {
    return TONNES.of(value);
  }

  public static Mass pounds(double value) {
    return POUNDS.of(value);
  }
}
