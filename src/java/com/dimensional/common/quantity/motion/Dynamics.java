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

package com.dimensional.common.quantity.motion;

import com.google.common.collect.ImmutableList;

import com.dimensional.common.quantity.Relation;
import com.dimensional.common.quantity.energy.Energy;
import com.dimensional.common.quantity.mass.Mass;
import com.dimensional.common.quantity.space.Length;

import static com.dimensional.common.quantity.energy.EnergyUnit.JOULES;
import static com.dimensional.common.quantity.mass.MassUnit.KILOGRAMS;
import static com.dimensional.common.quantity.motion.AccelerationUnit.METERS_PER_SECOND_SQUARED;
import static com.dimensional.common.quantity.motion.ForceUnit.NEWTONS;
import static com.dimensional.common.quantity.motion.MomentumUnit.NEWTON_SECONDS;
import static com.dimensional.common.quantity.motion.VelocityUnit.METERS_PER_SECOND;
import static com.dimensional.common.quantity.space.LengthUnit.METERS;

/**
 * Relations of mass in motion: momentum, force and the work a force does.  Mass takes part in
 * kilograms, since its canonical unit is the gram.
 */
public final class Dynamics {

  public static final Relation<Mass, Velocity, Momentum> MASS_TIMES_VELOCITY =
      Relation.product(KILOGRAMS, METERS_PER_SECOND, NEWTON_SECONDS);

  public static final Relation<Momentum, Mass, Velocity> MOMENTUM_OVER_MASS =
      Relation.quotient(NEWTON_SECONDS, KILOGRAMS, METERS_PER_SECOND);

  public static final Relation<Momentum, Velocity, Mass> MOMENTUM_OVER_VELOCITY =
      Relation.quotient(NEWTON_SECONDS, METERS_PER_SECOND, KILOGRAMS);

  public static final Relation<Mass, Acceleration, Force> MASS_TIMES_ACCELERATION =
      Relation.product(KILOGRAMS, METERS_PER_SECOND_SQUARED, NEWTONS);

  public static final Relation<Force, Mass, Acceleration> FORCE_OVER_MASS =
      Relation.quotient(NEWTONS, KILOGRAMS, METERS_PER_SECOND_SQUARED);

  public static final Relation<Force, Acceleration, Mass> FORCE_OVER_ACCELERATION =
      Relation.quotient(NEWTONS, METERS_PER_SECOND_SQUARED, KILOGRAMS);

  public static final Relation<Force, Length, Energy> FORCE_TIMES_LENGTH =
      Relation.product(NEWTONS, METERS, JOULES);

  public static final Relation<Energy, Length, Force> ENERGY_OVER_LENGTH =
      Relation.quotient(JOULES, METERS, NEWTONS);

  public static final Relation<Energy, Force, Length> ENERGY_OVER_FORCE =
      Relation.quotient(JOULES, NEWTONS, METERS);

  public static final ImmutableList<Relation<?, ?, ?>> ALL = ImmutableList.<Relation<?, ?, ?>>of(
      MASS_TIMES_VELOCITY,
      MOMENTUM_OVER_MASS,
      MOMENTUM_OVER_VELOCITY,
      MASS_TIMES_ACCELERATION,
      FORCE_OVER_MASS,
      FORCE_OVER_ACCELERATION,
      FORCE_TIMES_LENGTH,
      ENERGY_OVER_LENGTH,
      ENERGY_OVER_FORCE);

  private Dynamics() {
    // relations
  }
}
