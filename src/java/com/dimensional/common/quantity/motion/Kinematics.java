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

import com.dimensional.common.quantity.TimeDerivativePair;
import com.dimensional.common.quantity.space.Length;

import static com.dimensional.common.quantity.TimeUnit.SECONDS;
import static com.dimensional.common.quantity.motion.AccelerationUnit.METERS_PER_SECOND_SQUARED;
import static com.dimensional.common.quantity.motion.ForceUnit.NEWTONS;
import static com.dimensional.common.quantity.motion.JerkUnit.METERS_PER_SECOND_CUBED;
import static com.dimensional.common.quantity.motion.MomentumUnit.NEWTON_SECONDS;
import static com.dimensional.common.quantity.motion.VelocityUnit.METERS_PER_SECOND;
import static com.dimensional.common.quantity.space.LengthUnit.METERS;

/**
 * The time-derivative chains of motion: length, velocity, acceleration and jerk; and momentum
 * and force.
 */
public final class Kinematics {

  public static final TimeDerivativePair<Length, Velocity> LENGTH_VELOCITY =
      TimeDerivativePair.declare(METERS, METERS_PER_SECOND, SECONDS);

  public static final TimeDerivativePair<Velocity, Acceleration> VELOCITY_ACCELERATION =
      TimeDerivativePair.declare(METERS_PER_SECOND, METERS_PER_SECOND_SQUARED, SECONDS);

  public static final TimeDerivativePair<Acceleration, Jerk> ACCELERATION_JERK =
      TimeDerivativePair.declare(METERS_PER_SECOND_SQUARED, METERS_PER_SECOND_CUBED, SECONDS);

  public static final TimeDerivativePair<Momentum, Force> MOMENTUM_FORCE =
      TimeDerivativePair.declare(NEWTON_SECONDS, NEWTONS, SECONDS);

  public static final ImmutableList<TimeDerivativePair<?, ?>> ALL =
      ImmutableList.<TimeDerivativePair<?, ?>>of(
          LENGTH_VELOCITY,
          VELOCITY_ACCELERATION,
          ACCELERATION_JERK,
          MOMENTUM_FORCE);

  private Kinematics() {
    // relations
  }
}
