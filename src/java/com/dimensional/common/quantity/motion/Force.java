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

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.ParseResult;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.Time;
import com.dimensional.common.quantity.TimeDerivative;
import com.dimensional.common.quantity.energy.Energy;
import com.dimensional.common.quantity.mass.Mass;
import com.dimensional.common.quantity.space.Length;

/**
 * Canonical values are in newtons.
 */
public final class Force extends Quantity<Force> implements TimeDerivative<Momentum> {

  /**
   * One pound-force, in newtons.
   */
  public static final double POUND_FORCE = 4.4482216152605;

  public static final Dimension<Force> DIMENSION =
      Dimension.builder("Force", new Dimension.Factory<Force>() {
        @Override public Force create(double canonical) {
          return new Force(canonical);
        }
      })
      .units(ForceUnit.class)
      .build();

  Force(double newtons) {
    super(newtons);
  }

  @Override
  public Dimension<Force> dimension() {
    return DIMENSION;
  }

  public Acceleration dividedBy(Mass mass) {
    return Dynamics.FORCE_OVER_MASS.apply(this, mass);
  }

  public Mass dividedBy(Acceleration acceleration) {
    return Dynamics.FORCE_OVER_ACCELERATION.apply(this, acceleration);
  }

  /**
   * Returns the work done by this force over a distance.
   */
  public Energy times(Length length) {
    return Dynamics.FORCE_TIMES_LENGTH.apply(this, length);
  }

  @Override
  public Momentum times(Time time) {
    return Kinematics.MOMENTUM_FORCE.integral(this, time);
  }

  public static ParseResult<Force> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Force newtons(double value) {
    return ForceUnit.NEWTONS.of(value);
  }

  public static Force poundForce(double value) {
    return ForceUnit.POUND_FORCE.of(value);
  }
}
