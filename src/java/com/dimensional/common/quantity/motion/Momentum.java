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
import com.dimensional.common.quantity.TimeIntegral;
import com.dimensional.common.quantity.mass.Mass;

/**
 * Mass in motion.  Canonical values are in newton seconds (kilogram meters per second).
 */
public final class Momentum extends Quantity<Momentum> implements TimeIntegral<Force> {

  public static final Dimension<Momentum> DIMENSION =
      Dimension.builder("Momentum", new Dimension.Factory<Momentum>() {
        @Override public Momentum create(double canonical) {
          return new Momentum(canonical);
        }
      })
      .units(MomentumUnit.class)
      .alias("kg·m/s", MomentumUnit.NEWTON_SECONDS)
      .build();

  Momentum(double newtonSeconds) {
    super(newtonSeconds);
  }

  @Override
  public Dimension<Momentum> dimension() {
    return DIMENSION;
  }

  public Velocity dividedBy(Mass mass) {
    return Dynamics.MOMENTUM_OVER_MASS.apply(this, mass);
  }

  public Mass dividedBy(Velocity velocity) {
    return Dynamics.MOMENTUM_OVER_VELOCITY.apply(this, velocity);
  }

  @Override
  public Force dividedBy(Time time) {
    return Kinematics.MOMENTUM_FORCE.derivative(this, time);
  }

  @Override
  public Time dividedBy(Force force) {
    return Kinematics.MOMENTUM_FORCE.time(this, force);
  }

  public static ParseResult<Momentum> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Momentum newtonSeconds(double value) {
    return MomentumUnit.NEWTON_SECONDS.of(value);
  }
}
