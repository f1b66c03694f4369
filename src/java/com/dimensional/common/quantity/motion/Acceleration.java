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
import com.dimensional.common.quantity.TimeIntegral;

/**
 * The rate of change of velocity.  Canonical values are in meters per second squared.
 */
public final class Acceleration extends Quantity<Acceleration>
    implements TimeDerivative<Velocity>, TimeIntegral<Jerk> {

  /**
   * Standard acceleration due to gravity, in meters per second squared.
   */
  public static final double STANDARD_GRAVITY = 9.80665;

  public static final Dimension<Acceleration> DIMENSION =
      Dimension.builder("Acceleration", new Dimension.Factory<Acceleration>() {
        @Override public Acceleration create(double canonical) {
          return new Acceleration(canonical);
        }
      })
      .units(AccelerationUnit.class)
      .build();

  Acceleration(double metersPerSecondSquared) {
    super(metersPerSecondSquared);
  }

  @Override
  public Dimension<Acceleration> dimension() {
    return DIMENSION;
  }

  @Override
  public Velocity times(Time time) {
    return Kinematics.VELOCITY_ACCELERATION.integral(this, time);
  }

  @Override
  public Jerk dividedBy(Time time) {
    return Kinematics.ACCELERATION_JERK.derivative(this, time);
  }

  @Override
  public Time dividedBy(Jerk jerk) {
    return Kinematics.ACCELERATION_JERK.time(this, jerk);
  }

  public static ParseResult<Acceleration> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Acceleration metersPerSecondSquared(double value) {
    return AccelerationUnit.METERS_PER_SECOND_SQUARED.of(value);
  }

  public static Acceleration earthGravities(double value) {
    return AccelerationUnit.EARTH_GRAVITIES.of(value);
  }
}
