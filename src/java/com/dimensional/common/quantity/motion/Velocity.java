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
import com.dimensional.common.quantity.space.Length;

/**
 * The rate of change of length.  Canonical values are in meters per second.
 */
public final class Velocity extends Quantity<Velocity>
    implements TimeDerivative<Length>, TimeIntegral<Acceleration> {

  public static final Dimension<Velocity> DIMENSION =
      Dimension.builder("Velocity", new Dimension.Factory<Velocity>() {
        @Override public Velocity create(double canonical) {
          return new Velocity(canonical);
        }
      })
      .units(VelocityUnit.class)
      .build();

  Velocity(double metersPerSecond) {
    super(metersPerSecond);
  }

  @Override
  public Dimension<Velocity> dimension() {
    return DIMENSION;
  }

  @Override
  public Length times(Time time) {
    return Kinematics.LENGTH_VELOCITY.integral(this, time);
  }

  @Override
  public Acceleration dividedBy(Time time) {
    return Kinematics.VELOCITY_ACCELERATION.derivative(this, time);
  }

  @Override
  public Time dividedBy(Acceleration acceleration) {
    return Kinematics.VELOCITY_ACCELERATION.time(this, acceleration);
  }

  public static ParseResult<Velocity> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Velocity metersPerSecond(double value) {
    return VelocityUnit.METERS_PER_SECOND.of(value);
  }

  public static Velocity kilometersPerHour(double value) {
    return VelocityUnit.KILOMETERS_PER_HOUR.of(value);
  }
}
