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

package com.dimensional.common.quantity.space;

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.ParseResult;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.Time;
import com.dimensional.common.quantity.TimeIntegral;
import com.dimensional.common.quantity.motion.Kinematics;
import com.dimensional.common.quantity.motion.Velocity;

import static com.dimensional.common.quantity.space.LengthUnit.CENTIMETERS;
import static com.dimensional.common.quantity.space.LengthUnit.FEET;
import static com.dimensional.common.quantity.space.LengthUnit.KILOMETERS;
import static com.dimensional.common.quantity.space.LengthUnit.METERS;
import static com.dimensional.common.quantity.space.LengthUnit.MICROMETERS;
import static com.dimensional.common.quantity.space.LengthUnit.MILES;
import static com.dimensional.common.quantity.space.LengthUnit.MILLIMETERS;
import static com.dimensional.common.quantity.space.LengthUnit.NANOMETERS;

/**
 * A distance.  Canonical values are in meters.
 */
public final class Length extends Quantity<Length> implements TimeIntegral<Velocity> {

  public static final Dimension<Length> DIMENSION =
      Dimension.builder("Length", new Dimension.Factory<Length>() {
        @Override public Length create(double canonical) {
          return new Length(canonical);
        }
      })
      .units(LengthUnit.class)
      .display(1.0, KILOMETERS)
      .display(1.0, METERS)
      .display(1.0, CENTIMETERS)
      .display(1.0, MILLIMETERS)
      .display(1.0, MICROMETERS)
      .displayFallback(NANOMETERS)
      .build();

  Length(double meters) {
    super(meters);
  }

  @Override
  public Dimension<Length> dimension() {
    return DIMENSION;
  }

  public Area times(Length that) {
    return SpaceRelations.LENGTH_TIMES_LENGTH.apply(this, that);
  }

  @Override
  public Velocity dividedBy(Time time) {
    return Kinematics.LENGTH_VELOCITY.derivative(this, time);
  }

  @Override
  public Time dividedBy(Velocity velocity) {
    return Kinematics.LENGTH_VELOCITY.time(this, velocity);
  }

  public static ParseResult<Length> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Length meters(double value) {
    return METERS.of(value);
  }

  public static Length kilometers(double value) {
    return KILOMETERS.of(value);
  }

  public static Length feet(double value) {
    return FEET.of(value);
  }

  public static Length miles(double value) {
    return MILES.of(value);
  }
}
