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

/**
 * The rate of change of acceleration, the third time-derivative of position.  Canonical values
 * are in meters per second cubed.
 */
public final class Jerk extends Quantity<Jerk> implements TimeDerivative<Acceleration> {

  public static final Dimension<Jerk> DIMENSION =
      Dimension.builder("Jerk", new Dimension.Factory<Jerk>() {
        @Override public Jerk create(double canonical) {
          return new Jerk(canonical);
        }
      })
      .units(JerkUnit.class)
      .build();

  Jerk(double metersPerSecondCubed) {
    super(metersPerSecondCubed);
  }

  @Override
  public Dimension<Jerk> dimension() {
    return DIMENSION;
  }

  @Override
  public Acceleration times(Time time) {
    return Kinematics.ACCELERATION_JERK.integral(this, time);
  }

  public static ParseResult<Jerk> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Jerk metersPerSecondCubed(double value) {
    return JerkUnit.METERS_PER_SECOND_CUBED.of(value);
  }
}
