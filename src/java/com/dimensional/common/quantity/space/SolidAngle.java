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
import com.dimensional.common.quantity.energy.Power;
import com.dimensional.common.quantity.radio.RadiantIntensity;
import com.dimensional.common.quantity.radio.RadioRelations;

/**
 * Canonical values are in steradians.
 */
public final class SolidAngle extends Quantity<SolidAngle> {

  public static final Dimension<SolidAngle> DIMENSION =
      Dimension.builder("SolidAngle", new Dimension.Factory<SolidAngle>() {
        @Override public SolidAngle create(double canonical) {
          return new SolidAngle(canonical);
        }
      })
      .units(SolidAngleUnit.class)
      .build();

  SolidAngle(double steradians) {
    super(steradians);
  }

  @Override
  public Dimension<SolidAngle> dimension() {
    return DIMENSION;
  }

  public Power times(RadiantIntensity intensity) {
    return RadioRelations.SOLID_ANGLE_TIMES_RADIANT_INTENSITY.apply(this, intensity);
  }

  public static ParseResult<SolidAngle> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static SolidAngle steradians(double value) {
    return SolidAngleUnit.STERADIANS.of(value);
  }
}
