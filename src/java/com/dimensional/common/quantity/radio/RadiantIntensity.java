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

package com.dimensional.common.quantity.radio;

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.ParseResult;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.energy.Power;
import com.dimensional.common.quantity.space.SolidAngle;

/**
 * Power per unit solid angle.  Canonical values are in watts per steradian.
 */
public final class RadiantIntensity extends Quantity<RadiantIntensity> {

  public static final Dimension<RadiantIntensity> DIMENSION =
      Dimension.builder("RadiantIntensity", new Dimension.Factory<RadiantIntensity>() {
        @Override public RadiantIntensity create(double canonical) {
          return new RadiantIntensity(canonical);
        }
      })
      .units(RadiantIntensityUnit.class)
      .build();

  RadiantIntensity(double wattsPerSteradian) {
    super(wattsPerSteradian);
  }

  @Override
  public Dimension<RadiantIntensity> dimension() {
    return DIMENSION;
  }

  public Power times(SolidAngle solidAngle) {
    return RadioRelations.RADIANT_INTENSITY_TIMES_SOLID_ANGLE.apply(this, solidAngle);
  }

  public static ParseResult<RadiantIntensity> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static RadiantIntensity wattsPerSteradian(double value) {
    return RadiantIntensityUnit.WATTS_PER_STERADIAN.of(value);
  }
}
