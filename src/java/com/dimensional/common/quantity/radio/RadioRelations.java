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

import com.google.common.collect.ImmutableList;

import com.dimensional.common.quantity.Relation;
import com.dimensional.common.quantity.energy.Power;
import com.dimensional.common.quantity.space.Length;
import com.dimensional.common.quantity.space.SolidAngle;

import static com.dimensional.common.quantity.energy.PowerUnit.WATTS;
import static com.dimensional.common.quantity.radio.RadiantIntensityUnit.WATTS_PER_STERADIAN;
import static com.dimensional.common.quantity.radio.SpectralPowerUnit.WATTS_PER_METER;
import static com.dimensional.common.quantity.space.LengthUnit.METERS;
import static com.dimensional.common.quantity.space.SolidAngleUnit.STERADIANS;

/**
 * Power spread over wavelength and over solid angle.
 */
public final class RadioRelations {

  public static final Relation<SpectralPower, Length, Power> SPECTRAL_POWER_TIMES_LENGTH =
      Relation.product(WATTS_PER_METER, METERS, WATTS);

  public static final Relation<Power, Length, SpectralPower> POWER_OVER_LENGTH =
      Relation.quotient(WATTS, METERS, WATTS_PER_METER);

  public static final Relation<Power, SpectralPower, Length> POWER_OVER_SPECTRAL_POWER =
      Relation.quotient(WATTS, WATTS_PER_METER, METERS);

  public static final Relation<RadiantIntensity, SolidAngle, Power>
      RADIANT_INTENSITY_TIMES_SOLID_ANGLE =
          Relation.product(WATTS_PER_STERADIAN, STERADIANS, WATTS);

  public static final Relation<SolidAngle, RadiantIntensity, Power>
      SOLID_ANGLE_TIMES_RADIANT_INTENSITY =
          Relation.product(STERADIANS, WATTS_PER_STERADIAN, WATTS);

  public static final Relation<Power, SolidAngle, RadiantIntensity> POWER_OVER_SOLID_ANGLE =
      Relation.quotient(WATTS, STERADIANS, WATTS_PER_STERADIAN);

  public static final Relation<Power, RadiantIntensity, SolidAngle> POWER_OVER_RADIANT_INTENSITY =
      Relation.quotient(WATTS, WATTS_PER_STERADIAN, STERADIANS);

  public static final ImmutableList<Relation<?, ?, ?>> ALL = ImmutableList.<Relation<?, ?, ?>>of(
      SPECTRAL_POWER_TIMES_LENGTH,
      POWER_OVER_LENGTH,
      POWER_OVER_SPECTRAL_POWER,
      RADIANT_INTENSITY_TIMES_SOLID_ANGLE,
      SOLID_ANGLE_TIMES_RADIANT_INTENSITY,
      POWER_OVER_SOLID_ANGLE,
      POWER_OVER_RADIANT_INTENSITY);

  private RadioRelations() {
    // relations
  }
}
