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
import com.dimensional.common.quantity.space.Length;

/**
 * Power per unit of wavelength.  Canonical values are in watts per meter.
 */
public final class SpectralPower extends Quantity<SpectralPower> {

  public static final Dimension<SpectralPower> DIMENSION =
      Dimension.builder("SpectralPower", new Dimension.Factory<SpectralPower>() {
        @Override public SpectralPower create(double canonical) {
          return new SpectralPower(canonical);
        }
      })
      .units(SpectralPowerUnit.class)
      .build();

  SpectralPower(double wattsPerMeter) {
    super(wattsPerMeter);
  }

  @Override
  public Dimension<SpectralPower> dimension() {
    return DIMENSION;
  }

  public Power times(Length length) {
    return RadioRelations.SPECTRAL_POWER_TIMES_LENGTH.apply(this, length);
  }

  public static ParseResult<SpectralPower> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static SpectralPower wattsPerMeter(double value) {
    return SpectralPowerUnit.WATTS_PER_METER.of(value);
  }
}
