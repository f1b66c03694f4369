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

package com.dimensional.common.quantity.energy;

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.ParseResult;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.space.Volume;

/**
 * Canonical values are in joules per cubic meter.
 */
public final class EnergyDensity extends Quantity<EnergyDensity> {

  public static final Dimension<EnergyDensity> DIMENSION =
      Dimension.builder("EnergyDensity", new Dimension.Factory<EnergyDensity>() {
        @Override public EnergyDensity create(double canonical) {
          return new EnergyDensity(canonical);
        }
      })
      .units(EnergyDensityUnit.class)
      .build();

  EnergyDensity(double joulesPerCubicMeter) {
    super(joulesPerCubicMeter);
  }

  @Override
  public Dimension<EnergyDensity> dimension() {
    return DIMENSION;
  }

  public Energy times(Volume volume) {
    return EnergyRelations.ENERGY_DENSITY_TIMES_VOLUME.apply(this, volume);
  }

  public static ParseResult<EnergyDensity> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static EnergyDensity joulesPerCubicMeter(double value) {
    return EnergyDensityUnit.JOULES_PER_CUBIC_METER.of(value);
  }
}
