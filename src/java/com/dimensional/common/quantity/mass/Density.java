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

package com.dimensional.common.quantity.mass;

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.ParseResult;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.space.Volume;

/**
 * Mass per unit volume.  Canonical values are in kilograms per cubic meter.
 */
public final class Density extends Quantity<Density> {

  public static final Dimension<Density> DIMENSION =
      Dimension.builder("Density", new Dimension.Factory<Density>() {
        @Override public Density create(double canonical) {
          return new Density(canonical);
        }
      })
      .units(DensityUnit.class)
      .build();

  Density(double kilogramsPerCubicMeter) {
    super(kilogramsPerCubicMeter);
  }

  @Override
  public Dimension<Density> dimension() {
    return DIMENSION;
  }

  public Mass times(Volume volume) {
    return MassRelations.DENSITY_TIMES_VOLUME.apply(this, volume);
  }

  public static ParseResult<Density> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Density kilogramsPerCubicMeter(double value) {
    return DensityUnit.KILOGRAMS_PER_CUBIC_METER.of(value);
  }
}
