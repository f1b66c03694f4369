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
import com.dimensional.common.quantity.mass.Mass;

/**
 * Energy per unit mass, which is also the absorbed dose of radiation.  Canonical values are in
 * grays.
 */
public final class SpecificEnergy extends Quantity<SpecificEnergy> {

  public static final Dimension<SpecificEnergy> DIMENSION =
      Dimension.builder("SpecificEnergy", new Dimension.Factory<SpecificEnergy>() {
        @Override public SpecificEnergy create(double canonical) {
          return new SpecificEnergy(canonical);
        }
      })
      .units(SpecificEnergyUnit.class)
      .alias("J/kg", SpecificEnergyUnit.GRAYS)
      .build();

  SpecificEnergy(double grays) {
    super(grays);
  }

  @Override
  public Dimension<SpecificEnergy> dimension() {
    return DIMENSION;
  }

  public Energy times(Mass mass) {
    return EnergyRelations.SPECIFIC_ENERGY_TIMES_MASS.apply(this, mass);
  }

  public static ParseResult<SpecificEnergy> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static SpecificEnergy grays(double value) {
    return SpecificEnergyUnit.GRAYS.of(value);
  }
}
