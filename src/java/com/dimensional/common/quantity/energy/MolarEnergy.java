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
import com.dimensional.common.quantity.mass.ChemicalAmount;

/**
 * Energy per amount of substance.  Canonical values are in joules per mole.
 */
public final class MolarEnergy extends Quantity<MolarEnergy> {

  public static final Dimension<MolarEnergy> DIMENSION =
      Dimension.builder("MolarEnergy", new Dimension.Factory<MolarEnergy>() {
        @Override public MolarEnergy create(double canonical) {
          return new MolarEnergy(canonical);
        }
      })
      .units(MolarEnergyUnit.class)
      .build();

  MolarEnergy(double joulesPerMole) {
    super(joulesPerMole);
  }

  @Override
  public Dimension<MolarEnergy> dimension() {
    return DIMENSION;
  }

  public Energy times(ChemicalAmount amount) {
    return EnergyRelations.MOLAR_ENERGY_TIMES_AMOUNT.apply(this, amount);
  }

  public static ParseResult<MolarEnergy> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static MolarEnergy joulesPerMole(double value) {
    return MolarEnergyUnit.JOULES_PER_MOLE.of(value);
  }
}
