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
 * An amount of substance.  Canonical values are in moles.
 */
public final class ChemicalAmount extends Quantity<ChemicalAmount> {

  public static final Dimension<ChemicalAmount> DIMENSION =
      Dimension.builder("ChemicalAmount", new Dimension.Factory<ChemicalAmount>() {
        @Override public ChemicalAmount create(double canonical) {
          return new ChemicalAmount(canonical);
        }
      })
      .units(ChemicalAmountUnit.class)
      .build();

  ChemicalAmount(double moles) {
    super(moles);
  }

  @Override
  public Dimension<ChemicalAmount> dimension() {
    return DIMENSION;
  }

  public SubstanceConcentration dividedBy(Volume volume) {
    return MassRelations.AMOUNT_OVER_VOLUME.apply(this, volume);
  }

  public Volume dividedBy(SubstanceConcentration concentration) {
    return MassRelations.AMOUNT_OVER_CONCENTRATION.apply(this, concentration);
  }

  public static ParseResult<ChemicalAmount> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static ChemicalAmount moles(double value) {
    return ChemicalAmountUnit.MOLES.of(value);
  }
}
