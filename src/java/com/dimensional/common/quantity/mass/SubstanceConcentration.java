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
 * Amount of substance per unit volume (molar concentration).  Canonical values are in moles per
 * cubic meter.
 */
public final class SubstanceConcentration extends Quantity<SubstanceConcentration> {

  public static final Dimension<SubstanceConcentration> DIMENSION =
      Dimension.builder("SubstanceConcentration",
          new Dimension.Factory<SubstanceConcentration>() {
            @Override public SubstanceConcentration create(double canonical) {
              return new SubstanceConcentration(canonical);
            }
          })
      .units(SubstanceConcentrationUnit.class)
      .alias("M", SubstanceConcentrationUnit.MOLES_PER_LITRE)
      .build();

  SubstanceConcentration(double molesPerCubicMeter) {
    super(molesPerCubicMeter);
  }

  @Override
  public Dimension<SubstanceConcentration> dimension() {
    return DIMENSION;
  }

  public ChemicalAmount times(Volume volume) {
    return MassRelations.CONCENTRATION_TIMES_VOLUME.apply(this, volume);
  }

  public static ParseResult<SubstanceConcentration> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static SubstanceConcentration molesPerCubicMeter(double value) {
    return SubstanceConcentrationUnit.MOLES_PER_CUBIC_METER.of(value);
  }

  public static SubstanceConcentration molesPerLitre(double value) {
    return SubstanceConcentrationUnit.MOLES_PER_LITRE.of(value);
  }
}
