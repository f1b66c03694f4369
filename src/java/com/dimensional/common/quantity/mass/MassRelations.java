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

import com.google.common.collect.ImmutableList;

import com.dimensional.common.quantity.Relation;
import com.dimensional.common.quantity.TimeDerivativePair;
import com.dimensional.common.quantity.space.Volume;

import static com.dimensional.common.quantity.TimeUnit.SECONDS;
import static com.dimensional.common.quantity.mass.ChemicalAmountUnit.MOLES;
import static com.dimensional.common.quantity.mass.DensityUnit.KILOGRAMS_PER_CUBIC_METER;
import static com.dimensional.common.quantity.mass.MassFlowRateUnit.KILOGRAMS_PER_SECOND;
import static com.dimensional.common.quantity.mass.MassUnit.KILOGRAMS;
import static com.dimensional.common.quantity.mass.SubstanceConcentrationUnit.MOLES_PER_CUBIC_METER;
import static com.dimensional.common.quantity.space.VolumeUnit.CUBIC_METERS;

/**
 * Mass flow as the time-derivative of mass, and the relations of mass and amount of substance to
 * the volume they occupy.
 */
public final class MassRelations {

  public static final TimeDerivativePair<Mass, MassFlowRate> MASS_FLOW =
      TimeDerivativePair.declare(KILOGRAMS, KILOGRAMS_PER_SECOND, SECONDS);

  public static final Relation<Mass, Volume, Density> MASS_OVER_VOLUME =
      Relation.quotient(KILOGRAMS, CUBIC_METERS, KILOGRAMS_PER_CUBIC_METER);

  public static final Relation<Mass, Density, Volume> MASS_OVER_DENSITY =
      Relation.quotient(KILOGRAMS, KILOGRAMS_PER_CUBIC_METER, CUBIC_METERS);

  public static final Relation<Density, Volume, Mass> DENSITY_TIMES_VOLUME =
      Relation.product(KILOGRAMS_PER_CUBIC_METER, CUBIC_METERS, KILOGRAMS);

  public static final Relation<ChemicalAmount, Volume, SubstanceConcentration> AMOUNT_OVER_VOLUME =
      Relation.quotient(MOLES, CUBIC_METERS, MOLES_PER_CUBIC_METER);

  public static final Relation<ChemicalAmount, SubstanceConcentration, Volume>
      AMOUNT_OVER_CONCENTRATION = Relation.quotient(MOLES, MOLES_PER_CUBIC_METER, CUBIC_METERS);

  public static final Relation<SubstanceConcentration, Volume, ChemicalAmount>
      CONCENTRATION_TIMES_VOLUME = Relation.product(MOLES_PER_CUBIC_METER, CUBIC_METERS, MOLES);

  public static final ImmutableList<Relation<?, ?, ?>> ALL = ImmutableList.<Relation<?, ?, ?>>of(
      MASS_OVER_VOLUME,
      MASS_OVER_DENSITY,
      DENSITY_TIMES_VOLUME,
      AMOUNT_OVER_VOLUME,
      AMOUNT_OVER_CONCENTRATION,
      CONCENTRATION_TIMES_VOLUME);

  private MassRelations() {
    // relations
  }
}
