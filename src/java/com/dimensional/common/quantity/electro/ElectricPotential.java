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

package com.dimensional.common.quantity.electro;

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.ParseResult;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.energy.Energy;
import com.dimensional.common.quantity.energy.Power;

/**
 * Canonical values are in volts.
 */
public final class ElectricPotential extends Quantity<ElectricPotential> {

  public static final Dimension<ElectricPotential> DIMENSION =
      Dimension.builder("ElectricPotential", new Dimension.Factory<ElectricPotential>() {
        @Override public ElectricPotential create(double canonical) {
          return new ElectricPotential(canonical);
        }
      })
      .units(ElectricPotentialUnit.class)
      .build();

  ElectricPotential(double volts) {
    super(volts);
  }

  @Override
  public Dimension<ElectricPotential> dimension() {
    return DIMENSION;
  }

  public ElectricalResistance dividedBy(ElectricCurrent current) {
    return ElectroRelations.POTENTIAL_OVER_CURRENT.apply(this, current);
  }

  public ElectricCurrent dividedBy(ElectricalResistance resistance) {
    return ElectroRelations.POTENTIAL_OVER_RESISTANCE.apply(this, resistance);
  }

  public Power times(ElectricCurrent current) {
    return ElectroRelations.POTENTIAL_TIMES_CURRENT.apply(this, current);
  }

  public Energy times(ElectricCharge charge) {
    return ElectroRelations.POTENTIAL_TIMES_CHARGE.apply(this, charge);
  }

  public ElectricCurrent times(ElectricalConductance conductance) {
    return ElectroRelations.POTENTIAL_TIMES_CONDUCTANCE.apply(this, conductance);
  }

  public static ParseResult<ElectricPotential> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static ElectricPotential volts(double value) {
    return ElectricPotentialUnit.VOLTS.of(value);
  }
}
