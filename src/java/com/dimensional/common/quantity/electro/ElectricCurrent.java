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
import com.dimensional.common.quantity.Time;
import com.dimensional.common.quantity.TimeDerivative;
import com.dimensional.common.quantity.energy.Power;

/**
 * Canonical values are in amperes.
 */
public final class ElectricCurrent extends Quantity<ElectricCurrent>
    implements TimeDerivative<ElectricCharge> {

  public static final Dimension<ElectricCurrent> DIMENSION =
      Dimension.builder("ElectricCurrent", new Dimension.Factory<ElectricCurrent>() {
        @Override public ElectricCurrent create(double canonical) {
          return new ElectricCurrent(canonical);
        }
      })
      .units(ElectricCurrentUnit.class)
      .build();

  ElectricCurrent(double amperes) {
    super(amperes);
  }

  @Override
  public Dimension<ElectricCurrent> dimension() {
    return DIMENSION;
  }

  @Override
  public ElectricCharge times(Time time) {
    return ElectroRelations.CHARGE_CURRENT.integral(this, time);
  }

  public Power times(ElectricPotential potential) {
    return ElectroRelations.CURRENT_TIMES_POTENTIAL.apply(this, potential);
  }

  public ElectricPotential times(ElectricalResistance resistance) {
    return ElectroRelations.CURRENT_TIMES_RESISTANCE.apply(this, resistance);
  }

  public ElectricalConductance dividedBy(ElectricPotential potential) {
    return ElectroRelations.CURRENT_OVER_POTENTIAL.apply(this, potential);
  }

  public ElectricPotential dividedBy(ElectricalConductance conductance) {
    return ElectroRelations.CURRENT_OVER_CONDUCTANCE.apply(this, conductance);
  }

  public static ParseResult<ElectricCurrent> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static ElectricCurrent amperes(double value) {
    return ElectricCurrentUnit.AMPERES.of(value);
  }

  public static ElectricCurrent milliamperes(double value) {
    return ElectricCurrentUnit.MILLIAMPERES.of(value);
  }
}
