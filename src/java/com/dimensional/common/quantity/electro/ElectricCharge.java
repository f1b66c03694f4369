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
import com.dimensional.common.quantity.TimeIntegral;
import com.dimensional.common.quantity.energy.Energy;

/**
 * Canonical values are in coulombs.
 */
public final class ElectricCharge extends Quantity<ElectricCharge>
    implements TimeIntegral<ElectricCurrent> {

  public static final Dimension<ElectricCharge> DIMENSION =
      Dimension.builder("ElectricCharge", new Dimension.Factory<ElectricCharge>() {
        @Override public ElectricCharge create(double canonical) {
          return new ElectricCharge(canonical);
        }
      })
      .units(ElectricChargeUnit.class)
      .build();

  ElectricCharge(double coulombs) {
    super(coulombs);
  }

  @Override
  public Dimension<ElectricCharge> dimension() {
    return DIMENSION;
  }

  @Override
  public ElectricCurrent dividedBy(Time time) {
    return ElectroRelations.CHARGE_CURRENT.derivative(this, time);
  }

  @Override
  public Time dividedBy(ElectricCurrent current) {
    return ElectroRelations.CHARGE_CURRENT.time(this, current);
  }

  public Energy times(ElectricPotential potential) {
    return ElectroRelations.CHARGE_TIMES_POTENTIAL.apply(this, potential);
  }

  public static ParseResult<ElectricCharge> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static ElectricCharge coulombs(double value) {
    return ElectricChargeUnit.COULOMBS.of(value);
  }

  public static ElectricCharge milliampereHours(double value) {
    return ElectricChargeUnit.MILLIAMPERE_HOURS.of(value);
  }
}
