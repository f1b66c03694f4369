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
import com.dimensional.common.quantity.space.Length;

import static com.dimensional.common.quantity.electro.ElectricalResistanceUnit.GIGOHMS;
import static com.dimensional.common.quantity.electro.ElectricalResistanceUnit.KILOHMS;
import static com.dimensional.common.quantity.electro.ElectricalResistanceUnit.MEGOHMS;
import static com.dimensional.common.quantity.electro.ElectricalResistanceUnit.MILLIOHMS;
import static com.dimensional.common.quantity.electro.ElectricalResistanceUnit.OHMS;

/**
 * Canonical values are in ohms.
 */
public final class ElectricalResistance extends Quantity<ElectricalResistance> {

  public static final Dimension<ElectricalResistance> DIMENSION =
      Dimension.builder("ElectricalResistance", new Dimension.Factory<ElectricalResistance>() {
        @Override public ElectricalResistance create(double canonical) {
          return new ElectricalResistance(canonical);
        }
      })
      .units(ElectricalResistanceUnit.class)
      .alias("ohm", OHMS)
      .alias("ohms", OHMS)
      .display(1.0, GIGOHMS)
      .display(1.0, MEGOHMS)
      .display(1.0, KILOHMS)
      .display(1.0, OHMS)
      .displayFallback(MILLIOHMS)
      .build();

  ElectricalResistance(double ohms) {
    super(ohms);
  }

  @Override
  public Dimension<ElectricalResistance> dimension() {
    return DIMENSION;
  }

  public ElectricPotential times(ElectricCurrent current) {
    return ElectroRelations.RESISTANCE_TIMES_CURRENT.apply(this, current);
  }

  public Resistivity times(Length length) {
    return ElectroRelations.RESISTANCE_TIMES_LENGTH.apply(this, length);
  }

  /**
   * Returns the conductance of this resistance; a zero resistance has infinite conductance.
   */
  public ElectricalConductance inverse() {
    return ElectricalConductanceUnit.SIEMENS.of(1.0 / to(OHMS));
  }

  public static ParseResult<ElectricalResistance> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static ElectricalResistance ohms(double value) {
    return OHMS.of(value);
  }

  public static ElectricalResistance kilohms(double value) {
    return KILOHMS.of(value);
  }
}
