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

/**
 * Canonical values are in siemens.
 */
public final class ElectricalConductance extends Quantity<ElectricalConductance> {

  public static final Dimension<ElectricalConductance> DIMENSION =
      Dimension.builder("ElectricalConductance", new Dimension.Factory<ElectricalConductance>() {
        @Override public ElectricalConductance create(double canonical) {
          return new ElectricalConductance(canonical);
        }
      })
      .units(ElectricalConductanceUnit.class)
      .build();

  ElectricalConductance(double siemens) {
    super(siemens);
  }

  @Override
  public Dimension<ElectricalConductance> dimension() {
    return DIMENSION;
  }

  public ElectricCurrent times(ElectricPotential potential) {
    return ElectroRelations.CONDUCTANCE_TIMES_POTENTIAL.apply(this, potential);
  }

  public ElectricalResistance inverse() {
    return ElectricalResistanceUnit.OHMS.of(1.0 / to(ElectricalConductanceUnit.SIEMENS));
  }

  public static ParseResult<ElectricalConductance> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static ElectricalConductance siemens(double value) {
    return ElectricalConductanceUnit.SIEMENS.of(value);
  }
}
