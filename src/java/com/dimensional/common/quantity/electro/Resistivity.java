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

/**
 * Electrical resistivity of a material.  Canonical values are in ohm-meters.
 */
public final class Resistivity extends Quantity<Resistivity> {

  public static final Dimension<Resistivity> DIMENSION =
      Dimension.builder("Resistivity", new Dimension.Factory<Resistivity>() {
        @Override public Resistivity create(double canonical) {
          return new Resistivity(canonical);
        }
      })
      .units(ResistivityUnit.class)
      .build();

  Resistivity(double ohmMeters) {
    super(ohmMeters);
  }

  @Override
  public Dimension<Resistivity> dimension() {
    return DIMENSION;
  }

  public ElectricalResistance dividedBy(Length length) {
    return ElectroRelations.RESISTIVITY_OVER_LENGTH.apply(this, length);
  }

  public Length dividedBy(ElectricalResistance resistance) {
    return ElectroRelations.RESISTIVITY_OVER_RESISTANCE.apply(this, resistance);
  }

  public static ParseResult<Resistivity> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Resistivity ohmMeters(double value) {
    return ResistivityUnit.OHM_METERS.of(value);
  }
}
