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
import com.dimensional.common.quantity.MetricSystem;
import com.dimensional.common.quantity.UnitConversion;
import com.dimensional.common.quantity.UnitOfMeasure;

import static com.dimensional.common.quantity.UnitConversion.linear;

/**
 * Units of {@link ElectricCharge}.  The value unit is the coulomb.
 */
public enum ElectricChargeUnit implements UnitOfMeasure<ElectricCharge> {
  PICOCOULOMBS("pC", linear(MetricSystem.PICO)),
  NANOCOULOMBS("nC", linear(MetricSystem.NANO)),
  MICROCOULOMBS("µC", linear(MetricSystem.MICRO)),
  MILLICOULOMBS("mC", linear(MetricSystem.MILLI)),
  COULOMBS("C", UnitConversion.VALUE),
  MILLIAMPERE_HOURS("mAh", linear(3.6)),
  AMPERE_HOURS("Ah", linear(3600.0));

  private final String symbol;
  private final UnitConversion conversion;

  private ElectricChargeUnit(String symbol, UnitConversion conversion) {
    this.symbol = symbol;
    this.conversion = conversion;
  }

  @Override
  public String symbol() {
    return symbol;
  }

  @Override
  public UnitConversion conversion() {
    return conversion;
  }

  @Override
  public Dimension<ElectricCharge> dimension() {
    return ElectricCharge.DIMENSION;
  }

  @Override
  public ElectricCharge of(double value) {
    return new ElectricCharge(conversion.toCanonical(value));
  }

  @Override
  public String toString() {
    return symbol;
  }
}
