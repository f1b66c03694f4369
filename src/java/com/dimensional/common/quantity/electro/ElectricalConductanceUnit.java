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
 * Units of {@link ElectricalConductance}.  The value unit is the siemens.
 */
public enum ElectricalConductanceUnit implements UnitOfMeasure<ElectricalConductance> {
  MICROSIEMENS("µS", linear(MetricSystem.MICRO)),
  MILLISIEMENS("mS", linear(MetricSystem.MILLI)),
  SIEMENS("S", UnitConversion.VALUE),
  KILOSIEMENS("kS", linear(MetricSystem.KILO));

  private final String symbol;
  private final UnitConversion conversion;

  private ElectricalConductanceUnit(String symbol, UnitConversion conversion) {
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
  public Dimension<ElectricalConductance> dimension() {
    return ElectricalConductance.DIMENSION;
  }

  @Override
  public ElectricalConductance of(double value) {
    return new ElectricalConductance(conversion.toCanonical(value));
  }

  @Override
  public String toString() {
    return symbol;
  }
}
