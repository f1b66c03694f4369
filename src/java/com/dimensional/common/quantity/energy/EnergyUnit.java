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

package com.dimensional.common.quantity.energy;

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.MetricSystem;
import com.dimensional.common.quantity.UnitConversion;
import com.dimensional.common.quantity.UnitOfMeasure;

import static com.dimensional.common.quantity.UnitConversion.linear;

/**
 * Units of {@link Energy}.  The value unit is the watt-hour.
 */
public enum EnergyUnit implements UnitOfMeasure<Energy> {
  WATT_HOURS("Wh", UnitConversion.VALUE),
  KILOWATT_HOURS("kWh", linear(MetricSystem.KILO)),
  MEGAWATT_HOURS("MWh", linear(MetricSystem.MEGA)),
  GIGAWATT_HOURS("GWh", linear(MetricSystem.GIGA)),
  JOULES("J", linear(Energy.JOULE)),
  PICOJOULES("pJ", linear(Energy.JOULE * MetricSystem.PICO)),
  NANOJOULES("nJ", linear(Energy.JOULE * MetricSystem.NANO)),
  MICROJOULES("µJ", linear(Energy.JOULE * MetricSystem.MICRO)),
  MILLIJOULES("mJ", linear(Energy.JOULE * MetricSystem.MILLI)),
  KILOJOULES("kJ", linear(Energy.JOULE * MetricSystem.KILO)),
  MEGAJOULES("MJ", linear(Energy.JOULE * MetricSystem.MEGA)),
  GIGAJOULES("GJ", linear(Energy.JOULE * MetricSystem.GIGA)),
  TERAJOULES("TJ", linear(Energy.JOULE * MetricSystem.TERA)),
  BRITISH_THERMAL_UNITS("Btu", linear(Energy.BTU)),
  MBTUS("MBtu", linear(Energy.BTU * MetricSystem.KILO)),
  MMBTUS("MMBtu", linear(Energy.BTU * MetricSystem.MEGA));

  private final String symbol;
  private final UnitConversion conversion;

  private EnergyUnit(String symbol, UnitConversion conversion) {
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
  public Dimension<Energy> dimension() {
    return Energy.DIMENSION;
  }

  @Override
  public Energy of(double value) {
    return new Energy(conversion.toCanonical(value));
  }

  @Override
  public String toString() {
    return symbol;
  }
}
