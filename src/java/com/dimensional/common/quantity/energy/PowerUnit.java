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
 * Units of {@link Power}.  The value unit is the watt.
 *
 * <p>{@link #DECIBEL_MILLIWATTS} is logarithmic: 0 dBm is one milliwatt and every 10 dBm is a
 * tenfold increase.
 */
public enum PowerUnit implements UnitOfMeasure<Power> {
  MILLIWATTS("mW", linear(MetricSystem.MILLI)),
  WATTS("W", UnitConversion.VALUE),
  KILOWATTS("kW", linear(MetricSystem.KILO)),
  MEGAWATTS("MW", linear(MetricSystem.MEGA)),
  GIGAWATTS("GW", linear(MetricSystem.GIGA)),
  BTUS_PER_HOUR("Btu/hr", linear(Energy.BTU)),
  DECIBEL_MILLIWATTS("dBm", new UnitConversion() {
    @Override public double toCanonical(double dbm) {
      return Math.pow(10, dbm / 10) * MetricSystem.MILLI;
    }

    @Override public double fromCanonical(double watts) {
      return 10 * Math.log10(watts / MetricSystem.MILLI);
    }

    @Override public String toString() {
      return "10^(x / 10) mW";
    }
  });

  private final String symbol;
  private final UnitConversion conversion;

  private PowerUnit(String symbol, UnitConversion conversion) {
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
  public Dimension<Power> dimension() {
    return Power.DIMENSION;
  }

  @Override
  public Power of(double value) {
    return new Power(conversion.toCanonical(value));
  }

  @Override
  public String toString() {
    return symbol;
  }
}
