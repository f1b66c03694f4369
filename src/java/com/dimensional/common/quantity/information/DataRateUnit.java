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

package com.dimensional.common.quantity.information;

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.UnitConversion;
import com.dimensional.common.quantity.UnitOfMeasure;

import static com.dimensional.common.quantity.UnitConversion.linear;

/**
 * Units of {@link DataRate}.  The value unit is the bit per second; prefixed units are binary, like those of {@link InformationUnit}.
 */
public enum DataRateUnit implements UnitOfMeasure<DataRate> {
  BITS_PER_SECOND("bps", UnitConversion.VALUE),
  KILOBITS_PER_SECOND("Kbps", linear(1024.0)),
  MEGABITS_PER_SECOND("Mbps", linear(1024.0 * 1024)),
  GIGABITS_PER_SECOND("Gbps", linear(1024.0 * 1024 * 1024)),
  BYTES_PER_SECOND("B/s", linear(8.0)),
  KILOBYTES_PER_SECOND("KB/s", linear(8.0 * 1024)),
  MEGABYTES_PER_SECOND("MB/s", linear(8.0 * 1024 * 1024)),
  GIGABYTES_PER_SECOND("GB/s", linear(8.0 * 1024 * 1024 * 1024));

  private final String symbol;
  private final UnitConversion conversion;

  private DataRateUnit(String symbol, UnitConversion conversion) {
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
  public Dimension<DataRate> dimension() {
    return DataRate.DIMENSION;
  }

  @Override
  public DataRate of(double value) {
    return new DataRate(conversion.toCanonical(value));
  }

  @Override
  public String toString() {
    return symbol;
  }
}
