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

/**
 * Units of {@link Information}.  The kilo/mega/giga/... hierarchy is built on base 2 so that the
 * hierarchy increases by a factor of 1024 instead of 1000 as typical in metric units.
 * Additionally, units are divided in 2 hierarchies one based on bits and the other on bytes.
 * Thus {@link #Kb} represents kilobits; so 1 Kb = 1024 bits, and {@link #KB} represents
 * kilobytes so 1 KB = 1024 bytes or 8192 bits.  The value unit is the bit.
 */
public enum InformationUnit implements UnitOfMeasure<Information> {
  BITS("b"),
  Kb(1024, BITS),
  Mb(1024, Kb),
  Gb(1024, Mb),
  BYTES(8, BITS, "B"),
  KB(1024, BYTES),
  MB(1024, KB),
  GB(1024, MB),
  TB(1024, GB),
  PB(1024, TB);

  private final String symbol;
  private final double multiplier;
  private final UnitConversion conversion;

  private InformationUnit(String symbol) {
    this.symbol = symbol;
    this.multiplier = 1;
    this.conversion = UnitConversion.VALUE;
  }

  private InformationUnit(double multiplier, InformationUnit base, String symbol) {
    this.symbol = symbol;
    this.multiplier = multiplier * base.multiplier;
    this.conversion = UnitConversion.linear(this.multiplier);
  }

  private InformationUnit(double multiplier, InformationUnit base) {
    this(multiplier, base, null);
  }

  @Override
  public String symbol() {
    return symbol == null ? name() : symbol;
  }

  @Override
  public UnitConversion conversion() {
    return conversion;
  }

  @Override
  public Dimension<Information> dimension() {
    return Information.DIMENSION;
  }

  @Override
  public Information of(double value) {
    return new Information(conversion.toCanonical(value));
  }

  @Override
  public String toString() {
    return symbol();
  }
}
