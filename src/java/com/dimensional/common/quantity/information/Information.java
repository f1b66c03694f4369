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
import com.dimensional.common.quantity.ParseResult;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.Time;
import com.dimensional.common.quantity.TimeIntegral;

import static com.dimensional.common.quantity.information.InformationUnit.BITS;
import static com.dimensional.common.quantity.information.InformationUnit.BYTES;
import static com.dimensional.common.quantity.information.InformationUnit.GB;
import static com.dimensional.common.quantity.information.InformationUnit.KB;
import static com.dimensional.common.quantity.information.InformationUnit.MB;
import static com.dimensional.common.quantity.information.InformationUnit.PB;
import static com.dimensional.common.quantity.information.InformationUnit.TB;

/**
 * An amount of data.  Canonical values are in bits; by default amounts display in the largest
 * byte unit that amounts to at least one, or else in bits.
 */
public final class Information extends Quantity<Information> implements TimeIntegral<DataRate> {

  public static final Dimension<Information> DIMENSION =
      Dimension.builder("Information", new Dimension.Factory<Information>() {
        @Override public Information create(double canonical) {
          return new Information(canonical);
        }
      })
      .units(InformationUnit.class)
      .alias("bits", BITS)
      .alias("bytes", BYTES)
      .display(1.0, PB)
      .display(1.0, TB)
      .display(1.0, GB)
      .display(1.0, MB)
      .display(1.0, KB)
      .display(1.0, BYTES)
      .displayFallback(BITS)
      .build();

  Information(double bits) {
    super(bits);
  }

  @Override
  public Dimension<Information> dimension() {
    return DIMENSION;
  }

  @Override
  public DataRate dividedBy(Time time) {
    return InformationRelations.INFORMATION_DATA_RATE.derivative(this, time);
  }

  @Override
  public Time dividedBy(DataRate rate) {
    return InformationRelations.INFORMATION_DATA_RATE.time(this, rate);
  }

  public static ParseResult<Information> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Information bits(double value) {
    return BITS.of(value);
  }

  public static Information bytes(double value) {
    return BYTES.of(value);
  }
}
