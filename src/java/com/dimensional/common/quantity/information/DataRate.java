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
import com.dimensional.common.quantity.TimeDerivative;

/**
 * Canonical values are in bits per second.
 */
public final class DataRate extends Quantity<DataRate> implements TimeDerivative<Information> {

  public static final Dimension<DataRate> DIMENSION =
      Dimension.builder("DataRate", new Dimension.Factory<DataRate>() {
        @Override public DataRate create(double canonical) {
          return new DataRate(canonical);
        }
      })
      .units(DataRateUnit.class)
      .build();

  DataRate(double bitsPerSecond) {
    super(bitsPerSecond);
  }

  @Override
  public Dimension<DataRate> dimension() {
    return DIMENSION;
  }

  @Override
  public Information times(Time time) {
    return InformationRelations.INFORMATION_DATA_RATE.integral(this, time);
  }

  public static ParseResult<DataRate> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static DataRate bitsPerSecond(double value) {
    return DataRateUnit.BITS_PER_SECOND.of(value);
  }

  public static DataRate megabitsPerSecond(double value) {
    return DataRateUnit.MEGABITS_PER_SECOND.of(value);
  }
}
