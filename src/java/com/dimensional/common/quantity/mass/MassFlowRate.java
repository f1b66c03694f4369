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

package com.dimensional.common.quantity.mass;

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.ParseResult;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.Time;
import com.dimensional.common.quantity.TimeDerivative;

/**
 * Canonical values are in kilograms per second.
 */
public final class MassFlowRate extends Quantity<MassFlowRate> implements TimeDerivative<Mass> {

  public static final Dimension<MassFlowRate> DIMENSION =
      Dimension.builder("MassFlowRate", new Dimension.Factory<MassFlowRate>() {
        @Override public MassFlowRate create(double canonical) {
          return new MassFlowRate(canonical);
        }
      })
      .units(MassFlowRateUnit.class)
      .build();

  MassFlowRate(double kilogramsPerSecond) {
    super(kilogramsPerSecond);
  }

  @Override
  public Dimension<MassFlowRate> dimension() {
    return DIMENSION;
  }

  @Override
  public Mass times(Time time) {
    return MassRelations.MASS_FLOW.integral(this, time);
  }

  public static ParseResult<MassFlowRate> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static MassFlowRate kilogramsPerSecond(double value) {
    return MassFlowRateUnit.KILOGRAMS_PER_SECOND.of(value);
  }

  public static MassFlowRate kilogramsPerHour(double value) {
    return MassFlowRateUnit.KILOGRAMS_PER_HOUR.of(value);
  }
}
