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

package com.dimensional.common.quantity;

/**
 * Metric prefix multipliers for declaring units; eg: {@code linear(MetricSystem.KILO)} for
 * kilograms in a family whose value unit is grams.
 */
public final class MetricSystem {

  public static final double PICO = 1e-12;
  public static final double NANO = 1e-9;
  public static final double MICRO = 1e-6;
  public static final double MILLI = 1e-3;
  public static final double CENTI = 1e-2;
  public static final double DECI = 1e-1;
  public static final double DECA = 1e1;
  public static final double HECTO = 1e2;
  public static final double KILO = 1e3;
  public static final double MEGA = 1e6;
  public static final double GIGA = 1e9;
  public static final double TERA = 1e12;

  private MetricSystem() {
    // constants
  }
}
