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

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class UnitConversionTest {

  private static final double EPSILON = 1e-9;

  @Test
  public void testValueIsIdentity() {
    assertEquals(42.5, UnitConversion.VALUE.toCanonical(42.5), 0);
    assertEquals(42.5, UnitConversion.VALUE.fromCanonical(42.5), 0);
    assertEquals(-0.0, UnitConversion.VALUE.toCanonical(-0.0), 0);
  }

  @Test
  public void testLinear() {
    UnitConversion dozens = UnitConversion.linear(12);
    assertEquals(36.0, dozens.toCanonical(3), 0);
    assertEquals(3.0, dozens.fromCanonical(36), 0);
    assertEquals(0.5, dozens.fromCanonical(6), 0);
  }

  @Test
  public void testOffset() {
    UnitConversion celsius = UnitConversion.offset(1.0, 273.15);
    assertEquals(273.15, celsius.toCanonical(0), 0);
    assertEquals(0.0, celsius.fromCanonical(273.15), 0);

    UnitConversion fahrenheit = UnitConversion.offset(5.0 / 9, 459.67);
    assertEquals(273.15, fahrenheit.toCanonical(32), EPSILON);
    assertEquals(212.0, fahrenheit.fromCanonical(373.15), EPSILON);
  }

  @Test
  public void testCustom() {
    UnitConversion squares = new UnitConversion() {
      @Override public double toCanonical(double raw) {
        return raw * raw;
      }

      @Override public double fromCanonical(double canonical) {
        return Math.sqrt(canonical);
      }
    };
    assertEquals(9.0, squares.toCanonical(3), 0);
    assertEquals(3.0, squares.fromCanonical(9), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLinearRejectsZero() {
    UnitConversion.linear(0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLinearRejectsNaN() {
    UnitConversion.linear(Double.NaN);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOffsetRejectsZeroScale() {
    UnitConversion.offset(0, 10);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOffsetRejectsInfiniteOffset() {
    UnitConversion.offset(1, Double.POSITIVE_INFINITY);
  }
}
