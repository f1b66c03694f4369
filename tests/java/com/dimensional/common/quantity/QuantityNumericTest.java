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

import com.dimensional.common.quantity.mass.Mass;
import com.dimensional.common.quantity.mass.MassUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class QuantityNumericTest {

  private final QuantityNumeric<Mass> kilograms = QuantityNumeric.of(MassUnit.KILOGRAMS);

  @Test
  public void testIdentities() {
    assertTrue(kilograms.zero().isZero());
    assertEquals(Mass.kilograms(1), kilograms.one());
    assertSame(MassUnit.KILOGRAMS, kilograms.referenceUnit());
  }

  @Test
  public void testArithmetic() {
    assertEquals(Mass.kilograms(1.5), kilograms.add(Mass.kilograms(1), Mass.grams(500)));
    assertEquals(Mass.grams(500), kilograms.subtract(Mass.kilograms(1), Mass.grams(500)));
    assertEquals(Mass.kilograms(3), kilograms.multiply(Mass.kilograms(1.5), 2));
  }

  @Test
  public void testDoubles() {
    assertEquals(1.5, kilograms.toDouble(Mass.grams(1500)), 0);
    assertEquals(Mass.grams(2500), kilograms.fromDouble(2.5));
  }

  @Test
  public void testCompare() {
    assertTrue(kilograms.compare(Mass.kilograms(1), Mass.grams(999)) > 0);
    assertTrue(kilograms.compare(Mass.kilograms(1), Mass.grams(1000)) == 0);
    assertTrue(kilograms.compare(Mass.grams(-1), Mass.grams(0)) < 0);
  }

  @Test
  public void testToString() {
    assertEquals("Numeric[Mass in kg]", kilograms.toString());
  }
}
