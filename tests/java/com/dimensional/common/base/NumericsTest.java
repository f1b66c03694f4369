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

package com.dimensional.common.base;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.junit.Test;

import com.dimensional.common.quantity.QuantityNumeric;
import com.dimensional.common.quantity.mass.Mass;
import com.dimensional.common.quantity.mass.MassUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class NumericsTest {

  private static final Numeric<Mass> KILOGRAMS = QuantityNumeric.of(MassUnit.KILOGRAMS);

  @Test
  public void testSum() {
    assertEquals(Mass.kilograms(1.5),
        Numerics.sum(KILOGRAMS, ImmutableList.of(Mass.kilograms(1), Mass.grams(500))));
  }

  @Test
  public void testSumEmpty() {
    Mass sum = Numerics.sum(KILOGRAMS, ImmutableList.<Mass>of());
    assertTrue(sum.isZero());
    assertEquals(KILOGRAMS.zero(), sum);
  }

  @Test
  public void testMean() {
    assertEquals(Mass.kilograms(1.5),
        Numerics.mean(KILOGRAMS, ImmutableList.of(Mass.kilograms(1), Mass.kilograms(2))));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMeanEmpty() {
    Numerics.mean(KILOGRAMS, ImmutableList.<Mass>of());
  }

  @Test
  public void testExtremes() {
    List<Mass> masses = ImmutableList.of(Mass.grams(900), Mass.kilograms(1), Mass.grams(-3));
    assertEquals(Mass.kilograms(1), Numerics.max(KILOGRAMS, masses));
    assertEquals(Mass.grams(-3), Numerics.min(KILOGRAMS, masses));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMaxEmpty() {
    Numerics.max(KILOGRAMS, ImmutableList.<Mass>of());
  }

  @Test
  public void testSortedCopy() {
    assertEquals(
        ImmutableList.of(Mass.milligrams(1), Mass.grams(1), Mass.kilograms(1), Mass.tonnes(1)),
        Numerics.sortedCopy(KILOGRAMS, ImmutableList.of(
            Mass.kilograms(1), Mass.tonnes(1), Mass.milligrams(1), Mass.grams(1))));
  }

  @Test
  public void testSortedCopyLeavesInputAlone() {
    List<Mass> masses = Lists.newArrayList(Mass.tonnes(2), Mass.grams(3), Mass.kilograms(1));
    Iterable<? extends Mass> view = masses;

    List<Mass> sorted = Numerics.sortedCopy(KILOGRAMS, view);
    assertEquals(ImmutableList.of(Mass.grams(3), Mass.kilograms(1), Mass.tonnes(2)), sorted);
    assertEquals(ImmutableList.of(Mass.tonnes(2), Mass.grams(3), Mass.kilograms(1)), masses);

    sorted.add(Mass.grams(1));
    assertEquals(3, masses.size());
  }
}
