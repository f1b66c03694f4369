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

import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.testing.EqualsTester;

import org.junit.Test;

import com.dimensional.common.quantity.information.Information;
import com.dimensional.common.quantity.information.InformationUnit;
import com.dimensional.common.quantity.mass.Mass;
import com.dimensional.common.quantity.mass.MassUnit;
import com.dimensional.common.quantity.space.Length;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class QuantityTest {

  @Test
  public void testEquals() {
    new EqualsTester()
        .addEqualityGroup(Time.days(1), Time.hours(24), Time.minutes(24 * 60))
        .addEqualityGroup(Time.hours(25))
        .addEqualityGroup(Time.seconds(0), Time.seconds(-0.0), Time.days(0))
        .addEqualityGroup(Time.seconds(Double.NaN), Time.seconds(Double.NaN))
        .addEqualityGroup(Length.meters(1))
        .addEqualityGroup(Length.meters(0))
        .testEquals();
  }

  @Test
  public void testFamiliesNeverEqual() {
    assertFalse("quantities of different families should never be equal even if their values are",
        Time.nanoseconds(1).equals(Information.bits(1)));
    assertFalse(Length.meters(0).equals(Time.seconds(0)));
  }

  @Test
  public void testComparisonMixedUnits() {
    assertTrue(Time.minutes(1).compareTo(Time.seconds(59)) > 0);
    assertTrue(Time.minutes(1).compareTo(Time.seconds(60)) == 0);
    assertTrue(Time.minutes(1).compareTo(Time.seconds(61)) < 0);

    assertTrue(Time.seconds(59).compareTo(Time.minutes(1)) < 0);
    assertTrue(Time.seconds(60).compareTo(Time.minutes(1)) == 0);
    assertTrue(Time.seconds(61).compareTo(Time.minutes(1)) > 0);

    assertTrue(Time.seconds(-0.0).compareTo(Time.seconds(0)) == 0);
  }

  @Test
  public void testComparisonNonFinite() {
    Time nan = Time.seconds(Double.NaN);
    Time forever = Time.seconds(Double.POSITIVE_INFINITY);

    assertTrue(nan.compareTo(Time.seconds(Double.NaN)) == 0);
    assertTrue(nan.compareTo(forever) > 0);
    assertTrue(forever.compareTo(Time.days(365)) > 0);
    assertTrue(Time.seconds(Double.NEGATIVE_INFINITY).compareTo(Time.seconds(-0.0)) < 0);
  }

  @Test
  public void testOrderingMixedUnits() {
    assertEquals(
        Lists.newArrayList(
            InformationUnit.BITS.of(1),
            InformationUnit.KB.of(1),
            InformationUnit.MB.of(1),
            InformationUnit.MB.of(1)),
        Ordering.<Information>natural().sortedCopy(Lists.newArrayList(
            InformationUnit.KB.of(1),
            InformationUnit.KB.of(1024),
            InformationUnit.BITS.of(1),
            InformationUnit.MB.of(1))));
  }

  @Test
  public void testConvert() {
    Time duration = Time.minutes(15);
    assertEquals(15 * 60 * 1000, duration.to(TimeUnit.MILLISECONDS), 1e-6);
    assertEquals(0.25, duration.to(TimeUnit.HOURS), 0);
    assertEquals(900.0, duration.value(), 0);
    assertSame(TimeUnit.SECONDS, duration.valueUnit());
  }

  @Test
  public void testArithmetic() {
    assertEquals(Mass.kilograms(1.5), Mass.kilograms(1).plus(Mass.grams(500)));
    assertEquals(Mass.grams(500), Mass.kilograms(1).minus(Mass.grams(500)));
    assertEquals(Mass.kilograms(3), Mass.kilograms(1.5).times(2));
    assertEquals(Mass.grams(250), Mass.kilograms(1).dividedBy(4));
    assertEquals(4.0, Mass.kilograms(2).ratio(Mass.grams(500)), 0);
    assertEquals(Mass.grams(-2), Mass.grams(2).negate());
    assertEquals(Mass.grams(2), Mass.grams(-2).abs());
  }

  @Test
  public void testDivisionByZeroFollowsIeee() {
    assertEquals(Double.POSITIVE_INFINITY, Mass.grams(1).dividedBy(0).value(), 0);
    assertTrue(Double.isNaN(Mass.grams(0).ratio(Mass.grams(0))));
  }

  @Test
  public void testSign() {
    assertEquals(1, Time.seconds(3).signum());
    assertEquals(-1, Time.seconds(-3).signum());
    assertEquals(0, Time.seconds(0).signum());
    assertTrue(Time.seconds(0).isZero());
    assertTrue(Time.seconds(-0.0).isZero());
    assertFalse(Time.nanoseconds(1).isZero());
  }

  @Test
  public void testMinMax() {
    assertEquals(Time.seconds(59), Time.minutes(1).min(Time.seconds(59)));
    assertEquals(Time.minutes(1), Time.minutes(1).max(Time.seconds(59)));
  }

  @Test
  public void testApprox() {
    Mass tolerance = Mass.milligrams(1);
    assertTrue(Mass.grams(1).approx(Mass.grams(1.0005), tolerance));
    assertTrue(Mass.grams(1.0005).approx(Mass.grams(1), tolerance));
    assertFalse(Mass.grams(1).approx(Mass.grams(1.002), tolerance));
  }

  @Test
  public void testFormat() {
    assertEquals("1.5 min", Time.seconds(90).format());
    assertEquals("90.0 s", Time.seconds(90).format(TimeUnit.SECONDS));
    assertEquals("90.0 s", Time.seconds(90).toString(TimeUnit.SECONDS));
    assertEquals("1.5 min", Time.seconds(90).toString());
    assertEquals("1000.0 g", Mass.kilograms(1).format(MassUnit.GRAMS));
  }
}
