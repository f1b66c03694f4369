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

import com.google.common.base.Function;
import com.google.common.base.Optional;

import org.junit.Test;

import com.dimensional.common.quantity.energy.Power;
import com.dimensional.common.quantity.energy.PowerUnit;
import com.dimensional.common.quantity.mass.Mass;
import com.dimensional.common.quantity.mass.MassUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class QuantityParserTest {

  @Test
  public void testParse() {
    assertEquals(Mass.milligrams(12), Mass.parse("12 mg").get());
    assertEquals(Mass.kilograms(3.5), Mass.parse("3.5 kg").get());
    assertEquals(Mass.grams(-2), Mass.parse("-2 g").get());
    assertEquals(Mass.grams(0.5), Mass.parse(".5 g").get());
    assertEquals(Mass.grams(7), Mass.parse("+7 g").get());
  }

  @Test
  public void testSpacing() {
    assertEquals(Mass.milligrams(12), Mass.parse("12mg").get());
    assertEquals(Mass.milligrams(12), Mass.parse("12   mg").get());
    assertEquals(Mass.kilograms(3.5), Mass.parse("  3.5 kg\t").get());
  }

  @Test
  public void testExponent() {
    assertEquals(Mass.grams(1000), Mass.parse("1e3 g").get());
    assertEquals(Mass.grams(1.0E-10), Mass.parse("1.0E-10 g").get());
    assertEquals(Mass.grams(2.5E7), Mass.parse("2.5E+7 g").get());
  }

  @Test
  public void testLongestSymbolWins() {
    assertEquals(Mass.milligrams(5), Mass.parse("5 mg").get());
    assertEquals(MassUnit.MICROGRAMS.of(5), Mass.parse("5 mcg").get());
  }

  @Test
  public void testAlias() {
    assertEquals(Mass.tonnes(1.5), Mass.parse("1.5 tonnes").get());
    assertEquals(Mass.tonnes(1.5), Mass.parse("1.5 t").get());
  }

  @Test
  public void testFormattedValuesParse() {
    for (Mass mass : new Mass[] {
        Mass.grams(1234.5), Mass.grams(1.0E-10), Mass.grams(-3), Mass.grams(6.02E23)}) {
      assertEquals(mass, Mass.parse(mass.format(MassUnit.GRAMS)).get());
    }
  }

  @Test
  public void testNonFiniteValuesParse() {
    Power zero = Power.watts(0);
    assertEquals("-Infinity dBm", zero.format(PowerUnit.DECIBEL_MILLIWATTS));
    assertEquals(zero, Power.parse(zero.format(PowerUnit.DECIBEL_MILLIWATTS)).get());

    Power negative = Power.watts(-1);
    assertEquals("NaN dBm", negative.format(PowerUnit.DECIBEL_MILLIWATTS));
    assertTrue(Power.parse("NaN dBm").isSuccess());

    Power unbounded = Power.watts(1).dividedBy(0);
    assertEquals("Infinity GW", unbounded.format());
    assertEquals(unbounded, Power.parse(unbounded.format()).get());
    assertEquals(Power.watts(Double.NEGATIVE_INFINITY), Power.parse("-Infinity W").get());
    assertEquals(Mass.grams(Double.NaN), Mass.parse("NaN g").get());
  }

  @Test
  public void testFailures() {
    assertFailure("12 xyz");
    assertFailure("12 KG");
    assertFailure("kg");
    assertFailure("12");
    assertFailure("");
    assertFailure("   ");
    assertFailure("12 kg extra");
    assertFailure("1,000 g");
    assertFailure("12 kg 3 g");
    assertFailure("Inf g");
    assertFailure("-NaN g");
  }

  @Test
  public void testFailureDetails() {
    ParseError error = Mass.parse("12 xyz").getError();
    assertEquals("12 xyz", error.input());
    assertEquals("Mass", error.dimensionName());
    assertEquals("Unable to parse 12 xyz as Mass", error.message());
    assertEquals("Unable to parse 12 xyz as Mass", error.toString());
  }

  @Test
  public void testNull() {
    ParseResult<Mass> result = Mass.parse(null);
    assertTrue(result.isFailure());
    assertNull(result.getError().input());
    assertEquals("Mass", result.getError().dimensionName());
  }

  @Test
  public void testGetOrThrow() {
    assertEquals(Mass.grams(5), Mass.parse("5 g").getOrThrow());
    try {
      Mass.parse("5 lightyears").getOrThrow();
      fail("Expected an unparseable mass to throw");
    } catch (QuantityParseException e) {
      assertEquals("Unable to parse 5 lightyears as Mass", e.getMessage());
      assertEquals("5 lightyears", e.getError().input());
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testGetOnFailure() {
    Mass.parse("nope").get();
  }

  @Test(expected = IllegalStateException.class)
  public void testGetErrorOnSuccess() {
    Mass.parse("5 g").getError();
  }

  @Test
  public void testResultCombinators() {
    ParseResult<Mass> success = Mass.parse("5 g");
    ParseResult<Mass> failure = Mass.parse("5 q");

    assertEquals(Optional.of(Mass.grams(5)), success.toOptional());
    assertEquals(Optional.<Mass>absent(), failure.toOptional());
    assertEquals(Mass.grams(5), success.or(Mass.grams(1)));
    assertEquals(Mass.grams(1), failure.or(Mass.grams(1)));

    Function<Mass, Double> inKilograms = new Function<Mass, Double>() {
      @Override public Double apply(Mass mass) {
        return mass.to(MassUnit.KILOGRAMS);
      }
    };
    assertEquals(ParseResult.success(0.005), success.transform(inKilograms));
    ParseResult<Double> transformedFailure = failure.transform(inKilograms);
    assertTrue(transformedFailure.isFailure());
    assertSame(failure.getError(), transformedFailure.getError());

    assertEquals(success, Mass.parse("5 g"));
    assertFalse(success.equals(failure));
    assertEquals("Success(5.0 g)", success.toString());
    assertEquals("Failure(Unable to parse 5 q as Mass)", failure.toString());
  }

  private static void assertFailure(String raw) {
    ParseResult<Mass> result = Mass.parse(raw);
    assertTrue("Expected failure parsing '" + raw + "', got " + result, result.isFailure());
    assertFalse(result.isSuccess());
  }
}
