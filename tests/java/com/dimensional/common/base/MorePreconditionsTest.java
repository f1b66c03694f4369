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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class MorePreconditionsTest {

  @Test(expected = NullPointerException.class)
  public void testCheckNotBlankStringNull() {
    MorePreconditions.checkNotBlank((String) null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckNotBlankStringEmpty() {
    MorePreconditions.checkNotBlank("");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckNotBlankWhitespace() {
    MorePreconditions.checkNotBlank("\t\r\n ");
  }

  @Test
  public void testCheckNotBlankStringValid() {
    String argument = new String("kg");
    assertSame(argument, MorePreconditions.checkNotBlank(argument));
  }

  @Test
  public void testCheckNotBlankStringExceptionFormatting() {
    try {
      MorePreconditions.checkNotBlank("", "Unit %s of %s has a blank symbol", "GRAMS", "Mass");
      fail("Expected a blank symbol to be rejected");
    } catch (IllegalArgumentException e) {
      assertEquals("Unit GRAMS of Mass has a blank symbol", e.getMessage());
    }
  }

  @Test
  public void testCheckFinite() {
    assertEquals(42.0, MorePreconditions.checkFinite(42.0, "bad %s"), 0);
    assertEquals(0.0, MorePreconditions.checkFinite(0.0, "bad %s"), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckFiniteNaN() {
    MorePreconditions.checkFinite(Double.NaN, "bad %s");
  }

  @Test
  public void testCheckFiniteExceptionFormatting() {
    try {
      MorePreconditions.checkFinite(Double.POSITIVE_INFINITY, "Invalid display threshold %s");
      fail("Expected infinity to be rejected");
    } catch (IllegalArgumentException e) {
      assertEquals("Invalid display threshold Infinity", e.getMessage());
    }
  }

  @Test
  public void testCheckNonZero() {
    assertEquals(-1e-9, MorePreconditions.checkNonZero(-1e-9, "bad %s"), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckNonZeroZero() {
    MorePreconditions.checkNonZero(0.0, "bad %s");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckNonZeroNegativeZero() {
    MorePreconditions.checkNonZero(-0.0, "bad %s");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckNonZeroInfinite() {
    MorePreconditions.checkNonZero(Double.NEGATIVE_INFINITY, "bad %s");
  }
}
