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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

public class TimeTest {

  @Test
  public void testUnits() {
    assertEquals(Time.days(1), Time.hours(24));
    assertEquals(Time.hours(1), Time.minutes(60));
    assertEquals(Time.minutes(1), Time.seconds(60));
    assertEquals(1e9, Time.seconds(1).to(TimeUnit.NANOSECONDS), 1e-3);
  }

  @Test
  public void testConcurrentTimeUnits() {
    assertEquals(Time.milliseconds(5), Time.of(5, java.util.concurrent.TimeUnit.MILLISECONDS));
    assertEquals(Time.hours(2), Time.of(2, java.util.concurrent.TimeUnit.HOURS));
    for (TimeUnit unit : TimeUnit.values()) {
      assertEquals(unit.of(3), Time.of(3, unit.getTimeUnit()));
    }
    assertSame(java.util.concurrent.TimeUnit.DAYS, TimeUnit.DAYS.getTimeUnit());
  }

  @Test
  public void testDisplay() {
    assertEquals("2.0 d", Time.hours(48).format());
    assertEquals("1.5 h", Time.minutes(90).format());
    assertEquals("1.5 min", Time.seconds(90).format());
    assertEquals("59.0 s", Time.seconds(59).format());
    assertEquals("1.0 ms", Time.milliseconds(1).format());
    assertSame(TimeUnit.MICROSECONDS, Time.DIMENSION.displayUnit(Time.nanoseconds(1500)));
    assertSame(TimeUnit.NANOSECONDS, Time.DIMENSION.displayUnit(Time.nanoseconds(999)));
    assertSame(TimeUnit.NANOSECONDS, Time.DIMENSION.displayUnit(Time.seconds(0)));
  }

  @Test
  public void testParse() {
    assertThat(Time.parse("2 h").get(), is(Time.hours(2)));
    assertThat(Time.parse("2 hrs").get(), is(Time.hours(2)));
    assertEquals(Time.minutes(5), Time.parse("5 mins").get());
    assertEquals(Time.seconds(30), Time.parse("30 secs").get());
    assertEquals(Time.days(3), Time.parse("3 days").get());
    assertEquals(Time.parse("10 µs").get(), Time.parse("10 us").get());
  }
}
