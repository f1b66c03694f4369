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

import org.junit.Test;

import com.dimensional.common.quantity.Time;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

public class InformationTest {

  @Test
  public void testUnits() {
    assertEquals(Information.bits(8192), InformationUnit.KB.of(1));
    assertEquals(Information.bits(1024), InformationUnit.Kb.of(1));
    assertEquals(Information.bytes(1024), InformationUnit.KB.of(1));
    assertEquals(InformationUnit.GB.of(1), InformationUnit.MB.of(1024));
    assertEquals(1.0, InformationUnit.PB.of(1).to(InformationUnit.TB) / 1024, 0);
  }

  @Test
  public void testSymbols() {
    assertThat(InformationUnit.BITS.symbol(), is("b"));
    assertThat(InformationUnit.BYTES.symbol(), is("B"));
    assertThat(InformationUnit.KB.symbol(), is("KB"));
    assertThat(InformationUnit.Mb.symbol(), is("Mb"));
    assertThat(InformationUnit.KB.toString(), is("KB"));
  }

  @Test
  public void testParseIsCaseSensitive() {
    assertEquals(InformationUnit.Mb.of(10), Information.parse("10 Mb").get());
    assertEquals(InformationUnit.MB.of(10), Information.parse("10 MB").get());
    assertEquals(Information.bytes(3), Information.parse("3 bytes").get());
    assertEquals(Information.bits(3), Information.parse("3 bits").get());
    assertEquals(Information.bits(3), Information.parse("3 b").get());
  }

  @Test
  public void testDisplay() {
    assertEquals("1.5 KB", Information.bytes(1536).format());
    assertEquals("2.0 B", Information.bits(16).format());
    assertEquals("4.0 b", Information.bits(4).format());
    assertSame(InformationUnit.GB, Information.DIMENSION.displayUnit(InformationUnit.GB.of(3)));
  }

  @Test
  public void testDataRate() {
    assertEquals(DataRateUnit.BYTES_PER_SECOND.of(1000),
        Information.bytes(1000).dividedBy(Time.seconds(1)));
    assertEquals(DataRate.bitsPerSecond(8000), Information.bytes(1000).dividedBy(Time.seconds(1)));
    assertEquals(InformationUnit.Mb.of(8), DataRate.megabitsPerSecond(1).times(Time.seconds(8)));
    assertEquals(Time.seconds(8),
        InformationUnit.Mb.of(8).dividedBy(DataRate.megabitsPerSecond(1)));
    assertEquals(DataRate.bitsPerSecond(8 * 1024), DataRate.parse("1 KB/s").get());
  }
}
