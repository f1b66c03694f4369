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

package com.dimensional.common.quantity.space;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SpaceTest {

  @Test
  public void testLength() {
    assertEquals(Length.meters(1000), Length.kilometers(1));
    assertEquals(0.3048, Length.feet(1).to(LengthUnit.METERS), 0);
    assertEquals(5280.0, Length.miles(1).to(LengthUnit.FEET), 1e-9);
  }

  @Test
  public void testLengthDisplay() {
    assertEquals("1.5 km", Length.meters(1500).format());
    assertEquals("2.0 m", Length.meters(2).format());
    assertEquals(LengthUnit.CENTIMETERS, Length.DIMENSION.displayUnit(Length.meters(0.5)));
    assertEquals(LengthUnit.MILLIMETERS, Length.DIMENSION.displayUnit(Length.meters(0.005)));
    assertEquals(LengthUnit.NANOMETERS, Length.DIMENSION.displayUnit(Length.meters(1e-8)));
  }

  @Test
  public void testProducts() {
    assertEquals(Area.squareMeters(6), Length.meters(2).times(Length.meters(3)));
    assertEquals(Volume.cubicMeters(24), Area.squareMeters(6).times(Length.meters(4)));
  }

  @Test
  public void testQuotients() {
    assertEquals(Length.meters(3), Area.squareMeters(6).dividedBy(Length.meters(2)));
    assertEquals(Length.meters(4), Volume.cubicMeters(24).dividedBy(Area.squareMeters(6)));
    assertEquals(Area.squareMeters(6), Volume.cubicMeters(24).dividedBy(Length.meters(4)));
  }

  @Test
  public void testUnitsConvertBeforeApplying() {
    Area area = Length.kilometers(1).times(Length.meters(10));
    assertEquals(Area.squareMeters(10000), area);
    assertEquals(Area.hectares(1), area);
  }

  @Test
  public void testVolume() {
    assertTrue(Volume.litres(1000).approx(Volume.cubicMeters(1), Volume.cubicMeters(1e-12)));
    assertEquals(Volume.litres(2), Volume.parse("2 l").get());
    assertEquals(VolumeUnit.LITRES, Volume.DIMENSION.displayUnit(Volume.litres(2)));
    assertEquals(Volume.litres(2), Volume.parse("2 L").get());
    assertEquals("1.5 m³", Volume.cubicMeters(1.5).format());
  }

  @Test
  public void testSolidAngle() {
    assertEquals(4 * Math.PI,
        SolidAngle.steradians(4 * Math.PI).to(SolidAngleUnit.STERADIANS), 0);
    assertEquals(41252.96, SolidAngle.steradians(4 * Math.PI).to(SolidAngleUnit.SQUARE_DEGREES),
        0.01);
  }
}
