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

package com.dimensional.common.quantity.thermal;

import org.junit.Test;

import com.dimensional.common.quantity.energy.EnergyUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TemperatureTest {

  private static final double EPSILON = 1e-9;

  @Test
  public void testScales() {
    assertEquals(Temperature.kelvin(273.15), Temperature.celsius(0));
    assertEquals(0.0, Temperature.kelvin(273.15).to(TemperatureUnit.CELSIUS), 0);
    assertEquals(212.0, Temperature.celsius(100).to(TemperatureUnit.FAHRENHEIT), EPSILON);
    assertEquals(0.0, Temperature.fahrenheit(32).to(TemperatureUnit.CELSIUS), EPSILON);
    assertEquals(-40.0, Temperature.celsius(-40).to(TemperatureUnit.FAHRENHEIT), EPSILON);
    assertEquals(491.67, Temperature.celsius(0).to(TemperatureUnit.RANKINE), EPSILON);
  }

  @Test
  public void testComparesAbsolute() {
    assertTrue(Temperature.celsius(1).compareTo(Temperature.fahrenheit(33)) > 0);
    assertTrue(Temperature.celsius(-273.15).isZero());
  }

  @Test
  public void testParse() {
    assertEquals(Temperature.celsius(20), Temperature.parse("20 °C").get());
    assertEquals(Temperature.celsius(20), Temperature.parse("20 C").get());
    assertEquals(Temperature.fahrenheit(-5), Temperature.parse("-5 °F").get());
    assertEquals(Temperature.kelvin(300), Temperature.parse("300K").get());
  }

  @Test
  public void testDisplay() {
    assertEquals("300.0 K", Temperature.kelvin(300).format());
    assertEquals("0.0 °C", Temperature.celsius(0).format(TemperatureUnit.CELSIUS));
  }

  @Test
  public void testHeat() {
    assertEquals(100.0, ThermalCapacity.joulesPerKelvin(2).times(Temperature.kelvin(50))
        .to(EnergyUnit.JOULES), EPSILON);
    assertEquals(100.0, Temperature.kelvin(50).times(ThermalCapacity.joulesPerKelvin(2))
        .to(EnergyUnit.JOULES), EPSILON);
    assertEquals(2.0, EnergyUnit.JOULES.of(100).dividedBy(Temperature.kelvin(50))
        .to(ThermalCapacityUnit.JOULES_PER_KELVIN), EPSILON);
    assertEquals(50.0, EnergyUnit.JOULES.of(100).dividedBy(ThermalCapacity.joulesPerKelvin(2))
        .to(TemperatureUnit.KELVIN), EPSILON);
  }
}
