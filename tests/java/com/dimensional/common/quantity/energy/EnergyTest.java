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

package com.dimensional.common.quantity.energy;

import org.junit.Test;

import com.dimensional.common.quantity.Time;
import com.dimensional.common.quantity.mass.ChemicalAmount;
import com.dimensional.common.quantity.mass.Mass;
import com.dimensional.common.quantity.mass.MassUnit;
import com.dimensional.common.quantity.space.Volume;
import com.dimensional.common.quantity.space.VolumeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class EnergyTest {

  private static final double EPSILON = 1e-9;

  @Test
  public void testParseAndFormat() {
    Energy energy = Energy.parse("1.5 kWh").get();
    assertEquals(Energy.kilowattHours(1.5), energy);
    assertEquals(1500.0, energy.value(), 0);
    assertEquals("1.5 kWh", energy.format());
  }

  @Test
  public void testDisplayThresholds() {
    assertEquals("1.0 kWh", Energy.wattHours(1000).format());
    assertEquals("999.0 Wh", Energy.wattHours(999).format());
    assertEquals("2.0 GWh", Energy.wattHours(2e9).format());
    assertSame(EnergyUnit.JOULES, Energy.DIMENSION.displayUnit(Energy.wattHours(0.5)));
    assertSame(EnergyUnit.JOULES, Energy.DIMENSION.displayUnit(Energy.joules(10)));
  }

  @Test
  public void testJoules() {
    assertEquals(3600.0, Energy.wattHours(1).to(EnergyUnit.JOULES), EPSILON);
    assertEquals(3.6, Energy.kilowattHours(1).to(EnergyUnit.MEGAJOULES), EPSILON);
    assertEquals(1055.05585262, Energy.parse("1 Btu").get().to(EnergyUnit.JOULES), EPSILON);
    assertEquals(Energy.parse("1 Btu").get(), Energy.parse("1 BTU").get());
  }

  @Test
  public void testPowerOverTime() {
    assertEquals(Power.watts(1500), Energy.kilowattHours(3).dividedBy(Time.hours(2)));
    assertEquals(Energy.wattHours(50), Power.watts(100).times(Time.minutes(30)));
    assertEquals(Time.hours(2), Energy.kilowattHours(3).dividedBy(Power.kilowatts(1.5)));
  }

  @Test
  public void testMolarEnergy() {
    MolarEnergy molar = Energy.joules(100).dividedBy(ChemicalAmount.moles(4));
    assertEquals(25.0, molar.to(MolarEnergyUnit.JOULES_PER_MOLE), EPSILON);
    assertEquals(4.0, Energy.joules(100).dividedBy(MolarEnergy.joulesPerMole(25)).value(),
        EPSILON);
    assertEquals(100.0,
        MolarEnergy.joulesPerMole(25).times(ChemicalAmount.moles(4)).to(EnergyUnit.JOULES),
        EPSILON);
  }

  @Test
  public void testPowerDisplay() {
    assertEquals("1.5 kW", Power.watts(1500).format());
    assertEquals("250.0 W", Power.watts(250).format());
    assertSame(PowerUnit.MILLIWATTS, Power.DIMENSION.displayUnit(Power.watts(0.25)));
  }

  @Test
  public void testDecibelMilliwatts() {
    assertEquals(1.0, Power.decibelMilliwatts(30).to(PowerUnit.WATTS), EPSILON);
    assertEquals(0.001, Power.decibelMilliwatts(0).to(PowerUnit.WATTS), EPSILON);
    assertEquals(30.0, Power.watts(1).to(PowerUnit.DECIBEL_MILLIWATTS), EPSILON);
    assertEquals(-30.0, Power.watts(1e-6).to(PowerUnit.DECIBEL_MILLIWATTS), EPSILON);
    assertTrue(Power.decibelMilliwatts(-10).compareTo(Power.decibelMilliwatts(10)) < 0);
  }

  @Test
  public void testSpecificEnergy() {
    SpecificEnergy dose = Energy.joules(100).dividedBy(Mass.kilograms(4));
    assertEquals(25.0, dose.to(SpecificEnergyUnit.GRAYS), EPSILON);
    assertEquals(4.0, Energy.joules(100).dividedBy(SpecificEnergy.grays(25)).to(MassUnit.KILOGRAMS),
        EPSILON);
    assertEquals(100.0, SpecificEnergy.grays(25).times(Mass.kilograms(4)).to(EnergyUnit.JOULES),
        EPSILON);
    assertEquals(100.0, Mass.kilograms(4).times(SpecificEnergy.grays(25)).to(EnergyUnit.JOULES),
        EPSILON);
    assertEquals(SpecificEnergy.grays(2), SpecificEnergy.parse("2 J/kg").get());
    assertEquals(2.0,
        SpecificEnergy.parse("200 rad").get().to(SpecificEnergyUnit.GRAYS), EPSILON);
  }

  @Test
  public void testEnergyDensity() {
    EnergyDensity density = Energy.joules(600).dividedBy(Volume.cubicMeters(3));
    assertEquals(200.0, density.to(EnergyDensityUnit.JOULES_PER_CUBIC_METER), EPSILON);
    assertEquals(3.0,
        Energy.joules(600).dividedBy(EnergyDensity.joulesPerCubicMeter(200))
            .to(VolumeUnit.CUBIC_METERS),
        EPSILON);
    assertEquals(600.0,
        EnergyDensity.joulesPerCubicMeter(200).times(Volume.cubicMeters(3))
            .to(EnergyUnit.JOULES),
        EPSILON);
  }
}
