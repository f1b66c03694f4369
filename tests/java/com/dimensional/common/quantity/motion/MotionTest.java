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

package com.dimensional.common.quantity.motion;

import org.junit.Test;

import com.dimensional.common.quantity.Time;
import com.dimensional.common.quantity.energy.EnergyUnit;
import com.dimensional.common.quantity.mass.Mass;
import com.dimensional.common.quantity.space.Length;

import static org.junit.Assert.assertEquals;

public class MotionTest {

  @Test
  public void testLengthOverTime() {
    assertEquals(Velocity.metersPerSecond(5), Length.meters(10).dividedBy(Time.seconds(2)));
    assertEquals(Length.meters(10), Velocity.metersPerSecond(5).times(Time.seconds(2)));
    assertEquals(Time.seconds(2), Length.meters(10).dividedBy(Velocity.metersPerSecond(5)));
  }

  @Test
  public void testRateIsExpressedPerSecond() {
    assertEquals(Velocity.metersPerSecond(10),
        Length.kilometers(36).dividedBy(Time.hours(1)));
    assertEquals(10.0, Velocity.kilometersPerHour(36).to(VelocityUnit.METERS_PER_SECOND), 1e-9);
  }

  @Test
  public void testDerivativeChain() {
    assertEquals(Acceleration.metersPerSecondSquared(2),
        Velocity.metersPerSecond(10).dividedBy(Time.seconds(5)));
    assertEquals(Velocity.metersPerSecond(10),
        Acceleration.metersPerSecondSquared(2).times(Time.seconds(5)));
    assertEquals(Time.seconds(5),
        Velocity.metersPerSecond(10).dividedBy(Acceleration.metersPerSecondSquared(2)));

    assertEquals(Jerk.metersPerSecondCubed(0.5),
        Acceleration.metersPerSecondSquared(2).dividedBy(Time.seconds(4)));
    assertEquals(Acceleration.metersPerSecondSquared(2),
        Jerk.metersPerSecondCubed(0.5).times(Time.seconds(4)));
  }

  @Test
  public void testNewtonsSecondLaw() {
    assertEquals(Force.newtons(6),
        Mass.kilograms(2).times(Acceleration.metersPerSecondSquared(3)));
    assertEquals(Acceleration.metersPerSecondSquared(3),
        Force.newtons(6).dividedBy(Mass.kilograms(2)));
    assertEquals(Mass.kilograms(2),
        Force.newtons(6).dividedBy(Acceleration.metersPerSecondSquared(3)));
  }

  @Test
  public void testMomentum() {
    assertEquals(Momentum.newtonSeconds(10), Mass.kilograms(2).times(Velocity.metersPerSecond(5)));
    assertEquals(Velocity.metersPerSecond(5),
        Momentum.newtonSeconds(10).dividedBy(Mass.kilograms(2)));
    assertEquals(Mass.kilograms(2),
        Momentum.newtonSeconds(10).dividedBy(Velocity.metersPerSecond(5)));

    assertEquals(Force.newtons(5), Momentum.newtonSeconds(10).dividedBy(Time.seconds(2)));
    assertEquals(Momentum.newtonSeconds(10), Force.newtons(5).times(Time.seconds(2)));
    assertEquals(Time.seconds(2), Momentum.newtonSeconds(10).dividedBy(Force.newtons(5)));
  }

  @Test
  public void testWork() {
    assertEquals(3600.0,
        Force.newtons(10).times(Length.meters(360)).to(EnergyUnit.JOULES), 1e-9);
    assertEquals(1.0,
        Force.newtons(10).times(Length.meters(360)).to(EnergyUnit.WATT_HOURS), 1e-12);
  }

  @Test
  public void testGravity() {
    assertEquals(Acceleration.metersPerSecondSquared(9.80665), Acceleration.earthGravities(1));
    assertEquals(4.4482216152605, Force.poundForce(1).to(ForceUnit.NEWTONS), 0);
    assertEquals(Force.newtons(9.80665), Force.parse("1 kgf").get());
  }
}
