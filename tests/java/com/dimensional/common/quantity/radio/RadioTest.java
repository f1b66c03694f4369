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

package com.dimensional.common.quantity.radio;

import org.junit.Test;

import com.dimensional.common.quantity.energy.Power;
import com.dimensional.common.quantity.space.Length;
import com.dimensional.common.quantity.space.SolidAngle;

import static org.junit.Assert.assertEquals;

public class RadioTest {

  @Test
  public void testSpectralPower() {
    assertEquals(Power.watts(6), SpectralPower.wattsPerMeter(2).times(Length.meters(3)));
    assertEquals(SpectralPower.wattsPerMeter(2), Power.watts(6).dividedBy(Length.meters(3)));
    assertEquals(Length.meters(3), Power.watts(6).dividedBy(SpectralPower.wattsPerMeter(2)));
  }

  @Test
  public void testRadiantIntensity() {
    assertEquals(Power.watts(6), RadiantIntensity.wattsPerSteradian(3).times(
        SolidAngle.steradians(2)));
    assertEquals(RadiantIntensity.wattsPerSteradian(3),
        Power.watts(6).dividedBy(SolidAngle.steradians(2)));
    assertEquals(SolidAngle.steradians(2),
        Power.watts(6).dividedBy(RadiantIntensity.wattsPerSteradian(3)));
  }

  @Test
  public void testUnits() {
    assertEquals(SpectralPower.wattsPerMeter(0.25), SpectralPower.parse("250 mW/m").get());
    assertEquals(RadiantIntensity.wattsPerSteradian(1.5),
        RadiantIntensity.parse("1500 mW/sr").get());
  }

  @Test
  public void testSolidAngleTimesIntensity() {
    assertEquals(Power.watts(6),
        SolidAngle.steradians(2).times(RadiantIntensity.wattsPerSteradian(3)));
    assertEquals(SolidAngle.steradians(2).times(RadiantIntensity.wattsPerSteradian(3)),
        RadiantIntensity.wattsPerSteradian(3).times(SolidAngle.steradians(2)));
  }
}
