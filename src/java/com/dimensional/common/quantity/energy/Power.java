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

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.ParseResult;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.Time;
import com.dimensional.common.quantity.TimeDerivative;
import com.dimensional.common.quantity.electro.ElectricCurrent;
import com.dimensional.common.quantity.electro.ElectricPotential;
import com.dimensional.common.quantity.electro.ElectroRelations;
import com.dimensional.common.quantity.radio.RadiantIntensity;
import com.dimensional.common.quantity.radio.RadioRelations;
import com.dimensional.common.quantity.radio.SpectralPower;
import com.dimensional.common.quantity.space.Length;
import com.dimensional.common.quantity.space.SolidAngle;

import static com.dimensional.common.quantity.energy.PowerUnit.DECIBEL_MILLIWATTS;
import static com.dimensional.common.quantity.energy.PowerUnit.GIGAWATTS;
import static com.dimensional.common.quantity.energy.PowerUnit.KILOWATTS;
import static com.dimensional.common.quantity.energy.PowerUnit.MEGAWATTS;
import static com.dimensional.common.quantity.energy.PowerUnit.MILLIWATTS;
import static com.dimensional.common.quantity.energy.PowerUnit.WATTS;

/**
 * Canonical values are in watts.
 */
public final class Power extends Quantity<Power> implements TimeDerivative<Energy> {

  public static final Dimension<Power> DIMENSION =
      Dimension.builder("Power", new Dimension.Factory<Power>() {
        @Override public Power create(double canonical) {
          return new Power(canonical);
        }
      })
      .units(PowerUnit.class)
      .display(1.0, GIGAWATTS)
      .display(1.0, MEGAWATTS)
      .display(1.0, KILOWATTS)
      .display(1.0, WATTS)
      .displayFallback(MILLIWATTS)
      .build();

  Power(double watts) {
    super(watts);
  }

  @Override
  public Dimension<Power> dimension() {
    return DIMENSION;
  }

  @Override
  public Energy times(Time time) {
    return EnergyRelations.ENERGY_POWER.integral(this, time);
  }

  public ElectricPotential dividedBy(ElectricCurrent current) {
    return ElectroRelations.POWER_OVER_CURRENT.apply(this, current);
  }

  public ElectricCurrent dividedBy(ElectricPotential potential) {
    return ElectroRelations.POWER_OVER_POTENTIAL.apply(this, potential);
  }

  public SpectralPower dividedBy(Length length) {
    return RadioRelations.POWER_OVER_LENGTH.apply(this, length);
  }

  public Length dividedBy(SpectralPower spectralPower) {
    return RadioRelations.POWER_OVER_SPECTRAL_POWER.apply(this, spectralPower);
  }

  public RadiantIntensity dividedBy(SolidAngle solidAngle) {
    return RadioRelations.POWER_OVER_SOLID_ANGLE.apply(this, solidAngle);
  }

  public SolidAngle dividedBy(RadiantIntensity intensity) {
    return RadioRelations.POWER_OVER_RADIANT_INTENSITY.apply(this, intensity);
  }

  public static ParseResult<Power> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Power watts(double value) {
    return WATTS.of(value);
  }

  public static Power kilowatts(double value) {
    return KILOWATTS.of(value);
  }

  public static Power decibelMilliwatts(double value) {
    return DECIBEL_MILLIWATTS.of(value);
  }
}
