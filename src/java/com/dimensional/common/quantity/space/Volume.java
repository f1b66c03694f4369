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

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.ParseResult;
import com.dimensional.common.quantity.Quantity;

/**
 * A three-dimensional extent.  Canonical values are in cubic meters.
 */
public final class Volume extends Quantity<Volume> {

  public static final Dimension<Volume> DIMENSION =
      Dimension.builder("Volume", new Dimension.Factory<Volume>() {
        @Override public Volume create(double canonical) {
          return new Volume(canonical);
        }
      })
      .units(VolumeUnit.class)
      .alias("l", VolumeUnit.LITRES)
      .alias("ml", VolumeUnit.MILLILITRES)
      .display(1.0, VolumeUnit.CUBIC_METERS)
      .display(1.0, VolumeUnit.LITRES)
      .displayFallback(VolumeUnit.MILLILITRES)
      .build();

  Volume(double cubicMeters) {
    super(cubicMeters);
  }

  @Override
  public Dimension<Volume> dimension() {
    return DIMENSION;
  }

  public Length dividedBy(Area area) {
    return SpaceRelations.VOLUME_OVER_AREA.apply(this, area);
  }

  public Area dividedBy(Length length) {
    return SpaceRelations.VOLUME_OVER_LENGTH.apply(this, length);
  }

  public static ParseResult<Volume> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Volume cubicMeters(double value) {
    return VolumeUnit.CUBIC_METERS.of(value);
  }

  public static Volume litres(double value) {
    return VolumeUnit.LITRES.of(value);
  }
}
