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
 * A two-dimensional extent.  Canonical values are in square meters.
 */
public final class Area extends Quantity<Area> {

  public static final Dimension<Area> DIMENSION =
      Dimension.builder("Area", new Dimension.Factory<Area>() {
        @Override public Area create(double canonical) {
          return new Area(canonical);
        }
      })
      .units(AreaUnit.class)
      .build();

  Area(double squareMeters) {
    super(squareMeters);
  }

  @Override
  public Dimension<Area> dimension() {
    return DIMENSION;
  }

  public Volume times(Length length) {
    return SpaceRelations.AREA_TIMES_LENGTH.apply(this, length);
  }

  public Length dividedBy(Length length) {
    return SpaceRelations.AREA_OVER_LENGTH.apply(this, length);
  }

  public static ParseResult<Area> parse(String raw) {
    return DIMENSION.parse(raw);
  }

  public static Area squareMeters(double value) {
    return AreaUnit.SQUARE_METERS.of(value);
  }

  public static Area hectares(double value) {
    return AreaUnit.HECTARES.of(value);
  }
}
