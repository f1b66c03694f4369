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

import com.google.common.collect.ImmutableList;

import com.dimensional.common.quantity.Relation;

import static com.dimensional.common.quantity.space.AreaUnit.SQUARE_METERS;
import static com.dimensional.common.quantity.space.LengthUnit.METERS;
import static com.dimensional.common.quantity.space.VolumeUnit.CUBIC_METERS;

/**
 * Relations between lengths, areas and volumes.
 */
public final class SpaceRelations {

  public static final Relation<Length, Length, Area> LENGTH_TIMES_LENGTH =
      Relation.product(METERS, METERS, SQUARE_METERS);

  public static final Relation<Area, Length, Volume> AREA_TIMES_LENGTH =
      Relation.product(SQUARE_METERS, METERS, CUBIC_METERS);

  public static final Relation<Area, Length, Length> AREA_OVER_LENGTH =
      Relation.quotient(SQUARE_METERS, METERS, METERS);

  public static final Relation<Volume, Area, Length> VOLUME_OVER_AREA =
      Relation.quotient(CUBIC_METERS, SQUARE_METERS, METERS);

  public static final Relation<Volume, Length, Area> VOLUME_OVER_LENGTH =
      Relation.quotient(CUBIC_METERS, METERS, SQUARE_METERS);

  public static final ImmutableList<Relation<?, ?, ?>> ALL = ImmutableList.<Relation<?, ?, ?>>of(
      LENGTH_TIMES_LENGTH,
      AREA_TIMES_LENGTH,
      AREA_OVER_LENGTH,
      VOLUME_OVER_AREA,
      VOLUME_OVER_LENGTH);

  private SpaceRelations() {
    // relations
  }
}
