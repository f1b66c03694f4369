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

package com.dimensional.common.quantity;

import com.google.common.base.Optional;

import org.junit.Test;

import com.dimensional.common.quantity.motion.Kinematics;
import com.dimensional.common.quantity.motion.Velocity;
import com.dimensional.common.quantity.space.Area;
import com.dimensional.common.quantity.space.AreaUnit;
import com.dimensional.common.quantity.space.Length;
import com.dimensional.common.quantity.space.LengthUnit;
import com.dimensional.common.quantity.space.SpaceRelations;
import com.dimensional.common.quantity.space.Volume;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class DimensionalAlgebraTest {

  @Test
  public void testResolve() {
    DimensionalAlgebra algebra = DimensionalAlgebra.builder()
        .declareAll(SpaceRelations.ALL)
        .build();

    Optional<Relation<?, ?, ?>> relation =
        algebra.resolve(Length.DIMENSION, Operator.TIMES, Length.DIMENSION);
    assertTrue(relation.isPresent());
    assertSame(SpaceRelations.LENGTH_TIMES_LENGTH, relation.get());
    assertSame(Area.DIMENSION, relation.get().result());

    assertFalse(algebra.resolve(Length.DIMENSION, Operator.DIVIDED_BY, Length.DIMENSION)
        .isPresent());
    assertFalse(algebra.resolve(Area.DIMENSION, Operator.TIMES, Area.DIMENSION).isPresent());
  }

  @Test
  public void testNoTransitiveInference() {
    DimensionalAlgebra algebra = DimensionalAlgebra.builder()
        .declare(SpaceRelations.LENGTH_TIMES_LENGTH)
        .declare(SpaceRelations.AREA_TIMES_LENGTH)
        .build();

    assertTrue(algebra.resolve(Area.DIMENSION, Operator.TIMES, Length.DIMENSION).isPresent());
    assertFalse("operand order matters unless both orders are declared",
        algebra.resolve(Length.DIMENSION, Operator.TIMES, Area.DIMENSION).isPresent());
    assertFalse(algebra.resolve(Volume.DIMENSION, Operator.DIVIDED_BY, Length.DIMENSION)
        .isPresent());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateDeclaration() {
    DimensionalAlgebra.builder()
        .declare(SpaceRelations.LENGTH_TIMES_LENGTH)
        .declare(Relation.product(LengthUnit.FEET, LengthUnit.FEET, AreaUnit.SQUARE_FEET));
  }

  @Test
  public void testDeclarePair() {
    DimensionalAlgebra algebra = DimensionalAlgebra.builder()
        .declare(Kinematics.LENGTH_VELOCITY)
        .build();

    assertEquals(3, algebra.relations().size());
    assertEquals(Kinematics.LENGTH_VELOCITY.relations().asList(),
        algebra.relations().asList());
    assertTrue(algebra.dimensions().contains(Time.DIMENSION));
    assertTrue(algebra.dimensions().contains(Length.DIMENSION));
    assertTrue(algebra.dimensions().contains(Velocity.DIMENSION));
    assertEquals(3, algebra.dimensions().size());
  }

  @Test
  public void testEvaluate() {
    DimensionalAlgebra algebra = DimensionalAlgebra.builder()
        .declareAll(SpaceRelations.ALL)
        .declare(Kinematics.LENGTH_VELOCITY)
        .build();

    Optional<Quantity<?>> area =
        algebra.evaluate(Length.meters(2), Operator.TIMES, Length.meters(3));
    assertEquals(Optional.<Quantity<?>>of(Area.squareMeters(6)), area);

    Optional<Quantity<?>> velocity =
        algebra.evaluate(Length.meters(10), Operator.DIVIDED_BY, Time.seconds(2));
    assertEquals(Optional.<Quantity<?>>of(Velocity.metersPerSecond(5)), velocity);

    assertFalse(algebra.evaluate(Time.seconds(2), Operator.TIMES, Time.seconds(2)).isPresent());
  }

  @Test
  public void testRelationDescriptions() {
    assertEquals("*", Operator.TIMES.toString());
    assertEquals("/", Operator.DIVIDED_BY.toString());
    assertEquals("Length / Time = Velocity (m / s = m/s)",
        Kinematics.LENGTH_VELOCITY.derivativeRelation().toString());
    assertEquals("d(Length)/dt = Velocity", Kinematics.LENGTH_VELOCITY.toString());
  }
}
