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

package com.dimensional.common.quantity.catalog;

import java.util.Set;

import com.google.common.collect.Sets;

import org.junit.Test;

import com.dimensional.common.quantity.Dimension;
import com.dimensional.common.quantity.DimensionalAlgebra;
import com.dimensional.common.quantity.Operator;
import com.dimensional.common.quantity.Quantity;
import com.dimensional.common.quantity.Relation;
import com.dimensional.common.quantity.Time;
import com.dimensional.common.quantity.UnitConversion;
import com.dimensional.common.quantity.UnitOfMeasure;
import com.dimensional.common.quantity.energy.Energy;
import com.dimensional.common.quantity.energy.Power;
import com.dimensional.common.quantity.motion.Velocity;
import com.dimensional.common.quantity.space.Length;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class StandardCatalogTest {

  private static final double[] SAMPLES = {-12.5, 0.0, 0.75, 3.0, 1234.5};

  @Test
  public void testFamilies() {
    Set<String> names = Sets.newHashSet();
    for (Dimension<?> dimension : StandardCatalog.dimensions()) {
      assertTrue("Duplicate family " + dimension, names.add(dimension.name()));
    }
    assertEquals(32, names.size());
  }

  @Test
  public void testEveryFamilyHasOneValueUnit() {
    for (Dimension<?> dimension : StandardCatalog.dimensions()) {
      checkValueUnit(dimension);
    }
  }

  @Test
  public void testUnitsRoundTrip() {
    for (Dimension<?> dimension : StandardCatalog.dimensions()) {
      checkRoundTrip(dimension);
    }
  }

  @Test
  public void testFormattedQuantitiesParse() {
    for (Dimension<?> dimension : StandardCatalog.dimensions()) {
      checkFormatParse(dimension);
    }
  }

  @Test
  public void testRelationsOnlyReferenceCatalogFamilies() {
    DimensionalAlgebra algebra = StandardCatalog.algebra();
    assertFalse(algebra.relations().isEmpty());
    assertTrue(StandardCatalog.dimensions().containsAll(algebra.dimensions()));
    for (Relation<?, ?, ?> relation : algebra.relations()) {
      assertSame(relation, algebra.resolve(relation.left(), relation.operator(),
          relation.right()).get());
    }
  }

  @Test
  public void testAlgebra() {
    DimensionalAlgebra algebra = StandardCatalog.algebra();
    assertSame(Power.DIMENSION,
        algebra.resolve(Energy.DIMENSION, Operator.DIVIDED_BY, Time.DIMENSION).get().result());
    assertEquals(Velocity.metersPerSecond(5),
        algebra.evaluate(Length.meters(10), Operator.DIVIDED_BY, Time.seconds(2)).get());
    assertFalse(algebra.resolve(Velocity.DIMENSION, Operator.TIMES, Velocity.DIMENSION)
        .isPresent());
    assertSame(algebra, StandardCatalog.algebra());
  }

  private static <A extends Quantity<A>> void checkValueUnit(Dimension<A> dimension) {
    int valueUnits = 0;
    for (UnitOfMeasure<A> unit : dimension.units()) {
      assertSame(unit + " belongs to " + dimension, dimension, unit.dimension());
      if (unit.conversion() == UnitConversion.VALUE) {
        valueUnits++;
        assertSame(unit, dimension.valueUnit());
      }
    }
    assertEquals(dimension + " value units", 1, valueUnits);
  }

  private static <A extends Quantity<A>> void checkRoundTrip(Dimension<A> dimension) {
    for (UnitOfMeasure<A> unit : dimension.units()) {
      for (double sample : SAMPLES) {
        A quantity = unit.of(sample);
        String context = dimension + " " + sample + " " + unit.symbol();
        assertEquals(context, unit.conversion().toCanonical(sample), quantity.value(), 0);
        assertEquals(context, sample, quantity.to(unit), tolerance(sample));
        assertEquals(context, quantity, dimension.fromCanonical(quantity.value()));
      }
    }
  }

  private static <A extends Quantity<A>> void checkFormatParse(Dimension<A> dimension) {
    for (UnitOfMeasure<A> unit : dimension.units()) {
      A quantity = unit.of(3.0);
      A parsed = dimension.parse(quantity.format(unit)).get();
      assertEquals(quantity.format(unit), quantity.value(), parsed.value(),
          tolerance(quantity.value()));
      assertSame(dimension, parsed.dimension());
    }
  }

  private static double tolerance(double expected) {
    return 1e-9 * Math.max(1.0, Math.abs(expected));
  }
}
