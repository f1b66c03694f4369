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

import com.google.common.base.Preconditions;

import com.dimensional.common.base.Numeric;

/**
 * Adapts a quantity family to {@link Numeric} so that generic algorithms can sum, average and
 * sort quantities.  The adapter is bound to an explicit reference unit that backs
 * {@link #one()} and the double conversions; addition, subtraction and ordering work on
 * canonical values and so are exact regardless of the units the inputs were created in.
 *
 * @param <A> the type of quantity adapted
 */
public final class QuantityNumeric<A extends Quantity<A>> implements Numeric<A> {

  private final UnitOfMeasure<A> referenceUnit;

  private QuantityNumeric(UnitOfMeasure<A> referenceUnit) {
    this.referenceUnit = Preconditions.checkNotNull(referenceUnit);
  }

  /**
   * Creates an adapter whose {@link #one()} is a single {@code referenceUnit}.
   */
  public static <A extends Quantity<A>> QuantityNumeric<A> of(UnitOfMeasure<A> referenceUnit) {
    return new QuantityNumeric<A>(referenceUnit);
  }

  public UnitOfMeasure<A> referenceUnit() {
    return referenceUnit;
  }

  /**
   * Returns the quantity with a canonical value of zero.
   */
  @Override
  public A zero() {
    return referenceUnit.dimension().fromCanonical(0.0);
  }

  @Override
  public A one() {
    return referenceUnit.of(1.0);
  }

  @Override
  public A add(A a, A b) {
    return a.plus(b);
  }

  @Override
  public A subtract(A a, A b) {
    return a.minus(b);
  }

  @Override
  public A multiply(A a, double factor) {
    return a.times(factor);
  }

  @Override
  public double toDouble(A a) {
    return a.to(referenceUnit);
  }

  @Override
  public A fromDouble(double count) {
    return referenceUnit.of(count);
  }

  @Override
  public int compare(A a, A b) {
    return a.compareTo(b);
  }

  @Override
  public String toString() {
    return "Numeric[" + referenceUnit.dimension() + " in " + referenceUnit.symbol() + "]";
  }
}
