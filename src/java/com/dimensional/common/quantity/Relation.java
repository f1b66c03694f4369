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

/**
 * A declared derived-quantity relationship {@code A op B = C}; eg: {@code Mass * Velocity =
 * Momentum}.
 *
 * <p>The author of a relation names the units the arithmetic is carried out in.  Both operands
 * are converted to their declared units, combined with the operator, and the result is read as
 * an amount of the declared result unit.  Most relations simply use canonical units, but some
 * need a normalizing unit; eg: energy in watt-hours divided by time in hours is power in watts.
 *
 * @param <A> the left operand family
 * @param <B> the right operand family
 * @param <C> the result family
 */
public final class Relation<A extends Quantity<A>, B extends Quantity<B>, C extends Quantity<C>> {

  private final UnitOfMeasure<A> leftUnit;
  private final Operator operator;
  private final UnitOfMeasure<B> rightUnit;
  private final UnitOfMeasure<C> resultUnit;

  private Relation(UnitOfMeasure<A> leftUnit, Operator operator, UnitOfMeasure<B> rightUnit,
      UnitOfMeasure<C> resultUnit) {
    this.leftUnit = Preconditions.checkNotNull(leftUnit);
    this.operator = Preconditions.checkNotNull(operator);
    this.rightUnit = Preconditions.checkNotNull(rightUnit);
    this.resultUnit = Preconditions.checkNotNull(resultUnit);
  }

  /**
   * Declares {@code leftUnit * rightUnit = resultUnit}.
   */
  public static <A extends Quantity<A>, B extends Quantity<B>, C extends Quantity<C>>
      Relation<A, B, C> product(UnitOfMeasure<A> leftUnit, UnitOfMeasure<B> rightUnit,
          UnitOfMeasure<C> resultUnit) {
    return new Relation<A, B, C>(leftUnit, Operator.TIMES, rightUnit, resultUnit);
  }

  /**
   * Declares {@code leftUnit / rightUnit = resultUnit}.
   */
  public static <A extends Quantity<A>, B extends Quantity<B>, C extends Quantity<C>>
      Relation<A, B, C> quotient(UnitOfMeasure<A> leftUnit, UnitOfMeasure<B> rightUnit,
          UnitOfMeasure<C> resultUnit) {
    return new Relation<A, B, C>(leftUnit, Operator.DIVIDED_BY, rightUnit, resultUnit);
  }

  /**
   * Combines two quantities.  Division by a zero quantity follows IEEE-754 and yields an
   * infinite or NaN result rather than failing.
   *
   * @param left the left operand.
   * @param right the right operand.
   * @return the derived quantity.
   */
  public C apply(A left, B right) {
    return resultUnit.of(operator.apply(left.to(leftUnit), right.to(rightUnit)));
  }

  public Dimension<A> left() {
    return leftUnit.dimension();
  }

  public Operator operator() {
    return operator;
  }

  public Dimension<B> right() {
    return rightUnit.dimension();
  }

  public Dimension<C> result() {
    return resultUnit.dimension();
  }

  public UnitOfMeasure<A> leftUnit() {
    return leftUnit;
  }

  public UnitOfMeasure<B> rightUnit() {
    return rightUnit;
  }

  public UnitOfMeasure<C> resultUnit() {
    return resultUnit;
  }

  @Override
  public String toString() {
    return String.format("%s %s %s = %s (%s %s %s = %s)", left(), operator, right(), result(),
        leftUnit.symbol(), operator, rightUnit.symbol(), resultUnit.symbol());
  }
}
