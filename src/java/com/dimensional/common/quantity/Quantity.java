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

/**
 * Represents an amount of some physical quantity and facilitates unambiguous communication of
 * amounts.  Every quantity stores a single canonical value: its amount expressed in the
 * {@link Dimension#valueUnit() value unit} of its family.  Instances are created via
 * {@link UnitOfMeasure#of(double)} or by arithmetic on other quantities and are never mutated.
 *
 * <p>Arithmetic, comparison and equality all operate on canonical values, never on display
 * values, and never cross families implicitly.  Cross-family products and quotients are
 * offered by the concrete family types, each backed by a declared {@link Relation}.
 *
 * @param <A> the concrete quantity type
 */
public abstract class Quantity<A extends Quantity<A>> implements Comparable<A> {

  private final double value;

  protected Quantity(double value) {
    this.value = value;
  }

  /**
   * Returns the family this quantity belongs to.
   */
  public abstract Dimension<A> dimension();

  /**
   * Returns the canonical value of this quantity; its amount in {@link #valueUnit()}s.
   */
  public final double value() {
    return value;
  }

  public final UnitOfMeasure<A> valueUnit() {
    return dimension().valueUnit();
  }

  /**
   * Expresses this quantity in the given unit.
   *
   * @param unit the unit to convert to.
   * @return the number of {@code unit}s this quantity amounts to.
   */
  public final double to(UnitOfMeasure<A> unit) {
    return unit.conversion().fromCanonical(value);
  }

  public final A plus(A that) {
    return create(value + that.value());
  }

  public final A minus(A that) {
    return create(value - that.value());
  }

  public final A times(double factor) {
    return create(value * factor);
  }

  public final A dividedBy(double divisor) {
    return create(value / divisor);
  }

  /**
   * Returns the dimensionless ratio of this quantity to another of the same family.
   */
  public final double ratio(A that) {
    return value / that.value();
  }

  public final A negate() {
    return create(-value);
  }

  public final A abs() {
    return create(Math.abs(value));
  }

  public final int signum() {
    return (int) Math.signum(value);
  }

  public final boolean isZero() {
    return value == 0.0;
  }

  public final A min(A that) {
    return compareTo(that) <= 0 ? self() : that;
  }

  public final A max(A that) {
    return compareTo(that) >= 0 ? self() : that;
  }

  /**
   * Tests whether this quantity lies within {@code tolerance} of another.
   *
   * @param that the quantity to compare against.
   * @param tolerance the largest difference still considered equal, in either direction.
   * @return {@code true} if the canonical values differ by no more than the tolerance.
   */
  public final boolean approx(A that, A tolerance) {
    return Math.abs(value - that.value()) <= Math.abs(tolerance.value());
  }

  /**
   * Formats this quantity in the unit its family's display thresholds select.
   */
  public final String format() {
    return format(dimension().displayUnit(self()));
  }

  /**
   * Formats this quantity as {@code "<amount> <symbol>"} in the given unit.
   */
  public final String format(UnitOfMeasure<A> unit) {
    return to(unit) + " " + unit.symbol();
  }

  public final String toString(UnitOfMeasure<A> unit) {
    return format(unit);
  }

  @Override
  public final int compareTo(A that) {
    return Double.compare(normalized(), ((Quantity<A>) that).normalized());
  }

  @Override
  public final int hashCode() {
    return 31 * dimension().hashCode() + Double.valueOf(normalized()).hashCode();
  }

  @Override
  public final boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Quantity<?> other = (Quantity<?>) obj;
    return Double.compare(normalized(), other.normalized()) == 0;
  }

  @Override
  public String toString() {
    return format();
  }

  protected final A create(double canonical) {
    return dimension().fromCanonical(canonical);
  }

  // Folds -0.0 into 0.0 so that equality, ordering and hashing agree.
  private double normalized() {
    return value + 0.0;
  }

  private A self() {
    @SuppressWarnings("unchecked") // A is always the concrete type of this quantity.
    A self = (A) this;
    return self;
  }
}
