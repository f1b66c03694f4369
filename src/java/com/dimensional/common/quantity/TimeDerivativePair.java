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

import com.google.common.collect.ImmutableList;

/**
 * Declares that one family is the time-derivative of another; eg: velocity of length.  A single
 * declaration yields the three relations of the pair:
 * <ul>
 *   <li>{@code integral / time = derivative}</li>
 *   <li>{@code derivative * time = integral}</li>
 *   <li>{@code integral / derivative = time}</li>
 * </ul>
 *
 * <p>Families expose these through {@link TimeIntegral} and {@link TimeDerivative}, delegating
 * to the pair.
 *
 * @param <I> the integral family
 * @param <D> the derivative family
 */
public final class TimeDerivativePair<I extends Quantity<I>, D extends Quantity<D>> {

  private final Relation<I, Time, D> derivative;
  private final Relation<D, Time, I> integral;
  private final Relation<I, D, Time> time;

  private TimeDerivativePair(UnitOfMeasure<I> integralUnit, UnitOfMeasure<D> derivativeUnit,
      TimeUnit timeUnit) {
    this.derivative = Relation.quotient(integralUnit, timeUnit, derivativeUnit);
    this.integral = Relation.product(derivativeUnit, timeUnit, integralUnit);
    this.time = Relation.quotient(integralUnit, derivativeUnit, timeUnit);
  }

  /**
   * Declares that one {@code integralUnit} per {@code timeUnit} is one {@code derivativeUnit}.
   *
   * @param integralUnit the unit of the integral family the rate is measured in.
   * @param derivativeUnit the unit of the derivative family.
   * @param timeUnit the time unit the rate is expressed per; eg: hours for watt-hours per watt.
   * @param <I> the integral family.
   * @param <D> the derivative family.
   * @return the declared pair.
   */
  public static <I extends Quantity<I>, D extends Quantity<D>> TimeDerivativePair<I, D> declare(
      UnitOfMeasure<I> integralUnit, UnitOfMeasure<D> derivativeUnit, TimeUnit timeUnit) {
    return new TimeDerivativePair<I, D>(integralUnit, derivativeUnit, timeUnit);
  }

  /**
   * Returns the average rate of change of {@code integral} over {@code time}.
   */
  public D derivative(I integral, Time time) {
    return derivative.apply(integral, time);
  }

  /**
   * Returns the accumulation of {@code derivative} over {@code time}.
   */
  public I integral(D derivative, Time time) {
    return integral.apply(derivative, time);
  }

  /**
   * Returns the time it takes to accumulate {@code integral} at rate {@code derivative}.
   */
  public Time time(I integral, D derivative) {
    return time.apply(integral, derivative);
  }

  public Relation<I, Time, D> derivativeRelation() {
    return derivative;
  }

  public Relation<D, Time, I> integralRelation() {
    return integral;
  }

  public Relation<I, D, Time> timeRelation() {
    return time;
  }

  public ImmutableList<Relation<?, ?, ?>> relations() {
    return ImmutableList.<Relation<?, ?, ?>>of(derivative, integral, time);
  }

  @Override
  public String toString() {
    return "d(" + derivative.left() + ")/dt = " + derivative.result();
  }
}
