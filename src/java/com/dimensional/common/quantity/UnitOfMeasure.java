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
 * Represents a unit of a given quantity family; eg: kilograms for mass.  Units are typically
 * declared as enum constants, one enum per family, and serve as the factories for quantities.
 *
 * @param <A> the type of quantity this unit measures
 */
public interface UnitOfMeasure<A extends Quantity<A>> {

  /**
   * Returns the symbol used to display and parse amounts of this unit.  Symbols are unique within
   * a family.
   */
  String symbol();

  /**
   * Returns the conversion between raw values in this unit and canonical values.
   */
  UnitConversion conversion();

  /**
   * Returns the family this unit belongs to.
   */
  Dimension<A> dimension();

  /**
   * Creates a quantity of {@code value} of this unit.
   *
   * @param value the number of units the returned quantity should hold.
   * @return a quantity holding the canonical equivalent of {@code value}.
   */
  A of(double value);
}
