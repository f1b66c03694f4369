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

package com.dimensional.common.base;

import java.util.Comparator;

/**
 * Arithmetic over a value type that is not itself a {@link Number}, allowing generic numeric
 * algorithms (see {@link Numerics}) to sum, scale and order such values.
 *
 * <p>Implementations must be stateless and safe to share; each operation returns a new value.
 *
 * @param <T> the value type the arithmetic operates on
 */
public interface Numeric<T> extends Comparator<T> {

  /**
   * Returns the additive identity.
   */
  T zero();

  /**
   * Returns the value counted as a single unit when converting from and to plain doubles.
   */
  T one();

  T add(T a, T b);

  T subtract(T a, T b);

  /**
   * Scales {@code a} by a dimensionless factor.
   */
  T multiply(T a, double factor);

  /**
   * Returns {@code a} counted in multiples of {@link #one()}.
   */
  double toDouble(T a);

  /**
   * Returns the value that is {@code count} multiples of {@link #one()}.
   */
  T fromDouble(double count);
}
