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

import java.util.Iterator;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;

/**
 * Generic numeric algorithms that work on any value type with a {@link Numeric} instance.
 */
public final class Numerics {

  private Numerics() {
    // utility
  }

  /**
   * Sums the given values, returning {@link Numeric#zero()} for an empty sequence.
   *
   * @param numeric the arithmetic to sum with.
   * @param values the values to sum.
   * @param <T> the value type.
   * @return the sum of all {@code values}.
   */
  public static <T> T sum(Numeric<T> numeric, Iterable<? extends T> values) {
    Preconditions.checkNotNull(numeric);
    Preconditions.checkNotNull(values);

    T total = numeric.zero();
    for (T value : values) {
      total = numeric.add(total, value);
    }
    return total;
  }

  /**
   * Calculates the arithmetic mean of a non-empty sequence of values.
   *
   * @param numeric the arithmetic to average with.
   * @param values the values to average.
   * @param <T> the value type.
   * @return the mean of {@code values}.
   * @throws IllegalArgumentException if {@code values} is empty.
   */
  public static <T> T mean(Numeric<T> numeric, Iterable<? extends T> values) {
    int count = Iterables.size(values);
    Preconditions.checkArgument(count > 0, "Cannot average an empty sequence");
    return numeric.multiply(sum(numeric, values), 1.0 / count);
  }

  /**
   * Finds the largest of a non-empty sequence of values.
   */
  public static <T> T max(Numeric<T> numeric, Iterable<? extends T> values) {
    return extreme(numeric, values, 1);
  }

  /**
   * Finds the smallest of a non-empty sequence of values.
   */
  public static <T> T min(Numeric<T> numeric, Iterable<? extends T> values) {
    return extreme(numeric, values, -1);
  }

  /**
   * Returns a copy of {@code values} sorted in ascending order.
   */
  public static <T> List<T> sortedCopy(Numeric<T> numeric, Iterable<? extends T> values) {
    Ordering<T> ordering = Ordering.from(numeric);
    return ordering.sortedCopy(Lists.<T>newArrayList(values));
  }

  private static <T> T extreme(Numeric<T> numeric, Iterable<? extends T> values, int direction) {
    Iterator<? extends T> iterator = values.iterator();
    Preconditions.checkArgument(iterator.hasNext(), "Sequence must not be empty");

    T best = iterator.next();
    while (iterator.hasNext()) {
      T candidate = iterator.next();
      if (Integer.signum(numeric.compare(candidate, best)) == direction) {
        best = candidate;
      }
    }
    return best;
  }
}
