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
 * A quantity whose rate of change over time is another family; eg: length, whose
 * time-derivative is velocity.  Implementations delegate to a {@link TimeDerivativePair}.
 *
 * @param <D> the time-derivative family
 */
public interface TimeIntegral<D extends Quantity<D>> {

  /**
   * Returns the average rate of change that accumulates this quantity over {@code time}.
   */
  D dividedBy(Time time);

  /**
   * Returns the time needed to accumulate this quantity at the given rate.
   */
  Time dividedBy(D derivative);
}
