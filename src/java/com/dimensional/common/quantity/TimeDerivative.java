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
 * A rate of change over time of another family; eg: velocity, the time-derivative of length.
 * Implementations delegate to a {@link TimeDerivativePair}.
 *
 * @param <I> the time-integral family
 */
public interface TimeDerivative<I extends Quantity<I>> {

  /**
   * Returns the amount accumulated at this rate over {@code time}.
   */
  I times(Time time);
}
