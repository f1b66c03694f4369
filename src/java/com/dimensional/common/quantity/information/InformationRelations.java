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

package com.dimensional.common.quantity.information;

import com.dimensional.common.quantity.TimeDerivativePair;

import static com.dimensional.common.quantity.TimeUnit.SECONDS;
import static com.dimensional.common.quantity.information.DataRateUnit.BITS_PER_SECOND;
import static com.dimensional.common.quantity.information.InformationUnit.BITS;

/**
 * Data rate as the time-derivative of information.
 */
public final class InformationRelations {

  public static final TimeDerivativePair<Information, DataRate> INFORMATION_DATA_RATE =
      TimeDerivativePair.declare(BITS, BITS_PER_SECOND, SECONDS);

  private InformationRelations() {
    // relations
  }
}
