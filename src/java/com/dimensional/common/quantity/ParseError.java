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

import javax.annotation.Nullable;

import com.google.common.base.Objects;

/**
 * Describes why a string could not be parsed as a quantity.
 */
public final class ParseError {
  @Nullable private final String input;
  private final String dimensionName;
  private final String message;

  public ParseError(@Nullable String input, String dimensionName, String message) {
    this.input = input;
    this.dimensionName = dimensionName;
    this.message = message;
  }

  /**
   * Returns the text that failed to parse, exactly as given.
   */
  @Nullable
  public String input() {
    return input;
  }

  /**
   * Returns the name of the quantity family the text was parsed as.
   */
  public String dimensionName() {
    return dimensionName;
  }

  public String message() {
    return message;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof ParseError)) {
      return false;
    }
    ParseError other = (ParseError) o;
    return Objects.equal(input, other.input)
        && dimensionName.equals(other.dimensionName)
        && message.equals(other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(input, dimensionName, message);
  }

  @Override
  public String toString() {
    return message;
  }
}
