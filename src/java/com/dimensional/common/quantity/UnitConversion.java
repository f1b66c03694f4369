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

import com.dimensional.common.base.MorePreconditions;

/**
 * Converts raw values expressed in some unit to and from the canonical value of the unit's
 * quantity family.  Conversions are plain double arithmetic; no rounding is ever applied.
 *
 * <p>Most units are {@link #linear(double) linear}.  Scales with an offset, such as temperature,
 * use {@link #offset(double, double)}, and anything else may subclass this type and supply both
 * directions explicitly.
 */
public abstract class UnitConversion {

  /**
   * The identity conversion of a family's canonical unit.  Exactly one unit per family converts
   * with this instance.
   */
  public static final UnitConversion VALUE = new Linear(1.0) {
    @Override public String toString() {
      return "value";
    }
  };

  /**
   * Converts a raw value in this unit to the canonical value.
   */
  public abstract double toCanonical(double raw);

  /**
   * Converts a canonical value to a raw value in this unit.
   */
  public abstract double fromCanonical(double canonical);

  /**
   * Creates a conversion where {@code canonical = raw * multiplier}.
   *
   * @param multiplier the weight of one unit in canonical units.
   * @return a linear conversion.
   * @throws IllegalArgumentException if the multiplier is zero, NaN or infinite.
   */
  public static UnitConversion linear(double multiplier) {
    return new Linear(multiplier);
  }

  /**
   * Creates a conversion where {@code canonical = (raw + offset) * scale}.
   *
   * @param scale the weight of one unit step in canonical units.
   * @param offset the raw amount added before scaling.
   * @return an affine conversion.
   * @throws IllegalArgumentException if the scale is zero or either argument is not finite.
   */
  public static UnitConversion offset(final double scale, final double offset) {
    MorePreconditions.checkNonZero(scale, "Invalid conversion scale %s");
    MorePreconditions.checkFinite(offset, "Invalid conversion offset %s");
    return new UnitConversion() {
      @Override public double toCanonical(double raw) {
        return (raw + offset) * scale;
      }

      @Override public double fromCanonical(double canonical) {
        return canonical / scale - offset;
      }

      @Override public String toString() {
        return String.format("(x + %s) * %s", offset, scale);
      }
    };
  }

  private static class Linear extends UnitConversion {
    private final double multiplier;

    Linear(double multiplier) {
      this.multiplier = MorePreconditions.checkNonZero(multiplier, "Invalid unit multiplier %s");
    }

    @Override public double toCanonical(double raw) {
      return raw * multiplier;
    }

    @Override public double fromCanonical(double canonical) {
      return canonical / multiplier;
    }

    @Override public String toString() {
      return "x * " + multiplier;
    }
  }
}
