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

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Maps;
import com.google.common.collect.Table;

/**
 * An inspectable registry of declared derived-quantity {@link Relation}s.
 *
 * <p>The registry holds exactly what was declared: relations are never inferred transitively,
 * so declaring {@code A / B = C} and {@code C / D = E} says nothing about {@code A / (B * D)}.
 * Declaring the same {@code (left, operator, right)} twice is a programming error detected when
 * the registry is built.
 */
public final class DimensionalAlgebra {

  private static final Logger LOG = Logger.getLogger(DimensionalAlgebra.class.getName());

  private final ImmutableSet<Relation<?, ?, ?>> relations;
  private final Map<Operator, ImmutableTable<Dimension<?>, Dimension<?>, Relation<?, ?, ?>>>
      byOperator;

  private DimensionalAlgebra(Builder builder) {
    this.relations = builder.relations.build();
    this.byOperator = Maps.newEnumMap(Operator.class);
    for (Map.Entry<Operator, Table<Dimension<?>, Dimension<?>, Relation<?, ?, ?>>> entry
        : builder.tables.entrySet()) {
      byOperator.put(entry.getKey(), ImmutableTable.copyOf(entry.getValue()));
    }
  }

  /**
   * Returns every declared relation in declaration order.
   */
  public ImmutableSet<Relation<?, ?, ?>> relations() {
    return relations;
  }

  /**
   * Returns every family that takes part in at least one relation.
   */
  public ImmutableSet<Dimension<?>> dimensions() {
    ImmutableSet.Builder<Dimension<?>> dimensions = ImmutableSet.builder();
    for (Relation<?, ?, ?> relation : relations) {
      dimensions.add(relation.left(), relation.right(), relation.result());
    }
    return dimensions.build();
  }

  /**
   * Looks up the relation declared for {@code left op right}.
   *
   * @return the declared relation, or absent if the combination was never declared.
   */
  public Optional<Relation<?, ?, ?>> resolve(Dimension<?> left, Operator operator,
      Dimension<?> right) {
    return Optional.<Relation<?, ?, ?>>fromNullable(byOperator.get(operator).get(left, right));
  }

  /**
   * Combines two quantities whose families are only known at runtime.
   *
   * @param left the left operand.
   * @param operator the operator to apply.
   * @param right the right operand.
   * @return the derived quantity, or absent if no relation is declared for the operand families.
   */
  public Optional<Quantity<?>> evaluate(Quantity<?> left, Operator operator, Quantity<?> right) {
    Optional<Relation<?, ?, ?>> relation = resolve(left.dimension(), operator, right.dimension());
    if (!relation.isPresent()) {
      LOG.warning(String.format("No relation declared for %s %s %s", left.dimension(), operator,
          right.dimension()));
      return Optional.absent();
    }
    return Optional.<Quantity<?>>of(applyUnchecked(relation.get(), left, right));
  }

  @SuppressWarnings({"unchecked", "rawtypes"}) // Operand families were matched by resolve.
  private static Quantity<?> applyUnchecked(Relation relation, Quantity<?> left,
      Quantity<?> right) {
    return (Quantity<?>) relation.apply(left, right);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Collects relations, rejecting duplicate declarations.
   */
  public static final class Builder {
    private final ImmutableSet.Builder<Relation<?, ?, ?>> relations = ImmutableSet.builder();
    private final EnumMap<Operator, Table<Dimension<?>, Dimension<?>, Relation<?, ?, ?>>> tables =
        Maps.newEnumMap(Operator.class);

    private Builder() {
      for (Operator operator : Operator.values()) {
        tables.put(operator, HashBasedTable.<Dimension<?>, Dimension<?>, Relation<?, ?, ?>>create());
      }
    }

    /**
     * Declares a relation.
     *
     * @throws IllegalArgumentException if a relation for the same operand families and operator
     *     was already declared.
     */
    public Builder declare(Relation<?, ?, ?> relation) {
      Preconditions.checkNotNull(relation);
      Table<Dimension<?>, Dimension<?>, Relation<?, ?, ?>> table = tables.get(relation.operator());
      Relation<?, ?, ?> existing = table.get(relation.left(), relation.right());
      Preconditions.checkArgument(existing == null, "%s conflicts with already declared %s",
          relation, existing);

      table.put(relation.left(), relation.right(), relation);
      relations.add(relation);
      return this;
    }

    /**
     * Declares all three relations of a time-derivative pair.
     */
    public Builder declare(TimeDerivativePair<?, ?> pair) {
      for (Relation<?, ?, ?> relation : pair.relations()) {
        declare(relation);
      }
      return this;
    }

    public Builder declareAll(Iterable<? extends Relation<?, ?, ?>> declared) {
      for (Relation<?, ?, ?> relation : declared) {
        declare(relation);
      }
      return this;
    }

    public DimensionalAlgebra build() {
      DimensionalAlgebra algebra = new DimensionalAlgebra(this);
      LOG.fine("Built algebra of " + algebra.relations.size() + " relations over "
          + algebra.dimensions().size() + " dimensions");
      return algebra;
    }
  }
}
