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

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import com.dimensional.common.base.MorePreconditions;

/**
 * Describes a quantity family: its name, its units, the one value unit canonical amounts are
 * stored in, and the ordered threshold table used to pick a unit for display.
 *
 * <p>Dimensions are immutable and validated when built; a malformed declaration (no value unit,
 * two value units, a repeated symbol) is a programming error and fails fast during class
 * initialization of the family that declares it.
 *
 * @param <A> the type of quantity in this family
 */
public final class Dimension<A extends Quantity<A>> {

  private static final Logger LOG = Logger.getLogger(Dimension.class.getName());

  /**
   * Creates quantities of a family from canonical values.
   *
   * @param <A> the type of quantity created
   */
  public interface Factory<A extends Quantity<A>> {
    A create(double canonical);
  }

  /**
   * An entry of a display threshold table: {@link #unit()} is chosen for display when a
   * quantity's magnitude in that unit is at least {@link #minimum()}.
   *
   * @param <A> the type of quantity displayed
   */
  public static final class DisplayThreshold<A extends Quantity<A>> {
    private final double minimum;
    private final UnitOfMeasure<A> unit;

    DisplayThreshold(double minimum, UnitOfMeasure<A> unit) {
      this.minimum = minimum;
      this.unit = unit;
    }

    public double minimum() {
      return minimum;
    }

    public UnitOfMeasure<A> unit() {
      return unit;
    }

    boolean selects(A quantity) {
      return Math.abs(quantity.to(unit)) >= minimum;
    }

    @Override
    public String toString() {
      return ">= " + minimum + " " + unit.symbol();
    }
  }

  private final String name;
  private final Factory<A> factory;
  private final ImmutableList<UnitOfMeasure<A>> units;
  private final UnitOfMeasure<A> valueUnit;
  private final ImmutableMap<String, UnitOfMeasure<A>> symbols;
  private final ImmutableList<DisplayThreshold<A>> displayThresholds;
  private final UnitOfMeasure<A> displayFallback;
  private final QuantityParser<A> parser;

  private Dimension(Builder<A> builder, UnitOfMeasure<A> valueUnit) {
    this.name = builder.name;
    this.factory = builder.factory;
    this.units = ImmutableList.copyOf(builder.units);
    this.valueUnit = valueUnit;
    this.symbols = ImmutableMap.copyOf(builder.symbols);
    this.displayThresholds = ImmutableList.copyOf(builder.displayThresholds);
    this.displayFallback = builder.displayFallback == null ? valueUnit : builder.displayFallback;
    this.parser = new QuantityParser<A>(name, symbols);
  }

  public String name() {
    return name;
  }

  public ImmutableList<UnitOfMeasure<A>> units() {
    return units;
  }

  /**
   * Returns the canonical unit all quantities of this family store their amounts in.
   */
  public UnitOfMeasure<A> valueUnit() {
    return valueUnit;
  }

  /**
   * Returns every symbol and alias recognized when parsing, mapped to its unit.
   */
  public ImmutableMap<String, UnitOfMeasure<A>> symbols() {
    return symbols;
  }

  public Optional<UnitOfMeasure<A>> unit(String symbol) {
    return Optional.fromNullable(symbols.get(symbol));
  }

  public ImmutableList<DisplayThreshold<A>> displayThresholds() {
    return displayThresholds;
  }

  /**
   * Selects the unit a quantity is displayed in by default: the first threshold entry, in
   * declaration order, whose minimum the quantity's magnitude reaches, or the fallback unit if
   * none does.
   *
   * @param quantity the quantity to display.
   * @return the unit to display {@code quantity} in.
   */
  public UnitOfMeasure<A> displayUnit(A quantity) {
    for (DisplayThreshold<A> threshold : displayThresholds) {
      if (threshold.selects(quantity)) {
        return threshold.unit();
      }
    }
    return displayFallback;
  }

  /**
   * Creates a quantity directly from a canonical value.  Together with {@link Quantity#value()}
   * this round-trips any double exactly.
   */
  public A fromCanonical(double canonical) {
    return factory.create(canonical);
  }

  /**
   * Parses a string of the form {@code "<number> <symbol>"} into a quantity of this family.
   *
   * @param raw the text to parse.
   * @return the parsed quantity, or an error describing why {@code raw} could not be parsed.
   */
  public ParseResult<A> parse(String raw) {
    return parser.parse(raw);
  }

  @Override
  public String toString() {
    return name;
  }

  /**
   * Starts the declaration of a quantity family.
   *
   * @param name the family name used in messages, eg: {@code "Mass"}.
   * @param factory creates quantities of the family from canonical values.
   * @param <A> the type of quantity in the family.
   * @return a builder to declare units, aliases and display thresholds with.
   */
  public static <A extends Quantity<A>> Builder<A> builder(String name, Factory<A> factory) {
    return new Builder<A>(name, factory);
  }

  /**
   * Collects the units of a family and validates them on {@link #build()}.
   *
   * @param <A> the type of quantity in the family
   */
  public static final class Builder<A extends Quantity<A>> {
    private final String name;
    private final Factory<A> factory;
    private final List<UnitOfMeasure<A>> units = Lists.newArrayList();
    private final Map<String, UnitOfMeasure<A>> symbols = Maps.newLinkedHashMap();
    private final List<DisplayThreshold<A>> displayThresholds = Lists.newArrayList();
    private UnitOfMeasure<A> displayFallback;

    private Builder(String name, Factory<A> factory) {
      this.name = MorePreconditions.checkNotBlank(name);
      this.factory = Preconditions.checkNotNull(factory);
    }

    /**
     * Adds every constant of a unit enum, in declaration order.
     */
    public <E extends Enum<E> & UnitOfMeasure<A>> Builder<A> units(Class<E> unitType) {
      for (E unit : unitType.getEnumConstants()) {
        unit(unit);
      }
      return this;
    }

    public Builder<A> unit(UnitOfMeasure<A> unit) {
      Preconditions.checkNotNull(unit);
      Preconditions.checkArgument(!units.contains(unit), "%s declared twice in %s", unit, name);
      units.add(unit);
      return symbol(unit.symbol(), unit);
    }

    /**
     * Registers an additional symbol that parses to {@code unit}, eg: {@code "tonnes"}.
     */
    public Builder<A> alias(String alias, UnitOfMeasure<A> unit) {
      Preconditions.checkArgument(units.contains(unit), "Alias %s targets unknown unit %s of %s",
          alias, unit, name);
      return symbol(alias, unit);
    }

    /**
     * Appends an entry to the display threshold table.  Entries are evaluated in the order they
     * are declared, so larger units should come first.
     */
    public Builder<A> display(double minimum, UnitOfMeasure<A> unit) {
      MorePreconditions.checkFinite(minimum, "Invalid display threshold %s");
      Preconditions.checkArgument(units.contains(unit), "Display unit %s is not a unit of %s",
          unit, name);
      displayThresholds.add(new DisplayThreshold<A>(minimum, unit));
      return this;
    }

    /**
     * Sets the unit used for display when no threshold matches; defaults to the value unit.
     */
    public Builder<A> displayFallback(UnitOfMeasure<A> unit) {
      Preconditions.checkArgument(units.contains(unit), "Display unit %s is not a unit of %s",
          unit, name);
      displayFallback = unit;
      return this;
    }

    public Dimension<A> build() {
      Preconditions.checkState(!units.isEmpty(), "%s declares no units", name);

      List<UnitOfMeasure<A>> valueUnits = Lists.newArrayList();
      for (UnitOfMeasure<A> unit : units) {
        if (unit.conversion() == UnitConversion.VALUE) {
          valueUnits.add(unit);
        }
      }
      Preconditions.checkState(!valueUnits.isEmpty(), "%s declares no value unit", name);
      Preconditions.checkState(valueUnits.size() == 1, "%s declares more than one value unit: %s",
          name, valueUnits);

      Dimension<A> dimension = new Dimension<A>(this, valueUnits.get(0));
      LOG.fine(String.format("Declared %s in %s with units [%s]", name, dimension.valueUnit,
          Joiner.on(", ").join(dimension.symbols.keySet())));
      return dimension;
    }

    private Builder<A> symbol(String symbol, UnitOfMeasure<A> unit) {
      MorePreconditions.checkNotBlank(symbol, "Unit %s of %s has a blank symbol", unit, name);
      Preconditions.checkArgument(!symbols.containsKey(symbol), "Symbol %s used twice in %s",
          symbol, name);
      symbols.put(symbol, unit);
      return this;
    }
  }
}
