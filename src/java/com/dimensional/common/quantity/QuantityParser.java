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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Ordering;

/**
 * Parses {@code "<number> <symbol>"} strings into quantities of one family.
 *
 * <p>Symbols are matched exactly (case sensitively) against the family's symbols and aliases,
 * longest first so that a symbol is never shadowed by one of its suffixes; eg: {@code "mg"} is
 * tried before {@code "g"}.
 *
 * @param <A> the type of quantity parsed
 */
final class QuantityParser<A extends Quantity<A>> {

  private static final Logger LOG = Logger.getLogger(QuantityParser.class.getName());

  // Infinity and NaN are what Double.toString prints for non-finite values.
  private static final String NUMBER =
      "[-+]?(?:[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?|Infinity)|NaN";

  private static final Ordering<String> LONGEST_FIRST = Ordering.<Integer>natural().reverse()
      .onResultOf(new Function<String, Integer>() {
        @Override public Integer apply(String symbol) {
          return symbol.length();
        }
      })
      .compound(Ordering.<String>natural());

  private static final Function<String, String> QUOTE = new Function<String, String>() {
    @Override public String apply(String symbol) {
      return Pattern.quote(symbol);
    }
  };

  private final String dimensionName;
  private final ImmutableMap<String, UnitOfMeasure<A>> symbols;
  private final Pattern pattern;

  QuantityParser(String dimensionName, Map<String, UnitOfMeasure<A>> symbols) {
    this.dimensionName = dimensionName;
    this.symbols = ImmutableMap.copyOf(symbols);

    List<String> ordered = LONGEST_FIRST.sortedCopy(symbols.keySet());
    this.pattern = Pattern.compile(
        "(" + NUMBER + ") *(" + Joiner.on('|').join(Iterables.transform(ordered, QUOTE)) + ")");
  }

  ParseResult<A> parse(@Nullable String raw) {
    if (raw == null) {
      return failure(null, "Unable to parse null as " + dimensionName);
    }

    Matcher matcher = pattern.matcher(raw.trim());
    if (!matcher.matches()) {
      return failure(raw, "Unable to parse " + raw + " as " + dimensionName);
    }

    double number = Double.parseDouble(matcher.group(1));
    UnitOfMeasure<A> unit = symbols.get(matcher.group(2));
    return ParseResult.success(unit.of(number));
  }

  private ParseResult<A> failure(@Nullable String raw, String message) {
    LOG.fine(message);
    return ParseResult.failure(new ParseError(raw, dimensionName, message));
  }
}
