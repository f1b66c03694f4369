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

import com.google.common.base.Function;
import com.google.common.base.Objects;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

/**
 * The outcome of parsing a quantity: either the parsed value or a {@link ParseError}.
 *
 * <p>Parsing reports malformed input through this type rather than by throwing; callers that
 * prefer an exception may ask for one with {@link #getOrThrow()}.
 *
 * @param <T> the type of the parsed value
 */
public final class ParseResult<T> {
  private final Optional<T> value;
  private final Optional<ParseError> error;

  private ParseResult(Optional<T> value, Optional<ParseError> error) {
    this.value = value;
    this.error = error;
  }

  public static <T> ParseResult<T> success(T value) {
    return new ParseResult<T>(Optional.of(value), Optional.<ParseError>absent());
  }

  public static <T> ParseResult<T> failure(ParseError error) {
    return new ParseResult<T>(Optional.<T>absent(), Optional.of(error));
  }

  public boolean isSuccess() {
    return value.isPresent();
  }

  public boolean isFailure() {
    return error.isPresent();
  }

  /**
   * Returns the parsed value.
   *
   * @return The parsed value.
   * @throws IllegalStateException if parsing failed.
   */
  public T get() {
    Preconditions.checkState(isSuccess(), "No value parsed: %s", error.orNull());
    return value.get();
  }

  /**
   * Returns the parse error.
   *
   * @return The error describing the failed parse.
   * @throws IllegalStateException if parsing succeeded.
   */
  public ParseError getError() {
    Preconditions.checkState(isFailure(), "Parse succeeded with %s", value.orNull());
    return error.get();
  }

  public Optional<T> toOptional() {
    return value;
  }

  /**
   * Returns the parsed value, or {@code defaultValue} if parsing failed.
   */
  public T or(T defaultValue) {
    return value.or(defaultValue);
  }

  /**
   * Returns the parsed value or throws a {@link QuantityParseException} carrying the error.
   */
  public T getOrThrow() throws QuantityParseException {
    if (isFailure()) {
      throw new QuantityParseException(error.get());
    }
    return value.get();
  }

  /**
   * Maps a successful value; failures pass through unchanged.
   *
   * @param transformer The transformation to apply to the parsed value.
   * @param <M> The type the value will be mapped to.
   * @return The mapped success or else this failure.
   */
  public <M> ParseResult<M> transform(Function<? super T, M> transformer) {
    if (isSuccess()) {
      return success(transformer.apply(value.get()));
    }
    return failure(error.get());
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof ParseResult)) {
      return false;
    }
    ParseResult<?> other = (ParseResult<?>) o;
    return Objects.equal(value, other.value)
        && Objects.equal(error, other.error);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value, error);
  }

  @Override
  public String toString() {
    if (isSuccess()) {
      return String.format("Success(%s)", value.get());
    } else {
      return String.format("Failure(%s)", error.get());
    }
  }
}
