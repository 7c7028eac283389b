/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pluscode;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The result of a fallible Plus Code operation, holding either a value or the {@link
 * PlusCodeException} which describes why no value could be produced.
 */
public final class ErrorOr<T> {

  public static <T> ErrorOr<T> success(T value) {
    checkNotNull(value, "success must return a non-null value");
    return new ErrorOr<>(value, null);
  }

  public static <T> ErrorOr<T> failure(PlusCodeException error) {
    checkNotNull(error, "failure must provide a non-null exception");
    return new ErrorOr<>(null, error);
  }

  // Runs an operation which reports bad input by throwing, capturing the failure.
  static <T> ErrorOr<T> capture(Supplier<T> operation) {
    try {
      return success(operation.get());
    } catch (PlusCodeException e) {
      return failure(e);
    }
  }

  @Nullable private final T value;
  @Nullable private final PlusCodeException error;

  private ErrorOr(@Nullable T value, @Nullable PlusCodeException error) {
    this.value = value;
    this.error = error;
  }

  public T get() {
    checkState(value != null, "cannot obtain a value from an error: %s", this);
    return value;
  }

  /** Returns the value of a successful result, or throws the captured exception. */
  public T getOrThrow() {
    if (error != null) {
      throw error;
    }
    return get();
  }

  public PlusCodeException getError() {
    checkState(error != null, "no error for: %s", this);
    return error;
  }

  public boolean isSuccess() {
    return value != null;
  }

  public boolean isError() {
    return error != null;
  }

  @Override
  public String toString() {
    return isSuccess()
        ? String.format("ErrorOr{value=%s}", value)
        : String.format("ErrorOr{error='%s'}", getError().getMessage());
  }
}
