/*
 * Copyright 2025 XueFeng Ma
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package reclaim.api;

/**
 * Represents the result of a storage command that can either succeed with a value of type {@code
 * T} or fail with a {@link Throwable} cause.
 *
 * <p>Store adapters use this type between the low level executor and the public {@link
 * reclaim.api.coordination.ResourceStore} methods, which unwrap it with {@link #getOrThrow()} and
 * translate the cause into a {@link StoreException}.
 *
 * @param <T> The type of the value on success.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

  /**
   * Returns the encapsulated value if this result is a {@link Success}, or {@code null} for a
   * {@link Failure}.
   *
   * @return The successful value, or {@code null} if it's a failure.
   */
  T value();

  /**
   * Returns the encapsulated value, or throws the encapsulated cause if this result is a {@link
   * Failure}.
   *
   * @return The successful value.
   * @throws Throwable The encapsulated cause if this result is a failure.
   */
  T getOrThrow() throws Throwable;

  /**
   * Returns the cause of the failure if this result is a {@link Failure}.
   *
   * @return The {@link Throwable} cause if it's a failure, otherwise {@code null}.
   */
  default Throwable getCause() {
    return null;
  }

  default boolean isSuccess() {
    return this instanceof Result.Success<T>;
  }

  default boolean isFailure() {
    return this instanceof Result.Failure<T>;
  }

  /**
   * Represents a successful outcome of an operation.
   *
   * @param <T> The type of the successful value.
   * @param value The value of the successful outcome.
   */
  record Success<T>(T value) implements Result<T> {

    @Override
    public T getOrThrow() {
      return value;
    }
  }

  /**
   * Represents a failed outcome of an operation.
   *
   * @param <T> The type of the expected successful value (not present in failure).
   * @param cause The {@link Throwable} that caused the failure.
   */
  record Failure<T>(Throwable cause) implements Result<T> {

    @Override
    public Throwable getCause() {
      return cause;
    }

    @Override
    public T value() {
      return null;
    }

    @Override
    public T getOrThrow() throws Throwable {
      throw cause;
    }
  }
}
