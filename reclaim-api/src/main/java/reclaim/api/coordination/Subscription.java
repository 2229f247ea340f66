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

package reclaim.api.coordination;

/**
 * Represents an active subscription to change events of operation records.
 *
 * <p>This interface extends {@link AutoCloseable}, making it suitable for use in try-with-resources
 * statements.
 */
public interface Subscription extends AutoCloseable {

  /**
   * Cancels this subscription. The listener receives no further events. This operation is
   * idempotent.
   */
  void unsubscribe();

  /**
   * @return {@code true} if the subscription is active and has not been cancelled.
   */
  boolean isSubscribed();

  /** Equivalent to {@link #unsubscribe()}. */
  @Override
  default void close() {
    unsubscribe();
  }
}
