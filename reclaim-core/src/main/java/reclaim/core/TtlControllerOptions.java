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

package reclaim.core;

import com.google.common.base.Preconditions;

import java.time.Duration;

/**
 * Tuning knobs of an {@link OperationTtlController}.
 *
 * @param workerThreads size of the worker pool when the controller owns it
 * @param failureBaseDelay delay before the first retry of a failed reconcile
 * @param failureMaxDelay upper bound of the exponential retry delay
 */
public record TtlControllerOptions(
    int workerThreads, Duration failureBaseDelay, Duration failureMaxDelay) {

  public TtlControllerOptions {
    Preconditions.checkArgument(workerThreads > 0, "workerThreads must be positive");
    Preconditions.checkArgument(
        !failureBaseDelay.isNegative() && !failureBaseDelay.isZero(),
        "failureBaseDelay must be positive");
    Preconditions.checkArgument(
        failureMaxDelay.compareTo(failureBaseDelay) >= 0,
        "failureMaxDelay must not be shorter than failureBaseDelay");
  }

  public static TtlControllerOptions defaults() {
    return new TtlControllerOptions(2, Duration.ofMillis(5), Duration.ofSeconds(1000));
  }
}
