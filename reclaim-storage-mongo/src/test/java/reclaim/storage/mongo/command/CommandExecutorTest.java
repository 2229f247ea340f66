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

package reclaim.storage.mongo.command;

import com.mongodb.MongoException;
import org.junit.jupiter.api.Test;
import reclaim.api.OperationTimeoutException;
import reclaim.api.Result;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CommandExecutorTest {

  private final CommandExecutor executor = new CommandExecutor(Duration.ofSeconds(5));

  @Test
  void returnsCommandValue() {
    Result<String> result = executor.execute(() -> "ok");

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value()).isEqualTo("ok");
  }

  @Test
  void retriesWriteConflicts() {
    AtomicInteger attempts = new AtomicInteger();

    Result<Integer> result =
        executor.execute(
            () -> {
              if (attempts.incrementAndGet() < 3) {
                throw new MongoException(MongoErrorCode.WRITE_CONFLICT.getCode(), "WriteConflict");
              }
              return attempts.get();
            });

    assertThat(result.value()).isEqualTo(3);
  }

  @Test
  void doesNotRetryPermanentErrors() {
    AtomicInteger attempts = new AtomicInteger();
    MongoException unauthorized = new MongoException(13, "Unauthorized");

    Result<Object> result =
        executor.execute(
            () -> {
              attempts.incrementAndGet();
              throw unauthorized;
            });

    assertThat(result.isFailure()).isTrue();
    assertThat(result.getCause()).isSameAs(unauthorized);
    assertThat(attempts).hasValue(1);
  }

  @Test
  void slowCommandFailsWithTimeout() {
    CommandExecutor impatient = new CommandExecutor(Duration.ofMillis(50));

    Result<String> result =
        impatient.execute(
            () -> {
              try {
                Thread.sleep(300);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              return "late";
            });

    assertThat(result.getCause()).isInstanceOf(OperationTimeoutException.class);
  }
}
