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

import com.google.errorprone.annotations.CheckReturnValue;
import com.mongodb.MongoConfigurationException;
import com.mongodb.MongoConnectionPoolClearedException;
import com.mongodb.MongoException;
import com.mongodb.MongoIncompatibleDriverException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.ReadConcern;
import com.mongodb.ReadConcernLevel;
import com.mongodb.WriteConcern;
import dev.failsafe.CircuitBreaker;
import dev.failsafe.CircuitBreakerOpenException;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.Policy;
import dev.failsafe.RetryPolicy;
import dev.failsafe.Timeout;
import dev.failsafe.TimeoutExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reclaim.api.OperationTimeoutException;
import reclaim.api.Result;
import reclaim.api.StoreException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs store commands under Failsafe policies.
 *
 * <p>Transient server errors (transaction labels, lock contention, write conflicts, primary step
 * downs) are retried a few times with a short delay. Connection level failures feed a circuit
 * breaker shared by every command of one store, so a lost cluster fails fast instead of piling up
 * blocked workers. Each attempt is bounded by the configured timeout.
 *
 * <p>Retries here stay below the {@link reclaim.api.coordination.ResourceStore} contract: a
 * command that still fails is returned as {@link Result.Failure} and becomes a failed reconcile.
 */
public class CommandExecutor {

  // Acknowledged by the "calculated majority" of data-bearing voting members and journaled.
  public static final WriteConcern WRITE_CONCERN = new WriteConcern("majority").withJournal(true);
  public static final ReadConcern READ_CONCERN = new ReadConcern(ReadConcernLevel.MAJORITY);

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

  private final List<Policy<Object>> policies = new ArrayList<>(3);

  public CommandExecutor() {
    this(DEFAULT_TIMEOUT);
  }

  public CommandExecutor(Duration timeout) {
    this.policies.add(
        RetryPolicy.builder()
            .handleIf(CommandExecutor::isTransient)
            .withDelay(Duration.ofMillis(50))
            .withMaxRetries(3)
            .onRetry(
                event ->
                    log.debug(
                        "Retrying store command after transient error, attempt {}",
                        event.getAttemptCount(),
                        event.getLastException()))
            .build());
    this.policies.add(
        CircuitBreaker.builder()
            .handle(
                List.of(
                    MongoConfigurationException.class,
                    MongoSecurityException.class,
                    MongoSocketException.class,
                    MongoConnectionPoolClearedException.class,
                    MongoIncompatibleDriverException.class))
            .withFailureThreshold(5)
            .withDelay(Duration.ofSeconds(10))
            .onOpen(event -> log.warn("Store circuit opened, MongoDB looks unreachable"))
            .onClose(event -> log.info("Store circuit closed"))
            .build());
    if (!timeout.isNegative() && !timeout.isZero()) {
      this.policies.add(Timeout.of(timeout));
    }
  }

  private static boolean isTransient(Throwable error) {
    if (!(error instanceof MongoException dbError)) return false;
    return dbError.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)
        || dbError.hasErrorLabel(MongoException.UNKNOWN_TRANSACTION_COMMIT_RESULT_LABEL)
        || MongoErrorCode.fromException(dbError).isTransient();
  }

  @CheckReturnValue
  public <R> Result<R> execute(Supplier<R> command) {
    try {
      return new Result.Success<>(Failsafe.with(policies).get(command::get));
    } catch (TimeoutExceededException timeout) {
      return new Result.Failure<>(new OperationTimeoutException(timeout));
    } catch (CircuitBreakerOpenException circuitBreak) {
      return new Result.Failure<>(new StoreException("MongoDB circuit is open", circuitBreak));
    } catch (FailsafeException e) {
      // Checked causes, InterruptedException among them, arrive wrapped.
      return new Result.Failure<>(e.getCause() != null ? e.getCause() : e);
    } catch (Throwable e) {
      return new Result.Failure<>(e);
    }
  }
}
