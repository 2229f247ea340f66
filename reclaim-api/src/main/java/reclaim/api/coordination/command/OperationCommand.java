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

package reclaim.api.coordination.command;

import reclaim.api.OperationRecord;

import java.util.List;
import java.util.Optional;

/** Commands a store adapter executes against operation records. */
public final class OperationCommand {

  private OperationCommand() {}

  /** Reads a single record. The result is empty when the record does not exist. */
  public record Get() implements Command<Optional<OperationRecord>> {}

  /**
   * Deletes a single record.
   *
   * <p>The handler reports whether a record was removed; a store maps {@code deleted == false}
   * to {@link reclaim.api.ResourceNotFoundException}.
   */
  public record Delete() implements Command<DeleteResult> {}

  /** Reads every record. */
  public record ListAll() implements Command<List<OperationRecord>> {}

  /**
   * Represents the result of a {@link Delete} command.
   *
   * @param deleted {@code true} if a record was removed.
   */
  public record DeleteResult(boolean deleted) {}
}
