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

import java.util.Arrays;

public enum MongoErrorCode {
  UNKNOWN_ERROR(8),
  INTERNAL_ERROR(1),
  HOST_UNREACHABLE(6),
  HOST_NOT_FOUND(7),
  LOCK_TIMEOUT(24),
  LOCK_BUSY(46),
  NETWORK_TIMEOUT(89),
  WRITE_CONFLICT(112),
  PRIMARY_STEPPED_DOWN(189),
  NETWORK_INTERFACE_EXCEEDED_TIME_LIMIT(202),
  EXCEEDED_TIME_LIMIT(262),
  ;

  private final int code;

  MongoErrorCode(int code) {
    this.code = code;
  }

  static MongoErrorCode fromException(MongoException error) {
    return Arrays.stream(MongoErrorCode.values())
        .filter(t -> t.code == error.getCode())
        .findFirst()
        .orElse(MongoErrorCode.UNKNOWN_ERROR);
  }

  /** Errors after which repeating the same single-document command is safe. */
  boolean isTransient() {
    return switch (this) {
      case LOCK_TIMEOUT,
          LOCK_BUSY,
          WRITE_CONFLICT,
          NETWORK_TIMEOUT,
          PRIMARY_STEPPED_DOWN,
          NETWORK_INTERFACE_EXCEEDED_TIME_LIMIT -> true;
      default -> false;
    };
  }

  public int getCode() {
    return code;
  }
}
