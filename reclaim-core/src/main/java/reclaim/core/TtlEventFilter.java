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

import reclaim.api.OperationRecord;
import reclaim.api.coordination.ResourceEvent;

/**
 * Admits creations and updates of finished records that carry a time-to-live and are not already
 * being deleted. Deletions are never admitted, there is nothing left to collect.
 */
public final class TtlEventFilter implements EventFilter {

  @Override
  public boolean admit(ResourceEvent event) {
    return switch (event.type()) {
      case CREATED -> isCollectable(((ResourceEvent.Created) event).object());
      case UPDATED -> isCollectable(((ResourceEvent.Updated) event).newObject());
      case DELETED -> false;
    };
  }

  private static boolean isCollectable(OperationRecord record) {
    return record.finished()
        && record.ttlSecondsAfterFinished() != null
        && !record.deletionRequested();
  }
}
