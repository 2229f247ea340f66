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

import reclaim.api.coordination.ResourceEvent;

/**
 * Admission predicate deciding whether a change notification is worth a reconcile.
 *
 * <p>Filters are side-effect free. Events that are not admitted never reach the work queue.
 */
@FunctionalInterface
public interface EventFilter {

  boolean admit(ResourceEvent event);

  /** Returns a filter admitting only events admitted by both this filter and {@code other}. */
  default EventFilter and(EventFilter other) {
    return event -> admit(event) && other.admit(event);
  }
}
