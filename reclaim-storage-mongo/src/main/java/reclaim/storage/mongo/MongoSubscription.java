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

package reclaim.storage.mongo;

import reclaim.api.coordination.Subscription;

import java.util.concurrent.atomic.AtomicBoolean;

public final class MongoSubscription implements Subscription {
  private final AtomicBoolean subscribed = new AtomicBoolean(true);
  private final Runnable unsubscribeAction;

  public MongoSubscription(Runnable unsubscribeAction) {
    this.unsubscribeAction = unsubscribeAction;
  }

  @Override
  public void unsubscribe() {
    if (subscribed.compareAndSet(true, false)) {
      unsubscribeAction.run();
    }
  }

  @Override
  public boolean isSubscribed() {
    return subscribed.get();
  }
}
