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

/** The addressed record does not exist in the store (anymore). */
public class ResourceNotFoundException extends StoreException {

  private final ResourceKey key;

  public ResourceNotFoundException(ResourceKey key) {
    super("Operation record " + key + " not found");
    this.key = key;
  }

  public ResourceKey getKey() {
    return key;
  }
}
