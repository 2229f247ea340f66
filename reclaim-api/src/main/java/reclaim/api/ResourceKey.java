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

import java.util.Objects;

/**
 * Identity of an operation record: a name unique within its namespace.
 *
 * <p>The canonical string form is {@code namespace/name}.
 */
public record ResourceKey(String namespace, String name) {

  private static final char SEPARATOR = '/';

  public ResourceKey {
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) throw new IllegalArgumentException("name must not be empty");
    if (namespace.indexOf(SEPARATOR) >= 0) {
      throw new IllegalArgumentException("namespace must not contain '/': " + namespace);
    }
  }

  public static ResourceKey of(String namespace, String name) {
    return new ResourceKey(namespace, name);
  }

  /**
   * Parses the canonical {@code namespace/name} form produced by {@link #toString()}.
   *
   * @param text the canonical form
   * @return the parsed key
   * @throws IllegalArgumentException if {@code text} has no separator
   */
  public static ResourceKey parse(String text) {
    int idx = text.indexOf(SEPARATOR);
    if (idx < 0) throw new IllegalArgumentException("Not a resource key: " + text);
    return new ResourceKey(text.substring(0, idx), text.substring(idx + 1));
  }

  @Override
  public String toString() {
    return namespace + SEPARATOR + name;
  }
}
