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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceKeyTest {

  @Test
  void parsesCanonicalForm() {
    ResourceKey key = ResourceKey.parse("kafka/rebalance-1");

    assertThat(key.namespace()).isEqualTo("kafka");
    assertThat(key.name()).isEqualTo("rebalance-1");
    assertThat(key).hasToString("kafka/rebalance-1");
  }

  @Test
  void nameMayContainSeparator() {
    ResourceKey key = ResourceKey.parse("kafka/topics/orders");

    assertThat(key.namespace()).isEqualTo("kafka");
    assertThat(key.name()).isEqualTo("topics/orders");
  }

  @Test
  void emptyNamespaceIsAllowed() {
    assertThat(ResourceKey.parse("/cluster-wide").namespace()).isEmpty();
  }

  @Test
  void rejectsMalformedKeys() {
    assertThatThrownBy(() -> ResourceKey.parse("no-separator"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ResourceKey.of("kafka", ""))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ResourceKey.of("a/b", "c"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
