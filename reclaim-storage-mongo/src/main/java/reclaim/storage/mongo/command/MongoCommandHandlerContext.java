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

import com.mongodb.client.MongoDatabase;
import reclaim.api.ResourceKey;
import reclaim.api.coordination.command.CommandHandlerContext;

import java.util.Optional;

public class MongoCommandHandlerContext implements CommandHandlerContext {
  private final MongoDatabase mongoDatabase;
  private final CommandExecutor commandExecutor;
  private final ResourceKey resourceKey;

  public MongoCommandHandlerContext(
      MongoDatabase mongoDatabase, CommandExecutor commandExecutor, ResourceKey resourceKey) {
    this.mongoDatabase = mongoDatabase;
    this.commandExecutor = commandExecutor;
    this.resourceKey = resourceKey;
  }

  @Override
  public Optional<ResourceKey> getResourceKey() {
    return Optional.ofNullable(resourceKey);
  }

  /**
   * @return the key of the addressed record
   * @throws IllegalStateException for commands that do not address a single record
   */
  public ResourceKey requireResourceKey() {
    return getResourceKey()
        .orElseThrow(() -> new IllegalStateException("Command requires a resource key"));
  }

  public MongoDatabase getMongoDatabase() {
    return mongoDatabase;
  }

  public CommandExecutor getCommandExecutor() {
    return commandExecutor;
  }
}
