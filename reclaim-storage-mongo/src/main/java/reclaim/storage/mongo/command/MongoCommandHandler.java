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

import com.mongodb.client.MongoCollection;
import org.bson.Document;
import reclaim.api.Result;
import reclaim.api.StoreException;
import reclaim.api.coordination.command.Command;
import reclaim.api.coordination.command.CommandHandler;
import reclaim.api.coordination.command.CommandHandlerContext;

import static reclaim.storage.mongo.ReclaimCollectionNamespace.OPERATION;
import static reclaim.storage.mongo.command.CommandExecutor.READ_CONCERN;
import static reclaim.storage.mongo.command.CommandExecutor.WRITE_CONCERN;

public abstract class MongoCommandHandler<C extends Command<R>, R> implements CommandHandler<C, R> {

  protected MongoCollection<Document> getCollection(MongoCommandHandlerContext context) {
    return context
        .getMongoDatabase()
        .getCollection(OPERATION)
        .withReadConcern(READ_CONCERN)
        .withWriteConcern(WRITE_CONCERN);
  }

  @Override
  public R execute(C command, CommandHandlerContext context) {
    return this.execute(command, (MongoCommandHandlerContext) context);
  }

  protected abstract R execute(C command, MongoCommandHandlerContext context);

  /**
   * Unwraps a command result, translating any failure into a {@link StoreException}.
   *
   * @throws StoreException carrying the original failure as its cause
   */
  protected R unwrap(Result<R> result, String action) {
    try {
      return result.getOrThrow();
    } catch (StoreException e) {
      throw e;
    } catch (Throwable e) {
      throw new StoreException("Failed to " + action, e);
    }
  }
}
