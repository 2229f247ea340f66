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

import com.google.auto.service.AutoService;
import com.mongodb.client.MongoCollection;
import org.bson.Document;
import reclaim.api.OperationRecord;
import reclaim.api.ResourceKey;
import reclaim.api.coordination.command.CommandHandler;
import reclaim.api.coordination.command.HandlesCommand;
import reclaim.api.coordination.command.OperationCommand;
import reclaim.storage.mongo.OperationDocuments;

import java.util.Optional;

import static com.mongodb.client.model.Filters.eq;

@SuppressWarnings("rawtypes")
@HandlesCommand(OperationCommand.Get.class)
@AutoService({CommandHandler.class})
public class GetOperationCommandHandler
    extends MongoCommandHandler<OperationCommand.Get, Optional<OperationRecord>> {

  /**
   * Reads the addressed record.
   *
   * @return the record, or empty if no document exists under its id
   * @throws reclaim.api.StoreException for any database or execution-related failures.
   */
  @Override
  public Optional<OperationRecord> execute(
      OperationCommand.Get command, MongoCommandHandlerContext context) {
    ResourceKey key = context.requireResourceKey();
    MongoCollection<Document> collection = getCollection(context);

    return unwrap(
        context
            .getCommandExecutor()
            .execute(
                () -> {
                  Document doc = collection.find(eq(OperationDocuments.ID, key.toString())).first();
                  return Optional.ofNullable(doc).map(OperationDocuments::toRecord);
                }),
        "read operation record " + key);
  }
}
