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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reclaim.api.OperationRecord;
import reclaim.api.coordination.command.CommandHandler;
import reclaim.api.coordination.command.HandlesCommand;
import reclaim.api.coordination.command.OperationCommand;
import reclaim.storage.mongo.OperationDocuments;

import java.util.ArrayList;
import java.util.List;

@SuppressWarnings("rawtypes")
@HandlesCommand(OperationCommand.ListAll.class)
@AutoService({CommandHandler.class})
public class ListOperationsCommandHandler
    extends MongoCommandHandler<OperationCommand.ListAll, List<OperationRecord>> {

  private final Logger log = LoggerFactory.getLogger(ListOperationsCommandHandler.class);

  /** Reads every record; documents that cannot be mapped are logged and skipped. */
  @Override
  public List<OperationRecord> execute(
      OperationCommand.ListAll command, MongoCommandHandlerContext context) {
    MongoCollection<Document> collection = getCollection(context);

    return unwrap(
        context
            .getCommandExecutor()
            .execute(
                () -> {
                  List<OperationRecord> records = new ArrayList<>();
                  for (Document doc : collection.find()) {
                    try {
                      records.add(OperationDocuments.toRecord(doc));
                    } catch (RuntimeException e) {
                      log.warn(
                          "Skipping malformed operation document {}: {}",
                          doc.get(OperationDocuments.ID),
                          e.getMessage());
                    }
                  }
                  return records;
                }),
        "list operation records");
  }
}
