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

import com.google.errorprone.annotations.MustBeClosed;
import com.mongodb.MongoException;
import com.mongodb.MongoInterruptedException;
import com.mongodb.client.ChangeStreamIterable;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.model.changestream.FullDocument;
import com.mongodb.client.model.changestream.FullDocumentBeforeChange;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reclaim.api.OperationRecord;
import reclaim.api.ResourceKey;
import reclaim.api.ResourceNotFoundException;
import reclaim.api.coordination.ResourceEvent;
import reclaim.api.coordination.ResourceListener;
import reclaim.api.coordination.ResourceStore;
import reclaim.api.coordination.Subscription;
import reclaim.api.coordination.command.Command;
import reclaim.api.coordination.command.CommandHandler;
import reclaim.api.coordination.command.HandlesCommand;
import reclaim.api.coordination.command.OperationCommand;
import reclaim.storage.mongo.command.CommandExecutor;
import reclaim.storage.mongo.command.MongoCommandHandlerContext;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static reclaim.storage.mongo.ReclaimCollectionNamespace.OPERATION;

/**
 * {@link ResourceStore} backed by the {@code operation} collection of a MongoDB database.
 *
 * <p>Reads, deletes and listings are dispatched to {@link CommandHandler}s discovered through
 * {@link ServiceLoader}. Change events come from a single change stream on the collection, read by
 * a daemon thread that fans them out to every subscribed {@link ResourceListener}. Change streams
 * require a replica set or a sharded cluster.
 */
public class MongoResourceStore implements ResourceStore {

  private static final Duration WATCH_RETRY_DELAY = Duration.ofSeconds(1);

  private final Logger log = LoggerFactory.getLogger(MongoResourceStore.class);

  private final MongoDatabase mongoDatabase;
  private final CommandExecutor commandExecutor;

  @SuppressWarnings("rawtypes")
  private final Map<Class<? extends Command>, CommandHandler> commandHandlerRegistry =
      new ConcurrentHashMap<>();

  private final List<ResourceListener> listeners = new CopyOnWriteArrayList<>();
  private final Thread watcherThread;
  private volatile MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor;
  private volatile boolean closed;

  @MustBeClosed
  public MongoResourceStore(MongoClient mongoClient, String db) {
    this(mongoClient, db, CommandExecutor.DEFAULT_TIMEOUT);
  }

  @MustBeClosed
  public MongoResourceStore(MongoClient mongoClient, String db, Duration commandTimeout) {
    this.mongoDatabase = mongoClient.getDatabase(db);
    this.commandExecutor = new CommandExecutor(commandTimeout);

    // Discover and register all command handlers
    ServiceLoader.load(CommandHandler.class).forEach(this::registerHandler);

    // Open the cursor before returning, so that no change after construction is missed.
    this.cursor = openCursor(null);
    this.watcherThread = new Thread(this::demultiplexerLoop, "reclaim-event-demultiplexer");
    this.watcherThread.setDaemon(true);
    this.watcherThread.start();
  }

  @SuppressWarnings("rawtypes")
  private void registerHandler(CommandHandler handler) {
    HandlesCommand annotation = handler.getClass().getAnnotation(HandlesCommand.class);
    if (annotation != null) {
      commandHandlerRegistry.put(annotation.value(), handler);
    }
  }

  private MongoChangeStreamCursor<ChangeStreamDocument<Document>> openCursor(
      BsonDocument resumeToken) {
    ChangeStreamIterable<Document> stream =
        mongoDatabase
            .getCollection(OPERATION)
            .watch()
            .fullDocument(FullDocument.UPDATE_LOOKUP)
            .fullDocumentBeforeChange(FullDocumentBeforeChange.WHEN_AVAILABLE);
    if (resumeToken != null) {
      stream = stream.resumeAfter(resumeToken);
    }
    return stream.cursor();
  }

  private void demultiplexerLoop() {
    while (!closed && !Thread.currentThread().isInterrupted()) {
      MongoChangeStreamCursor<ChangeStreamDocument<Document>> current = this.cursor;
      ChangeStreamDocument<Document> change;
      try {
        change = current.next();
      } catch (MongoInterruptedException e) {
        break;
      } catch (MongoException | IllegalStateException e) {
        if (closed) break;
        log.warn("Change stream on '{}' failed, reopening: {}", OPERATION, e.getMessage());
        if (!reopen(current)) break;
        continue;
      }
      dispatch(change);
    }
    log.debug("Change stream demultiplexer on '{}' stopped", OPERATION);
  }

  private boolean reopen(MongoChangeStreamCursor<ChangeStreamDocument<Document>> failed) {
    BsonDocument resumeToken = failed.getResumeToken();
    try {
      failed.close();
    } catch (RuntimeException e) {
      log.debug("Closing failed change stream cursor: {}", e.getMessage());
    }
    while (!closed) {
      try {
        Thread.sleep(WATCH_RETRY_DELAY.toMillis());
        this.cursor = openCursor(resumeToken);
        return true;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      } catch (MongoException e) {
        // The token may be unusable (e.g. after an invalidate), start from now instead.
        resumeToken = null;
        log.warn("Reopening change stream on '{}' failed: {}", OPERATION, e.getMessage());
      }
    }
    return false;
  }

  private void dispatch(ChangeStreamDocument<Document> change) {
    if (listeners.isEmpty()) return;
    ResourceEvent event;
    try {
      event = buildChangeEventFrom(change);
    } catch (RuntimeException e) {
      log.warn("Skipping undecodable change event {}: {}", change.getDocumentKey(), e.getMessage());
      return;
    }
    if (event == null) return;

    for (ResourceListener listener : listeners) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException e) {
        log.warn("Listener failed on {} event for {}", event.type(), event.key(), e);
      }
    }
  }

  private ResourceEvent buildChangeEventFrom(ChangeStreamDocument<Document> change) {
    BsonDocument documentKey = change.getDocumentKey();
    if (documentKey == null) return null;
    BsonValue id = documentKey.get(OperationDocuments.ID);
    if (id == null || !id.isString()) return null;
    ResourceKey key = ResourceKey.parse(id.asString().getValue());

    OperationRecord oldNode =
        Optional.ofNullable(change.getFullDocumentBeforeChange())
            .map(OperationDocuments::toRecord)
            .orElse(null);
    OperationRecord newNode =
        Optional.ofNullable(change.getFullDocument())
            .map(OperationDocuments::toRecord)
            .orElse(null);

    return switch (Objects.requireNonNull(change.getOperationType())) {
      case INSERT -> newNode == null ? null : new ResourceEvent.Created(newNode);
      // A null post-image means the document is gone already; its delete event follows.
      case UPDATE, REPLACE -> newNode == null ? null : new ResourceEvent.Updated(oldNode, newNode);
      case DELETE -> new ResourceEvent.Deleted(key, oldNode);
      default -> null;
    };
  }

  @SuppressWarnings("unchecked")
  private <R> R execute(ResourceKey key, Command<R> command) {
    CommandHandler<Command<R>, R> handler = commandHandlerRegistry.get(command.getClass());
    if (handler == null) {
      throw new IllegalStateException(
          "No command handler found for command: " + command.getClass().getName());
    }
    MongoCommandHandlerContext context =
        new MongoCommandHandlerContext(mongoDatabase, commandExecutor, key);
    return handler.execute(command, context);
  }

  @Override
  public Optional<OperationRecord> get(ResourceKey key) {
    return execute(key, new OperationCommand.Get());
  }

  @Override
  public void delete(ResourceKey key) {
    OperationCommand.DeleteResult result = execute(key, new OperationCommand.Delete());
    if (!result.deleted()) {
      throw new ResourceNotFoundException(key);
    }
  }

  @Override
  public List<OperationRecord> list() {
    return execute(null, new OperationCommand.ListAll());
  }

  @Override
  public Subscription subscribe(ResourceListener listener) {
    listeners.add(listener);
    return new MongoSubscription(() -> listeners.remove(listener));
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    listeners.clear();
    this.watcherThread.interrupt();
    try {
      this.cursor.close();
    } catch (RuntimeException e) {
      log.debug("Closing change stream cursor: {}", e.getMessage());
    }
  }
}
