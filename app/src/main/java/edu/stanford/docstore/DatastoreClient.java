package edu.stanford.docstore;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import edu.stanford.docstore.client.Batch;
import edu.stanford.docstore.client.ClientContext;
import edu.stanford.docstore.client.DequeUnitOfWorkStack;
import edu.stanford.docstore.client.Transaction;
import edu.stanford.docstore.client.UnitOfWorkStack;
import edu.stanford.docstore.config.ClientConfig;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import java.util.Collection;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.extern.flogger.Flogger;

/**
 * Entry point for talking to one project (and default namespace) of the docstore.
 *
 * <p>Each client owns a stack of active batches and transactions. Standalone {@link #put} and
 * {@link #delete} calls stage into the innermost one, or commit immediately when none is active.
 * A client is not thread-safe: sharing one between threads requires external synchronization.
 */
@Flogger
public final class DatastoreClient implements ClientContext, AutoCloseable {
  @Getter private final String project;
  @Getter private final String namespace;
  @Getter private final DatastoreApi api;
  @Getter private final UnitOfWorkStack stack;

  // only set when this client opened the channel itself
  private final ManagedChannel channel;

  public DatastoreClient(String project, String namespace, DatastoreApi api) {
    this(project, namespace, api, new DequeUnitOfWorkStack(), null);
  }

  public DatastoreClient(
      String project, String namespace, DatastoreApi api, UnitOfWorkStack stack) {
    this(project, namespace, api, stack, null);
  }

  private DatastoreClient(
      String project,
      String namespace,
      DatastoreApi api,
      UnitOfWorkStack stack,
      ManagedChannel channel) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(project), "A project is required");
    this.project = project;
    this.namespace = Strings.nullToEmpty(namespace);
    this.api = Preconditions.checkNotNull(api);
    this.stack = Preconditions.checkNotNull(stack);
    this.channel = channel;
  }

  /** Opens a plaintext gRPC channel to the server named in {@code config}. */
  public static DatastoreClient create(ClientConfig config) {
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(config.getHost()), "Config must name a host: %s", config);
    Preconditions.checkArgument(config.getPort() > 0, "Config must name a port: %s", config);
    var target = config.getTarget();
    log.atInfo().log("Opening channel to %s for project %s", target, config.getProject());
    var channel = Grpc.newChannelBuilder(target, InsecureChannelCredentials.create()).build();
    return new DatastoreClient(
        config.getProject(),
        config.getNamespace(),
        new GrpcDatastoreApi(channel),
        new DequeUnitOfWorkStack(),
        channel);
  }

  public Batch batch() {
    return new Batch(this);
  }

  public Transaction transaction() {
    return new Transaction(this);
  }

  /** Builds a key in this client's project and namespace. */
  public Key key(PathElement... path) {
    return Key.of(project, namespace, path);
  }

  /** The innermost active batch or transaction, or {@code null}. */
  public Batch getCurrentBatch() {
    return stack.peek();
  }

  /** The innermost active unit of work if it is a transaction, or {@code null}. */
  public Transaction getCurrentTransaction() {
    return stack.peekTransaction();
  }

  public void put(Entity entity) {
    putMulti(ImmutableList.of(entity));
  }

  /**
   * Stages upserts into the current unit of work, or commits them right away in a new batch when
   * none is active.
   */
  public void putMulti(Collection<Entity> entities) {
    if (entities.isEmpty()) {
      return;
    }
    var current = getCurrentBatch();
    boolean inBatch = current != null;
    if (!inBatch) {
      current = batch();
      current.begin();
    }
    for (var entity : entities) {
      current.put(entity);
    }
    if (!inBatch) {
      current.commit();
    }
  }

  public void delete(Key key) {
    deleteMulti(ImmutableList.of(key));
  }

  /** Same routing as {@link #putMulti}, for deletes. */
  public void deleteMulti(Collection<Key> keys) {
    if (keys.isEmpty()) {
      return;
    }
    var current = getCurrentBatch();
    boolean inBatch = current != null;
    if (!inBatch) {
      current = batch();
      current.begin();
    }
    for (var key : keys) {
      current.delete(key);
    }
    if (!inBatch) {
      current.commit();
    }
  }

  @Override
  public void close() throws InterruptedException {
    if (stack.size() > 0) {
      log.atWarning().log("Closing client with %d active units of work", stack.size());
    }
    if (channel == null) {
      return;
    }
    log.atFine().log("Shutting down channel %s", channel);
    channel.shutdown();
    if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
      channel.shutdownNow();
    }
  }
}
