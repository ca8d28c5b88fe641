package edu.stanford.docstore.client;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import edu.stanford.docstore.CommitRequest;
import edu.stanford.docstore.CommitResponse;
import edu.stanford.docstore.Entity;
import edu.stanford.docstore.Key;
import edu.stanford.docstore.Mutation;
import edu.stanford.docstore.ProtoUtils;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.flogger.Flogger;

/**
 * A unit of work that buffers upserts and deletes and sends them to the server in a single
 * non-transactional commit.
 *
 * <p>Mutations are committed in exactly the order they were staged. A batch is owned by the code
 * that created it and must not be shared between threads.
 *
 * <p>The usual way to use a batch is scoped, through {@link #call} or {@link #run}:
 *
 * <pre>{@code
 * var batch = client.batch();
 * batch.run(() -> {
 *   batch.put(entity);
 *   batch.delete(oldKey);
 * });
 * }</pre>
 *
 * While the work runs the batch is the client's current unit of work, so {@code client.put(...)}
 * stages into it as well.
 */
@Flogger
public class Batch {
  /** Discriminates plain batches from transactions on the {@link UnitOfWorkStack}. */
  public enum Kind {
    BATCH,
    TRANSACTION
  }

  public enum Status {
    /** Created, not yet begun. */
    INITIAL,
    IN_PROGRESS,
    ABORTED,
    COMMITTED
  }

  @FunctionalInterface
  public interface Work<T, E extends Exception> {
    T call() throws E;
  }

  @FunctionalInterface
  public interface VoidWork<E extends Exception> {
    void run() throws E;
  }

  protected final ClientContext client;
  private final List<Mutation> mutations = new ArrayList<>();
  @Getter private Status status = Status.INITIAL;

  public Batch(ClientContext client) {
    this.client = Preconditions.checkNotNull(client);
  }

  public Kind kind() {
    return Kind.BATCH;
  }

  public String getProject() {
    return client.getProject();
  }

  public String getNamespace() {
    return client.getNamespace();
  }

  /** Staged mutations, in staging order. */
  public ImmutableList<Mutation> getMutations() {
    return ImmutableList.copyOf(mutations);
  }

  /** Returns the owning client's current unit of work, which may or may not be this batch. */
  public Batch current() {
    return client.getStack().peek();
  }

  /** Stages an upsert of {@code entity} built from its current key and properties. */
  public void put(Entity entity) {
    Preconditions.checkArgument(entity != null, "Entity cannot be null");
    var key = entity.getKey();
    Preconditions.checkArgument(key != null, "Entity must have a key");
    checkSameProject(key);
    checkNotFinished();
    mutations.add(Mutation.newBuilder().setUpsert(ProtoUtils.toProto(entity)).build());
  }

  /** Stages a delete of the entity stored under {@code key}, which must be complete. */
  public void delete(Key key) {
    Preconditions.checkArgument(key != null, "Key cannot be null");
    Preconditions.checkArgument(!key.isPartial(), "Key must be complete: %s", key);
    checkSameProject(key);
    checkNotFinished();
    mutations.add(Mutation.newBuilder().setDelete(ProtoUtils.toProto(key)).build());
  }

  public void begin() {
    Preconditions.checkState(status == Status.INITIAL, "Batch already started (%s)", status);
    status = Status.IN_PROGRESS;
  }

  /**
   * Sends all staged mutations in one non-transactional commit. If the call fails the error is
   * propagated and the batch stays in progress with its mutations intact.
   */
  public void commit() {
    Preconditions.checkState(
        status == Status.IN_PROGRESS, "Batch must be in progress to commit (%s)", status);
    sendCommit(CommitRequest.Mode.NON_TRANSACTIONAL, null);
    finish(Status.COMMITTED);
  }

  /** Discards staged mutations. No RPC is issued; nothing was sent to the server yet. */
  public void rollback() {
    Preconditions.checkState(
        status == Status.IN_PROGRESS, "Batch must be in progress to roll back (%s)", status);
    log.atFine().log("Discarding %d staged mutations", mutations.size());
    finish(Status.ABORTED);
  }

  /**
   * Runs {@code work} with this batch as the client's current unit of work.
   *
   * <p>The batch is pushed and begun first. If {@code work} returns normally the batch is
   * committed; if it throws, the batch is rolled back and the original exception is rethrown, with
   * any rollback failure attached as suppressed. The batch is popped on every path.
   */
  public final <T, E extends Exception> T call(Work<T, E> work) throws E {
    enter();
    T result;
    try {
      result = work.call();
    } catch (Throwable t) {
      exitWithFailure(t);
      throw t;
    }
    exitNormally();
    return result;
  }

  public final <E extends Exception> void run(VoidWork<E> work) throws E {
    this.<Void, E>call(
        () -> {
          work.run();
          return null;
        });
  }

  /** Whether commit or rollback would currently be accepted. */
  protected boolean isActive() {
    return status == Status.IN_PROGRESS;
  }

  protected CommitResponse sendCommit(CommitRequest.Mode mode, ByteString transaction) {
    var staged = ImmutableList.copyOf(mutations);
    log.atFine().log(
        "Committing %d mutations to project %s (%s)", staged.size(), getProject(), mode);
    return client.getApi().commit(getProject(), mode, staged, transaction);
  }

  protected void finish(Status terminal) {
    mutations.clear();
    status = terminal;
  }

  private void enter() {
    client.getStack().push(this);
    boolean begun = false;
    try {
      begin();
      begun = true;
    } finally {
      if (!begun) {
        popSelf();
      }
    }
  }

  private void exitNormally() {
    try {
      if (isActive()) {
        commit();
      }
    } finally {
      popSelf();
    }
  }

  private void exitWithFailure(Throwable failure) {
    try {
      if (isActive()) {
        rollback();
      }
    } catch (RuntimeException e) {
      log.atWarning().withCause(e).log("Rollback failed after error in %s", kind());
      failure.addSuppressed(e);
    } finally {
      popSelf();
    }
  }

  private void popSelf() {
    var popped = client.getStack().pop();
    if (popped != this) {
      log.atSevere().log("Unit of work stack out of order: expected %s, popped %s", this, popped);
    }
  }

  private void checkSameProject(Key key) {
    Preconditions.checkArgument(
        getProject().equals(key.project()),
        "Key project %s does not match batch project %s",
        key.project(),
        getProject());
  }

  private void checkNotFinished() {
    Preconditions.checkState(
        status == Status.INITIAL || status == Status.IN_PROGRESS,
        "Cannot stage mutations on a %s %s",
        status,
        kind());
  }
}
