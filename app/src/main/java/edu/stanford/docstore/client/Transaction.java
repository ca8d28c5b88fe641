package edu.stanford.docstore.client;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import edu.stanford.docstore.CommitRequest;
import edu.stanford.docstore.Entity;
import edu.stanford.docstore.MutationResult;
import edu.stanford.docstore.ProtoKey;
import edu.stanford.docstore.ProtoUtils;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.flogger.Flogger;

/**
 * A {@link Batch} whose mutations are applied atomically inside a server-side transaction.
 *
 * <p>Lifecycle: {@code INITIAL -> IN_PROGRESS -> COMMITTED | ABORTED}. The last two states are
 * final; a transaction cannot be begun again once it has committed or rolled back. {@link #getId}
 * is non-null exactly while the transaction is in progress.
 *
 * <p>Entities put with a partial key are remembered in staging order, once per put. On commit the
 * server returns one allocated key per such put, in the same order, and each entity's key is
 * replaced with its completed form. An entity put twice takes the key of its first put.
 */
@Flogger
public class Transaction extends Batch {
  @Getter private ByteString id;
  private final List<Entity> partialKeyEntities = new ArrayList<>();

  public Transaction(ClientContext client) {
    super(client);
  }

  @Override
  public Kind kind() {
    return Kind.TRANSACTION;
  }

  /**
   * Returns the owning client's current transaction: the top of its stack if that is a
   * transaction, otherwise {@code null}.
   */
  @Override
  public Transaction current() {
    return client.getStack().peekTransaction();
  }

  /** Entities staged with a partial key, in staging order. */
  public ImmutableList<Entity> getPartialKeyEntities() {
    return ImmutableList.copyOf(partialKeyEntities);
  }

  /**
   * Starts the server-side transaction. If the RPC fails the error propagates and the transaction
   * stays {@code INITIAL}, so it may be begun again.
   */
  @Override
  public void begin() {
    Preconditions.checkState(
        getStatus() != Status.IN_PROGRESS, "Transaction %s is already in progress", id);
    Preconditions.checkState(
        getStatus() == Status.INITIAL, "Transaction has been tombstoned (%s)", getStatus());
    id = client.getApi().beginTransaction(getProject());
    setInProgress();
  }

  @Override
  public void put(Entity entity) {
    super.put(entity);
    if (entity.getKey().isPartial()) {
      partialKeyEntities.add(entity);
    }
  }

  /**
   * Commits the staged mutations transactionally and writes allocated keys back onto the entities
   * that were put with partial keys.
   */
  @Override
  public void commit() {
    Preconditions.checkState(id != null, "Transaction is not in progress (%s)", getStatus());
    var response = sendCommit(CommitRequest.Mode.TRANSACTIONAL, id);
    var assignedKeys =
        response.getMutationResultsList().stream()
            .filter(MutationResult::hasKey)
            .map(MutationResult::getKey)
            .collect(toImmutableList());
    var pending = ImmutableList.copyOf(partialKeyEntities);
    // the server has committed, so the transaction is over whatever the response holds
    end(Status.COMMITTED);
    Preconditions.checkState(
        assignedKeys.size() == pending.size(),
        "Server allocated %s keys for %s entities with partial keys",
        assignedKeys.size(),
        pending.size());
    for (int i = 0; i < pending.size(); i++) {
      var entity = pending.get(i);
      // an entity staged more than once was completed at its first position
      if (entity.getKey().isPartial()) {
        patchKey(entity, assignedKeys.get(i));
      } else {
        log.atFine().log(
            "Entity already keyed as %s, skipping allocated key %d", entity.getKey(), i);
      }
    }
  }

  /**
   * Abandons the server-side transaction. The transaction is tombstoned even if the rollback RPC
   * fails; that failure still propagates.
   */
  @Override
  public void rollback() {
    Preconditions.checkState(id != null, "Transaction is not in progress (%s)", getStatus());
    try {
      client.getApi().rollback(getProject(), id);
    } finally {
      end(Status.ABORTED);
    }
  }

  @Override
  protected boolean isActive() {
    return id != null;
  }

  private void setInProgress() {
    // Batch.begin only moves INITIAL -> IN_PROGRESS, which is all that is left to do here
    super.begin();
  }

  private void end(Status terminal) {
    id = null;
    partialKeyEntities.clear();
    finish(terminal);
  }

  private static void patchKey(Entity entity, ProtoKey assigned) {
    var assignedLeaf = ProtoUtils.fromProto(assigned.getPath(assigned.getPathCount() - 1));
    var completed = entity.getKey().completedKey(assignedLeaf);
    log.atFine().log("Assigned key %s", completed);
    entity.setKey(completed);
  }
}
