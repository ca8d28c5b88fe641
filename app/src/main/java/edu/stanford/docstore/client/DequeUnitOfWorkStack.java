package edu.stanford.docstore.client;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.Deque;

/** Default {@link UnitOfWorkStack}; not synchronized. */
public final class DequeUnitOfWorkStack implements UnitOfWorkStack {
  private final Deque<Batch> batches = new ArrayDeque<>();

  @Override
  public void push(Batch batch) {
    Preconditions.checkNotNull(batch);
    batches.addFirst(batch);
  }

  @Override
  public Batch pop() {
    Preconditions.checkState(!batches.isEmpty(), "No unit of work is active");
    return batches.removeFirst();
  }

  @Override
  public Batch peek() {
    return batches.peekFirst();
  }

  @Override
  public int size() {
    return batches.size();
  }
}
