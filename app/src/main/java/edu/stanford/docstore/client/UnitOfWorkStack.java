package edu.stanford.docstore.client;

/**
 * The units of work active on one client, innermost first. The top of the stack is the current
 * unit of work and receives staged operations; an empty stack means nothing is active.
 *
 * <p>Implementations are not required to be thread-safe.
 */
public interface UnitOfWorkStack {
  void push(Batch batch);

  /**
   * Removes and returns the top of the stack.
   *
   * @throws IllegalStateException if the stack is empty
   */
  Batch pop();

  /** Returns the top of the stack, or {@code null} if no unit of work is active. */
  Batch peek();

  int size();

  /**
   * Returns the top of the stack if it is a transaction, or {@code null}. A plain batch on top
   * masks any transaction beneath it.
   */
  default Transaction peekTransaction() {
    var top = peek();
    if (top == null || top.kind() != Batch.Kind.TRANSACTION) {
      return null;
    }
    return (Transaction) top;
  }
}
