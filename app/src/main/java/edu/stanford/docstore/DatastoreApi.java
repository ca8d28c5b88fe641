package edu.stanford.docstore;

import com.google.protobuf.ByteString;
import java.util.List;

/**
 * The RPC surface the transaction core talks to. Implementations propagate transport and service
 * errors unchanged; nothing here retries.
 */
public interface DatastoreApi {
  /** Starts a server-side transaction and returns its identifier. */
  ByteString beginTransaction(String project);

  /**
   * Applies {@code mutations} in order. {@code transaction} is {@code null} for non-transactional
   * commits.
   */
  CommitResponse commit(
      String project, CommitRequest.Mode mode, List<Mutation> mutations, ByteString transaction);

  void rollback(String project, ByteString transaction);
}
