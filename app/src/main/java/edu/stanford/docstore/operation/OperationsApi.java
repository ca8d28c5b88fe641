package edu.stanford.docstore.operation;

/** Polls the server for the state of long-running operations. */
public interface OperationsApi {
  ProtoOperation getOperation(String name);
}
