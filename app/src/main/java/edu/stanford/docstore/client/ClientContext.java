package edu.stanford.docstore.client;

import edu.stanford.docstore.DatastoreApi;

/** What a {@link Batch} needs from the client that owns it, and nothing more. */
public interface ClientContext {
  String getProject();

  /** The namespace new keys default to; empty for the default namespace. */
  String getNamespace();

  DatastoreApi getApi();

  UnitOfWorkStack getStack();
}
