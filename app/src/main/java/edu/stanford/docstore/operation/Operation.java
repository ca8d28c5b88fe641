package edu.stanford.docstore.operation;

import com.google.common.base.Preconditions;
import com.google.protobuf.Message;
import java.util.Optional;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.flogger.Flogger;

/** Handle on a long-running operation started by the server. */
@Flogger
public class Operation {
  @Getter private final String name;
  private final OperationsApi api;
  private final Message metadata;
  private boolean complete = false;

  /** Whatever the caller associates with this operation; not used here. */
  @Getter @Setter private Object target;

  public Operation(String name, OperationsApi api) {
    this(name, api, null);
  }

  public Operation(String name, OperationsApi api, Message metadata) {
    this.name = Preconditions.checkNotNull(name);
    this.api = Preconditions.checkNotNull(api);
    this.metadata = metadata;
  }

  /**
   * Builds an operation from its protobuf form. Metadata is decoded only when its type URL is
   * known to {@code registry}.
   */
  public static Operation fromProto(
      ProtoOperation proto, OperationsApi api, TypeUrlRegistry registry) {
    Message metadata = null;
    if (proto.hasMetadata() && !proto.getMetadata().getTypeUrl().isEmpty()) {
      metadata = registry.unpack(proto.getMetadata()).orElse(null);
      if (metadata == null) {
        log.atFine().log(
            "No type registered for metadata %s of operation %s",
            proto.getMetadata().getTypeUrl(),
            proto.getName());
      }
    }
    return new Operation(proto.getName(), api, metadata);
  }

  public Optional<Message> getMetadata() {
    return Optional.ofNullable(metadata);
  }

  public boolean isComplete() {
    return complete;
  }

  /**
   * Asks the server whether the operation is done.
   *
   * @throws IllegalStateException if a previous call already saw it complete
   */
  public boolean finished() {
    Preconditions.checkState(!complete, "The operation has completed.");
    var response = api.getOperation(name);
    if (response.getDone()) {
      complete = true;
      if (!response.getErrorMessage().isEmpty()) {
        log.atWarning().log("Operation %s failed: %s", name, response.getErrorMessage());
      }
    }
    return complete;
  }

  @Override
  public String toString() {
    return name + "(" + (complete ? "complete" : "running") + ")";
  }
}
