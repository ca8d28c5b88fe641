package edu.stanford.docstore;

import com.google.common.base.Preconditions;

/**
 * One (kind, identifier) pair of a key path. The identifier is either a numeric id or a string
 * name; an element with neither is partial and waits for the server to allocate an id.
 */
public record PathElement(String kind, Long id, String name) {

  public PathElement {
    Preconditions.checkArgument(kind != null && !kind.isEmpty(), "Path elements must have a kind");
    Preconditions.checkArgument(
        id == null || name == null, "Path element %s cannot have both an id and a name", kind);
    Preconditions.checkArgument(id == null || id != 0L, "Ids must be non-zero");
    Preconditions.checkArgument(name == null || !name.isEmpty(), "Names cannot be empty");
  }

  public static PathElement of(String kind) {
    return new PathElement(kind, null, null);
  }

  public static PathElement of(String kind, long id) {
    return new PathElement(kind, id, null);
  }

  public static PathElement of(String kind, String name) {
    return new PathElement(kind, null, name);
  }

  public boolean isComplete() {
    return id != null || name != null;
  }

  @Override
  public String toString() {
    if (id != null) {
      return kind + ":" + id;
    } else if (name != null) {
      return kind + ":'" + name + "'";
    }
    return kind + ":?";
  }
}
