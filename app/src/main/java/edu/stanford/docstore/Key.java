package edu.stanford.docstore;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A key in the docstore: a project, a namespace (empty for the default one) and a non-empty path
 * of {@link PathElement}s. Only the last element may lack an identifier; such a key is
 * <em>partial</em> and becomes complete once the server allocates an id for it on commit.
 */
public record Key(String project, String namespace, List<PathElement> path) {

  public Key {
    Preconditions.checkArgument(
        project != null && !project.isEmpty(), "Keys must belong to a project");
    namespace = Strings.nullToEmpty(namespace);
    path = ImmutableList.copyOf(path);
    Preconditions.checkArgument(!path.isEmpty(), "Keys must have at least one path element");
    for (int i = 0; i < path.size() - 1; i++) {
      Preconditions.checkArgument(
          path.get(i).isComplete(), "Only the last path element may be partial: %s", path);
    }
  }

  public static Key of(String project, String namespace, PathElement... path) {
    return new Key(project, namespace, ImmutableList.copyOf(path));
  }

  public PathElement leaf() {
    return path.get(path.size() - 1);
  }

  public String kind() {
    return leaf().kind();
  }

  public boolean isPartial() {
    return !leaf().isComplete();
  }

  public Key completedKey(long id) {
    return completedKey(PathElement.of(kind(), id));
  }

  public Key completedKey(String name) {
    return completedKey(PathElement.of(kind(), name));
  }

  /** Returns a copy of this partial key whose last path element is replaced by {@code assigned}. */
  public Key completedKey(PathElement assigned) {
    Preconditions.checkState(isPartial(), "Only a partial key can be completed: %s", this);
    Preconditions.checkArgument(assigned.isComplete(), "Assigned element must be complete");
    Preconditions.checkArgument(
        assigned.kind().equals(kind()),
        "Assigned element kind %s does not match key kind %s",
        assigned.kind(),
        kind());
    var completedPath =
        ImmutableList.<PathElement>builder()
            .addAll(path.subList(0, path.size() - 1))
            .add(assigned)
            .build();
    return new Key(project, namespace, completedPath);
  }

  @Override
  public String toString() {
    var prefix = namespace.isEmpty() ? project : project + "/" + namespace;
    return prefix + "[" + Joiner.on(", ").join(path) + "]";
  }
}
