package edu.stanford.docstore;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class KeyTest {
  @Test
  void testPartialAndComplete() {
    var partial = Key.of("p", null, PathElement.of("Parent", "a"), PathElement.of("Kind"));
    assertThat(partial.isPartial()).isTrue();
    assertThat(partial.kind()).isEqualTo("Kind");
    assertThat(partial.namespace()).isEmpty();

    var byId = partial.completedKey(12);
    assertThat(byId.isPartial()).isFalse();
    assertThat(byId.path())
        .containsExactly(PathElement.of("Parent", "a"), PathElement.of("Kind", 12))
        .inOrder();

    var byName = partial.completedKey("named");
    assertThat(byName.leaf()).isEqualTo(PathElement.of("Kind", "named"));

    // the original is untouched
    assertThat(partial.isPartial()).isTrue();
  }

  @Test
  void testCompletedKey_rejectsCompleteKeysAndWrongKind() {
    var complete = Key.of("p", null, PathElement.of("Kind", 1));
    assertThrows(IllegalStateException.class, () -> complete.completedKey(2));

    var partial = Key.of("p", null, PathElement.of("Kind"));
    assertThrows(
        IllegalArgumentException.class, () -> partial.completedKey(PathElement.of("Other", 3)));
    assertThrows(
        IllegalArgumentException.class, () -> partial.completedKey(PathElement.of("Kind")));
  }

  @Test
  void testValidation() {
    assertThrows(IllegalArgumentException.class, () -> Key.of("", null, PathElement.of("Kind")));
    assertThrows(IllegalArgumentException.class, () -> Key.of("p", null));
    assertThrows(
        IllegalArgumentException.class,
        () -> Key.of("p", null, PathElement.of("Parent"), PathElement.of("Kind", 1)));
    assertThrows(IllegalArgumentException.class, () -> PathElement.of(""));
    assertThrows(IllegalArgumentException.class, () -> PathElement.of("Kind", 0));
    assertThrows(IllegalArgumentException.class, () -> PathElement.of("Kind", ""));
    assertThrows(IllegalArgumentException.class, () -> new PathElement("Kind", 1L, "both"));
  }

  @Test
  void testEqualityIgnoresNullVsEmptyNamespace() {
    assertThat(Key.of("p", null, PathElement.of("Kind", 1)))
        .isEqualTo(Key.of("p", "", PathElement.of("Kind", 1)));
    assertThat(Key.of("p", "ns", PathElement.of("Kind", 1)))
        .isNotEqualTo(Key.of("p", "", PathElement.of("Kind", 1)));
  }

  @Test
  void testToString() {
    var key = Key.of("p", "ns", PathElement.of("Parent", "a"), PathElement.of("Kind"));
    assertThat(key.toString()).isEqualTo("p/ns[Parent:'a', Kind:?]");
  }
}
