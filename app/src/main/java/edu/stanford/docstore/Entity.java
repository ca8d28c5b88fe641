package edu.stanford.docstore;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.protobuf.ByteString;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;

/**
 * A record held by the client: a mutable key plus named property values.
 *
 * <p>Entities are compared by identity. A transaction that stages an entity with a partial key
 * later writes the server-allocated key back onto that same object.
 *
 * <p>Supported property values are {@code null}, {@link Boolean}, {@link Long} (and {@link
 * Integer}), {@link Double} (and {@link Float}), {@link String}, {@link ByteString} (and {@code
 * byte[]}), {@link Key} and lists of those.
 */
public final class Entity {
  @Getter @Setter private Key key;
  private final Map<String, Object> properties = new LinkedHashMap<>();
  @Getter private final ImmutableSet<String> excludeFromIndexes;

  public Entity(Key key) {
    this(key, ImmutableSet.of());
  }

  public Entity(Key key, Set<String> excludeFromIndexes) {
    this.key = key;
    this.excludeFromIndexes = ImmutableSet.copyOf(excludeFromIndexes);
  }

  public Entity set(String name, Object value) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "Property names cannot be empty");
    properties.put(name, normalize(value));
    return this;
  }

  public Object get(String name) {
    return properties.get(name);
  }

  public Object remove(String name) {
    return properties.remove(name);
  }

  /** Properties in insertion order. */
  public Map<String, Object> getProperties() {
    return Collections.unmodifiableMap(properties);
  }

  static Object normalize(Object value) {
    if (value == null
        || value instanceof Boolean
        || value instanceof Long
        || value instanceof Double
        || value instanceof String
        || value instanceof ByteString
        || value instanceof Key) {
      return value;
    } else if (value instanceof Integer i) {
      return i.longValue();
    } else if (value instanceof Float f) {
      return f.doubleValue();
    } else if (value instanceof byte[] bytes) {
      return ByteString.copyFrom(bytes);
    } else if (value instanceof List<?> list) {
      // ImmutableList rejects nulls, so keep a plain unmodifiable copy
      var copy = new ArrayList<Object>(list.size());
      for (var element : list) {
        Preconditions.checkArgument(
            !(element instanceof List), "Nested lists are not supported as property values");
        copy.add(normalize(element));
      }
      return Collections.unmodifiableList(copy);
    }
    throw new IllegalArgumentException(
        "Unsupported property value type: " + value.getClass().getName());
  }

  @Override
  public String toString() {
    return "Entity" + properties + "(" + key + ")";
  }
}
