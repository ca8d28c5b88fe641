package edu.stanford.docstore.operation;

import com.google.common.base.Preconditions;
import com.google.protobuf.Any;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps {@link Any} type URLs to the message types used to decode them. Each component that decodes
 * operation metadata owns its own registry.
 */
public final class TypeUrlRegistry {
  public static final String DEFAULT_PREFIX = "type.googleapis.com";

  private final Map<String, Message> prototypes = new HashMap<>();

  public static String computeTypeUrl(Descriptor descriptor) {
    return computeTypeUrl(descriptor, DEFAULT_PREFIX);
  }

  public static String computeTypeUrl(Descriptor descriptor, String prefix) {
    return prefix + "/" + descriptor.getFullName();
  }

  /** Registers {@code prototype}'s type under its default type URL. */
  public void register(Message prototype) {
    register(computeTypeUrl(prototype.getDescriptorForType()), prototype);
  }

  /**
   * Registers {@code prototype}'s type under {@code typeUrl}. Registering the same type twice is
   * allowed.
   *
   * @throws IllegalArgumentException if a different type is already registered for the URL
   */
  public void register(String typeUrl, Message prototype) {
    Preconditions.checkNotNull(typeUrl, "typeUrl");
    Preconditions.checkNotNull(prototype, "prototype");
    var existing = prototypes.get(typeUrl);
    if (existing != null) {
      Preconditions.checkArgument(
          existing.getClass() == prototype.getClass(),
          "Conflict: %s is already registered for %s",
          existing.getDescriptorForType().getFullName(),
          typeUrl);
      return;
    }
    prototypes.put(typeUrl, prototype.getDefaultInstanceForType());
  }

  public Optional<Message> lookup(String typeUrl) {
    return Optional.ofNullable(prototypes.get(typeUrl));
  }

  /** Decodes {@code any} if its type URL is registered, otherwise returns empty. */
  public Optional<Message> unpack(Any any) {
    var prototype = prototypes.get(any.getTypeUrl());
    if (prototype == null) {
      return Optional.empty();
    }
    try {
      Message message = prototype.getParserForType().parseFrom(any.getValue());
      return Optional.of(message);
    } catch (InvalidProtocolBufferException e) {
      throw new IllegalArgumentException("Malformed payload for " + any.getTypeUrl(), e);
    }
  }
}
