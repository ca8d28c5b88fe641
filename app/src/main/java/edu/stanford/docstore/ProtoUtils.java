package edu.stanford.docstore;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/** Conversions between the client-side value types and their protobuf messages. */
public final class ProtoUtils {
  private ProtoUtils() {}

  public static ProtoKey toProto(Key key) {
    var builder =
        ProtoKey.newBuilder()
            .setPartitionId(
                ProtoPartitionId.newBuilder()
                    .setProjectId(key.project())
                    .setNamespaceId(key.namespace()));
    for (var element : key.path()) {
      builder.addPath(toProto(element));
    }
    return builder.build();
  }

  public static ProtoPathElement toProto(PathElement element) {
    var builder = ProtoPathElement.newBuilder().setKind(element.kind());
    if (element.id() != null) {
      builder.setId(element.id());
    } else if (element.name() != null) {
      builder.setName(element.name());
    }
    return builder.build();
  }

  public static Key fromProto(ProtoKey protoKey) {
    var partition = protoKey.getPartitionId();
    var path = ImmutableList.<PathElement>builder();
    for (var element : protoKey.getPathList()) {
      path.add(fromProto(element));
    }
    return new Key(partition.getProjectId(), partition.getNamespaceId(), path.build());
  }

  public static PathElement fromProto(ProtoPathElement element) {
    return switch (element.getIdTypeCase()) {
      case ID -> PathElement.of(element.getKind(), element.getId());
      case NAME -> PathElement.of(element.getKind(), element.getName());
      case IDTYPE_NOT_SET -> PathElement.of(element.getKind());
    };
  }

  public static ProtoEntity toProto(Entity entity) {
    var builder = ProtoEntity.newBuilder();
    if (entity.getKey() != null) {
      builder.setKey(toProto(entity.getKey()));
    }
    var excluded = entity.getExcludeFromIndexes();
    for (var property : entity.getProperties().entrySet()) {
      var name = property.getKey();
      builder.putProperties(name, toProtoValue(property.getValue(), excluded.contains(name)));
    }
    return builder.build();
  }

  // decoding entities is only needed to check encodings
  static Entity fromProto(ProtoEntity protoEntity) {
    var key = protoEntity.hasKey() ? fromProto(protoEntity.getKey()) : null;
    var excluded = new LinkedHashSet<String>();
    for (var property : protoEntity.getPropertiesMap().entrySet()) {
      if (property.getValue().getExcludeFromIndexes()) {
        excluded.add(property.getKey());
      }
    }
    var entity = new Entity(key, excluded);
    for (var property : protoEntity.getPropertiesMap().entrySet()) {
      entity.set(property.getKey(), fromProtoValue(property.getValue()));
    }
    return entity;
  }

  public static ProtoValue toProtoValue(Object value, boolean excludeFromIndexes) {
    var builder = ProtoValue.newBuilder().setExcludeFromIndexes(excludeFromIndexes);
    var normalized = Entity.normalize(value);
    if (normalized == null) {
      builder.setNullValue(true);
    } else if (normalized instanceof Boolean b) {
      builder.setBooleanValue(b);
    } else if (normalized instanceof Long l) {
      builder.setIntegerValue(l);
    } else if (normalized instanceof Double d) {
      builder.setDoubleValue(d);
    } else if (normalized instanceof String s) {
      builder.setStringValue(s);
    } else if (normalized instanceof ByteString bytes) {
      builder.setBlobValue(bytes);
    } else if (normalized instanceof Key key) {
      builder.setKeyValue(toProto(key));
    } else if (normalized instanceof List<?> list) {
      var array = ProtoArrayValue.newBuilder();
      for (var element : list) {
        // index exclusion lives on the outer value
        array.addValues(toProtoValue(element, false));
      }
      builder.setArrayValue(array);
    }
    return builder.build();
  }

  static Object fromProtoValue(ProtoValue value) {
    return switch (value.getValueTypeCase()) {
      case NULL_VALUE, VALUETYPE_NOT_SET -> null;
      case BOOLEAN_VALUE -> value.getBooleanValue();
      case INTEGER_VALUE -> value.getIntegerValue();
      case DOUBLE_VALUE -> value.getDoubleValue();
      case STRING_VALUE -> value.getStringValue();
      case BLOB_VALUE -> value.getBlobValue();
      case KEY_VALUE -> fromProto(value.getKeyValue());
      case ARRAY_VALUE -> {
        var values = new ArrayList<Object>(value.getArrayValue().getValuesCount());
        for (var element : value.getArrayValue().getValuesList()) {
          values.add(fromProtoValue(element));
        }
        yield Collections.unmodifiableList(values);
      }
    };
  }
}
