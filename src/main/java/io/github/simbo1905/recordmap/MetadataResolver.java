// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import io.github.simbo1905.recordmap.annotation.DateFormat;
import io.github.simbo1905.recordmap.annotation.DefaultValue;
import io.github.simbo1905.recordmap.annotation.Exclude;
import io.github.simbo1905.recordmap.annotation.ListElementType;
import io.github.simbo1905.recordmap.annotation.OptionalField;
import io.github.simbo1905.recordmap.annotation.Rename;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

import static io.github.simbo1905.recordmap.RecordMapper.LOGGER;

/// Introspects record types and caches the result.
///
/// A type's shape is static so the cache is never invalidated in normal operation. Population goes through
/// [ConcurrentHashMap#computeIfAbsent] so concurrent first use of a type introspects it once and every caller
/// sees the same complete shape. Nested record types are resolved on their own first use, never while another
/// type is being resolved, which keeps the critical section free of recursive updates.
final class MetadataResolver {

  /// We cache the shape of each record type to avoid introspecting it more than once
  static final ConcurrentHashMap<Class<?>, RecordShape<?>> REGISTRY = new ConcurrentHashMap<>();

  /// Counts actual introspections, the expensive part that the cache exists to avoid
  static final LongAdder INTROSPECTIONS = new LongAdder();

  private MetadataResolver() {
  }

  static List<FieldDescriptor> describe(Class<?> type) {
    return shape(type).fields();
  }

  @SuppressWarnings("unchecked")
  static <R> RecordShape<R> shape(Class<R> type) {
    Objects.requireNonNull(type, "type must not be null");
    final RecordShape<?> cached = REGISTRY.get(type);
    if (cached != null) {
      return (RecordShape<R>) cached;
    }
    return (RecordShape<R>) REGISTRY.computeIfAbsent(type, MetadataResolver::introspect);
  }

  static void clear() {
    LOGGER.fine(() -> "Clearing " + REGISTRY.size() + " cached record shapes");
    REGISTRY.clear();
  }

  static <R> RecordShape<R> introspect(Class<R> type) {
    INTROSPECTIONS.increment();
    LOGGER.fine(() -> "Introspecting " + type.getName());
    if (!type.isRecord()) {
      throw new InvalidMetadataException(type, "", "not a record type");
    }

    final RecordComponent[] components = type.getRecordComponents();
    final List<FieldDescriptor> fields = new ArrayList<>(components.length);
    final Map<String, String> keyOwners = new LinkedHashMap<>();
    for (RecordComponent component : components) {
      final FieldDescriptor field = describeComponent(type, component);
      final String previous = keyOwners.putIfAbsent(field.externalKey(), field.name());
      if (previous != null) {
        throw new InvalidMetadataException(type, field.name(), "external key '" + field.externalKey()
            + "' is already used by field '" + previous + "'");
      }
      LOGGER.finer(() -> "Field " + field.name() + " -> '" + field.externalKey() + "' " + field.kind()
          + (field.element() != null ? "(" + field.element().targetKind() + ")" : ""));
      fields.add(field);
    }

    final MethodHandle constructor;
    final List<MethodHandle> accessors = new ArrayList<>(components.length);
    try {
      final Class<?>[] parameterTypes = Arrays.stream(components).map(RecordComponent::getType).toArray(Class<?>[]::new);
      final Constructor<R> canonical = type.getDeclaredConstructor(parameterTypes);
      canonical.setAccessible(true);
      constructor = MethodHandles.lookup().unreflectConstructor(canonical);
      for (RecordComponent component : components) {
        final Method accessor = component.getAccessor();
        accessor.setAccessible(true);
        accessors.add(MethodHandles.lookup().unreflect(accessor));
      }
    } catch (NoSuchMethodException | IllegalAccessException | RuntimeException e) {
      throw new InvalidMetadataException(type, "", "cannot access canonical constructor or accessors: " + e.getMessage(), e);
    }

    LOGGER.info(() -> "Resolved " + fields.size() + " fields of " + type.getSimpleName());
    return new RecordShape<>(type, Collections.unmodifiableList(fields),
        Collections.unmodifiableSet(new LinkedHashSet<>(keyOwners.keySet())),
        constructor, List.copyOf(accessors));
  }

  static FieldDescriptor describeComponent(Class<?> type, RecordComponent component) {
    final String name = component.getName();

    final Rename rename = component.getAnnotation(Rename.class);
    final String externalKey = rename == null ? name : rename.value();
    if (externalKey.isBlank()) {
      throw new InvalidMetadataException(type, name, "@Rename key must not be blank");
    }

    final TypeExpr analyzed;
    try {
      analyzed = TypeExpr.analyze(component.getGenericType());
    } catch (IllegalArgumentException e) {
      throw new InvalidMetadataException(type, name, e.getMessage(), e);
    }
    LOGGER.finer(() -> "Component " + name + " has type expression " + analyzed.toTreeString());

    final boolean wrappedInOptional = analyzed instanceof TypeExpr.OptionalNode;
    final TypeExpr typeExpr = wrappedInOptional ? ((TypeExpr.OptionalNode) analyzed).wrapped() : analyzed;

    final boolean optionalField = component.isAnnotationPresent(OptionalField.class);
    if (optionalField && component.getType().isPrimitive()) {
      throw new InvalidMetadataException(type, name, "@OptionalField cannot be used on primitive " + component.getType());
    }

    final DateFormat dateFormat = component.getAnnotation(DateFormat.class);
    final String pattern = dateFormat == null ? null : dateFormat.value();
    final ListElementType listElementType = component.getAnnotation(ListElementType.class);

    final FieldKind kind;
    final Class<?> javaType;
    FieldDescriptor element = null;
    if (typeExpr instanceof TypeExpr.ValueNode valueNode) {
      kind = valueNode.kind();
      javaType = valueNode.javaType();
    } else if (typeExpr instanceof TypeExpr.ListNode listNode) {
      kind = FieldKind.LIST;
      javaType = List.class;
      element = describeElement(type, name, externalKey, listNode.element(), listElementType, pattern);
    } else if (typeExpr instanceof TypeExpr.MapNode mapNode) {
      kind = FieldKind.MAP;
      javaType = Map.class;
      element = describeNested(type, name, externalKey, mapNode.value(), pattern);
    } else {
      throw new InvalidMetadataException(type, name, "unsupported type " + typeExpr.toTreeString());
    }

    if (listElementType != null && kind != FieldKind.LIST) {
      throw new InvalidMetadataException(type, name, "@ListElementType is only valid on List components");
    }

    final Class<?> temporalType = temporalLeaf(kind, javaType, element);
    if (temporalType == null && pattern != null) {
      throw new InvalidMetadataException(type, name, "@DateFormat is only valid on date and time components");
    }
    if (temporalType != null) {
      if (pattern == null) {
        throw new InvalidMetadataException(type, name, temporalType.getSimpleName() + " component requires @DateFormat");
      }
      try {
        DateFormats.verify(pattern, temporalType);
      } catch (IllegalArgumentException e) {
        throw new InvalidMetadataException(type, name, e.getMessage(), e);
      }
    }

    final FieldDescriptor field = new FieldDescriptor(name, externalKey, kind, javaType, element,
        kind == FieldKind.TEMPORAL ? pattern : null,
        component.isAnnotationPresent(Exclude.class),
        false, null,
        optionalField || wrappedInOptional,
        wrappedInOptional);

    final DefaultValue defaultValue = component.getAnnotation(DefaultValue.class);
    return defaultValue == null ? field : field.withDefault(resolveDefault(type, field, defaultValue.value()));
  }

  static FieldDescriptor describeElement(Class<?> type, String name, String externalKey, TypeExpr element,
                                         ListElementType declared, String pattern) {
    if (declared != null) {
      final Class<?> declaredType = declared.value();
      final FieldKind declaredKind = TypeExpr.classify(declaredType);
      if (declaredKind == null || declaredKind.isContainer() || declaredKind == FieldKind.OPAQUE || declaredType.isPrimitive()) {
        throw new InvalidMetadataException(type, name, "@ListElementType " + declaredType.getName()
            + " is not a record, enum, scalar or date type");
      }
      final boolean contradicts = element instanceof TypeExpr.ListNode || element instanceof TypeExpr.MapNode
          || element instanceof TypeExpr.ValueNode valueNode && valueNode.kind() != FieldKind.OPAQUE
          && valueNode.javaType() != declaredType;
      if (contradicts) {
        throw new InvalidMetadataException(type, name, "@ListElementType " + declaredType.getSimpleName()
            + " contradicts declared element type " + element.toTreeString());
      }
      return FieldDescriptor.elementOf(externalKey, declaredKind, declaredType,
          declaredKind == FieldKind.TEMPORAL ? pattern : null);
    }
    return describeNested(type, name, externalKey, element, pattern);
  }

  /// Descriptor for list elements and map values, recursing into nested containers.
  /// Null means the content is copied through.
  static FieldDescriptor describeNested(Class<?> type, String name, String externalKey, TypeExpr expr, String pattern) {
    if (expr instanceof TypeExpr.UnknownNode unknown) {
      throw new InvalidMetadataException(type, name, "element type " + unknown.type().getTypeName()
          + " cannot be determined at runtime, declare it with @ListElementType on a List component");
    }
    if (expr instanceof TypeExpr.ListNode listNode) {
      return FieldDescriptor.elementOf(externalKey, FieldKind.LIST, List.class, null,
          describeNested(type, name, externalKey, listNode.element(), pattern));
    }
    if (expr instanceof TypeExpr.MapNode mapNode) {
      return FieldDescriptor.elementOf(externalKey, FieldKind.MAP, Map.class, null,
          describeNested(type, name, externalKey, mapNode.value(), pattern));
    }
    if (expr instanceof TypeExpr.ValueNode valueNode && valueNode.kind() != FieldKind.OPAQUE) {
      return FieldDescriptor.elementOf(externalKey, valueNode.kind(), valueNode.javaType(),
          valueNode.kind() == FieldKind.TEMPORAL ? pattern : null);
    }
    return null;
  }

  /// The date or time class the `@DateFormat` of a component applies to, at any container depth
  static Class<?> temporalLeaf(FieldKind kind, Class<?> javaType, FieldDescriptor element) {
    if (kind == FieldKind.TEMPORAL) {
      return javaType;
    }
    for (FieldDescriptor nested = element; nested != null; nested = nested.element()) {
      if (nested.kind() == FieldKind.TEMPORAL) {
        return nested.javaType();
      }
    }
    return null;
  }

  static Object resolveDefault(Class<?> type, FieldDescriptor field, String text) {
    final Object value = switch (field.kind()) {
      case RECORD -> throw new InvalidMetadataException(type, field.name(), "@DefaultValue is not supported on nested records");
      case LIST -> {
        if (!"[]".equals(text.trim())) {
          throw new InvalidMetadataException(type, field.name(), "@DefaultValue of a list must be []");
        }
        yield List.of();
      }
      case MAP -> {
        if (!"{}".equals(text.trim())) {
          throw new InvalidMetadataException(type, field.name(), "@DefaultValue of a map must be {}");
        }
        yield Map.of();
      }
      default -> {
        try {
          yield ValueCoercion.scalar(text, field);
        } catch (MarshalException e) {
          throw new InvalidMetadataException(type, field.name(), "invalid @DefaultValue: " + e.detail(), e);
        }
      }
    };
    return field.wrappedInOptional() ? Optional.of(value) : value;
  }
}
