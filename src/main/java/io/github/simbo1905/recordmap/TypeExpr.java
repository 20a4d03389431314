// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Shape of a record component's generic type. The resolver turns it into a [FieldDescriptor].
sealed interface TypeExpr permits
    TypeExpr.ValueNode, TypeExpr.ListNode, TypeExpr.OptionalNode, TypeExpr.MapNode, TypeExpr.UnknownNode {

  Set<Class<?>> TEMPORAL_TYPES = Set.of(
      LocalDate.class, LocalDateTime.class, LocalTime.class,
      OffsetDateTime.class, ZonedDateTime.class, Instant.class, YearMonth.class);

  /// An element whose content is copied through untouched
  ValueNode OPAQUE = new ValueNode(FieldKind.OPAQUE, Object.class);

  /// Recursive descent over a component type
  static TypeExpr analyze(Type type) {
    Objects.requireNonNull(type, "Type cannot be null");

    if (type instanceof Class<?> clazz) {
      if (clazz.isArray()) {
        throw new IllegalArgumentException("Arrays are not supported, use a List: " + clazz.getSimpleName());
      }
      if (List.class.isAssignableFrom(clazz)) {
        // raw List
        return new ListNode(OPAQUE);
      }
      if (Map.class.isAssignableFrom(clazz)) {
        return new MapNode(OPAQUE);
      }
      if (clazz == Optional.class) {
        throw new IllegalArgumentException("Optional must have a type argument");
      }
      final FieldKind kind = classify(clazz);
      if (kind == null) {
        throw new IllegalArgumentException("Unsupported type: " + clazz.getName());
      }
      return new ValueNode(kind, clazz);
    }

    if (type instanceof ParameterizedType paramType && paramType.getRawType() instanceof Class<?> rawClass) {
      final Type[] typeArgs = paramType.getActualTypeArguments();
      if (List.class.isAssignableFrom(rawClass) && typeArgs.length == 1) {
        return new ListNode(analyzeElement(typeArgs[0]));
      }
      if (rawClass == Optional.class && typeArgs.length == 1) {
        if (!(typeArgs[0] instanceof Class<?>)) {
          throw new IllegalArgumentException("Optional must wrap a plain type: " + type);
        }
        final TypeExpr wrapped = analyze(typeArgs[0]);
        if (wrapped instanceof OptionalNode) {
          throw new IllegalArgumentException("Nested Optional is not supported: " + type);
        }
        return new OptionalNode(wrapped);
      }
      if (Map.class.isAssignableFrom(rawClass) && typeArgs.length == 2) {
        return mapOf(paramType);
      }
      throw new IllegalArgumentException("Unsupported generic type: " + type);
    }

    if (type instanceof TypeVariable<?>) {
      throw new IllegalArgumentException("Type variables are not supported: " + type);
    }

    if (type instanceof WildcardType || type instanceof GenericArrayType) {
      throw new IllegalArgumentException("Unsupported type: " + type);
    }

    throw new IllegalArgumentException("Unsupported type: " + type + " of class " + type.getClass());
  }

  /// List elements and map values. Plain supported classes and nested containers are converted,
  /// `?`, `Object` and raw containers are copied through, bounded wildcards and type variables are unknown.
  private static TypeExpr analyzeElement(Type type) {
    if (type instanceof Class<?> clazz) {
      if (clazz.isArray()) {
        throw new IllegalArgumentException("Arrays are not supported, use a List: " + clazz.getSimpleName());
      }
      final FieldKind kind = classify(clazz);
      if (kind == null) {
        throw new IllegalArgumentException("Unsupported element type: " + clazz.getName());
      }
      if (kind == FieldKind.LIST) {
        return new ListNode(OPAQUE);
      }
      if (kind == FieldKind.MAP) {
        return new MapNode(OPAQUE);
      }
      return kind == FieldKind.OPAQUE ? OPAQUE : new ValueNode(kind, clazz);
    }
    if (type instanceof ParameterizedType paramType && paramType.getRawType() instanceof Class<?> rawClass) {
      final Type[] typeArgs = paramType.getActualTypeArguments();
      if (List.class.isAssignableFrom(rawClass) && typeArgs.length == 1) {
        return new ListNode(analyzeElement(typeArgs[0]));
      }
      if (Map.class.isAssignableFrom(rawClass) && typeArgs.length == 2) {
        return mapOf(paramType);
      }
      throw new IllegalArgumentException("Unsupported element type: " + type);
    }
    if (type instanceof WildcardType wildcard) {
      final Type[] upper = wildcard.getUpperBounds();
      final boolean unbounded = wildcard.getLowerBounds().length == 0
          && (upper.length == 0 || upper[0] == Object.class);
      return unbounded ? OPAQUE : new UnknownNode(type);
    }
    if (type instanceof TypeVariable<?>) {
      return new UnknownNode(type);
    }
    throw new IllegalArgumentException("Unsupported element type: " + type);
  }

  /// External maps are keyed by text so the key type must be `String`, `Object` or `?`
  private static MapNode mapOf(ParameterizedType type) {
    final Type key = type.getActualTypeArguments()[0];
    final boolean textKey = key == String.class || key == Object.class
        || key instanceof WildcardType wildcard && wildcard.getLowerBounds().length == 0
        && wildcard.getUpperBounds()[0] == Object.class;
    if (!textKey) {
      throw new IllegalArgumentException("Map keys must be String: " + type);
    }
    return new MapNode(analyzeElement(type.getActualTypeArguments()[1]));
  }

  /// Classifies a class into a field kind, or null when it is not supported
  static FieldKind classify(Class<?> clazz) {
    if (clazz == String.class) {
      return FieldKind.STRING;
    }
    if (clazz == boolean.class || clazz == Boolean.class) {
      return FieldKind.BOOLEAN;
    }
    if (clazz == char.class || clazz == Character.class) {
      return FieldKind.CHARACTER;
    }
    if (clazz == byte.class || clazz == Byte.class) {
      return FieldKind.BYTE;
    }
    if (clazz == short.class || clazz == Short.class) {
      return FieldKind.SHORT;
    }
    if (clazz == int.class || clazz == Integer.class) {
      return FieldKind.INTEGER;
    }
    if (clazz == long.class || clazz == Long.class) {
      return FieldKind.LONG;
    }
    if (clazz == float.class || clazz == Float.class) {
      return FieldKind.FLOAT;
    }
    if (clazz == double.class || clazz == Double.class) {
      return FieldKind.DOUBLE;
    }
    if (clazz == BigInteger.class) {
      return FieldKind.BIG_INTEGER;
    }
    if (clazz == BigDecimal.class) {
      return FieldKind.BIG_DECIMAL;
    }
    if (clazz == java.util.UUID.class) {
      return FieldKind.UUID;
    }
    if (TEMPORAL_TYPES.contains(clazz)) {
      return FieldKind.TEMPORAL;
    }
    if (clazz.isEnum()) {
      return FieldKind.ENUM;
    }
    if (clazz.isRecord()) {
      return FieldKind.RECORD;
    }
    if (List.class.isAssignableFrom(clazz)) {
      return FieldKind.LIST;
    }
    if (Map.class.isAssignableFrom(clazz)) {
      return FieldKind.MAP;
    }
    if (clazz == Object.class) {
      return FieldKind.OPAQUE;
    }
    return null;
  }

  /// Example: LIST(OrderItem) or OPTIONAL(LocalDate)
  default String toTreeString() {
    if (this instanceof ListNode list) {
      return "LIST(" + list.element().toTreeString() + ")";
    }
    if (this instanceof OptionalNode optional) {
      return "OPTIONAL(" + optional.wrapped().toTreeString() + ")";
    }
    if (this instanceof MapNode map) {
      return "MAP(" + map.value().toTreeString() + ")";
    }
    if (this instanceof UnknownNode unknown) {
      return "UNKNOWN(" + unknown.type().getTypeName() + ")";
    }
    return ((ValueNode) this).javaType().getSimpleName();
  }

  /// Leaf node for scalars, enums, temporal values and nested records
  record ValueNode(FieldKind kind, Class<?> javaType) implements TypeExpr {
    public ValueNode {
      Objects.requireNonNull(kind, "kind cannot be null");
      Objects.requireNonNull(javaType, "javaType cannot be null");
    }
  }

  /// Container node for lists - has one child (element type)
  record ListNode(TypeExpr element) implements TypeExpr {
    public ListNode {
      Objects.requireNonNull(element, "List element type cannot be null");
    }
  }

  /// Container node for optionals - has one child (wrapped type)
  record OptionalNode(TypeExpr wrapped) implements TypeExpr {
    public OptionalNode {
      Objects.requireNonNull(wrapped, "Optional wrapped type cannot be null");
    }
  }

  /// Container node for maps with text keys - has one child (value type)
  record MapNode(TypeExpr value) implements TypeExpr {
    public MapNode {
      Objects.requireNonNull(value, "Map value type cannot be null");
    }
  }

  /// An element type that erasure leaves undecidable, such as `? extends Item` or `T`
  record UnknownNode(Type type) implements TypeExpr {
  }
}
