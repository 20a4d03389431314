// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static io.github.simbo1905.recordmap.RecordMapper.LOGGER;

/// Converts one value between its Java form and its external form, as directed by a [FieldDescriptor].
/// Nested records and lists of records recurse through the owning [RecordMarshaler].
final class ValueCoercion {

  static final Set<String> TRUE_LITERALS = Set.of("true", "1", "yes", "on");
  static final Set<String> FALSE_LITERALS = Set.of("false", "0", "no", "off");

  private final RecordMarshaler marshaler;

  ValueCoercion(RecordMarshaler marshaler) {
    this.marshaler = marshaler;
  }

  /// Java value to external value
  @Nullable Object toExternal(@Nullable Object value, FieldDescriptor field) {
    if (value == null) {
      return null;
    }
    if (field.wrappedInOptional()) {
      final Optional<?> optional = (Optional<?>) value;
      if (optional.isEmpty()) {
        return null;
      }
      value = optional.get();
    }
    return switch (field.kind()) {
      case RECORD -> {
        try {
          yield marshaler.toMap((Record) value);
        } catch (MarshalException e) {
          throw e.prependPath(field.name());
        }
      }
      case LIST -> listToExternal((List<?>) value, field);
      case MAP -> mapToExternal((Map<?, ?>) value, field);
      case CHARACTER, UUID -> value.toString();
      case ENUM -> ((Enum<?>) value).name();
      case TEMPORAL -> DateFormats.format((TemporalAccessor) value, field.dateFormat());
      case OPAQUE -> {
        try {
          yield plain(value);
        } catch (MarshalException e) {
          throw e.prependPath(field.name());
        }
      }
      default -> value;
    };
  }

  /// Renders content declared as `Object`, or held in an opaque container, as a JSON-like value.
  /// Records become maps, enums, UUIDs and characters become text, containers are rendered element by element.
  /// @throws TypeCoercionException for anything else, such as a date with no pattern to render it
  @Nullable Object plain(@Nullable Object value) {
    if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
      return value;
    }
    if (value instanceof Record record) {
      return marshaler.toMap(record);
    }
    if (value instanceof Enum<?> constant) {
      return constant.name();
    }
    if (value instanceof UUID || value instanceof Character) {
      return value.toString();
    }
    if (value instanceof Collection<?> collection) {
      final List<Object> result = new ArrayList<>(collection.size());
      int index = 0;
      for (Object item : collection) {
        try {
          result.add(plain(item));
        } catch (MarshalException e) {
          throw e.prependPath("[" + index + "]");
        }
        index++;
      }
      return result;
    }
    if (value instanceof Map<?, ?> map) {
      final Map<String, Object> result = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        final String key = String.valueOf(entry.getKey());
        try {
          result.put(key, plain(entry.getValue()));
        } catch (MarshalException e) {
          throw e.prependPath("[" + key + "]");
        }
      }
      return result;
    }
    throw new TypeCoercionException("", null, value, "JSON value", null);
  }

  /// External value to Java value
  @Nullable Object toInternal(@Nullable Object external, FieldDescriptor field) {
    if (external == null) {
      if (field.optional()) {
        return field.wrappedInOptional() ? Optional.empty() : null;
      }
      throw new TypeCoercionException(field.name(), field.externalKey(), null, field.targetKind(), null);
    }
    final Object value = switch (field.kind()) {
      case RECORD -> nestedToInternal(external, field);
      case LIST -> listToInternal(external, field);
      case MAP -> mapToInternal(external, field);
      default -> scalar(external, field);
    };
    return field.wrappedInOptional() ? Optional.of(value) : value;
  }

  private Object nestedToInternal(Object external, FieldDescriptor field) {
    if (!(external instanceof Map<?, ?> map)) {
      throw new TypeCoercionException(field.name(), field.externalKey(), external, field.targetKind(), null);
    }
    try {
      @SuppressWarnings("unchecked") final Map<String, ?> nested = (Map<String, ?>) map;
      return marshaler.fromMap(field.javaType(), nested);
    } catch (MarshalException e) {
      throw e.prependPath(field.name());
    }
  }

  private List<Object> listToExternal(List<?> list, FieldDescriptor field) {
    final FieldDescriptor element = field.element();
    final List<Object> result = new ArrayList<>(list.size());
    int index = 0;
    for (Object item : list) {
      try {
        result.add(element == null ? plain(item) : toExternal(item, element));
      } catch (MarshalException e) {
        throw e.prependPath("[" + index + "]").prependPath(field.name());
      }
      index++;
    }
    return result;
  }

  private Map<String, Object> mapToExternal(Map<?, ?> map, FieldDescriptor field) {
    final FieldDescriptor element = field.element();
    final Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      final String key = String.valueOf(entry.getKey());
      try {
        result.put(key, element == null ? plain(entry.getValue()) : toExternal(entry.getValue(), element));
      } catch (MarshalException e) {
        throw e.prependPath("[" + key + "]").prependPath(field.name());
      }
    }
    return result;
  }

  private Map<?, ?> mapToInternal(Object external, FieldDescriptor field) {
    if (!(external instanceof Map<?, ?> map)) {
      throw new TypeCoercionException(field.name(), field.externalKey(), external, "Map", null);
    }
    final FieldDescriptor element = field.element();
    if (element == null) {
      return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
    final Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      final String key = String.valueOf(entry.getKey());
      try {
        result.put(key, toInternal(entry.getValue(), element));
      } catch (MarshalException e) {
        throw e.prependPath("[" + key + "]").prependPath(field.name());
      }
    }
    return Collections.unmodifiableMap(result);
  }

  private List<Object> listToInternal(Object external, FieldDescriptor field) {
    if (!(external instanceof Collection<?> collection)) {
      throw new TypeCoercionException(field.name(), field.externalKey(), external, "List", null);
    }
    final FieldDescriptor element = field.element();
    if (element == null) {
      LOGGER.finer(() -> "Copying " + collection.size() + " opaque elements of " + field.name());
      return Collections.unmodifiableList(new ArrayList<>(collection));
    }
    final List<Object> result = new ArrayList<>(collection.size());
    int index = 0;
    for (Object item : collection) {
      try {
        result.add(toInternal(item, element));
      } catch (MarshalException e) {
        throw e.prependPath("[" + index + "]").prependPath(field.name());
      }
      index++;
    }
    return Collections.unmodifiableList(result);
  }

  /// Scalars, enums, UUIDs and temporal values. Needs no marshaler so the resolver also uses it to
  /// convert `@DefaultValue` text.
  static Object scalar(Object external, FieldDescriptor field) {
    return switch (field.kind()) {
      case STRING -> toText(external, field);
      case BOOLEAN -> toBoolean(external, field);
      case CHARACTER -> toCharacter(external, field);
      case BYTE -> (byte) integral(external, field, Byte.MIN_VALUE, Byte.MAX_VALUE);
      case SHORT -> (short) integral(external, field, Short.MIN_VALUE, Short.MAX_VALUE);
      case INTEGER -> (int) integral(external, field, Integer.MIN_VALUE, Integer.MAX_VALUE);
      case LONG -> integral(external, field, Long.MIN_VALUE, Long.MAX_VALUE);
      case FLOAT -> (float) floating(external, field);
      case DOUBLE -> floating(external, field);
      case BIG_DECIMAL -> toBigDecimal(external, field);
      case BIG_INTEGER -> toBigInteger(external, field);
      case UUID -> toUuid(external, field);
      case ENUM -> toEnum(external, field);
      case TEMPORAL -> toTemporal(external, field);
      case OPAQUE -> external;
      case RECORD, LIST, MAP -> throw new IllegalStateException("not a scalar field: " + field);
    };
  }

  static String toText(Object external, FieldDescriptor field) {
    if (external instanceof String text) {
      return text;
    }
    if (external instanceof Number || external instanceof Boolean || external instanceof Character) {
      return external.toString();
    }
    throw mismatch(external, field, null);
  }

  static Boolean toBoolean(Object external, FieldDescriptor field) {
    if (external instanceof Boolean flag) {
      return flag;
    }
    if (external instanceof String text) {
      final String literal = text.trim().toLowerCase(Locale.ROOT);
      if (TRUE_LITERALS.contains(literal)) {
        return Boolean.TRUE;
      }
      if (FALSE_LITERALS.contains(literal)) {
        return Boolean.FALSE;
      }
    }
    if (external instanceof Number number && isIntegralNumber(number)) {
      final long value = number.longValue();
      if (value == 1L || value == 0L) {
        return value == 1L;
      }
    }
    throw mismatch(external, field, null);
  }

  static Character toCharacter(Object external, FieldDescriptor field) {
    if (external instanceof Character character) {
      return character;
    }
    if (external instanceof String text && text.length() == 1) {
      return text.charAt(0);
    }
    throw mismatch(external, field, null);
  }

  /// Integral numbers, whole floating point numbers and numeric text, checked against the target range
  static long integral(Object external, FieldDescriptor field, long min, long max) {
    final long value;
    try {
      if (external instanceof Number number && isIntegralNumber(number)) {
        value = number.longValue();
      } else if (external instanceof BigInteger big) {
        value = big.longValueExact();
      } else if (external instanceof BigDecimal decimal) {
        value = decimal.longValueExact();
      } else if (external instanceof Double || external instanceof Float) {
        value = BigDecimal.valueOf(((Number) external).doubleValue()).longValueExact();
      } else if (external instanceof String text) {
        value = new BigDecimal(text.trim()).longValueExact();
      } else {
        throw mismatch(external, field, null);
      }
    } catch (ArithmeticException | NumberFormatException e) {
      throw mismatch(external, field, e);
    }
    if (value < min || value > max) {
      throw mismatch(external, field, null);
    }
    return value;
  }

  static double floating(Object external, FieldDescriptor field) {
    if (external instanceof Number number) {
      return number.doubleValue();
    }
    if (external instanceof String text) {
      try {
        return Double.parseDouble(text.trim());
      } catch (NumberFormatException e) {
        throw mismatch(external, field, e);
      }
    }
    throw mismatch(external, field, null);
  }

  static BigDecimal toBigDecimal(Object external, FieldDescriptor field) {
    try {
      if (external instanceof BigDecimal decimal) {
        return decimal;
      }
      if (external instanceof BigInteger big) {
        return new BigDecimal(big);
      }
      if (external instanceof Number number && isIntegralNumber(number)) {
        return BigDecimal.valueOf(number.longValue());
      }
      if (external instanceof Double || external instanceof Float) {
        return BigDecimal.valueOf(((Number) external).doubleValue());
      }
      if (external instanceof String text) {
        return new BigDecimal(text.trim());
      }
    } catch (NumberFormatException e) {
      throw mismatch(external, field, e);
    }
    throw mismatch(external, field, null);
  }

  static BigInteger toBigInteger(Object external, FieldDescriptor field) {
    if (external instanceof BigInteger big) {
      return big;
    }
    if (external instanceof Number number && isIntegralNumber(number)) {
      return BigInteger.valueOf(number.longValue());
    }
    try {
      return toBigDecimal(external, field).toBigIntegerExact();
    } catch (ArithmeticException e) {
      throw mismatch(external, field, e);
    }
  }

  static UUID toUuid(Object external, FieldDescriptor field) {
    if (external instanceof UUID uuid) {
      return uuid;
    }
    if (external instanceof String text) {
      try {
        return UUID.fromString(text.trim());
      } catch (IllegalArgumentException e) {
        throw mismatch(external, field, e);
      }
    }
    throw mismatch(external, field, null);
  }

  /// Exact constant name first, then a case-insensitive match
  static Object toEnum(Object external, FieldDescriptor field) {
    final Object[] constants = field.javaType().getEnumConstants();
    if (field.javaType().isInstance(external)) {
      return external;
    }
    if (external instanceof String text) {
      for (Object constant : constants) {
        if (((Enum<?>) constant).name().equals(text)) {
          return constant;
        }
      }
      for (Object constant : constants) {
        if (((Enum<?>) constant).name().equalsIgnoreCase(text.trim())) {
          return constant;
        }
      }
    }
    throw mismatch(external, field, null);
  }

  static Object toTemporal(Object external, FieldDescriptor field) {
    if (field.javaType().isInstance(external)) {
      return external;
    }
    if (external instanceof String text) {
      try {
        return DateFormats.parse(text, field.javaType(), field.dateFormat());
      } catch (DateTimeParseException e) {
        throw new DateFormatException(field.name(), field.externalKey(), field.dateFormat(), text, e);
      }
    }
    throw mismatch(external, field, null);
  }

  static boolean isIntegralNumber(Number number) {
    return number instanceof Integer || number instanceof Long
        || number instanceof Short || number instanceof Byte;
  }

  static TypeCoercionException mismatch(Object external, FieldDescriptor field, @Nullable Throwable cause) {
    return new TypeCoercionException(field.name(), field.externalKey(), external, field.targetKind(), cause);
  }
}
