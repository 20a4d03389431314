// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.github.simbo1905.recordmap.RecordMapper.LOGGER;

/// Whole record conversion. Stateless apart from its configuration; the shared state is the descriptor cache.
final class RecordMarshaler {

  final MarshalConfig config;
  final ValueCoercion coercion;

  RecordMarshaler(MarshalConfig config) {
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.coercion = new ValueCoercion(this);
  }

  Map<String, Object> toMap(Record record) {
    Objects.requireNonNull(record, "record must not be null");
    final RecordShape<?> shape = MetadataResolver.shape(record.getClass());
    final List<FieldDescriptor> fields = shape.fields();
    final Map<String, Object> result = new LinkedHashMap<>();
    MarshalException failure = null;
    for (int i = 0; i < fields.size(); i++) {
      final FieldDescriptor field = fields.get(i);
      if (field.excluded()) {
        continue;
      }
      try {
        result.put(field.externalKey(), coercion.toExternal(shape.read(i, record), field));
      } catch (MarshalException e) {
        failure = collect(failure, e);
      }
    }
    if (failure != null) {
      throw failure;
    }
    LOGGER.finer(() -> "Wrote " + result.size() + " keys from " + shape.type().getSimpleName());
    return result;
  }

  <R> R fromMap(Class<R> type, Map<String, ?> map) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(map, "map must not be null");
    final RecordShape<R> shape = MetadataResolver.shape(type);
    final List<FieldDescriptor> fields = shape.fields();
    final Object[] values = new Object[fields.size()];
    MarshalException failure = null;
    for (int i = 0; i < fields.size(); i++) {
      try {
        values[i] = resolve(fields.get(i), map);
      } catch (MarshalException e) {
        failure = collect(failure, e);
      }
    }
    if (config.strict()) {
      for (Object key : map.keySet()) {
        if (!shape.externalKeys().contains(String.valueOf(key))) {
          failure = collect(failure, new UnexpectedKeyException(String.valueOf(key)));
        }
      }
    }
    if (failure != null) {
      final MarshalException thrown = failure;
      LOGGER.fine(() -> "Rejected input for " + type.getSimpleName() + " with "
          + (1 + thrown.getSuppressed().length) + " violation(s): " + thrown.getMessage());
      throw failure;
    }
    return shape.construct(values);
  }

  private Object resolve(FieldDescriptor field, Map<String, ?> map) {
    if (map.containsKey(field.externalKey())) {
      return coercion.toInternal(map.get(field.externalKey()), field);
    }
    if (field.hasDefault()) {
      return field.defaultValue();
    }
    if (field.optional()) {
      return field.wrappedInOptional() ? Optional.empty() : null;
    }
    throw new MissingFieldException(field.name(), field.externalKey());
  }

  /// Fail fast throws straight away, otherwise later violations ride along on the first one
  private MarshalException collect(MarshalException first, MarshalException next) {
    if (config.failFast()) {
      throw next;
    }
    if (first == null) {
      return next;
    }
    first.addSuppressed(next);
    return first;
  }
}
