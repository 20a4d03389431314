// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

final class RecordMapperImpl<R extends Record> implements RecordMapper<R> {

  final RecordShape<R> shape;
  final RecordMarshaler marshaler;

  RecordMapperImpl(RecordShape<R> shape, RecordMarshaler marshaler) {
    this.shape = shape;
    this.marshaler = marshaler;
    LOGGER.fine(() -> "RecordMapper ready for " + shape.type().getSimpleName() + " with " + marshaler.config);
  }

  @Override
  public @NotNull Map<String, Object> toMap(@NotNull R record) {
    return marshaler.toMap(record);
  }

  @Override
  public @NotNull R fromMap(@NotNull Map<String, ?> map) {
    return marshaler.fromMap(shape.type(), map);
  }

  @Override
  public @NotNull List<FieldDescriptor> fields() {
    return shape.fields();
  }

  @Override
  public @NotNull Class<R> type() {
    return shape.type();
  }

  @Override
  public @NotNull MarshalConfig config() {
    return marshaler.config;
  }

  @Override
  public String toString() {
    return "RecordMapper[" + shape.type().getName() + "]";
  }
}
