// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Converts instances of one record type to and from generic maps such as decoded JSON.
///
/// ```java
/// RecordMapper<Order> mapper = RecordMapper.forRecord(Order.class);
/// Map<String, Object> map = mapper.toMap(order);
/// Order copy = mapper.fromMap(map);
/// ```
///
/// Instances are immutable and safe to share between threads. The per type metadata they rely on is
/// resolved once per process and cached, see [RecordMaps#describe(Class)].
public sealed interface RecordMapper<R extends Record> permits RecordMapperImpl {

  Logger LOGGER = Logger.getLogger(RecordMapper.class.getName());

  /// Writes every non excluded field under its external key, in declaration order
  /// @param record The record to convert
  /// @return a new mutable map
  @NotNull Map<String, Object> toMap(@NotNull R record);

  /// Builds a record from a map. Absent keys take their default, optional fields take null or
  /// `Optional.empty()`, unknown keys are ignored unless the mapper is strict.
  /// @param map The input map
  /// @return a fully constructed record
  /// @throws MarshalException describing the first violation, with the others as suppressed exceptions
  @NotNull R fromMap(@NotNull Map<String, ?> map);

  /// @return the resolved field descriptors in declaration order
  @NotNull List<FieldDescriptor> fields();

  @NotNull Class<R> type();

  @NotNull MarshalConfig config();

  /// Factory method using [MarshalConfig#defaults()]
  /// @param type The record class
  /// @throws InvalidMetadataException if the record type cannot be described
  static <R extends Record> RecordMapper<R> forRecord(@NotNull Class<R> type) {
    return forRecord(type, MarshalConfig.defaults());
  }

  /// Factory method. Resolves the metadata eagerly so definition errors surface here.
  /// @param type The record class
  /// @param config Strictness and error aggregation
  /// @throws InvalidMetadataException if the record type cannot be described
  static <R extends Record> RecordMapper<R> forRecord(@NotNull Class<R> type, @NotNull MarshalConfig config) {
    Objects.requireNonNull(type, "Class must not be null");
    Objects.requireNonNull(config, "config must not be null");
    return new RecordMapperImpl<>(MetadataResolver.shape(type), new RecordMarshaler(config));
  }
}
