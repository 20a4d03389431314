// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/// Static entry points for callers that do not hold a [RecordMapper]. All use [MarshalConfig#defaults()].
public final class RecordMaps {

  private RecordMaps() {
  }

  public static @NotNull Map<String, Object> toMap(@NotNull Record record) {
    return new RecordMarshaler(MarshalConfig.defaults()).toMap(record);
  }

  public static <R extends Record> @NotNull R fromMap(@NotNull Class<R> type, @NotNull Map<String, ?> map) {
    return new RecordMarshaler(MarshalConfig.defaults()).fromMap(type, map);
  }

  /// Resolved field descriptors of a record type, computed once per process
  /// @throws InvalidMetadataException if the record type cannot be described
  public static @NotNull List<FieldDescriptor> describe(@NotNull Class<? extends Record> type) {
    return MetadataResolver.describe(type);
  }

  /// Forgets every resolved record type. Meant for test isolation.
  public static void clearCache() {
    MetadataResolver.clear();
  }
}
