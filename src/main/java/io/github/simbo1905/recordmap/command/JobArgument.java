// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.command;

import io.github.simbo1905.recordmap.MarshalConfig;
import io.github.simbo1905.recordmap.MarshalException;
import io.github.simbo1905.recordmap.RecordMapper;
import io.github.simbo1905.recordmap.RecordMaps;
import io.github.simbo1905.recordmap.annotation.OptionalField;
import io.github.simbo1905.recordmap.annotation.Rename;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/// One argument of a dispatched command in transport-safe form.
///
/// A record argument is held as its class name plus the map `toMap` produced; anything else is held as
/// the plain JSON-like value it already is.
///
/// @param recordType class name of a marshaled record, null for plain values
/// @param value      the record's field map, or the plain value
public record JobArgument(
    @Rename("type") @OptionalField String recordType,
    @OptionalField Object value) {

  /// Wraps one `handle` argument
  /// @throws CommandException if the value is neither a record nor JSON-like
  static JobArgument of(int position, @Nullable Object argument) {
    if (argument instanceof Record record) {
      final Map<String, Object> fields;
      try {
        fields = RecordMaps.toMap(record);
      } catch (MarshalException e) {
        throw new CommandException("Argument " + position + " of type " + record.getClass().getName()
            + " cannot be marshaled: " + e.getMessage(), e);
      }
      if (!isTransportSafe(fields)) {
        throw new CommandException("Argument " + position + " of type " + record.getClass().getName()
            + " marshaled to a map that cannot cross the queue boundary");
      }
      return new JobArgument(record.getClass().getName(), fields);
    }
    if (!isTransportSafe(argument)) {
      throw new CommandException("Argument " + position + " of type " + argument.getClass().getName()
          + " cannot cross the queue boundary, pass a record or a JSON-like value");
    }
    return new JobArgument(null, argument);
  }

  public boolean isRecord() {
    return recordType != null;
  }

  /// Rebuilds the original argument, turning a marshaled record back into an instance
  Object restore(ClassLoader classLoader, MarshalConfig config) {
    if (!isRecord()) {
      return value;
    }
    final Class<?> type;
    try {
      type = Class.forName(recordType, false, classLoader);
    } catch (ClassNotFoundException e) {
      throw new CommandException("Unknown record type " + recordType, e);
    }
    if (!type.isRecord()) {
      throw new CommandException(recordType + " is not a record");
    }
    if (!(value instanceof Map<?, ?> fields)) {
      throw new CommandException("Marshaled " + recordType + " has no field map");
    }
    @SuppressWarnings("unchecked") final Map<String, ?> map = (Map<String, ?>) fields;
    return RecordMapper.forRecord(type.asSubclass(Record.class), config).fromMap(map);
  }

  /// null, text, numbers, booleans, and lists or maps made only of those
  static boolean isTransportSafe(@Nullable Object value) {
    if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
      return true;
    }
    if (value instanceof List<?> list) {
      return list.stream().allMatch(JobArgument::isTransportSafe);
    }
    if (value instanceof Map<?, ?> map) {
      return map.keySet().stream().allMatch(k -> k instanceof String)
          && map.values().stream().allMatch(JobArgument::isTransportSafe);
    }
    return false;
  }
}
