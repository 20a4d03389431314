// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.command;

import io.github.simbo1905.recordmap.RecordMapper;
import io.github.simbo1905.recordmap.annotation.Rename;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/// A dispatched command waiting to run: which command, on which queue, with which arguments.
///
/// A job is itself a record so [#toMap()] and [#fromMap(Map)] give the broker a plain map to persist.
///
/// @param id          unique per dispatch
/// @param commandType class name of the command
/// @param queue       name of the target queue
/// @param arguments   transport-safe arguments in call order
public record Job(
    @NotNull String id,
    @Rename("command") @NotNull String commandType,
    @NotNull String queue,
    @NotNull List<JobArgument> arguments) {

  public Job {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(commandType, "commandType must not be null");
    Objects.requireNonNull(queue, "queue must not be null");
    arguments = List.copyOf(arguments);
  }

  static Job create(Class<?> commandType, String queue, Object[] arguments) {
    final List<JobArgument> converted = new ArrayList<>(arguments.length);
    for (int i = 0; i < arguments.length; i++) {
      converted.add(JobArgument.of(i, arguments[i]));
    }
    return new Job(UUID.randomUUID().toString(), commandType.getName(), queue, converted);
  }

  public @NotNull Map<String, Object> toMap() {
    return RecordMapper.forRecord(Job.class).toMap(this);
  }

  public static @NotNull Job fromMap(@NotNull Map<String, ?> map) {
    return RecordMapper.forRecord(Job.class).fromMap(map);
  }
}
