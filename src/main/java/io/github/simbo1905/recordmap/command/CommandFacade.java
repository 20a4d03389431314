// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.command;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point for invoking one command type, either now on the caller's thread or later through a queue.
///
/// ```java
/// CommandFacade<SendInvoice> sendInvoice = CommandFacade.of(SendInvoice.class, container, queue);
/// Receipt receipt = sendInvoice.run(invoice);          // synchronous, returns the result
/// sendInvoice.dispatchOn("billing", invoice);          // enqueued, returns at once
/// ```
///
/// A facade holds no mutable state and can be shared.
public final class CommandFacade<C> {

  public static final Logger LOGGER = Logger.getLogger(CommandFacade.class.getName());

  public static final String DEFAULT_QUEUE = "default";

  private final Class<C> commandType;
  private final CommandContainer container;
  private final JobQueue queue;

  private CommandFacade(Class<C> commandType, CommandContainer container, @Nullable JobQueue queue) {
    this.commandType = Objects.requireNonNull(commandType, "commandType must not be null");
    this.container = Objects.requireNonNull(container, "container must not be null");
    this.queue = queue;
  }

  /// A facade that can only [#run(Object...)]
  public static <C> CommandFacade<C> of(@NotNull Class<C> commandType, @NotNull CommandContainer container) {
    return new CommandFacade<>(commandType, container, null);
  }

  public static <C> CommandFacade<C> of(@NotNull Class<C> commandType, @NotNull CommandContainer container,
                                        @NotNull JobQueue queue) {
    return new CommandFacade<>(commandType, container, Objects.requireNonNull(queue, "queue must not be null"));
  }

  /// Runs `handle` now. Arguments are passed as given, nothing is marshaled.
  /// @return the result of `handle`, null for void
  /// @throws CommandException if the command is not a [RunnableCommand] or the arguments do not fit
  @SuppressWarnings("unchecked")
  public <T> T run(Object... arguments) {
    if (!RunnableCommand.class.isAssignableFrom(commandType)) {
      throw new CommandException(commandType.getName() + " is not a " + RunnableCommand.class.getSimpleName());
    }
    final var entryPoint = CommandEntryPoint.of(commandType);
    final var argumentList = Arrays.asList(nonNull(arguments));
    entryPoint.checkArguments(argumentList);
    final C command = construct();
    LOGGER.fine(() -> "Running " + commandType.getSimpleName() + " with " + argumentList.size() + " argument(s)");
    return (T) entryPoint.call(command, argumentList);
  }

  /// Same as [#dispatchOn(String, Object...)] on [#DEFAULT_QUEUE]
  public @NotNull Job dispatch(Object... arguments) {
    return dispatchOn(DEFAULT_QUEUE, arguments);
  }

  /// Converts record arguments to maps, hands the job to the queue and returns without waiting.
  /// @return the job as handed to the queue
  /// @throws CommandException if the command is not a [DispatchableCommand] or an argument is not transport-safe
  public @NotNull Job dispatchOn(@NotNull String queueName, Object... arguments) {
    Objects.requireNonNull(queueName, "queueName must not be null");
    if (queueName.isBlank()) {
      throw new IllegalArgumentException("queueName must not be blank");
    }
    if (!DispatchableCommand.class.isAssignableFrom(commandType)) {
      throw new CommandException(commandType.getName() + " is not a " + DispatchableCommand.class.getSimpleName());
    }
    if (queue == null) {
      throw new IllegalStateException("No JobQueue configured for " + commandType.getName());
    }
    final Object[] values = nonNull(arguments);
    CommandEntryPoint.of(commandType).checkArguments(Arrays.asList(values));
    final Job job = Job.create(commandType, queueName, values);
    queue.push(job);
    LOGGER.fine(() -> "Dispatched " + commandType.getSimpleName() + " as job " + job.id() + " on " + queueName);
    return job;
  }

  public @NotNull Class<C> commandType() {
    return commandType;
  }

  private C construct() {
    final Object command = container.construct(commandType);
    if (!commandType.isInstance(command)) {
      throw new CommandException("Container returned " + command + " for " + commandType.getName());
    }
    return commandType.cast(command);
  }

  /// `run((Object[]) null)` means no arguments
  private static Object[] nonNull(@Nullable Object[] arguments) {
    return arguments == null ? new Object[0] : arguments;
  }
}
