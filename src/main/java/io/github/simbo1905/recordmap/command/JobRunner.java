// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.command;

import io.github.simbo1905.recordmap.MarshalConfig;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;

import static io.github.simbo1905.recordmap.command.CommandFacade.LOGGER;

/// Executes delivered jobs. A [JobQueue] implementation calls [#execute(Job)] once per delivery attempt.
public final class JobRunner {

  private final CommandContainer container;
  private final MarshalConfig config;
  private final ClassLoader classLoader;

  public JobRunner(@NotNull CommandContainer container) {
    this(container, MarshalConfig.defaults(), JobRunner.class.getClassLoader());
  }

  /// @param container   builds the command instances
  /// @param config      used to rebuild record arguments
  /// @param classLoader resolves command and record class names
  public JobRunner(@NotNull CommandContainer container, @NotNull MarshalConfig config, @NotNull ClassLoader classLoader) {
    this.container = Objects.requireNonNull(container, "container must not be null");
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.classLoader = Objects.requireNonNull(classLoader, "classLoader must not be null");
  }

  /// Rebuilds the arguments, constructs the command and calls `handle`. Plain numbers are converted to
  /// the numeric parameter type when that loses nothing.
  ///
  /// When rebuilding the arguments or `handle` fails the command's [DispatchableCommand#failed] hook is
  /// called first and the failure is then rethrown for the queue's retry policy. If rebuilding failed the
  /// hook sees the transport form of the arguments.
  ///
  /// @return whatever `handle` returned
  public Object execute(@NotNull Job job) {
    Objects.requireNonNull(job, "job must not be null");
    LOGGER.fine(() -> "Executing job " + job.id() + " " + job.commandType() + " from queue " + job.queue());
    final Class<?> commandType = load(job.commandType());
    final DispatchableCommand command = (DispatchableCommand) construct(commandType);

    List<Object> arguments = transportForm(job);
    try {
      final CommandEntryPoint entryPoint = CommandEntryPoint.of(commandType);
      arguments = Collections.unmodifiableList(entryPoint.widenNumbers(restore(job)));
      return entryPoint.call(command, arguments);
    } catch (RuntimeException e) {
      LOGGER.log(Level.WARNING, e, () -> "Job " + job.id() + " " + commandType.getSimpleName() + " failed: " + e.getMessage());
      notifyFailure(command, e, arguments);
      throw e;
    }
  }

  private Class<?> load(String commandType) {
    final Class<?> type;
    try {
      type = Class.forName(commandType, true, classLoader);
    } catch (ClassNotFoundException e) {
      throw new CommandException("Unknown command type " + commandType, e);
    }
    if (!DispatchableCommand.class.isAssignableFrom(type)) {
      throw new CommandException(commandType + " is not a " + DispatchableCommand.class.getSimpleName());
    }
    return type;
  }

  private Object construct(Class<?> commandType) {
    final Object command = container.construct(commandType);
    if (!commandType.isInstance(command)) {
      throw new CommandException("Container returned " + command + " for " + commandType.getName());
    }
    return command;
  }

  private List<Object> restore(Job job) {
    final List<Object> arguments = new ArrayList<>(job.arguments().size());
    for (JobArgument argument : job.arguments()) {
      arguments.add(argument.restore(classLoader, config));
    }
    return Collections.unmodifiableList(arguments);
  }

  private static List<Object> transportForm(Job job) {
    final List<Object> arguments = new ArrayList<>(job.arguments().size());
    for (JobArgument argument : job.arguments()) {
      arguments.add(argument.value());
    }
    return Collections.unmodifiableList(arguments);
  }

  private static void notifyFailure(DispatchableCommand command, RuntimeException error, List<Object> arguments) {
    try {
      command.failed(error, arguments);
    } catch (RuntimeException hookFailure) {
      LOGGER.log(Level.SEVERE, hookFailure, () -> "Failure hook of " + command.getClass().getSimpleName()
          + " threw " + hookFailure.getMessage());
      error.addSuppressed(hookFailure);
    }
  }
}
