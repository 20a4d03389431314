// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.command;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/// Supplies command instances. Usually backed by the application's dependency injection container:
///
/// ```java
/// CommandContainer container = injector::getInstance;
/// ```
@FunctionalInterface
public interface CommandContainer {

  /// @param commandType the command class
  /// @return a ready to use instance of exactly that class or a subclass
  Object construct(Class<?> commandType);

  /// Builds commands through their no-arg constructor
  static CommandContainer reflective() {
    return commandType -> {
      try {
        final Constructor<?> constructor = commandType.getDeclaredConstructor();
        constructor.setAccessible(true);
        return constructor.newInstance();
      } catch (NoSuchMethodException e) {
        throw new CommandException(commandType.getName() + " has no no-arg constructor", e);
      } catch (InvocationTargetException e) {
        throw new CommandException("Constructor of " + commandType.getName() + " failed", e.getCause());
      } catch (ReflectiveOperationException | RuntimeException e) {
        throw new CommandException("Cannot construct " + commandType.getName() + ": " + e.getMessage(), e);
      }
    };
  }
}
