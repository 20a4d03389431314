// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.command;

/// A command cannot be constructed, resolved, invoked, or its arguments cannot cross the queue boundary.
/// Also wraps checked exceptions thrown by `handle`.
public class CommandException extends RuntimeException {

  public CommandException(String message) {
    super(message);
  }

  public CommandException(String message, Throwable cause) {
    super(message, cause);
  }
}
