// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.command;

import java.util.List;

/// A command that can be enqueued through [CommandFacade#dispatch(Object...)] and executed later by a
/// [JobRunner]. Independent of [RunnableCommand]; implement both to support both styles.
///
/// Record arguments travel as maps and are rebuilt before `handle` runs. Every other argument must be a
/// JSON-like value: null, text, a number, a boolean, or a list or map of those.
public interface DispatchableCommand {

  /// Called when deferred execution fails, before the error is handed back to the queue for its own retry
  /// policy. Does nothing unless overridden.
  ///
  /// @param error     what `handle` threw
  /// @param arguments the arguments `handle` was called with, records already rebuilt
  default void failed(Throwable error, List<Object> arguments) {
  }
}
