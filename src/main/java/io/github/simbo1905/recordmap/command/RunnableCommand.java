// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.command;

/// A command that can be run synchronously through [CommandFacade#run(Object...)].
///
/// The business logic lives in the command's single public method named `handle`. Its parameters and
/// return type are up to the command.
public interface RunnableCommand {
}
