// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.command;

/// The broker that persists and delivers dispatched jobs.
///
/// Implementations guarantee at-least-once delivery of each job to a [JobRunner] and own ordering,
/// retry and dead lettering. [JobRunner#execute(Job)] throws when a job fails, after the command's
/// failure hook ran, so the implementation can apply its retry policy.
@FunctionalInterface
public interface JobQueue {

  /// Accepts a job and returns without waiting for it to run
  void push(Job job);
}
