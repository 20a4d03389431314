// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.command;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/// [JobQueue] for tests: records dispatched jobs instead of running them.
///
/// ```java
/// RecordingJobQueue queue = new RecordingJobQueue();
/// CommandFacade.of(SendInvoice.class, container, queue).dispatch(invoice);
/// assertThat(queue.dispatched(SendInvoice.class)).hasSize(1);
/// queue.drain(new JobRunner(container));
/// ```
public final class RecordingJobQueue implements JobQueue {

  private final List<Job> jobs = new CopyOnWriteArrayList<>();

  @Override
  public void push(@NotNull Job job) {
    jobs.add(Objects.requireNonNull(job, "job must not be null"));
  }

  /// Every recorded job in dispatch order
  public @NotNull List<Job> jobs() {
    return List.copyOf(jobs);
  }

  public @NotNull List<Job> jobsOn(@NotNull String queue) {
    return jobs.stream().filter(job -> job.queue().equals(queue)).toList();
  }

  public @NotNull List<Job> dispatched(@NotNull Class<?> commandType) {
    return jobs.stream().filter(job -> job.commandType().equals(commandType.getName())).toList();
  }

  public boolean wasDispatched(@NotNull Class<?> commandType) {
    return !dispatched(commandType).isEmpty();
  }

  /// Runs and forgets every recorded job in dispatch order, continuing past failures
  /// @return how many jobs failed
  public int drain(@NotNull JobRunner runner) {
    final List<Job> pending = new ArrayList<>(jobs);
    jobs.removeAll(pending);
    int failures = 0;
    for (Job job : pending) {
      try {
        runner.execute(job);
      } catch (RuntimeException e) {
        // the runner already logged it and ran the failure hook
        failures++;
      }
    }
    return failures;
  }

  public void clear() {
    jobs.clear();
  }
}
