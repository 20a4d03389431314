// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.command;

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

import static io.github.simbo1905.recordmap.command.CommandFacade.LOGGER;

/// In-process [JobQueue]: one single-threaded lane per queue name, so jobs on the same queue run in
/// dispatch order and different queues run in parallel.
///
/// Each job is rendered to a map and read back before it runs, so arguments reach `handle` exactly as
/// they would after a real broker persisted them. Failed jobs are logged after the command's failure
/// hook ran and are not retried.
public final class ExecutorJobQueue implements JobQueue, AutoCloseable {

  private final JobRunner runner;
  private final Map<String, ExecutorService> lanes = new ConcurrentHashMap<>();
  private volatile boolean closed;

  public ExecutorJobQueue(@NotNull JobRunner runner) {
    this.runner = Objects.requireNonNull(runner, "runner must not be null");
  }

  @Override
  public void push(@NotNull Job job) {
    Objects.requireNonNull(job, "job must not be null");
    if (closed) {
      throw new IllegalStateException("Queue is closed, cannot accept job " + job.id());
    }
    final Map<String, Object> persisted = job.toMap();
    lanes.computeIfAbsent(job.queue(), this::newLane).execute(() -> deliver(persisted));
  }

  /// Decodes and runs one persisted job. Undecodable payloads and failed jobs are logged and dropped.
  void deliver(Map<String, ?> persisted) {
    try {
      runner.execute(Job.fromMap(persisted));
    } catch (RuntimeException e) {
      LOGGER.log(Level.WARNING, e, () -> "Dropping failed job " + persisted.get("id") + " on queue " + persisted.get("queue"));
    }
  }

  private ExecutorService newLane(String queue) {
    LOGGER.info(() -> "Starting lane for queue " + queue);
    return Executors.newSingleThreadExecutor(task -> {
      final Thread thread = new Thread(task, "job-queue-" + queue);
      thread.setDaemon(true);
      return thread;
    });
  }

  /// Stops accepting jobs and waits for queued ones to finish
  @Override
  public void close() throws InterruptedException {
    closed = true;
    for (Map.Entry<String, ExecutorService> lane : lanes.entrySet()) {
      lane.getValue().shutdown();
    }
    for (Map.Entry<String, ExecutorService> lane : lanes.entrySet()) {
      while (!lane.getValue().awaitTermination(1, TimeUnit.SECONDS)) {
        LOGGER.fine(() -> "Waiting for queue " + lane.getKey() + " to drain");
      }
    }
  }
}
