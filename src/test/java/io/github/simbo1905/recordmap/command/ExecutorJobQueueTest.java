// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.command;

import io.github.simbo1905.LoggingControl;
import io.github.simbo1905.recordmap.model.OrderItem;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutorJobQueueTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  void jobsOnOneQueueRunInDispatchOrder() throws Exception {
    final CountDownLatch done = new CountDownLatch(20);
    final TestCommands.Notify command = new TestCommands.Notify(done);
    final CommandContainer container = type -> command;
    try (ExecutorJobQueue queue = new ExecutorJobQueue(new JobRunner(container))) {
      final CommandFacade<TestCommands.Notify> facade = CommandFacade.of(TestCommands.Notify.class, container, queue);
      IntStream.range(0, 20).forEach(i -> facade.dispatchOn("ordered", "event-" + i, i));

      assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
    }

    assertThat(command.events).containsExactlyElementsOf(IntStream.range(0, 20).mapToObj(i -> "event-" + i).toList());
    assertThat(command.payloads).containsExactlyElementsOf(IntStream.range(0, 20).boxed().map(Object.class::cast).toList());
  }

  @Test
  void recordArgumentsArriveRebuiltOnTheLaneThread() throws Exception {
    final TestCommands.PlaceOrder command = new TestCommands.PlaceOrder();
    final CommandContainer container = type -> command;
    try (ExecutorJobQueue queue = new ExecutorJobQueue(new JobRunner(container))) {
      CommandFacade.of(TestCommands.PlaceOrder.class, container, queue).dispatchOn("orders", CommandFacadeTest.order(), "web");
    }

    assertThat(command.orders).containsExactly(CommandFacadeTest.order());
    assertThat(command.orders.get(0)).isNotSameAs(CommandFacadeTest.order());
    assertThat(command.threads).containsExactly("job-queue-orders");
  }

  @Test
  void failedJobDoesNotStopTheLane() throws Exception {
    final TestCommands.RejectItem reject = new TestCommands.RejectItem();
    final CountDownLatch done = new CountDownLatch(1);
    final TestCommands.Notify notify = new TestCommands.Notify(done);
    final CommandContainer container = type -> type == TestCommands.Notify.class ? notify : reject;
    try (ExecutorJobQueue queue = new ExecutorJobQueue(new JobRunner(container))) {
      CommandFacade.of(TestCommands.RejectItem.class, container, queue).dispatchOn("mixed", new OrderItem(9, 1));
      CommandFacade.of(TestCommands.Notify.class, container, queue).dispatchOn("mixed", "after", null);

      assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
    }

    assertThat(reject.errors).hasSize(1);
    assertThat(notify.events).containsExactly("after");
  }

  @Test
  void undecodableJobIsDroppedOnTheLane() throws Exception {
    try (ExecutorJobQueue queue = new ExecutorJobQueue(new JobRunner(CommandContainer.reflective()))) {
      assertThatCode(() -> queue.deliver(Map.of("id", "x"))).doesNotThrowAnyException();
      assertThatCode(() -> queue.deliver(Map.of("id", "y", "command", 7, "queue", "q", "arguments", "none")))
          .doesNotThrowAnyException();
    }
  }

  @Test
  void closedQueueRejectsJobs() throws Exception {
    final ExecutorJobQueue queue = new ExecutorJobQueue(new JobRunner(CommandContainer.reflective()));
    queue.close();

    final Job job = Job.create(TestCommands.Notify.class, "late", new Object[]{"x", null});
    assertThatThrownBy(() -> queue.push(job)).isInstanceOf(IllegalStateException.class);
  }
}
