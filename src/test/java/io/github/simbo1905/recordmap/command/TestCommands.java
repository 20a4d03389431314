// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.command;

import io.github.simbo1905.recordmap.model.Order;
import io.github.simbo1905.recordmap.model.OrderItem;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

/// Commands used by the dispatch tests. Each instance records what it saw.
final class TestCommands {

  private TestCommands() {
  }

  /// Both styles, returns a receipt
  public static class PlaceOrder implements RunnableCommand, DispatchableCommand {
    final List<Order> orders = new CopyOnWriteArrayList<>();
    final List<String> channels = new CopyOnWriteArrayList<>();
    final List<String> threads = new CopyOnWriteArrayList<>();

    public String handle(Order order, String channel) {
      orders.add(order);
      channels.add(channel);
      threads.add(Thread.currentThread().getName());
      return "receipt-" + order.id() + "-" + channel;
    }
  }

  public static class AddNumbers implements RunnableCommand {
    public int handle(int left, int right) {
      return left + right;
    }
  }

  public static class Notify implements DispatchableCommand {
    final List<String> events = new CopyOnWriteArrayList<>();
    final List<Object> payloads = new CopyOnWriteArrayList<>();
    final CountDownLatch latch;

    public Notify() {
      this(new CountDownLatch(0));
    }

    Notify(CountDownLatch latch) {
      this.latch = latch;
    }

    public void handle(String event, Object payload) {
      events.add(event);
      payloads.add(payload == null ? "null" : payload);
      latch.countDown();
    }
  }

  /// Numeric parameters that a JSON broker hands back as whatever boxed type fits the digits
  public static class Measure implements DispatchableCommand {
    final List<Object> seen = new CopyOnWriteArrayList<>();

    public void handle(long count, double ratio, java.math.BigDecimal amount) {
      seen.add(count);
      seen.add(ratio);
      seen.add(amount);
    }
  }

  /// Rejects every item, remembering what the failure hook was given
  public static class RejectItem implements DispatchableCommand {
    final List<Throwable> errors = new CopyOnWriteArrayList<>();
    final List<List<Object>> failedArguments = new CopyOnWriteArrayList<>();

    public void handle(OrderItem item) {
      throw new IllegalStateException("out of stock: " + item.productId());
    }

    @Override
    public void failed(Throwable error, List<Object> arguments) {
      errors.add(error);
      failedArguments.add(arguments);
    }
  }

  public static class BrokenHook implements DispatchableCommand {
    public void handle(String value) {
      throw new IllegalArgumentException("bad value " + value);
    }

    @Override
    public void failed(Throwable error, List<Object> arguments) {
      throw new IllegalStateException("hook exploded");
    }
  }

  public static class ReadsFile implements RunnableCommand {
    public String handle(String path) throws IOException {
      throw new IOException("no such file " + path);
    }
  }

  public static class NoHandle implements RunnableCommand {
    public void process() {
    }
  }

  public static class TwoHandles implements RunnableCommand {
    public void handle(String text) {
    }

    public void handle(int number) {
    }
  }

  public static class NeedsDependency implements RunnableCommand {
    private final String greeting;

    public NeedsDependency(String greeting) {
      this.greeting = greeting;
    }

    public String handle(String name) {
      return greeting + " " + name;
    }
  }
}
