// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.command;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import static io.github.simbo1905.recordmap.command.CommandFacade.LOGGER;

/// The resolved `handle` method of a command type, cached per type like record metadata.
record CommandEntryPoint(Class<?> commandType, Method method, MethodHandle handle) {

  static final String METHOD_NAME = "handle";

  static final ConcurrentHashMap<Class<?>, CommandEntryPoint> REGISTRY = new ConcurrentHashMap<>();

  static CommandEntryPoint of(Class<?> commandType) {
    return REGISTRY.computeIfAbsent(commandType, CommandEntryPoint::resolve);
  }

  static CommandEntryPoint resolve(Class<?> commandType) {
    final List<Method> candidates = Arrays.stream(commandType.getMethods())
        .filter(m -> m.getName().equals(METHOD_NAME))
        .filter(m -> !m.isBridge() && !m.isSynthetic())
        .filter(m -> !Modifier.isStatic(m.getModifiers()))
        .toList();
    if (candidates.size() != 1) {
      throw new CommandException(commandType.getName() + " must declare exactly one public " + METHOD_NAME
          + " method, found " + candidates.size());
    }
    final Method method = candidates.get(0);
    try {
      method.setAccessible(true);
      final MethodHandle handle = MethodHandles.lookup().unreflect(method);
      LOGGER.fine(() -> "Resolved entry point " + commandType.getSimpleName() + "." + METHOD_NAME
          + Arrays.toString(method.getParameterTypes()));
      return new CommandEntryPoint(commandType, method, handle);
    } catch (IllegalAccessException | RuntimeException e) {
      throw new CommandException("Cannot access " + commandType.getName() + "." + METHOD_NAME, e);
    }
  }

  /// Rejects argument lists `handle` cannot accept, before anything runs or is enqueued
  void checkArguments(List<?> arguments) {
    final Class<?>[] parameterTypes = method.getParameterTypes();
    if (method.isVarArgs()) {
      if (arguments.size() < parameterTypes.length - 1) {
        throw new CommandException(describe() + " needs at least " + (parameterTypes.length - 1)
            + " arguments, got " + arguments.size());
      }
      return;
    }
    if (arguments.size() != parameterTypes.length) {
      throw new CommandException(describe() + " takes " + parameterTypes.length + " arguments, got " + arguments.size());
    }
    for (int i = 0; i < parameterTypes.length; i++) {
      final Object argument = arguments.get(i);
      final Class<?> parameterType = parameterTypes[i];
      if (argument == null) {
        if (parameterType.isPrimitive()) {
          throw new CommandException(describe() + " argument " + i + " is null but the parameter is " + parameterType);
        }
      } else if (!MethodType.methodType(parameterType).wrap().returnType().isInstance(argument)) {
        throw new CommandException(describe() + " argument " + i + " is a " + argument.getClass().getName()
            + " but the parameter is " + parameterType.getName());
      }
    }
  }

  /// Converts plain numeric arguments to the numeric parameter type they are passed to, as long as no
  /// information is lost. A JSON broker hands back `2` for a `long` parameter as an `Integer`.
  /// Anything that does not convert exactly is left for [#checkArguments(List)] to reject.
  List<Object> widenNumbers(List<?> arguments) {
    final Class<?>[] parameterTypes = method.getParameterTypes();
    final List<Object> result = new ArrayList<>(arguments);
    if (method.isVarArgs() || arguments.size() != parameterTypes.length) {
      return result;
    }
    for (int i = 0; i < parameterTypes.length; i++) {
      if (result.get(i) instanceof Number number) {
        result.set(i, widen(number, MethodType.methodType(parameterTypes[i]).wrap().returnType()));
      }
    }
    return result;
  }

  static Object widen(Number number, Class<?> target) {
    if (target.isInstance(number)) {
      return number;
    }
    try {
      final BigDecimal exact = new BigDecimal(number.toString());
      if (target == Long.class) {
        return exact.longValueExact();
      }
      if (target == Integer.class) {
        return exact.intValueExact();
      }
      if (target == Short.class) {
        return exact.shortValueExact();
      }
      if (target == Byte.class) {
        return exact.byteValueExact();
      }
      if (target == Double.class) {
        return number.doubleValue();
      }
      if (target == Float.class) {
        return number.floatValue();
      }
      if (target == BigDecimal.class) {
        return exact;
      }
      if (target == BigInteger.class) {
        return exact.toBigIntegerExact();
      }
    } catch (ArithmeticException | NumberFormatException e) {
      LOGGER.finer(() -> "Cannot convert " + number + " to " + target.getSimpleName() + ": " + e.getMessage());
    }
    return number;
  }

  /// Runs `handle` on the caller's thread. Unchecked failures propagate unchanged, checked ones are wrapped.
  Object call(Object command, List<?> arguments) {
    checkArguments(arguments);
    final List<Object> receiverAndArguments = new ArrayList<>(arguments.size() + 1);
    receiverAndArguments.add(command);
    receiverAndArguments.addAll(arguments);
    try {
      return handle.invokeWithArguments(receiverAndArguments);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new CommandException(describe() + " failed: " + t.getMessage(), t);
    }
  }

  private String describe() {
    return commandType.getSimpleName() + "." + METHOD_NAME;
  }
}
