// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import java.lang.invoke.MethodHandle;
import java.util.List;
import java.util.Set;

/// Everything resolved once per record type: the field descriptors in declaration order, the
/// canonical constructor and one accessor per component, indexed like the descriptors.
record RecordShape<R>(
    Class<R> type,
    List<FieldDescriptor> fields,
    Set<String> externalKeys,
    MethodHandle constructor,
    List<MethodHandle> accessors) {

  Object read(int index, Object record) {
    try {
      return accessors.get(index).invoke(record);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new RuntimeException("Failed to read " + fields.get(index).name() + " of " + type.getName(), t);
    }
  }

  /// Values are indexed like [#fields()]
  R construct(Object[] values) {
    final Object result;
    try {
      result = constructor.invokeWithArguments(values);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      throw new RecordConstructionException(type, t);
    }
    return type.cast(result);
  }
}
