// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import org.jetbrains.annotations.NotNull;

/// Every field resolved but the canonical constructor rejected the values.
public final class RecordConstructionException extends MarshalException {

  RecordConstructionException(@NotNull Class<?> recordType, @NotNull Throwable cause) {
    super("", null, "constructor of " + recordType.getName() + " failed: " + cause.getMessage(), cause);
  }
}
