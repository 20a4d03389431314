// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/// A record type cannot be described: bad annotations, unsupported component types or
/// colliding external keys. Raised on first use of the type and never cached.
public final class InvalidMetadataException extends MarshalException {

  private final Class<?> recordType;

  InvalidMetadataException(@NotNull Class<?> recordType, @NotNull String path, @NotNull String detail) {
    this(recordType, path, detail, null);
  }

  InvalidMetadataException(@NotNull Class<?> recordType, @NotNull String path, @NotNull String detail, @Nullable Throwable cause) {
    super(path, null, recordType.getName() + ": " + detail, cause);
    this.recordType = recordType;
  }

  public Class<?> recordType() {
    return recordType;
  }
}
