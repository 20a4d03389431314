// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/// Root of every failure raised while describing, reading or writing a record.
///
/// Each failure carries the path of the offending field, for example `items[1].quantity`, and the
/// external key it was read from. When a nested record or list element fails the enclosing
/// field name is prepended as the failure travels outward. When several top level fields fail in
/// one call the first failure is thrown and the others are attached with [Throwable#addSuppressed].
public abstract sealed class MarshalException extends RuntimeException permits
    InvalidMetadataException, MissingFieldException, TypeCoercionException, DateFormatException,
    UnexpectedKeyException, RecordConstructionException {

  private String path;
  private final String externalKey;

  MarshalException(@NotNull String path, @Nullable String externalKey, @NotNull String detail, @Nullable Throwable cause) {
    super(detail, cause);
    this.path = path;
    this.externalKey = externalKey;
  }

  /// Dotted path from the outermost record down to the failing field. Empty when the failure
  /// concerns the record as a whole.
  public @NotNull String path() {
    return path;
  }

  /// Key of the failing field in the external map, or null when there is none.
  public @Nullable String externalKey() {
    return externalKey;
  }

  /// The message without the path prefix.
  public @NotNull String detail() {
    return super.getMessage();
  }

  @Override
  public String getMessage() {
    return path.isEmpty() ? detail() : path + ": " + detail();
  }

  /// Prefixes the path with a field name or a list index such as `[2]`. Suppressed siblings
  /// raised in the same nested call get the same prefix.
  MarshalException prependPath(@NotNull String segment) {
    if (segment.isEmpty()) {
      return this;
    }
    if (path.isEmpty()) {
      path = segment;
    } else if (path.startsWith("[")) {
      path = segment + path;
    } else {
      path = segment + "." + path;
    }
    for (Throwable suppressed : getSuppressed()) {
      if (suppressed instanceof MarshalException other) {
        other.prependPath(segment);
      }
    }
    return this;
  }
}
