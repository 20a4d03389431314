// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/// A value cannot be converted into the declared type of its field.
public final class TypeCoercionException extends MarshalException {

  private final transient Object value;
  private final String sourceKind;
  private final String targetKind;

  TypeCoercionException(@NotNull String path, @Nullable String externalKey, @Nullable Object value,
                        @NotNull String targetKind, @Nullable Throwable cause) {
    super(path, externalKey, "cannot convert " + kindOf(value) + render(value) + " to " + targetKind, cause);
    this.value = value;
    this.sourceKind = kindOf(value);
    this.targetKind = targetKind;
  }

  public @Nullable Object value() {
    return value;
  }

  public @NotNull String sourceKind() {
    return sourceKind;
  }

  public @NotNull String targetKind() {
    return targetKind;
  }

  static String kindOf(@Nullable Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }

  static String render(@Nullable Object value) {
    if (value == null) {
      return "";
    }
    final var text = String.valueOf(value);
    return " '" + (text.length() > 64 ? text.substring(0, 64) + "..." : text) + "'";
  }
}
