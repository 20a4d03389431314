// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/// Text does not match the `@DateFormat` pattern of its field.
public final class DateFormatException extends MarshalException {

  private final String pattern;
  private final String text;

  DateFormatException(@NotNull String path, @Nullable String externalKey, @NotNull String pattern,
                      @NotNull String text, @Nullable Throwable cause) {
    super(path, externalKey, "text '" + text + "' does not match date pattern '" + pattern + "'", cause);
    this.pattern = pattern;
    this.text = text;
  }

  public @NotNull String pattern() {
    return pattern;
  }

  public @NotNull String text() {
    return text;
  }
}
