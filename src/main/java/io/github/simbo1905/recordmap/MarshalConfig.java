// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

/// Per call behaviour of the marshaler.
///
/// @param strict   reject input keys that match no field with [UnexpectedKeyException]
/// @param failFast throw on the first violation instead of reporting every top level violation at once
public record MarshalConfig(boolean strict, boolean failFast) {

  public static final String STRICT_PROPERTY = "no.framework.recordmap.Strict";
  public static final String FAIL_FAST_PROPERTY = "no.framework.recordmap.FailFast";

  /// Lenient and aggregating unless overridden with `-Dno.framework.recordmap.Strict=true` or
  /// `-Dno.framework.recordmap.FailFast=true`
  public static MarshalConfig defaults() {
    return new MarshalConfig(Boolean.getBoolean(STRICT_PROPERTY), Boolean.getBoolean(FAIL_FAST_PROPERTY));
  }

  public MarshalConfig withStrict(boolean strict) {
    return new MarshalConfig(strict, failFast);
  }

  public MarshalConfig withFailFast(boolean failFast) {
    return new MarshalConfig(strict, failFast);
  }
}
