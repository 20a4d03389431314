// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

/// How a field converts between its Java value and the external map value.
public enum FieldKind {
  STRING, BOOLEAN, CHARACTER,
  BYTE, SHORT, INTEGER, LONG,
  FLOAT, DOUBLE, BIG_INTEGER, BIG_DECIMAL,
  UUID, ENUM, TEMPORAL,
  /// nested record, converted to and from a nested map
  RECORD,
  /// converted element by element when the element type is known, otherwise copied through
  LIST,
  /// copied through
  MAP,
  /// declared as `Object`, copied through
  OPAQUE;

  boolean isContainer() {
    return this == LIST || this == MAP;
  }
}
