// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import org.jetbrains.annotations.NotNull;

/// Strict mode only: the input map holds a key that matches no field.
public final class UnexpectedKeyException extends MarshalException {

  UnexpectedKeyException(@NotNull String externalKey) {
    super(externalKey, externalKey, "unexpected key '" + externalKey + "'", null);
  }
}
