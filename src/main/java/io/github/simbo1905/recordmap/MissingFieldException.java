// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import org.jetbrains.annotations.NotNull;

/// A required field without default is absent from the input map.
public final class MissingFieldException extends MarshalException {

  MissingFieldException(@NotNull String fieldName, @NotNull String externalKey) {
    super(fieldName, externalKey, "required key '" + externalKey + "' is missing", null);
  }
}
