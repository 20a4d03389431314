// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/// Resolved metadata of one record component. Immutable and structurally comparable, so two
/// resolutions of the same type always produce equal lists.
///
/// @param name              the record component name
/// @param externalKey       key used in the external map, the component name unless renamed
/// @param kind              conversion kind
/// @param javaType          erased component class, or the class wrapped by `Optional`
/// @param element           descriptor applied to each list element or map value, null when the content is opaque
/// @param dateFormat        `DateTimeFormatter` pattern for temporal values, null otherwise
/// @param excluded          never written by `toMap`
/// @param hasDefault        an absent key is filled with `defaultValue`
/// @param defaultValue      already converted to the component type
/// @param optional          null or absent is a valid value
/// @param wrappedInOptional the component is declared as `java.util.Optional`
public record FieldDescriptor(
    @NotNull String name,
    @NotNull String externalKey,
    @NotNull FieldKind kind,
    @NotNull Class<?> javaType,
    @Nullable FieldDescriptor element,
    @Nullable String dateFormat,
    boolean excluded,
    boolean hasDefault,
    @Nullable Object defaultValue,
    boolean optional,
    boolean wrappedInOptional) {

  public FieldDescriptor {
    Objects.requireNonNull(name, "name cannot be null");
    Objects.requireNonNull(externalKey, "externalKey cannot be null");
    Objects.requireNonNull(kind, "kind cannot be null");
    Objects.requireNonNull(javaType, "javaType cannot be null");
  }

  /// Descriptor for the elements of a list field. Elements have no name of their own so failures are
  /// reported by index under the enclosing field. Null elements are tolerated.
  static FieldDescriptor elementOf(String externalKey, FieldKind kind, Class<?> javaType, @Nullable String dateFormat) {
    return elementOf(externalKey, kind, javaType, dateFormat, null);
  }

  /// Element of a nested container, itself a list or map with its own element descriptor
  static FieldDescriptor elementOf(String externalKey, FieldKind kind, Class<?> javaType, @Nullable String dateFormat,
                                   @Nullable FieldDescriptor element) {
    return new FieldDescriptor("", externalKey, kind, javaType, element, dateFormat,
        false, false, null, true, false);
  }

  /// A list field whose elements are copied through on input and rendered as plain data on output
  public boolean isOpaqueList() {
    return kind == FieldKind.LIST && element == null;
  }

  /// A map field whose values are copied through on input and rendered as plain data on output
  public boolean isOpaqueMap() {
    return kind == FieldKind.MAP && element == null;
  }

  FieldDescriptor withDefault(Object value) {
    return new FieldDescriptor(name, externalKey, kind, javaType, element, dateFormat,
        excluded, true, value, optional, wrappedInOptional);
  }

  /// Target kind used in diagnostics, for example `int` or `LocalDate`
  String targetKind() {
    return javaType.getSimpleName();
  }
}
