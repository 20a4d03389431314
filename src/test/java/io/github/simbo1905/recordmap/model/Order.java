// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.model;

import io.github.simbo1905.recordmap.annotation.DateFormat;
import io.github.simbo1905.recordmap.annotation.DefaultValue;
import io.github.simbo1905.recordmap.annotation.OptionalField;
import io.github.simbo1905.recordmap.annotation.Rename;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record Order(
    UUID id,
    Customer customer,
    List<OrderItem> items,
    @Rename("placed_on") @DateFormat("yyyy-MM-dd") LocalDate placedOn,
    @DefaultValue("PENDING") OrderStatus status,
    BigDecimal total,
    @OptionalField String note) {
}
