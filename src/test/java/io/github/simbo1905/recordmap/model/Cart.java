// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.recordmap.model;

import java.util.List;

public record Cart(List<OrderItem> items) {
}
