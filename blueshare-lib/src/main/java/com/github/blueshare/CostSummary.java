// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

public record CostSummary(double totalUsd, double perDeviceUsd) {
}
