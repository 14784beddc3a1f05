// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

/// @param totalMbps        The sum of the capacity advertised by all hosts.
/// @param fairShareMbps    The planned per-device allocation under the "double space, half time" policy.
public record BandwidthAllocation(double totalMbps, double fairShareMbps) {
}
