// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.util.List;

/// The transport layer that discovers nearby devices. It supplies each device with its role, signal strength, byte
/// counters and, for hosts, the bandwidth capacity on offer. Real implementations scan Bluetooth LE advertisements.
@FunctionalInterface
public interface DeviceRegistry {
  /// @return The devices currently in range, in discovery order. The same device must not be returned twice.
  List<Device> discover();
}
