// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

/// The part a device plays in a shared network.
public enum DeviceRole {
  /// Shares its upstream connection. Only hosts contribute bandwidth capacity.
  HOST,
  /// Uses the shared connection and pays for what it uses.
  CLIENT,
  /// Forwards traffic for others.
  RELAY,
  /// Monitors the session only.
  OBSERVER
}
