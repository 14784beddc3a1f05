// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

public enum Topology {
  /// A single host with every other device attached to it.
  STAR,
  /// A daisy chain of devices with failover along the chain.
  BUS,
  /// Several hosts sharing load with every device linked to every other.
  MESH,
  /// A single host hub with the remaining devices chained for failover.
  HYBRID
}
