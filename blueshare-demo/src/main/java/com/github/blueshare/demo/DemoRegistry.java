// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare.demo;

import com.github.blueshare.Device;
import com.github.blueshare.DeviceRegistry;
import com.github.blueshare.DeviceRole;

import java.util.List;

/// A fixed set of four devices standing in for a Bluetooth scan: one host sharing 10 Mbps, two clients and a relay
/// whose signal strength can be chosen. The traffic counters are those the transport would have reported.
public class DemoRegistry implements DeviceRegistry {
  /// The relay is out of range at this strength and vetoes the session.
  public static final int DISTANT_RELAY_DBM = -95;
  /// The relay is ambiguous at this strength and the session goes ahead.
  public static final int NEARBY_RELAY_DBM = -85;

  private final int relaySignalDbm;

  public DemoRegistry(int relaySignalDbm) {
    this.relaySignalDbm = relaySignalDbm;
  }

  @Override
  public List<Device> discover() {
    return List.of(
        new Device("host-001", "Alice (Host)", DeviceRole.HOST, -65, 10.0)
            .recordTraffic(5_242_880, 2_097_152),
        new Device("client-001", "Bob", DeviceRole.CLIENT, -72, 0.0)
            .recordTraffic(1_048_576, 10_485_760),
        new Device("client-002", "Carol", DeviceRole.CLIENT, -68, 0.0)
            .recordTraffic(524_288, 3_145_728),
        new Device("relay-001", "Dave (Relay)", DeviceRole.RELAY, relaySignalDbm, 0.0)
            .recordTraffic(2_097_152, 1_048_576));
  }
}
