// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/// An undirected adjacency list of the links between devices, keyed by device identity. This is owned by the [Session]
/// so that devices never point at each other or back at their session.
public final class TopologyLinks {
  private final Map<DeviceId, Set<DeviceId>> adjacency = new LinkedHashMap<>();

  public static TopologyLinks empty() {
    return new TopologyLinks();
  }

  void addDevice(DeviceId device) {
    adjacency.computeIfAbsent(device, k -> new LinkedHashSet<>());
  }

  void link(DeviceId a, DeviceId b) {
    if (a.equals(b)) {
      throw new IllegalArgumentException("a device cannot link to itself: " + a);
    }
    adjacency.computeIfAbsent(a, k -> new LinkedHashSet<>()).add(b);
    adjacency.computeIfAbsent(b, k -> new LinkedHashSet<>()).add(a);
  }

  public Set<DeviceId> neighbours(DeviceId device) {
    return Collections.unmodifiableSet(adjacency.getOrDefault(device, Set.of()));
  }

  public boolean linked(DeviceId a, DeviceId b) {
    return adjacency.getOrDefault(a, Set.of()).contains(b);
  }

  public int linkCount() {
    return adjacency.values().stream().mapToInt(Set::size).sum() / 2;
  }

  public Set<DeviceId> devices() {
    return Collections.unmodifiableSet(adjacency.keySet());
  }

  @Override
  public String toString() {
    return "TopologyLinks" + adjacency;
  }
}
