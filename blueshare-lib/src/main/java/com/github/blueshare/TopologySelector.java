// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.util.List;
import java.util.Objects;

import static com.github.blueshare.BlueShareLogger.LOGGER;

/// Chooses a topology from the number of devices `N` and the number of hosts `H`. The rules overlap so they are
/// evaluated in this order and the first match wins:
///
/// | rule                 | topology |
/// |----------------------|----------|
/// | `H == 0`             | error    |
/// | `N <= 3 && H == 1`   | STAR     |
/// | `N <= 5 && H <= 2`   | BUS      |
/// | `H >= 2`             | MESH     |
/// | otherwise            | HYBRID   |
///
/// Swapping the order changes the outcome at the boundaries. For example `N=3, H=1` is a STAR yet also satisfies the
/// BUS rule.
public class TopologySelector {
  private final SessionListener listener;

  public TopologySelector(SessionListener listener) {
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  public TopologySelector() {
    this(SessionListener.NONE);
  }

  /// @throws InvalidTopologyInputException if there are no hosts.
  public static Topology select(int deviceCount, int hostCount) {
    if (hostCount < 0 || hostCount > deviceCount) {
      throw new IllegalArgumentException("hostCount=" + hostCount + " must be within [0," + deviceCount + "]");
    }
    if (hostCount == 0) {
      throw new InvalidTopologyInputException(deviceCount);
    }
    if (deviceCount <= 3 && hostCount == 1) {
      return Topology.STAR;
    } else if (deviceCount <= 5 && hostCount <= 2) {
      return Topology.BUS;
    } else if (hostCount >= 2) {
      return Topology.MESH;
    } else {
      return Topology.HYBRID;
    }
  }

  /// Chooses the topology for the session then records it along with the links between the devices.
  ///
  /// @throws InvalidTopologyInputException if there are no hosts.
  public Topology select(Session session) {
    final int deviceCount = session.deviceCount();
    final int hostCount = session.hostCount();
    LOGGER.fine(() -> "topology " + session.id() + " analysing " + deviceCount + " devices with " + hostCount
        + " hosts");
    final Topology topology = select(deviceCount, hostCount);
    session.topology(topology);
    session.links(link(session.devices(), topology));
    LOGGER.fine(() -> "topology " + session.id() + " selected " + topology);
    listener.onEvent(new SessionEvent.TopologySelected(session.id(), topology, deviceCount, hostCount));
    return topology;
  }

  /// Builds the links between devices for a topology:
  ///
  /// - STAR links every other device to the first host;
  /// - BUS chains the devices in session order;
  /// - MESH links every pair of devices;
  /// - HYBRID meshes the hosts, hangs each other device off a host in turn and chains those devices for failover.
  public static TopologyLinks link(List<Device> devices, Topology topology) {
    final var links = TopologyLinks.empty();
    devices.forEach(d -> links.addDevice(d.id()));
    final List<Device> hosts = devices.stream().filter(Device::isHost).toList();
    final List<Device> others = devices.stream().filter(d -> !d.isHost()).toList();
    switch (topology) {
      case STAR -> {
        if (hosts.isEmpty()) throw new InvalidTopologyInputException(devices.size());
        final DeviceId hub = hosts.get(0).id();
        devices.stream()
            .map(Device::id)
            .filter(id -> !id.equals(hub))
            .forEach(id -> links.link(hub, id));
      }
      case BUS -> {
        for (int i = 1; i < devices.size(); i++) {
          links.link(devices.get(i - 1).id(), devices.get(i).id());
        }
      }
      case MESH -> {
        for (int i = 0; i < devices.size(); i++) {
          for (int j = i + 1; j < devices.size(); j++) {
            links.link(devices.get(i).id(), devices.get(j).id());
          }
        }
      }
      case HYBRID -> {
        if (hosts.isEmpty()) throw new InvalidTopologyInputException(devices.size());
        for (int i = 0; i < hosts.size(); i++) {
          for (int j = i + 1; j < hosts.size(); j++) {
            links.link(hosts.get(i).id(), hosts.get(j).id());
          }
        }
        for (int i = 0; i < others.size(); i++) {
          links.link(hosts.get(i % hosts.size()).id(), others.get(i).id());
          if (i > 0) {
            links.link(others.get(i - 1).id(), others.get(i).id());
          }
        }
      }
    }
    return links;
  }
}
