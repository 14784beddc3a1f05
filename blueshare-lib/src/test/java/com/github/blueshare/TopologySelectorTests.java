// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class TopologySelectorTests {

  @Test
  void rulesApplyInOrder() {
    assertEquals(Topology.STAR, TopologySelector.select(3, 1));
    assertEquals(Topology.BUS, TopologySelector.select(5, 2));
    assertEquals(Topology.MESH, TopologySelector.select(6, 2));
    assertEquals(Topology.HYBRID, TopologySelector.select(7, 1));
    // two hosts in a small session is a BUS not a MESH
    assertEquals(Topology.BUS, TopologySelector.select(3, 2));
    assertEquals(Topology.BUS, TopologySelector.select(4, 1));
    assertEquals(Topology.STAR, TopologySelector.select(1, 1));
  }

  @Test
  void noHostIsAnError() {
    final var e = assertThrows(InvalidTopologyInputException.class, () -> TopologySelector.select(4, 0));
    assertEquals(4, e.deviceCount());
  }

  @Test
  void hostCountMustFitTheDeviceCount() {
    assertThrows(IllegalArgumentException.class, () -> TopologySelector.select(2, 3));
    assertThrows(IllegalArgumentException.class, () -> TopologySelector.select(2, -1));
  }

  @Property
  void everySessionWithAHostGetsATopology(@ForAll @IntRange(min = 1, max = 40) int deviceCount,
                                          @ForAll @IntRange(min = 1, max = 40) int hostCount) {
    Assume.that(hostCount <= deviceCount);
    final var topology = TopologySelector.select(deviceCount, hostCount);
    if (topology == Topology.STAR) {
      assertTrue(deviceCount <= 3 && hostCount == 1);
    }
    if (topology == Topology.HYBRID) {
      assertEquals(1, hostCount);
      assertTrue(deviceCount > 5);
    }
    if (deviceCount > 5 && hostCount >= 2) {
      assertEquals(Topology.MESH, topology);
    }
  }

  @Test
  void selectRecordsTopologyAndLinks() {
    final var listener = new SessionFixtures.RecordingListener();
    final var session = SessionFixtures.fourDeviceSession(SessionFixtures.NEARBY_RELAY_DBM);
    assertEquals(Topology.BUS, new TopologySelector(listener).select(session));
    assertEquals(Topology.BUS, session.topology().orElseThrow());
    assertEquals(3, session.links().linkCount());
    final var event = listener.of(SessionEvent.TopologySelected.class).get(0);
    assertEquals(4, event.deviceCount());
    assertEquals(1, event.hostCount());
  }

  @Test
  void starLinksEveryDeviceToTheHost() {
    final var devices = SessionFixtures.devices(3, 1);
    final var links = TopologySelector.link(devices, Topology.STAR);
    final var hub = devices.get(0).id();
    assertThat(links.neighbours(hub)).containsExactly(devices.get(1).id(), devices.get(2).id());
    assertFalse(links.linked(devices.get(1).id(), devices.get(2).id()));
    assertEquals(2, links.linkCount());
  }

  @Test
  void busChainsDevicesInOrder() {
    final var devices = SessionFixtures.devices(4, 1);
    final var links = TopologySelector.link(devices, Topology.BUS);
    assertEquals(3, links.linkCount());
    assertTrue(links.linked(devices.get(1).id(), devices.get(2).id()));
    assertFalse(links.linked(devices.get(0).id(), devices.get(3).id()));
  }

  @Test
  void meshLinksEveryPair() {
    final var devices = SessionFixtures.devices(6, 2);
    final var links = TopologySelector.link(devices, Topology.MESH);
    assertEquals(15, links.linkCount());
    devices.forEach(d -> assertEquals(5, links.neighbours(d.id()).size()));
  }

  @Test
  void hybridHangsDevicesOffHostsAndChainsThem() {
    final var devices = SessionFixtures.devices(7, 1);
    final var links = TopologySelector.link(devices, Topology.HYBRID);
    final var host = devices.get(0).id();
    assertEquals(6, links.neighbours(host).size());
    // six host links plus five failover links
    assertEquals(11, links.linkCount());
    assertTrue(links.linked(devices.get(3).id(), devices.get(4).id()));
    assertThat(links.devices()).hasSize(7);
  }

  @Test
  void noDeviceLinksToItself() {
    final List<Device> devices = SessionFixtures.devices(6, 3);
    for (Topology topology : Topology.values()) {
      final var links = TopologySelector.link(devices, topology);
      devices.forEach(d -> assertFalse(links.linked(d.id(), d.id()), topology + " self link"));
    }
  }
}
