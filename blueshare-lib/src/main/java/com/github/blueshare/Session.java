// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// A single short-lived shared network. The session owns its devices and the links between them. It is mutated in
/// place by each pipeline stage in turn:
///
/// - the bandwidth and cost aggregates do not exist until [BandwidthAllocator] and [CostAllocator] have run, and
///   reading them before then throws [StageOrderViolationException];
/// - the transparency, fairness and privacy flags start false and can only ever be set to true;
/// - the session only becomes active once the [ComplianceGate] passes, and is inactive again once ended.
///
/// This class is not thread safe. The [SessionOrchestrator] ensures that only one stage writes to it at a time.
public class Session {
  static final String BANDWIDTH_STAGE = "bandwidth allocation";
  static final String COST_STAGE = "cost allocation";

  private final String id;
  private final List<Device> devices;
  private final Instant start;

  private Topology topology;
  private TopologyLinks links = TopologyLinks.empty();
  private BandwidthAllocation bandwidth;
  private CostSummary costs;

  private boolean transparencyVerified = false;
  private boolean fairnessVerified = false;
  private boolean privacyVerified = false;

  private boolean active = false;
  private Instant end;

  public Session(String id, List<Device> devices, Instant start) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("Session ID must not be blank");
    this.id = id;
    this.devices = List.copyOf(devices);
    this.start = Objects.requireNonNull(start, "start");
    final Set<DeviceId> seen = new HashSet<>();
    for (Device device : this.devices) {
      if (!seen.add(device.id())) {
        throw new IllegalArgumentException("device " + device.id() + " appears twice in session " + id);
      }
    }
  }

  /// Opens a session over whatever devices the transport can currently see.
  public static Session open(String id, DeviceRegistry registry, Clock clock) {
    return new Session(id, registry.discover(), clock.instant());
  }

  public String id() {
    return id;
  }

  public List<Device> devices() {
    return devices;
  }

  public int deviceCount() {
    return devices.size();
  }

  public int hostCount() {
    return (int) devices.stream().filter(Device::isHost).count();
  }

  public Optional<Device> device(DeviceId deviceId) {
    return devices.stream().filter(d -> d.id().equals(deviceId)).findFirst();
  }

  public Instant start() {
    return start;
  }

  public Optional<Topology> topology() {
    return Optional.ofNullable(topology);
  }

  public TopologyLinks links() {
    return links;
  }

  void topology(Topology topology) {
    this.topology = Objects.requireNonNull(topology, "topology");
  }

  void links(TopologyLinks links) {
    this.links = Objects.requireNonNull(links, "links");
  }

  /// @throws StageOrderViolationException if bandwidth has not yet been allocated.
  public BandwidthAllocation bandwidth() {
    if (bandwidth == null) {
      throw new StageOrderViolationException(id, List.of(BANDWIDTH_STAGE));
    }
    return bandwidth;
  }

  public boolean isBandwidthAllocated() {
    return bandwidth != null;
  }

  void bandwidth(BandwidthAllocation bandwidth) {
    this.bandwidth = Objects.requireNonNull(bandwidth, "bandwidth");
  }

  /// @throws StageOrderViolationException if costs have not yet been allocated.
  public CostSummary costs() {
    if (costs == null) {
      throw new StageOrderViolationException(id, List.of(COST_STAGE));
    }
    return costs;
  }

  public boolean isCostAllocated() {
    return costs != null;
  }

  void costs(CostSummary costs) {
    this.costs = Objects.requireNonNull(costs, "costs");
  }

  public boolean transparencyVerified() {
    return transparencyVerified;
  }

  public boolean fairnessVerified() {
    return fairnessVerified;
  }

  public boolean privacyVerified() {
    return privacyVerified;
  }

  void markTransparencyVerified() {
    transparencyVerified = true;
  }

  void markFairnessVerified() {
    fairnessVerified = true;
  }

  void markPrivacyVerified() {
    privacyVerified = true;
  }

  public boolean isActive() {
    return active;
  }

  public Optional<Instant> end() {
    return Optional.ofNullable(end);
  }

  public boolean isEnded() {
    return end != null;
  }

  void activate() {
    if (end != null) {
      throw new IllegalStateException("session " + id + " has ended and cannot be activated");
    }
    active = true;
  }

  void end(Instant when) {
    if (end == null) {
      end = Objects.requireNonNull(when, "when");
    }
    active = false;
  }

  @Override
  public String toString() {
    return "Session[" + id + ",devices=" + devices.size() + ",topology=" + topology + ",active=" + active + "]";
  }
}
