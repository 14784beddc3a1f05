// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.time.Instant;

/// What happened as a session moved through the pipeline. The pipeline emits these to a [SessionListener] rather than
/// printing anything so that presentation is a separate concern and the core can be tested without capturing output.
public sealed interface SessionEvent {

  record ConsentDecided(DeviceId deviceId, String deviceName, int signalStrengthDbm,
                        ConsentRecord record) implements SessionEvent {
  }

  record ConsensusReached(String sessionId, ConsensusTally tally) implements SessionEvent {
  }

  record TopologySelected(String sessionId, Topology topology, int deviceCount,
                          int hostCount) implements SessionEvent {
  }

  record BandwidthAllocated(String sessionId, BandwidthAllocation allocation) implements SessionEvent {
  }

  record CostAllocated(String sessionId, DeviceId deviceId, String deviceName, double megabytes,
                       double costUsd) implements SessionEvent {
  }

  record CostsSummarised(String sessionId, CostSummary summary) implements SessionEvent {
  }

  record PaymentSettled(String sessionId, DeviceId deviceId, String deviceName,
                        PaymentRecord payment) implements SessionEvent {
  }

  record ComplianceChecked(String sessionId, ComplianceReport report) implements SessionEvent {
  }

  record SessionActivated(String sessionId) implements SessionEvent {
  }

  record SessionAborted(String sessionId, String reason) implements SessionEvent {
  }

  record SessionEnded(String sessionId, Instant end) implements SessionEvent {
  }
}
