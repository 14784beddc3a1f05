// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.util.Optional;

/// A snapshot of a session for presentation. The aggregates are optional as the snapshot may be taken of a session
/// that stopped before its allocators ran.
public record SessionSummary(String sessionId,
                             Optional<Topology> topology,
                             int deviceCount,
                             int hostCount,
                             Optional<BandwidthAllocation> bandwidth,
                             Optional<CostSummary> costs,
                             boolean transparencyVerified,
                             boolean fairnessVerified,
                             boolean privacyVerified,
                             boolean active) {

  public static SessionSummary of(Session session) {
    return new SessionSummary(
        session.id(),
        session.topology(),
        session.deviceCount(),
        session.hostCount(),
        session.isBandwidthAllocated() ? Optional.of(session.bandwidth()) : Optional.empty(),
        session.isCostAllocated() ? Optional.of(session.costs()) : Optional.empty(),
        session.transparencyVerified(),
        session.fairnessVerified(),
        session.privacyVerified(),
        session.isActive());
  }
}
