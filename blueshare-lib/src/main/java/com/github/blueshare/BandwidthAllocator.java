// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.util.Objects;

import static com.github.blueshare.BlueShareLogger.LOGGER;

/// Plans each device's share of the capacity offered by the hosts. The "double space, half time" policy allocates
/// twice the even split on the understanding that each device only transmits for half of the time. It is a planning
/// heuristic and not a throughput guarantee.
///
/// Running an allocation pass is what marks the session as fair. The allocator does not itself judge fairness.
public class BandwidthAllocator {
  public static final double FAIR_SHARE_FACTOR = 2.0;

  private final SessionListener listener;

  public BandwidthAllocator(SessionListener listener) {
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  public BandwidthAllocator() {
    this(SessionListener.NONE);
  }

  /// @throws EmptySessionException if the session has no devices.
  public void allocate(Session session) {
    if (session.deviceCount() == 0) {
      throw new EmptySessionException(session.id(), Session.BANDWIDTH_STAGE);
    }
    final double total = session.devices().stream()
        .filter(Device::isHost)
        .mapToDouble(Device::bandwidthCapacityMbps)
        .sum();
    final var allocation = new BandwidthAllocation(total, total * FAIR_SHARE_FACTOR / session.deviceCount());
    session.bandwidth(allocation);
    session.markFairnessVerified();
    LOGGER.fine(() -> String.format("bandwidth %s total=%.2fMbps fairShare=%.2fMbps/device", session.id(),
        allocation.totalMbps(), allocation.fairShareMbps()));
    listener.onEvent(new SessionEvent.BandwidthAllocated(session.id(), allocation));
  }
}
