// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.util.Objects;

import static com.github.blueshare.BlueShareLogger.LOGGER;

/// Charges each device for the data it moved using the closed-form [CostModel]. Each device's balance is set to its
/// own cost, then the session total and per-device average are recorded. The calculation is deterministic and looks
/// nothing up, which is what marks the session as transparent.
public class CostAllocator {
  private final CostModel costModel;
  private final SessionListener listener;

  public CostAllocator(CostModel costModel, SessionListener listener) {
    this.costModel = Objects.requireNonNull(costModel, "costModel");
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  public CostAllocator() {
    this(CostModel.DEFAULT, SessionListener.NONE);
  }

  /// @throws EmptySessionException if the session has no devices.
  public void allocateCosts(Session session) {
    if (session.deviceCount() == 0) {
      throw new EmptySessionException(session.id(), Session.COST_STAGE);
    }
    double total = 0.0;
    for (Device device : session.devices()) {
      final double megabytes = CostModel.megabytes(device.totalBytes());
      final double cost = costModel.costUsd(device.totalBytes());
      device.balanceUsd(cost);
      total += cost;
      LOGGER.finer(() -> String.format("cost %s %.2fMB -> $%.6f", device.id(), megabytes, cost));
      listener.onEvent(new SessionEvent.CostAllocated(session.id(), device.id(), device.name(), megabytes, cost));
    }
    final var summary = new CostSummary(total, total / session.deviceCount());
    session.costs(summary);
    session.markTransparencyVerified();
    LOGGER.fine(() -> String.format("cost %s total=$%.6f perDevice=$%.6f", session.id(), summary.totalUsd(),
        summary.perDeviceUsd()));
    listener.onEvent(new SessionEvent.CostsSummarised(session.id(), summary));
  }
}
