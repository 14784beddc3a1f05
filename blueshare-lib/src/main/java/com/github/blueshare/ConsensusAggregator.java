// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.util.Objects;

import static com.github.blueshare.BlueShareLogger.LOGGER;

/// Combines the consent of every device into a network-wide verdict. The rules are applied in this order:
///
/// 1. any reject vetoes the session whatever the number of accepts;
/// 2. accepts of at least `floor(deviceCount / 2)` verify the session;
/// 3. otherwise the round is pending.
///
/// Devices that have not yet voted are left out of all three counts yet still count towards the device total. A
/// session with no devices at all is pending as there is nobody to agree.
public class ConsensusAggregator {
  private final SessionListener listener;

  public ConsensusAggregator(SessionListener listener) {
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  public ConsensusAggregator() {
    this(SessionListener.NONE);
  }

  public static ConsensusVerdict verdict(int accept, int reject, int deviceCount) {
    if (reject > 0) {
      return ConsensusVerdict.REJECTED;
    }
    if (deviceCount == 0) {
      return ConsensusVerdict.PENDING;
    }
    if (accept >= deviceCount / 2) {
      return ConsensusVerdict.VERIFIED;
    }
    return ConsensusVerdict.PENDING;
  }

  public ConsensusTally tally(Session session) {
    int accept = 0;
    int reject = 0;
    int ambiguous = 0;
    for (Device device : session.devices()) {
      final var consent = device.consent();
      if (consent.isEmpty()) {
        continue;
      }
      switch (consent.get().state()) {
        case ACCEPT -> accept++;
        case REJECT -> reject++;
        case AMBIGUOUS -> ambiguous++;
      }
    }
    final var tally = new ConsensusTally(accept, reject, ambiguous, session.deviceCount(),
        verdict(accept, reject, session.deviceCount()));
    LOGGER.fine(() -> "consensus " + session.id() + " accept=" + tally.accept() + " reject=" + tally.reject()
        + " ambiguous=" + tally.ambiguous() + " -> " + tally.verdict());
    listener.onEvent(new SessionEvent.ConsensusReached(session.id(), tally));
    return tally;
  }

  public boolean verify(Session session) {
    return tally(session).verdict() == ConsensusVerdict.VERIFIED;
  }
}
