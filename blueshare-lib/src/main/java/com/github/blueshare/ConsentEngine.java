// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

import static com.github.blueshare.BlueShareLogger.LOGGER;

/// Decides whether a single device takes part in a session from its received signal strength:
///
/// - above [#ACCEPT_ABOVE_DBM] the device accepts;
/// - below [#REJECT_BELOW_DBM] the device rejects;
/// - anything within `[-90, -70]` inclusive is ambiguous and one entropy measurement is attached to the decision.
///
/// There are no retries. Each call replaces the device's current [ConsentRecord]. Calls for different devices share no
/// mutable state other than the [EntropySource] so they may be made concurrently.
public class ConsentEngine {
  public static final int ACCEPT_ABOVE_DBM = -70;
  public static final int REJECT_BELOW_DBM = -90;

  private final EntropySource entropySource;
  private final Clock clock;
  private final SessionListener listener;

  public ConsentEngine(EntropySource entropySource, Clock clock, SessionListener listener) {
    this.entropySource = Objects.requireNonNull(entropySource, "entropySource");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  public ConsentEngine(EntropySource entropySource, Clock clock) {
    this(entropySource, clock, SessionListener.NONE);
  }

  /// The decision rule without the entropy draw.
  public static ConsentState decide(int signalStrengthDbm) {
    if (signalStrengthDbm > ACCEPT_ABOVE_DBM) {
      return ConsentState.ACCEPT;
    } else if (signalStrengthDbm < REJECT_BELOW_DBM) {
      return ConsentState.REJECT;
    } else {
      return ConsentState.AMBIGUOUS;
    }
  }

  public ConsentState requestConsent(Device device) {
    final int strength = device.signalStrengthDbm();
    final Instant now = clock.instant();
    final ConsentRecord record = switch (decide(strength)) {
      case ACCEPT -> ConsentRecord.accept(now);
      case REJECT -> ConsentRecord.reject(now);
      case AMBIGUOUS -> ConsentRecord.ambiguous(entropySource.measure(), now);
    };
    device.consent(record);
    LOGGER.fine(() -> "consent " + device.id() + " " + strength + "dBm -> " + record.state()
        + (record.entropy().isPresent() ? String.format(" entropy=%.4f", record.entropy().getAsDouble()) : ""));
    listener.onEvent(new SessionEvent.ConsentDecided(device.id(), device.name(), strength, record));
    return record.state();
  }
}
