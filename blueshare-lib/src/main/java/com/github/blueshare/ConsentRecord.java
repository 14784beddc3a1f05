// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/// A single consent decision of one device in one consensus round. A device holds at most one of these at a time and a
/// new vote replaces the old record.
///
/// @param state      The decision.
/// @param entropy    The measured entropy in bits. This is present only when the state is [ConsentState#AMBIGUOUS].
/// @param capturedAt When the decision was taken.
public record ConsentRecord(ConsentState state, OptionalDouble entropy, Instant capturedAt) {
  public ConsentRecord {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(entropy, "entropy");
    Objects.requireNonNull(capturedAt, "capturedAt");
    if (entropy.isPresent() != (state == ConsentState.AMBIGUOUS)) {
      throw new IllegalArgumentException("entropy must be present only for AMBIGUOUS but state=" + state
          + " entropy=" + entropy);
    }
    if (entropy.isPresent() && !(entropy.getAsDouble() >= 0.0)) {
      throw new IllegalArgumentException("entropy must be non-negative but was " + entropy.getAsDouble());
    }
  }

  public static ConsentRecord accept(Instant capturedAt) {
    return new ConsentRecord(ConsentState.ACCEPT, OptionalDouble.empty(), capturedAt);
  }

  public static ConsentRecord reject(Instant capturedAt) {
    return new ConsentRecord(ConsentState.REJECT, OptionalDouble.empty(), capturedAt);
  }

  public static ConsentRecord ambiguous(double entropy, Instant capturedAt) {
    return new ConsentRecord(ConsentState.AMBIGUOUS, OptionalDouble.of(entropy), capturedAt);
  }
}
