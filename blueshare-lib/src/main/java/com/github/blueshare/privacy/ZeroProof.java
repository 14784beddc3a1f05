// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare.privacy;

import java.time.Instant;
import java.util.Objects;

/// The answer to a challenge that shows possession of an identity without sending its hash.
///
/// @param proof     SHA-256 of the identity hash followed by the challenge.
/// @param challenge The random challenge being answered.
/// @param timestamp When the proof was made.
public record ZeroProof(byte[] proof, byte[] challenge, Instant timestamp) {
  public ZeroProof {
    if (proof == null || proof.length != ZeroId.HASH_LENGTH) {
      throw new IllegalArgumentException("proof must be " + ZeroId.HASH_LENGTH + " bytes");
    }
    if (challenge == null || challenge.length != PhantomEncoder.CHALLENGE_LENGTH) {
      throw new IllegalArgumentException("challenge must be " + PhantomEncoder.CHALLENGE_LENGTH + " bytes");
    }
    Objects.requireNonNull(timestamp, "timestamp");
    proof = proof.clone();
    challenge = challenge.clone();
  }

  @Override
  public byte[] proof() {
    return proof.clone();
  }

  @Override
  public byte[] challenge() {
    return challenge.clone();
  }
}
