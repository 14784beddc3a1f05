// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import org.jetbrains.annotations.TestOnly;

import java.security.SecureRandom;
import java.util.Random;

/// Supplies the tie-break signal for devices whose consent is ambiguous. It draws [#SAMPLE_SIZE] uniformly random bytes
/// and sums `-p * log2(p)` over them where `p = sample / 255`. The value is not the entropy of the radio channel. It
/// is a non-deterministic number with known bounds that is recorded against the consent decision.
///
/// Each term lies within `[0, 1 / (e ln 2)]` so the sum lies within `[0, 64 / (e ln 2)]` which is [#MAX_ENTROPY_BITS].
public class EntropySource {
  public static final int SAMPLE_SIZE = 64;

  /// The largest value of `-p * log2(p)` which is reached at `p = 1/e`.
  public static final double MAX_TERM_BITS = 1.0 / (Math.E * Math.log(2.0));

  public static final double MAX_ENTROPY_BITS = SAMPLE_SIZE * MAX_TERM_BITS;

  private static final double LN_2 = Math.log(2.0);

  /// A trick from the core UUID class is to use holder class to defer initialization until needed.
  private static class LazyRandom {
    static final SecureRandom RANDOM = new SecureRandom();
  }

  private final Random random;

  /// Samples from a shared [SecureRandom] so that the values cannot be predicted from the wall clock.
  public EntropySource() {
    this(LazyRandom.RANDOM);
  }

  /// Tests may pass a seeded generator to make the measurement reproducible.
  /// The generator is shared by every consent request, which may run on several threads. [Random] and
  /// [SecureRandom] are both safe for that.
  @TestOnly
  public EntropySource(Random random) {
    this.random = random;
  }

  /// @return [#SAMPLE_SIZE] values each uniform over `[0, 255]`.
  public int[] sample() {
    final byte[] bytes = new byte[SAMPLE_SIZE];
    random.nextBytes(bytes);
    final int[] samples = new int[SAMPLE_SIZE];
    for (int i = 0; i < SAMPLE_SIZE; i++) {
      samples[i] = bytes[i] & 0xFF;
    }
    return samples;
  }

  /// Draws a fresh sample and returns its entropy in bits.
  public double measure() {
    return entropyBits(sample());
  }

  public static double entropyBits(int[] samples) {
    double entropy = 0.0;
    for (int sample : samples) {
      if (sample < 0 || sample > 255) {
        throw new IllegalArgumentException("sample must be within [0,255] but was " + sample);
      }
      final double p = sample / 255.0;
      if (p > 0.0) {
        entropy -= p * (Math.log(p) / LN_2);
      }
    }
    // p == 1 contributes -0.0 which we do not want to leak out
    return entropy == 0.0 ? 0.0 : entropy;
  }
}
