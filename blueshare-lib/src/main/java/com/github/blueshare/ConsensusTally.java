// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

/// The counts behind a [ConsensusVerdict]. Devices that have not voted are in `deviceCount` but in none of the three
/// vote counts.
public record ConsensusTally(int accept, int reject, int ambiguous, int deviceCount, ConsensusVerdict verdict) {
  public ConsensusTally {
    if (accept < 0 || reject < 0 || ambiguous < 0 || accept + reject + ambiguous > deviceCount) {
      throw new IllegalArgumentException("inconsistent tally accept=" + accept + " reject=" + reject
          + " ambiguous=" + ambiguous + " deviceCount=" + deviceCount);
    }
  }

  public int abstained() {
    return deviceCount - accept - reject - ambiguous;
  }
}
