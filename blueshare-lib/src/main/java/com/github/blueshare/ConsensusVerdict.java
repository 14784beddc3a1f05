// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

/// The network-wide outcome of a consensus round.
public enum ConsensusVerdict {
  /// Enough devices accepted and none rejected.
  VERIFIED,
  /// At least one device rejected. A single reject vetoes the session whatever the accept count.
  REJECTED,
  /// No device rejected yet too few accepted.
  PENDING
}
