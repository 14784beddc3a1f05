// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

/// The trinary outcome of asking a single device whether it will take part in a session.
public enum ConsentState {
  ACCEPT,
  REJECT,
  /// The signal is marginal. The decision carries an entropy measurement as a tie-break signal.
  AMBIGUOUS
}
