// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

/// The settlement states of a payment. The happy path is `PENDING -> AUTHORIZED -> PROCESSING -> SETTLED`. As
/// settlement here is instantaneous an authorised payment may also move straight to `SETTLED`. Any state that is not
/// terminal may move to `FAILED`.
public enum PaymentStatus {
  PENDING,
  AUTHORIZED,
  PROCESSING,
  SETTLED,
  FAILED;

  public boolean isTerminal() {
    return this == SETTLED || this == FAILED;
  }

  public boolean canTransitionTo(PaymentStatus next) {
    if (isTerminal()) {
      return false;
    }
    if (next == FAILED) {
      return true;
    }
    return switch (this) {
      case PENDING -> next == AUTHORIZED;
      case AUTHORIZED -> next == PROCESSING || next == SETTLED;
      case PROCESSING -> next == SETTLED;
      case SETTLED, FAILED -> false;
    };
  }
}
