// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.time.Instant;
import java.util.Objects;

/// An invoice-like settlement record for the balance of one client device. The fields other than the status never
/// change. A status change yields a new record and is validated by [PaymentStatus#canTransitionTo(PaymentStatus)].
///
/// @param invoice       A BOLT11-shaped token embedding the amount and a prefix of the hash. It is not a real invoice.
/// @param amountSatoshi The balance in satoshi at the reference exchange rate.
/// @param amountUsd     The balance in USD.
/// @param paymentHash   Hex SHA-256 that is unique per record.
/// @param expiry        When the invoice lapses.
/// @param status        The settlement state.
public record PaymentRecord(String invoice, long amountSatoshi, double amountUsd, String paymentHash,
                            Instant expiry, PaymentStatus status) {
  public PaymentRecord {
    Objects.requireNonNull(invoice, "invoice");
    Objects.requireNonNull(paymentHash, "paymentHash");
    Objects.requireNonNull(expiry, "expiry");
    Objects.requireNonNull(status, "status");
    if (amountSatoshi < 0) throw new IllegalArgumentException("amountSatoshi must be non-negative: " + amountSatoshi);
  }

  public PaymentRecord transitionTo(PaymentStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException("payment " + paymentHash + " cannot move from " + status + " to " + next);
    }
    return new PaymentRecord(invoice, amountSatoshi, amountUsd, paymentHash, expiry, next);
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiry);
  }
}
