// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

/// A fixed USD/BTC reference price used to express balances in satoshi. There is no live price lookup.
public record ExchangeRate(double usdPerBtc) {
  public static final long SATOSHI_PER_BTC = 100_000_000L;

  public static final ExchangeRate DEFAULT = new ExchangeRate(40_000.0);

  public ExchangeRate {
    if (!(usdPerBtc > 0.0)) throw new IllegalArgumentException("usdPerBtc must be positive but was " + usdPerBtc);
  }

  /// Truncates towards zero so that a payment never asks for more than is owed.
  public long toSatoshi(double usd) {
    if (usd < 0.0) throw new IllegalArgumentException("usd must be non-negative but was " + usd);
    return (long) Math.floor(usd / usdPerBtc * SATOSHI_PER_BTC);
  }

  public double toUsd(long satoshi) {
    return (double) satoshi / SATOSHI_PER_BTC * usdPerBtc;
  }

  /// The USD value of a single satoshi which bounds the rounding error of [#toSatoshi(double)].
  public double usdPerSatoshi() {
    return usdPerBtc / SATOSHI_PER_BTC;
  }
}
