// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/// The operational settings of a [SessionOrchestrator]. The consent thresholds and the cost model are fixed and are
/// not configurable.
///
/// @param consentParallelism How many devices may be asked for consent at once. One means sequentially.
/// @param invoiceExpiry      How long a payment invoice is valid for.
/// @param usdPerBtc          The reference price used to express balances in satoshi.
public record SessionConfig(int consentParallelism, Duration invoiceExpiry, double usdPerBtc) {
  public static final String CONSENT_PARALLELISM = "blueshare.consent.parallelism";
  public static final String INVOICE_EXPIRY_SECONDS = "blueshare.invoice.expiry.seconds";
  public static final String USD_PER_BTC = "blueshare.usd.per.btc";

  public static final SessionConfig DEFAULT =
      new SessionConfig(1, PaymentSettler.DEFAULT_EXPIRY, ExchangeRate.DEFAULT.usdPerBtc());

  public SessionConfig {
    if (consentParallelism < 1) {
      throw new IllegalArgumentException("consentParallelism must be at least 1 but was " + consentParallelism);
    }
    Objects.requireNonNull(invoiceExpiry, "invoiceExpiry");
    if (invoiceExpiry.isNegative() || invoiceExpiry.isZero()) {
      throw new IllegalArgumentException("invoiceExpiry must be positive but was " + invoiceExpiry);
    }
    if (!(usdPerBtc > 0.0)) {
      throw new IllegalArgumentException("usdPerBtc must be positive but was " + usdPerBtc);
    }
  }

  public ExchangeRate exchangeRate() {
    return new ExchangeRate(usdPerBtc);
  }

  /// Reads any of the `blueshare.*` keys that are present and uses the defaults for the rest.
  public static SessionConfig fromProperties(Properties properties) {
    final int parallelism = Integer.parseInt(properties.getProperty(CONSENT_PARALLELISM,
        Integer.toString(DEFAULT.consentParallelism())));
    final long expirySeconds = Long.parseLong(properties.getProperty(INVOICE_EXPIRY_SECONDS,
        Long.toString(DEFAULT.invoiceExpiry().toSeconds())));
    final double usdPerBtc = Double.parseDouble(properties.getProperty(USD_PER_BTC,
        Double.toString(DEFAULT.usdPerBtc())));
    return new SessionConfig(parallelism, Duration.ofSeconds(expirySeconds), usdPerBtc);
  }

  public static SessionConfig fromSystemProperties() {
    return fromProperties(System.getProperties());
  }
}
