// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

import static com.github.blueshare.BlueShareLogger.LOGGER;

/// Turns the balance owed by each client into a settled payment record. Only devices in the [DeviceRole#CLIENT] role
/// with a strictly positive balance pay. Hosts, relays and observers, and clients who owe nothing, get no record.
///
/// Settlement is instantaneous: a record is created `AUTHORIZED` and moves straight to `SETTLED`, and the device's own
/// payment status is set to match. Nothing is sent to a payment network.
public class PaymentSettler {
  public static final Duration DEFAULT_EXPIRY = Duration.ofMinutes(10);

  static final String INVOICE_PREFIX = "lnbc";
  static final int INVOICE_HASH_CHARS = 10;

  private static final ThreadLocal<MessageDigest> SHA_256 = ThreadLocal.withInitial(() -> {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("Required digest algorithm unavailable", e);
    }
  });

  private final ExchangeRate exchangeRate;
  private final Duration expiry;
  private final Clock clock;
  private final SessionListener listener;

  /// Mixed into each payment hash so that two records for the same amount in the same instant still differ.
  private final AtomicLong sequence = new AtomicLong();

  public PaymentSettler(ExchangeRate exchangeRate, Duration expiry, Clock clock, SessionListener listener) {
    this.exchangeRate = Objects.requireNonNull(exchangeRate, "exchangeRate");
    this.expiry = Objects.requireNonNull(expiry, "expiry");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  public PaymentSettler(Clock clock) {
    this(ExchangeRate.DEFAULT, DEFAULT_EXPIRY, clock, SessionListener.NONE);
  }

  /// A client is settled at most once. Settling a session again throws before any new record is made.
  ///
  /// @return The settled payments by device in session order.
  /// @throws StageOrderViolationException if costs have not been allocated so there are no balances to settle.
  /// @throws IllegalStateException        if a client that owes is no longer pending payment.
  public Map<DeviceId, @NotNull PaymentRecord> settle(Session session) {
    if (!session.isCostAllocated()) {
      throw new StageOrderViolationException(session.id(), List.of(Session.COST_STAGE));
    }
    final List<Device> payers = session.devices().stream()
        .filter(d -> d.role() == DeviceRole.CLIENT && d.balanceUsd() > 0.0)
        .toList();
    for (Device device : payers) {
      if (device.paymentStatus() != PaymentStatus.PENDING) {
        throw new IllegalStateException("session " + session.id() + " device " + device.id()
            + " has already been settled as " + device.paymentStatus());
      }
    }
    final var payments = new LinkedHashMap<DeviceId, PaymentRecord>();
    for (Device device : payers) {
      final PaymentRecord authorized = invoice(device.balanceUsd());
      device.paymentStatus(authorized.status());
      final PaymentRecord settled = authorized.transitionTo(PaymentStatus.SETTLED);
      device.paymentStatus(settled.status());
      payments.put(device.id(), settled);
      LOGGER.fine(() -> String.format("payment %s %s %d sat ($%.6f) %s", device.id(), settled.invoice(),
          settled.amountSatoshi(), settled.amountUsd(), settled.status()));
      listener.onEvent(new SessionEvent.PaymentSettled(session.id(), device.id(), device.name(), settled));
    }
    return Collections.unmodifiableMap(payments);
  }

  /// Creates an authorised, not yet settled, record for an amount.
  PaymentRecord invoice(double amountUsd) {
    final Instant now = clock.instant();
    final long satoshi = exchangeRate.toSatoshi(amountUsd);
    final String hash = paymentHash(amountUsd, now, sequence.incrementAndGet());
    final String invoice = INVOICE_PREFIX + satoshi + "u1p" + hash.substring(0, INVOICE_HASH_CHARS);
    return new PaymentRecord(invoice, satoshi, amountUsd, hash, now.plus(expiry), PaymentStatus.AUTHORIZED);
  }

  static String paymentHash(double amountUsd, Instant createdAt, long sequence) {
    final ByteBuffer buffer = ByteBuffer.allocate(Double.BYTES + Long.BYTES + Integer.BYTES + Long.BYTES)
        .putDouble(amountUsd)
        .putLong(createdAt.getEpochSecond())
        .putInt(createdAt.getNano())
        .putLong(sequence);
    final MessageDigest digest = SHA_256.get();
    digest.reset();
    return HexFormat.of().formatHex(digest.digest(buffer.array()));
  }
}
