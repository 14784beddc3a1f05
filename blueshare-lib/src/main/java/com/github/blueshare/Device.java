// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/// A device discovered by the transport layer. Identity, role and the radio measurements taken at discovery are fixed.
/// The traffic counters, balance, payment status and consent are written in place as the session pipeline runs, each
/// by exactly one stage. A device knows nothing of its neighbours: topology links are held by the [Session].
///
/// This class is not thread safe. The [SessionOrchestrator] only ever lets one stage touch a device at a time.
public class Device {
  public static final int DEFAULT_MTU = 512;

  private final DeviceId id;
  private final String name;
  private final DeviceRole role;
  private final int signalStrengthDbm;
  private final int mtu;
  /// Advertised upstream capacity. This is only meaningful for a [DeviceRole#HOST].
  private final double bandwidthCapacityMbps;

  private long bytesSent;
  private long bytesReceived;
  private double balanceUsd;
  private PaymentStatus paymentStatus = PaymentStatus.PENDING;
  private ConsentRecord consent;
  private Instant lastSeen;

  public Device(DeviceId id, String name, DeviceRole role, int signalStrengthDbm, int mtu,
                double bandwidthCapacityMbps, Instant lastSeen) {
    this.id = Objects.requireNonNull(id, "id");
    this.name = Objects.requireNonNull(name, "name");
    this.role = Objects.requireNonNull(role, "role");
    if (mtu <= 0) throw new IllegalArgumentException("mtu must be positive but was " + mtu);
    if (bandwidthCapacityMbps < 0.0) {
      throw new IllegalArgumentException("bandwidth capacity must be non-negative but was " + bandwidthCapacityMbps);
    }
    this.signalStrengthDbm = signalStrengthDbm;
    this.mtu = mtu;
    this.bandwidthCapacityMbps = bandwidthCapacityMbps;
    this.lastSeen = Objects.requireNonNull(lastSeen, "lastSeen");
  }

  public Device(String id, String name, DeviceRole role, int signalStrengthDbm, double bandwidthCapacityMbps) {
    this(new DeviceId(id), name, role, signalStrengthDbm, DEFAULT_MTU, bandwidthCapacityMbps, Instant.EPOCH);
  }

  /// Records the cumulative byte counters reported by the transport.
  public Device recordTraffic(long bytesSent, long bytesReceived) {
    if (bytesSent < 0 || bytesReceived < 0) {
      throw new IllegalArgumentException("byte counters must be non-negative but were sent=" + bytesSent
          + " received=" + bytesReceived);
    }
    this.bytesSent = bytesSent;
    this.bytesReceived = bytesReceived;
    return this;
  }

  public long totalBytes() {
    return bytesSent + bytesReceived;
  }

  void consent(ConsentRecord record) {
    this.consent = Objects.requireNonNull(record, "record");
    this.lastSeen = record.capturedAt();
  }

  void balanceUsd(double balanceUsd) {
    this.balanceUsd = balanceUsd;
  }

  /// @throws IllegalStateException if the move is not allowed from the current status.
  void paymentStatus(PaymentStatus next) {
    Objects.requireNonNull(next, "next");
    if (!paymentStatus.canTransitionTo(next)) {
      throw new IllegalStateException("device " + id + " payment cannot move from " + paymentStatus + " to " + next);
    }
    this.paymentStatus = next;
  }

  public DeviceId id() {
    return id;
  }

  public String name() {
    return name;
  }

  public DeviceRole role() {
    return role;
  }

  public boolean isHost() {
    return role == DeviceRole.HOST;
  }

  public int signalStrengthDbm() {
    return signalStrengthDbm;
  }

  public int mtu() {
    return mtu;
  }

  public double bandwidthCapacityMbps() {
    return bandwidthCapacityMbps;
  }

  public long bytesSent() {
    return bytesSent;
  }

  public long bytesReceived() {
    return bytesReceived;
  }

  public double balanceUsd() {
    return balanceUsd;
  }

  public PaymentStatus paymentStatus() {
    return paymentStatus;
  }

  public Optional<ConsentRecord> consent() {
    return Optional.ofNullable(consent);
  }

  public Instant lastSeen() {
    return lastSeen;
  }

  @Override
  public String toString() {
    return "Device[" + id + "," + role + "," + signalStrengthDbm + "dBm]";
  }
}
