// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare.privacy;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/// The verification key that pairs with a [ZeroId]. It is kept and stored apart from the identity.
///
/// @param hash       HMAC-SHA256 of the identity hash under the issuer's master key.
/// @param timestamp  When the key was made.
/// @param expiration When the key stops being valid.
public record ZeroKey(byte[] hash, Instant timestamp, Instant expiration) {

  public ZeroKey {
    if (hash == null || hash.length != ZeroId.HASH_LENGTH) {
      throw new IllegalArgumentException("hash must be " + ZeroId.HASH_LENGTH + " bytes");
    }
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(expiration, "expiration");
    if (expiration.isBefore(timestamp)) {
      throw new IllegalArgumentException("expiration " + expiration + " is before " + timestamp);
    }
    hash = hash.clone();
  }

  @Override
  public byte[] hash() {
    return hash.clone();
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiration);
  }

  public void writeTo(DataOutputStream dos) throws IOException {
    dos.write(hash);
    dos.writeLong(timestamp.getEpochSecond());
    dos.writeInt(timestamp.getNano());
    dos.writeLong(expiration.getEpochSecond());
    dos.writeInt(expiration.getNano());
  }

  public static ZeroKey readFrom(DataInputStream dis) throws IOException {
    final byte[] hash = new byte[ZeroId.HASH_LENGTH];
    dis.readFully(hash);
    final Instant timestamp = Instant.ofEpochSecond(dis.readLong(), dis.readInt());
    final Instant expiration = Instant.ofEpochSecond(dis.readLong(), dis.readInt());
    return new ZeroKey(hash, timestamp, expiration);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ZeroKey that
        && Arrays.equals(hash, that.hash)
        && timestamp.equals(that.timestamp)
        && expiration.equals(that.expiration);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Arrays.hashCode(hash), timestamp, expiration);
  }

  @Override
  public String toString() {
    return "ZeroKey[expires=" + expiration + "]";
  }
}
