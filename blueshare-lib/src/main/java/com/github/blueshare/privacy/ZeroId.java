// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare.privacy;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/// A phantom identity. The hash stands in for the device identifier which cannot be recovered from it.
///
/// @param version The identity scheme version which derived identities inherit.
/// @param hash    SHA-256 of the device identifier and the salt, or an HMAC for a derived identity.
/// @param salt    The random salt of the base identity.
/// @param created When the identity was made.
public record ZeroId(byte version, byte[] hash, byte[] salt, Instant created) {
  public static final byte VERSION = 1;
  public static final int HASH_LENGTH = 32;
  public static final int SALT_LENGTH = 32;

  public ZeroId {
    if (hash == null || hash.length != HASH_LENGTH) {
      throw new IllegalArgumentException("hash must be " + HASH_LENGTH + " bytes");
    }
    if (salt == null || salt.length != SALT_LENGTH) {
      throw new IllegalArgumentException("salt must be " + SALT_LENGTH + " bytes");
    }
    Objects.requireNonNull(created, "created");
    hash = hash.clone();
    salt = salt.clone();
  }

  @Override
  public byte[] hash() {
    return hash.clone();
  }

  @Override
  public byte[] salt() {
    return salt.clone();
  }

  public void writeTo(DataOutputStream dos) throws IOException {
    dos.writeByte(version);
    dos.write(hash);
    dos.write(salt);
    dos.writeLong(created.getEpochSecond());
    dos.writeInt(created.getNano());
  }

  public static ZeroId readFrom(DataInputStream dis) throws IOException {
    final byte version = dis.readByte();
    final byte[] hash = new byte[HASH_LENGTH];
    dis.readFully(hash);
    final byte[] salt = new byte[SALT_LENGTH];
    dis.readFully(salt);
    final Instant created = Instant.ofEpochSecond(dis.readLong(), dis.readInt());
    return new ZeroId(version, hash, salt, created);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ZeroId that
        && version == that.version
        && Arrays.equals(hash, that.hash)
        && Arrays.equals(salt, that.salt)
        && created.equals(that.created);
  }

  @Override
  public int hashCode() {
    return Objects.hash(version, Arrays.hashCode(hash), Arrays.hashCode(salt), created);
  }

  /// Only a short prefix of the hash is shown.
  @Override
  public String toString() {
    return "ZeroId[v" + version + "," + HexFormat.of().formatHex(hash, 0, 8) + "...]";
  }
}
