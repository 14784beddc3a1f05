// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare.privacy;

import java.security.SecureRandom;
import java.util.Arrays;

/// The secrets held by whoever issues phantom identities. Neither value ever leaves the issuer.
///
/// @param masterKey   Keys verification keys from identity hashes.
/// @param contextSalt Keys the derivation of purpose-specific identities.
public record ZeroContext(byte[] masterKey, byte[] contextSalt) {
  public static final int SECRET_LENGTH = 32;

  public ZeroContext {
    if (masterKey == null || masterKey.length != SECRET_LENGTH) {
      throw new IllegalArgumentException("masterKey must be " + SECRET_LENGTH + " bytes");
    }
    if (contextSalt == null || contextSalt.length != SECRET_LENGTH) {
      throw new IllegalArgumentException("contextSalt must be " + SECRET_LENGTH + " bytes");
    }
    masterKey = masterKey.clone();
    contextSalt = contextSalt.clone();
  }

  public static ZeroContext create(SecureRandom random) {
    final byte[] masterKey = new byte[SECRET_LENGTH];
    final byte[] contextSalt = new byte[SECRET_LENGTH];
    random.nextBytes(masterKey);
    random.nextBytes(contextSalt);
    return new ZeroContext(masterKey, contextSalt);
  }

  @Override
  public byte[] masterKey() {
    return masterKey.clone();
  }

  @Override
  public byte[] contextSalt() {
    return contextSalt.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ZeroContext that
        && Arrays.equals(masterKey, that.masterKey)
        && Arrays.equals(contextSalt, that.contextSalt);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(masterKey) + Arrays.hashCode(contextSalt);
  }

  /// Never print the secrets.
  @Override
  public String toString() {
    return "ZeroContext[SHA256-HMAC]";
  }
}
