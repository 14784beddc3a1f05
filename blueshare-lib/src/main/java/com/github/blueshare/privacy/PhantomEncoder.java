// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare.privacy;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Logger;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/// Issues and checks phantom identities so that a device can prove it belongs to a network without revealing its
/// identifier. An identity is a salted hash of the identifier. Purpose-specific identities are derived from it with
/// an HMAC under the context salt so that an identity used for one purpose cannot be linked to another. Proofs are a
/// hash of the identity and a fresh random challenge and are compared in constant time.
public class PhantomEncoder {
  static final Logger LOGGER = Logger.getLogger(PhantomEncoder.class.getName());

  public static final int CHALLENGE_LENGTH = 32;
  public static final Duration KEY_LIFETIME = Duration.ofDays(30);
  public static final String AUTHENTICATION = "authentication";
  public static final String NETWORK_JOINING = "network-joining";

  private static final String HMAC_SHA256 = "HmacSHA256";

  private static final ThreadLocal<MessageDigest> SHA_256 = ThreadLocal.withInitial(() -> {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("Required digest algorithm unavailable", e);
    }
  });

  private static final ThreadLocal<Mac> MAC = ThreadLocal.withInitial(() -> {
    try {
      return Mac.getInstance(HMAC_SHA256);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("Required MAC algorithm unavailable", e);
    }
  });

  private final ZeroContext context;
  private final Clock clock;
  private final SecureRandom random;

  public PhantomEncoder(ZeroContext context, Clock clock, SecureRandom random) {
    this.context = Objects.requireNonNull(context, "context");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.random = Objects.requireNonNull(random, "random");
  }

  public PhantomEncoder(ZeroContext context, Clock clock) {
    this(context, clock, new SecureRandom());
  }

  public ZeroId createId(String deviceId) {
    Objects.requireNonNull(deviceId, "deviceId");
    final byte[] salt = new byte[ZeroId.SALT_LENGTH];
    random.nextBytes(salt);
    final MessageDigest digest = SHA_256.get();
    digest.reset();
    digest.update(deviceId.getBytes(StandardCharsets.UTF_8));
    digest.update(salt);
    final var id = new ZeroId(ZeroId.VERSION, digest.digest(), salt, clock.instant());
    LOGGER.finer(() -> "created " + id);
    return id;
  }

  public ZeroKey createKey(ZeroId id) {
    final Instant now = clock.instant();
    return new ZeroKey(hmac(context.masterKey(), id.hash(), new byte[0]), now, now.plus(KEY_LIFETIME));
  }

  /// Derives an identity for one purpose that keeps the base salt and version but cannot be linked to the base hash.
  public ZeroId derive(ZeroId base, String purpose) {
    final byte[] hash = hmac(context.contextSalt(), base.hash(), purpose.getBytes(StandardCharsets.UTF_8));
    final var derived = new ZeroId(base.version(), hash, base.salt(), clock.instant());
    LOGGER.finer(() -> "derived " + derived + " for " + purpose);
    return derived;
  }

  public byte[] challenge() {
    final byte[] challenge = new byte[CHALLENGE_LENGTH];
    random.nextBytes(challenge);
    return challenge;
  }

  public ZeroProof prove(ZeroId id, byte[] challenge) {
    return new ZeroProof(proofHash(id.hash(), challenge), challenge, clock.instant());
  }

  public boolean verify(ZeroProof proof, ZeroId id) {
    final byte[] expected = proofHash(id.hash(), proof.challenge());
    return MessageDigest.isEqual(expected, proof.proof());
  }

  /// Creates the base identity, its key and the two derived identities a device presents.
  public PhantomIdentity enrol(String deviceId) {
    final ZeroId id = createId(deviceId);
    return new PhantomIdentity(id, createKey(id), derive(id, AUTHENTICATION), derive(id, NETWORK_JOINING));
  }

  /// A challenge-response round over the authentication identity.
  public boolean authenticate(PhantomIdentity identity) {
    final boolean verified = respond(identity.authenticationId());
    LOGGER.fine(() -> "authentication " + identity.authenticationId() + " verified=" + verified);
    return verified;
  }

  /// A challenge-response round over an identity derived from the network identity for one named network.
  public boolean joinNetwork(PhantomIdentity identity, String networkName) {
    final ZeroId networkSpecific = derive(identity.networkId(), "network-" + networkName);
    final boolean verified = respond(networkSpecific);
    LOGGER.fine(() -> "join " + networkName + " as " + networkSpecific + " verified=" + verified);
    return verified;
  }

  private boolean respond(ZeroId id) {
    return verify(prove(id, challenge()), id);
  }

  private static byte[] proofHash(byte[] hash, byte[] challenge) {
    final MessageDigest digest = SHA_256.get();
    digest.reset();
    digest.update(hash);
    digest.update(challenge);
    return digest.digest();
  }

  private static byte[] hmac(byte[] key, byte[] first, byte[] second) {
    final Mac mac = MAC.get();
    try {
      mac.init(new SecretKeySpec(key, HMAC_SHA256));
    } catch (InvalidKeyException e) {
      throw new IllegalStateException("HMAC key rejected", e);
    }
    mac.update(first);
    mac.update(second);
    return mac.doFinal();
  }
}
