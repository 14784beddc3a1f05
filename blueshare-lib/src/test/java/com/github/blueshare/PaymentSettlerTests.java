// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;

import static com.github.blueshare.SessionFixtures.CLOCK;
import static com.github.blueshare.SessionFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class PaymentSettlerTests {

  private static Session costedSession() {
    final var session = SessionFixtures.fourDeviceSession(SessionFixtures.NEARBY_RELAY_DBM);
    new CostAllocator().allocateCosts(session);
    return session;
  }

  @Test
  void onlyClientsThatOweArePaid() {
    final var session = costedSession();
    final var listener = new SessionFixtures.RecordingListener();
    final var payments = new PaymentSettler(ExchangeRate.DEFAULT, PaymentSettler.DEFAULT_EXPIRY, CLOCK, listener)
        .settle(session);
    assertThat(payments.keySet()).containsExactly(new DeviceId("client-001"), new DeviceId("client-002"));
    assertEquals(2, listener.of(SessionEvent.PaymentSettled.class).size());
    final var devices = session.devices();
    assertEquals(PaymentStatus.PENDING, devices.get(0).paymentStatus());
    assertEquals(PaymentStatus.SETTLED, devices.get(1).paymentStatus());
    assertEquals(PaymentStatus.SETTLED, devices.get(2).paymentStatus());
    assertEquals(PaymentStatus.PENDING, devices.get(3).paymentStatus());
  }

  @Test
  void clientWithNothingToPayIsSkipped() {
    final var session = SessionFixtures.session(List.of(
        new Device("h", "H", DeviceRole.HOST, -60, 10.0).recordTraffic(1_048_576, 0),
        new Device("c", "C", DeviceRole.CLIENT, -60, 0.0)));
    new CostAllocator().allocateCosts(session);
    assertTrue(new PaymentSettler(CLOCK).settle(session).isEmpty());
    assertEquals(PaymentStatus.PENDING, session.devices().get(1).paymentStatus());
  }

  @Test
  void recordsAreSettledInvoices() {
    final var payments = new PaymentSettler(CLOCK).settle(costedSession());
    final var bob = payments.get(new DeviceId("client-001"));
    assertEquals(PaymentStatus.SETTLED, bob.status());
    assertEquals(0.001786125, bob.amountUsd(), 1e-12);
    // floor(0.001786125 / 40000 * 1e8) == floor(4.465)
    assertEquals(4, bob.amountSatoshi());
    assertEquals(1, payments.get(new DeviceId("client-002")).amountSatoshi());
    assertTrue(bob.paymentHash().matches("[0-9a-f]{64}"), bob.paymentHash());
    assertEquals("lnbc4u1p" + bob.paymentHash().substring(0, 10), bob.invoice());
    assertEquals(NOW.plus(Duration.ofMinutes(10)), bob.expiry());
    assertFalse(bob.isExpired(NOW));
    assertTrue(bob.isExpired(NOW.plus(Duration.ofMinutes(11))));
  }

  @Test
  void expiryIsConfigurable() {
    final var settler = new PaymentSettler(ExchangeRate.DEFAULT, Duration.ofSeconds(30), CLOCK,
        SessionListener.NONE);
    assertEquals(NOW.plusSeconds(30), settler.invoice(1.0).expiry());
  }

  @Test
  void hashesDifferWithinTheSameInstant() {
    final var settler = new PaymentSettler(CLOCK);
    final var hashes = new HashSet<String>();
    for (int i = 0; i < 100; i++) {
      assertTrue(hashes.add(settler.invoice(0.5).paymentHash()));
    }
  }

  @Test
  void newInvoicesAreAuthorised() {
    assertEquals(PaymentStatus.AUTHORIZED, new PaymentSettler(CLOCK).invoice(0.25).status());
  }

  @Property
  void satoshiConversionLosesLessThanOneSatoshi(@ForAll @DoubleRange(min = 0.0, max = 1000.0) double usd) {
    final var rate = ExchangeRate.DEFAULT;
    final long satoshi = rate.toSatoshi(usd);
    assertTrue(satoshi >= 0);
    final double lost = usd - rate.toUsd(satoshi);
    assertTrue(lost >= -1e-9 && lost < rate.usdPerSatoshi() + 1e-9, "lost " + lost);
  }

  @Test
  void settlingBeforeCostsIsAnError() {
    final var session = SessionFixtures.fourDeviceSession(SessionFixtures.NEARBY_RELAY_DBM);
    final var e = assertThrows(StageOrderViolationException.class, () -> new PaymentSettler(CLOCK).settle(session));
    assertEquals(List.of(Session.COST_STAGE), e.missingStages());
  }

  @Test
  void clientsAreSettledOnlyOnce() {
    final var session = costedSession();
    final var listener = new SessionFixtures.RecordingListener();
    final var settler = new PaymentSettler(ExchangeRate.DEFAULT, PaymentSettler.DEFAULT_EXPIRY, CLOCK, listener);
    settler.settle(session);
    assertThrows(IllegalStateException.class, () -> settler.settle(session));
    assertEquals(2, listener.of(SessionEvent.PaymentSettled.class).size());
    assertEquals(PaymentStatus.SETTLED, session.devices().get(1).paymentStatus());
  }
}
