// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static com.github.blueshare.SessionFixtures.CLOCK;
import static com.github.blueshare.SessionFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;

public class SessionTests {

  @Test
  void devicesMustBeUnique() {
    final var a = new Device("same", "A", DeviceRole.HOST, -60, 1.0);
    final var b = new Device("same", "B", DeviceRole.CLIENT, -60, 0.0);
    assertThrows(IllegalArgumentException.class, () -> SessionFixtures.session(List.of(a, b)));
  }

  @Test
  void openAsksTheRegistry() {
    final var session = Session.open("s1", () -> SessionFixtures.fourDevices(-80), CLOCK);
    assertEquals(4, session.deviceCount());
    assertEquals(1, session.hostCount());
    assertEquals(NOW, session.start());
    assertTrue(session.device(new DeviceId("client-002")).isPresent());
    assertTrue(session.topology().isEmpty());
    assertEquals(0, session.links().linkCount());
  }

  @Test
  void aggregatesCannotBeReadBeforeTheyExist() {
    final var session = SessionFixtures.fourDeviceSession(-80);
    final var bandwidth = assertThrows(StageOrderViolationException.class, session::bandwidth);
    assertEquals(List.of(Session.BANDWIDTH_STAGE), bandwidth.missingStages());
    final var costs = assertThrows(StageOrderViolationException.class, session::costs);
    assertEquals(List.of(Session.COST_STAGE), costs.missingStages());
  }

  @Test
  void flagsStartFalse() {
    final var session = SessionFixtures.fourDeviceSession(-80);
    assertFalse(session.transparencyVerified());
    assertFalse(session.fairnessVerified());
    assertFalse(session.privacyVerified());
    assertFalse(session.isActive());
    assertFalse(session.isEnded());
  }

  @Test
  void endedSessionStaysEnded() {
    final var session = SessionFixtures.fourDeviceSession(-80);
    session.activate();
    assertTrue(session.isActive());
    session.end(NOW.plusSeconds(60));
    session.end(NOW.plusSeconds(120));
    assertFalse(session.isActive());
    assertEquals(NOW.plusSeconds(60), session.end().orElseThrow());
    assertThrows(IllegalStateException.class, session::activate);
  }

  @Test
  void deviceValidation() {
    assertThrows(IllegalArgumentException.class, () -> new DeviceId(" "));
    assertThrows(IllegalArgumentException.class, () -> new Device("d", "D", DeviceRole.HOST, -60, -1.0));
    assertThrows(IllegalArgumentException.class,
        () -> new Device("d", "D", DeviceRole.CLIENT, -60, 0.0).recordTraffic(-1, 0));
    assertEquals(Device.DEFAULT_MTU, new Device("d", "D", DeviceRole.CLIENT, -60, 0.0).mtu());
  }

  @Test
  void consentRecordCarriesEntropyOnlyWhenAmbiguous() {
    assertThrows(IllegalArgumentException.class,
        () -> new ConsentRecord(ConsentState.ACCEPT, OptionalDouble.of(1.0), NOW));
    assertThrows(IllegalArgumentException.class,
        () -> new ConsentRecord(ConsentState.AMBIGUOUS, OptionalDouble.empty(), NOW));
    assertThrows(IllegalArgumentException.class, () -> ConsentRecord.ambiguous(-0.5, NOW));
  }

  @Test
  void devicePaymentStatusFollowsTheLifecycle() {
    final var device = new Device("c", "C", DeviceRole.CLIENT, -60, 0.0);
    assertThrows(IllegalStateException.class, () -> device.paymentStatus(PaymentStatus.SETTLED));
    device.paymentStatus(PaymentStatus.AUTHORIZED);
    device.paymentStatus(PaymentStatus.SETTLED);
    assertThrows(IllegalStateException.class, () -> device.paymentStatus(PaymentStatus.SETTLED));
    assertEquals(PaymentStatus.SETTLED, device.paymentStatus());
  }
}
