// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ComplianceGateTests {

  @Test
  void failsBeforeTheAllocatorsRun() {
    final var session = SessionFixtures.fourDeviceSession(SessionFixtures.NEARBY_RELAY_DBM);
    final var report = new ComplianceGate().assess(session);
    assertFalse(report.transparency());
    assertFalse(report.fairness());
    assertTrue(report.privacy());
    assertTrue(report.accessibility());
    assertFalse(report.passed());
    assertTrue(session.privacyVerified());
  }

  @Test
  void failsWithoutCostAllocation() {
    final var session = SessionFixtures.fourDeviceSession(SessionFixtures.NEARBY_RELAY_DBM);
    new BandwidthAllocator().allocate(session);
    final var gate = new ComplianceGate();
    assertFalse(gate.verify(session));
    final var e = assertThrows(StageOrderViolationException.class, () -> gate.enforce(session));
    assertEquals(List.of(Session.COST_STAGE), e.missingStages());
  }

  @Test
  void enforceNamesEveryMissingStage() {
    final var session = SessionFixtures.fourDeviceSession(SessionFixtures.NEARBY_RELAY_DBM);
    final var e = assertThrows(StageOrderViolationException.class, () -> new ComplianceGate().enforce(session));
    assertEquals(List.of(Session.BANDWIDTH_STAGE, Session.COST_STAGE), e.missingStages());
  }

  @Test
  void passesOnceBothAllocatorsHaveRun() {
    final var session = SessionFixtures.fourDeviceSession(SessionFixtures.NEARBY_RELAY_DBM);
    new BandwidthAllocator().allocate(session);
    new CostAllocator().allocateCosts(session);
    final var listener = new SessionFixtures.RecordingListener();
    final var gate = new ComplianceGate(listener);
    assertTrue(gate.verify(session));
    assertTrue(gate.enforce(session).passed());
    assertEquals(2, listener.of(SessionEvent.ComplianceChecked.class).size());
  }
}
