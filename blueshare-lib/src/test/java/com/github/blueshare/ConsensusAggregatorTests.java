// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.blueshare.SessionFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;

public class ConsensusAggregatorTests {

  @Test
  void verdictRules() {
    assertEquals(ConsensusVerdict.VERIFIED, ConsensusAggregator.verdict(2, 0, 4));
    assertEquals(ConsensusVerdict.PENDING, ConsensusAggregator.verdict(1, 0, 4));
    assertEquals(ConsensusVerdict.REJECTED, ConsensusAggregator.verdict(3, 1, 4));
    // floor(5 / 2) == 2
    assertEquals(ConsensusVerdict.VERIFIED, ConsensusAggregator.verdict(2, 0, 5));
    assertEquals(ConsensusVerdict.VERIFIED, ConsensusAggregator.verdict(0, 0, 1));
  }

  @Test
  void noDevicesIsPending() {
    assertEquals(ConsensusVerdict.PENDING, ConsensusAggregator.verdict(0, 0, 0));
    final var session = SessionFixtures.session(List.of());
    assertEquals(ConsensusVerdict.PENDING, new ConsensusAggregator().tally(session).verdict());
  }

  @Property
  void anyRejectVetoes(@ForAll @IntRange(min = 0, max = 50) int accept,
                       @ForAll @IntRange(min = 1, max = 50) int reject,
                       @ForAll @IntRange(min = 0, max = 50) int extra) {
    assertEquals(ConsensusVerdict.REJECTED, ConsensusAggregator.verdict(accept, reject, accept + reject + extra));
  }

  @Property
  void withoutRejectsHalfTheDevicesVerify(@ForAll @IntRange(min = 1, max = 100) int deviceCount,
                                          @ForAll @IntRange(min = 0, max = 100) int accept) {
    Assume.that(accept <= deviceCount);
    final var expected = accept >= deviceCount / 2 ? ConsensusVerdict.VERIFIED : ConsensusVerdict.PENDING;
    assertEquals(expected, ConsensusAggregator.verdict(accept, 0, deviceCount));
  }

  @Test
  void devicesThatHaveNotVotedAreLeftOut() {
    final var devices = SessionFixtures.devices(4, 1);
    devices.get(0).consent(ConsentRecord.accept(NOW));
    devices.get(1).consent(ConsentRecord.ambiguous(3.0, NOW));
    final var listener = new SessionFixtures.RecordingListener();
    final var tally = new ConsensusAggregator(listener).tally(SessionFixtures.session(devices));
    assertEquals(1, tally.accept());
    assertEquals(0, tally.reject());
    assertEquals(1, tally.ambiguous());
    assertEquals(2, tally.abstained());
    assertEquals(4, tally.deviceCount());
    // one accept of four is below floor(4 / 2)
    assertEquals(ConsensusVerdict.PENDING, tally.verdict());
    assertEquals(List.of("ConsensusReached"), listener.names());
  }

  @Test
  void verifyIsTrueOnlyWhenVerified() {
    final var devices = SessionFixtures.devices(2, 1);
    devices.get(0).consent(ConsentRecord.accept(NOW));
    assertTrue(new ConsensusAggregator().verify(SessionFixtures.session(devices)));
    devices.get(1).consent(ConsentRecord.reject(NOW));
    assertFalse(new ConsensusAggregator().verify(SessionFixtures.session(devices)));
  }
}
