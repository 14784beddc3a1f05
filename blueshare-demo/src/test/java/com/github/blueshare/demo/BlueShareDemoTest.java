// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare.demo;

import com.github.blueshare.ConsensusTally;
import com.github.blueshare.ConsensusVerdict;
import com.github.blueshare.SessionConfig;
import com.github.blueshare.SessionEvent;
import com.github.blueshare.SessionResult;
import com.github.blueshare.Topology;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class BlueShareDemoTest {
  final Clock clock = Clock.fixed(Instant.parse("2025-06-01T09:30:00Z"), ZoneOffset.UTC);

  @Test
  public void nearbyRelaySessionCompletes() {
    final var result = BlueShareDemo.run(new DemoRegistry(DemoRegistry.NEARBY_RELAY_DBM), SessionConfig.DEFAULT,
        clock);
    assertEquals(SessionResult.Outcome.COMPLETED, result.outcome());
    assertEquals(Topology.BUS, result.topology().orElseThrow());
    assertThat(result.payments()).hasSize(2);
  }

  @Test
  public void distantRelayVetoes() {
    final var result = BlueShareDemo.run(new DemoRegistry(DemoRegistry.DISTANT_RELAY_DBM), SessionConfig.DEFAULT,
        clock);
    assertEquals(SessionResult.Outcome.CONSENSUS_REJECTED, result.outcome());
  }

  @Test
  public void narration() {
    final var tally = new ConsensusTally(2, 0, 2, 4, ConsensusVerdict.VERIFIED);
    assertEquals("Consensus VERIFIED: 2 accept, 0 reject, 2 ambiguous of 4 devices",
        NarrationListener.narrate(new SessionEvent.ConsensusReached("s", tally)));
    assertEquals("Session s aborted: consensus REJECTED",
        NarrationListener.narrate(new SessionEvent.SessionAborted("s", "consensus REJECTED")));
  }
}
