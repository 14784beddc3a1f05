// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// The outcome of one run of the pipeline over a session. Stages after the one that stopped the run are absent.
///
/// @param sessionId  The session that was run.
/// @param outcome    How far the run got.
/// @param tally      The consensus counts which always exist as consent is the first stage.
/// @param topology   The topology if consensus was verified.
/// @param payments   The settled payments by device which is empty unless the run got as far as settlement.
/// @param compliance The compliance report if the gate was reached.
public record SessionResult(String sessionId, Outcome outcome, ConsensusTally tally, Optional<Topology> topology,
                            Map<DeviceId, PaymentRecord> payments, Optional<ComplianceReport> compliance) {

  public enum Outcome {
    /// Every stage ran and the session is active.
    COMPLETED,
    /// A device rejected so the session was ended.
    CONSENSUS_REJECTED,
    /// Too few devices accepted so the session was ended.
    CONSENSUS_PENDING,
    /// The compliance gate failed so the session was ended.
    COMPLIANCE_FAILED
  }

  public SessionResult {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(tally, "tally");
    Objects.requireNonNull(topology, "topology");
    payments = Collections.unmodifiableMap(new LinkedHashMap<>(payments));
    Objects.requireNonNull(compliance, "compliance");
  }

  static SessionResult consensusFailed(String sessionId, ConsensusTally tally) {
    final Outcome outcome = tally.verdict() == ConsensusVerdict.REJECTED
        ? Outcome.CONSENSUS_REJECTED
        : Outcome.CONSENSUS_PENDING;
    return new SessionResult(sessionId, outcome, tally, Optional.empty(), Map.of(), Optional.empty());
  }

  public boolean completed() {
    return outcome == Outcome.COMPLETED;
  }
}
