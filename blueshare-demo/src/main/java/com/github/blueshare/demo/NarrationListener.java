// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare.demo;

import com.github.blueshare.SessionEvent;
import com.github.blueshare.SessionListener;

import java.util.Locale;
import java.util.logging.Logger;

/// Renders the pipeline's events as a readable narration of the session.
public class NarrationListener implements SessionListener {
  static final Logger LOGGER = Logger.getLogger(NarrationListener.class.getName());

  @Override
  public void onEvent(SessionEvent event) {
    LOGGER.info(() -> narrate(event));
  }

  static String narrate(SessionEvent event) {
    if (event instanceof SessionEvent.ConsentDecided e) {
      final String entropy = e.record().entropy().isPresent()
          ? String.format(Locale.ROOT, " (entropy %.2f bits)", e.record().entropy().getAsDouble())
          : "";
      return String.format(Locale.ROOT, "Consent %s at %d dBm: %s%s",
          e.deviceName(), e.signalStrengthDbm(), e.record().state(), entropy);
    } else if (event instanceof SessionEvent.ConsensusReached e) {
      return String.format(Locale.ROOT, "Consensus %s: %d accept, %d reject, %d ambiguous of %d devices",
          e.tally().verdict(), e.tally().accept(), e.tally().reject(), e.tally().ambiguous(),
          e.tally().deviceCount());
    } else if (event instanceof SessionEvent.TopologySelected e) {
      return String.format(Locale.ROOT, "Topology %s for %d devices with %d hosts",
          e.topology(), e.deviceCount(), e.hostCount());
    } else if (event instanceof SessionEvent.BandwidthAllocated e) {
      return String.format(Locale.ROOT, "Bandwidth %.2f Mbps total, %.2f Mbps fair share",
          e.allocation().totalMbps(), e.allocation().fairShareMbps());
    } else if (event instanceof SessionEvent.CostAllocated e) {
      return String.format(Locale.ROOT, "Cost %s used %.2f MB costing $%.6f",
          e.deviceName(), e.megabytes(), e.costUsd());
    } else if (event instanceof SessionEvent.CostsSummarised e) {
      return String.format(Locale.ROOT, "Costs $%.6f total, $%.6f per device",
          e.summary().totalUsd(), e.summary().perDeviceUsd());
    } else if (event instanceof SessionEvent.PaymentSettled e) {
      return String.format(Locale.ROOT, "Payment %s %d sat %s %s",
          e.deviceName(), e.payment().amountSatoshi(), e.payment().invoice(), e.payment().status());
    } else if (event instanceof SessionEvent.ComplianceChecked e) {
      return String.format(Locale.ROOT, "Compliance %s (transparency=%s fairness=%s privacy=%s accessibility=%s)",
          e.report().passed() ? "PASSED" : "FAILED", e.report().transparency(), e.report().fairness(),
          e.report().privacy(), e.report().accessibility());
    } else if (event instanceof SessionEvent.SessionActivated e) {
      return "Session " + e.sessionId() + " is active";
    } else if (event instanceof SessionEvent.SessionAborted e) {
      return "Session " + e.sessionId() + " aborted: " + e.reason();
    } else if (event instanceof SessionEvent.SessionEnded e) {
      return "Session " + e.sessionId() + " ended at " + e.end();
    }
    return event.toString();
  }
}
