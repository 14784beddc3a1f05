// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare.demo;

import com.github.blueshare.Device;
import com.github.blueshare.Session;
import com.github.blueshare.SessionConfig;
import com.github.blueshare.SessionEvents;
import com.github.blueshare.SessionOrchestrator;
import com.github.blueshare.SessionResult;
import com.github.blueshare.SessionSummary;
import com.github.blueshare.privacy.PhantomEncoder;
import com.github.blueshare.privacy.ZeroContext;
import org.jetbrains.annotations.NotNull;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Locale;
import java.util.logging.Logger;

/// Runs one session over the four demo devices and prints a summary. The optional first argument is the relay's
/// signal strength in dBm. At the default of -85 the session completes; at -95 the relay vetoes it.
public class BlueShareDemo {
  static {
    LoggerConfig.initialize();
  }

  static final Logger LOGGER = Logger.getLogger(BlueShareDemo.class.getName());

  static final String NETWORK_NAME = "blueshare-demo";

  public static void main(String[] args) {
    final int relaySignal = args.length > 0 ? Integer.parseInt(args[0]) : DemoRegistry.NEARBY_RELAY_DBM;
    final var result = run(new DemoRegistry(relaySignal), SessionConfig.fromSystemProperties(), Clock.systemUTC());
    if (!result.completed()) {
      System.exit(1);
    }
  }

  static SessionResult run(DemoRegistry registry, SessionConfig config, Clock clock) {
    final var session = Session.open("session-" + clock.millis(), registry, clock);
    authenticate(session, clock);

    final var events = new SessionEvents().subscribe(new NarrationListener());
    try (var orchestrator = new SessionOrchestrator(config, clock, events)) {
      final SessionResult result = orchestrator.run(session);
      LOGGER.info(() -> summary(SessionSummary.of(session), result));
      return result;
    }
  }

  /// Each device proves membership of the network with a phantom identity before the session runs.
  static void authenticate(Session session, Clock clock) {
    final var random = new SecureRandom();
    final var encoder = new PhantomEncoder(ZeroContext.create(random), clock, random);
    for (Device device : session.devices()) {
      final var identity = encoder.enrol(device.id().id());
      final boolean authenticated = encoder.authenticate(identity);
      final boolean joined = encoder.joinNetwork(identity, NETWORK_NAME);
      LOGGER.info(() -> "Identity " + device.name() + " as " + identity.authenticationId()
          + " authenticated=" + authenticated + " joined=" + joined);
    }
  }

  @NotNull
  static String summary(SessionSummary summary, SessionResult result) {
    final var sb = new StringBuilder();
    sb.append("Session ").append(summary.sessionId()).append(' ').append(result.outcome()).append('\n');
    sb.append("  devices: ").append(summary.deviceCount()).append(" (").append(summary.hostCount())
        .append(" hosts)\n");
    sb.append("  topology: ").append(summary.topology().map(Enum::name).orElse("none")).append('\n');
    summary.bandwidth().ifPresent(b -> sb.append(String.format(Locale.ROOT,
        "  bandwidth: %.2f Mbps total, %.2f Mbps fair share%n", b.totalMbps(), b.fairShareMbps())));
    summary.costs().ifPresent(c -> sb.append(String.format(Locale.ROOT,
        "  costs: $%.6f total, $%.6f per device%n", c.totalUsd(), c.perDeviceUsd())));
    sb.append("  payments settled: ").append(result.payments().size()).append('\n');
    sb.append("  compliance: transparency=").append(summary.transparencyVerified())
        .append(" fairness=").append(summary.fairnessVerified())
        .append(" privacy=").append(summary.privacyVerified()).append('\n');
    sb.append("  active: ").append(summary.active());
    return sb.toString();
  }
}
