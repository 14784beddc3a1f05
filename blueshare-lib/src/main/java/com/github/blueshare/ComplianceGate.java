// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.util.Objects;

import static com.github.blueshare.BlueShareLogger.LOGGER;

/// The last check before a session may operate. It evaluates, in order and without short-circuiting:
///
/// 1. transparency: the [CostAllocator] has run;
/// 2. fairness: the [BandwidthAllocator] has run;
/// 3. privacy: always passes as the privacy-preserving identity layer sits outside the pipeline;
/// 4. accessibility: always passes.
///
/// The first two enforce the stage order at runtime. A gate run before either allocator fails.
public class ComplianceGate {
  private final SessionListener listener;

  public ComplianceGate(SessionListener listener) {
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  public ComplianceGate() {
    this(SessionListener.NONE);
  }

  public ComplianceReport assess(Session session) {
    final boolean transparency = session.transparencyVerified();
    final boolean fairness = session.fairnessVerified();
    session.markPrivacyVerified();
    final boolean privacy = session.privacyVerified();
    final boolean accessibility = true;
    final var report = new ComplianceReport(transparency, fairness, privacy, accessibility);
    LOGGER.fine(() -> "compliance " + session.id() + " transparency=" + transparency + " fairness=" + fairness
        + " privacy=" + privacy + " accessibility=" + accessibility);
    if (!report.passed()) {
      LOGGER.warning(() -> "compliance " + session.id() + " failed as it has not run " + report.missingStages());
    }
    listener.onEvent(new SessionEvent.ComplianceChecked(session.id(), report));
    return report;
  }

  public boolean verify(Session session) {
    return assess(session).passed();
  }

  /// @throws StageOrderViolationException naming the allocators that have not run.
  public ComplianceReport enforce(Session session) {
    final var report = assess(session);
    if (!report.passed()) {
      throw new StageOrderViolationException(session.id(), report.missingStages());
    }
    return report;
  }
}
