// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

import static com.github.blueshare.BlueShareLogger.LOGGER;

/// Runs a session through the pipeline in its fixed order:
///
/// 1. consent from every device, optionally fanned out over a thread pool;
/// 2. consensus, where anything other than verified ends the session;
/// 3. topology selection and linking;
/// 4. bandwidth then cost allocation;
/// 5. settlement of client balances;
/// 6. the compliance gate, which activates the session if it passes and ends it otherwise.
///
/// A failed stage is never retried and there is no partial success. When a stage throws, the session is ended, a
/// [SessionEvent.SessionAborted] is emitted and the exception propagates. A session is run at most once.
///
/// Only one run proceeds at a time per orchestrator. Every stage after consent is a single writer over the session.
public class SessionOrchestrator implements AutoCloseable {
  private final Clock clock;
  private final SessionListener listener;
  private final ConsentEngine consentEngine;
  private final ConsensusAggregator consensusAggregator;
  private final TopologySelector topologySelector;
  private final BandwidthAllocator bandwidthAllocator;
  private final CostAllocator costAllocator;
  private final PaymentSettler paymentSettler;
  private final ComplianceGate complianceGate;

  /// Null when consent is requested sequentially on the calling thread.
  private final ExecutorService consentPool;

  private final Semaphore mutex = new Semaphore(1);

  public SessionOrchestrator(SessionConfig config, Clock clock, SessionListener listener) {
    this(config, clock, listener,
        new ConsentEngine(new EntropySource(), clock, listener),
        new ConsensusAggregator(listener),
        new TopologySelector(listener),
        new BandwidthAllocator(listener),
        new CostAllocator(CostModel.DEFAULT, listener),
        new PaymentSettler(config.exchangeRate(), config.invoiceExpiry(), clock, listener),
        new ComplianceGate(listener));
  }

  public SessionOrchestrator(SessionConfig config, Clock clock) {
    this(config, clock, SessionListener.NONE);
  }

  public SessionOrchestrator(SessionConfig config,
                             Clock clock,
                             SessionListener listener,
                             ConsentEngine consentEngine,
                             ConsensusAggregator consensusAggregator,
                             TopologySelector topologySelector,
                             BandwidthAllocator bandwidthAllocator,
                             CostAllocator costAllocator,
                             PaymentSettler paymentSettler,
                             ComplianceGate complianceGate) {
    Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.consentEngine = Objects.requireNonNull(consentEngine, "consentEngine");
    this.consensusAggregator = Objects.requireNonNull(consensusAggregator, "consensusAggregator");
    this.topologySelector = Objects.requireNonNull(topologySelector, "topologySelector");
    this.bandwidthAllocator = Objects.requireNonNull(bandwidthAllocator, "bandwidthAllocator");
    this.costAllocator = Objects.requireNonNull(costAllocator, "costAllocator");
    this.paymentSettler = Objects.requireNonNull(paymentSettler, "paymentSettler");
    this.complianceGate = Objects.requireNonNull(complianceGate, "complianceGate");
    this.consentPool = config.consentParallelism() > 1
        ? Executors.newFixedThreadPool(config.consentParallelism())
        : null;
  }

  /// Runs the whole pipeline over a session that has not yet been run.
  ///
  /// @return The outcome. Consensus and compliance failures are normal outcomes that end the session.
  /// @throws InvalidTopologyInputException if consensus was reached without a host.
  /// @throws EmptySessionException         if an allocator was reached with no devices.
  /// @throws IllegalStateException         if the session is already active or has ended.
  public @NotNull SessionResult run(@NotNull Session session) {
    try {
      mutex.acquire();
      try {
        if (session.isEnded()) {
          throw new IllegalStateException("session " + session.id() + " has already ended");
        }
        if (session.isActive()) {
          throw new IllegalStateException("session " + session.id() + " is already active");
        }
        try {
          return runNotThreadSafe(session);
        } catch (RuntimeException e) {
          LOGGER.log(Level.WARNING, "session " + session.id() + " aborted: " + e.getMessage(), e);
          abort(session, String.valueOf(e.getMessage()));
          throw e;
        }
      } finally {
        mutex.release();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException("SessionOrchestrator was interrupted awaiting the mutex probably to shutdown.", e);
    }
  }

  private SessionResult runNotThreadSafe(Session session) {
    LOGGER.info(() -> "session " + session.id() + " starting with " + session.deviceCount() + " devices");
    requestConsent(session.devices());

    final ConsensusTally tally = consensusAggregator.tally(session);
    if (tally.verdict() != ConsensusVerdict.VERIFIED) {
      LOGGER.info(() -> "session " + session.id() + " consensus " + tally.verdict());
      abort(session, "consensus " + tally.verdict());
      return SessionResult.consensusFailed(session.id(), tally);
    }

    final Topology topology = topologySelector.select(session);
    bandwidthAllocator.allocate(session);
    costAllocator.allocateCosts(session);
    final Map<DeviceId, PaymentRecord> payments = paymentSettler.settle(session);

    final ComplianceReport report = complianceGate.assess(session);
    if (!report.passed()) {
      abort(session, "compliance failed: missing " + report.missingStages());
      return new SessionResult(session.id(), SessionResult.Outcome.COMPLIANCE_FAILED, tally, Optional.of(topology),
          payments, Optional.of(report));
    }

    session.activate();
    LOGGER.info(() -> "session " + session.id() + " active as " + topology + " with " + payments.size()
        + " payments settled");
    listener.onEvent(new SessionEvent.SessionActivated(session.id()));
    return new SessionResult(session.id(), SessionResult.Outcome.COMPLETED, tally, Optional.of(topology),
        payments, Optional.of(report));
  }

  private void requestConsent(List<Device> devices) {
    if (consentPool == null || devices.size() < 2) {
      devices.forEach(consentEngine::requestConsent);
      return;
    }
    final var tasks = new ArrayList<Callable<ConsentState>>(devices.size());
    for (Device device : devices) {
      tasks.add(() -> consentEngine.requestConsent(device));
    }
    try {
      for (Future<ConsentState> future : consentPool.invokeAll(tasks)) {
        future.get();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException("interrupted awaiting consent", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("consent request failed", e.getCause());
    }
  }

  /// Ends a session. This is idempotent and a session that has ended can never become active again.
  public void end(Session session) {
    if (session.isEnded()) {
      return;
    }
    session.end(clock.instant());
    final var end = session.end().orElseThrow();
    LOGGER.info(() -> "session " + session.id() + " ended at " + end);
    listener.onEvent(new SessionEvent.SessionEnded(session.id(), end));
  }

  private void abort(Session session, String reason) {
    listener.onEvent(new SessionEvent.SessionAborted(session.id(), reason));
    end(session);
  }

  @Override
  public void close() {
    if (consentPool == null) {
      return;
    }
    consentPool.shutdown();
    try {
      if (!consentPool.awaitTermination(5, TimeUnit.SECONDS)) {
        LOGGER.warning("consent pool did not terminate in time");
        consentPool.shutdownNow();
      }
    } catch (InterruptedException e) {
      consentPool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
