// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;

import static com.github.blueshare.BlueShareLogger.LOGGER;

/// Fans each event out to every subscribed listener. A listener that throws is logged and does not stop the pipeline
/// or the other listeners.
public class SessionEvents implements SessionListener {
  private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

  public SessionEvents subscribe(SessionListener listener) {
    listeners.add(listener);
    return this;
  }

  public void unsubscribe(SessionListener listener) {
    listeners.remove(listener);
  }

  @Override
  public void onEvent(SessionEvent event) {
    LOGGER.finest(() -> "event " + event);
    for (SessionListener listener : listeners) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException e) {
        LOGGER.log(Level.WARNING, "listener " + listener + " failed on " + event + ": " + e, e);
      }
    }
  }
}
