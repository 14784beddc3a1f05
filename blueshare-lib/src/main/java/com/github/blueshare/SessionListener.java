// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

/// Receives [SessionEvent]s on the thread of the stage that raised them. Consent may be decided on pool threads so
/// listeners must be thread safe.
@FunctionalInterface
public interface SessionListener {
  SessionListener NONE = event -> {
  };

  void onEvent(SessionEvent event);
}
