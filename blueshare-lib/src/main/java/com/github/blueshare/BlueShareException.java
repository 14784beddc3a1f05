// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

/// The root of the failures that abort a session pipeline run. None of these are retried automatically. They
/// propagate to the [SessionOrchestrator] which ends the session before passing them on to the caller.
public abstract class BlueShareException extends RuntimeException {
  protected BlueShareException(String message) {
    super(message);
  }
}
