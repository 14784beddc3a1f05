// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

/// Thrown when a per-device average is requested over a session with no devices.
public class EmptySessionException extends BlueShareException {
  public EmptySessionException(String sessionId, String stage) {
    super(stage + " cannot run on session " + sessionId + " as it has no devices");
  }
}
