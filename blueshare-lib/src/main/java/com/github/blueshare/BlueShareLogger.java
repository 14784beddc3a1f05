// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.util.logging.Logger;

/// We are using JUL logging to reduce dependencies. You can configure JUL logging to bridge to your chosen logging
/// framework. Stage detail is logged at FINE, session lifecycle at INFO and aborts at WARNING.
public final class BlueShareLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.blueshare");

  private BlueShareLogger() {
  }
}
