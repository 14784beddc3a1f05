// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.util.List;

/// Thrown when the output of a pipeline stage is needed before that stage has run. Re-running the pipeline in the
/// correct order recovers from this.
public class StageOrderViolationException extends BlueShareException {
  private final List<String> missingStages;

  public StageOrderViolationException(String sessionId, List<String> missingStages) {
    super("session " + sessionId + " has not yet run " + String.join(", ", missingStages));
    this.missingStages = List.copyOf(missingStages);
  }

  public List<String> missingStages() {
    return missingStages;
  }
}
