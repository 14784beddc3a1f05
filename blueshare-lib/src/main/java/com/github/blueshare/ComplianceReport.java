// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

import java.util.ArrayList;
import java.util.List;

/// The four predicates checked before a session may operate. Every predicate is always evaluated so that the caller
/// sees the full picture rather than the first failure.
///
/// @param transparency  Costs were computed by the auditable cost model.
/// @param fairness      An allocation pass shared the bandwidth.
/// @param privacy       The privacy-preserving identity layer is in place.
/// @param accessibility No device is excluded on the basis of its kind.
public record ComplianceReport(boolean transparency, boolean fairness, boolean privacy, boolean accessibility) {

  public boolean passed() {
    return transparency && fairness && privacy && accessibility;
  }

  /// The producing stages that had not run when the report was made.
  public List<String> missingStages() {
    final var missing = new ArrayList<String>();
    if (!fairness) missing.add(Session.BANDWIDTH_STAGE);
    if (!transparency) missing.add(Session.COST_STAGE);
    return missing;
  }
}
