// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare.privacy;

import java.util.Objects;

/// Everything a device is issued on enrolment. Only the derived identities are ever shown to a network.
public record PhantomIdentity(ZeroId id, ZeroKey key, ZeroId authenticationId, ZeroId networkId) {
  public PhantomIdentity {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(authenticationId, "authenticationId");
    Objects.requireNonNull(networkId, "networkId");
  }
}
