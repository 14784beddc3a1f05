// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

/// Thrown when a topology is requested for a session that has no device in the [DeviceRole#HOST] role. Without a host
/// there is no connection to share so the session must be aborted rather than retried.
public class InvalidTopologyInputException extends BlueShareException {
  private final int deviceCount;

  public InvalidTopologyInputException(int deviceCount) {
    super("no host among " + deviceCount + " devices so no topology can be chosen");
    this.deviceCount = deviceCount;
  }

  public int deviceCount() {
    return deviceCount;
  }
}
