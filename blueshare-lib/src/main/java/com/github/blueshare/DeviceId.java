// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

public record DeviceId(String id) implements Comparable<DeviceId> {
  public DeviceId {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("Device ID must not be blank");
  }

  @Override
  public int compareTo(DeviceId other) {
    return id.compareTo(other.id);
  }

  @Override
  public String toString() {
    return id;
  }
}
