// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare;

/// Prices data as mechanical work: `W = F * d * cos(theta)` joules per megabyte, charged at a fixed rate per joule.
/// The figures are a closed-form planning model and not a measurement.
///
/// @param forceNewtons   The force applied per megabyte.
/// @param distanceMeters The distance the force is applied over.
/// @param cosineTheta    The cosine of the angle between force and displacement.
/// @param usdPerJoule    The micro-transaction rate.
public record CostModel(double forceNewtons, double distanceMeters, double cosineTheta, double usdPerJoule) {
  public static final double BYTES_PER_MB = 1024.0 * 1024.0;

  /// cos(30 degrees) is taken as 0.866.
  public static final CostModel DEFAULT = new CostModel(1.25, 15.0, 0.866, 0.00001);

  public CostModel {
    if (forceNewtons < 0 || distanceMeters < 0 || usdPerJoule < 0) {
      throw new IllegalArgumentException("cost model figures must be non-negative: " + forceNewtons + ","
          + distanceMeters + "," + usdPerJoule);
    }
    if (cosineTheta < -1.0 || cosineTheta > 1.0) {
      throw new IllegalArgumentException("cosineTheta must be within [-1,1] but was " + cosineTheta);
    }
  }

  public double workPerMb() {
    return forceNewtons * distanceMeters * cosineTheta;
  }

  public static double megabytes(long bytes) {
    return bytes / BYTES_PER_MB;
  }

  public double costUsd(long bytes) {
    return megabytes(bytes) * workPerMb() * usdPerJoule;
  }
}
