// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The BlueShare session pipeline. Devices discovered on a short-lived shared network each give consent, the
/// consent is combined into a consensus, a topology is chosen and then bandwidth, cost and settlement are worked out
/// before a compliance gate decides whether the session may operate.
///
/// The entry point is [com.github.blueshare.SessionOrchestrator]. Each stage is also usable on its own. Progress is
/// reported as [com.github.blueshare.SessionEvent] records to a [com.github.blueshare.SessionListener] and logged with
/// `java.util.logging` under the `com.github.blueshare` logger.
package com.github.blueshare;
