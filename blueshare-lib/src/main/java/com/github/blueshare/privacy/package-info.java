// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Phantom identities for devices that join a session. A device proves membership by answering a random challenge
/// with a hash over a derived identity so the network never learns the device identifier.
package com.github.blueshare.privacy;
