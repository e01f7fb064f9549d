package com.deepansh.learnermemory.memory.store;

import com.deepansh.learnermemory.memory.MemoryState;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Target of a conditional (layer, status) transition.
 *
 * @param confirmedOn new lastConfirmed, or null to leave it alone
 * @param clearExpiry remove expiresAt (leaving the ephemeral tier)
 */
public record StateChange(MemoryState target, Instant at, LocalDate confirmedOn, boolean clearExpiry) {}
