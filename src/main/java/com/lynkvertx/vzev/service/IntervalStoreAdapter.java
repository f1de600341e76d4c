package com.lynkvertx.vzev.service;

import com.lynkvertx.vzev.model.Reading;

import java.time.Instant;
import java.util.List;

/**
 * Source of accepted interval readings.
 *
 * Implementations return the readings of one meter in [start, end), sorted by slot start
 * ascending and already restricted to the accepted quality flag. Any retry or backoff
 * belongs to the implementation; the engine treats a call as a plain synchronous fetch.
 */
public interface IntervalStoreAdapter {

    List<Reading> readings(String meterExternalId, Instant start, Instant end);
}
