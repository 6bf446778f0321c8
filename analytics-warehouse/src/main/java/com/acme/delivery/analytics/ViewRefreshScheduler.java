/*
 * Copyright (C) 2026 ACME Delivery Services
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.acme.delivery.analytics;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debounces materialized view refreshes: at most one refresh per interval. The first call
 * after startup always refreshes.
 */
public final class ViewRefreshScheduler {

  private static final Logger LOG = LoggerFactory.getLogger(ViewRefreshScheduler.class);

  public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);

  private final AnalyticsStore store;
  private final List<String> views;
  private final Duration interval;
  private final Clock clock;

  private Instant lastRefresh;

  public ViewRefreshScheduler(AnalyticsStore store) {
    this(store, MaterializedViews.ALL, DEFAULT_INTERVAL, Clock.systemUTC());
  }

  public ViewRefreshScheduler(AnalyticsStore store, List<String> views, Duration interval, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.views = List.copyOf(views);
    this.interval = Objects.requireNonNull(interval, "interval");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (interval.isNegative()) {
      throw new IllegalArgumentException("interval must be >= 0");
    }
  }

  /**
   * Refreshes the views when none was refreshed yet or more than the interval has passed.
   * A failed refresh leaves the checkpoint untouched, so the next call tries again.
   *
   * @return whether a refresh ran
   */
  public synchronized boolean maybeRefresh() throws SQLException {
    Instant now = clock.instant();
    if (lastRefresh != null && Duration.between(lastRefresh, now).compareTo(interval) <= 0) {
      return false;
    }
    store.refreshViews(views);
    lastRefresh = now;
    LOG.info("Materialized views refreshed: {}", views);
    return true;
  }

  /**
   * Time of the last successful refresh, null before the first one.
   */
  public synchronized Instant lastRefresh() {
    return lastRefresh;
  }
}
