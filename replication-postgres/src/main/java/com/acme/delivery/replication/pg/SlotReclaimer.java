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

package com.acme.delivery.replication.pg;

import com.acme.delivery.replication.core.RetryPolicy;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forcibly frees a replication slot: terminates the backend holding it, then drops it.
 *
 * <p>Each step is retried under the configured policy when it raises, and the last failure
 * of a step propagates. Termination always precedes the drop. A missing slot is left alone.
 */
public final class SlotReclaimer {

  private static final Logger LOG = LoggerFactory.getLogger(SlotReclaimer.class);

  @FunctionalInterface
  private interface Step {
    void run() throws SQLException;
  }

  private final ReplicationAdmin admin;
  private final RetryPolicy retryPolicy;

  public SlotReclaimer(ReplicationAdmin admin) {
    this(admin, defaultRetryPolicy());
  }

  public SlotReclaimer(ReplicationAdmin admin, RetryPolicy retryPolicy) {
    this.admin = Objects.requireNonNull(admin, "admin");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy").copy();
    this.retryPolicy.validate();
  }

  public static RetryPolicy defaultRetryPolicy() {
    return RetryPolicy.fixedDelay(Duration.ofSeconds(1), 3);
  }

  public void reclaim(String slotName) throws SQLException {
    Optional<ReplicationAdmin.SlotInfo> slot = admin.findSlot(slotName);
    if (slot.isEmpty()) {
      LOG.debug("Replication slot '{}' does not exist, nothing to reclaim", slotName);
      return;
    }

    Integer activePid = slot.get().activePid();
    if (activePid != null) {
      LOG.info("Terminating backend {} holding replication slot '{}'", activePid, slotName);
      withRetry("terminate backend " + activePid, () -> {
        // false means the backend had already exited
        if (!admin.terminateBackend(activePid)) {
          LOG.info("Backend {} was already gone", activePid);
        }
      });
      // the server needs a moment to release the slot after the backend exits
      retryPolicy.pause();
    }

    withRetry("drop slot '" + slotName + "'", () -> admin.dropSlot(slotName));
    LOG.info("Dropped replication slot '{}'", slotName);
  }

  private void withRetry(String description, Step step) throws SQLException {
    long attempt = 1;
    while (true) {
      try {
        step.run();
        return;
      } catch (SQLException e) {
        if (!retryPolicy.shouldRetry(e, attempt)) {
          LOG.error("Failed to {} after {} attempt(s): {}", description, attempt, e.getMessage());
          throw e;
        }
        LOG.warn("Failed to {} (attempt {}), retrying: {}", description, attempt, e.getMessage());
        retryPolicy.pause();
        attempt++;
      }
    }
  }
}
