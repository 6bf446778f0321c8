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

import com.acme.delivery.replication.core.ReplicationStream;
import com.acme.delivery.replication.core.ReplicationSubscription;
import java.util.Objects;
import org.slf4j.Logger;

public final class ReplicationLogging {

  private ReplicationLogging() {
  }

  /**
   * Logs every lifecycle transition of {@code stream}: INFO for normal transitions, WARN when
   * a cause is attached and ERROR when the stream fails for good.
   */
  public static ReplicationSubscription attachDefaultLogging(ReplicationStream<?> stream,
                                                             Logger logger,
                                                             String streamName) {
    Objects.requireNonNull(stream, "stream");
    Objects.requireNonNull(logger, "logger");
    String name = streamName == null || streamName.isBlank() ? "cdc" : streamName;

    return stream.onStateChange(change -> {
      if (change.isFatal()) {
        logger.error("stream={} {}", name, change);
      } else if (change.cause() != null) {
        logger.warn("stream={} {}", name, change);
      } else {
        logger.info("stream={} {}", name, change);
      }
    });
  }
}
