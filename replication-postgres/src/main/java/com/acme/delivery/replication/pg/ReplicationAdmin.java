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

import java.sql.SQLException;
import java.util.Optional;

/**
 * Server-side replication metadata and maintenance on the source database.
 */
public interface ReplicationAdmin {

  String walLevel() throws SQLException;

  boolean publicationExists(String publication) throws SQLException;

  Optional<SlotInfo> findSlot(String slotName) throws SQLException;

  /**
   * @return whether the server accepted the termination request
   */
  boolean terminateBackend(int pid) throws SQLException;

  void dropSlot(String slotName) throws SQLException;

  /**
   * Creates a logical slot. An already existing slot is not an error.
   */
  void createSlot(String slotName, String plugin) throws SQLException;

  final class SlotInfo {
    private final String slotName;
    private final Integer activePid;
    private final String plugin;

    public SlotInfo(String slotName, Integer activePid, String plugin) {
      this.slotName = slotName;
      this.activePid = activePid;
      this.plugin = plugin;
    }

    public String slotName() {
      return slotName;
    }

    /**
     * Backend holding the slot, or null when nobody streams from it.
     */
    public Integer activePid() {
      return activePid;
    }

    public String plugin() {
      return plugin;
    }

    public boolean isActive() {
      return activePid != null;
    }
  }
}
