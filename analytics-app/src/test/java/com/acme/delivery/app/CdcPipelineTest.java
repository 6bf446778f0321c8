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

package com.acme.delivery.app;

import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CdcPipelineTest {

  @Test
  void refusesToStartWithInvalidConfiguration() {
    ReplicationAppConfig config = ReplicationAppConfig.fromMap(Map.of("CDC_SLOT_NAME", "Bad-Slot"));

    assertThrows(IllegalArgumentException.class, () -> CdcPipeline.run(config));
  }
}
