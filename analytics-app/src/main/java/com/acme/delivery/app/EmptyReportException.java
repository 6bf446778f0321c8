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

/**
 * Raised when a report query completes without returning any row.
 */
public class EmptyReportException extends RuntimeException {

  public EmptyReportException() {
    super("No data returned from query");
  }
}
