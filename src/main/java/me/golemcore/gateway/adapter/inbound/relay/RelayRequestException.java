/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.gateway.adapter.inbound.relay;

/**
 * Malformed or incomplete relay request. The message is returned to the caller
 * verbatim.
 */
public class RelayRequestException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RelayRequestException(String message) {
        super(message);
    }

    public RelayRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
