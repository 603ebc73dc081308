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
 * Lifecycle of a single relay stream.
 */
public enum RelayStreamState {

    /** Waiting for the first delivery. */
    AWAITING,

    /** At least one progress event written; waiting for the next delivery. */
    EMITTING_PROGRESS,

    /**
     * Terminal event written, or the caller went away. Nothing more is read from
     * the delivery channel.
     */
    TERMINATED
}
