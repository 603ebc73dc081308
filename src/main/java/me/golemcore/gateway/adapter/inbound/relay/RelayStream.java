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

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Observable state of one relay stream, owned by the request that opened it.
 */
public class RelayStream {

    private final String requestId;
    private final AtomicReference<RelayStreamState> state = new AtomicReference<>(RelayStreamState.AWAITING);
    private final AtomicInteger progressEvents = new AtomicInteger();

    public RelayStream(String requestId) {
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }

    public RelayStreamState getState() {
        return state.get();
    }

    public int getProgressEvents() {
        return progressEvents.get();
    }

    void onEvent(RelayEvent event) {
        if (event.isTerminal()) {
            state.set(RelayStreamState.TERMINATED);
            return;
        }
        progressEvents.incrementAndGet();
        state.compareAndSet(RelayStreamState.AWAITING, RelayStreamState.EMITTING_PROGRESS);
    }

    void onAbandoned() {
        state.set(RelayStreamState.TERMINATED);
    }
}
