package dev.mars.pgprojection.core.testing;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

import dev.mars.pgprojection.api.Event;
import dev.mars.pgprojection.api.SimpleEvent;

import java.time.Instant;

/**
 * Event payloads and event factories for the account model.
 */
public final class AccountEvents {

    public record Opened(String owner) {}

    public record Deposited(long amount) {}

    public record Withdrawn(long amount) {}

    public record Closed() {}

    public record Transferred(String from, String to, long amount) {}

    public record Audited(String note) {}

    private AccountEvents() {
    }

    public static Event<?> event(String stream, long version, long sequence, Object payload) {
        return event(stream, version, sequence, payload, SimpleEvent.DEFAULT_TENANT);
    }

    public static Event<?> event(String stream, long version, long sequence, Object payload, String tenantId) {
        return SimpleEvent.builder(payload)
            .streamKey(stream)
            .version(version)
            .sequence(sequence)
            .tenantId(tenantId)
            .timestamp(Instant.parse("2025-07-15T10:00:00Z").plusSeconds(sequence))
            .build();
    }
}
