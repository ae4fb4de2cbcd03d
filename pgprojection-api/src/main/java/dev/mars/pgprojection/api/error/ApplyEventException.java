package dev.mars.pgprojection.api.error;

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

/**
 * Wraps a failure raised by projection fold logic with the event being applied.
 * Fatal to the slice it occurred in, not to the shard.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class ApplyEventException extends RuntimeException {

    private final transient Event<?> event;

    public ApplyEventException(Event<?> event, Throwable cause) {
        super(String.format("Failure to apply event #%d (%s) of stream %s version %d: %s",
                event.getSequence(), event.getEventType(), event.getStreamIdentity(),
                event.getVersion(), cause.getMessage()), cause);
        this.event = event;
    }

    public Event<?> getEvent() {
        return event;
    }

    public long getSequence() {
        return event.getSequence();
    }

    public Object getStreamIdentity() {
        return event.getStreamIdentity();
    }

    public String getEventType() {
        return event.getEventType();
    }
}
