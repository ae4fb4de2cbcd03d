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

/**
 * Another writer holds the lock on a stream that was fetched for writing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class StreamLockedException extends RuntimeException {

    private final Object streamId;

    public StreamLockedException(Object streamId, Throwable cause) {
        super("Stream '" + streamId + "' may be locked for updates", cause);
        this.streamId = streamId;
    }

    public Object getStreamId() {
        return streamId;
    }
}
