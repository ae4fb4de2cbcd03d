package dev.mars.pgprojection.pg.storage;

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
 * An aggregate fetched for writing together with the stream version it was built from.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class WritableAggregate<TDoc> {

    private final Object streamId;
    private final TDoc aggregate;
    private final long currentVersion;

    public WritableAggregate(Object streamId, TDoc aggregate, long currentVersion) {
        this.streamId = streamId;
        this.aggregate = aggregate;
        this.currentVersion = currentVersion;
    }

    public Object getStreamId() {
        return streamId;
    }

    /**
     * @return The aggregate, or null when the stream has no aggregate yet
     */
    public TDoc getAggregate() {
        return aggregate;
    }

    public long getCurrentVersion() {
        return currentVersion;
    }

    public boolean isNew() {
        return currentVersion == 0;
    }

    @Override
    public String toString() {
        return "WritableAggregate{" + streamId + " at version " + currentVersion + ", " + aggregate + '}';
    }
}
