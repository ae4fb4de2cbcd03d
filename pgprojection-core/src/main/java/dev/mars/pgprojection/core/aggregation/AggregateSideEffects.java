package dev.mars.pgprojection.core.aggregation;

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

import dev.mars.pgprojection.api.session.ProjectionSession;
import dev.mars.pgprojection.core.slicing.EventSlice;

/**
 * Raises events or publishes messages after a slice is folded.
 *
 * Only invoked while a shard runs continuously, never during a rebuild or inline.
 * Use {@link EventSlice#raiseEvent(Object)} and {@link EventSlice#publishMessage(Object)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
@FunctionalInterface
public interface AggregateSideEffects<TDoc, TId> {

    void raiseSideEffects(ProjectionSession session, EventSlice<TDoc, TId> slice);
}
