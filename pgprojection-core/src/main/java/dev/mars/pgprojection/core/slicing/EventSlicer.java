package dev.mars.pgprojection.core.slicing;

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
import dev.mars.pgprojection.api.StreamAction;
import dev.mars.pgprojection.api.session.ProjectionSession;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Groups a flat, range-ordered list of events into per-identity slices.
 *
 * Slicing is a pure transformation: it never loads aggregate state.
 *
 * @param <TDoc> The aggregate document type
 * @param <TId> The identity type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface EventSlicer<TDoc, TId> {

    CompletableFuture<List<TenantSliceGroup<TDoc, TId>>> sliceAsyncEvents(ProjectionSession session,
                                                                          List<Event<?>> events);

    /**
     * Slices the streams appended by the current unit of work.
     */
    CompletableFuture<List<EventSlice<TDoc, TId>>> sliceInlineActions(ProjectionSession session,
                                                                      List<StreamAction> streams);

    /**
     * Whether identity is the stream itself, which enables versioning and new-stream shortcuts.
     */
    boolean isSingleStream();
}
