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

import dev.mars.pgprojection.api.Event;

/**
 * What an aggregate can do with one event type: create itself, apply the event, or be deleted by it.
 *
 * Handlers are resolved per payload type when the projection is built; folding never
 * discovers methods at runtime.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface AggregateHandler<TDoc> {

    /**
     * @return Whether {@link #create(Event)} can build a new aggregate from this event
     */
    boolean canCreate();

    boolean canApply();

    TDoc create(Event<?> event);

    /**
     * Applies the event, returning the aggregate to continue with. Handlers that mutate in
     * place return the same instance.
     */
    TDoc apply(TDoc aggregate, Event<?> event);

    boolean shouldDelete(TDoc aggregate, Event<?> event);
}
