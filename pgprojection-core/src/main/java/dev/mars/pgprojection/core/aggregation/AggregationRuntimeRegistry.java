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

import dev.mars.pgprojection.api.StreamAction;
import dev.mars.pgprojection.api.projection.ProjectionLifecycle;
import dev.mars.pgprojection.api.session.ProjectionSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Aggregation runtimes keyed by document type.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class AggregationRuntimeRegistry {
    private static final Logger logger = LoggerFactory.getLogger(AggregationRuntimeRegistry.class);

    private final Map<Class<?>, AggregationRuntime<?, ?>> runtimes = new LinkedHashMap<>();

    public synchronized void register(AggregationRuntime<?, ?> runtime) {
        Class<?> documentType = runtime.getProjection().getDocumentType();
        if (runtimes.putIfAbsent(documentType, runtime) != null) {
            throw new IllegalArgumentException("An aggregation runtime for " + documentType.getName()
                    + " is already registered");
        }
        logger.info("Registered {} aggregation runtime for {}", runtime.getProjection().getLifecycle(),
                documentType.getName());
    }

    @SuppressWarnings("unchecked")
    public synchronized <TDoc, TId> AggregationRuntime<TDoc, TId> runtimeFor(Class<TDoc> documentType) {
        AggregationRuntime<?, ?> runtime = runtimes.get(documentType);
        if (runtime == null) {
            throw new IllegalArgumentException("No known aggregation runtime for document type "
                    + documentType.getName());
        }
        return (AggregationRuntime<TDoc, TId>) runtime;
    }

    public synchronized Collection<AggregationRuntime<?, ?>> getRuntimes() {
        return Collections.unmodifiableList(new ArrayList<>(runtimes.values()));
    }

    public synchronized List<AggregationRuntime<?, ?>> getRuntimes(ProjectionLifecycle lifecycle) {
        List<AggregationRuntime<?, ?>> matching = new ArrayList<>();
        for (AggregationRuntime<?, ?> runtime : runtimes.values()) {
            if (runtime.getProjection().getLifecycle() == lifecycle) {
                matching.add(runtime);
            }
        }
        return matching;
    }

    /**
     * Applies every inline projection, one after the other, to the streams of a unit of work.
     */
    public CompletableFuture<Void> applyInlineProjections(ProjectionSession session, List<StreamAction> streams) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (AggregationRuntime<?, ?> runtime : getRuntimes(ProjectionLifecycle.INLINE)) {
            chain = chain.thenCompose(v -> runtime.applyInline(session, streams));
        }
        return chain;
    }
}
