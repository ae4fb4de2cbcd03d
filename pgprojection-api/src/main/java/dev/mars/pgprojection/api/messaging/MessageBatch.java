package dev.mars.pgprojection.api.messaging;

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

import dev.mars.pgprojection.api.session.CommitListener;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound messages published by projection side effects, delivered with the batch commit.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface MessageBatch extends CommitListener {

    default CompletableFuture<Void> publish(Object message) {
        return publish(message, Map.of());
    }

    CompletableFuture<Void> publish(Object message, Map<String, String> headers);

    int getPendingCount();
}
