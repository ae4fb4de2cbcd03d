package dev.mars.pgprojection.api.session;

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

import java.util.concurrent.CompletableFuture;

/**
 * Hook invoked once per executed batch, before and after the transaction commits.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface CommitListener {

    default CompletableFuture<Void> beforeCommit(CommitContext context, ChangeSet changes) {
        return CompletableFuture.completedFuture(null);
    }

    default CompletableFuture<Void> afterCommit(CommitContext context, ChangeSet changes) {
        return CompletableFuture.completedFuture(null);
    }
}
