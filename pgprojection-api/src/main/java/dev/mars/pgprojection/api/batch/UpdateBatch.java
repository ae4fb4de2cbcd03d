package dev.mars.pgprojection.api.batch;

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

import dev.mars.pgprojection.api.session.ChangeSet;
import dev.mars.pgprojection.api.session.CommitContext;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A batch of operations ready to be executed by a {@link BatchSession}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface UpdateBatch {

    /**
     * @return The non-empty pages in execution order
     */
    List<OperationPage> buildPages();

    ChangeSet getChangeSet();

    /** Runs the before-commit listeners inside the open transaction. */
    CompletableFuture<Void> preUpdate(CommitContext context);

    /** Runs the after-commit listeners once the transaction has committed. */
    CompletableFuture<Void> postUpdate(CommitContext context);
}
