package dev.mars.pgprojection.core.batch;

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

import dev.mars.pgprojection.api.batch.OperationPage;
import dev.mars.pgprojection.api.session.ChangeSet;
import dev.mars.pgprojection.api.storage.StorageOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The operations of a batch's pages, flattened in execution order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class UnitOfWork implements ChangeSet {

    private final List<StorageOperation> operations;

    public UnitOfWork(List<OperationPage> pages) {
        List<StorageOperation> all = new ArrayList<>();
        for (OperationPage page : pages) {
            all.addAll(page.getOperations());
        }
        this.operations = Collections.unmodifiableList(all);
    }

    @Override
    public List<StorageOperation> getOperations() {
        return operations;
    }

    @Override
    public String toString() {
        return "UnitOfWork{operations=" + operations.size() + '}';
    }
}
