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

import dev.mars.pgprojection.api.storage.StorageOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered group of operations executed as a single database round trip.
 *
 * Pages are filled by exactly one thread, the batch's order-preserving sink.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class OperationPage {

    private final int index;
    private final int capacity;
    private final List<StorageOperation> operations;

    public OperationPage(int index, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Page capacity must be positive: " + capacity);
        }
        this.index = index;
        this.capacity = capacity;
        this.operations = new ArrayList<>(Math.min(capacity, 64));
    }

    public void append(StorageOperation operation) {
        if (isFull()) {
            throw new IllegalStateException("Page " + index + " is full (" + capacity + ")");
        }
        operations.add(operation);
    }

    public int getIndex() {
        return index;
    }

    public int getCapacity() {
        return capacity;
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public boolean isFull() {
        return operations.size() >= capacity;
    }

    public List<StorageOperation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    @Override
    public String toString() {
        return "OperationPage{index=" + index + ", size=" + operations.size() + "/" + capacity + '}';
    }
}
