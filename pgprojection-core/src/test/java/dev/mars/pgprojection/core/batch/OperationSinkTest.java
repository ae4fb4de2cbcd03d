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

import dev.mars.pgprojection.api.storage.StorageOperation;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class OperationSinkTest {

    @Test
    void testCompletionDrainsEarlierPosts() {
        List<StorageOperation> received = new CopyOnWriteArrayList<>();
        StorageOperation first = Mockito.mock(StorageOperation.class);
        StorageOperation second = Mockito.mock(StorageOperation.class);

        try (OperationSink sink = new OperationSink("test", group -> received.addAll(group.getOperations()))) {
            sink.post(List.of(first));
            sink.post(List.of(second));
            sink.complete().join();

            assertEquals(List.of(first, second), received);
            assertTrue(sink.isCompleted());
        }
    }

    @Test
    void testPostAfterCompletionRejected() {
        try (OperationSink sink = new OperationSink("test", group -> { })) {
            sink.complete().join();

            assertThrows(IllegalStateException.class,
                () -> sink.post(List.of(Mockito.mock(StorageOperation.class))));
        }
    }

    @Test
    void testAcceptedActionRunsAfterOperations() {
        List<Object> seen = new CopyOnWriteArrayList<>();
        StorageOperation operation = Mockito.mock(StorageOperation.class);

        try (OperationSink sink = new OperationSink("test", group -> {
            seen.addAll(group.getOperations());
            group.accepted();
        })) {
            sink.post(new OperationSink.Group(List.of(operation), () -> seen.add("published")));
            sink.complete().join();
        }

        assertEquals(List.of(operation, "published"), seen);
    }

    @Test
    void testTargetFailureFailsCompletion() {
        List<StorageOperation> received = new CopyOnWriteArrayList<>();
        StorageOperation first = Mockito.mock(StorageOperation.class);
        StorageOperation second = Mockito.mock(StorageOperation.class);

        try (OperationSink sink = new OperationSink("test", group -> {
            if (group.getOperations().contains(first)) {
                throw new IllegalStateException("page rejected");
            }
            received.addAll(group.getOperations());
        })) {
            sink.post(List.of(first));
            sink.post(List.of(second));

            CompletionException error = assertThrows(CompletionException.class, () -> sink.complete().join());

            assertInstanceOf(IllegalStateException.class, error.getCause());
            assertEquals(List.of(second), received);
        }
    }

    @Test
    void testCompleteIsIdempotent() {
        OperationSink sink = new OperationSink("test", group -> { });

        assertSame(sink.complete(), sink.complete());
        sink.close();
        sink.close();
    }
}
