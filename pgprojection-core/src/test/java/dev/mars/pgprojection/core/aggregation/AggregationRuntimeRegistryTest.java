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
import dev.mars.pgprojection.core.config.DaemonSettings;
import dev.mars.pgprojection.core.testing.Account;
import dev.mars.pgprojection.core.testing.AccountEvents.Opened;
import dev.mars.pgprojection.core.testing.InMemoryDocumentStorage;
import dev.mars.pgprojection.core.testing.RecordingProjectionSession;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.mars.pgprojection.core.testing.AccountEvents.event;
import static dev.mars.pgprojection.core.testing.AccountProjections.accounts;
import static dev.mars.pgprojection.core.testing.AccountProjections.storage;
import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class AggregationRuntimeRegistryTest {

    static class Summary {
        private int opened;
    }

    @Test
    void testRegistersByDocumentType() {
        AggregationRuntimeRegistry registry = new AggregationRuntimeRegistry();
        AggregationRuntime<Account, String> runtime =
            new AggregationRuntime<>(accounts().build(), storage(), DaemonSettings.defaults());

        registry.register(runtime);

        assertSame(runtime, registry.<Account, String>runtimeFor(Account.class));
        assertThrows(IllegalArgumentException.class, () -> registry.register(runtime));
        assertThrows(IllegalArgumentException.class, () -> registry.runtimeFor(String.class));
    }

    @Test
    void testAppliesOnlyInlineProjections() {
        AggregationRuntimeRegistry registry = new AggregationRuntimeRegistry();
        InMemoryDocumentStorage<Account, String> accounts = storage();
        InMemoryDocumentStorage<Summary, String> summaries =
            new InMemoryDocumentStorage<>(Summary.class, summary -> "all", (summary, id) -> summary);
        registry.register(new AggregationRuntime<>(accounts().lifecycle(ProjectionLifecycle.INLINE).build(),
            accounts, DaemonSettings.defaults()));
        registry.register(new AggregationRuntime<>(AggregateProjection.builder(Summary.class, String.class)
            .applyInPlace(Opened.class, (summary, e) -> summary.opened++)
            .build(), summaries, DaemonSettings.defaults()));
        RecordingProjectionSession session = new RecordingProjectionSession(null, null);

        registry.applyInlineProjections(session, List.of(
            StreamAction.start("a", "*DEFAULT*", List.of(event("a", 1, 1, new Opened("ann")))))).join();

        assertEquals(1, session.getOperations().size());
        assertEquals(Account.class, session.getOperations().get(0).getDocumentType());
        assertEquals(1, registry.getRuntimes(ProjectionLifecycle.INLINE).size());
        assertEquals(2, registry.getRuntimes().size());
    }
}
