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
import dev.mars.pgprojection.api.error.ProjectionConfigurationException;
import dev.mars.pgprojection.core.testing.Account;
import dev.mars.pgprojection.core.testing.AccountEvents.Audited;
import dev.mars.pgprojection.core.testing.AccountEvents.Deposited;
import dev.mars.pgprojection.core.testing.AccountEvents.Opened;
import dev.mars.pgprojection.core.testing.AccountEvents.Transferred;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static dev.mars.pgprojection.core.testing.AccountEvents.event;
import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class MultiStreamSlicerTest {

    private MultiStreamSlicer<Account, String> slicer;

    @BeforeEach
    void setUp() {
        slicer = new MultiStreamSlicer<Account, String>()
            .identityFromEvent(Opened.class, Event::getStreamKey)
            .identities(Transferred.class, e -> List.of(e.from(), e.to()));
    }

    @Test
    void testFansOutToEveryIdentity() {
        List<Event<?>> events = List.of(
            event("a", 1, 1, new Opened("ann")),
            event("b", 1, 2, new Opened("bob")),
            event("x", 1, 3, new Transferred("a", "b", 10)));

        TenantSliceGroup<Account, String> group = slicer.sliceAsyncEvents(null, events).join().get(0);

        assertEquals(2, group.size());
        assertEquals(2, group.getSlice("a").count());
        assertEquals(2, group.getSlice("b").count());
        assertSame(events.get(2), group.getSlice("a").getLastEvent());
        assertSame(events.get(2), group.getSlice("b").getLastEvent());
    }

    @Test
    void testOrdersBySequence() {
        List<Event<?>> events = List.of(
            event("x", 1, 9, new Transferred("a", "b", 10)),
            event("a", 1, 4, new Opened("ann")));

        EventSlice<Account, String> slice = slicer.sliceAsyncEvents(null, events).join().get(0).getSlice("a");

        assertEquals(List.of(4L, 9L),
            slice.getEvents().stream().map(Event::getSequence).collect(Collectors.toList()));
    }

    @Test
    void testEventRoutedOnceToRepeatedIdentity() {
        List<Event<?>> events = List.of(event("x", 1, 1, new Transferred("a", "a", 10)));

        TenantSliceGroup<Account, String> group = slicer.sliceAsyncEvents(null, events).join().get(0);

        assertEquals(1, group.getSlice("a").count());
    }

    @Test
    void testSkipsEventsWithoutRule() {
        List<Event<?>> events = List.of(
            event("a", 1, 1, new Audited("check")),
            event("a", 2, 2, new Opened("ann")));

        TenantSliceGroup<Account, String> group = slicer.sliceAsyncEvents(null, events).join().get(0);

        assertEquals(1, group.getSlice("a").count());
        assertFalse(slicer.isSingleStream());
    }

    @Test
    void testRuleMatchesSubtypes() {
        MultiStreamSlicer<Account, String> bySupertype = new MultiStreamSlicer<Account, String>()
            .identityFromEvent(Record.class, Event::getStreamKey);

        TenantSliceGroup<Account, String> group = bySupertype
            .sliceAsyncEvents(null, List.of(event("a", 1, 1, new Deposited(1)))).join().get(0);

        assertEquals(1, group.getSlice("a").count());
    }

    @Test
    void testInlineSlicesAcrossStreams() {
        List<StreamAction> streams = List.of(
            StreamAction.start("a", "t1", List.of(event("a", 1, 1, new Opened("ann"), "t1"))),
            StreamAction.append("x", "t1", List.of(event("x", 3, 2, new Transferred("a", "c", 1), "t1"))));

        List<EventSlice<Account, String>> slices = slicer.sliceInlineActions(null, streams).join();

        assertEquals(2, slices.size());
        assertEquals(Set.of("a", "c"), slices.stream().map(EventSlice::getId).collect(Collectors.toSet()));
    }

    @Test
    void testValidateListsMissingTypes() {
        ProjectionConfigurationException error = assertThrows(ProjectionConfigurationException.class,
            () -> slicer.validate(List.of(Opened.class, Deposited.class, Audited.class)));

        assertTrue(error.getMessage().contains(Deposited.class.getName()));
        assertTrue(error.getMessage().contains(Audited.class.getName()));
        assertFalse(error.getMessage().contains(Opened.class.getName()));
    }

    @Test
    void testDuplicateRuleRejected() {
        assertThrows(ProjectionConfigurationException.class,
            () -> slicer.identity(Opened.class, Opened::owner));
        assertEquals(Set.of(Opened.class, Transferred.class), slicer.getRegisteredEventTypes());
    }
}
