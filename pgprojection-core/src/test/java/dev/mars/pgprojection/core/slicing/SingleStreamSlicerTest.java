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
import dev.mars.pgprojection.api.StreamActionType;
import dev.mars.pgprojection.core.testing.Account;
import dev.mars.pgprojection.core.testing.AccountEvents.Deposited;
import dev.mars.pgprojection.core.testing.AccountEvents.Opened;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static dev.mars.pgprojection.core.testing.AccountEvents.event;
import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class SingleStreamSlicerTest {

    record AccountId(String value) {}

    private final SingleStreamSlicer<Account, String> slicer = SingleStreamSlicer.byStreamIdentity();

    @Test
    void testGroupsByTenantAndStream() {
        List<Event<?>> events = List.of(
            event("a", 1, 1, new Opened("ann"), "t1"),
            event("b", 1, 2, new Opened("bob"), "t2"),
            event("a", 2, 3, new Deposited(10), "t1"),
            event("c", 4, 4, new Deposited(5), "t1"));

        List<TenantSliceGroup<Account, String>> groups = slicer.sliceAsyncEvents(null, events).join();

        assertEquals(2, groups.size());
        TenantSliceGroup<Account, String> t1 = groups.get(0);
        assertEquals("t1", t1.getTenantId());
        assertEquals(2, t1.size());
        assertEquals(2, t1.getSlice("a").count());
        assertEquals(StreamActionType.START, t1.getSlice("a").getActionType());
        assertEquals(StreamActionType.APPEND, t1.getSlice("c").getActionType());
        assertEquals("t2", groups.get(1).getTenantId());
    }

    @Test
    void testOrdersSliceByVersion() {
        List<Event<?>> events = List.of(
            event("a", 3, 7, new Deposited(3)),
            event("a", 1, 5, new Opened("ann")),
            event("a", 2, 6, new Deposited(2)));

        EventSlice<Account, String> slice = slicer.sliceAsyncEvents(null, events).join().get(0).getSlice("a");

        assertEquals(List.of(1L, 2L, 3L),
            slice.getEvents().stream().map(Event::getVersion).collect(Collectors.toList()));
        assertEquals(3, slice.getLastEvent().getVersion());
    }

    @Test
    void testEqualVersionsKeepRangeOrder() {
        Event<?> first = event("a", 2, 10, new Deposited(1));
        Event<?> second = event("a", 2, 11, new Deposited(2));

        EventSlice<Account, String> slice = slicer.sliceAsyncEvents(null, List.of(first, second)).join()
            .get(0).getSlice("a");

        assertSame(first, slice.getEvents().get(0));
        assertSame(second, slice.getEvents().get(1));
    }

    @Test
    void testInlineKeepsActionType() {
        List<StreamAction> streams = List.of(
            StreamAction.start("a", "t1", List.of(event("a", 1, 1, new Opened("ann")))),
            StreamAction.append("b", "t1", List.of(event("b", 5, 2, new Deposited(1)))));

        List<EventSlice<Account, String>> slices = slicer.sliceInlineActions(null, streams).join();

        assertEquals(2, slices.size());
        assertEquals(StreamActionType.START, slices.get(0).getActionType());
        assertEquals(StreamActionType.APPEND, slices.get(1).getActionType());
        assertEquals("t1", slices.get(1).getTenantId());
    }

    @Test
    void testStrongTypedIdentity() {
        SingleStreamSlicer<Account, AccountId> typed = new SingleStreamSlicer<>(raw -> new AccountId((String) raw));

        List<TenantSliceGroup<Account, AccountId>> groups =
            typed.sliceAsyncEvents(null, List.of(event("a", 1, 1, new Opened("ann")))).join();

        assertNotNull(groups.get(0).getSlice(new AccountId("a")));
        assertEquals(new AccountId("a"), typed.identityOf(event("a", 1, 1, new Opened("ann"))));
        assertTrue(typed.isSingleStream());
    }
}
