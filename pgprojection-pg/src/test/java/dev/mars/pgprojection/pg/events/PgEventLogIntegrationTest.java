package dev.mars.pgprojection.pg.events;

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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.pgprojection.api.Event;
import dev.mars.pgprojection.api.SimpleEvent;
import dev.mars.pgprojection.api.StreamAction;
import dev.mars.pgprojection.api.StreamActionType;
import dev.mars.pgprojection.api.error.ConcurrencyException;
import dev.mars.pgprojection.api.log.SequenceMark;
import dev.mars.pgprojection.core.testing.AccountEvents.Deposited;
import dev.mars.pgprojection.core.testing.AccountEvents.Opened;
import dev.mars.pgprojection.pg.PgTestSupport;
import dev.mars.pgprojection.pg.util.JsonMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Map;

import static dev.mars.pgprojection.core.testing.AccountEvents.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
class PgEventLogIntegrationTest extends PgTestSupport {

    private PgEventLog eventLog;

    @BeforeEach
    void setUp() {
        eventLog = new PgEventLog(pool);
    }

    private StreamAction start(String stream, Object... payloads) {
        return StreamAction.start(stream, SimpleEvent.DEFAULT_TENANT, events(stream, payloads));
    }

    private static List<Event<?>> events(String stream, Object... payloads) {
        Event<?>[] events = new Event<?>[payloads.length];
        for (int i = 0; i < payloads.length; i++) {
            events[i] = event(stream, 0, 0, payloads[i]);
        }
        return List.of(events);
    }

    @Test
    void testAppendedEventsAreReadBackInSequenceOrder() throws Exception {
        await(eventLog.append(start("acct-1", new Opened("ann"), new Deposited(10))));
        await(eventLog.append(start("acct-2", new Opened("bob"))));

        List<Event<?>> events = await(eventLog.fetchEvents(0, 10));

        assertEquals(3, events.size());
        assertEquals(List.of(1L, 2L, 3L), events.stream().map(Event::getSequence).toList());
        assertEquals(List.of(1L, 2L, 1L), events.stream().map(Event::getVersion).toList());
        assertEquals("acct-1", events.get(0).getStreamKey());
        assertEquals(new Opened("ann"), events.get(0).getPayload());
        assertEquals(new Deposited(10), events.get(1).getPayload());
        assertEquals(SimpleEvent.DEFAULT_TENANT, events.get(2).getTenantId());
        assertEquals(3L, await(eventLog.highestAssigned()));
    }

    @Test
    void testFetchEventsHonoursRangeBounds() throws Exception {
        await(eventLog.append(start("acct-1", new Opened("ann"), new Deposited(1), new Deposited(2),
                new Deposited(3))));

        List<Event<?>> events = await(eventLog.fetchEvents(1, 3));

        assertEquals(List.of(2L, 3L), events.stream().map(Event::getSequence).toList());
    }

    @Test
    void testAppendWithoutExpectedVersionContinuesStream() throws Exception {
        await(eventLog.append(start("acct-1", new Opened("ann"), new Deposited(1))));
        await(eventLog.append(StreamAction.append("acct-1", SimpleEvent.DEFAULT_TENANT,
                events("acct-1", new Deposited(2), new Deposited(3)))));

        List<Event<?>> events = await(eventLog.fetchStream(pool, "acct-1", SimpleEvent.DEFAULT_TENANT)
                .toCompletionStage().toCompletableFuture());

        assertEquals(List.of(1L, 2L, 3L, 4L), events.stream().map(Event::getVersion).toList());
        assertEquals(4L, sql("SELECT version FROM pgp_streams WHERE id = 'acct-1'").iterator().next().getLong(0));
    }

    @Test
    void testStartingExistingStreamFailsAndWritesNothing() throws Exception {
        await(eventLog.append(start("acct-1", new Opened("ann"))));

        Throwable failure = awaitFailure(eventLog.append(start("acct-1", new Opened("again"), new Deposited(5))));

        assertInstanceOf(ConcurrencyException.class, failure);
        assertEquals(1, count("pgp_events"));
    }

    @Test
    void testExpectedVersionMismatchRaisesConcurrencyException() throws Exception {
        await(eventLog.append(start("acct-1", new Opened("ann"), new Deposited(1))));

        StreamAction stale = new StreamAction("acct-1", SimpleEvent.DEFAULT_TENANT, StreamActionType.APPEND,
                events("acct-1", new Deposited(2)), 1L);
        ConcurrencyException failure = (ConcurrencyException) awaitFailure(eventLog.append(stale));

        assertEquals(1L, failure.getExpectedVersion());
        assertEquals(2, count("pgp_events"));

        StreamAction current = new StreamAction("acct-1", SimpleEvent.DEFAULT_TENANT, StreamActionType.APPEND,
                events("acct-1", new Deposited(2)), 2L);
        await(eventLog.append(current));
        assertEquals(3, count("pgp_events"));
    }

    @Test
    void testStreamsAreSeparatedByTenant() throws Exception {
        await(eventLog.append(StreamAction.start("acct-1", "tenant-a", events("acct-1", new Opened("ann")))));
        await(eventLog.append(StreamAction.start("acct-1", "tenant-b", events("acct-1", new Opened("bob")))));

        List<Event<?>> events = await(eventLog.fetchEvents(0, 10));

        assertEquals(List.of("tenant-a", "tenant-b"), events.stream().map(Event::getTenantId).toList());
        assertEquals(List.of(1L, 1L), events.stream().map(Event::getVersion).toList());
    }

    @Test
    void testRegisteredAliasIsStoredAsType() throws Exception {
        PgEventLog aliased = new PgEventLog(pool, JsonMapping.createDefaultObjectMapper(),
                new EventTypeRegistry().register("account_opened", Opened.class), StreamIdentity.AS_STRING);

        await(aliased.append(start("acct-1", new Opened("ann"))));

        assertEquals("account_opened", sql("SELECT type FROM pgp_events").iterator().next().getString(0));
        Event<?> read = await(aliased.fetchEvents(0, 1)).get(0);
        assertEquals("account_opened", read.getEventType());
        assertEquals(new Opened("ann"), read.getPayload());
    }

    @Test
    void testUnknownEventTypeIsReadAsJson() throws Exception {
        sql("INSERT INTO pgp_events (seq_id, id, stream_id, version, type, data, tenant_id) "
                + "VALUES (nextval('pgp_events_sequence'), gen_random_uuid(), 'legacy', 1, "
                + "'com.example.RetiredEvent', '{\"note\":\"old\"}', '*DEFAULT*')");

        Event<?> read = await(eventLog.fetchEvents(0, 1)).get(0);

        assertInstanceOf(JsonNode.class, read.getPayload());
        assertEquals("old", ((JsonNode) read.getPayload()).get("note").asText());
    }

    @Test
    void testHeadersRoundTrip() throws Exception {
        Event<?> withHeaders = SimpleEvent.builder(new Opened("ann"))
            .streamKey("acct-1")
            .headers(Map.of("correlation-id", "c-1"))
            .build();
        await(eventLog.append(StreamAction.start("acct-1", SimpleEvent.DEFAULT_TENANT, List.of(withHeaders))));

        Event<?> read = await(eventLog.fetchEvents(0, 1)).get(0);

        assertEquals(Map.of("correlation-id", "c-1"), read.getHeaders());
        assertEquals(withHeaders.getEventId(), read.getEventId());
    }

    @Test
    void testSequenceMarksArePagedAndShowGaps() throws Exception {
        await(eventLog.append(start("acct-1", new Opened("ann"), new Deposited(1))));
        long reserved = await(eventLog.nextSequence());
        await(eventLog.append(start("acct-2", new Opened("bob"), new Deposited(2))));

        List<SequenceMark> firstPage = await(eventLog.fetchSequenceMarks(0, 10, 3));
        List<SequenceMark> all = await(eventLog.fetchSequenceMarks(0, 10, 10));

        assertEquals(3L, reserved);
        assertEquals(List.of(1L, 2L, 4L), firstPage.stream().map(SequenceMark::sequence).toList());
        assertEquals(List.of(1L, 2L, 4L, 5L), all.stream().map(SequenceMark::sequence).toList());
        assertTrue(all.stream().allMatch(mark -> mark.timestamp() != null));
    }

    @Test
    void testHighestAssignedOnEmptyLog() throws Exception {
        assertEquals(1L, await(eventLog.highestAssigned()));
        assertTrue(await(eventLog.fetchEvents(0, 10)).isEmpty());
    }
}
