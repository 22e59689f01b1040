package org.mendoza.consultation.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChangeFeedEventTest {

    @Test
    @DisplayName("Parses a trigger payload")
    void testParse() {
        ChangeFeedEvent event = ChangeFeedEvent.parse(
            "{\"table\":\"video_calls\",\"operation\":\"update\",\"row\":{\"id\":12,\"status\":\"ongoing\"}}");

        assertEquals(FeedTable.VIDEO_CALLS, event.table);
        assertEquals(FeedOperation.UPDATE, event.operation);
        assertEquals(12L, event.callId());
        assertNull(event.appointmentId());
        assertEquals("ongoing", event.row.getString("status"));
    }

    @Test
    @DisplayName("Participant changes coalesce per call, other tables per row")
    void testCoalescingKey() {
        ChangeFeedEvent first = ChangeFeedEvent.parse(
            "{\"table\":\"video_call_participants\",\"operation\":\"INSERT\",\"row\":{\"id\":1,\"video_call_id\":7}}");
        ChangeFeedEvent second = ChangeFeedEvent.parse(
            "{\"table\":\"video_call_participants\",\"operation\":\"UPDATE\",\"row\":{\"id\":2,\"video_call_id\":7}}");
        ChangeFeedEvent call = ChangeFeedEvent.parse(
            "{\"table\":\"video_calls\",\"operation\":\"UPDATE\",\"row\":{\"id\":7}}");

        assertEquals(first.coalescingKey(), second.coalescingKey());
        assertNotEquals(first.coalescingKey(), call.coalescingKey());
    }

    @Test
    @DisplayName("Appointment ids are UUID text and key their own coalescing slot")
    void testAppointmentUuid() {
        ChangeFeedEvent event = ChangeFeedEvent.parse("{\"table\":\"appointments\",\"operation\":\"UPDATE\","
            + "\"row\":{\"id\":\"3f1c2a9e-5b7d-4e21-9a0c-7d2e4b6f8a10\",\"status\":\"cancelled\"}}");

        assertEquals("3f1c2a9e-5b7d-4e21-9a0c-7d2e4b6f8a10", event.appointmentId());
        assertNull(event.callId());
        assertEquals("appointments:3f1c2a9e-5b7d-4e21-9a0c-7d2e4b6f8a10", event.coalescingKey());
    }

    @Test
    @DisplayName("Participant rows resolve to their call")
    void testParticipantCallId() {
        ChangeFeedEvent event = ChangeFeedEvent.parse(
            "{\"table\":\"video_call_participants\",\"operation\":\"DELETE\",\"row\":{\"id\":3,\"video_call_id\":7}}");

        assertEquals(7L, event.callId());
    }

    @Test
    @DisplayName("Unwatched tables yield null")
    void testUnknownTable() {
        assertNull(ChangeFeedEvent.parse("{\"table\":\"invoices\",\"operation\":\"INSERT\",\"row\":{\"id\":1}}"));
    }

    @Test
    @DisplayName("Missing row becomes an empty object")
    void testMissingRow() {
        ChangeFeedEvent event = ChangeFeedEvent.parse("{\"table\":\"appointments\",\"operation\":\"DELETE\"}");

        assertNotNull(event.row);
        assertNull(event.appointmentId());
        assertNull(event.callId());
    }

    @Test
    @DisplayName("Garbage payloads are rejected")
    void testMalformed() {
        assertThrows(IllegalArgumentException.class, () -> ChangeFeedEvent.parse(null));
        assertThrows(IllegalArgumentException.class, () -> ChangeFeedEvent.parse("  "));
        assertThrows(IllegalArgumentException.class, () -> ChangeFeedEvent.parse("{oops"));
        assertThrows(IllegalArgumentException.class,
            () -> ChangeFeedEvent.parse("{\"table\":\"video_calls\",\"row\":{\"id\":1}}"));
        assertThrows(IllegalArgumentException.class,
            () -> ChangeFeedEvent.parse("{\"table\":\"video_calls\",\"operation\":\"MERGE\",\"row\":{\"id\":1}}"));
    }

    @Test
    @DisplayName("Fields of the wrong JSON type are rejected like any other bad payload")
    void testWrongTypes() {
        assertThrows(IllegalArgumentException.class,
            () -> ChangeFeedEvent.parse("{\"table\":\"video_calls\",\"operation\":\"UPDATE\",\"row\":{\"id\":\"3f1c2a9e\"}}"));
        assertThrows(IllegalArgumentException.class,
            () -> ChangeFeedEvent.parse("{\"table\":\"video_call_participants\",\"operation\":\"UPDATE\",\"row\":{\"video_call_id\":1.5}}"));
        assertThrows(IllegalArgumentException.class,
            () -> ChangeFeedEvent.parse("{\"table\":\"appointments\",\"operation\":\"UPDATE\",\"row\":{\"id\":true}}"));
        assertThrows(IllegalArgumentException.class,
            () -> ChangeFeedEvent.parse("{\"table\":\"appointments\",\"operation\":\"UPDATE\",\"row\":{\"id\":\"a\",\"status\":3}}"));
        assertThrows(IllegalArgumentException.class,
            () -> ChangeFeedEvent.parse("{\"table\":\"video_calls\",\"operation\":\"UPDATE\",\"row\":[1]}"));
    }
}
