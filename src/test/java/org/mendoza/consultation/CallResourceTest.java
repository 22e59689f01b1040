package org.mendoza.consultation;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.*;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;

/**
 * Integration tests for the management and webhook endpoints, against the in-memory store
 * and the fake video provider.
 */
@QuarkusTest
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class CallResourceTest {

    private static final String APPOINTMENT = "5b0e9c3a-8f41-4d2e-b7a6-1c9d0e2f3a40";

    private static Integer callId;
    private static String meetingRef;

    @Test
    @Order(1)
    @DisplayName("Creating a call returns a scheduled session with a join link")
    void testCreateCall() {
        var response = given()
            .contentType(ContentType.JSON)
            .body("{\"appointmentId\": \"" + APPOINTMENT + "\", \"doctorId\": \"dr-ana\", \"patientId\": \"pt-luis\"}")
            .when().post("/calls")
            .then()
                .statusCode(200)
                .contentType("application/json")
                .body("status", is("scheduled"))
                .body("appointmentId", is(APPOINTMENT))
                .body("meetingRef", notNullValue())
                .body("callLink", containsString("/video-call/"))
                .body("durationMinutes", nullValue())
                .extract();

        callId = response.path("id");
        meetingRef = response.path("meetingRef");
    }

    @Test
    @Order(2)
    @DisplayName("Creating again for the same appointment returns the same call")
    void testCreateIsIdempotent() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"appointmentId\": \"" + APPOINTMENT + "\"}")
            .when().post("/calls")
            .then()
                .statusCode(200)
                .body("id", is(callId));
    }

    @Test
    @Order(3)
    @DisplayName("A participant-joined webhook starts the call")
    void testJoinWebhook() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"webhookType\": \"participant-joined\", \"data\": {\"meetingId\": \"" + meetingRef
                + "\", \"participantId\": \"p-1\", \"metaData\": {\"userId\": \"dr-ana\", \"role\": \"doctor\"}}}")
            .when().post("/webhooks/videosdk")
            .then()
                .statusCode(200)
                .body("status", is("accepted"));

        given()
            .when().get("/calls/" + callId)
            .then()
                .statusCode(200)
                .body("status", is("ongoing"))
                .body("startedAt", notNullValue())
                .body("activeParticipants", is(1))
                .body("participants.size()", is(1))
                .body("participants[0].role", is("doctor"));
    }

    @Test
    @Order(4)
    @DisplayName("Recording can be started and stopped on an ongoing call")
    void testRecordingToggle() {
        given()
            .when().post("/calls/" + callId + "/recording/start")
            .then()
                .statusCode(200)
                .body("changed", is(true))
                .body("isRecording", is(true));

        given()
            .when().post("/calls/" + callId + "/recording/stop")
            .then()
                .statusCode(200)
                .body("changed", is(true))
                .body("isRecording", is(false));

        given()
            .when().post("/calls/" + callId + "/recording/stop")
            .then()
                .statusCode(200)
                .body("changed", is(false));
    }

    @Test
    @Order(5)
    @DisplayName("Ending the call completes it and a second end changes nothing")
    void testEndCall() {
        given()
            .when().post("/calls/" + callId + "/end")
            .then()
                .statusCode(200)
                .body("changed", is(true))
                .body("status", is("completed"))
                .body("endedAt", notNullValue())
                .body("durationMinutes", notNullValue())
                .body("activeParticipants", is(0));

        given()
            .when().post("/calls/" + callId + "/end")
            .then()
                .statusCode(200)
                .body("changed", is(false))
                .body("status", is("completed"));
    }

    @Test
    @Order(6)
    @DisplayName("Webhooks for ended or unknown rooms are discarded, unknown types ignored")
    void testDiscardedWebhooks() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"webhookType\": \"participant-left\", \"data\": {\"meetingId\": \"" + meetingRef
                + "\", \"participantId\": \"dr-ana\"}}")
            .when().post("/webhooks/videosdk")
            .then()
                .statusCode(200)
                .body("status", is("discarded"));

        given()
            .contentType(ContentType.JSON)
            .body("{\"webhookType\": \"participant-joined\", \"data\": {\"meetingId\": \"room-nobody\", \"participantId\": \"x\"}}")
            .when().post("/webhooks/videosdk")
            .then()
                .statusCode(200)
                .body("status", is("discarded"));

        given()
            .contentType(ContentType.JSON)
            .body("{\"webhookType\": \"session-started\", \"data\": {\"meetingId\": \"" + meetingRef + "\"}}")
            .when().post("/webhooks/videosdk")
            .then()
                .statusCode(200)
                .body("status", is("ignored"));
    }

    @Test
    @Order(7)
    @DisplayName("Listing and stats include the created call")
    void testListAndStats() {
        given()
            .queryParam("limit", 10)
            .when().get("/calls")
            .then()
                .statusCode(200)
                .body("count", greaterThanOrEqualTo(1))
                .body("calls.id", hasItem(callId));

        given()
            .when().get("/calls/stats")
            .then()
                .statusCode(200)
                .body("completed", greaterThanOrEqualTo(1))
                .body("total", greaterThanOrEqualTo(1));
    }

    @Test
    @Order(8)
    @DisplayName("Bad requests are rejected with 400")
    void testBadRequests() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"doctorId\": \"dr-ana\"}")
            .when().post("/calls")
            .then()
                .statusCode(400)
                .body("status", is("error"))
                .body("message", containsString("appointmentId"));

        given()
            .contentType(ContentType.JSON)
            .body("not json")
            .when().post("/calls")
            .then()
                .statusCode(400);

        given()
            .contentType(ContentType.JSON)
            .body("{\"webhookType\": \"participant-joined\", \"data\": {}}")
            .when().post("/webhooks/videosdk")
            .then()
                .statusCode(400)
                .body("status", is("error"));
        given()
            .contentType(ContentType.JSON)
            .body("{\"appointmentId\": 9001}")
            .when().post("/calls")
            .then()
                .statusCode(400)
                .body("message", containsString("appointmentId"));

        given()
            .contentType(ContentType.JSON)
            .body("{\"appointmentId\": \"" + APPOINTMENT + "\", \"enableRecording\": \"yes\"}")
            .when().post("/calls")
            .then()
                .statusCode(400)
                .body("message", containsString("enableRecording"));

        given()
            .contentType(ContentType.JSON)
            .body("{\"webhookType\": \"participant-joined\", \"data\": \"room-1\"}")
            .when().post("/webhooks/videosdk")
            .then()
                .statusCode(400)
                .body("status", is("error"));
    }

    @Test
    @Order(9)
    @DisplayName("Unknown calls return 404")
    void testUnknownCall() {
        given()
            .when().get("/calls/987654")
            .then()
                .statusCode(404)
                .body("status", is("error"));

        given()
            .when().post("/calls/987654/end")
            .then()
                .statusCode(404);
    }

    @Test
    @Order(10)
    @DisplayName("Sync stats endpoint reports bridge and session counters")
    void testSyncStats() {
        given()
            .when().get("/sync/stats")
            .then()
                .statusCode(200)
                .body("sync.enabled", is(true))
                .body("sync.malformed", notNullValue())
                .body("sessions.cachedSessions", notNullValue())
                .body("sessions.pendingFinalizations", is(0));
    }
}
