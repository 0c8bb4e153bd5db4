package com.starscape.phototriage.integration;

import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.server.LocalServerPort;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Integration tests for the triage flow.
 * Tests: register photos → import hashes → run pipeline → verify decisions, groups and provenance
 */
public class TriageFlowIntegrationTest extends BaseIntegrationTest {
    
    @LocalServerPort
    private int port;
    
    @BeforeEach
    void setUp() {
        RestAssured.port = port;
        RestAssured.baseURI = "http://localhost";
    }
    
    private static String checksum(String name) {
        return DigestUtils.sha256Hex(name);
    }
    
    private static Map<String, Object> photo(String id, int width, int height, long bytes, String path) {
        Map<String, Object> photo = new HashMap<>();
        photo.put("photoId", id);
        photo.put("mimeType", "image/jpeg");
        photo.put("bytes", bytes);
        photo.put("width", width);
        photo.put("height", height);
        photo.put("hasExif", false);
        photo.put("sourcePaths", List.of(path));
        return photo;
    }
    
    private String startRun(Map<String, Object> request) {
        String runId = given()
                .contentType(ContentType.JSON)
                .body(request)
                .post("/commands/pipeline/runs")
                .then()
                .statusCode(202)
                .body("status", equalTo("RUNNING"))
                .extract()
                .path("runId");
        
        await().atMost(Duration.ofSeconds(30))
                .pollInterval(Duration.ofMillis(250))
                .untilAsserted(() -> given()
                        .get("/queries/pipeline/runs/" + runId)
                        .then()
                        .statusCode(200)
                        .body("status", equalTo("COMPLETED")));
        return runId;
    }
    
    @Test
    void shouldTriageRegisteredPhotos() {
        String icon = checksum("icon");
        String master = checksum("master");
        String preview = checksum("preview");
        String copy = checksum("copy");
        
        // 1. Register photos
        Map<String, Object> registerRequest = Map.of("photos", List.of(
            photo(icon, 50, 80, 2_000L, "/Users/me/Pictures/icon.png"),
            photo(master, 3000, 3000, 4_000_000L, "/Users/me/Pictures/beach.jpg"),
            photo(preview, 300, 300, 60_000L, "/Users/me/Library/Previews/beach.jpg"),
            photo(copy, 3000, 3000, 3_900_000L, "/Volumes/Backup/beach copy.jpg")
        ));
        
        given()
                .contentType(ContentType.JSON)
                .body(registerRequest)
                .post("/commands/photos")
                .then()
                .statusCode(200)
                .body("created", equalTo(4))
                .body("pathsAdded", equalTo(4));
        
        // Registering again adds nothing
        given()
                .contentType(ContentType.JSON)
                .body(registerRequest)
                .post("/commands/photos")
                .then()
                .statusCode(200)
                .body("created", equalTo(0))
                .body("existing", equalTo(4))
                .body("pathsAdded", equalTo(0));
        
        // 2. Import hashes from an earlier scan
        Map<String, Object> hashRequest = Map.of("hashes", List.of(
            Map.of("photoId", master, "primaryHash", "0000000000000000"),
            Map.of("photoId", preview, "primaryHash", "0000000000000003"),
            Map.of("photoId", copy, "primaryHash", "0000000000000000"),
            Map.of("photoId", checksum("never registered"), "primaryHash", "ffffffffffffffff")
        ));
        
        given()
                .contentType(ContentType.JSON)
                .body(hashRequest)
                .post("/commands/hashes/import")
                .then()
                .statusCode(200)
                .body("imported", equalTo(3))
                .body("unknownPhotos", equalTo(1));
        
        // 3. Run the pipeline
        String runId = startRun(Map.of("linkage", "COMPLETE"));
        
        given()
                .get("/queries/pipeline/runs/" + runId)
                .then()
                .statusCode(200)
                .body("linkage", equalTo("COMPLETE"))
                .body("classifiedRejected", equalTo(1))
                .body("groupsFormed", equalTo(1))
                .body("groupRejections", equalTo(2))
                .body("guardTrips", equalTo(0));
        
        given()
                .get("/queries/pipeline/runs/" + runId + "/events")
                .then()
                .statusCode(200)
                .body("eventType", contains("StageCompleted", "StageCompleted", "StageCompleted"))
                .body("payload.stage", contains("CLASSIFY", "GROUP", "GROUP_RULES"));
        
        // 4. Verify catalog-wide outcome
        Map<String, Object> status = given()
                .get("/queries/pipeline/status")
                .then()
                .statusCode(200)
                .body("totalPhotos", equalTo(4))
                .body("hashedPhotos", equalTo(3))
                .body("individualDecisions", hasSize(1))
                .body("individualDecisions[0].ruleName", equalTo("TINY_ICON"))
                .body("groups", equalTo(1))
                .body("groupedPhotos", equalTo(3))
                .body("groupRejectionsByRule.THUMBNAIL", equalTo(1))
                .body("groupRejectionsByRule.SAME_RESOLUTION_DUPLICATE", equalTo(1))
                .body("aggregatedPaths", equalTo(2))
                .body("photosWithAggregatedPaths", equalTo(1))
                .body("keptPhotos", equalTo(1))
                .body("checkpoints", hasSize(3))
                .extract()
                .as(Map.class);
        
        // 5. A second run over the same data reaches the same result
        startRun(Map.of("linkage", "COMPLETE", "reclassify", true));
        
        Map<String, Object> rerun = given()
                .get("/queries/pipeline/status")
                .then()
                .statusCode(200)
                .extract()
                .as(Map.class);
        
        assertEquals(status.get("groupRejectionsByRule"), rerun.get("groupRejectionsByRule"));
        assertEquals(status.get("aggregatedPaths"), rerun.get("aggregatedPaths"));
        assertEquals(status.get("keptPhotos"), rerun.get("keptPhotos"));
    }
    
    @Test
    void shouldRejectMalformedPhotoIds() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("photos", List.of(photo("not-a-checksum", 10, 10, 1L, "/x.jpg"))))
                .post("/commands/photos")
                .then()
                .statusCode(400);
    }
    
    @Test
    void shouldReturnNotFoundForUnknownRun() {
        given()
                .get("/queries/pipeline/runs/run_missing")
                .then()
                .statusCode(404);
    }
}
