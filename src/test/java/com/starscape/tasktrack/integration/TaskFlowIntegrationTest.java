package com.starscape.tasktrack.integration;

import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the complete task lifecycle on PostgreSQL.
 * Tests: create → list with filters → patch → soft delete, plus concurrent tag creation
 */
@Testcontainers(disabledWithoutDocker = true)
public class TaskFlowIntegrationTest extends BaseIntegrationTest {
    
    @LocalServerPort
    private int port;
    
    @Autowired
    private JdbcTemplate jdbcTemplate;
    
    private String tagPrefix;
    
    @BeforeEach
    void setUp() {
        RestAssured.port = port;
        RestAssured.baseURI = "http://localhost";
        
        // Unique tag names per test so tests sharing the container stay independent
        tagPrefix = "t" + System.nanoTime() + "-";
    }
    
    private Map<String, Object> task(String title, int priority, List<String> tags) {
        return Map.of(
            "title", title,
            "priority", priority,
            "due_date", "2999-01-01",
            "tags", tags
        );
    }
    
    @Test
    void shouldCompleteFullTaskLifecycle() {
        String docs = tagPrefix + "docs";
        String urgent = tagPrefix + "urgent";
        
        // 1. Create task with two new tags
        Integer taskId = given()
                .contentType(ContentType.JSON)
                .body(task("Write report", 3, List.of(docs, urgent)))
                .post("/tasks")
                .then()
                .statusCode(201)
                .body("id", notNullValue())
                .body("tags", hasSize(2))
                .body("tags.name", containsInAnyOrder(docs, urgent))
                .extract()
                .path("id");
        
        // 2. Filter requires both tags
        given()
                .queryParam("tags", docs + "," + urgent)
                .get("/tasks")
                .then()
                .statusCode(200)
                .body("id", contains(taskId));
        
        // 3. Patch title only
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("title", "Review report"))
                .patch("/tasks/" + taskId)
                .then()
                .statusCode(200)
                .body("title", equalTo("Review report"))
                .body("priority", equalTo(3))
                .body("tags", hasSize(2));
        
        // 4. Replace tags with an empty list
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("tags", List.of()))
                .patch("/tasks/" + taskId)
                .then()
                .statusCode(200)
                .body("tags", empty());
        
        // 5. Soft delete, then the task is gone from every read path
        given()
                .delete("/tasks/" + taskId)
                .then()
                .statusCode(200)
                .body("detail", equalTo("Task deleted successfully"));
        
        given()
                .get("/tasks/" + taskId)
                .then()
                .statusCode(404);
        
        given()
                .delete("/tasks/" + taskId)
                .then()
                .statusCode(404);
        
        Integer stored = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM tasks WHERE task_id = ? AND visibility = 'DELETED'",
                Integer.class, taskId);
        assertEquals(1, stored);
    }
    
    @Test
    void shouldReturnValidationDetails() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("title", "x", "priority", 9, "due_date", "2000-01-01"))
                .post("/tasks")
                .then()
                .statusCode(422)
                .body("error", equalTo("Validation Failed"))
                .body("details.priority", notNullValue())
                .body("details.due_date", notNullValue());
    }
    
    @Test
    void shouldStoreTitleOfTwoHundredEmoji() {
        String title = "\uD83D\uDE00".repeat(200);
        
        Integer taskId = given()
                .contentType(ContentType.JSON)
                .body(task(title, 1, List.of()))
                .post("/tasks")
                .then()
                .statusCode(201)
                .extract()
                .path("id");
        
        String stored = jdbcTemplate.queryForObject(
                "SELECT title FROM tasks WHERE task_id = ?", String.class, taskId);
        assertEquals(title, stored);
    }
    
    @Test
    void shouldCreateSharedTagOnceUnderConcurrentRequests() throws Exception {
        String shared = tagPrefix + "race-" + UUID.randomUUID();
        int requests = 6;
        ExecutorService executor = Executors.newFixedThreadPool(requests);
        CountDownLatch start = new CountDownLatch(1);
        
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < requests; i++) {
                String title = "Concurrent " + i;
                Callable<Integer> call = () -> {
                    start.await();
                    return given()
                            .contentType(ContentType.JSON)
                            .body(task(title, 2, List.of(shared)))
                            .post("/tasks")
                            .then()
                            .extract()
                            .statusCode();
                };
                results.add(executor.submit(call));
            }
            start.countDown();
            
            for (Future<Integer> result : results) {
                assertEquals(201, result.get(30, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        
        Integer tagRows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM tags WHERE name = ?", Integer.class, shared);
        assertEquals(1, tagRows);
        
        given()
                .queryParam("tags", shared)
                .queryParam("limit", 100)
                .get("/tasks")
                .then()
                .statusCode(200)
                .body("size()", equalTo(requests));
    }
}
