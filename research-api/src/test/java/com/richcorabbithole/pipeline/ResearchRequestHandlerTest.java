package com.richcorabbithole.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.richcorabbithole.pipeline.api.ApiResponse;
import com.richcorabbithole.pipeline.shared.model.ResearchWorkItem;
import com.richcorabbithole.pipeline.shared.model.TaskRecord;
import com.richcorabbithole.pipeline.shared.model.TaskStatus;
import com.richcorabbithole.pipeline.shared.model.TaskUpdate;
import com.richcorabbithole.pipeline.shared.service.SqsService;
import com.richcorabbithole.pipeline.shared.service.TaskTableService;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class ResearchRequestHandlerTest {

    private static final String QUEUE_URL = "https://sqs.us-east-1.amazonaws.com/123456789/test-queue";
    private static final String TASK_ID = "test-task-id-1234";
    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();

    private TaskTableService taskTable;
    private SqsService sqsService;
    private ResearchRequestHandler handler;

    @Before
    public void setUp() {
        taskTable = mock(TaskTableService.class);
        sqsService = mock(SqsService.class);
        when(sqsService.sendMessage(anyString(), any())).thenReturn("message-1");
        when(taskTable.updateTask(anyString(), any(TaskUpdate.class))).thenReturn(true);
        handler = new ResearchRequestHandler(taskTable, sqsService, QUEUE_URL,
                () -> TASK_ID, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // --- validation ---

    @Test
    public void testRejectsMalformedJson() throws Exception {
        assertRejected(handler.handle("not json"), "Invalid JSON in request body");
    }

    @Test
    public void testRejectsNonObjectBody() throws Exception {
        assertRejected(handler.handle("[\"topic\"]"), "Invalid JSON in request body");
    }

    @Test
    public void testRejectsTrailingContentAfterObject() throws Exception {
        assertRejected(handler.handle("{\"topic\": \"x\"} junk"), "Invalid JSON in request body");
    }

    @Test
    public void testRejectsWhitespaceOnlyBody() throws Exception {
        assertRejected(handler.handle("   "), "Invalid JSON in request body");
    }

    @Test
    public void testEmptyBodyIsTreatedAsEmptyObject() throws Exception {
        assertRejected(handler.handle(""), "Missing required field: topic (must be a string)");
    }

    @Test
    public void testRejectsMissingBody() throws Exception {
        assertRejected(handler.handle(null), "Missing required field: topic (must be a string)");
    }

    @Test
    public void testRejectsEmptyObject() throws Exception {
        assertRejected(handler.handle("{}"), "Missing required field: topic (must be a string)");
    }

    @Test
    public void testRejectsNonStringTopic() throws Exception {
        assertRejected(handler.handle("{\"topic\": 42}"), "Missing required field: topic (must be a string)");
    }

    @Test
    public void testRejectsEmptyTopic() throws Exception {
        assertRejected(handler.handle("{\"topic\": \"\"}"), "Missing required field: topic (must be a string)");
    }

    @Test
    public void testRejectsTopicOver500Characters() throws Exception {
        assertRejected(handler.handle(body("a".repeat(501))), "topic must be 500 characters or fewer");
    }

    @Test
    public void testAcceptsTopicOfExactly500Characters() {
        assertEquals(202, handler.handle(body("a".repeat(500))).getStatusCode());
    }

    // --- happy path ---

    @Test
    public void testReturns202WithTaskIdAndPendingStatus() throws Exception {
        ApiResponse response = handler.handle(body("serverless architecture"));

        assertEquals(202, response.getStatusCode());
        assertEquals("application/json", response.getHeaders().get("Content-Type"));
        JsonNode json = objectMapper.readTree(response.getBody());
        assertEquals(TASK_ID, json.get("taskId").asText());
        assertEquals("pending", json.get("status").asText());
        assertEquals("Research task queued for processing", json.get("message").asText());
    }

    @Test
    public void testCreatesPendingRecordBeforePublishing() {
        handler.handle(body("serverless architecture"));

        InOrder inOrder = inOrder(taskTable, sqsService);
        ArgumentCaptor<TaskRecord> record = ArgumentCaptor.forClass(TaskRecord.class);
        ArgumentCaptor<ResearchWorkItem> item = ArgumentCaptor.forClass(ResearchWorkItem.class);
        inOrder.verify(taskTable).createTask(record.capture());
        inOrder.verify(sqsService).sendMessage(eq(QUEUE_URL), item.capture());

        assertEquals(TASK_ID, record.getValue().getTaskId());
        assertEquals(TaskStatus.PENDING, record.getValue().getStatus());
        assertEquals("serverless architecture", record.getValue().getTopic());
        assertEquals(NOW, record.getValue().getCreatedAt());
        assertEquals(NOW, record.getValue().getUpdatedAt());

        assertEquals(TASK_ID, item.getValue().getTaskId());
        assertEquals("serverless architecture", item.getValue().getTopic());
        verify(taskTable, never()).updateTask(anyString(), any(TaskUpdate.class));
    }

    // --- failures ---

    @Test
    public void testCreateFailureReturns500AndNeverPublishes() throws Exception {
        doThrow(new RuntimeException("DynamoDB unavailable")).when(taskTable).createTask(any(TaskRecord.class));

        ApiResponse response = handler.handle(body("test topic"));

        assertEquals(500, response.getStatusCode());
        assertEquals("Failed to create task record", objectMapper.readTree(response.getBody()).get("error").asText());
        verify(sqsService, never()).sendMessage(anyString(), any());
        verify(sqsService, never()).sendRawMessage(anyString(), anyString());
    }

    @Test
    public void testPublishFailureMarksTaskFailed() throws Exception {
        when(sqsService.sendMessage(anyString(), any())).thenThrow(new RuntimeException("SQS unavailable"));

        ApiResponse response = handler.handle(body("test topic"));

        assertEquals(500, response.getStatusCode());
        assertEquals("Failed to place message on queue", objectMapper.readTree(response.getBody()).get("error").asText());
        verify(taskTable).updateTask(eq(TASK_ID), argThat(update ->
                update.getStatus() == TaskStatus.FAILED
                        && "Failed to place message on queue".equals(update.getError().orElse(null))));
    }

    @Test
    public void testPublishFailureStillReturns500WhenCompensationFails() throws Exception {
        when(sqsService.sendMessage(anyString(), any())).thenThrow(new RuntimeException("SQS unavailable"));
        when(taskTable.updateTask(anyString(), any(TaskUpdate.class))).thenThrow(new RuntimeException("DynamoDB down too"));

        ApiResponse response = handler.handle(body("test topic"));

        assertEquals(500, response.getStatusCode());
        assertEquals("Failed to place message on queue", objectMapper.readTree(response.getBody()).get("error").asText());
    }

    @Test
    public void testEachRequestGetsAFreshTaskId() throws Exception {
        ResearchRequestHandler uuidHandler = new ResearchRequestHandler(taskTable, sqsService, QUEUE_URL);

        String first = objectMapper.readTree(uuidHandler.handle(body("one")).getBody()).get("taskId").asText();
        String second = objectMapper.readTree(uuidHandler.handle(body("two")).getBody()).get("taskId").asText();

        assertNotEquals(first, second);
    }

    private void assertRejected(ApiResponse response, String expectedError) throws Exception {
        assertEquals(400, response.getStatusCode());
        assertEquals(expectedError, objectMapper.readTree(response.getBody()).get("error").asText());
        verifyNoInteractions(taskTable, sqsService);
    }

    private String body(String topic) {
        return objectMapper.createObjectNode().put("topic", topic).toString();
    }
}
