package com.richcorabbithole.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.richcorabbithole.pipeline.api.AcceptedResponse;
import com.richcorabbithole.pipeline.api.ApiResponse;
import com.richcorabbithole.pipeline.api.ErrorResponse;
import com.richcorabbithole.pipeline.shared.AppConfig;
import com.richcorabbithole.pipeline.shared.AwsClientFactory;
import com.richcorabbithole.pipeline.shared.model.ResearchWorkItem;
import com.richcorabbithole.pipeline.shared.model.TaskRecord;
import com.richcorabbithole.pipeline.shared.model.TaskStatus;
import com.richcorabbithole.pipeline.shared.service.SqsService;
import com.richcorabbithole.pipeline.shared.service.TaskStatusUpdater;
import com.richcorabbithole.pipeline.shared.service.TaskTableService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Accepts research requests.
 *
 * Validates the body, writes a pending task record and queues a work item for the
 * research worker, then answers 202 with the task id the client polls on.
 * The record is always written before the work item is published; if publishing fails
 * the record is marked failed so it does not sit in pending forever.
 *
 * The handler is stateless across invocations and never throws: every outcome is an
 * {@link ApiResponse}.
 */
public class ResearchRequestHandler {

    private static final Logger logger = LoggerFactory.getLogger(ResearchRequestHandler.class);

    public static final int MAX_TOPIC_LENGTH = 500;

    static final String INVALID_JSON = "Invalid JSON in request body";
    static final String MISSING_TOPIC = "Missing required field: topic (must be a string)";
    static final String TOPIC_TOO_LONG = "topic must be " + MAX_TOPIC_LENGTH + " characters or fewer";
    static final String CREATE_FAILED = "Failed to create task record";
    static final String PUBLISH_FAILED = "Failed to place message on queue";

    private final TaskTableService taskTable;
    private final TaskStatusUpdater statusUpdater;
    private final SqsService sqsService;
    private final String queueUrl;
    private final Supplier<String> taskIdGenerator;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public ResearchRequestHandler(TaskTableService taskTable, SqsService sqsService, String queueUrl) {
        this(taskTable, sqsService, queueUrl, () -> UUID.randomUUID().toString(), Clock.systemUTC());
    }

    public ResearchRequestHandler(TaskTableService taskTable, SqsService sqsService, String queueUrl,
            Supplier<String> taskIdGenerator, Clock clock) {
        this.taskTable = taskTable;
        this.statusUpdater = new TaskStatusUpdater(taskTable);
        this.sqsService = sqsService;
        this.queueUrl = queueUrl;
        this.taskIdGenerator = taskIdGenerator;
        this.clock = clock;
    }

    /**
     * Wires the handler against real AWS clients.
     */
    public static ResearchRequestHandler fromConfig(AppConfig config) {
        String region = config.getString(AppConfig.AWS_REGION);
        TaskTableService taskTable = new TaskTableService(
                AwsClientFactory.createDynamoDbClient(region),
                config.getString(AppConfig.TABLE_NAME));
        SqsService sqsService = new SqsService(AwsClientFactory.createSqsClient(region));
        return new ResearchRequestHandler(taskTable, sqsService, config.getString(AppConfig.RESEARCH_QUEUE_URL));
    }

    public ApiResponse handle(String requestBody) {
        try {
            return accept(requestBody);
        } catch (RuntimeException e) {
            logger.error("Failed to accept research request", e);
            return error(500, TaskStatusUpdater.describe(e));
        }
    }

    private ApiResponse accept(String requestBody) {
        JsonNode body;
        try {
            body = objectMapper.readTree(requestBody == null || requestBody.isEmpty() ? "{}" : requestBody);
        } catch (JsonProcessingException e) {
            logger.warn("Rejected request: body is not valid JSON");
            return error(400, INVALID_JSON);
        }
        if (body == null || !body.isObject()) {
            logger.warn("Rejected request: body is not a JSON object");
            return error(400, INVALID_JSON);
        }

        JsonNode topicNode = body.get("topic");
        if (topicNode == null || !topicNode.isTextual() || topicNode.asText().isEmpty()) {
            logger.warn("Rejected request: missing or non-string topic");
            return error(400, MISSING_TOPIC);
        }
        String topic = topicNode.asText();
        if (topic.length() > MAX_TOPIC_LENGTH) {
            logger.warn("Rejected request: topic is {} characters", topic.length());
            return error(400, TOPIC_TOO_LONG);
        }

        String taskId = taskIdGenerator.get();
        try {
            taskTable.createTask(TaskRecord.createPending(taskId, topic, Instant.now(clock)));
        } catch (RuntimeException e) {
            logger.error("{} for task {}", CREATE_FAILED, taskId, e);
            return error(500, CREATE_FAILED);
        }

        try {
            String messageId = sqsService.sendMessage(queueUrl, new ResearchWorkItem(taskId, topic));
            logger.info("Queued task {} as message {}", taskId, messageId);
        } catch (RuntimeException e) {
            logger.error("{} for task {}", PUBLISH_FAILED, taskId, e);
            TaskStatusUpdater.MarkFailedResult result = statusUpdater.markFailed(taskId, PUBLISH_FAILED);
            if (!result.isRecorded()) {
                logger.error("Task {} may remain orphaned in pending: {}", taskId, result);
            }
            return error(500, PUBLISH_FAILED);
        }

        return json(202, new AcceptedResponse(taskId, TaskStatus.PENDING.value(), AcceptedResponse.QUEUED_MESSAGE));
    }

    private ApiResponse error(int statusCode, String message) {
        return json(statusCode, new ErrorResponse(message));
    }

    private ApiResponse json(int statusCode, Object body) {
        try {
            return new ApiResponse(statusCode, objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response body", e);
        }
    }
}
