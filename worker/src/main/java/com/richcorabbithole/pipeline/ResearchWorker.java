package com.richcorabbithole.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.richcorabbithole.pipeline.research.AnthropicResearchClient;
import com.richcorabbithole.pipeline.research.ResearchPrompt;
import com.richcorabbithole.pipeline.research.ResearchProvider;
import com.richcorabbithole.pipeline.research.ResearchProviderException;
import com.richcorabbithole.pipeline.research.ResearchResponse;
import com.richcorabbithole.pipeline.shared.AppConfig;
import com.richcorabbithole.pipeline.shared.AwsClientFactory;
import com.richcorabbithole.pipeline.shared.model.ArtifactKeys;
import com.richcorabbithole.pipeline.shared.model.TaskRecord;
import com.richcorabbithole.pipeline.shared.model.TaskStatus;
import com.richcorabbithole.pipeline.shared.model.TaskUpdate;
import com.richcorabbithole.pipeline.shared.service.S3Service;
import com.richcorabbithole.pipeline.shared.service.SecretsService;
import com.richcorabbithole.pipeline.shared.service.TaskStatusUpdater;
import com.richcorabbithole.pipeline.shared.service.TaskStoreException;
import com.richcorabbithole.pipeline.shared.service.TaskTableService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes one research work item per queue delivery, redeliveries included.
 *
 * Contract with the queue: returning normally means the message may be deleted;
 * throwing means it must be redelivered (and eventually dead-lettered). Failures after
 * the task is known are recorded on the task before the original exception is rethrown.
 */
public class ResearchWorker {

    private static final Logger logger = LoggerFactory.getLogger(ResearchWorker.class);

    static final String MALFORMED_BODY = "Malformed SQS message body";
    static final String MISSING_TASK_ID = "Missing taskId in SQS message";
    static final String MISSING_TOPIC = "Missing topic in SQS message";
    static final String NO_TEXT_CONTENT = "Claude returned no text content";

    private final TaskTableService taskTable;
    private final TaskStatusUpdater statusUpdater;
    private final S3Service s3Service;
    private final ApiKeyProvider apiKeyProvider;
    private final ResearchProvider researchProvider;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ResearchWorker(TaskTableService taskTable, S3Service s3Service, ApiKeyProvider apiKeyProvider,
            ResearchProvider researchProvider) {
        this.taskTable = taskTable;
        this.statusUpdater = new TaskStatusUpdater(taskTable);
        this.s3Service = s3Service;
        this.apiKeyProvider = apiKeyProvider;
        this.researchProvider = researchProvider;
    }

    public static ResearchWorker fromConfig(AppConfig config) {
        String region = config.getString(AppConfig.AWS_REGION);
        TaskTableService taskTable = new TaskTableService(
                AwsClientFactory.createDynamoDbClient(region),
                config.getString(AppConfig.TABLE_NAME));
        S3Service s3Service = new S3Service(
                AwsClientFactory.createS3Client(region),
                config.getString(AppConfig.BUCKET_NAME));
        ApiKeyProvider apiKeyProvider = new ApiKeyProvider(
                new SecretsService(AwsClientFactory.createSecretsManagerClient(region)),
                config.getString(AppConfig.SECRET_ID));
        return new ResearchWorker(taskTable, s3Service, apiKeyProvider, AnthropicResearchClient.fromConfig(config));
    }

    /**
     * @throws PoisonMessageException if the body is unreadable, has no taskId, or names an
     *                                unknown task
     * @throws RuntimeException       any failure after the task was found, after the task
     *                                has been marked failed (best effort)
     */
    public WorkerOutcome process(String messageBody) {
        JsonNode message = parse(messageBody);

        String taskId = text(message, "taskId");
        if (taskId == null) {
            throw new PoisonMessageException(MISSING_TASK_ID);
        }

        String topic = text(message, "topic");
        if (topic == null) {
            return failMissingTopic(taskId);
        }

        TaskRecord task = taskTable.getTask(taskId)
                .orElseThrow(() -> new PoisonMessageException("Task not found: " + taskId));

        if (task.getStatus() == TaskStatus.RESEARCHED) {
            logger.info("Task {} already researched ({}), skipping duplicate delivery", taskId, task.getS3Key());
            return WorkerOutcome.alreadyResearched(taskId, task.getS3Key());
        }

        try {
            return research(task, topic);
        } catch (RuntimeException e) {
            logger.error("Research failed for task {}", taskId, e);
            TaskStatusUpdater.MarkFailedResult result = statusUpdater.markFailed(taskId, TaskStatusUpdater.describe(e));
            logger.info("Recording failure for task {}: {}", taskId, result);
            throw e;
        }
    }

    private WorkerOutcome research(TaskRecord task, String topic) {
        String taskId = task.getTaskId();
        TaskStatus status = task.getStatus().transitionTo(TaskStatus.RESEARCHING);
        if (!taskTable.updateTask(taskId, TaskUpdate.researching())) {
            return finishedElsewhere(taskId, TaskStatus.RESEARCHING);
        }

        String apiKey = apiKeyProvider.getApiKey();
        logger.info("Researching task {}: {}", taskId, topic);
        ResearchResponse response = researchProvider.createMessage(
                apiKey, ResearchPrompt.SYSTEM, ResearchPrompt.userMessage(topic));

        String research = response.firstText()
                .orElseThrow(() -> new ResearchProviderException(NO_TEXT_CONTENT));

        String s3Key = s3Service.uploadString(
                ArtifactKeys.researchKey(taskId), research, ArtifactKeys.MARKDOWN_CONTENT_TYPE);

        status.transitionTo(TaskStatus.RESEARCHED);
        if (!taskTable.updateTask(taskId, TaskUpdate.researched(s3Key))) {
            return finishedElsewhere(taskId, TaskStatus.RESEARCHED);
        }
        logger.info("Research complete for task {}: {}", taskId, s3Key);
        return WorkerOutcome.researched(taskId, s3Key);
    }

    /**
     * A status write was refused. Another delivery of the same task may have completed it
     * since the guard read; if so this delivery is a duplicate. Otherwise the task is gone.
     */
    private WorkerOutcome finishedElsewhere(String taskId, TaskStatus attempted) {
        TaskRecord current = taskTable.getTask(taskId)
                .filter(task -> task.getStatus() == TaskStatus.RESEARCHED)
                .orElseThrow(() -> new TaskStoreException(
                        "Task " + taskId + " no longer exists, cannot move it to " + attempted));
        logger.info("Task {} was researched by another delivery ({}), dropping this one", taskId, current.getS3Key());
        return WorkerOutcome.alreadyResearched(taskId, current.getS3Key());
    }

    /**
     * Redelivery cannot repair a payload without a topic, so the task is failed and the
     * message acknowledged. A store outage still escalates so the failure gets recorded
     * on a later delivery.
     */
    private WorkerOutcome failMissingTopic(String taskId) {
        logger.error("{} for task {}, marking it failed", MISSING_TOPIC, taskId);
        if (!taskTable.updateTask(taskId, TaskUpdate.failed(MISSING_TOPIC))) {
            logger.warn("Task {} was not marked failed: missing or already researched", taskId);
        }
        return WorkerOutcome.failed(taskId, MISSING_TOPIC);
    }

    private JsonNode parse(String messageBody) {
        if (messageBody == null) {
            throw new PoisonMessageException(MALFORMED_BODY);
        }
        JsonNode message;
        try {
            message = objectMapper.readTree(messageBody);
        } catch (JsonProcessingException e) {
            throw new PoisonMessageException(MALFORMED_BODY, e);
        }
        if (message == null || !message.isObject()) {
            throw new PoisonMessageException(MALFORMED_BODY);
        }
        return message;
    }

    private static String text(JsonNode message, String field) {
        JsonNode node = message.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }
}
