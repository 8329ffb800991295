package com.richcorabbithole.pipeline.shared.service;

import com.richcorabbithole.pipeline.shared.model.TaskRecord;
import com.richcorabbithole.pipeline.shared.model.TaskStatus;
import com.richcorabbithole.pipeline.shared.model.TaskUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Task records in DynamoDB, keyed by taskId.
 *
 * Updates are targeted SET expressions so concurrent writers never erase each other's
 * unrelated attributes. Every update requires the item to exist and not to be researched
 * yet, so a finished task is never rewritten by a late delivery.
 */
public class TaskTableService {

    private static final Logger logger = LoggerFactory.getLogger(TaskTableService.class);

    static final String ATTR_TASK_ID = "taskId";
    static final String ATTR_STATUS = "status";
    static final String ATTR_TOPIC = "topic";
    static final String ATTR_CREATED_AT = "createdAt";
    static final String ATTR_UPDATED_AT = "updatedAt";
    static final String ATTR_S3_KEY = "s3Key";
    static final String ATTR_ERROR = "error";

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;
    private final Clock clock;

    public TaskTableService(DynamoDbClient dynamoDbClient, String tableName) {
        this(dynamoDbClient, tableName, Clock.systemUTC());
    }

    public TaskTableService(DynamoDbClient dynamoDbClient, String tableName, Clock clock) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = tableName;
        this.clock = clock;
    }

    /**
     * Writes a new task. Fails if an item with the same taskId already exists.
     */
    public void createTask(TaskRecord task) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put(ATTR_TASK_ID, s(task.getTaskId()));
        item.put(ATTR_STATUS, s(task.getStatus().value()));
        item.put(ATTR_TOPIC, s(task.getTopic()));
        item.put(ATTR_CREATED_AT, s(task.getCreatedAt().toString()));
        item.put(ATTR_UPDATED_AT, s(task.getUpdatedAt().toString()));

        PutItemRequest request = PutItemRequest.builder()
                .tableName(tableName)
                .item(item)
                .conditionExpression("attribute_not_exists(#taskId)")
                .expressionAttributeNames(Map.of("#taskId", ATTR_TASK_ID))
                .build();

        dynamoDbClient.putItem(request);
        logger.info("Created task {} with status {}", task.getTaskId(), task.getStatus());
    }

    /**
     * Strongly consistent read, so a record written just before its work item was
     * published is always visible to the worker.
     */
    public Optional<TaskRecord> getTask(String taskId) {
        GetItemRequest request = GetItemRequest.builder()
                .tableName(tableName)
                .key(key(taskId))
                .consistentRead(true)
                .build();

        GetItemResponse response = dynamoDbClient.getItem(request);
        if (!response.hasItem() || response.item().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toRecord(response.item()));
    }

    /**
     * Applies the patch and rewrites updatedAt.
     *
     * @return false when the condition did not hold (no such task, or the task is already
     *         researched); true when the write was applied
     */
    public boolean updateTask(String taskId, TaskUpdate update) {
        List<String> assignments = new ArrayList<>();
        Map<String, String> names = new HashMap<>();
        Map<String, AttributeValue> values = new HashMap<>();

        names.put("#taskId", ATTR_TASK_ID);
        names.put("#status", ATTR_STATUS);
        names.put("#updatedAt", ATTR_UPDATED_AT);
        values.put(":status", s(update.getStatus().value()));
        values.put(":updatedAt", s(Instant.now(clock).toString()));
        assignments.add("#status = :status");
        assignments.add("#updatedAt = :updatedAt");

        update.getS3Key().ifPresent(s3Key -> {
            names.put("#s3Key", ATTR_S3_KEY);
            values.put(":s3Key", s(s3Key));
            assignments.add("#s3Key = :s3Key");
        });
        update.getError().ifPresent(error -> {
            names.put("#error", ATTR_ERROR);
            values.put(":error", s(error));
            assignments.add("#error = :error");
        });

        values.put(":researched", s(TaskStatus.RESEARCHED.value()));
        String condition = "attribute_exists(#taskId) AND #status <> :researched";

        UpdateItemRequest request = UpdateItemRequest.builder()
                .tableName(tableName)
                .key(key(taskId))
                .updateExpression("SET " + String.join(", ", assignments))
                .conditionExpression(condition)
                .expressionAttributeNames(names)
                .expressionAttributeValues(values)
                .build();

        try {
            dynamoDbClient.updateItem(request);
        } catch (ConditionalCheckFailedException e) {
            logger.warn("Update of task {} to {} not applied: condition failed", taskId, update.getStatus());
            return false;
        }
        logger.info("Task {} -> {}", taskId, update.getStatus());
        return true;
    }

    private static Map<String, AttributeValue> key(String taskId) {
        return Map.of(ATTR_TASK_ID, s(taskId));
    }

    private static AttributeValue s(String value) {
        return AttributeValue.builder().s(value).build();
    }

    static TaskRecord toRecord(Map<String, AttributeValue> item) {
        String taskId = string(item, ATTR_TASK_ID);
        String status = string(item, ATTR_STATUS);
        if (taskId == null || status == null) {
            throw new TaskStoreException("Task item is missing taskId or status: " + item.keySet());
        }
        return new TaskRecord(
                taskId,
                TaskStatus.fromValue(status),
                string(item, ATTR_TOPIC),
                instant(item, ATTR_CREATED_AT),
                instant(item, ATTR_UPDATED_AT),
                string(item, ATTR_S3_KEY),
                string(item, ATTR_ERROR));
    }

    private static String string(Map<String, AttributeValue> item, String name) {
        AttributeValue value = item.get(name);
        return value != null ? value.s() : null;
    }

    private static Instant instant(Map<String, AttributeValue> item, String name) {
        String value = string(item, name);
        return value != null ? Instant.parse(value) : null;
    }
}
