package com.richcorabbithole.pipeline;

import com.richcorabbithole.pipeline.shared.AppConfig;
import com.richcorabbithole.pipeline.shared.AwsClientFactory;
import com.richcorabbithole.pipeline.shared.service.SqsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sqs.model.Message;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Worker main class.
 * Long-polls the research queue and hands each message to {@link ResearchWorker}.
 *
 * A message is deleted only when processing returns normally. On any exception it is
 * left in place: it becomes visible again after the visibility timeout, and the queue's
 * redrive policy moves it to the dead-letter queue after the maximum receive count.
 */
public class Worker {

    private static final Logger logger = LoggerFactory.getLogger(Worker.class);

    // Config keys
    private static final String WAIT_TIME_KEY = "WAIT_TIME_SECONDS";
    private static final String VISIBILITY_TIMEOUT_KEY = "VISIBILITY_TIMEOUT_SECONDS";
    private static final String MAX_RECEIVE_COUNT_KEY = "MAX_RECEIVE_COUNT";

    private final SqsService sqsService;
    private final ResearchWorker researchWorker;
    private final AtomicBoolean running;

    private final String queueUrl;
    private final int waitTimeSeconds;
    private final int visibilityTimeout;
    private final int maxReceiveCount;

    public Worker(SqsService sqsService, ResearchWorker researchWorker, String queueUrl,
            int waitTimeSeconds, int visibilityTimeout, int maxReceiveCount) {
        this.sqsService = sqsService;
        this.researchWorker = researchWorker;
        this.queueUrl = queueUrl;
        this.waitTimeSeconds = waitTimeSeconds;
        this.visibilityTimeout = visibilityTimeout;
        this.maxReceiveCount = maxReceiveCount;
        this.running = new AtomicBoolean(true);
    }

    public static Worker fromConfig(AppConfig config) {
        String region = config.getString(AppConfig.AWS_REGION);
        return new Worker(
                new SqsService(AwsClientFactory.createSqsClient(region)),
                ResearchWorker.fromConfig(config),
                config.getString(AppConfig.RESEARCH_QUEUE_URL),
                config.getIntOptional(WAIT_TIME_KEY, 20),
                // Must exceed the longest provider call or the message is redelivered mid-flight
                config.getIntOptional(VISIBILITY_TIMEOUT_KEY, 900),
                config.getIntOptional(MAX_RECEIVE_COUNT_KEY, 2));
    }

    public void start() {
        logger.info("Worker starting on {} (visibility {}s, max receives {})",
                queueUrl, visibilityTimeout, maxReceiveCount);
        setupShutdownHook();

        while (running.get()) {
            try {
                pollOnce();
            } catch (Exception e) {
                logger.error("Error in main loop", e);
                sleep(5000);
            }
        }

        logger.info("Worker stopped");
    }

    /**
     * Receives at most one message and processes it.
     *
     * @return the number of messages received
     */
    int pollOnce() {
        List<Message> messages = sqsService.receiveMessages(queueUrl, 1, waitTimeSeconds, visibilityTimeout);
        for (Message message : messages) {
            processMessage(message);
        }
        return messages.size();
    }

    /**
     * @return true if the message was processed and deleted
     */
    boolean processMessage(Message message) {
        int attempt = SqsService.receiveCount(message);
        logger.info("Processing message {} (attempt {}/{})", message.messageId(), attempt, maxReceiveCount);

        WorkerOutcome outcome;
        try {
            outcome = researchWorker.process(message.body());
        } catch (RuntimeException e) {
            if (attempt >= maxReceiveCount) {
                logger.error("Message {} failed on its last attempt and will be dead-lettered: {}",
                        message.messageId(), e.getMessage());
            } else {
                logger.warn("Message {} failed, leaving it for redelivery: {}", message.messageId(), e.getMessage());
            }
            return false;
        }

        sqsService.deleteMessage(queueUrl, message.receiptHandle());
        logger.info("Message {} done: {}", message.messageId(), outcome);
        return true;
    }

    public void stop() {
        running.set(false);
    }

    private void setupShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            stop();
        }));
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
        }
    }

    public static void main(String[] args) {
        logger.info("=== Research Worker Starting ===");

        try {
            Worker worker = Worker.fromConfig(new AppConfig());
            worker.start();
        } catch (Exception e) {
            logger.error("Fatal error in worker", e);
            System.exit(1);
        }

        logger.info("=== Research Worker Stopped ===");
    }
}
