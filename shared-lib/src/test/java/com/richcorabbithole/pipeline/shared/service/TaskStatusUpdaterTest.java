package com.richcorabbithole.pipeline.shared.service;

import com.richcorabbithole.pipeline.shared.model.TaskStatus;
import com.richcorabbithole.pipeline.shared.model.TaskUpdate;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class TaskStatusUpdaterTest {

    private TaskTableService taskTable;
    private TaskStatusUpdater updater;

    @Before
    public void setUp() {
        taskTable = mock(TaskTableService.class);
        updater = new TaskStatusUpdater(taskTable);
    }

    @Test
    public void testRecorded() {
        when(taskTable.updateTask(eq("t1"), any(TaskUpdate.class))).thenReturn(true);

        TaskStatusUpdater.MarkFailedResult result = updater.markFailed("t1", "Failed to place message on queue");

        assertTrue(result.isRecorded());
        ArgumentCaptor<TaskUpdate> captor = ArgumentCaptor.forClass(TaskUpdate.class);
        verify(taskTable).updateTask(eq("t1"), captor.capture());
        assertEquals(TaskStatus.FAILED, captor.getValue().getStatus());
        assertEquals("Failed to place message on queue", captor.getValue().getError().get());
    }

    @Test
    public void testConditionMissIsSkipped() {
        when(taskTable.updateTask(eq("t1"), any(TaskUpdate.class))).thenReturn(false);

        assertEquals(TaskStatusUpdater.MarkFailedResult.Outcome.SKIPPED, updater.markFailed("t1", "x").getOutcome());
    }

    @Test
    public void testSecondaryFailureIsCapturedNotThrown() {
        RuntimeException storeDown = new RuntimeException("DynamoDB down too");
        when(taskTable.updateTask(eq("t1"), any(TaskUpdate.class))).thenThrow(storeDown);

        TaskStatusUpdater.MarkFailedResult result = updater.markFailed("t1", "Original error");

        assertEquals(TaskStatusUpdater.MarkFailedResult.Outcome.ERROR, result.getOutcome());
        assertSame(storeDown, result.getCause());
        assertFalse(result.isRecorded());
    }

    @Test
    public void testDescribeFallsBackToClassName() {
        assertEquals("API rate limited", TaskStatusUpdater.describe(new RuntimeException("API rate limited")));
        assertEquals("NullPointerException", TaskStatusUpdater.describe(new NullPointerException()));
    }
}
