package com.tyron.gamedit.core.concurrent;

import com.tyron.gamedit.api.concurrent.TaskHandle;
import com.tyron.gamedit.api.concurrent.WorkerTask;
import com.tyron.gamedit.core.test.MockWorkspace;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class LaneTaskExecutorTest {

    private LaneTaskExecutor lane;

    @AfterEach
    public void tearDown() {
        if (lane != null) {
            lane.dispose();
            lane = null;
        }
    }

    @Test
    public void testRunsInSubmissionOrderOnTheLaneThread() throws Exception {
        lane = new LaneTaskExecutor("order");
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        List<String> threads = Collections.synchronizedList(new ArrayList<>());

        List<TaskHandle> handles = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            int n = i;
            handles.add(lane.submit(new WorkerTask("t" + n, "task " + n) {
                @Override
                protected void doTask() {
                    order.add(n);
                    threads.add(Thread.currentThread().getName());
                }
            }));
        }

        awaitAll(handles);

        for (int i = 0; i < 50; i++) {
            Assertions.assertEquals(i, order.get(i));
        }
        Assertions.assertTrue(threads.stream().allMatch("CacheLane-order"::equals), threads.toString());
        Assertions.assertEquals(50, lane.getSubmittedCount());
    }

    @Test
    public void testFailingTaskKeepsTheLaneAlive() throws Exception {
        lane = new LaneTaskExecutor("errors");
        TaskHandle failing = lane.submit(new WorkerTask("fail", "throws") {
            @Override
            protected void doTask() {
                throw new IllegalStateException("boom");
            }
        });
        TaskHandle next = lane.submit(new WorkerTask("ok", "runs after a failure") {
            @Override
            protected void doTask() {
            }
        });

        awaitAll(List.of(failing, next));

        Assertions.assertTrue(failing.getTask().hasError());
        Assertions.assertEquals("boom", failing.getTask().getErrorMessage());
        Assertions.assertInstanceOf(IllegalStateException.class, failing.getTask().getError());
        Assertions.assertFalse(next.getTask().hasError());
    }

    @Test
    public void testSubmitAfterDisposeIsRejected() {
        lane = new LaneTaskExecutor("closed");
        lane.dispose();
        Assertions.assertThrows(IllegalStateException.class, () -> lane.submit(new WorkerTask("late", "late") {
            @Override
            protected void doTask() {
            }
        }));
    }

    @Test
    public void testLaneNameFromWorkspaceConfiguration() {
        MockWorkspace workspace = new MockWorkspace(new File("."));
        lane = LaneTaskExecutor.forWorkspace(workspace);
        Assertions.assertEquals(LaneTaskExecutor.DEFAULT_LANE, lane.getLane());
        lane.dispose();

        workspace.getConfiguration().setProperty(LaneTaskExecutor.LANE_KEY, " io ");
        lane = LaneTaskExecutor.forWorkspace(workspace);
        Assertions.assertEquals("io", lane.getLane());
    }

    private static void awaitAll(List<TaskHandle> handles) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        for (TaskHandle handle : handles) {
            while (!handle.isComplete()) {
                if (System.currentTimeMillis() > deadline) {
                    Assertions.fail("Task did not complete: " + handle);
                }
                Thread.sleep(1);
            }
        }
    }
}
