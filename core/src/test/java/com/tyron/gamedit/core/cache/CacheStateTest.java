package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.api.resource.ValidationReport;
import com.tyron.gamedit.api.concurrent.WorkerTask;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class CacheStateTest {

    @Test
    public void testHandleIsUnusableAfterClose() {
        CacheState state = new CacheState();
        CacheState.Locked locked = state.lock();
        locked.close();

        Assertions.assertThrows(IllegalStateException.class, locked::resources);
        Assertions.assertThrows(IllegalStateException.class, () -> locked.enqueueReport(new ValidationReport("A", "A", true)));
        // closing twice is harmless
        locked.close();
    }

    @Test
    public void testTryLockFailsWhileAnotherThreadHoldsTheLock() throws Exception {
        CacheState state = new CacheState();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Thread holder = new Thread(() -> {
            try (CacheState.Locked ignored = state.lock()) {
                held.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "lock-holder");
        holder.start();

        Assertions.assertTrue(held.await(5, TimeUnit.SECONDS));
        Assertions.assertNull(state.tryLock());

        release.countDown();
        holder.join(5000);

        try (CacheState.Locked locked = state.tryLock()) {
            Assertions.assertNotNull(locked);
        }
    }

    @Test
    public void testHandleRejectsOtherThreads() throws Exception {
        CacheState state = new CacheState();
        List<Throwable> errors = new ArrayList<>();
        try (CacheState.Locked locked = state.lock()) {
            Thread other = new Thread(() -> {
                try {
                    locked.graph();
                } catch (Throwable t) {
                    errors.add(t);
                }
            });
            other.start();
            other.join(5000);
        }
        Assertions.assertEquals(1, errors.size());
        Assertions.assertInstanceOf(IllegalStateException.class, errors.get(0));
    }

    @Test
    public void testSubmissionsAreTakenOldestFirst() {
        CacheState state = new CacheState();
        try (CacheState.Locked locked = state.lock()) {
            locked.enqueueSubmission(new NamedTask("one"));
            locked.enqueueSubmission(new NamedTask("two"));
            locked.enqueueSubmission(new NamedTask("three"));
        }
        Assertions.assertTrue(state.hasQueuedSubmissions());

        try (CacheState.Locked locked = state.lock()) {
            List<WorkerTask> first = locked.takeSubmissions(2);
            Assertions.assertEquals(List.of("one", "two"), first.stream().map(WorkerTask::getTaskName).toList());
            List<WorkerTask> rest = locked.takeSubmissions(10);
            Assertions.assertEquals(List.of("three"), rest.stream().map(WorkerTask::getTaskName).toList());
        }
        Assertions.assertFalse(state.hasQueuedSubmissions());
    }

    @Test
    public void testDrainReportsEmptiesTheQueue() {
        CacheState state = new CacheState();
        List<ValidationReport> out = new ArrayList<>();
        try (CacheState.Locked locked = state.lock()) {
            locked.enqueueReport(new ValidationReport("A", "A", true));
            locked.enqueueReport(new ValidationReport("B", null, false));
            Assertions.assertEquals(2, locked.drainReports(out));
            Assertions.assertEquals(0, locked.drainReports(out));
        }
        Assertions.assertEquals(2, out.size());
    }

    private static final class NamedTask extends WorkerTask {
        NamedTask(String name) {
            super(name, name);
        }

        @Override
        protected void doTask() {
        }
    }
}
