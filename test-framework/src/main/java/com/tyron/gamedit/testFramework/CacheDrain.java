package com.tyron.gamedit.testFramework;

import com.tyron.gamedit.api.resource.ValidationReport;
import com.tyron.gamedit.core.cache.ResourceCache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives a {@link ResourceCache} from the test thread the way the editor's UI loop does.
 */
public final class CacheDrain {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private CacheDrain() {
    }

    /**
     * Ticks until every submitted task finished and no child task is waiting.
     *
     * @throws AssertionError if the cache is still busy after {@code timeout}
     */
    public static void tickUntilIdle(ResourceCache cache, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        cache.tickPendingWork();
        while (cache.hasPendingWork()) {
            if (System.nanoTime() - deadline > 0) {
                throw new AssertionError("Resource cache still busy after " + timeout.toMillis() + "ms");
            }
            try {
                Thread.sleep(1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while draining the resource cache", e);
            }
            cache.tickPendingWork();
        }
    }

    /**
     * Takes every queued report. Only reliable once the cache is idle.
     */
    public static List<ValidationReport> takeReports(ResourceCache cache) {
        List<ValidationReport> reports = new ArrayList<>();
        cache.dequeuePendingUpdates(reports);
        return reports;
    }

    /**
     * Collapses reports to the most recent verdict per resource id.
     */
    public static Map<String, Boolean> latest(List<ValidationReport> reports) {
        Map<String, Boolean> latest = new LinkedHashMap<>();
        for (ValidationReport report : reports) {
            latest.put(report.resourceId(), report.valid());
        }
        return latest;
    }
}
