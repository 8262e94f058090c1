package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.api.resource.Resource;
import com.tyron.gamedit.api.resource.ValidationReport;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validates one resource, reports the verdict and schedules the next step of the cascade.
 * <p>
 * The cascade never recurses: the dependents of the validated resource get their own
 * validate tasks, which reach the executor on the owner's next tick.
 */
final class ValidateResourceTask extends CacheTask {

    private static final Logger LOG = Logger.getLogger(ValidateResourceTask.class.getName());

    private final ValidationEngine engine;
    private final String resourceId;
    private final PropagationWave wave;

    ValidateResourceTask(CacheState state, ValidationEngine engine, String resourceId, PropagationWave wave) {
        super(state, "ValidateCacheResource", "Validate resource. [id=" + resourceId + "]");
        this.engine = engine;
        this.resourceId = resourceId;
        this.wave = wave;
    }

    String getResourceId() {
        return resourceId;
    }

    @Override
    protected void doTask() {
        boolean valid;
        int scheduled = 0;
        try (CacheState.Locked locked = state.lock()) {
            wave.settle(resourceId);
            Resource resource = locked.resources().get(resourceId);
            valid = engine.validate(locked.resources(), resourceId);
            locked.enqueueReport(new ValidationReport(resourceId, resource != null ? resource.getName() : null, valid));

            if (resource != null) {
                scheduled = engine.propagate(locked, resourceId, valid, wave,
                        userId -> locked.enqueueSubmission(new ValidateResourceTask(state, engine, userId, wave)));
            }
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Validated resource. [id=" + resourceId + ", valid=" + valid + ", scheduled=" + scheduled
                    + ", wave=" + wave.getOrigin() + "]");
        }
    }
}
