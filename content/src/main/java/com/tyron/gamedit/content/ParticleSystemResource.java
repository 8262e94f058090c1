package com.tyron.gamedit.content;

import com.tyron.gamedit.api.resource.ResourceType;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Set;

/**
 * Kinematic particle engine parameters. Like shapes, the preview material lives in the
 * {@value #MATERIAL_PROPERTY} property.
 */
public class ParticleSystemResource extends ContentResource {

    public static final String MATERIAL_PROPERTY = "material";

    private int maxParticles = 100;
    private float minLifetime = 1.0f;
    private float maxLifetime = 2.0f;
    private String drawPrimitive = "Points";

    public ParticleSystemResource(@NotNull String id, @NotNull String name) {
        super(ResourceType.PARTICLE_SYSTEM, id, name);
    }

    protected ParticleSystemResource(@NotNull ParticleSystemResource other) {
        super(other);
        this.maxParticles = other.maxParticles;
        this.minLifetime = other.minLifetime;
        this.maxLifetime = other.maxLifetime;
        this.drawPrimitive = other.drawPrimitive;
    }

    public ParticleSystemResource setMaterial(@NotNull String materialId) {
        setProperty(MATERIAL_PROPERTY, materialId);
        return this;
    }

    public int getMaxParticles() {
        return maxParticles;
    }

    public void setMaxParticles(int maxParticles) {
        this.maxParticles = maxParticles;
    }

    public void setLifetime(float min, float max) {
        if (min > max) {
            throw new IllegalArgumentException("min lifetime " + min + " > max lifetime " + max);
        }
        this.minLifetime = min;
        this.maxLifetime = max;
    }

    public void setDrawPrimitive(@NotNull String drawPrimitive) {
        this.drawPrimitive = drawPrimitive;
    }

    @Override
    protected void collectDependencies(@NotNull Set<String> out) {
        pushBack(out, getStringProperty(MATERIAL_PROPERTY));
    }

    @Override
    protected void writeContent(@NotNull Map<String, Object> content) {
        content.put("max_particles", maxParticles);
        content.put("min_lifetime", (double) minLifetime);
        content.put("max_lifetime", (double) maxLifetime);
        content.put("primitive", drawPrimitive);
    }

    @Override
    public @NotNull ParticleSystemResource copy() {
        return new ParticleSystemResource(this);
    }
}
