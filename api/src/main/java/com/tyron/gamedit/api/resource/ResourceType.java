package com.tyron.gamedit.api.resource;

/**
 * Kinds of content the editor knows about.
 */
public enum ResourceType {
    MATERIAL,
    PARTICLE_SYSTEM,
    SHAPE,
    ENTITY,
    SCENE,
    TILEMAP,
    SCRIPT,
    DATA_FILE,
    AUDIO_GRAPH,
    UI,
    DRAWABLE
}
