package com.tyron.gamedit.content;

import com.tyron.gamedit.api.resource.ResourceType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A level: entity placements, an optional tilemap and the scene script.
 */
public class SceneResource extends ContentResource {

    private String scriptId;
    private String tilemapId;
    private final List<Placement> placements = new ArrayList<>();

    public SceneResource(@NotNull String id, @NotNull String name) {
        super(ResourceType.SCENE, id, name);
    }

    protected SceneResource(@NotNull SceneResource other) {
        super(other);
        this.scriptId = other.scriptId;
        this.tilemapId = other.tilemapId;
        this.placements.addAll(other.placements);
    }

    public SceneResource setScriptId(@Nullable String scriptId) {
        this.scriptId = scriptId;
        return this;
    }

    public SceneResource setTilemapId(@Nullable String tilemapId) {
        this.tilemapId = tilemapId;
        return this;
    }

    public SceneResource place(@NotNull String name, @NotNull String entityId, double x, double y) {
        placements.add(new Placement(name, entityId, x, y));
        return this;
    }

    /**
     * Removes every placement of {@code entityId}.
     */
    public void removePlacements(@NotNull String entityId) {
        placements.removeIf(p -> p.entityId.equals(entityId));
    }

    public int getPlacementCount() {
        return placements.size();
    }

    @Override
    protected void collectDependencies(@NotNull Set<String> out) {
        pushBack(out, scriptId);
        pushBack(out, tilemapId);
        for (Placement placement : placements) {
            pushBack(out, placement.entityId);
        }
    }

    @Override
    protected void writeContent(@NotNull Map<String, Object> content) {
        if (scriptId != null) {
            content.put("script_file", scriptId);
        }
        if (tilemapId != null) {
            content.put("tilemap", tilemapId);
        }
        List<Map<String, Object>> list = new ArrayList<>(placements.size());
        for (Placement placement : placements) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("name", placement.name);
            map.put("entity", placement.entityId);
            map.put("position", List.of(placement.x, placement.y));
            list.add(map);
        }
        content.put("nodes", list);
    }

    @Override
    public @NotNull SceneResource copy() {
        return new SceneResource(this);
    }

    private static final class Placement {
        final String name;
        final String entityId;
        final double x;
        final double y;

        Placement(String name, String entityId, double x, double y) {
            this.name = Objects.requireNonNull(name, "name");
            this.entityId = Objects.requireNonNull(entityId, "entityId");
            this.x = x;
            this.y = y;
        }
    }
}
