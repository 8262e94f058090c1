package com.tyron.gamedit.content;

import com.tyron.gamedit.api.resource.ResourceType;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * A built-in geometric shape. Geometry is generated by the engine, so there is nothing to
 * depend on and no file to read.
 */
public class DrawableResource extends ContentResource {

    private final String shapeClass;

    public DrawableResource(@NotNull String id, @NotNull String name, @NotNull String shapeClass) {
        super(ResourceType.DRAWABLE, id, name);
        this.shapeClass = shapeClass;
    }

    protected DrawableResource(@NotNull DrawableResource other) {
        super(other);
        this.shapeClass = other.shapeClass;
    }

    public String getShapeClass() {
        return shapeClass;
    }

    @Override
    protected void writeContent(@NotNull Map<String, Object> content) {
        content.put("shape", shapeClass);
    }

    @Override
    public @NotNull DrawableResource copy() {
        return new DrawableResource(this);
    }
}
