package com.tyron.gamedit.content;

import com.tyron.gamedit.api.resource.ResourceType;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A user drawn polygon.
 * <p>
 * The material used to preview the shape in the editor is kept in the {@value #MATERIAL_PROPERTY}
 * property and counts as a (soft) dependency.
 */
public class ShapeResource extends ContentResource {

    public static final String MATERIAL_PROPERTY = "material";

    private final List<float[]> vertices = new ArrayList<>();

    public ShapeResource(@NotNull String id, @NotNull String name) {
        super(ResourceType.SHAPE, id, name);
    }

    protected ShapeResource(@NotNull ShapeResource other) {
        super(other);
        for (float[] vertex : other.vertices) {
            this.vertices.add(vertex.clone());
        }
    }

    public ShapeResource addVertex(float x, float y) {
        vertices.add(new float[]{x, y});
        return this;
    }

    public int getVertexCount() {
        return vertices.size();
    }

    public ShapeResource setMaterial(@NotNull String materialId) {
        setProperty(MATERIAL_PROPERTY, materialId);
        return this;
    }

    @Override
    protected void collectDependencies(@NotNull Set<String> out) {
        pushBack(out, getStringProperty(MATERIAL_PROPERTY));
    }

    @Override
    protected void writeContent(@NotNull Map<String, Object> content) {
        List<List<Double>> points = new ArrayList<>(vertices.size());
        for (float[] vertex : vertices) {
            points.add(List.of((double) vertex[0], (double) vertex[1]));
        }
        content.put("vertices", points);
    }

    @Override
    public @NotNull ShapeResource copy() {
        return new ShapeResource(this);
    }
}
