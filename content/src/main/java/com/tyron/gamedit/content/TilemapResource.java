package com.tyron.gamedit.content;

import com.tyron.gamedit.api.resource.ResourceType;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A tile map made of layers. Layer data lives in separate data file resources; render layers
 * draw their tiles with a palette of materials.
 */
public class TilemapResource extends ContentResource {

    private int width;
    private int height;
    private final List<Layer> layers = new ArrayList<>();

    public TilemapResource(@NotNull String id, @NotNull String name, int width, int height) {
        super(ResourceType.TILEMAP, id, name);
        this.width = width;
        this.height = height;
    }

    protected TilemapResource(@NotNull TilemapResource other) {
        super(other);
        this.width = other.width;
        this.height = other.height;
        for (Layer layer : other.layers) {
            this.layers.add(layer.copy());
        }
    }

    public Layer addLayer(@NotNull String name, @NotNull String dataId) {
        Layer layer = new Layer(name, dataId);
        layers.add(layer);
        return layer;
    }

    public List<Layer> getLayers() {
        return List.copyOf(layers);
    }

    @Override
    protected void collectDependencies(@NotNull Set<String> out) {
        for (Layer layer : layers) {
            pushBack(out, layer.dataId);
            if (!layer.render) {
                continue;
            }
            for (String materialId : layer.palette) {
                pushBack(out, materialId);
            }
        }
    }

    @Override
    protected void writeContent(@NotNull Map<String, Object> content) {
        content.put("width", width);
        content.put("height", height);
        List<Map<String, Object>> list = new ArrayList<>(layers.size());
        for (Layer layer : layers) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("name", layer.name);
            map.put("data", layer.dataId);
            map.put("render", layer.render);
            map.put("palette", List.copyOf(layer.palette));
            list.add(map);
        }
        content.put("layers", list);
    }

    @Override
    public @NotNull TilemapResource copy() {
        return new TilemapResource(this);
    }

    public static final class Layer {
        private final String name;
        private final String dataId;
        private boolean render;
        private final List<String> palette = new ArrayList<>();

        private Layer(String name, String dataId) {
            this.name = Objects.requireNonNull(name, "name");
            this.dataId = Objects.requireNonNull(dataId, "dataId");
        }

        public String getName() {
            return name;
        }

        /**
         * Makes this a render layer drawing its tiles with {@code materialIds}, by palette index.
         * Data-only layers ignore their palette.
         */
        public Layer setRenderPalette(@NotNull String... materialIds) {
            this.render = true;
            this.palette.clear();
            this.palette.addAll(List.of(materialIds));
            return this;
        }

        public Layer setRender(boolean render) {
            this.render = render;
            return this;
        }

        private Layer copy() {
            Layer copy = new Layer(name, dataId);
            copy.render = render;
            copy.palette.addAll(palette);
            return copy;
        }
    }
}
