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
 * An entity class: a tree of nodes with drawables, physics bodies and text, plus the scripts
 * driving it.
 */
public class EntityResource extends ContentResource {

    private String scriptId;
    private final List<String> animatorScriptIds = new ArrayList<>();
    private final List<Node> nodes = new ArrayList<>();

    public EntityResource(@NotNull String id, @NotNull String name) {
        super(ResourceType.ENTITY, id, name);
    }

    protected EntityResource(@NotNull EntityResource other) {
        super(other);
        this.scriptId = other.scriptId;
        this.animatorScriptIds.addAll(other.animatorScriptIds);
        for (Node node : other.nodes) {
            this.nodes.add(node.copy());
        }
    }

    public EntityResource setScriptId(@Nullable String scriptId) {
        this.scriptId = scriptId;
        return this;
    }

    public EntityResource addAnimatorScript(@NotNull String scriptId) {
        animatorScriptIds.add(Objects.requireNonNull(scriptId, "scriptId"));
        return this;
    }

    public Node addNode(@NotNull String name) {
        Node node = new Node(name);
        nodes.add(node);
        return node;
    }

    public List<Node> getNodes() {
        return List.copyOf(nodes);
    }

    @Override
    protected void collectDependencies(@NotNull Set<String> out) {
        pushBack(out, scriptId);
        for (String id : animatorScriptIds) {
            pushBack(out, id);
        }
        for (Node node : nodes) {
            pushBack(out, node.materialId);
            pushBack(out, node.drawableId);
            pushBack(out, node.rigidBodyShapeId);
        }
    }

    @Override
    protected void collectFiles(@NotNull Set<String> out) {
        for (Node node : nodes) {
            pushBack(out, node.fontUri);
        }
    }

    @Override
    protected void writeContent(@NotNull Map<String, Object> content) {
        if (scriptId != null) {
            content.put("script_file", scriptId);
        }
        content.put("animators", List.copyOf(animatorScriptIds));
        List<Map<String, Object>> list = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            list.add(node.toMap());
        }
        content.put("nodes", list);
    }

    @Override
    public @NotNull EntityResource copy() {
        return new EntityResource(this);
    }

    /**
     * One node of the entity tree. Every component is optional.
     */
    public static final class Node {
        private final String name;
        private String drawableId;
        private String materialId;
        private String rigidBodyShapeId;
        private String text;
        private String fontUri;

        private Node(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public String getName() {
            return name;
        }

        public Node setDrawable(@NotNull String drawableId, @NotNull String materialId) {
            this.drawableId = Objects.requireNonNull(drawableId, "drawableId");
            this.materialId = Objects.requireNonNull(materialId, "materialId");
            return this;
        }

        public Node setRigidBody(@NotNull String shapeId) {
            this.rigidBodyShapeId = Objects.requireNonNull(shapeId, "shapeId");
            return this;
        }

        public Node setTextItem(@NotNull String text, @NotNull String fontUri) {
            this.text = Objects.requireNonNull(text, "text");
            this.fontUri = Objects.requireNonNull(fontUri, "fontUri");
            return this;
        }

        private Node copy() {
            Node copy = new Node(name);
            copy.drawableId = drawableId;
            copy.materialId = materialId;
            copy.rigidBodyShapeId = rigidBodyShapeId;
            copy.text = text;
            copy.fontUri = fontUri;
            return copy;
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("name", name);
            if (drawableId != null) {
                map.put("drawable", Map.of("drawable", drawableId, "material", materialId));
            }
            if (rigidBodyShapeId != null) {
                map.put("rigid_body", Map.of("polygon", rigidBodyShapeId));
            }
            if (fontUri != null) {
                map.put("text", Map.of("text", text, "font", fontUri));
            }
            return map;
        }
    }
}
