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
 * A network of audio elements (file sources, mixers, effects) producing one output stream.
 * <p>
 * Elements reading audio data name the file in their {@value #FILE_ARG} argument.
 */
public class AudioGraphResource extends ContentResource {

    public static final String FILE_ARG = "file";

    private final List<Element> elements = new ArrayList<>();
    private String outputElementId;

    public AudioGraphResource(@NotNull String id, @NotNull String name) {
        super(ResourceType.AUDIO_GRAPH, id, name);
    }

    protected AudioGraphResource(@NotNull AudioGraphResource other) {
        super(other);
        for (Element element : other.elements) {
            this.elements.add(new Element(element.id, element.type, element.args));
        }
        this.outputElementId = other.outputElementId;
    }

    public AudioGraphResource addElement(@NotNull String id, @NotNull String type, @NotNull Map<String, String> args) {
        elements.add(new Element(id, type, args));
        return this;
    }

    public List<Element> getElements() {
        return List.copyOf(elements);
    }

    public void setOutputElementId(String outputElementId) {
        this.outputElementId = outputElementId;
    }

    @Override
    protected void collectFiles(@NotNull Set<String> out) {
        for (Element element : elements) {
            // an element without input file is incomplete but not a broken reference
            pushBack(out, element.args.get(FILE_ARG));
        }
    }

    @Override
    protected void writeContent(@NotNull Map<String, Object> content) {
        List<Map<String, Object>> list = new ArrayList<>(elements.size());
        for (Element element : elements) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("id", element.id);
            map.put("type", element.type);
            map.put("args", new LinkedHashMap<>(element.args));
            list.add(map);
        }
        content.put("elements", list);
        if (outputElementId != null) {
            content.put("output", outputElementId);
        }
    }

    @Override
    public @NotNull AudioGraphResource copy() {
        return new AudioGraphResource(this);
    }

    public static final class Element {
        private final String id;
        private final String type;
        private final Map<String, String> args;

        Element(String id, String type, Map<String, String> args) {
            this.id = Objects.requireNonNull(id, "id");
            this.type = Objects.requireNonNull(type, "type");
            this.args = new LinkedHashMap<>(args);
        }

        public String getId() {
            return id;
        }

        public String getType() {
            return type;
        }

        public Map<String, String> getArgs() {
            return new LinkedHashMap<>(args);
        }
    }
}
