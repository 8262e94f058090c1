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
 * A UI window: widgets, a style file, a key map and the window script.
 * <p>
 * Styles may reference materials by id. Those references are tracked per widget and for the
 * window itself.
 */
public class UiResource extends ContentResource {

    public static final String DEFAULT_KEYMAP = "app://ui/keymap/default.json";

    private String scriptId;
    private String styleUri;
    private String keyMapUri = DEFAULT_KEYMAP;
    private final List<String> windowStyleMaterials = new ArrayList<>();
    private final Map<String, List<String>> widgetStyleMaterials = new LinkedHashMap<>();

    public UiResource(@NotNull String id, @NotNull String name, @NotNull String styleUri) {
        super(ResourceType.UI, id, name);
        this.styleUri = Objects.requireNonNull(styleUri, "styleUri");
    }

    protected UiResource(@NotNull UiResource other) {
        super(other);
        this.scriptId = other.scriptId;
        this.styleUri = other.styleUri;
        this.keyMapUri = other.keyMapUri;
        this.windowStyleMaterials.addAll(other.windowStyleMaterials);
        other.widgetStyleMaterials.forEach((widget, materials) ->
                this.widgetStyleMaterials.put(widget, new ArrayList<>(materials)));
    }

    public UiResource setScriptId(@Nullable String scriptId) {
        this.scriptId = scriptId;
        return this;
    }

    public UiResource setKeyMapUri(@Nullable String keyMapUri) {
        this.keyMapUri = keyMapUri;
        return this;
    }

    public UiResource setStyleUri(@NotNull String styleUri) {
        this.styleUri = Objects.requireNonNull(styleUri, "styleUri");
        return this;
    }

    public UiResource addWindowStyleMaterial(@NotNull String materialId) {
        windowStyleMaterials.add(Objects.requireNonNull(materialId, "materialId"));
        return this;
    }

    public UiResource addWidget(@NotNull String widgetId, @NotNull String... styleMaterialIds) {
        widgetStyleMaterials.put(Objects.requireNonNull(widgetId, "widgetId"), new ArrayList<>(List.of(styleMaterialIds)));
        return this;
    }

    @Override
    protected void collectDependencies(@NotNull Set<String> out) {
        pushBack(out, scriptId);
        for (String materialId : windowStyleMaterials) {
            pushBack(out, materialId);
        }
        for (List<String> materials : widgetStyleMaterials.values()) {
            for (String materialId : materials) {
                pushBack(out, materialId);
            }
        }
    }

    @Override
    protected void collectFiles(@NotNull Set<String> out) {
        pushBack(out, keyMapUri);
        pushBack(out, styleUri);
    }

    @Override
    protected void writeContent(@NotNull Map<String, Object> content) {
        if (scriptId != null) {
            content.put("script_file", scriptId);
        }
        content.put("style", styleUri);
        if (keyMapUri != null) {
            content.put("keymap", keyMapUri);
        }
        content.put("window_style_materials", List.copyOf(windowStyleMaterials));
        Map<String, Object> widgets = new LinkedHashMap<>();
        widgetStyleMaterials.forEach((widget, materials) -> widgets.put(widget, List.copyOf(materials)));
        content.put("widgets", widgets);
    }

    @Override
    public @NotNull UiResource copy() {
        return new UiResource(this);
    }
}
