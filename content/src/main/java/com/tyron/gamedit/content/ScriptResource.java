package com.tyron.gamedit.content;

import com.tyron.gamedit.api.resource.ResourceType;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A Lua script file registered in the workspace.
 */
public class ScriptResource extends ContentResource {

    private String fileUri;

    public ScriptResource(@NotNull String id, @NotNull String name, @NotNull String fileUri) {
        super(ResourceType.SCRIPT, id, name);
        this.fileUri = Objects.requireNonNull(fileUri, "fileUri");
    }

    protected ScriptResource(@NotNull ScriptResource other) {
        super(other);
        this.fileUri = other.fileUri;
    }

    public String getFileUri() {
        return fileUri;
    }

    public void setFileUri(@NotNull String fileUri) {
        this.fileUri = Objects.requireNonNull(fileUri, "fileUri");
    }

    @Override
    protected void collectFiles(@NotNull Set<String> out) {
        pushBack(out, fileUri);
    }

    @Override
    protected void writeContent(@NotNull Map<String, Object> content) {
        content.put("uri", fileUri);
    }

    @Override
    public @NotNull ScriptResource copy() {
        return new ScriptResource(this);
    }
}
