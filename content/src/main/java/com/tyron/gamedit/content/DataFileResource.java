package com.tyron.gamedit.content;

import com.tyron.gamedit.api.resource.ResourceType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An arbitrary application data file, e.g. tile layer data or a level description.
 */
public class DataFileResource extends ContentResource {

    private String fileUri;
    // resource this data belongs to, if any
    private String ownerId;

    public DataFileResource(@NotNull String id, @NotNull String name, @NotNull String fileUri) {
        super(ResourceType.DATA_FILE, id, name);
        this.fileUri = Objects.requireNonNull(fileUri, "fileUri");
    }

    protected DataFileResource(@NotNull DataFileResource other) {
        super(other);
        this.fileUri = other.fileUri;
        this.ownerId = other.ownerId;
    }

    public String getFileUri() {
        return fileUri;
    }

    public void setFileUri(@NotNull String fileUri) {
        this.fileUri = Objects.requireNonNull(fileUri, "fileUri");
    }

    @Nullable
    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(@Nullable String ownerId) {
        this.ownerId = ownerId;
    }

    @Override
    protected void collectFiles(@NotNull Set<String> out) {
        pushBack(out, fileUri);
    }

    @Override
    protected void writeContent(@NotNull Map<String, Object> content) {
        content.put("uri", fileUri);
        if (ownerId != null) {
            content.put("owner_id", ownerId);
        }
    }

    @Override
    public @NotNull DataFileResource copy() {
        return new DataFileResource(this);
    }
}
