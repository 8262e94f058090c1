package com.tyron.gamedit.content;

import com.tyron.gamedit.api.resource.Resource;
import com.tyron.gamedit.api.resource.ResourceType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Base class of the editor's resource kinds.
 * <p>
 * Owns the identity and both property bags. Subclasses only describe their own content:
 * which resources they refer to ({@link #collectDependencies(Set)}), which files they read
 * ({@link #collectFiles(Set)}) and how they serialize ({@link #writeContent(Map)}).
 * Primitive instances report neither dependencies nor files.
 */
public abstract class ContentResource implements Resource {

    private final String id;
    private final ResourceType type;
    private String name;
    private boolean primitive;

    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final Map<String, Object> userProperties = new LinkedHashMap<>();

    protected ContentResource(@NotNull ResourceType type, @NotNull String id, @NotNull String name) {
        this.type = Objects.requireNonNull(type, "type");
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Copy constructor for {@link #copy()} implementations.
     */
    protected ContentResource(@NotNull ContentResource other) {
        this(other.type, other.id, other.name);
        this.primitive = other.primitive;
        this.properties.putAll(other.properties);
        this.userProperties.putAll(other.userProperties);
    }

    @Override
    public @NotNull String getId() {
        return id;
    }

    @Override
    public @NotNull String getName() {
        return name;
    }

    public void setName(@NotNull String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public @NotNull ResourceType getType() {
        return type;
    }

    @Override
    public boolean isPrimitive() {
        return primitive;
    }

    public void setPrimitive(boolean primitive) {
        this.primitive = primitive;
    }

    @Override
    public final @NotNull Set<String> listDependencies() {
        if (primitive) {
            return Set.of();
        }
        Set<String> out = new LinkedHashSet<>();
        collectDependencies(out);
        return Collections.unmodifiableSet(out);
    }

    @Override
    public final @NotNull Set<String> collectFileReferences() {
        if (primitive) {
            return Set.of();
        }
        Set<String> out = new LinkedHashSet<>();
        collectFiles(out);
        return Collections.unmodifiableSet(out);
    }

    protected void collectDependencies(@NotNull Set<String> out) {
    }

    protected void collectFiles(@NotNull Set<String> out) {
    }

    @Override
    public boolean hasProperty(@NotNull String key) {
        return properties.containsKey(key);
    }

    @Override
    public @Nullable Object getProperty(@NotNull String key) {
        return properties.get(key);
    }

    @Nullable
    public String getStringProperty(@NotNull String key) {
        Object value = properties.get(key);
        return value != null ? value.toString() : null;
    }

    @Override
    public void setProperty(@NotNull String key, @NotNull Object value) {
        properties.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    @Override
    public void deleteProperty(@NotNull String key) {
        properties.remove(key);
    }

    @Override
    public @NotNull Map<String, Object> getProperties() {
        return new LinkedHashMap<>(properties);
    }

    public void setUserProperty(@NotNull String key, @NotNull Object value) {
        userProperties.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    @Override
    public @NotNull Map<String, Object> getUserProperties() {
        return new LinkedHashMap<>(userProperties);
    }

    @Override
    public final @NotNull Map<String, Object> toContent() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("resource_id", id);
        content.put("resource_name", name);
        content.put("resource_type", type.name());
        writeContent(content);
        return content;
    }

    /**
     * Adds the kind specific fields. Values must be plain strings, numbers, booleans, lists or maps.
     */
    protected abstract void writeContent(@NotNull Map<String, Object> content);

    @Override
    public abstract @NotNull ContentResource copy();

    /**
     * Adds {@code value} unless it is null or blank; unset references are not references.
     */
    protected static void pushBack(@NotNull Set<String> out, @Nullable String value) {
        if (value != null && !value.isBlank()) {
            out.add(value);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + id + ", name=" + name + "]";
    }
}
