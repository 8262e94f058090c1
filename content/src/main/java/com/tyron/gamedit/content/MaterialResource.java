package com.tyron.gamedit.content;

import com.tyron.gamedit.api.resource.ResourceType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A surface description: a base color, a set of textures or a custom shader.
 */
public class MaterialResource extends ContentResource {

    public enum MaterialType {
        COLOR,
        TEXTURE,
        SPRITE,
        CUSTOM
    }

    private MaterialType materialType;
    private String baseColor = "White";
    private final List<String> textureUris = new ArrayList<>();
    private final List<String> textFontUris = new ArrayList<>();
    private String shaderUri;

    public MaterialResource(@NotNull String id, @NotNull String name, @NotNull MaterialType materialType) {
        super(ResourceType.MATERIAL, id, name);
        this.materialType = Objects.requireNonNull(materialType, "materialType");
    }

    protected MaterialResource(@NotNull MaterialResource other) {
        super(other);
        this.materialType = other.materialType;
        this.baseColor = other.baseColor;
        this.textureUris.addAll(other.textureUris);
        this.textFontUris.addAll(other.textFontUris);
        this.shaderUri = other.shaderUri;
    }

    public MaterialType getMaterialType() {
        return materialType;
    }

    public void setMaterialType(@NotNull MaterialType materialType) {
        this.materialType = Objects.requireNonNull(materialType, "materialType");
    }

    public String getBaseColor() {
        return baseColor;
    }

    public void setBaseColor(@NotNull String baseColor) {
        this.baseColor = Objects.requireNonNull(baseColor, "baseColor");
    }

    public MaterialResource addTexture(@NotNull String uri) {
        textureUris.add(Objects.requireNonNull(uri, "uri"));
        return this;
    }

    public void removeTexture(@NotNull String uri) {
        textureUris.remove(uri);
    }

    public List<String> getTextureUris() {
        return List.copyOf(textureUris);
    }

    /**
     * Font of a texture generated from a text buffer.
     */
    public MaterialResource addTextFont(@NotNull String uri) {
        textFontUris.add(Objects.requireNonNull(uri, "uri"));
        return this;
    }

    @Nullable
    public String getShaderUri() {
        return shaderUri;
    }

    public void setShaderUri(@Nullable String shaderUri) {
        this.shaderUri = shaderUri;
    }

    @Override
    protected void collectFiles(@NotNull Set<String> out) {
        for (String uri : textureUris) {
            pushBack(out, uri);
        }
        for (String uri : textFontUris) {
            pushBack(out, uri);
        }
        if (materialType == MaterialType.CUSTOM) {
            pushBack(out, shaderUri);
        }
    }

    @Override
    protected void writeContent(@NotNull Map<String, Object> content) {
        content.put("type", materialType.name());
        content.put("color", baseColor);
        content.put("textures", List.copyOf(textureUris));
        content.put("fonts", List.copyOf(textFontUris));
        if (shaderUri != null) {
            content.put("shader", shaderUri);
        }
    }

    @Override
    public @NotNull MaterialResource copy() {
        return new MaterialResource(this);
    }
}
