package com.tyron.gamedit.content;

import com.tyron.gamedit.api.resource.ResourceType;
import com.tyron.gamedit.api.resource.ResourceValidity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.google.common.truth.Truth.assertThat;

public class ContentResourceTest {

    @Test
    public void entityListsScriptsDrawablesMaterialsAndShapes() {
        EntityResource entity = new EntityResource("e1", "Player")
                .setScriptId("s-player")
                .addAnimatorScript("s-anim");
        entity.addNode("body").setDrawable("_rect", "m-skin").setRigidBody("shape-hull");
        entity.addNode("label").setTextItem("HP", "app://fonts/ARCADE.TTF");

        assertThat(entity.getType()).isEqualTo(ResourceType.ENTITY);
        assertThat(entity.listDependencies())
                .containsExactly("s-player", "s-anim", "m-skin", "_rect", "shape-hull").inOrder();
        assertThat(entity.collectFileReferences()).containsExactly("app://fonts/ARCADE.TTF");
    }

    @Test
    public void sceneListsScriptTilemapAndPlacedEntities() {
        SceneResource scene = new SceneResource("scene", "Level 1")
                .setScriptId("s-level")
                .setTilemapId("map")
                .place("player", "e1", 0, 0)
                .place("enemy", "e2", 10, 0)
                .place("enemy2", "e2", 20, 0);

        assertThat(scene.listDependencies()).containsExactly("s-level", "map", "e1", "e2").inOrder();
        assertThat(scene.collectFileReferences()).isEmpty();
    }

    @Test
    public void tilemapPaletteOnlyCountsForRenderLayers() {
        TilemapResource map = new TilemapResource("map", "World", 64, 64);
        map.addLayer("ground", "data-ground").setRenderPalette("m-grass", "m-water");
        map.addLayer("collision", "data-collision").setRenderPalette("m-debug").setRender(false);

        assertThat(map.listDependencies())
                .containsExactly("data-ground", "m-grass", "m-water", "data-collision").inOrder();
    }

    @Test
    public void softMaterialPropertyIsADependency() {
        ShapeResource shape = new ShapeResource("hull", "Hull").addVertex(0, 0).addVertex(1, 0).addVertex(0, 1);
        assertThat(shape.listDependencies()).isEmpty();

        shape.setMaterial("m-debug");
        assertThat(shape.listDependencies()).containsExactly("m-debug");

        ParticleSystemResource particles = new ParticleSystemResource("fx", "Sparks").setMaterial("_Gold");
        assertThat(particles.listDependencies()).containsExactly("_Gold");
    }

    @Test
    public void blankReferencesAreSkipped() {
        AudioGraphResource graph = new AudioGraphResource("music", "Music")
                .addElement("src", "FileSource", Map.of(AudioGraphResource.FILE_ARG, "ws://audio/theme.ogg"))
                .addElement("empty", "FileSource", Map.of(AudioGraphResource.FILE_ARG, ""))
                .addElement("mix", "Mixer", Map.of("gain", "0.5"));
        UiResource ui = new UiResource("ui", "Main Menu", "ws://ui/style.json").setKeyMapUri(null).setScriptId(" ");

        assertThat(graph.collectFileReferences()).containsExactly("ws://audio/theme.ogg");
        assertThat(ui.collectFileReferences()).containsExactly("ws://ui/style.json");
        assertThat(ui.listDependencies()).isEmpty();
    }

    @Test
    public void customMaterialReadsItsShader() {
        MaterialResource material = new MaterialResource("m", "Water", MaterialResource.MaterialType.CUSTOM)
                .addTexture("ws://textures/water.png");
        material.setShaderUri("ws://shaders/water.glsl");

        assertThat(material.collectFileReferences())
                .containsExactly("ws://textures/water.png", "ws://shaders/water.glsl").inOrder();

        material.setMaterialType(MaterialResource.MaterialType.TEXTURE);
        assertThat(material.collectFileReferences()).containsExactly("ws://textures/water.png");
    }

    @Test
    public void primitiveReportsNothing() {
        DrawableResource rect = new DrawableResource("_rect", "2D Rectangle", "Rectangle");
        MaterialResource checker = new MaterialResource("_checkerboard", "Checkerboard", MaterialResource.MaterialType.TEXTURE)
                .addTexture("app://textures/Checkerboard.png");
        checker.setPrimitive(true);
        rect.setPrimitive(true);

        assertThat(checker.collectFileReferences()).isEmpty();
        assertThat(rect.listDependencies()).isEmpty();
    }

    @Test
    public void copyIsIndependent() {
        EntityResource original = new EntityResource("e1", "Player");
        original.addNode("body").setDrawable("_rect", "m1");
        ResourceValidity.store(original, ResourceValidity.VALID);
        original.setUserProperty("expanded", true);

        EntityResource copy = original.copy();
        copy.addNode("extra").setDrawable("_circle", "m2");
        copy.setName("Renamed");
        ResourceValidity.clear(copy);

        assertThat(copy.getId()).isEqualTo("e1");
        assertThat(original.getName()).isEqualTo("Player");
        assertThat(original.listDependencies()).containsExactly("m1", "_rect");
        assertThat(ResourceValidity.of(original)).isEqualTo(ResourceValidity.VALID);
        assertThat(copy.getUserProperties()).containsEntry("expanded", true);
    }

    @Test
    public void contentIsPlainData() {
        SceneResource scene = new SceneResource("scene", "Level").setTilemapId("map").place("p", "e1", 1.5, 2);

        Map<String, Object> content = scene.toContent();

        assertThat(content).containsEntry("resource_id", "scene");
        assertThat(content).containsEntry("resource_type", "SCENE");
        assertThat(content).containsEntry("tilemap", "map");
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> nodes = (List<Map<String, Object>>) content.get("nodes");
        assertThat(nodes).hasSize(1);
        assertThat(nodes.get(0)).containsEntry("position", List.of(1.5, 2.0));
    }
}
