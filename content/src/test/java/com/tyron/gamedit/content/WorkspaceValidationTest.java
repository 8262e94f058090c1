package com.tyron.gamedit.content;

import com.tyron.gamedit.api.resource.ResourceValidity;
import com.tyron.gamedit.api.resource.ValidationReport;
import com.tyron.gamedit.core.cache.CacheLifecycle;
import com.tyron.gamedit.core.storage.MapDbWorkspaceStorage;
import com.tyron.gamedit.testFramework.BaseCacheTest;
import com.tyron.gamedit.testFramework.TestWorkspaceBuilder;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.List;
import java.util.Map;

import static com.google.common.truth.Truth.assertThat;

public class WorkspaceValidationTest extends BaseCacheTest {

    private MaterialResource grass;
    private EntityResource player;
    private SceneResource level;

    @Override
    protected void configureWorkspace(TestWorkspaceBuilder builder) {
        builder.withConfigYaml("""
                        id: blast
                        cache:
                          lane: content-test
                          maxSubmitPerTick: 4
                        """)
                .withFile("textures/grass.png", "png")
                .withFile("scripts/player.lua", "function tick() end")
                .withFile("data/ground.bin", "0101");
    }

    @Override
    protected void beforeEach() {
        for (ContentResource primitive : PrimitiveResources.create()) {
            add(primitive);
        }

        grass = new MaterialResource("m-grass", "Grass", MaterialResource.MaterialType.TEXTURE)
                .addTexture("ws://textures/grass.png");
        ScriptResource script = new ScriptResource("s-player", "player.lua", "ws://scripts/player.lua");
        player = new EntityResource("e-player", "Player").setScriptId("s-player");
        player.addNode("body").setDrawable("_rect", "m-grass");
        DataFileResource groundData = new DataFileResource("d-ground", "ground.bin", "ws://data/ground.bin");
        TilemapResource map = new TilemapResource("map", "World", 32, 32);
        map.addLayer("ground", "d-ground").setRenderPalette("m-grass", PrimitiveResources.colorId("Blue"));
        level = new SceneResource("scene-1", "Level 1")
                .setTilemapId("map")
                .place("player", "e-player", 0, 0);

        add(grass);
        add(script);
        add(player);
        add(groundData);
        add(map);
        add(level);
    }

    @Test
    public void configurationIsAppliedToTheCache() {
        assertThat(executor.getLane()).isEqualTo("content-test");
        assertThat(workspace.getConfiguration().getProperty("gamedit.id")).isEqualTo("blast");
    }

    @Test
    public void completeWorkspaceIsValid() {
        cache.buildCache();
        Map<String, Boolean> verdicts = drainVerdicts();

        assertThat(cache.getLifecycle()).isEqualTo(CacheLifecycle.INITIALIZED);
        assertThat(verdicts).containsExactly(
                "m-grass", true,
                "s-player", true,
                "e-player", true,
                "d-ground", true,
                "map", true,
                "scene-1", true);
    }

    @Test
    public void deletingAMaterialBreaksEverythingAboveIt() {
        cache.buildCache();
        drainVerdicts();

        cache.deleteResource("m-grass");
        Map<String, Boolean> verdicts = drainVerdicts();

        assertThat(verdicts).containsEntry("e-player", false);
        assertThat(verdicts).containsEntry("map", false);
        assertThat(verdicts).containsEntry("scene-1", false);
        assertThat(verdicts).doesNotContainKey("s-player");
        assertThat(cache.getResourceValidity("d-ground")).isEqualTo(ResourceValidity.VALID);
    }

    @Test
    public void missingTextureIsRepairedByWritingItAndReAdding() {
        MaterialResource broken = grass.copy().addTexture("ws://textures/grass_normal.png");
        cache.buildCache();
        drainVerdicts();

        add(broken);
        Map<String, Boolean> verdicts = drainVerdicts();
        assertThat(verdicts).containsEntry("m-grass", false);
        assertThat(verdicts).containsEntry("scene-1", false);

        file("textures/grass_normal.png", "png");
        add(broken);
        verdicts = drainVerdicts();
        assertThat(verdicts).containsEntry("m-grass", true);
        assertThat(verdicts).containsEntry("e-player", true);
        assertThat(verdicts).containsEntry("map", true);
        assertThat(verdicts).containsEntry("scene-1", true);
    }

    @Test
    public void fallbackMaterialRepairsAnEntity() {
        cache.buildCache();
        drainVerdicts();
        cache.deleteResource("m-grass");
        assertThat(drainVerdicts()).containsEntry("e-player", false);

        EntityResource fixed = player.copy();
        fixed.getNodes().get(0).setDrawable("_rect", PrimitiveResources.CHECKERBOARD);
        add(fixed);

        List<ValidationReport> reports = drainReports();
        assertThat(reports).contains(new ValidationReport("e-player", "Player", true));
        // the map still paints with the deleted material
        assertThat(cache.getResourceValidity("map")).isEqualTo(ResourceValidity.INVALID);
    }

    @Test
    public void saveWritesTheThreeWorkspaceFiles() {
        cache.buildCache();
        drainVerdicts();

        cache.saveWorkspace(Map.of("main-window", "maximized"), Map.of("recent", "scene-1"));
        drain();

        File root = workspace.getWorkspaceDirectory();
        assertThat(new File(root, MapDbWorkspaceStorage.CONTENT_DB).isFile()).isTrue();
        assertThat(new File(root, MapDbWorkspaceStorage.PROPERTIES_FILE).isFile()).isTrue();
        assertThat(new File(root, MapDbWorkspaceStorage.USER_PROPERTIES_FILE).isFile()).isTrue();
        // saving never disturbs validity
        assertThat(cache.getResourceValidity("scene-1")).isEqualTo(ResourceValidity.VALID);
    }
}
