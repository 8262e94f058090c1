package com.tyron.gamedit.core.storage;

import com.tyron.gamedit.api.project.ProjectSettings;
import com.tyron.gamedit.api.resource.Resource;
import com.tyron.gamedit.api.workspace.StorageResult;
import com.tyron.gamedit.core.test.MockResource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.HTreeMap;
import org.mapdb.Serializer;
import org.yaml.snakeyaml.Yaml;

import java.io.File;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class MapDbWorkspaceStorageTest {

    @TempDir
    Path dir;

    @Test
    public void testWritesThreeFilesAndSkipsPrimitives() throws Exception {
        MockResource material = new MockResource("mat-1").setName("Grass").dependsOn("tex").references("ws://grass.png");
        material.setProperty("color", "green");
        material.setUserProperty("collapsed", true);
        MockResource primitive = MockResource.primitive("_checkerboard");

        ProjectSettings settings = new ProjectSettings();
        settings.setApplicationName("Blast");

        MapDbWorkspaceStorage storage = new MapDbWorkspaceStorage(dir.toFile());
        StorageResult result = storage.save(List.<Resource>of(material, primitive), settings,
                Map.of("main-window", "maximized"), Map.of("recent", "mat-1"));

        Assertions.assertTrue(result.isSuccess(), String.valueOf(result));

        Map<String, String> content = readContent();
        Assertions.assertEquals(1, content.size());
        Map<String, Object> doc = new Yaml().load(content.get("mat-1"));
        Assertions.assertEquals("Grass", doc.get("name"));
        Assertions.assertEquals(List.of("tex"), doc.get("dependencies"));

        Map<String, Object> props = loadYaml(MapDbWorkspaceStorage.PROPERTIES_FILE);
        Assertions.assertEquals(Map.of("main-window", "maximized"), props.get("workspace"));
        Assertions.assertEquals("Blast", ((Map<?, ?>) props.get("project")).get("application_name"));
        Map<?, ?> resources = (Map<?, ?>) props.get("resources");
        Assertions.assertEquals(Map.of("color", "green"), resources.get("mat-1"));
        Assertions.assertFalse(resources.containsKey("_checkerboard"));

        Map<String, Object> user = loadYaml(MapDbWorkspaceStorage.USER_PROPERTIES_FILE);
        Assertions.assertEquals(Map.of("recent", "mat-1"), user.get("user"));
        Assertions.assertEquals(Map.of("collapsed", true), ((Map<?, ?>) user.get("resources")).get("mat-1"));
    }

    @Test
    public void testDeletedResourcesAreDroppedOnNextSave() throws Exception {
        MapDbWorkspaceStorage storage = new MapDbWorkspaceStorage(dir.toFile());
        ProjectSettings settings = new ProjectSettings();

        Assertions.assertTrue(storage.save(List.of(new MockResource("a"), new MockResource("b")),
                settings, Map.of(), Map.of()).isSuccess());
        Assertions.assertEquals(2, readContent().size());

        Assertions.assertTrue(storage.save(List.of(new MockResource("b")),
                settings, Map.of(), Map.of()).isSuccess());
        Assertions.assertEquals(List.of("b"), List.copyOf(readContent().keySet()));
    }

    @Test
    public void testUnwritableDirectoryIsAFailureValue() throws Exception {
        File blocker = dir.resolve("not-a-dir").toFile();
        Files.writeString(blocker.toPath(), "file in the way");

        StorageResult result = new MapDbWorkspaceStorage(new File(blocker, "ws"))
                .save(List.of(new MockResource("a")), new ProjectSettings(), Map.of(), Map.of());

        Assertions.assertFalse(result.isSuccess());
        Assertions.assertNotNull(result.getMessage());
    }

    private Map<String, String> readContent() {
        DB db = DBMaker.fileDB(dir.resolve(MapDbWorkspaceStorage.CONTENT_DB).toFile())
                .transactionEnable()
                .make();
        try {
            HTreeMap<String, String> map = db.hashMap(MapDbWorkspaceStorage.CONTENT_MAP, Serializer.STRING, Serializer.STRING).createOrOpen();
            return new TreeMap<>(map);
        } finally {
            db.close();
        }
    }

    private Map<String, Object> loadYaml(String name) throws Exception {
        try (InputStream in = Files.newInputStream(dir.resolve(name))) {
            return new Yaml().load(in);
        }
    }
}
