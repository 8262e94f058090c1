package com.tyron.gamedit.core.storage;

import com.tyron.gamedit.api.project.ProjectSettings;
import com.tyron.gamedit.api.resource.Resource;
import com.tyron.gamedit.api.workspace.StorageResult;
import com.tyron.gamedit.api.workspace.WorkspaceStorage;
import org.jetbrains.annotations.NotNull;
import org.mapdb.DB;
import org.mapdb.DBException;
import org.mapdb.DBMaker;
import org.mapdb.HTreeMap;
import org.mapdb.Serializer;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes a workspace to its directory.
 * <ul>
 *     <li>{@value #CONTENT_DB} - MapDB store, resource id -> YAML document of the resource content</li>
 *     <li>{@value #PROPERTIES_FILE} - workspace properties, project settings and resource properties</li>
 *     <li>{@value #USER_PROPERTIES_FILE} - per-user workspace and resource properties</li>
 * </ul>
 * Primitive resources are never written; they are recreated with every workspace.
 */
public final class MapDbWorkspaceStorage implements WorkspaceStorage {

    private static final Logger LOG = Logger.getLogger(MapDbWorkspaceStorage.class.getName());

    public static final String CONTENT_DB = "content.db";
    public static final String PROPERTIES_FILE = "workspace.yaml";
    public static final String USER_PROPERTIES_FILE = ".workspace_private.yaml";

    public static final String CONTENT_MAP = "content";
    public static final String META_MAP = "meta";
    public static final String SAVED_AT_KEY = "savedAtMs";

    private final File workspaceDir;

    public MapDbWorkspaceStorage(@NotNull File workspaceDir) {
        this.workspaceDir = Objects.requireNonNull(workspaceDir, "workspaceDir");
    }

    @Override
    public @NotNull StorageResult save(@NotNull Collection<? extends Resource> resources,
                                       @NotNull ProjectSettings settings,
                                       @NotNull Map<String, Object> workspaceProperties,
                                       @NotNull Map<String, Object> userProperties) {
        if (!workspaceDir.isDirectory() && !workspaceDir.mkdirs()) {
            return StorageResult.failure("Failed to create workspace directory. [dir='" + workspaceDir + "']");
        }

        Yaml yaml = createYaml();

        StorageResult result = saveContent(yaml, resources);
        if (!result.isSuccess()) return result;

        result = saveProperties(yaml, resources, settings, workspaceProperties);
        if (!result.isSuccess()) return result;

        return saveUserProperties(yaml, resources, userProperties);
    }

    private StorageResult saveContent(Yaml yaml, Collection<? extends Resource> resources) {
        File file = new File(workspaceDir, CONTENT_DB);
        DB db;
        try {
            db = DBMaker.fileDB(file)
                    .transactionEnable()
                    .make();
        } catch (DBException e) {
            LOG.log(Level.WARNING, "Failed to open workspace content store", e);
            return StorageResult.failure("Failed to open file. [file='" + file + "']");
        }

        try {
            HTreeMap<String, String> content = db.hashMap(CONTENT_MAP, Serializer.STRING, Serializer.STRING).createOrOpen();
            HTreeMap<String, Long> meta = db.hashMap(META_MAP, Serializer.STRING, Serializer.LONG).createOrOpen();

            Set<String> written = new HashSet<>();
            for (Resource resource : resources) {
                if (resource.isPrimitive()) continue;
                content.put(resource.getId(), yaml.dump(resource.toContent()));
                written.add(resource.getId());
            }
            // drop resources deleted since the previous save
            List<String> stale = new ArrayList<>();
            for (String id : content.keySet()) {
                if (!written.contains(id)) stale.add(id);
            }
            for (String id : stale) {
                content.remove(id);
            }
            meta.put(SAVED_AT_KEY, System.currentTimeMillis());

            db.commit();
            LOG.fine(() -> "Wrote workspace content file. [file='" + file + "', resources=" + written.size() + "]");
            return StorageResult.ok();
        } catch (DBException | YAMLException e) {
            db.rollback();
            LOG.log(Level.WARNING, "Failed to write workspace content", e);
            return StorageResult.failure("Failed to write file. [file='" + file + "']");
        } finally {
            db.close();
        }
    }

    private StorageResult saveProperties(Yaml yaml,
                                         Collection<? extends Resource> resources,
                                         ProjectSettings settings,
                                         Map<String, Object> workspaceProperties) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("workspace", new LinkedHashMap<>(workspaceProperties));
        root.put("project", settings.toMap());

        Map<String, Object> perResource = new LinkedHashMap<>();
        for (Resource resource : resources) {
            if (resource.isPrimitive()) continue;
            perResource.put(resource.getId(), resource.getProperties());
        }
        root.put("resources", perResource);

        return writeYaml(yaml, new File(workspaceDir, PROPERTIES_FILE), root);
    }

    private StorageResult saveUserProperties(Yaml yaml,
                                             Collection<? extends Resource> resources,
                                             Map<String, Object> userProperties) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("user", new LinkedHashMap<>(userProperties));

        Map<String, Object> perResource = new LinkedHashMap<>();
        for (Resource resource : resources) {
            if (resource.isPrimitive()) continue;
            perResource.put(resource.getId(), resource.getUserProperties());
        }
        root.put("resources", perResource);

        return writeYaml(yaml, new File(workspaceDir, USER_PROPERTIES_FILE), root);
    }

    private static StorageResult writeYaml(Yaml yaml, File file, Map<String, Object> root) {
        try (Writer out = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            yaml.dump(root, out);
        } catch (IOException | YAMLException e) {
            LOG.log(Level.WARNING, "Failed to write " + file, e);
            return StorageResult.failure("Failed to open file for writing. [file='" + file + "']");
        }
        LOG.fine(() -> "Wrote workspace properties file. [file='" + file + "']");
        return StorageResult.ok();
    }

    private static Yaml createYaml() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        return new Yaml(options);
    }
}
