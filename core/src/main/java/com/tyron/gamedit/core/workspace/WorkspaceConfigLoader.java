package com.tyron.gamedit.core.workspace;

import com.tyron.gamedit.api.workspace.Workspace;
import com.tyron.gamedit.core.cache.ResourceCache;
import com.tyron.gamedit.core.concurrent.LaneTaskExecutor;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads workspace configuration from the workspace root (gamedit.yaml / gamedit.yml) into
 * {@link Workspace#getConfiguration()}.
 * <pre>
 * id: my-game
 * properties:
 *   author: someone
 * cache:
 *   lane: resource-cache
 *   maxSubmitPerTick: 64
 *   appHome: /opt/gamedit
 * </pre>
 * The file is optional; a missing or malformed file leaves the configuration untouched.
 */
public final class WorkspaceConfigLoader {

    private static final Logger LOG = Logger.getLogger(WorkspaceConfigLoader.class.getName());

    public static final String ID_KEY = "gamedit.id";
    public static final String PROPERTIES_PREFIX = "gamedit.properties.";

    private final Workspace workspace;

    public WorkspaceConfigLoader(Workspace workspace) {
        this.workspace = Objects.requireNonNull(workspace, "workspace");
    }

    /**
     * @return true if a configuration file was found and applied.
     */
    public boolean load() {
        File root = workspace.getWorkspaceDirectory();
        if (root == null) return false;

        File config = new File(root, "gamedit.yaml");
        if (!config.isFile()) {
            config = new File(root, "gamedit.yml");
        }
        if (!config.isFile()) return false;

        Workspace.WorkspaceConfiguration configuration = workspace.getConfiguration();

        try (InputStream in = Files.newInputStream(config.toPath())) {
            Object doc = new Yaml().load(in);
            if (!(doc instanceof Map<?, ?> map)) {
                LOG.warning("Ignoring workspace configuration, not a mapping. [file='" + config + "']");
                return false;
            }

            // id: string
            Object id = map.get("id");
            if (id != null) {
                configuration.setProperty(ID_KEY, String.valueOf(id));
            }

            // properties: {k: v}
            Object props = map.get("properties");
            if (props instanceof Map<?, ?> propsMap) {
                for (Map.Entry<?, ?> e : propsMap.entrySet()) {
                    if (e.getKey() == null) continue;
                    String value = (e.getValue() != null) ? String.valueOf(e.getValue()) : "";
                    configuration.setProperty(PROPERTIES_PREFIX + e.getKey(), value);
                }
            }

            // cache: {lane, maxSubmitPerTick, appHome}
            Object cache = map.get("cache");
            if (cache instanceof Map<?, ?> cacheMap) {
                copy(cacheMap, "lane", configuration, LaneTaskExecutor.LANE_KEY);
                copy(cacheMap, "maxSubmitPerTick", configuration, ResourceCache.MAX_SUBMIT_PER_TICK_KEY);
                copy(cacheMap, "appHome", configuration, WorkspaceFileResolver.APP_HOME_KEY);
            }
        } catch (IOException | YAMLException e) {
            LOG.log(Level.WARNING, "Failed to read workspace configuration. [file='" + config + "']", e);
            return false;
        }

        LOG.fine(() -> "Loaded workspace configuration. [workspace=" + workspace.getName() + "]");
        return true;
    }

    private static void copy(Map<?, ?> from, String name, Workspace.WorkspaceConfiguration to, String key) {
        Object value = from.get(name);
        if (value != null) {
            to.setProperty(key, String.valueOf(value));
        }
    }
}
