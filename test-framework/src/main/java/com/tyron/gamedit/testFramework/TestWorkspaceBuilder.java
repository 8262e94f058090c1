package com.tyron.gamedit.testFramework;

import com.tyron.gamedit.core.test.MockWorkspace;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A fluent builder to set up workspace directories with content files and configuration.
 */
public class TestWorkspaceBuilder {

    private final MockWorkspace workspace;

    public TestWorkspaceBuilder(File workspaceDir) {
        this.workspace = new MockWorkspace(workspaceDir.getName(), workspaceDir);
    }

    /**
     * Writes a file relative to the workspace root, creating parent directories.
     */
    public TestWorkspaceBuilder withFile(String relativePath, String content) {
        Path path = workspace.getWorkspaceDirectory().toPath().resolve(relativePath);
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    /**
     * Writes gamedit.yaml; picked up by the workspace config loader.
     */
    public TestWorkspaceBuilder withConfigYaml(String yaml) {
        return withFile("gamedit.yaml", yaml);
    }

    public TestWorkspaceBuilder withProperty(String key, String value) {
        workspace.getConfiguration().setProperty(key, value);
        return this;
    }

    public MockWorkspace build() {
        return workspace;
    }
}
