package com.tyron.gamedit.api.project;

import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Project-level settings of the game being edited.
 * <p>
 * Mutable; the resource cache keeps its own {@link #copy()} as a snapshot.
 */
public final class ProjectSettings {

    public enum WindowMode {
        FULLSCREEN,
        WINDOWED
    }

    private String applicationIdentifier = "";
    private String applicationName = "";
    private String applicationVersion = "";
    private String applicationLibrary = "app://libGameEngine.so";
    private String loadingFont = "app://fonts/ethnocentric rg.otf";
    private String debugFont = "";
    private int multisampleSampleCount = 4;
    private WindowMode windowMode = WindowMode.WINDOWED;
    private int windowWidth = 1024;
    private int windowHeight = 768;
    private boolean windowCanResize = true;
    private boolean windowHasBorder = true;
    private boolean windowVsync = false;
    private int canvasWidth = 1024;
    private int canvasHeight = 768;
    private int ticksPerSecond = 1;
    private int updatesPerSecond = 60;
    private boolean logDebug = false;
    private boolean logInfo = true;
    private boolean logWarn = true;
    private boolean logError = true;

    public ProjectSettings() {
    }

    private ProjectSettings(ProjectSettings other) {
        this.applicationIdentifier = other.applicationIdentifier;
        this.applicationName = other.applicationName;
        this.applicationVersion = other.applicationVersion;
        this.applicationLibrary = other.applicationLibrary;
        this.loadingFont = other.loadingFont;
        this.debugFont = other.debugFont;
        this.multisampleSampleCount = other.multisampleSampleCount;
        this.windowMode = other.windowMode;
        this.windowWidth = other.windowWidth;
        this.windowHeight = other.windowHeight;
        this.windowCanResize = other.windowCanResize;
        this.windowHasBorder = other.windowHasBorder;
        this.windowVsync = other.windowVsync;
        this.canvasWidth = other.canvasWidth;
        this.canvasHeight = other.canvasHeight;
        this.ticksPerSecond = other.ticksPerSecond;
        this.updatesPerSecond = other.updatesPerSecond;
        this.logDebug = other.logDebug;
        this.logInfo = other.logInfo;
        this.logWarn = other.logWarn;
        this.logError = other.logError;
    }

    @NotNull
    public ProjectSettings copy() {
        return new ProjectSettings(this);
    }

    /**
     * @return the settings as an ordered map of plain values, suitable for YAML/JSON output.
     */
    @NotNull
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("application_identifier", applicationIdentifier);
        map.put("application_name", applicationName);
        map.put("application_version", applicationVersion);
        map.put("application_library", applicationLibrary);
        map.put("loading_font", loadingFont);
        map.put("debug_font", debugFont);
        map.put("multisample_sample_count", multisampleSampleCount);
        map.put("window_mode", windowMode.name());
        map.put("window_width", windowWidth);
        map.put("window_height", windowHeight);
        map.put("window_can_resize", windowCanResize);
        map.put("window_has_border", windowHasBorder);
        map.put("window_vsync", windowVsync);
        map.put("canvas_width", canvasWidth);
        map.put("canvas_height", canvasHeight);
        map.put("ticks_per_second", ticksPerSecond);
        map.put("updates_per_second", updatesPerSecond);
        map.put("log_debug", logDebug);
        map.put("log_info", logInfo);
        map.put("log_warn", logWarn);
        map.put("log_error", logError);
        return map;
    }

    public String getApplicationIdentifier() {
        return applicationIdentifier;
    }

    public void setApplicationIdentifier(String applicationIdentifier) {
        this.applicationIdentifier = Objects.requireNonNull(applicationIdentifier);
    }

    public String getApplicationName() {
        return applicationName;
    }

    public void setApplicationName(String applicationName) {
        this.applicationName = Objects.requireNonNull(applicationName);
    }

    public String getApplicationVersion() {
        return applicationVersion;
    }

    public void setApplicationVersion(String applicationVersion) {
        this.applicationVersion = Objects.requireNonNull(applicationVersion);
    }

    public String getApplicationLibrary() {
        return applicationLibrary;
    }

    public void setApplicationLibrary(String applicationLibrary) {
        this.applicationLibrary = Objects.requireNonNull(applicationLibrary);
    }

    public String getLoadingFont() {
        return loadingFont;
    }

    public void setLoadingFont(String loadingFont) {
        this.loadingFont = Objects.requireNonNull(loadingFont);
    }

    public String getDebugFont() {
        return debugFont;
    }

    public void setDebugFont(String debugFont) {
        this.debugFont = Objects.requireNonNull(debugFont);
    }

    public int getMultisampleSampleCount() {
        return multisampleSampleCount;
    }

    public void setMultisampleSampleCount(int multisampleSampleCount) {
        this.multisampleSampleCount = multisampleSampleCount;
    }

    public WindowMode getWindowMode() {
        return windowMode;
    }

    public void setWindowMode(WindowMode windowMode) {
        this.windowMode = Objects.requireNonNull(windowMode);
    }

    public int getWindowWidth() {
        return windowWidth;
    }

    public void setWindowWidth(int windowWidth) {
        this.windowWidth = windowWidth;
    }

    public int getWindowHeight() {
        return windowHeight;
    }

    public void setWindowHeight(int windowHeight) {
        this.windowHeight = windowHeight;
    }

    public boolean isWindowCanResize() {
        return windowCanResize;
    }

    public void setWindowCanResize(boolean windowCanResize) {
        this.windowCanResize = windowCanResize;
    }

    public boolean isWindowHasBorder() {
        return windowHasBorder;
    }

    public void setWindowHasBorder(boolean windowHasBorder) {
        this.windowHasBorder = windowHasBorder;
    }

    public boolean isWindowVsync() {
        return windowVsync;
    }

    public void setWindowVsync(boolean windowVsync) {
        this.windowVsync = windowVsync;
    }

    public int getCanvasWidth() {
        return canvasWidth;
    }

    public void setCanvasWidth(int canvasWidth) {
        this.canvasWidth = canvasWidth;
    }

    public int getCanvasHeight() {
        return canvasHeight;
    }

    public void setCanvasHeight(int canvasHeight) {
        this.canvasHeight = canvasHeight;
    }

    public int getTicksPerSecond() {
        return ticksPerSecond;
    }

    public void setTicksPerSecond(int ticksPerSecond) {
        this.ticksPerSecond = ticksPerSecond;
    }

    public int getUpdatesPerSecond() {
        return updatesPerSecond;
    }

    public void setUpdatesPerSecond(int updatesPerSecond) {
        this.updatesPerSecond = updatesPerSecond;
    }

    public boolean isLogDebug() {
        return logDebug;
    }

    public void setLogDebug(boolean logDebug) {
        this.logDebug = logDebug;
    }

    public boolean isLogInfo() {
        return logInfo;
    }

    public void setLogInfo(boolean logInfo) {
        this.logInfo = logInfo;
    }

    public boolean isLogWarn() {
        return logWarn;
    }

    public void setLogWarn(boolean logWarn) {
        this.logWarn = logWarn;
    }

    public boolean isLogError() {
        return logError;
    }

    public void setLogError(boolean logError) {
        this.logError = logError;
    }
}
