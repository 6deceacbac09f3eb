package com.coherenceai.infrastructure.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Publishes the active {@link EngineConfiguration}.
 * <p>
 * Readers take one snapshot per request via {@link #current()} and see either the old or the new
 * configuration, never a mix. A rejected reload leaves the previous snapshot active.
 * </p>
 */
@Slf4j
@Component
public class EngineConfigurationHolder {

    private static final long NOT_TRACKED = -1L;

    private final EngineConfigurationLoader loader;
    private final ResourceLoader resourceLoader;
    private final String location;

    private final AtomicReference<EngineConfiguration> current = new AtomicReference<>();
    private volatile long loadedLastModified = NOT_TRACKED;
    private volatile long rejectedLastModified = NOT_TRACKED;

    public EngineConfigurationHolder(EngineConfigurationLoader loader,
                                     ResourceLoader resourceLoader,
                                     @Value("${engine.config.location:classpath:engine-config.json}") String location) {
        this.loader = loader;
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    /**
     * Initial load. A broken configuration at startup fails the application.
     */
    @PostConstruct
    public void init() {
        reload();
    }

    public EngineConfiguration current() {
        EngineConfiguration configuration = current.get();
        if (configuration == null) {
            throw new IllegalStateException("Engine configuration has not been loaded yet");
        }
        return configuration;
    }

    /**
     * Load and publish the configuration document.
     *
     * @throws InvalidConfigurationException if the document is rejected (previous snapshot stays active)
     */
    public EngineConfiguration reload() {
        Resource resource = resourceLoader.getResource(location);
        long lastModified = lastModifiedOf(resource);
        EngineConfiguration loaded;
        try {
            loaded = loader.load(resource);
        } catch (InvalidConfigurationException e) {
            rejectedLastModified = lastModified;
            log.error("[Config] Rejected engine configuration from {}: {} (keeping version={})",
                    location, e.getMessage(), current.get() != null ? current.get().version() : "none");
            throw e;
        }
        current.set(loaded);
        loadedLastModified = lastModified;
        log.info("[Config] Engine configuration loaded from {}: version={}, rules={}",
                location, loaded.version(), loaded.ruleSet().size());
        return loaded;
    }

    /**
     * Reload only if the document changed since the last successful load.
     *
     * @return true if a new configuration was published
     */
    public boolean reloadIfChanged() {
        long lastModified = lastModifiedOf(resourceLoader.getResource(location));
        if (lastModified == NOT_TRACKED
                || lastModified == loadedLastModified
                || lastModified == rejectedLastModified) {
            return false;
        }
        reload();
        return true;
    }

    private long lastModifiedOf(Resource resource) {
        try {
            return resource.isFile() ? resource.lastModified() : NOT_TRACKED;
        } catch (IOException e) {
            log.debug("[Config] Cannot track modification time of {}: {}", location, e.getMessage());
            return NOT_TRACKED;
        }
    }
}
