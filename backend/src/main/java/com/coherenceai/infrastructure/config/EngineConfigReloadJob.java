package com.coherenceai.infrastructure.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls the engine configuration document and republishes it when it changes on disk.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngineConfigReloadJob {

    private final EngineConfigurationHolder holder;

    @Scheduled(fixedDelayString = "${engine.config.reload-interval-ms:30000}")
    public void reloadIfChanged() {
        try {
            if (holder.reloadIfChanged()) {
                log.info("[Config] Hot reload applied");
            }
        } catch (InvalidConfigurationException e) {
            log.warn("[Config] Hot reload skipped, previous configuration remains active");
        }
    }
}
