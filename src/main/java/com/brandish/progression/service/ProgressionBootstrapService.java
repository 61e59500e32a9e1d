package com.brandish.progression.service;

import com.brandish.progression.config.ProgressionProperties;
import com.brandish.progression.tree.ProgressionTreeLoader;
import com.brandish.progression.tree.TreeSyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Syncs the tree config on startup, then makes sure a progress cycle and ballot exist.
 */
@Component
public class ProgressionBootstrapService implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ProgressionBootstrapService.class);

    private final ProgressionProperties progressionProperties;
    private final ProgressionTreeLoader progressionTreeLoader;
    private final ProgressionService progressionService;

    public ProgressionBootstrapService(
            ProgressionProperties progressionProperties,
            ProgressionTreeLoader progressionTreeLoader,
            ProgressionService progressionService
    ) {
        this.progressionProperties = progressionProperties;
        this.progressionTreeLoader = progressionTreeLoader;
        this.progressionService = progressionService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!progressionProperties.getTree().isSyncOnStartup()) {
            log.debug("Progression tree sync on startup disabled");
            return;
        }

        TreeSyncResult result = progressionTreeLoader.sync(false);
        if (result.unchanged()) {
            log.debug("Progression tree bootstrap found no config changes");
        }
        try {
            progressionService.initializeProgressionState();
        } catch (RuntimeException ex) {
            log.warn("Progression state initialization failed on startup", ex);
        }
    }
}
