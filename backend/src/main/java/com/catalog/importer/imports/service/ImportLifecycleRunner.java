package com.catalog.importer.imports.service;

import com.catalog.importer.imports.persistence.ImportJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Jobs are driven by in-process workers, so any job still pending or running at startup was
 * orphaned by a previous process and can never finish.
 */
@Component
public class ImportLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ImportLifecycleRunner.class);
    static final String INTERRUPTED_MESSAGE = "Import interrupted by application restart";

    private final ImportJobRepository repository;

    public ImportLifecycleRunner(ImportJobRepository repository) {
        this.repository = repository;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.debug("Database check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping import job cleanup because database is unreachable");
            return;
        }

        int failed = repository.failUnfinishedJobs(INTERRUPTED_MESSAGE, Instant.now());
        if (failed > 0) {
            log.warn("Marked {} unfinished import job(s) as failed on startup", failed);
        }
    }
}
