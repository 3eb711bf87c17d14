package com.workpipe.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workpipe.engine.DlqWriter;
import com.workpipe.engine.Outcome;
import com.workpipe.engine.PipelineConfig;
import com.workpipe.engine.PipelineEngine;
import com.workpipe.engine.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final ObjectMapper M = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        PipelineConfig cfg = load(args.length > 0 ? args[0] : null);

        PipelineEngine engine = new PipelineEngine(cfg);
        if (cfg.dlqPath != null && !cfg.dlqPath.isBlank()) {
            engine.deadLetterSink(new DlqWriter(Path.of(cfg.dlqPath)));
            log.info("Dead letters   : {}", cfg.dlqPath);
        }

        log.info("Items          : {}", cfg.itemCount);
        log.info("Max retries    : {}", cfg.maxRetries);
        log.info("Worker timeout : {}ms, failure rate {}/10", cfg.workerTimeoutMs, cfg.failureRate);

        Stats stats = engine.run();

        log.info("DONE. Enqueued={}", stats.produced.sum());
        for (Outcome o : Outcome.values()) {
            log.info("  {} = {}", o, stats.count(o));
        }
    }

    static PipelineConfig load(String configPath) throws IOException {
        if (configPath == null) {
            log.info("No config file given, using defaults");
            return new PipelineConfig();
        }
        Path path = Path.of(configPath);
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Config file not found: " + configPath);
        }
        log.info("Config: {}", configPath);
        return M.readValue(path.toFile(), PipelineConfig.class);
    }
}
