package com.workpipe.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/** Appends one JSON object per dead item to a file. */
public class DlqWriter implements DeadLetterSink {
    private static final Logger log = LoggerFactory.getLogger(DlqWriter.class);
    private static final ObjectMapper M = new ObjectMapper();

    private final Path path;

    public DlqWriter(Path path) {
        this.path = path;
    }

    @Override
    public synchronized void accept(String label) {
        ObjectNode line = M.createObjectNode();
        line.put("label", label);
        line.put("key", WorkItem.normalize(label));
        line.put("deadAt", Instant.now().toString());

        try (BufferedWriter bw = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            bw.write(M.writeValueAsString(line));
            bw.newLine();
        } catch (IOException e) {
            // the item is still counted as dead; only the file record is lost
            log.error("DLQ write failed to {} for {}", path, label, e);
        }
    }

    public Path path() {
        return path;
    }
}
