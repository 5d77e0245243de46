// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch.journal;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.vigil.core.model.CacheEntry;
import sh.vigil.core.model.ChainEvent;

/**
 * Optional append-only JSON-lines record of every block dispatched to
 * watchers.
 *
 * <p>
 * One line per block:
 * <pre>{@code
 * {"chain":"localnet","finalized":false,"number":12,"hash":"0x..","parentHash":"0x..",
 *  "events":[{"index":0,"section":"swapping","method":"SwapExecuted","data":{...}}]}
 * }</pre>
 *
 * <p>
 * Write failures are logged and do not affect dispatch.
 */
public final class EventJournal implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventJournal.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final EventJournal DISABLED = new EventJournal(null, null);

    private final @Nullable Path path;
    private final @Nullable BufferedWriter writer;
    private final Object lock = new Object();
    private boolean closed;

    private EventJournal(final @Nullable Path path, final @Nullable BufferedWriter writer) {
        this.path = path;
        this.writer = writer;
    }

    /**
     * Opens a journal appending to {@code path}, or a disabled journal when
     * {@code path} is null.
     *
     * @throws UncheckedIOException if the file cannot be opened
     */
    public static EventJournal open(final @Nullable Path path) {
        if (path == null) {
            return DISABLED;
        }
        try {
            final Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            final BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            log.info("Writing event journal to {}", path);
            return new EventJournal(path, writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open event journal " + path, e);
        }
    }

    public static EventJournal disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return writer != null;
    }

    public void append(final String chainId, final boolean finalized, final CacheEntry entry) {
        if (writer == null) {
            return;
        }
        final String line;
        try {
            line = MAPPER.writeValueAsString(toJson(chainId, finalized, entry));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize block #{} for event journal: {}", entry.number(), e.getMessage());
            return;
        }
        synchronized (lock) {
            if (closed) {
                return;
            }
            try {
                writer.write(line);
                writer.newLine();
                writer.flush();
            } catch (IOException e) {
                log.warn("Failed to append to event journal {}: {}", path, e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        if (writer == null) {
            return;
        }
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            try {
                writer.close();
            } catch (IOException e) {
                log.warn("Failed to close event journal {}: {}", path, e.getMessage());
            }
        }
    }

    private static ObjectNode toJson(final String chainId, final boolean finalized, final CacheEntry entry) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("chain", chainId);
        node.put("finalized", finalized);
        node.put("number", entry.number());
        node.put("hash", entry.hash().value());
        node.put("parentHash", entry.header().parentHash().value());
        final ArrayNode events = node.putArray("events");
        for (ChainEvent event : entry.events()) {
            final ObjectNode e = events.addObject();
            e.put("index", event.eventIndex());
            e.put("section", event.sectionName());
            e.put("method", event.methodName());
            e.set("data", event.data());
        }
        return node;
    }
}
