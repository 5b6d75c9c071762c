package com.shortspilot.orchestrator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.shortspilot.orchestrator.model.QuotaLedgerEntry;
import com.shortspilot.orchestrator.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link TrackingStore} backed by a single JSON document on local disk.
 *
 * Layout:
 * <pre>
 * {
 *   "formatVersion": 1,
 *   "items":  { "&lt;id&gt;": { ...WorkItem... } },
 *   "ledger": { "2026-10-19": { "date": ..., "consumedUnits": ..., "dailyBudget": ..., "version": ... } }
 * }
 * </pre>
 *
 * Every read goes to disk, so two processes sharing the file always compare
 * versions against what is actually persisted. {@link #commit()} holds an
 * exclusive lock on a sidecar {@code .lock} file while it re-reads, verifies,
 * merges and replaces the document; the new content is written to a temporary
 * file, forced to disk and renamed over the old one, so a crash leaves either
 * the previous or the new document.
 *
 * Item records that fail to parse are reported and left out of {@link #load()},
 * but their raw JSON is carried over unchanged on every commit.
 *
 * Ledger entries are counters rather than versioned records: commit applies the
 * staged delta to the entry it reads under the lock and clamps the result to
 * {@code [0, dailyBudget]}.
 */
public class JsonFileTrackingStore implements TrackingStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileTrackingStore.class);

    static final int FORMAT_VERSION = 1;

    private static final String ITEMS  = "items";
    private static final String LEDGER = "ledger";

    private final Path         file;
    private final Path         tempFile;
    private final Path         lockFile;
    private final ObjectMapper json;
    private final Clock        clock;

    // Staged changes, written by the next commit().
    private final Map<String, WorkItem>              stagedItems  = new LinkedHashMap<>();
    private final Map<LocalDate, LedgerDelta>        stagedLedger = new LinkedHashMap<>();

    private Set<String> corruptIds = Set.of();

    public JsonFileTrackingStore(Path file, ObjectMapper objectMapper, Clock clock) {
        this.file     = file.toAbsolutePath();
        this.tempFile = this.file.resolveSibling(this.file.getFileName() + ".tmp");
        this.lockFile = this.file.resolveSibling(this.file.getFileName() + ".lock");
        this.clock    = clock;
        this.json     = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getFile() { return file; }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Override
    public synchronized Map<String, WorkItem> load() {
        ObjectNode doc = readDocument();
        Map<String, WorkItem> items   = new LinkedHashMap<>();
        Set<String>           corrupt = new LinkedHashSet<>();

        Iterator<Map.Entry<String, JsonNode>> fields = section(doc, ITEMS).fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            try {
                WorkItem item = json.treeToValue(e.getValue(), WorkItem.class);
                if (item.getStatus() == null || !e.getKey().equals(item.getId())) {
                    throw new IllegalArgumentException("id/status mismatch");
                }
                items.put(e.getKey(), item);
            } catch (JsonProcessingException | IllegalArgumentException ex) {
                log.error("Tracking record '{}' is unreadable and will be skipped: {}",
                        e.getKey(), ex.getMessage());
                corrupt.add(e.getKey());
            }
        }
        corruptIds = Collections.unmodifiableSet(corrupt);
        return items;
    }

    @Override
    public synchronized Optional<WorkItem> find(String id) {
        return Optional.ofNullable(load().get(id));
    }

    @Override
    public synchronized Set<String> corruptRecordIds() {
        return corruptIds;
    }

    @Override
    public synchronized Optional<QuotaLedgerEntry> ledgerEntry(LocalDate date) {
        return readLedgerEntry(readDocument(), date);
    }

    @Override
    public synchronized long stagedLedgerDelta(LocalDate date) {
        LedgerDelta staged = stagedLedger.get(date);
        return staged == null ? 0 : staged.units();
    }

    // ------------------------------------------------------------------
    // Staging
    // ------------------------------------------------------------------

    @Override
    public synchronized void upsert(WorkItem item) {
        checkItemVersion(readDocument(), item);
        item.setUpdatedAt(clock.instant());
        stagedItems.put(item.getId(), item);
    }

    @Override
    public synchronized void verifyCurrent(WorkItem item) {
        checkItemVersion(readDocument(), item);
    }

    @Override
    public synchronized void stageLedgerDelta(LocalDate date, long dailyBudget, long units) {
        stagedLedger.merge(date, new LedgerDelta(dailyBudget, units),
                (a, b) -> new LedgerDelta(b.dailyBudget(), a.units() + b.units()));
    }

    @Override
    public synchronized void discard() {
        stagedItems.clear();
        stagedLedger.clear();
    }

    // ------------------------------------------------------------------
    // Commit
    // ------------------------------------------------------------------

    @Override
    public synchronized void commit() {
        if (stagedItems.isEmpty() && stagedLedger.isEmpty()) return;

        try {
            createParentDirectories();
            try (FileChannel lockChannel = FileChannel.open(lockFile,
                         StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = lockChannel.lock()) {

                ObjectNode doc = readDocument();
                for (WorkItem item : stagedItems.values()) {
                    checkItemVersion(doc, item);
                }

                doc.put("formatVersion", FORMAT_VERSION);
                ObjectNode items = section(doc, ITEMS);
                for (WorkItem item : stagedItems.values()) {
                    ObjectNode node = json.valueToTree(item);
                    node.put("version", item.getVersion() + 1);
                    items.set(item.getId(), node);
                }
                ObjectNode ledger = section(doc, LEDGER);
                for (Map.Entry<LocalDate, LedgerDelta> e : stagedLedger.entrySet()) {
                    if (e.getValue().units() == 0) continue;
                    QuotaLedgerEntry updated = applyDelta(doc, e.getKey(), e.getValue());
                    ledger.set(e.getKey().toString(), json.valueToTree(updated));
                }

                writeAtomically(doc);
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Could not commit tracking store " + file, e);
        }

        stagedItems.values().forEach(item -> item.setVersion(item.getVersion() + 1));
        log.debug("Committed {} item(s) and {} ledger delta(s) to {}",
                stagedItems.size(), stagedLedger.size(), file);
        stagedItems.clear();
        stagedLedger.clear();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ObjectNode readDocument() {
        if (!Files.exists(file)) {
            return emptyDocument();
        }
        JsonNode root;
        try {
            byte[] bytes = Files.readAllBytes(file);
            root = json.readTree(bytes);
        } catch (JsonProcessingException e) {
            throw new StoreCorruptException("Tracking store " + file + " is not valid JSON", e);
        } catch (IOException e) {
            throw new StoreUnavailableException("Could not read tracking store " + file, e);
        }
        if (!(root instanceof ObjectNode doc)) {
            throw new StoreCorruptException("Tracking store " + file + " is not a JSON object", null);
        }
        int format = doc.path("formatVersion").asInt(FORMAT_VERSION);
        if (format > FORMAT_VERSION) {
            throw new StoreCorruptException(
                    "Tracking store " + file + " has unsupported formatVersion " + format, null);
        }
        for (String section : new String[] {ITEMS, LEDGER}) {
            JsonNode node = doc.get(section);
            if (node != null && !node.isObject()) {
                throw new StoreCorruptException(
                        "Tracking store " + file + ": '" + section + "' must be an object", null);
            }
        }
        return doc;
    }

    private ObjectNode emptyDocument() {
        ObjectNode doc = json.createObjectNode();
        doc.put("formatVersion", FORMAT_VERSION);
        doc.putObject(ITEMS);
        doc.putObject(LEDGER);
        return doc;
    }

    private static ObjectNode section(ObjectNode doc, String name) {
        JsonNode node = doc.get(name);
        return node instanceof ObjectNode obj ? obj : doc.putObject(name);
    }

    /** Version 0 means "new": the record must not exist yet. */
    private static void checkItemVersion(ObjectNode doc, WorkItem item) {
        JsonNode persisted = section(doc, ITEMS).get(item.getId());
        checkVersion("item " + item.getId(), persisted, item.getVersion());
    }

    private static void checkVersion(String key, JsonNode persisted, long expected) {
        if (persisted == null) {
            if (expected != 0) throw new StaleWriteException(key, expected, 0);
            return;
        }
        long actual = persisted.path("version").asLong(0);
        if (expected == 0 || actual != expected) {
            throw new StaleWriteException(key, expected, actual);
        }
    }

    private Optional<QuotaLedgerEntry> readLedgerEntry(ObjectNode doc, LocalDate date) {
        JsonNode node = section(doc, LEDGER).get(date.toString());
        if (node == null) return Optional.empty();
        try {
            return Optional.of(json.treeToValue(node, QuotaLedgerEntry.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StoreCorruptException("Quota ledger entry for " + date + " is unreadable", e);
        }
    }

    private QuotaLedgerEntry applyDelta(ObjectNode doc, LocalDate date, LedgerDelta delta) {
        QuotaLedgerEntry current = readLedgerEntry(doc, date)
                .orElseGet(() -> QuotaLedgerEntry.fresh(date, delta.dailyBudget()));
        long consumed = current.consumedUnits() + delta.units();
        if (consumed > current.dailyBudget()) {
            log.warn("Quota ledger for {} overdrawn by a concurrent writer: {} > {}; capping",
                    date, consumed, current.dailyBudget());
            consumed = current.dailyBudget();
        }
        return current.withConsumed(Math.max(0, consumed)).withVersion(current.version() + 1);
    }

    private void createParentDirectories() throws IOException {
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private void writeAtomically(ObjectNode doc) throws IOException {
        byte[] bytes = json.writeValueAsBytes(doc);
        try (FileChannel out = FileChannel.open(tempFile,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            while (buf.hasRemaining()) {
                out.write(buf);
            }
            out.force(true);
        }
        try {
            Files.move(tempFile, file,
                    StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename not supported for {}; falling back to plain replace", file);
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private record LedgerDelta(long dailyBudget, long units) {}
}
