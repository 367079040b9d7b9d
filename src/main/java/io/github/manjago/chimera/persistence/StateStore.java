package io.github.manjago.chimera.persistence;

import io.github.manjago.chimera.coverage.CoverageRecord;
import io.github.manjago.chimera.coverage.CoverageUnit;
import io.github.manjago.chimera.coverage.Location;
import io.github.manjago.chimera.exec.SiteResult;
import io.github.manjago.chimera.exec.Verdict;
import io.github.manjago.chimera.incremental.FormDigest;
import io.github.manjago.chimera.scan.MutationSite;
import io.github.manjago.chimera.syntax.Coordinate;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.h2.mvstore.MVStoreException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Engine state kept between runs, in an H2 MVStore file.
 * <p>
 * Structure:
 * <ul>
 *   <li>"meta": format version</li>
 *   <li>"units": coverage unit id → serialized unit (dependency hash, tests, records)</li>
 *   <li>"digests": form id → serialized {@link FormDigest}</li>
 *   <li>"results": form id → serialized site results of that form</li>
 * </ul>
 */
public final class StateStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    private static final int VERSION = 1;

    private static final String KEY_VERSION = "version";

    private final Path path;
    private final MVStore store;
    private final MVMap<String, Long> meta;
    private final MVMap<String, byte[]> units;
    private final MVMap<String, byte[]> digests;
    private final MVMap<String, byte[]> results;

    private StateStore(Path path, MVStore store) throws StateStoreException {
        this.path = path;
        this.store = store;
        this.meta = store.openMap("meta");
        this.units = store.openMap("units");
        this.digests = store.openMap("digests");
        this.results = store.openMap("results");

        long version = meta.getOrDefault(KEY_VERSION, 0L);
        if (version == 0L) {
            meta.put(KEY_VERSION, (long) VERSION);
        } else if (version > VERSION) {
            throw new StateStoreException("Unsupported state version: " + version);
        }
    }

    /**
     * Open (or create) the state file.
     */
    public static StateStore open(Path path) throws StateStoreException {
        MVStore store;
        try {
            store = new MVStore.Builder()
                    .fileName(path.toString())
                    .compress()
                    .open();
        } catch (MVStoreException e) {
            throw new StateStoreException("Cannot open state file " + path, e);
        }
        try {
            StateStore state = new StateStore(path, store);
            log.debug("Opened state {}: {} units, {} forms", path, state.units.size(), state.digests.size());
            return state;
        } catch (StateStoreException | RuntimeException e) {
            store.closeImmediately();
            throw e;
        }
    }

    /**
     * Store kept in memory only; nothing survives {@link #close()}.
     */
    public static StateStore inMemory() {
        try {
            return new StateStore(Paths.get(":memory:"), new MVStore.Builder().open());
        } catch (StateStoreException e) {
            throw new IllegalStateException(e);
        }
    }

    public Path getPath() {
        return path;
    }

    // ========== Coverage units ==========

    public Map<String, CoverageUnit> loadUnits() throws StateStoreException {
        Map<String, CoverageUnit> result = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> e : units.entrySet()) {
            result.put(e.getKey(), decode(e.getKey(), e.getValue(), StateStore::readUnit));
        }
        return result;
    }

    /**
     * Replace the stored units with {@code current}; units not listed are dropped.
     */
    public void saveUnits(Collection<CoverageUnit> current) {
        Set<String> keep = new HashSet<>();
        for (CoverageUnit unit : current) {
            keep.add(unit.unitId());
            units.put(unit.unitId(), encode(out -> writeUnit(out, unit)));
        }
        removeAllBut(units, keep);
    }

    // ========== Form digests ==========

    public Map<String, FormDigest> loadDigests() throws StateStoreException {
        Map<String, FormDigest> result = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> e : digests.entrySet()) {
            result.put(e.getKey(), decode(e.getKey(), e.getValue(), StateStore::readDigest));
        }
        return result;
    }

    public void saveDigests(Collection<FormDigest> current) {
        Set<String> keep = new HashSet<>();
        for (FormDigest digest : current) {
            keep.add(digest.formId());
            digests.put(digest.formId(), encode(out -> writeDigest(out, digest)));
        }
        removeAllBut(digests, keep);
    }

    // ========== Site results ==========

    public List<SiteResult> loadResults(String formId) throws StateStoreException {
        byte[] data = results.get(formId);
        if (data == null) {
            return List.of();
        }
        return decode(formId, data, StateStore::readResults);
    }

    public void saveResults(String formId, List<SiteResult> formResults) {
        results.put(formId, encode(out -> writeResults(out, formResults)));
    }

    public void removeForm(String formId) {
        results.remove(formId);
        digests.remove(formId);
    }

    // ========== Lifecycle ==========

    public void commit() {
        store.commit();
    }

    /**
     * One-line summary for diagnostics.
     */
    public String describe() {
        return String.format("State v%d: %d coverage units, %d forms, %d forms with results",
                meta.getOrDefault(KEY_VERSION, 0L), units.size(), digests.size(), results.size());
    }

    public int unitCount() {
        return units.size();
    }

    public int formCount() {
        return digests.size();
    }

    @Override
    public void close() {
        store.close();
    }

    private static void removeAllBut(MVMap<String, byte[]> map, Set<String> keep) {
        List<String> stale = new ArrayList<>();
        for (String key : map.keySet()) {
            if (!keep.contains(key)) {
                stale.add(key);
            }
        }
        stale.forEach(map::remove);
    }

    // ========== Serialization ==========

    @FunctionalInterface
    private interface Writer {
        void write(DataOutputStream out) throws IOException;
    }

    @FunctionalInterface
    private interface Reader<T> {
        T read(DataInputStream in) throws IOException;
    }

    private static byte[] encode(Writer writer) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream out = new DataOutputStream(baos)) {
            writer.write(out);
            out.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            // in-memory stream
            throw new IllegalStateException(e);
        }
    }

    private static <T> T decode(String key, byte[] data, Reader<T> reader) throws StateStoreException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
            return reader.read(in);
        } catch (IOException | IllegalArgumentException e) {
            throw new StateStoreException("Corrupt state entry " + key + ": " + e.getMessage(), e);
        }
    }

    private static void writeUnit(DataOutputStream out, CoverageUnit unit) throws IOException {
        writeText(out, unit.unitId());
        writeText(out, unit.dependencyHash());
        out.writeInt(unit.testIds().size());
        for (String test : unit.testIds()) {
            writeText(out, test);
        }
        out.writeInt(unit.records().size());
        for (CoverageRecord record : unit.records()) {
            writeText(out, record.testId());
            out.writeInt(record.locations().size());
            for (Location location : record.locations()) {
                writeText(out, location.formId());
                writeText(out, location.coordinate().toString());
            }
        }
    }

    private static CoverageUnit readUnit(DataInputStream in) throws IOException {
        String unitId = readText(in);
        String hash = readText(in);
        int testCount = in.readInt();
        List<String> tests = new ArrayList<>(testCount);
        for (int i = 0; i < testCount; i++) {
            tests.add(readText(in));
        }
        int recordCount = in.readInt();
        List<CoverageRecord> records = new ArrayList<>(recordCount);
        for (int i = 0; i < recordCount; i++) {
            String testId = readText(in);
            int locationCount = in.readInt();
            Set<Location> locations = new HashSet<>();
            for (int j = 0; j < locationCount; j++) {
                locations.add(new Location(readText(in), Coordinate.parse(readText(in))));
            }
            records.add(new CoverageRecord(testId, locations));
        }
        return new CoverageUnit(unitId, hash, tests, records);
    }

    private static void writeDigest(DataOutputStream out, FormDigest digest) throws IOException {
        writeText(out, digest.formId());
        writeText(out, digest.file());
        writeText(out, digest.digest());
    }

    private static FormDigest readDigest(DataInputStream in) throws IOException {
        return new FormDigest(readText(in), readText(in), readText(in));
    }

    private static void writeResults(DataOutputStream out, List<SiteResult> formResults) throws IOException {
        out.writeInt(formResults.size());
        for (SiteResult result : formResults) {
            writeSite(out, result.site());
            writeText(out, result.verdict().name());
            writeOptional(out, result.killingTest());
            writeText(out, result.detail());
            writeOptional(out, result.representativeId());
            out.writeLong(result.durationMs());
        }
    }

    private static List<SiteResult> readResults(DataInputStream in) throws IOException {
        int count = in.readInt();
        List<SiteResult> list = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            MutationSite site = readSite(in);
            Verdict verdict = Verdict.valueOf(readText(in));
            String killingTest = readOptional(in);
            String detail = readText(in);
            String representative = readOptional(in);
            long duration = in.readLong();
            list.add(new SiteResult(site, verdict, killingTest, detail, representative, duration));
        }
        return list;
    }

    private static void writeSite(DataOutputStream out, MutationSite site) throws IOException {
        writeText(out, site.formId());
        writeText(out, site.coordinate().toString());
        writeText(out, site.operatorId());
        writeText(out, site.replacement());
        writeOptional(out, site.file() != null ? site.file().toString() : null);
        out.writeInt(site.line());
        writeText(out, site.original());
        out.writeInt(site.ordinal());
        out.writeBoolean(site.callHead());
    }

    private static MutationSite readSite(DataInputStream in) throws IOException {
        String formId = readText(in);
        Coordinate coordinate = Coordinate.parse(readText(in));
        String operatorId = readText(in);
        String replacement = readText(in);
        String file = readOptional(in);
        int line = in.readInt();
        String original = readText(in);
        int ordinal = in.readInt();
        boolean callHead = in.readBoolean();
        return new MutationSite(formId, coordinate, operatorId, replacement,
                file != null ? Paths.get(file) : null, line, original, ordinal, callHead);
    }

    /** Length-prefixed UTF-8; unlike writeUTF it has no 64 KiB limit */
    private static void writeText(DataOutputStream out, String text) throws IOException {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    private static String readText(DataInputStream in) throws IOException {
        int length = in.readInt();
        if (length < 0) {
            throw new IOException("Negative string length: " + length);
        }
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static void writeOptional(DataOutputStream out, @Nullable String text) throws IOException {
        out.writeBoolean(text != null);
        if (text != null) {
            writeText(out, text);
        }
    }

    @Nullable
    private static String readOptional(DataInputStream in) throws IOException {
        return in.readBoolean() ? readText(in) : null;
    }
}
