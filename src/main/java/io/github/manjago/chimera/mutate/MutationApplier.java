package io.github.manjago.chimera.mutate;

import io.github.manjago.chimera.scan.MutationSite;
import io.github.manjago.chimera.syntax.Digests;
import io.github.manjago.chimera.syntax.Form;
import io.github.manjago.chimera.syntax.LocationNotFoundException;
import io.github.manjago.chimera.syntax.Node;
import io.github.manjago.chimera.syntax.SourceFile;
import io.github.manjago.chimera.syntax.SyntaxParseException;
import io.github.manjago.chimera.syntax.SyntaxParser;
import io.github.manjago.chimera.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transactional single-file edits with guaranteed rollback.
 * <p>
 * Before a file is written its original bytes go to the backup directory
 * ({@code <key>.bak}, with the file's path and the bytes' hash in
 * {@code <key>.path}). Reverting
 * restores the bytes, verifies their hash and deletes the backup; backups left
 * by a crashed run are restored by {@link #recover()}. At most one edit per
 * file may be outstanding at a time.
 */
public final class MutationApplier {

    private static final Logger log = LoggerFactory.getLogger(MutationApplier.class);

    private static final String BACKUP_SUFFIX = ".bak";
    private static final String PATH_SUFFIX = ".path";

    private final Path backupDir;
    private final Set<Path> outstanding = ConcurrentHashMap.newKeySet();

    public MutationApplier(Path backupDir) {
        this.backupDir = backupDir;
    }

    /**
     * Apply one site against a fresh parse of its file.
     *
     * @throws MutationApplyException if the site no longer resolves, its node
     *                                changed, or the file cannot be written
     */
    public MutationHandle apply(MutationSite site) throws MutationApplyException {
        Path file = site.file();
        if (file == null) {
            throw new MutationApplyException("Site has no file: " + site.id());
        }
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MutationApplyException("Cannot read " + file, e);
        }
        return applyText(file, text, mutatedText(site, file, text));
    }

    /**
     * Text of {@code file} with the site's replacement spliced in.
     */
    static String mutatedText(MutationSite site, Path file, String text) throws MutationApplyException {
        try {
            SourceFile source = SyntaxParser.parse(file, text);
            Form form = source.form(site.formId())
                    .orElseThrow(() -> new MutationApplyException("Form " + site.formId() + " not found in " + file));
            Node current = SyntaxTree.decode(form.root(), site.coordinate());
            if (!current.text().equals(site.original())) {
                throw new MutationApplyException(String.format(
                        "Node at %s changed: expected '%s', found '%s'", site.id(), site.original(), current.text()));
            }
            Node replacement = SyntaxParser.parseNode(site.replacement());
            Node root = SyntaxTree.replace(form.root(), site.coordinate(), replacement);
            return source.withRoot(form.index(), root).render();
        } catch (SyntaxParseException e) {
            throw new MutationApplyException("Cannot parse while applying " + site.id() + ": " + e.getMessage(), e);
        } catch (LocationNotFoundException e) {
            throw new MutationApplyException("Stale site " + site.id() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Replace the content of {@code file}, provided it still equals {@code expectedOriginal}.
     */
    public MutationHandle applyText(Path file, String expectedOriginal, String newText) throws MutationApplyException {
        Path key = file.toAbsolutePath().normalize();
        if (!outstanding.add(key)) {
            throw new MutationApplyException("File already has an outstanding mutation: " + key);
        }
        boolean applied = false;
        try {
            byte[] original = Files.readAllBytes(key);
            if (!new String(original, StandardCharsets.UTF_8).equals(expectedOriginal)) {
                throw new MutationApplyException("File changed on disk since it was parsed: " + key);
            }
            String hash = Digests.sha256Hex(original);
            Path backup = writeBackup(key, original, hash);
            MutationHandle handle = new MutationHandle(this, key, original, hash, backup);
            try {
                Files.write(key, newText.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                handle.revert();
                throw new MutationApplyException("Cannot write " + key, e);
            }
            applied = true;
            log.debug("Mutated {} (backup {})", key, backup.getFileName());
            return handle;
        } catch (IOException e) {
            throw new MutationApplyException("Cannot prepare mutation of " + key, e);
        } finally {
            if (!applied) {
                outstanding.remove(key);
            }
        }
    }

    void revert(MutationHandle handle) {
        Path file = handle.getFile();
        try {
            Files.write(file, handle.originalBytes());
            String restored = Digests.sha256Hex(Files.readAllBytes(file));
            if (!restored.equals(handle.getOriginalHash())) {
                throw new RevertFailureException(file, "hash mismatch after restore");
            }
            deleteBackup(handle.backup());
        } catch (IOException e) {
            throw new RevertFailureException(file, e.getMessage(), e);
        }
        outstanding.remove(file);
        log.debug("Reverted {}", file);
    }

    /**
     * True if an edit of {@code file} is outstanding.
     */
    public boolean isMutated(Path file) {
        return outstanding.contains(file.toAbsolutePath().normalize());
    }

    // ========== Backups ==========

    private Path writeBackup(Path file, byte[] original, String hash) throws IOException {
        Files.createDirectories(backupDir);
        String key = Digests.shortHex(file.toString());
        Path backup = backupDir.resolve(key + BACKUP_SUFFIX);
        Files.write(backup, original);
        // path on the first line, hash of the original on the second
        Files.write(backupDir.resolve(key + PATH_SUFFIX), List.of(file.toString(), hash), StandardCharsets.UTF_8);
        return backup;
    }

    private static void deleteBackup(Path backup) throws IOException {
        Files.deleteIfExists(backup);
        Files.deleteIfExists(pathFileOf(backup));
    }

    private static Path pathFileOf(Path backup) {
        String name = backup.getFileName().toString();
        return backup.resolveSibling(name.substring(0, name.length() - BACKUP_SUFFIX.length()) + PATH_SUFFIX);
    }

    /**
     * Restore every file whose backup a previous run left behind.
     *
     * @return files that were restored
     * @throws RevertFailureException if a backup exists but cannot be restored
     */
    public List<Path> recover() throws IOException {
        List<Path> restored = new ArrayList<>();
        if (!Files.isDirectory(backupDir)) {
            return restored;
        }
        try (DirectoryStream<Path> backups = Files.newDirectoryStream(backupDir, "*" + BACKUP_SUFFIX)) {
            for (Path backup : backups) {
                Path pathFile = pathFileOf(backup);
                List<String> record = Files.exists(pathFile)
                        ? Files.readAllLines(pathFile, StandardCharsets.UTF_8)
                        : List.of();
                if (record.size() < 2) {
                    // crash before the original was touched
                    deleteBackup(backup);
                    continue;
                }
                Path target = Paths.get(record.get(0));
                String expectedHash = record.get(1);
                if (outstanding.contains(target)) {
                    continue;
                }
                byte[] original = Files.readAllBytes(backup);
                if (!Digests.sha256Hex(original).equals(expectedHash)) {
                    throw new RevertFailureException(target, "backup " + backup + " does not match its recorded hash");
                }
                try {
                    Files.write(target, original);
                    if (!Digests.sha256Hex(Files.readAllBytes(target)).equals(expectedHash)) {
                        throw new RevertFailureException(target, "hash mismatch after restore from " + backup);
                    }
                } catch (IOException e) {
                    throw new RevertFailureException(target, "cannot restore from backup " + backup, e);
                }
                deleteBackup(backup);
                restored.add(target);
                log.warn("Restored {} from a backup left by an interrupted run", target);
            }
        }
        return restored;
    }
}
