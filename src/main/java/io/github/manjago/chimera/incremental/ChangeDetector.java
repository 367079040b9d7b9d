package io.github.manjago.chimera.incremental;

import io.github.manjago.chimera.syntax.Form;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Form-level diff against the previous run.
 * <p>
 * Invalidation is conservative: a form is reused only when its content, its
 * file and every test covering it are unchanged.
 */
public final class ChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    private final Function<Form, Set<String>> coveringTests;

    /**
     * @param coveringTests tests covering any location of a form
     */
    public ChangeDetector(Function<Form, Set<String>> coveringTests) {
        this.coveringTests = coveringTests;
    }

    /**
     * @param forms        current forms of every scanned file
     * @param previous     digests stored by the previous run, by form id
     * @param changedTests tests whose unit was recomputed in this run
     */
    public ChangeSet detect(List<Form> forms, Map<String, FormDigest> previous, Set<String> changedTests) {
        Map<String, FormDigest> digests = new LinkedHashMap<>();
        Map<String, ChangeReason> changed = new LinkedHashMap<>();
        Set<String> unchanged = new HashSet<>();

        for (Form form : forms) {
            FormDigest current = FormDigest.of(form);
            digests.put(form.id(), current);

            FormDigest stored = previous.get(form.id());
            ChangeReason reason;
            if (stored == null) {
                reason = ChangeReason.NEW;
            } else if (!stored.digest().equals(current.digest())) {
                reason = ChangeReason.MODIFIED;
            } else if (!stored.file().equals(current.file())) {
                reason = ChangeReason.MOVED;
            } else if (!Collections.disjoint(coveringTests.apply(form), changedTests)) {
                reason = ChangeReason.TESTS_CHANGED;
            } else {
                reason = null;
            }

            if (reason == null) {
                unchanged.add(form.id());
            } else {
                changed.put(form.id(), reason);
            }
        }

        Set<String> removed = new TreeSet<>(previous.keySet());
        removed.removeAll(digests.keySet());

        ChangeSet result = new ChangeSet(digests, changed, unchanged, removed);
        log.info("Change detection: {} changed, {} unchanged, {} removed",
                changed.size(), unchanged.size(), removed.size());
        return result;
    }
}
