package io.github.manjago.chimera.incremental;

import io.github.manjago.chimera.syntax.Form;

/**
 * Content digest of a form, as persisted between runs.
 *
 * @param file file the form was read from, as a string ("" for in-memory sources)
 */
public record FormDigest(String formId, String file, String digest) {

    public static FormDigest of(Form form) {
        return new FormDigest(form.id(), form.file() != null ? form.file().toString() : "", form.digest());
    }
}
