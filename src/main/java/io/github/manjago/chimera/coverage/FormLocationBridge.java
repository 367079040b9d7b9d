package io.github.manjago.chimera.coverage;

import io.github.manjago.chimera.syntax.Form;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The runtime's view of where each of its forms starts.
 */
@FunctionalInterface
public interface FormLocationBridge {

    Map<String, FormLocation> locations();

    /**
     * Bridge whose form ids are the statically scanned ones.
     */
    static FormLocationBridge ofForms(Collection<Form> forms) {
        Map<String, FormLocation> locations = new LinkedHashMap<>();
        for (Form form : forms) {
            if (form.file() != null) {
                locations.put(form.id(), new FormLocation(form.file(), form.startLine()));
            }
        }
        return () -> locations;
    }
}
