package io.github.manjago.chimera.coverage;

import java.nio.file.Path;

/**
 * Where the runtime believes a form starts.
 */
public record FormLocation(Path file, int startLine) {
}
