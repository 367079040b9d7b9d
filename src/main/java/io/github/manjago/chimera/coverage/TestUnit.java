package io.github.manjago.chimera.coverage;

import io.github.manjago.chimera.syntax.Digests;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A logical group of tests (typically one test namespace) as it is now.
 *
 * @param dependencyHash hash over the content of every source the unit depends on,
 *                       tests included
 */
public record TestUnit(String unitId, String dependencyHash, List<String> testIds) {

    public TestUnit {
        testIds = List.copyOf(testIds);
    }

    /**
     * Content hash of a set of files, independent of the order they are given in.
     */
    public static String hashOf(Collection<Path> files) throws IOException {
        List<Path> sorted = new ArrayList<>();
        for (Path file : files) {
            sorted.add(file.toAbsolutePath().normalize());
        }
        sorted.sort(null);

        ByteArrayOutputStream content = new ByteArrayOutputStream();
        for (Path file : sorted) {
            content.write(file.toString().getBytes(StandardCharsets.UTF_8));
            content.write(0);
            content.write(Digests.sha256Hex(Files.readAllBytes(file)).getBytes(StandardCharsets.US_ASCII));
            content.write('\n');
        }
        return Digests.sha256Hex(content.toByteArray());
    }
}
