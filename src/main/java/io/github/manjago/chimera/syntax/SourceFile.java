package io.github.manjago.chimera.syntax;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lossless tree of a whole source file: top-level nodes plus the trivia
 * after the last one.
 */
public final class SourceFile {

    private static final String DEFAULT_NAMESPACE = "user";

    @Nullable
    private final Path file;
    private final List<Node> roots;
    private final String trailing;
    private final List<Form> forms;

    public SourceFile(@Nullable Path file, List<Node> roots, String trailing) {
        this.file = file;
        this.roots = List.copyOf(roots);
        this.trailing = trailing;
        this.forms = extractForms(file, this.roots);
    }

    @Nullable
    public Path file() {
        return file;
    }

    public List<Node> roots() {
        return roots;
    }

    public String trailing() {
        return trailing;
    }

    public List<Form> forms() {
        return forms;
    }

    public Optional<Form> form(String id) {
        return forms.stream().filter(f -> f.id().equals(id)).findFirst();
    }

    /**
     * Copy with one top-level node replaced; all other nodes are shared.
     */
    public SourceFile withRoot(int index, Node root) {
        List<Node> copy = new ArrayList<>(roots);
        copy.set(index, root);
        return new SourceFile(file, copy, trailing);
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Node root : roots) {
            root.render(sb);
        }
        sb.append(trailing);
        return sb.toString();
    }

    // ========== Form identities ==========

    private static List<Form> extractForms(@Nullable Path file, List<Node> roots) {
        String namespace = findNamespace(roots).orElseGet(() -> defaultNamespace(file));
        Map<String, Integer> seen = new HashMap<>();
        List<Form> result = new ArrayList<>(roots.size());

        for (int i = 0; i < roots.size(); i++) {
            Node root = roots.get(i);
            final int index = i;
            String id = definitionName(root)
                    .map(name -> namespace + "/" + name)
                    .orElseGet(() -> namespace + "#" + index);

            int occurrence = seen.merge(id, 1, Integer::sum);
            if (occurrence > 1) {
                id = id + "~" + occurrence;
            }
            result.add(new Form(id, file, root.line(), i, root));
        }
        return result;
    }

    private static Optional<String> findNamespace(List<Node> roots) {
        for (Node root : roots) {
            if (root instanceof CollectionNode c && c.isCall("ns") && c.children().size() > 1
                    && c.children().get(1) instanceof Token name) {
                return Optional.of(name.value());
            }
        }
        return Optional.empty();
    }

    /**
     * Name of a {@code (defX name ...)} form; defmethod adds its dispatch value.
     */
    private static Optional<String> definitionName(Node root) {
        if (!(root instanceof CollectionNode c) || c.children().size() < 2) {
            return Optional.empty();
        }
        Optional<String> head = c.headSymbol();
        if (head.isEmpty() || !head.get().startsWith("def")) {
            return Optional.empty();
        }
        if (!(c.children().get(1) instanceof Token name) || name.type() != TokenType.SYMBOL) {
            return Optional.empty();
        }
        if (head.get().equals("defmethod") && c.children().size() > 2) {
            return Optional.of(name.value() + " " + c.children().get(2).canonical());
        }
        return Optional.of(name.value());
    }

    private static String defaultNamespace(@Nullable Path file) {
        if (file == null || file.getFileName() == null) {
            return DEFAULT_NAMESPACE;
        }
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return (dot > 0 ? name.substring(0, dot) : name).replace('_', '-');
    }
}
