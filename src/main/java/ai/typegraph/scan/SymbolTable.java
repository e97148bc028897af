package ai.typegraph.scan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Source-wide table of declared types for light name resolution:
 * - canonical name (dots only) -> binary name ({@code $} between nesting levels)
 * - simple name -> binary name (only if unique)
 */
public final class SymbolTable {

    private final Map<String, String> binaryByCanonical = new HashMap<>();
    private final Set<String> binaryNames = new HashSet<>();
    private final Map<String, String> uniqueSimpleToBinary = new HashMap<>();
    private final Map<String, Integer> simpleCounts = new HashMap<>();

    public void registerType(String canonicalName, String binaryName) {
        if (binaryByCanonical.putIfAbsent(canonicalName, binaryName) != null) {
            return;
        }
        binaryNames.add(binaryName);
        simpleCounts.merge(simpleName(canonicalName), 1, Integer::sum);
    }

    public void finalizeIndex() {
        uniqueSimpleToBinary.clear();
        for (var e : binaryByCanonical.entrySet()) {
            final String simple = simpleName(e.getKey());
            if (simpleCounts.getOrDefault(simple, 0) == 1) {
                uniqueSimpleToBinary.put(simple, e.getValue());
            }
        }
    }

    public boolean isDeclared(String binaryName) {
        return binaryNames.contains(binaryName);
    }

    /**
     * Binary names a type name written in source may stand for, most likely first.
     * Order: qualified name, single-type import, member of an enclosing type,
     * same package, unique simple name, {@code java.lang}, the name as written.
     * Names declared outside the scanned sources are guesses the caller must verify.
     *
     * @param enclosingType binary name of the type the reference appears in, may be {@code null}
     */
    public List<String> candidates(String typeName, String packageName, List<String> imports, String enclosingType) {
        if (typeName == null || typeName.isBlank()) return List.of();
        final String name = stripGenerics(typeName.trim());
        if (name.isEmpty()) return List.of();

        final int dot = name.indexOf('.');
        final String head = dot < 0 ? name : name.substring(0, dot);
        final String tail = dot < 0 ? "" : name.substring(dot);
        final Set<String> out = new LinkedHashSet<>();

        // Already canonical
        final String known = binaryByCanonical.get(name);
        if (known != null) {
            out.add(known);
        }

        for (String imported : imports) {
            if (simpleName(imported).equals(head)) {
                out.add(toBinary(imported + tail));
            }
        }

        // Member type of the enclosing type or one of its outers
        String outer = enclosingType;
        while (outer != null) {
            out.add(outer + "$" + name.replace('.', '$'));
            final int cut = outer.lastIndexOf('$');
            outer = cut < 0 ? null : outer.substring(0, cut);
        }

        if (packageName != null && !packageName.isBlank()) {
            out.add(toBinary(packageName + "." + name));
        }

        if (dot < 0) {
            final String uniq = uniqueSimpleToBinary.get(name);
            if (uniq != null) out.add(uniq);
            out.add("java.lang." + name);
        }
        out.add(toBinary(name));

        // Candidates backed by a scanned declaration go first
        final List<String> ordered = new ArrayList<>(out.size());
        for (String c : out) {
            if (isDeclared(c)) ordered.add(c);
        }
        for (String c : out) {
            if (!isDeclared(c)) ordered.add(c);
        }
        return ordered;
    }

    private String toBinary(String canonical) {
        final String binary = binaryByCanonical.get(canonical);
        return binary != null ? binary : canonical;
    }

    static String simpleName(String name) {
        final int lastDot = name.lastIndexOf('.');
        return lastDot >= 0 ? name.substring(lastDot + 1) : name;
    }

    static String stripGenerics(String name) {
        final int lt = name.indexOf('<');
        return lt >= 0 ? name.substring(0, lt) : name;
    }
}
