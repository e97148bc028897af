package ai.typegraph.loader;

/**
 * Shared package tree; one namespace object per dotted name.
 */
final class NamespaceTable {

    private final AsmNamespace global = AsmNamespace.newGlobal();

    AsmNamespace global() {
        return global;
    }

    AsmNamespace get(String dottedName) {
        AsmNamespace ns = global;
        if (dottedName == null || dottedName.isEmpty()) {
            return ns;
        }
        for (String part : dottedName.split("\\.")) {
            ns = ns.child(part);
        }
        return ns;
    }

    static String packageOf(String internalName) {
        final int slash = internalName.lastIndexOf('/');
        return slash < 0 ? "" : internalName.substring(0, slash).replace('/', '.');
    }
}
