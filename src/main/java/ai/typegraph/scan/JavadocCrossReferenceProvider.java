package ai.typegraph.scan;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.typegraph.graph.CrossReferenceProvider;
import ai.typegraph.loader.LoadedModule;
import ai.typegraph.symbols.ArrayTypeSymbol;
import ai.typegraph.symbols.MemberSymbol;
import ai.typegraph.symbols.MethodKind;
import ai.typegraph.symbols.MethodSymbol;
import ai.typegraph.symbols.NamedTypeSymbol;
import ai.typegraph.symbols.NamespaceSymbol;
import ai.typegraph.symbols.ParameterSymbol;
import ai.typegraph.symbols.PropertySymbol;
import ai.typegraph.symbols.Symbol;
import ai.typegraph.symbols.TypeParameterSymbol;
import ai.typegraph.symbols.TypeSymbol;

/**
 * Cross references taken from the documentation comments of the module's sources.
 * Types named in tags are looked up in the loaded module and its references;
 * names that do not resolve to a loaded class are dropped.
 */
public final class JavadocCrossReferenceProvider implements CrossReferenceProvider {

    private static final Logger log = LoggerFactory.getLogger(JavadocCrossReferenceProvider.class);

    private final LoadedModule loaded;
    private final SymbolTable symbols;
    private final Map<String, List<DocComment>> commentsByType = new HashMap<>();

    public JavadocCrossReferenceProvider(LoadedModule loaded, JavadocScanner.ScanResult scan) {
        this.loaded = Objects.requireNonNull(loaded, "loaded");
        Objects.requireNonNull(scan, "scan");
        this.symbols = scan.symbols();
        for (DocComment c : scan.comments()) {
            commentsByType.computeIfAbsent(c.typeName(), k -> new ArrayList<>()).add(c);
        }
    }

    /**
     * Scans the given source roots (or project directories holding {@code src/main/java}).
     */
    public static JavadocCrossReferenceProvider load(List<Path> sourceDirs, LoadedModule loaded) throws IOException {
        final SourceRootFinder finder = new SourceRootFinder(false);
        final List<Path> roots = new ArrayList<>();
        for (Path dir : sourceDirs) {
            roots.addAll(finder.findSourceRoots(dir));
        }
        log.info("Documentation source roots: {}", roots);
        return new JavadocCrossReferenceProvider(loaded, new JavadocScanner().scan(roots));
    }

    @Override
    public List<TypeSymbol> exceptionTypesFor(Symbol symbol) {
        final DocComment doc = commentFor(symbol);
        if (doc == null) {
            return List.of();
        }
        final List<TypeSymbol> out = new ArrayList<>();
        for (String name : doc.throwsNames()) {
            final NamedTypeSymbol type = resolveType(name, doc);
            if (type != null && !out.contains(type)) {
                out.add(type);
            }
        }
        return out;
    }

    @Override
    public List<Symbol> seeAlsoFor(Symbol symbol) {
        final DocComment doc = commentFor(symbol);
        if (doc == null) {
            return List.of();
        }
        final List<Symbol> out = new ArrayList<>();
        for (String reference : doc.seeReferences()) {
            final Symbol target = resolveReference(reference, doc);
            if (target != null && !out.contains(target)) {
                out.add(target);
            }
        }
        return out;
    }

    private DocComment commentFor(Symbol symbol) {
        if (symbol instanceof NamedTypeSymbol type) {
            for (DocComment c : commentsByType.getOrDefault(binaryName(type), List.of())) {
                if (c.isTypeComment()) {
                    return c;
                }
            }
            return null;
        }
        if (symbol instanceof PropertySymbol property) {
            // Record components are documented through their accessor
            return property.getMethod() == null ? null : commentFor(property.getMethod());
        }
        if (symbol instanceof MethodSymbol method && method.containingType() != null) {
            return methodComment(method);
        }
        return null;
    }

    private DocComment methodComment(MethodSymbol method) {
        final boolean constructor = method.methodKind() == MethodKind.CONSTRUCTOR;
        final String memberName = constructor ? DocComment.CONSTRUCTOR : method.name();
        final List<String> actual = new ArrayList<>();
        for (ParameterSymbol p : method.parameters()) {
            actual.add(simpleName(p.type()));
        }

        for (DocComment c : commentsByType.getOrDefault(binaryName(method.containingType()), List.of())) {
            if (!memberName.equals(c.memberName())) {
                continue;
            }
            final List<String> declared = c.parameterTypes();
            // Constructors may carry implicit leading parameters in the class file
            final int skip = actual.size() - declared.size();
            if (skip < 0 || (skip > 0 && !constructor)) {
                continue;
            }
            if (parametersMatch(declared, actual.subList(skip, actual.size()))) {
                return c;
            }
        }
        return null;
    }

    static boolean parametersMatch(List<String> declared, List<String> actual) {
        if (declared.size() != actual.size()) {
            return false;
        }
        for (int i = 0; i < declared.size(); i++) {
            final String d = declared.get(i);
            final String a = actual.get(i);
            if (!d.equals(a) && !d.startsWith("*") && !a.startsWith("*")) {
                return false;
            }
        }
        return true;
    }

    private Symbol resolveReference(String reference, DocComment doc) {
        if (reference.startsWith("\"") || reference.startsWith("<")) {
            return null;
        }
        final String target = referenceTarget(reference);
        final int hash = target.indexOf('#');
        final String typePart = hash < 0 ? target : target.substring(0, hash);
        final NamedTypeSymbol type = typePart.isEmpty()
                ? loaded.findType(doc.typeName())
                : resolveType(typePart, doc);
        if (type == null || !LoadedModule.isResolved(type)) {
            return null;
        }
        if (hash < 0) {
            return type;
        }
        return findMember(type, target.substring(hash + 1));
    }

    // Drops the label: the target ends at the first blank outside a parameter list
    static String referenceTarget(String reference) {
        int depth = 0;
        for (int i = 0; i < reference.length(); i++) {
            final char ch = reference.charAt(i);
            if (ch == '(') depth++;
            else if (ch == ')') depth--;
            else if (Character.isWhitespace(ch) && depth == 0) {
                return reference.substring(0, i);
            }
        }
        return reference;
    }

    private Symbol findMember(NamedTypeSymbol type, String memberRef) {
        final int paren = memberRef.indexOf('(');
        final String name = paren < 0 ? memberRef : memberRef.substring(0, paren);
        final List<String> args = paren < 0 ? null : argumentNames(memberRef.substring(paren + 1));

        if (args == null) {
            for (MemberSymbol m : type.members()) {
                if (!(m instanceof MethodSymbol) && m.name().equals(name)) {
                    return m;
                }
            }
        }
        final boolean constructor = name.equals(type.name());
        for (MemberSymbol m : type.members()) {
            if (!(m instanceof MethodSymbol method) || method.isCompilerGenerated()) {
                continue;
            }
            final boolean nameMatches = constructor
                    ? method.methodKind() == MethodKind.CONSTRUCTOR
                    : method.name().equals(name);
            if (!nameMatches) {
                continue;
            }
            if (args == null) {
                return method;
            }
            final List<String> actual = new ArrayList<>();
            for (ParameterSymbol p : method.parameters()) {
                actual.add(simpleName(p.type()));
            }
            final int skip = actual.size() - args.size();
            if (skip >= 0 && (skip == 0 || constructor)
                    && parametersMatch(args, actual.subList(skip, actual.size()))) {
                return method;
            }
        }
        log.debug("Unresolved member reference {}#{}", type.displayName(), memberRef);
        return null;
    }

    private static List<String> argumentNames(String argList) {
        final int close = argList.lastIndexOf(')');
        final String body = (close < 0 ? argList : argList.substring(0, close)).trim();
        final List<String> out = new ArrayList<>();
        if (body.isEmpty()) {
            return out;
        }
        for (String raw : body.split(",")) {
            String arg = SymbolTable.stripGenerics(raw.trim());
            // Drop a parameter name if one is given
            final int space = arg.indexOf(' ');
            if (space > 0) {
                arg = arg.substring(0, space);
            }
            final boolean varargs = arg.endsWith("...");
            if (varargs) {
                arg = arg.substring(0, arg.length() - 3);
            }
            String dims = "";
            while (arg.endsWith("[]")) {
                dims += "[]";
                arg = arg.substring(0, arg.length() - 2);
            }
            out.add(SymbolTable.simpleName(arg) + dims + (varargs ? "[]" : ""));
        }
        return out;
    }

    /**
     * Looks a source-level type name up among the loaded classes. For a dotted
     * candidate whose class is missing, trailing segments are retried as nested types.
     */
    private NamedTypeSymbol resolveType(String name, DocComment doc) {
        for (String binary : symbols.candidates(name, doc.packageName(), doc.imports(), doc.typeName())) {
            String candidate = binary;
            while (true) {
                final NamedTypeSymbol type = loaded.findType(candidate);
                if (LoadedModule.isResolved(type)) {
                    return type;
                }
                final int dot = candidate.lastIndexOf('.');
                if (dot < 0) {
                    break;
                }
                candidate = candidate.substring(0, dot) + "$" + candidate.substring(dot + 1);
            }
        }
        log.debug("Unresolved type reference {} in {}", name, doc.typeName());
        return null;
    }

    /**
     * Binary name in dotted form, e.g. {@code com.acme.Outer$Inner}.
     */
    static String binaryName(NamedTypeSymbol type) {
        final NamedTypeSymbol definition = type.originalDefinition();
        final NamedTypeSymbol outer = definition.containingType();
        if (outer != null) {
            return binaryName(outer) + "$" + definition.name();
        }
        final NamespaceSymbol ns = definition.containingNamespace();
        return ns == null || ns.isGlobalNamespace() ? definition.name() : ns.fullName() + "." + definition.name();
    }

    static String simpleName(TypeSymbol type) {
        if (type instanceof ArrayTypeSymbol array) {
            return simpleName(array.elementType()) + "[]";
        }
        if (type instanceof TypeParameterSymbol) {
            return "*";
        }
        final String name = type.name();
        final int dollar = name.lastIndexOf('$');
        return dollar >= 0 ? name.substring(dollar + 1) : name;
    }
}
