package ai.typegraph.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.github.javaparser.ast.nodeTypes.NodeWithTypeParameters;
import com.github.javaparser.ast.type.ArrayType;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.TypeParameter;
import com.github.javaparser.javadoc.Javadoc;
import com.github.javaparser.javadoc.JavadocBlockTag;

/**
 * Reads {@code @throws}, {@code @exception} and {@code @see} tags from Java sources.
 * Sources that fail to parse are reported and skipped.
 */
public final class JavadocScanner {

    private static final Logger log = LoggerFactory.getLogger(JavadocScanner.class);

    private final JavaParser parser;

    public JavadocScanner() {
        final ParserConfiguration cfg = new ParserConfiguration();
        cfg.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(cfg);
    }

    public record ScanResult(List<DocComment> comments, SymbolTable symbols, int fileCount) {
    }

    public ScanResult scan(List<Path> sourceRoots) throws IOException {
        Objects.requireNonNull(sourceRoots, "sourceRoots");

        final List<Path> files = new ArrayList<>();
        for (Path root : sourceRoots) {
            files.addAll(listJavaFiles(root));
        }

        final SymbolTable symbols = new SymbolTable();
        final List<DocComment> comments = new ArrayList<>();
        for (Path file : files) {
            scanFile(file, symbols, comments);
        }
        symbols.finalizeIndex();

        log.info("Scanned {} source files, {} documented declarations", files.size(), comments.size());
        return new ScanResult(List.copyOf(comments), symbols, files.size());
    }

    private List<Path> listJavaFiles(Path root) throws IOException {
        try (Stream<Path> s = Files.walk(root)) {
            return s.filter(p -> Files.isRegularFile(p) && p.toString().endsWith(".java"))
                    .filter(p -> !p.getFileName().toString().equals("module-info.java"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    void scanFile(Path file, SymbolTable symbols, List<DocComment> out) {
        final ParseResult<CompilationUnit> result;
        try {
            result = parser.parse(file);
        } catch (IOException ex) {
            log.warn("Cannot read {}: {}", file, safeMsg(ex));
            return;
        }
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            final String problem = result.getProblems().isEmpty()
                    ? "unknown problem" : result.getProblems().get(0).getMessage();
            log.warn("Parse failed: {} ({})", file, safeMsg(problem));
            return;
        }
        scanUnit(result.getResult().get(), symbols, out);
    }

    void scanUnit(CompilationUnit cu, SymbolTable symbols, List<DocComment> out) {
        final String pkg = cu.getPackageDeclaration().map(pd -> pd.getNameAsString()).orElse("");
        final List<String> imports = new ArrayList<>();
        for (ImportDeclaration id : cu.getImports()) {
            if (!id.isAsterisk() && !id.isStatic()) {
                imports.add(id.getNameAsString());
            }
        }

        for (TypeDeclaration<?> td : cu.getTypes()) {
            scanType(td, pkg, "", "", imports, Set.of(), symbols, out);
        }
    }

    private void scanType(
            TypeDeclaration<?> td,
            String pkg,
            String canonicalOuter,
            String binaryOuter,
            List<String> imports,
            Set<String> outerTypeVariables,
            SymbolTable symbols,
            List<DocComment> out) {
        final String simple = td.getNameAsString();
        final String prefix = pkg.isEmpty() ? "" : pkg + ".";
        final String canonical = canonicalOuter.isEmpty() ? prefix + simple : canonicalOuter + "." + simple;
        final String binary = binaryOuter.isEmpty() ? prefix + simple : binaryOuter + "$" + simple;
        symbols.registerType(canonical, binary);

        final Set<String> typeVariables = new HashSet<>(outerTypeVariables);
        if (td instanceof NodeWithTypeParameters<?> generic) {
            for (TypeParameter tp : generic.getTypeParameters()) {
                typeVariables.add(tp.getNameAsString());
            }
        }

        comment(td, binary, null, List.of(), pkg, imports).ifPresent(out::add);

        for (BodyDeclaration<?> member : td.getMembers()) {
            if (member instanceof TypeDeclaration<?> nested) {
                // Nested types of an interface are implicitly static
                scanType(nested, pkg, canonical, binary, imports,
                        nested.isStatic() || isInterfaceLike(td) ? Set.of() : typeVariables, symbols, out);
            } else if (member instanceof MethodDeclaration md) {
                comment(md, binary, md.getNameAsString(), parameterTypes(md, typeVariables), pkg, imports)
                        .ifPresent(out::add);
            } else if (member instanceof ConstructorDeclaration cd) {
                comment(cd, binary, DocComment.CONSTRUCTOR, parameterTypes(cd, typeVariables), pkg, imports)
                        .ifPresent(out::add);
            }
        }
    }

    private static boolean isInterfaceLike(TypeDeclaration<?> td) {
        if (td.isAnnotationDeclaration() || td.isEnumDeclaration() || td.isRecordDeclaration()) {
            return true;
        }
        return td.isClassOrInterfaceDeclaration() && td.asClassOrInterfaceDeclaration().isInterface();
    }

    private static Optional<DocComment> comment(
            NodeWithJavadoc<? extends Node> node,
            String typeName,
            String memberName,
            List<String> parameterTypes,
            String pkg,
            List<String> imports) {
        final Optional<Javadoc> javadoc;
        try {
            javadoc = node.getJavadoc();
        } catch (RuntimeException ex) {
            log.warn("Malformed documentation comment on {}{}: {}",
                    typeName, memberName == null ? "" : "#" + memberName, safeMsg(ex));
            return Optional.empty();
        }
        if (javadoc.isEmpty()) {
            return Optional.empty();
        }

        final List<String> throwsNames = new ArrayList<>();
        final List<String> seeReferences = new ArrayList<>();
        for (JavadocBlockTag tag : javadoc.get().getBlockTags()) {
            switch (tag.getType()) {
                case THROWS, EXCEPTION -> tag.getName().ifPresent(n -> {
                    if (!n.isBlank()) throwsNames.add(n.trim());
                });
                case SEE -> {
                    final String ref = tag.getContent().toText().trim();
                    if (!ref.isEmpty()) seeReferences.add(ref);
                }
                default -> {
                    // other tags carry no cross references
                }
            }
        }
        if (throwsNames.isEmpty() && seeReferences.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DocComment(typeName, memberName, parameterTypes, throwsNames, seeReferences, pkg, imports));
    }

    private static List<String> parameterTypes(CallableDeclaration<?> callable, Set<String> ownerTypeVariables) {
        final Set<String> typeVariables = new HashSet<>(ownerTypeVariables);
        for (TypeParameter tp : callable.getTypeParameters()) {
            typeVariables.add(tp.getNameAsString());
        }
        final List<String> out = new ArrayList<>();
        for (Parameter p : callable.getParameters()) {
            final String raw = rawSimpleName(p.getType(), typeVariables);
            out.add(p.isVarArgs() ? raw + "[]" : raw);
        }
        return out;
    }

    static String rawSimpleName(Type type, Set<String> typeVariables) {
        if (type instanceof ArrayType array) {
            return rawSimpleName(array.getComponentType(), typeVariables) + "[]";
        }
        if (type instanceof ClassOrInterfaceType cit) {
            final String name = cit.getNameAsString();
            return cit.getScope().isEmpty() && typeVariables.contains(name) ? "*" : name;
        }
        return type.asString();
    }

    private static String safeMsg(Throwable t) {
        return safeMsg(t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage());
    }

    private static String safeMsg(String m) {
        if (m == null) return "";
        return m.length() > 200 ? m.substring(0, 200) + "..." : m;
    }
}
