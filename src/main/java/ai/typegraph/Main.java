package ai.typegraph;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

import ai.typegraph.graph.CrossReferenceProvider;
import ai.typegraph.graph.ExtractionOptions;
import ai.typegraph.graph.ExtractionResult;
import ai.typegraph.graph.GraphExtractor;
import ai.typegraph.io.NTriplesSink;
import ai.typegraph.io.SummaryWriter;
import ai.typegraph.io.TripleSink;
import ai.typegraph.io.TurtleSink;
import ai.typegraph.loader.ClassFileLoader;
import ai.typegraph.loader.LoadedModule;
import ai.typegraph.modules.ModuleIdentity;
import ai.typegraph.modules.ModuleResolver;
import ai.typegraph.scan.CompositeCrossReferenceProvider;
import ai.typegraph.scan.DeclaredExceptionsProvider;
import ai.typegraph.scan.JavadocCrossReferenceProvider;

public final class Main {

    private static final String FORMAT_NTRIPLES = "ntriples";
    private static final String FORMAT_TURTLE = "turtle";

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path target = null;
        Path output = null;
        Path summaryFile = null;
        Path referenceFile = null;
        String format = FORMAT_NTRIPLES;
        String moduleName = null;
        String moduleVersion = null;
        boolean includeJdk = true;
        ExtractionOptions options = ExtractionOptions.defaults();
        final List<String> references = new ArrayList<>();
        final List<Path> sourceDirs = new ArrayList<>();
        final Set<String> packages = new LinkedHashSet<>();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if ("--verbose".equals(arg)) {
                    setRootLevel(Level.DEBUG);
                    continue;
                }
                if ("--quiet".equals(arg)) {
                    setRootLevel(Level.WARN);
                    continue;
                }
                if (arg.startsWith("--output=")) {
                    output = Paths.get(value(arg));
                    continue;
                }
                if (arg.startsWith("--format=")) {
                    format = normalizeFormat(value(arg));
                    if (format == null) {
                        System.err.println("ERROR: unknown format: " + value(arg));
                        printUsage();
                        return 2;
                    }
                    continue;
                }
                if (arg.startsWith("--baseUri=")) {
                    options = options.withBaseUri(value(arg));
                    continue;
                }
                if (arg.startsWith("--includePrivate=")) {
                    options = options.withIncludePrivate(Boolean.parseBoolean(value(arg)));
                    continue;
                }
                if (arg.startsWith("--includeInternal=")) {
                    options = options.withIncludeInternal(Boolean.parseBoolean(value(arg)));
                    continue;
                }
                if (arg.startsWith("--includeCompilerGenerated=")) {
                    options = options.withIncludeCompilerGenerated(Boolean.parseBoolean(value(arg)));
                    continue;
                }
                if (arg.startsWith("--includeAttributes=")) {
                    options = options.withIncludeAttributes(Boolean.parseBoolean(value(arg)));
                    continue;
                }
                if (arg.startsWith("--includeExternalTypes=")) {
                    options = options.withIncludeExternalTypes(Boolean.parseBoolean(value(arg)));
                    continue;
                }
                if (arg.startsWith("--extractExceptions=")) {
                    options = options.withExtractExceptions(Boolean.parseBoolean(value(arg)));
                    continue;
                }
                if (arg.startsWith("--extractSeeAlso=")) {
                    options = options.withExtractSeeAlso(Boolean.parseBoolean(value(arg)));
                    continue;
                }
                if (arg.startsWith("--maxTypeDepth=")) {
                    options = options.withMaxTypeDepth(Integer.parseInt(value(arg).trim()));
                    continue;
                }
                if (arg.startsWith("--includeJdk=")) {
                    includeJdk = Boolean.parseBoolean(value(arg));
                    continue;
                }
                if (arg.startsWith("--reference=")) {
                    references.add(value(arg));
                    continue;
                }
                if (arg.startsWith("--referenceFile=")) {
                    referenceFile = Paths.get(value(arg));
                    continue;
                }
                if (arg.startsWith("--sources=")) {
                    sourceDirs.add(Paths.get(value(arg)));
                    continue;
                }
                if (arg.startsWith("--packages=")) {
                    final String list = value(arg).trim();
                    if (!list.isEmpty()) {
                        Arrays.stream(list.split(","))
                                .map(String::trim)
                                .filter(s -> !s.isEmpty())
                                .forEach(packages::add);
                    }
                    continue;
                }
                if (arg.startsWith("--moduleName=")) {
                    moduleName = value(arg);
                    continue;
                }
                if (arg.startsWith("--moduleVersion=")) {
                    moduleVersion = value(arg);
                    continue;
                }
                if (arg.startsWith("--summary=")) {
                    summaryFile = Paths.get(value(arg));
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (target == null) {
                    target = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }
        } catch (IllegalArgumentException ex) {
            System.err.println("ERROR: invalid argument: " + safeMsg(ex.getMessage()));
            printUsage();
            return 2;
        }

        if (target == null) {
            System.err.println("ERROR: missing target JAR or classes directory");
            printUsage();
            return 2;
        }

        try {
            target = target.toAbsolutePath().normalize();
            if (!Files.exists(target)) {
                throw new IOException("Target not found: " + target);
            }
            if (output == null) {
                output = defaultOutput(target, format);
            }

            final ModuleResolver resolver = new ModuleResolver(Paths.get("").toAbsolutePath());
            if (referenceFile != null) {
                references.addAll(ModuleResolver.loadReferenceFile(referenceFile));
            }
            final List<Path> referencePaths = resolver.resolveReferences(references);
            final ModuleIdentity identity = ModuleIdentity.resolve(target, moduleName, moduleVersion);

            final ExtractionResult result;
            try (LoadedModule loaded = new ClassFileLoader(referencePaths, includeJdk).load(target, identity, packages)) {
                final CrossReferenceProvider crossReferences = crossReferences(loaded, sourceDirs);
                try (TripleSink sink = openSink(output, format)) {
                    result = new GraphExtractor(sink, options, crossReferences).extract(loaded.module());
                }
            }

            if (summaryFile != null) {
                final List<String> referenceNames = new ArrayList<>();
                referencePaths.forEach(p -> referenceNames.add(p.toString()));
                final SummaryWriter.RunSummary summary = SummaryWriter.summarize(
                        Instant.now().toString(),
                        new SummaryWriter.ModuleInfo(identity.name(), identity.version(), target.toString()),
                        result,
                        options,
                        new SummaryWriter.OutputInfo(output.toString(), format),
                        referenceNames);
                new SummaryWriter().write(summaryFile, summary);
            }

            System.out.println("Type graph written to: " + output);
            System.out.println("Module: " + identity.name() + " " + identity.version()
                    + ", types: " + result.typeCount()
                    + ", triples: " + result.tripleCount());
            return 0;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (UncheckedIOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getCause().getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to extract type graph: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static CrossReferenceProvider crossReferences(LoadedModule loaded, List<Path> sourceDirs) throws IOException {
        final List<CrossReferenceProvider> providers = new ArrayList<>();
        providers.add(new DeclaredExceptionsProvider());
        if (!sourceDirs.isEmpty()) {
            providers.add(JavadocCrossReferenceProvider.load(sourceDirs, loaded));
        }
        return new CompositeCrossReferenceProvider(providers);
    }

    private static TripleSink openSink(Path output, String format) throws IOException {
        return FORMAT_TURTLE.equals(format) ? TurtleSink.open(output) : NTriplesSink.open(output);
    }

    static Path defaultOutput(Path target, String format) {
        String base = target.getFileName().toString();
        if (base.toLowerCase(Locale.ROOT).endsWith(".jar")) {
            base = base.substring(0, base.length() - ".jar".length());
        }
        return target.resolveSibling(base + (FORMAT_TURTLE.equals(format) ? ".ttl" : ".nt"));
    }

    static String normalizeFormat(String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "ntriples", "nt" -> FORMAT_NTRIPLES;
            case "turtle", "ttl" -> FORMAT_TURTLE;
            default -> null;
        };
    }

    private static String value(String arg) {
        return arg.substring(arg.indexOf('=') + 1);
    }

    private static void setRootLevel(Level level) {
        if (LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger root) {
            root.setLevel(level);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: jvm-typegraph <target.jar|classes-dir> [options]");
        System.out.println("Options:");
        System.out.println("  --output=<path>                 Output file (default: target with .nt/.ttl extension)");
        System.out.println("  --format=ntriples|turtle        Output syntax (default: ntriples)");
        System.out.println("  --baseUri=<iri>                 Base IRI for minted identifiers");
        System.out.println("  --includePrivate=<bool>         Include private types and members (default: false)");
        System.out.println("  --includeInternal=<bool>        Include package-private types and members (default: true)");
        System.out.println("  --includeCompilerGenerated=<bool>  Include synthetic declarations (default: false)");
        System.out.println("  --includeAttributes=<bool>      Describe annotations (default: true)");
        System.out.println("  --includeExternalTypes=<bool>   Describe referenced types from other modules (default: true)");
        System.out.println("  --extractExceptions=<bool>      Emit throws edges (default: true)");
        System.out.println("  --extractSeeAlso=<bool>         Emit related-to edges from @see (default: true)");
        System.out.println("  --maxTypeDepth=<n>              Nesting cap for referenced types (default: 256)");
        System.out.println("  --includeJdk=<bool>             Resolve JDK classes from the running runtime (default: true)");
        System.out.println("  --reference=<path>              Dependency JAR, classes dir or dir of JARs (repeatable)");
        System.out.println("  --referenceFile=<path>          File with one reference path per line");
        System.out.println("  --sources=<dir>                 Source directory for documentation cross references (repeatable)");
        System.out.println("  --packages=<p1,p2>              Only walk these packages and their sub-packages");
        System.out.println("  --moduleName=<name>             Override the module name");
        System.out.println("  --moduleVersion=<version>       Override the module version");
        System.out.println("  --summary=<path>                Write a JSON run summary");
        System.out.println("  --verbose, --quiet              Log at DEBUG / WARN");
        System.out.println("  --help, -h                      Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
