package ai.typegraph.loader;

import static ai.typegraph.testutil.RecordingSink.tg;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.typegraph.graph.CrossReferenceProvider;
import ai.typegraph.graph.ExtractionOptions;
import ai.typegraph.graph.ExtractionResult;
import ai.typegraph.graph.GraphExtractor;
import ai.typegraph.model.IriMinter;
import ai.typegraph.modules.ModuleIdentity;
import ai.typegraph.scan.CompositeCrossReferenceProvider;
import ai.typegraph.scan.DeclaredExceptionsProvider;
import ai.typegraph.symbols.Accessibility;
import ai.typegraph.symbols.ArrayTypeSymbol;
import ai.typegraph.symbols.AttributeData;
import ai.typegraph.symbols.FieldSymbol;
import ai.typegraph.symbols.MemberSymbol;
import ai.typegraph.symbols.MethodKind;
import ai.typegraph.symbols.MethodSymbol;
import ai.typegraph.symbols.NamedTypeSymbol;
import ai.typegraph.symbols.NamespaceSymbol;
import ai.typegraph.symbols.ParameterSymbol;
import ai.typegraph.symbols.PropertySymbol;
import ai.typegraph.symbols.Symbol;
import ai.typegraph.symbols.TypeKind;
import ai.typegraph.symbols.TypeParameterSymbol;
import ai.typegraph.symbols.TypeSymbol;
import ai.typegraph.symbols.TypedConstant;
import ai.typegraph.testutil.FixtureClasses;
import ai.typegraph.testutil.RecordingSink;
import fixtures.sample.SampleService;

class ClassFileLoaderTest {

    private static final ModuleIdentity FIXTURES = new ModuleIdentity("fixtures", "1.0");

    @TempDir
    Path tmp;

    private Path classes;
    private LoadedModule loaded;

    @BeforeEach
    void setUp() throws IOException {
        classes = FixtureClasses.copyPackage(SampleService.class, tmp.resolve("classes"));
    }

    @AfterEach
    void tearDown() {
        if (loaded != null) {
            loaded.close();
        }
    }

    private LoadedModule load(Set<String> packages) throws IOException {
        loaded = new ClassFileLoader(List.of()).load(classes, FIXTURES, packages);
        return loaded;
    }

    private NamedTypeSymbol type(String binaryName) {
        final NamedTypeSymbol type = loaded.findType(binaryName);
        assertThat(LoadedModule.isResolved(type)).as(binaryName).isTrue();
        return type;
    }

    private static NamespaceSymbol namespace(NamespaceSymbol root, String dotted) {
        NamespaceSymbol current = root;
        for (String part : dotted.split("\\.")) {
            current = current.namespaceMembers().stream()
                    .filter(ns -> ns.name().equals(part))
                    .findFirst()
                    .orElseThrow(() -> new AssertionError("no namespace " + part));
        }
        return current;
    }

    private static List<String> names(List<? extends NamedTypeSymbol> types) {
        return types.stream().map(NamedTypeSymbol::name).collect(Collectors.toList());
    }

    private static List<MethodSymbol> methods(NamedTypeSymbol type, String name) {
        return type.members().stream()
                .filter(m -> m instanceof MethodSymbol && m.name().equals(name))
                .map(m -> (MethodSymbol) m)
                .collect(Collectors.toList());
    }

    private static MethodSymbol method(NamedTypeSymbol type, String name) {
        final List<MethodSymbol> found = methods(type, name);
        assertThat(found).as(name).hasSize(1);
        return found.get(0);
    }

    private static MemberSymbol member(NamedTypeSymbol type, String name) {
        return type.members().stream()
                .filter(m -> !(m instanceof MethodSymbol) && m.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no member " + name));
    }

    @Test
    void topLevelTypesAreListedInTheirPackages() throws IOException {
        final LoadedModule module = load(Set.of());

        assertThat(module.module().name()).isEqualTo("fixtures");
        assertThat(module.module().version()).isEqualTo("1.0");

        final NamespaceSymbol sample = namespace(module.module().globalNamespace(), "fixtures.sample");
        assertThat(sample.fullName()).isEqualTo("fixtures.sample");
        assertThat(names(sample.typeMembers())).containsExactly(
                "AbstractBase", "Edge", "Marker", "Node", "PackagePrivateHelper",
                "Point", "Priority", "SampleService", "Shape");
        assertThat(names(namespace(sample, "sub").typeMembers())).containsExactly("SubThing");
    }

    @Test
    void packageFilterLimitsWalkedNamespacesButNotLookups() throws IOException {
        final LoadedModule module = load(Set.of("fixtures.sample.sub"));

        final NamespaceSymbol sample = namespace(module.module().globalNamespace(), "fixtures.sample");
        assertThat(sample.typeMembers()).isEmpty();
        assertThat(names(namespace(sample, "sub").typeMembers())).containsExactly("SubThing");

        assertThat(module.declaredTypes()).extracting(NamedTypeSymbol::name).contains("SampleService");
        assertThat(LoadedModule.isResolved(module.findType("fixtures.sample.SampleService"))).isTrue();
    }

    @Test
    void packageMatchingIncludesSubPackages() {
        assertThat(ClassFileLoader.matches("a.b", Set.of())).isTrue();
        assertThat(ClassFileLoader.matches("a.b", Set.of("a.b"))).isTrue();
        assertThat(ClassFileLoader.matches("a.b.c", Set.of("a.b"))).isTrue();
        assertThat(ClassFileLoader.matches("a.bc", Set.of("a.b"))).isFalse();
        assertThat(ClassFileLoader.matches("a", Set.of("a.b"))).isFalse();
    }

    @Test
    void genericClassShape() throws IOException {
        load(Set.of());
        final NamedTypeSymbol service = type("fixtures.sample.SampleService");

        assertThat(service.typeKind()).isEqualTo(TypeKind.CLASS);
        assertThat(service.accessibility()).isEqualTo(Accessibility.PUBLIC);
        assertThat(service.isAbstract()).isFalse();
        assertThat(service.typeParameters()).extracting(TypeParameterSymbol::name).containsExactly("K", "V");
        assertThat(service.typeParameters().get(0).constraintTypes())
                .singleElement()
                .satisfies(c -> assertThat(c.displayName()).startsWith("java.lang.Comparable"));
        assertThat(service.baseType().name()).isEqualTo("AbstractBase");
        assertThat(names(service.interfaces())).containsExactly("Shape");

        assertThat(names(service.typeMembers())).containsExactly("InnerItem", "Nested");
        final NamedTypeSymbol nested = type("fixtures.sample.SampleService$Nested");
        assertThat(nested.isStatic()).isTrue();
        assertThat(nested.containingType()).isSameAs(service);
        assertThat(names(nested.typeMembers())).containsExactly("Inner");
        assertThat(type("fixtures.sample.SampleService$InnerItem").isStatic()).isFalse();
    }

    @Test
    void kindsOfOtherTypes() throws IOException {
        load(Set.of());

        assertThat(type("fixtures.sample.Shape").typeKind()).isEqualTo(TypeKind.INTERFACE);
        assertThat(type("fixtures.sample.Marker").typeKind()).isEqualTo(TypeKind.INTERFACE);
        assertThat(type("fixtures.sample.Priority").typeKind()).isEqualTo(TypeKind.ENUM);
        assertThat(type("fixtures.sample.AbstractBase").isAbstract()).isTrue();
        assertThat(type("fixtures.sample.PackagePrivateHelper").accessibility()).isEqualTo(Accessibility.INTERNAL);

        final NamedTypeSymbol point = type("fixtures.sample.Point");
        assertThat(point.isRecord()).isTrue();
        final PropertySymbol x = point.members().stream()
                .filter(m -> m instanceof PropertySymbol && m.name().equals("x"))
                .map(m -> (PropertySymbol) m)
                .findFirst()
                .orElseThrow();
        assertThat(member(point, "x")).isInstanceOf(FieldSymbol.class);
        assertThat(x.getMethod()).isNotNull();
        assertThat(x.getMethod().methodKind()).isEqualTo(MethodKind.PROPERTY_GET);
    }

    @Test
    void fieldsCarryConstantsAndModifiers() throws IOException {
        load(Set.of());
        final NamedTypeSymbol service = type("fixtures.sample.SampleService");

        final FieldSymbol limit = (FieldSymbol) member(service, "LIMIT");
        assertThat(limit.isConst()).isTrue();
        assertThat(limit.constantValue()).isEqualTo(42);
        assertThat(((FieldSymbol) member(service, "GREETING")).constantValue()).isEqualTo("hi");

        final FieldSymbol counter = (FieldSymbol) member(service, "counter");
        assertThat(counter.isVolatile()).isTrue();
        assertThat(counter.accessibility()).isEqualTo(Accessibility.PROTECTED);
        assertThat(counter.type().name()).isEqualTo("long");

        final FieldSymbol names = (FieldSymbol) member(service, "names");
        assertThat(names.isReadOnly()).isTrue();
        assertThat(names.isConst()).isFalse();
        assertThat(names.accessibility()).isEqualTo(Accessibility.INTERNAL);

        assertThat(member(service, "secret").accessibility()).isEqualTo(Accessibility.PRIVATE);
    }

    @Test
    void methodsCarrySignaturesAndModifiers() throws IOException {
        load(Set.of());
        final NamedTypeSymbol service = type("fixtures.sample.SampleService");

        final MethodSymbol lookup = method(service, "lookup");
        assertThat(lookup.parameters()).extracting(ParameterSymbol::name).containsExactly("key");
        assertThat(lookup.parameters().get(0).type()).isInstanceOf(TypeParameterSymbol.class);
        assertThat(lookup.returnType().name()).isEqualTo("V");
        assertThat(lookup.declaredExceptions()).extracting(t -> t.displayName()).containsExactly("java.io.IOException");

        assertThat(methods(service, "put")).hasSize(3);
        assertThat(methods(service, "<init>")).hasSize(2)
                .allSatisfy(c -> assertThat(c.methodKind()).isEqualTo(MethodKind.CONSTRUCTOR));

        final ParameterSymbol parts = method(service, "join").parameters().get(0);
        assertThat(parts.isParams()).isTrue();
        assertThat(parts.type()).isInstanceOf(ArrayTypeSymbol.class);

        final MethodSymbol first = method(service, "first");
        assertThat(first.typeParameters()).extracting(TypeParameterSymbol::name).containsExactly("T");

        final MethodSymbol grid = method(service, "grid");
        assertThat(grid.returnType()).isInstanceOf(ArrayTypeSymbol.class);
        assertThat(((ArrayTypeSymbol) grid.returnType()).elementType()).isInstanceOf(ArrayTypeSymbol.class);

        final MethodSymbol describe = method(service, "describe");
        assertThat(describe.isOverride()).isTrue();
        assertThat(describe.overriddenMethod().containingType().name()).isEqualTo("AbstractBase");
        assertThat(method(service, "area").isOverride()).isFalse();

        assertThat(method(service, "hidden").accessibility()).isEqualTo(Accessibility.PRIVATE);
        assertThat(method(service, "packageLevel").accessibility()).isEqualTo(Accessibility.INTERNAL);
        assertThat(method(service, "packageLevel").isStatic()).isTrue();
    }

    @Test
    void enumSupportMethodsAreCompilerGenerated() throws IOException {
        load(Set.of());
        final NamedTypeSymbol priority = type("fixtures.sample.Priority");

        assertThat(method(priority, "values").isCompilerGenerated()).isTrue();
        assertThat(method(priority, "valueOf").isCompilerGenerated()).isTrue();
        assertThat(((FieldSymbol) member(priority, "HIGH")).isCompilerGenerated()).isFalse();
    }

    @Test
    void anonymousClassesAreLoadedButNotListed() throws IOException {
        final LoadedModule module = load(Set.of());
        final NamedTypeSymbol anonymous = type("fixtures.sample.SampleService$1");

        assertThat(anonymous.isCompilerGenerated()).isTrue();
        assertThat(anonymous.accessibility()).isEqualTo(Accessibility.PRIVATE);
        assertThat(module.declaredTypes()).contains(anonymous);
        assertThat(type("fixtures.sample.SampleService").typeMembers()).doesNotContain(anonymous);
    }

    @Test
    void annotationsBecomeAttributesWithNamedArguments() throws IOException {
        load(Set.of());
        final NamedTypeSymbol service = type("fixtures.sample.SampleService");

        final AttributeData marker = service.attributes().get(0);
        assertThat(marker.attributeClass().name()).isEqualTo("Marker");
        assertThat(marker.constructorArguments()).isEmpty();
        assertThat(marker.namedArguments()).extracting(AttributeData.NamedArgument::name)
                .containsExactly("value", "tags", "level");
        assertThat(marker.namedArguments().get(0).value()).isEqualTo(TypedConstant.of("service"));
        assertThat(marker.namedArguments().get(1).value().values()).hasSize(2);
        assertThat(marker.namedArguments().get(2).value())
                .isEqualTo(TypedConstant.ofEnum("fixtures.sample.Priority.HIGH"));

        assertThat(method(service, "hidden").attributes()).singleElement()
                .satisfies(a -> assertThat(a.attributeClass().name()).isEqualTo("Marker"));
    }

    @Test
    void annotationsOfMissingClassesAreNotEmitted() throws IOException {
        Files.delete(classes.resolve("fixtures/sample/Marker.class"));
        final LoadedModule module = load(Set.of());
        final NamedTypeSymbol service = type("fixtures.sample.SampleService");
        assertThat(service.attributes()).singleElement()
                .satisfies(a -> assertThat(a.attributeClass()).isNull());

        final RecordingSink sink = new RecordingSink();
        final GraphExtractor extractor = new GraphExtractor(sink, ExtractionOptions.defaults(),
                new DeclaredExceptionsProvider());
        extractor.extract(module.module());

        final String serviceIri = extractor.iris().type(service);
        final String attrIri = extractor.iris().attribute(service, 0);
        assertThat(sink.objects(serviceIri, tg("hasAttribute"))).isEmpty();
        assertThat(sink.facts()).noneMatch(f -> f.subject().equals(attrIri) || f.object().equals(attrIri));
        assertThat(sink.facts()).noneMatch(f -> f.object().endsWith("fixtures.sample.Marker"));
    }

    @Test
    void constructedTypesCompareByDefinitionAndArguments() throws IOException {
        load(Set.of());
        final NamedTypeSymbol list = type("java.util.List");
        final NamedTypeSymbol string = type("java.lang.String");
        final ConstructedType listOfString = new ConstructedType(list, List.of(string));
        final ConstructedType again = new ConstructedType(list, List.of(string));

        assertThat(listOfString).isEqualTo(again).hasSameHashCodeAs(again);
        assertThat(listOfString).isNotEqualTo(new ConstructedType(list, List.of(type("java.lang.Integer"))));
        assertThat(listOfString).isNotEqualTo(list);

        final CrossReferenceProvider first = seeAlso(listOfString);
        final CrossReferenceProvider second = seeAlso(again);
        final CompositeCrossReferenceProvider composite = new CompositeCrossReferenceProvider(List.of(first, second));
        assertThat(composite.seeAlsoFor(list)).containsExactly(listOfString);
    }

    private static CrossReferenceProvider seeAlso(Symbol related) {
        return new CrossReferenceProvider() {
            @Override
            public List<TypeSymbol> exceptionTypesFor(Symbol symbol) {
                return List.of();
            }

            @Override
            public List<Symbol> seeAlsoFor(Symbol symbol) {
                return List.of(related);
            }
        };
    }

    @Test
    void missingClassesStayUnresolved() throws IOException {
        load(Set.of());

        assertThat(LoadedModule.isResolved(loaded.findType("fixtures.sample.Missing"))).isFalse();
        assertThat(loaded.findType("fixtures.sample.Missing")).isNotNull();
    }

    @Test
    void withoutJdkLookupPlatformTypesStayUnresolved() throws IOException {
        loaded = new ClassFileLoader(List.of(), false).load(classes, FIXTURES, Set.of());

        assertThat(LoadedModule.isResolved(loaded.findType("java.lang.Object"))).isFalse();
        assertThat(LoadedModule.isResolved(loaded.findType("fixtures.sample.Point"))).isTrue();
    }

    @Test
    void loadsFromJar() throws IOException {
        final Path jar = FixtureClasses.jar(classes, tmp.resolve("fixtures-1.0.jar"), null);
        loaded = new ClassFileLoader(List.of()).load(jar, ModuleIdentity.of(jar), Set.of());

        assertThat(loaded.module().name()).isEqualTo("fixtures");
        assertThat(loaded.module().version()).isEqualTo("1.0");
        assertThat(LoadedModule.isResolved(loaded.findType("fixtures.sample.SampleService$Nested$Inner"))).isTrue();
    }

    @Test
    void referenceEntriesResolveTypesOutsideTheTarget() throws IOException {
        // target holds only the sub package, the rest comes from a reference
        final Path target = FixtureClasses.copyPackage(fixtures.sample.sub.SubThing.class, tmp.resolve("sub"));
        loaded = new ClassFileLoader(List.of(classes)).load(target, FIXTURES, Set.of());

        final NamedTypeSymbol service = loaded.findType("fixtures.sample.SampleService");
        assertThat(LoadedModule.isResolved(service)).isTrue();
        assertThat(service.containingModule()).isNotSameAs(loaded.module());
        assertThat(service.containingModule().name()).isEqualTo("classes");
        assertThat(loaded.declaredTypes()).extracting(NamedTypeSymbol::name).containsExactly("SubThing");
    }

    @Test
    void missingTargetFails() {
        assertThatThrownBy(() -> new ClassFileLoader(List.of()).load(tmp.resolve("nope.jar"), FIXTURES, Set.of()))
                .isInstanceOf(IOException.class);
    }

    @Test
    void extractsLoadedModuleEndToEnd() throws IOException {
        final LoadedModule module = load(Set.of());
        final RecordingSink sink = new RecordingSink();
        final GraphExtractor extractor = new GraphExtractor(sink, ExtractionOptions.defaults(),
                new DeclaredExceptionsProvider());
        final IriMinter iris = extractor.iris();

        final ExtractionResult result = extractor.extract(module.module());

        // nine top-level types, SubThing, and Nested, Inner, InnerItem
        assertThat(result.typeCount()).isEqualTo(13);

        final NamedTypeSymbol service = type("fixtures.sample.SampleService");
        final String serviceIri = iris.type(service);
        assertThat(sink.kinds(serviceIri)).containsExactly(tg("Type"), tg("Class"));
        assertThat(sink.kinds(iris.type(type("fixtures.sample.Shape")))).containsExactly(tg("Type"), tg("Interface"));
        assertThat(sink.kinds(iris.type(type("fixtures.sample.Priority")))).containsExactly(tg("Type"), tg("Enum"));
        assertThat(sink.kinds(iris.type(type("fixtures.sample.Point")))).containsExactly(tg("Type"), tg("Record"));
        assertThat(sink.kinds(iris.type(type("fixtures.sample.SampleService$1")))).isEmpty();

        final String putInt = iris.member(methods(service, "put").stream()
                .filter(m -> m.parameters().size() == 1 && m.parameters().get(0).type().name().equals("int"))
                .findFirst().orElseThrow());
        assertThat(putInt).endsWith("put(int)");
        assertThat(sink.objects(serviceIri, tg("hasMember"))).contains(putInt);

        // private members are left out by default
        assertThat(sink.objects(serviceIri, tg("hasMember"))).doesNotContain(iris.member(method(service, "hidden")));

        final MethodSymbol describe = method(service, "describe");
        assertThat(sink.has(iris.member(describe), tg("overridesMethod"),
                iris.member(describe.overriddenMethod()))).isTrue();
        assertThat(sink.has(iris.member(method(service, "lookup")), tg("throws"),
                iris.type(loaded.findType("java.io.IOException")))).isTrue();

        final String markerIri = iris.attribute(service, 0);
        assertThat(sink.has(serviceIri, tg("hasAttribute"), markerIri)).isTrue();
        assertThat(sink.objects(markerIri, tg("namedArguments"))).singleElement()
                .satisfies(args -> assertThat(args)
                        .contains("value=\"service\"")
                        .contains("level=fixtures.sample.Priority.HIGH"));
    }
}
