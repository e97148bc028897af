package ai.typegraph.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import ai.typegraph.symbols.RefKind;
import ai.typegraph.testutil.Stubs;

class IriMinterTest {

    private final IriMinter iris = new IriMinter("http://example.org/");
    private final Stubs.Module module = new Stubs.Module("Sample", "1.2.0");
    private final Stubs.Module lib = new Stubs.Module("java.base", "17");
    private final Stubs.Type string = lib.type("java.lang", "String");
    private final Stubs.Type intType = lib.type("java.lang", "Integer");

    @Test
    void trailingSlashesAreTrimmedFromTheBase() {
        assertThat(new IriMinter("http://example.org///").baseUri()).isEqualTo("http://example.org");
        assertThat(iris.module(module)).isEqualTo("http://example.org/assembly/Sample/1.2.0");
    }

    @Test
    void sameSymbolAlwaysMintsTheSameIri() {
        final Stubs.Type c = module.type("Sample", "C");
        final Stubs.Method m = c.method("M").param("s", string);

        assertThat(iris.type(c)).isEqualTo(iris.type(c));
        assertThat(iris.member(m)).isEqualTo(iris.member(m));
        assertThat(iris.type(c)).isEqualTo("http://example.org/type/Sample/1.2.0/Sample.C");
    }

    @Test
    void namespacesAreSharedByPathAndGlobalHasItsOwnIri() {
        final Stubs.Type a = module.type("A.B.C", "First");
        final Stubs.Type b = module.type("A.B.C", "Second");

        assertThat(iris.namespace(a.containingNamespace())).isEqualTo(iris.namespace(b.containingNamespace()))
                .isEqualTo("http://example.org/namespace/A.B.C");
        assertThat(iris.namespace(module.globalNamespace())).isEqualTo("http://example.org/namespace/_global_");
    }

    @Test
    void deeplyNestedTypeNamesEveryAncestor() {
        final Stubs.Type outer = module.type("Sample", "Outer");
        final Stubs.Type deepest = outer.nested("Level1").nested("Level2").nested("Level3");

        assertThat(iris.type(deepest))
                .endsWith("/Sample.Outer%2BLevel1%2BLevel2%2BLevel3")
                .contains("Outer", "Level1", "Level2", "Level3");
    }

    @Test
    void genericArityAndArgumentsAreEncoded() {
        final Stubs.Type list = lib.type("java.util", "List");
        list.typeParameter("E");
        final Stubs.Type listOfString = list.construct(string);

        assertThat(IriMinter.fullMetadataName(list)).isEqualTo("java.util.List`1");
        assertThat(IriMinter.fullMetadataName(listOfString)).isEqualTo("java.util.List`1[java.lang.String]");
        assertThat(iris.type(list)).isNotEqualTo(iris.type(listOfString));
    }

    @Test
    void arraysAndTypeParametersHaveDistinctNames() {
        final Stubs.Type box = module.type("Sample", "Box");
        final Stubs.TypeParam t = box.typeParameter("T");

        assertThat(IriMinter.fullMetadataName(new Stubs.Array(string, 1))).isEqualTo("java.lang.String[]");
        assertThat(IriMinter.fullMetadataName(new Stubs.Array(string, 2))).isEqualTo("java.lang.String[][]");
        assertThat(IriMinter.fullMetadataName(new Stubs.Pointer(intType))).isEqualTo("java.lang.Integer*");
        assertThat(IriMinter.fullMetadataName(t)).isEqualTo("T:Sample.Box`1.T");
    }

    @Test
    void overloadsByCountOrTypeMintDistinctIris() {
        final Stubs.Type c = module.type("Sample", "C");
        final Stubs.Method byString = c.method("M").param("s", string);
        final Stubs.Method byInt = c.method("M").param("i", intType);
        final Stubs.Method byTwo = c.method("M").param("a", intType).param("b", intType);
        final Stubs.Method none = c.method("M");

        assertThat(iris.member(byString)).endsWith("/member/M(java.lang.String)");
        assertThat(iris.member(none)).endsWith("/member/M()");
        assertThat(java.util.Set.of(iris.member(byString), iris.member(byInt), iris.member(byTwo), iris.member(none)))
                .hasSize(4);
    }

    @Test
    void refAndOutOverloadsCollideOnOneIri() {
        final Stubs.Type c = module.type("Sample", "C");
        final Stubs.Method byRef = c.method("Parse").param("value", intType, RefKind.REF);
        final Stubs.Method byOut = c.method("Parse").param("value", intType, RefKind.OUT);
        final Stubs.Method byIn = c.method("Parse").param("value", intType, RefKind.IN);

        assertThat(iris.member(byRef)).isEqualTo(iris.member(byOut)).endsWith("Parse(ref java.lang.Integer)");
        assertThat(iris.member(byIn)).endsWith("Parse(in java.lang.Integer)");
    }

    @Test
    void indexerSignatureUsesBrackets() {
        final Stubs.Type c = module.type("Sample", "C");
        final Stubs.Property item = c.property("Item", string).indexParam("index", intType);
        final Stubs.Property plain = c.property("Name", string);

        assertThat(iris.member(item)).endsWith("/member/Item[java.lang.Integer]");
        assertThat(iris.member(plain)).endsWith("/member/Name");
    }

    @Test
    void parametersTypeParametersAndAttributesHangOffTheirOwner() {
        final Stubs.Type c = module.type("Sample", "C");
        final Stubs.Method m = c.method("Map").param("s", string);
        final Stubs.TypeParam u = m.typeParameter("U");

        final String methodIri = iris.member(m);
        assertThat(iris.parameter(m.parameters().get(0))).isEqualTo(methodIri + "/param/0");
        assertThat(iris.typeParameter(m, u)).isEqualTo(methodIri + "/typeparam/0");
        assertThat(iris.attribute(c, 1)).isEqualTo(iris.type(c) + "/attr/1");
        assertThat(iris.attribute(m.parameters().get(0), 0)).isEqualTo(methodIri + "/param/0/attr/0");
        assertThat(iris.attribute(module, 0)).isEqualTo(iris.module(module) + "/attr/0");
    }

    @Test
    void typeParameterOwnerMustBeTypeOrMethod() {
        final Stubs.Type c = module.type("Sample", "C");
        final Stubs.TypeParam t = c.typeParameter("T");
        final Stubs.Field f = c.field("f", string);

        assertThatThrownBy(() -> iris.typeParameter(f, t)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> iris.attribute(module.globalNamespace(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void typesWithoutModuleGoUnderBuiltin() {
        final Stubs.Type primitive = Stubs.builtin("int");

        assertThat(iris.type(primitive)).isEqualTo("http://example.org/type/_builtin_/int");
        assertThat(iris.type(new Stubs.Array(primitive, 1))).isEqualTo("http://example.org/type/_builtin_/int%5B%5D");
    }

    @Test
    void escapeKeepsUnreservedCharactersOnly() {
        assertThat(IriMinter.escape("a-b_c.d~e")).isEqualTo("a-b_c.d~e");
        assertThat(IriMinter.escape("a b/c<d>")).isEqualTo("a%20b%2Fc%3Cd%3E");
        assertThat(IriMinter.escape("é")).isEqualTo("%C3%A9");
        assertThat(IriMinter.escape(null)).isEmpty();
    }
}
