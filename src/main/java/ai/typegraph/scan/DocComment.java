package ai.typegraph.scan;

import java.util.List;

/**
 * Cross-reference tags of one documented declaration.
 *
 * @param typeName   binary name of the declaring type, e.g. {@code com.acme.Outer$Inner}
 * @param memberName method name, {@code <init>} for constructors, {@code null} for the type itself
 * @param parameterTypes raw simple parameter type names; {@code *} stands for a type variable
 * @param throwsNames type names from {@code @throws} and {@code @exception}, as written
 * @param seeReferences {@code @see} targets, as written
 * @param packageName package of the compilation unit
 * @param imports single-type imports of the compilation unit
 */
public record DocComment(
        String typeName,
        String memberName,
        List<String> parameterTypes,
        List<String> throwsNames,
        List<String> seeReferences,
        String packageName,
        List<String> imports) {

    public static final String CONSTRUCTOR = "<init>";

    public DocComment {
        parameterTypes = List.copyOf(parameterTypes);
        throwsNames = List.copyOf(throwsNames);
        seeReferences = List.copyOf(seeReferences);
        imports = List.copyOf(imports);
    }

    public boolean isTypeComment() {
        return memberName == null;
    }
}
