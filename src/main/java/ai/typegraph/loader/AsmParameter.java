package ai.typegraph.loader;

import java.util.List;

import ai.typegraph.symbols.AttributeData;
import ai.typegraph.symbols.MemberSymbol;
import ai.typegraph.symbols.ParameterSymbol;
import ai.typegraph.symbols.TypeSymbol;

final class AsmParameter implements ParameterSymbol {

    private final AsmMethod method;
    private final int ordinal;
    private final String name;
    private final TypeRef typeRef;
    private final boolean params;
    private final List<ClassModel.AnnotationModel> annotations;
    private TypeSymbol type;

    AsmParameter(AsmMethod method, int ordinal, String name, TypeRef typeRef, boolean params,
                 List<ClassModel.AnnotationModel> annotations) {
        this.method = method;
        this.ordinal = ordinal;
        this.name = name;
        this.typeRef = typeRef;
        this.params = params;
        this.annotations = annotations;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int ordinal() {
        return ordinal;
    }

    @Override
    public TypeSymbol type() {
        if (type == null) {
            type = method.universe().resolve(typeRef, method);
        }
        return type;
    }

    @Override
    public MemberSymbol containingSymbol() {
        return method;
    }

    @Override
    public boolean isParams() {
        return params;
    }

    @Override
    public List<AttributeData> attributes() {
        return method.universe().annotations().convert(annotations);
    }

    @Override
    public String toString() {
        return name;
    }
}
