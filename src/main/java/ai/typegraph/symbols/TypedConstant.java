package ai.typegraph.symbols;

import java.util.Collections;
import java.util.List;

/**
 * A compile-time constant used as an attribute argument.
 * Array constants carry {@link #values()}; all other kinds carry {@link #value()}.
 */
public record TypedConstant(Kind kind, Object value, List<TypedConstant> values) {

    public enum Kind {
        PRIMITIVE,
        ENUM,
        TYPE,
        ARRAY,
        ATTRIBUTE,
        ERROR
    }

    public static TypedConstant of(Object value) {
        return new TypedConstant(Kind.PRIMITIVE, value, null);
    }

    public static TypedConstant ofType(TypeSymbol type) {
        return new TypedConstant(Kind.TYPE, type, null);
    }

    /**
     * Enum constant rendered as {@code Type.CONSTANT}.
     */
    public static TypedConstant ofEnum(String qualifiedConstant) {
        return new TypedConstant(Kind.ENUM, qualifiedConstant, null);
    }

    public static TypedConstant ofArray(List<TypedConstant> values) {
        return new TypedConstant(Kind.ARRAY, null, values == null ? null : Collections.unmodifiableList(values));
    }

    public static TypedConstant ofAttribute(AttributeData nested) {
        return new TypedConstant(Kind.ATTRIBUTE, nested, null);
    }

    public boolean isNull() {
        return kind == Kind.ARRAY ? values == null : value == null;
    }
}
