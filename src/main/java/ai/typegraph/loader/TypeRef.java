package ai.typegraph.loader;

import java.util.List;

import org.objectweb.asm.Type;

/**
 * Unresolved type reference read from a descriptor or generic signature.
 * Resolved to a symbol only when something asks for it.
 */
interface TypeRef {

    /**
     * @param descriptor primitive descriptor character, {@code V} for void
     */
    record Base(char descriptor) implements TypeRef {
    }

    record Array(TypeRef element) implements TypeRef {
    }

    record Variable(String name) implements TypeRef {
    }

    /**
     * @param internalName binary name with slashes, nested levels joined by {@code $}
     * @param arguments    innermost level's type arguments; empty for raw or non-generic use
     */
    record ClassType(String internalName, List<TypeRef> arguments) implements TypeRef {

        static final ClassType OBJECT = new ClassType("java/lang/Object", List.of());

        public ClassType {
            arguments = List.copyOf(arguments);
        }
    }

    static TypeRef fromDescriptor(String descriptor) {
        return fromAsmType(Type.getType(descriptor));
    }

    static TypeRef fromAsmType(Type type) {
        return switch (type.getSort()) {
            case Type.ARRAY -> {
                TypeRef ref = fromAsmType(type.getElementType());
                for (int i = 0; i < type.getDimensions(); i++) {
                    ref = new Array(ref);
                }
                yield ref;
            }
            case Type.OBJECT -> new ClassType(type.getInternalName(), List.of());
            default -> new Base(type.getDescriptor().charAt(0));
        };
    }
}
