package ai.typegraph.loader;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.signature.SignatureVisitor;

/**
 * Builds one {@link TypeRef} from a type signature. Wildcards collapse to
 * their bound, an unbounded wildcard to {@code Object}.
 */
final class TypeRefBuilder extends SignatureVisitor {

    private final Consumer<TypeRef> onDone;
    private String className;
    private List<TypeRef> arguments = new ArrayList<>();

    TypeRefBuilder(Consumer<TypeRef> onDone) {
        super(Opcodes.ASM9);
        this.onDone = onDone;
    }

    @Override
    public void visitBaseType(char descriptor) {
        onDone.accept(new TypeRef.Base(descriptor));
    }

    @Override
    public void visitTypeVariable(String name) {
        onDone.accept(new TypeRef.Variable(name));
    }

    @Override
    public SignatureVisitor visitArrayType() {
        return new TypeRefBuilder(component -> onDone.accept(new TypeRef.Array(component)));
    }

    @Override
    public void visitClassType(String name) {
        className = name;
        arguments = new ArrayList<>();
    }

    @Override
    public void visitInnerClassType(String name) {
        className = className + "$" + name;
        arguments = new ArrayList<>();
    }

    @Override
    public void visitTypeArgument() {
        arguments.add(TypeRef.ClassType.OBJECT);
    }

    @Override
    public SignatureVisitor visitTypeArgument(char wildcard) {
        final List<TypeRef> target = arguments;
        return new TypeRefBuilder(target::add);
    }

    @Override
    public void visitEnd() {
        onDone.accept(new TypeRef.ClassType(className, arguments));
    }
}
