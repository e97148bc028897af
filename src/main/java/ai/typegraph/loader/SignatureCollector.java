package ai.typegraph.loader;

import java.util.ArrayList;
import java.util.List;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.signature.SignatureReader;
import org.objectweb.asm.signature.SignatureVisitor;

/**
 * Collects the parts of a class or method generic signature.
 */
final class SignatureCollector extends SignatureVisitor {

    record FormalTypeParameter(String name, List<TypeRef> bounds) {
    }

    final List<FormalTypeParameter> typeParameters = new ArrayList<>();
    final List<TypeRef> interfaces = new ArrayList<>();
    final List<TypeRef> parameters = new ArrayList<>();
    final List<TypeRef> exceptions = new ArrayList<>();
    TypeRef superclass;
    TypeRef returnType;

    private SignatureCollector() {
        super(Opcodes.ASM9);
    }

    static SignatureCollector parse(String signature) {
        final SignatureCollector collector = new SignatureCollector();
        new SignatureReader(signature).accept(collector);
        return collector;
    }

    static TypeRef parseType(String signature) {
        final TypeRef[] out = new TypeRef[1];
        new SignatureReader(signature).acceptType(new TypeRefBuilder(t -> out[0] = t));
        return out[0];
    }

    @Override
    public void visitFormalTypeParameter(String name) {
        typeParameters.add(new FormalTypeParameter(name, new ArrayList<>()));
    }

    @Override
    public SignatureVisitor visitClassBound() {
        return new TypeRefBuilder(currentBounds()::add);
    }

    @Override
    public SignatureVisitor visitInterfaceBound() {
        return new TypeRefBuilder(currentBounds()::add);
    }

    @Override
    public SignatureVisitor visitSuperclass() {
        return new TypeRefBuilder(t -> superclass = t);
    }

    @Override
    public SignatureVisitor visitInterface() {
        return new TypeRefBuilder(interfaces::add);
    }

    @Override
    public SignatureVisitor visitParameterType() {
        return new TypeRefBuilder(parameters::add);
    }

    @Override
    public SignatureVisitor visitReturnType() {
        return new TypeRefBuilder(t -> returnType = t);
    }

    @Override
    public SignatureVisitor visitExceptionType() {
        return new TypeRefBuilder(exceptions::add);
    }

    private List<TypeRef> currentBounds() {
        return typeParameters.get(typeParameters.size() - 1).bounds();
    }
}
