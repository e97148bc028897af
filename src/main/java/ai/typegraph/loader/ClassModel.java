package ai.typegraph.loader;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.objectweb.asm.Opcodes;

/**
 * Raw contents of one class file, as read by {@link ClassModelReader}.
 * Mutable while reading, treated as read-only afterwards.
 */
final class ClassModel {

    int access;
    String internalName;
    String signature;
    String superName;
    List<String> interfaces = List.of();

    // InnerClasses entry describing this class itself
    boolean hasOwnInnerClassEntry;
    String outerName;
    String innerName;
    int innerAccess;
    boolean enclosedInMethod;

    boolean record;

    final List<String> memberTypes = new ArrayList<>();
    final List<FieldModel> fields = new ArrayList<>();
    final List<MethodModel> methods = new ArrayList<>();
    final List<ComponentModel> components = new ArrayList<>();
    final List<AnnotationModel> annotations = new ArrayList<>();

    boolean isNestedMember() {
        return hasOwnInnerClassEntry && outerName != null && innerName != null && !enclosedInMethod;
    }

    boolean isLocalOrAnonymous() {
        return enclosedInMethod || (hasOwnInnerClassEntry && (outerName == null || innerName == null));
    }

    boolean isAnonymous() {
        return hasOwnInnerClassEntry && innerName == null;
    }

    boolean is(int flag) {
        return (access & flag) != 0;
    }

    boolean isInterface() {
        return is(Opcodes.ACC_INTERFACE);
    }

    static final class FieldModel {
        int access;
        String name;
        String descriptor;
        String signature;
        Object value;
        final List<AnnotationModel> annotations = new ArrayList<>();
    }

    static final class MethodModel {
        int access;
        String name;
        String descriptor;
        String signature;
        List<String> exceptions = List.of();
        final List<String> parameterNames = new ArrayList<>();
        final Map<Integer, String> localVariableNames = new HashMap<>();
        final List<AnnotationModel> annotations = new ArrayList<>();
        final Map<Integer, List<AnnotationModel>> parameterAnnotations = new HashMap<>();
        final List<AnnotationModel> returnTypeAnnotations = new ArrayList<>();

        boolean is(int flag) {
            return (access & flag) != 0;
        }
    }

    static final class ComponentModel {
        String name;
        String descriptor;
        String signature;
        final List<AnnotationModel> annotations = new ArrayList<>();
    }

    /**
     * One annotation occurrence. Element values are ASM's representation:
     * boxed primitives and strings, {@link org.objectweb.asm.Type} for class
     * literals, {@link EnumValue}, nested {@link AnnotationModel} and {@link List}
     * for arrays.
     */
    record AnnotationModel(String descriptor, boolean visible, List<Element> elements) {
    }

    record Element(String name, Object value) {
    }

    record EnumValue(String descriptor, String constant) {
    }
}
