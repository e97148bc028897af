package ai.typegraph.loader;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

import org.objectweb.asm.AnnotationVisitor;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.FieldVisitor;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.RecordComponentVisitor;
import org.objectweb.asm.TypePath;
import org.objectweb.asm.TypeReference;

/**
 * Reads a class file into a {@link ClassModel} with ASM.
 */
final class ClassModelReader {

    private ClassModelReader() {
    }

    /**
     * @throws IllegalArgumentException when the bytes are not a readable class file
     */
    static ClassModel read(byte[] bytes) {
        final ClassModel model = new ClassModel();
        final ClassReader reader;
        try {
            reader = new ClassReader(bytes);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Not a class file: " + ex.getMessage(), ex);
        }
        try {
            reader.accept(new ModelVisitor(model), ClassReader.SKIP_FRAMES);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed class file " + model.internalName + ": " + ex.getMessage(), ex);
        }
        return model;
    }

    private static final class ModelVisitor extends ClassVisitor {

        private final ClassModel model;

        ModelVisitor(ClassModel model) {
            super(Opcodes.ASM9);
            this.model = model;
        }

        @Override
        public void visit(int version, int access, String name, String signature, String superName, String[] interfaces) {
            model.access = access;
            model.internalName = name;
            model.signature = signature;
            model.superName = superName;
            model.interfaces = interfaces == null ? List.of() : List.of(interfaces);
            model.record = (access & Opcodes.ACC_RECORD) != 0 || "java/lang/Record".equals(superName);
        }

        @Override
        public void visitOuterClass(String owner, String name, String descriptor) {
            model.enclosedInMethod = true;
        }

        @Override
        public void visitInnerClass(String name, String outerName, String innerName, int access) {
            if (name.equals(model.internalName)) {
                model.hasOwnInnerClassEntry = true;
                model.outerName = outerName;
                model.innerName = innerName;
                model.innerAccess = access;
            } else if (model.internalName.equals(outerName) && innerName != null) {
                model.memberTypes.add(name);
            }
        }

        @Override
        public AnnotationVisitor visitAnnotation(String descriptor, boolean visible) {
            return collect(descriptor, visible, model.annotations::add);
        }

        @Override
        public RecordComponentVisitor visitRecordComponent(String name, String descriptor, String signature) {
            final ClassModel.ComponentModel component = new ClassModel.ComponentModel();
            component.name = name;
            component.descriptor = descriptor;
            component.signature = signature;
            model.components.add(component);
            return new RecordComponentVisitor(Opcodes.ASM9) {
                @Override
                public AnnotationVisitor visitAnnotation(String annotationDescriptor, boolean visible) {
                    return collect(annotationDescriptor, visible, component.annotations::add);
                }
            };
        }

        @Override
        public FieldVisitor visitField(int access, String name, String descriptor, String signature, Object value) {
            final ClassModel.FieldModel field = new ClassModel.FieldModel();
            field.access = access;
            field.name = name;
            field.descriptor = descriptor;
            field.signature = signature;
            field.value = value;
            model.fields.add(field);
            return new FieldVisitor(Opcodes.ASM9) {
                @Override
                public AnnotationVisitor visitAnnotation(String annotationDescriptor, boolean visible) {
                    return collect(annotationDescriptor, visible, field.annotations::add);
                }
            };
        }

        @Override
        public MethodVisitor visitMethod(int access, String name, String descriptor, String signature, String[] exceptions) {
            final ClassModel.MethodModel method = new ClassModel.MethodModel();
            method.access = access;
            method.name = name;
            method.descriptor = descriptor;
            method.signature = signature;
            method.exceptions = exceptions == null ? List.of() : Arrays.asList(exceptions);
            model.methods.add(method);
            return new MethodVisitor(Opcodes.ASM9) {
                @Override
                public void visitParameter(String parameterName, int parameterAccess) {
                    method.parameterNames.add(parameterName);
                }

                @Override
                public AnnotationVisitor visitAnnotation(String annotationDescriptor, boolean visible) {
                    return collect(annotationDescriptor, visible, method.annotations::add);
                }

                @Override
                public AnnotationVisitor visitParameterAnnotation(int parameter, String annotationDescriptor, boolean visible) {
                    return collect(annotationDescriptor, visible,
                            a -> method.parameterAnnotations.computeIfAbsent(parameter, k -> new ArrayList<>()).add(a));
                }

                @Override
                public AnnotationVisitor visitTypeAnnotation(int typeRef, TypePath typePath, String annotationDescriptor,
                                                             boolean visible) {
                    if (new TypeReference(typeRef).getSort() == TypeReference.METHOD_RETURN && typePath == null) {
                        return collect(annotationDescriptor, visible, method.returnTypeAnnotations::add);
                    }
                    return null;
                }

                @Override
                public void visitLocalVariable(String localName, String localDescriptor, String localSignature,
                                               Label start, Label end, int index) {
                    method.localVariableNames.putIfAbsent(index, localName);
                }
            };
        }
    }

    private static AnnotationVisitor collect(String descriptor, boolean visible,
                                             Consumer<ClassModel.AnnotationModel> onDone) {
        final List<ClassModel.Element> elements = new ArrayList<>();
        return new ElementCollector(elements::add, () ->
                onDone.accept(new ClassModel.AnnotationModel(descriptor, visible, List.copyOf(elements))));
    }

    /**
     * Collects annotation element values, recursing into arrays and nested annotations.
     */
    private static final class ElementCollector extends AnnotationVisitor {

        private final Consumer<ClassModel.Element> sink;
        private final Runnable onEnd;

        ElementCollector(Consumer<ClassModel.Element> sink, Runnable onEnd) {
            super(Opcodes.ASM9);
            this.sink = sink;
            this.onEnd = onEnd;
        }

        @Override
        public void visit(String name, Object value) {
            sink.accept(new ClassModel.Element(name, normalize(value)));
        }

        @Override
        public void visitEnum(String name, String descriptor, String value) {
            sink.accept(new ClassModel.Element(name, new ClassModel.EnumValue(descriptor, value)));
        }

        @Override
        public AnnotationVisitor visitAnnotation(String name, String descriptor) {
            final List<ClassModel.Element> nested = new ArrayList<>();
            return new ElementCollector(nested::add, () -> sink.accept(new ClassModel.Element(name,
                    new ClassModel.AnnotationModel(descriptor, true, List.copyOf(nested)))));
        }

        @Override
        public AnnotationVisitor visitArray(String name) {
            final List<Object> values = new ArrayList<>();
            return new ElementCollector(e -> values.add(e.value()), () ->
                    sink.accept(new ClassModel.Element(name, values)));
        }

        @Override
        public void visitEnd() {
            onEnd.run();
        }

        // primitive arrays arrive as Java arrays, e.g. int[]
        private static Object normalize(Object value) {
            if (value == null || !value.getClass().isArray()) {
                return value;
            }
            final int length = java.lang.reflect.Array.getLength(value);
            final List<Object> out = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                out.add(java.lang.reflect.Array.get(value, i));
            }
            return out;
        }
    }
}
