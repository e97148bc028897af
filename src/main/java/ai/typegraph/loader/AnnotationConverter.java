package ai.typegraph.loader;

import java.util.ArrayList;
import java.util.List;

import org.objectweb.asm.Type;

import ai.typegraph.symbols.AttributeData;
import ai.typegraph.symbols.NamedTypeSymbol;
import ai.typegraph.symbols.TypedConstant;

/**
 * Turns annotations read from class files into {@link AttributeData}.
 * Java annotations have no positional arguments: every element is named,
 * {@code value} included.
 */
final class AnnotationConverter {

    private final TypeUniverse universe;

    AnnotationConverter(TypeUniverse universe) {
        this.universe = universe;
    }

    List<AttributeData> convert(List<ClassModel.AnnotationModel> annotations) {
        if (annotations.isEmpty()) {
            return List.of();
        }
        final List<AttributeData> out = new ArrayList<>(annotations.size());
        for (ClassModel.AnnotationModel annotation : annotations) {
            out.add(convert(annotation));
        }
        return List.copyOf(out);
    }

    AttributeData convert(ClassModel.AnnotationModel annotation) {
        final NamedTypeSymbol type = universe.namedType(Type.getType(annotation.descriptor()).getInternalName());
        final List<AttributeData.NamedArgument> named = new ArrayList<>(annotation.elements().size());
        for (ClassModel.Element element : annotation.elements()) {
            named.add(new AttributeData.NamedArgument(element.name(), constant(element.value())));
        }
        return new AttributeData(LoadedModule.isResolved(type) ? type : null, List.of(), named);
    }

    private TypedConstant constant(Object value) {
        if (value instanceof Type type) {
            return TypedConstant.ofType(universe.resolveDescriptor(type));
        }
        if (value instanceof ClassModel.EnumValue enumValue) {
            final String owner = Type.getType(enumValue.descriptor()).getClassName().replace('$', '.');
            return TypedConstant.ofEnum(owner + "." + enumValue.constant());
        }
        if (value instanceof ClassModel.AnnotationModel nested) {
            return TypedConstant.ofAttribute(convert(nested));
        }
        if (value instanceof List<?> values) {
            final List<TypedConstant> items = new ArrayList<>(values.size());
            for (Object item : values) {
                items.add(constant(item));
            }
            return TypedConstant.ofArray(items);
        }
        return TypedConstant.of(value);
    }
}
