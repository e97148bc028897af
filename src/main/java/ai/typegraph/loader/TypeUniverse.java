package ai.typegraph.loader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.objectweb.asm.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.typegraph.symbols.NamedTypeSymbol;
import ai.typegraph.symbols.TypeParameterSymbol;
import ai.typegraph.symbols.TypeSymbol;

/**
 * Every type reachable from one load: looks classes up in search order,
 * parses each at most once and resolves {@link TypeRef}s to symbols.
 */
final class TypeUniverse {

    private static final Logger log = LoggerFactory.getLogger(TypeUniverse.class);

    private final List<ClassSource> sources;
    private final NamespaceTable namespaces;
    private final Map<String, NamedTypeSymbol> types = new HashMap<>();
    private final AnnotationConverter annotations = new AnnotationConverter(this);

    TypeUniverse(List<ClassSource> sources, NamespaceTable namespaces) {
        this.sources = List.copyOf(sources);
        this.namespaces = Objects.requireNonNull(namespaces, "namespaces");
    }

    NamespaceTable namespaces() {
        return namespaces;
    }

    AnnotationConverter annotations() {
        return annotations;
    }

    /**
     * @return the parsed class, or an {@link UnresolvedType} when no source has it
     */
    NamedTypeSymbol namedType(String internalName) {
        final NamedTypeSymbol cached = types.get(internalName);
        if (cached != null) {
            return cached;
        }
        final NamedTypeSymbol loaded = load(internalName);
        types.put(internalName, loaded);
        return loaded;
    }

    private NamedTypeSymbol load(String internalName) {
        for (ClassSource source : sources) {
            final ClassSource.Found found;
            try {
                found = source.find(internalName);
            } catch (IOException ex) {
                log.warn("Cannot read {} from {}: {}", internalName, source, ex.toString());
                continue;
            }
            if (found == null) {
                continue;
            }
            try {
                final ClassModel model = ClassModelReader.read(found.bytes());
                return new AsmNamedType(this, model, found.module());
            } catch (IllegalArgumentException ex) {
                log.warn("Skipping malformed class {}: {}", internalName, ex.getMessage());
            }
        }
        log.debug("Unresolved type {}", internalName);
        return new UnresolvedType(internalName, namespaces.get(NamespaceTable.packageOf(internalName)));
    }

    TypeSymbol resolve(TypeRef ref, TypeScope scope) {
        if (ref instanceof TypeRef.Base base) {
            return BuiltinType.of(base.descriptor());
        }
        if (ref instanceof TypeRef.Array array) {
            return new AsmArrayType(resolve(array.element(), scope));
        }
        if (ref instanceof TypeRef.Variable variable) {
            final TypeParameterSymbol tp = scope.typeParameter(variable.name());
            // erasure when the declaring scope is not visible here
            return tp != null ? tp : namedType(TypeRef.ClassType.OBJECT.internalName());
        }
        final TypeRef.ClassType classType = (TypeRef.ClassType) ref;
        final NamedTypeSymbol definition = namedType(classType.internalName());
        if (classType.arguments().isEmpty()) {
            return definition;
        }
        return new ConstructedType(definition, resolveAll(classType.arguments(), scope));
    }

    List<TypeSymbol> resolveAll(List<TypeRef> refs, TypeScope scope) {
        final List<TypeSymbol> out = new ArrayList<>(refs.size());
        for (TypeRef ref : refs) {
            out.add(resolve(ref, scope));
        }
        return out;
    }

    NamedTypeSymbol resolveNamed(TypeRef ref, TypeScope scope) {
        return resolve(ref, scope) instanceof NamedTypeSymbol named ? named : null;
    }

    TypeSymbol resolveDescriptor(Type type) {
        return resolve(TypeRef.fromAsmType(type), TypeScope.NONE);
    }
}
