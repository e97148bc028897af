package ai.typegraph.loader;

import ai.typegraph.symbols.TypeParameterSymbol;

/**
 * Resolves type-variable names: a method's own, then its type's, then enclosing types'.
 */
interface TypeScope {

    TypeScope NONE = name -> null;

    TypeParameterSymbol typeParameter(String name);
}
