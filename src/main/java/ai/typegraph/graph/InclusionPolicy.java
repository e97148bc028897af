package ai.typegraph.graph;

import java.util.Objects;

import ai.typegraph.symbols.Accessibility;
import ai.typegraph.symbols.MemberSymbol;
import ai.typegraph.symbols.NamedTypeSymbol;

/**
 * Decides which declared types and members are described.
 * Compiler-generated symbols are dropped unless enabled; otherwise private
 * needs includePrivate, internal and protected-and-internal need
 * includeInternal, and everything wider is always kept.
 */
public final class InclusionPolicy {

    private final ExtractionOptions options;

    public InclusionPolicy(ExtractionOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public boolean includes(NamedTypeSymbol type) {
        return includes(type.isCompilerGenerated(), type.accessibility());
    }

    public boolean includes(MemberSymbol member) {
        return includes(member.isCompilerGenerated(), member.accessibility());
    }

    private boolean includes(boolean compilerGenerated, Accessibility accessibility) {
        if (compilerGenerated && !options.includeCompilerGenerated()) {
            return false;
        }
        return switch (accessibility) {
            case PRIVATE -> options.includePrivate();
            case INTERNAL, PROTECTED_AND_INTERNAL -> options.includeInternal();
            default -> true;
        };
    }
}
