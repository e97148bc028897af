package ai.typegraph.loader;

import org.objectweb.asm.Opcodes;

import ai.typegraph.symbols.Accessibility;

final class AsmAccess {

    private AsmAccess() {
    }

    /**
     * Package-private maps to {@link Accessibility#INTERNAL}.
     */
    static Accessibility accessibility(int access) {
        if ((access & Opcodes.ACC_PUBLIC) != 0) {
            return Accessibility.PUBLIC;
        }
        if ((access & Opcodes.ACC_PROTECTED) != 0) {
            return Accessibility.PROTECTED;
        }
        if ((access & Opcodes.ACC_PRIVATE) != 0) {
            return Accessibility.PRIVATE;
        }
        return Accessibility.INTERNAL;
    }
}
