package org.minicc.compiler.frontend.semantics;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The set of declared variable names for one analysis run.
 * <p>
 * There is a single flat namespace: no scopes, no types. Declarations inside
 * {@code main} share the namespace with top-level ones.
 */
public class SymbolTable {

    private final Set<String> names = new LinkedHashSet<>();

    /**
     * Declares a name.
     * @param name The variable name.
     * @return true if the name was new, false if it had already been declared.
     */
    public boolean declare(String name) {
        return names.add(name);
    }

    /**
     * @param name The variable name.
     * @return true if the name has been declared.
     */
    public boolean isDeclared(String name) {
        return names.contains(name);
    }

    /**
     * @return The declared names in declaration order.
     */
    public Set<String> getNames() {
        return Collections.unmodifiableSet(names);
    }
}
