package org.schemaforge.incremental;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the statements a pattern recipe emits.
 */
public class LoadSteps {
    private final List<String> preamble = new ArrayList<>();
    private final List<String> statements = new ArrayList<>();

    /**
     * A declaration that must run before the transaction opens.
     */
    public LoadSteps declare(String statement) {
        preamble.add(statement);
        return this;
    }

    public LoadSteps add(String statement) {
        statements.add(statement);
        return this;
    }

    public List<String> preamble() {
        return List.copyOf(preamble);
    }

    public List<String> statements() {
        return List.copyOf(statements);
    }
}
