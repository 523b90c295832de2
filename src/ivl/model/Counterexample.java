package ivl.model;

import ivl.hir.Block;
import ivl.hir.Implementation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A failed proof obligation reported by the solver, bound to the program it
 * was produced for: the implementation, the executed blocks and the model.
 */
public abstract class Counterexample {

    private final Implementation impl;
    private final List<Block> trace;
    private final Model model;

    protected Counterexample(Implementation impl, List<Block> trace, Model model) {
        this.impl = impl;
        this.trace = new ArrayList<Block>(trace);
        this.model = model;
    }

    public Implementation getImplementation() {
        return impl;
    }

    /** Returns the blocks of the failing path, in execution order. */
    public List<Block> getTrace() {
        return Collections.unmodifiableList(trace);
    }

    public Model getModel() {
        return model;
    }
}
