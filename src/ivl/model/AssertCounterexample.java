package ivl.model;

import ivl.hir.AssertCmd;
import ivl.hir.Block;
import ivl.hir.Implementation;

import java.util.List;

/** An assertion that may fail, possibly a loop invariant. */
public class AssertCounterexample extends Counterexample {

    /** Whether the failing assertion is a loop invariant, and in which role. */
    public enum LoopInvariantFailure {
        NONE, ENTRY, MAINTENANCE
    }

    private final AssertCmd failing_assert;
    private final LoopInvariantFailure loop_failure;

    public AssertCounterexample(Implementation impl, List<Block> trace, Model model,
            AssertCmd failing_assert, LoopInvariantFailure loop_failure) {
        super(impl, trace, model);
        this.failing_assert = failing_assert;
        this.loop_failure = loop_failure;
    }

    public AssertCmd getFailingAssert() {
        return failing_assert;
    }

    public LoopInvariantFailure getLoopInvariantFailure() {
        return loop_failure;
    }
}
