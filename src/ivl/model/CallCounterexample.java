package ivl.model;

import ivl.hir.Block;
import ivl.hir.CallCmd;
import ivl.hir.Implementation;
import ivl.hir.Requires;

import java.util.List;

/** A precondition of a called procedure that may not hold at the call. */
public class CallCounterexample extends Counterexample {

    private final CallCmd failing_call;
    private final Requires failing_requires;

    public CallCounterexample(Implementation impl, List<Block> trace, Model model,
            CallCmd failing_call, Requires failing_requires) {
        super(impl, trace, model);
        this.failing_call = failing_call;
        this.failing_requires = failing_requires;
    }

    public CallCmd getFailingCall() {
        return failing_call;
    }

    public Requires getFailingRequires() {
        return failing_requires;
    }
}
