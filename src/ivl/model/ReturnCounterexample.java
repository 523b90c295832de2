package ivl.model;

import ivl.hir.Block;
import ivl.hir.Ensures;
import ivl.hir.Implementation;

import java.util.List;

/** A postcondition that may not hold when the implementation returns. */
public class ReturnCounterexample extends Counterexample {

    private final Block return_block;
    private final Ensures failing_ensures;

    public ReturnCounterexample(Implementation impl, List<Block> trace, Model model,
            Block return_block, Ensures failing_ensures) {
        super(impl, trace, model);
        this.return_block = return_block;
        this.failing_ensures = failing_ensures;
    }

    public Block getReturnBlock() {
        return return_block;
    }

    public Ensures getFailingEnsures() {
        return failing_ensures;
    }
}
