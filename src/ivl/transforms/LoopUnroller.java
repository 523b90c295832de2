package ivl.transforms;

import ivl.analysis.BlockGraph;
import ivl.hir.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Unrolls every natural loop of every implementation a fixed number of
 * times. Copy <i>i</i> of a block labelled <b>L</b> is labelled <b>L#i</b>;
 * the back edges of copy <i>i</i> lead into copy <i>i+1</i>, and those of
 * the last copy lead to a block that cuts the path off with
 * <b>assume false</b>. Nested loops are unrolled innermost first.
 * Copies share their command objects, so a later pass that needs distinct
 * commands per copy must clone them.
 */
public class LoopUnroller extends TransformPass {

    private final int unroll_factor;

    public LoopUnroller(Program program, int factor) {
        super(program);
        if (factor < 1) {
            throw new IllegalArgumentException("[ERROR in LoopUnroller] unroll factor must be positive: "
                    + factor);
        }
        unroll_factor = factor;
    }

    @Override
    public String getPassName() {
        return "[LoopUnroller]";
    }

    @Override
    public void start() {
        for (Implementation impl : program.getImplementations()) {
            unroll(impl);
        }
    }

    /** Unrolls all loops of one implementation. */
    public void unroll(Implementation impl) {
        while (true) {
            BlockGraph graph = new BlockGraph(impl);
            Block header = null;
            Set<Block> body = null;
            for (Block h : graph.getLoopHeaders()) {
                Set<Block> loop = graph.getNaturalLoop(h);
                if (body == null || loop.size() < body.size()) {
                    header = h;
                    body = loop;
                }
            }
            if (header == null) {
                return;
            }
            PrintTools.println("Unrolling loop at " + header.getLabel() + " in " + impl.getName(), 2);
            unrollLoop(impl, graph, header, body);
        }
    }

    private void unrollLoop(Implementation impl, BlockGraph graph, Block header, Set<Block> body) {
        String cut_label = header.getLabel() + "#cut";
        List<Block> new_blocks = new ArrayList<Block>();
        for (Block b : impl.getBlocks()) {
            if (b == header) {
                for (int i = 0; i < unroll_factor; i++) {
                    for (Block x : impl.getBlocks()) {
                        if (body.contains(x)) {
                            new_blocks.add(copyBlock(x, body, header, i, cut_label));
                        }
                    }
                }
                List<Cmd> cut = new ArrayList<Cmd>();
                cut.add(new AssumeCmd(LiteralExpr.FALSE));
                new_blocks.add(new Block(cut_label, cut, new ReturnCmd()));
            } else if (!body.contains(b)) {
                new_blocks.add(redirectEntries(b, body));
            }
        }
        impl.setBlocks(new_blocks);
    }

    private Block copyBlock(Block b, Set<Block> body, Block header, int iteration, String cut_label) {
        TransferCmd transfer = b.getTransfer();
        if (transfer instanceof GotoCmd) {
            List<String> targets = new ArrayList<String>();
            for (String t : ((GotoCmd)transfer).getTargets()) {
                if (t.equals(header.getLabel())) {
                    targets.add((iteration + 1 < unroll_factor)
                            ? copyLabel(t, iteration + 1) : cut_label);
                } else if (isBodyLabel(t, body)) {
                    targets.add(copyLabel(t, iteration));
                } else {
                    targets.add(t);
                }
            }
            GotoCmd g = new GotoCmd(targets);
            g.setPosition(transfer.getPosition());
            transfer = g;
        } else {
            transfer = transfer.clone();
        }
        return new Block(copyLabel(b.getLabel(), iteration), b.getCmds(), transfer);
    }

    /* Jumps from outside the loop enter the first copy. */
    private Block redirectEntries(Block b, Set<Block> body) {
        TransferCmd transfer = b.getTransfer();
        if (!(transfer instanceof GotoCmd)) {
            return b;
        }
        List<String> targets = new ArrayList<String>();
        boolean changed = false;
        for (String t : ((GotoCmd)transfer).getTargets()) {
            if (isBodyLabel(t, body)) {
                targets.add(copyLabel(t, 0));
                changed = true;
            } else {
                targets.add(t);
            }
        }
        if (changed) {
            GotoCmd g = new GotoCmd(targets);
            g.setPosition(transfer.getPosition());
            b.setTransfer(g);
        }
        return b;
    }

    private static boolean isBodyLabel(String label, Set<Block> body) {
        for (Block b : body) {
            if (b.getLabel().equals(label)) {
                return true;
            }
        }
        return false;
    }

    static String copyLabel(String label, int iteration) {
        return label + "#" + iteration;
    }

    /** Strips all unrolling suffixes from a block label. */
    public static String originalLabel(String label) {
        int idx = label.indexOf('#');
        return (idx < 0) ? label : label.substring(0, idx);
    }
}
