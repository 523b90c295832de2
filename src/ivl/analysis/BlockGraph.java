package ivl.analysis;

import ivl.hir.Block;
import ivl.hir.Implementation;
import ivl.hir.ReturnCmd;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Control-flow graph over the basic blocks of an implementation, with
 * dominator and post-dominator sets, natural loops and control dependence.
 * The first block is the entry; blocks ending in <b>return</b> are exits.
 * Dominance information is computed with the iterative bit-set algorithm
 * and is not updated when the implementation changes.
 */
public class BlockGraph {

    private final List<Block> blocks;
    private final Map<Block, Integer> index;
    private final List<List<Integer>> succs;
    private final List<List<Integer>> preds;
    private BitSet[] dominator;
    private BitSet[] post_dominator;

    public BlockGraph(Implementation impl) {
        blocks = new ArrayList<Block>(impl.getBlocks());
        index = new HashMap<Block, Integer>();
        Map<String, Integer> label_index = new HashMap<String, Integer>();
        for (int i = 0; i < blocks.size(); i++) {
            index.put(blocks.get(i), i);
            label_index.put(blocks.get(i).getLabel(), i);
        }
        succs = new ArrayList<List<Integer>>(blocks.size());
        preds = new ArrayList<List<Integer>>(blocks.size());
        for (int i = 0; i < blocks.size(); i++) {
            succs.add(new ArrayList<Integer>());
            preds.add(new ArrayList<Integer>());
        }
        for (int i = 0; i < blocks.size(); i++) {
            for (String label : blocks.get(i).getSuccessorLabels()) {
                Integer j = label_index.get(label);
                if (j == null) {
                    throw new IllegalStateException("[ERROR in BlockGraph] unknown block " + label
                            + " in " + impl.getName());
                }
                if (!succs.get(i).contains(j)) {
                    succs.get(i).add(j);
                    preds.get(j).add(i);
                }
            }
        }
    }

    public List<Block> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public Block getEntry() {
        return blocks.get(0);
    }

    public List<Block> getSuccessors(Block b) {
        return toBlocks(succs.get(indexOf(b)));
    }

    public List<Block> getPredecessors(Block b) {
        return toBlocks(preds.get(indexOf(b)));
    }

    private int indexOf(Block b) {
        Integer i = index.get(b);
        if (i == null) {
            throw new IllegalArgumentException("[ERROR in BlockGraph] block " + b.getLabel()
                    + " is not part of this graph");
        }
        return i;
    }

    private List<Block> toBlocks(Iterable<Integer> indices) {
        List<Block> ret = new ArrayList<Block>();
        for (int i : indices) {
            ret.add(blocks.get(i));
        }
        return ret;
    }

    /** Returns true if every path from the entry to b passes through a. */
    public boolean dominates(Block a, Block b) {
        if (dominator == null) {
            dominator = computeDominators(preds, Collections.singleton(0));
        }
        return dominator[indexOf(b)].get(indexOf(a));
    }

    /** Returns true if every path from b to an exit passes through a. */
    public boolean postDominates(Block a, Block b) {
        if (post_dominator == null) {
            Set<Integer> exits = new LinkedHashSet<Integer>();
            for (int i = 0; i < blocks.size(); i++) {
                if (blocks.get(i).getTransfer() instanceof ReturnCmd) {
                    exits.add(i);
                }
            }
            post_dominator = computeDominators(succs, exits);
        }
        return post_dominator[indexOf(b)].get(indexOf(a));
    }

    /*
     * Iterative data-flow solution: dom(n) = {n} + intersection of dom(p)
     * over the incoming edges of n. For post-dominators the edges are
     * reversed and the exits act as entries.
     */
    private BitSet[] computeDominators(List<List<Integer>> incoming, Set<Integer> entries) {
        int node_size = blocks.size();
        BitSet[] dom = new BitSet[node_size];
        for (int i = 0; i < node_size; i++) {
            dom[i] = new BitSet(node_size);
            dom[i].set(0, node_size);
        }
        for (int entry : entries) {
            dom[entry].clear();
            dom[entry].set(entry);
        }
        boolean change = true;
        while (change) {
            change = false;
            for (int i = 0; i < node_size; i++) {
                if (entries.contains(i) || incoming.get(i).isEmpty()) {
                    continue;
                }
                BitSet tmp = new BitSet(node_size);
                tmp.set(0, node_size);
                for (int p : incoming.get(i)) {
                    tmp.and(dom[p]);
                }
                tmp.set(i);
                if (!tmp.equals(dom[i])) {
                    change = true;
                    dom[i] = tmp;
                }
            }
        }
        return dom;
    }

    /** Returns true if the edge from source to target is a back edge. */
    public boolean isBackEdge(Block source, Block target) {
        return getSuccessors(source).contains(target) && dominates(target, source);
    }

    /** Returns the loop headers in block order. */
    public List<Block> getLoopHeaders() {
        List<Block> ret = new ArrayList<Block>();
        for (Block h : blocks) {
            if (!getBackEdgeSources(h).isEmpty()) {
                ret.add(h);
            }
        }
        return ret;
    }

    /** Returns the blocks jumping back to the given loop header. */
    public List<Block> getBackEdgeSources(Block header) {
        List<Block> ret = new ArrayList<Block>();
        for (Block p : getPredecessors(header)) {
            if (dominates(header, p)) {
                ret.add(p);
            }
        }
        return ret;
    }

    /**
     * Returns the natural loop of the given header: the header and every
     * block that reaches a back edge to it without passing through it.
     */
    public Set<Block> getNaturalLoop(Block header) {
        Set<Block> body = new LinkedHashSet<Block>();
        body.add(header);
        LinkedList<Block> work = new LinkedList<Block>(getBackEdgeSources(header));
        while (!work.isEmpty()) {
            Block b = work.removeFirst();
            if (body.add(b)) {
                work.addAll(getPredecessors(b));
            }
        }
        return body;
    }

    /**
     * Returns the blocks on whose branching b is control-dependent: blocks x
     * having a successor s post-dominated by b while b does not strictly
     * post-dominate x.
     */
    public Set<Block> getControllingBlocks(Block b) {
        Set<Block> ret = new LinkedHashSet<Block>();
        for (Block x : blocks) {
            List<Block> xs = getSuccessors(x);
            if (xs.size() < 2 || (x != b && postDominates(b, x))) {
                continue;
            }
            for (Block s : xs) {
                if (postDominates(b, s)) {
                    ret.add(x);
                    break;
                }
            }
        }
        return ret;
    }
}
