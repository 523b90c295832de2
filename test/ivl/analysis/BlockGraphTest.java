package ivl.analysis;

import ivl.base.ProgramParser;
import ivl.hir.Block;
import ivl.hir.Implementation;

import java.util.Set;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class BlockGraphTest {

    static final String LOOP =
            "var i: bv32;\n"
            + "function {:bvbuiltin \"bvult\"} BV32_ULT(bv32, bv32) : bool;\n"
            + "procedure p();\n"
            + "  modifies i;\n"
            + "implementation p()\n"
            + "{\n"
            + "entry:\n"
            + "  i := 0bv32;\n"
            + "  goto head;\n"
            + "head:\n"
            + "  goto body, done;\n"
            + "body:\n"
            + "  assume BV32_ULT(i, 4bv32);\n"
            + "  goto latch;\n"
            + "latch:\n"
            + "  i := i;\n"
            + "  goto head;\n"
            + "done:\n"
            + "  return;\n"
            + "}\n";

    private static Implementation parse(String text) {
        return ProgramParser.parse(text, "loop.gbpl").getImplementation("p");
    }

    @Test
    public void findsLoopHeaderAndNaturalLoop() {
        Implementation impl = parse(LOOP);
        BlockGraph graph = new BlockGraph(impl);
        assertThat(graph.getEntry(), is(impl.getBlock("entry")));
        assertThat(graph.getLoopHeaders().size(), is(1));
        Block head = graph.getLoopHeaders().get(0);
        assertThat(head.getLabel(), is("head"));
        assertThat(graph.getBackEdgeSources(head).get(0).getLabel(), is("latch"));

        Set<Block> loop = graph.getNaturalLoop(head);
        assertThat(loop.size(), is(3));
        assertTrue(loop.contains(impl.getBlock("body")));
        assertFalse(loop.contains(impl.getBlock("done")));
        assertFalse(loop.contains(impl.getBlock("entry")));
    }

    @Test
    public void dominanceAndBackEdges() {
        Implementation impl = parse(LOOP);
        BlockGraph graph = new BlockGraph(impl);
        Block head = impl.getBlock("head");
        assertTrue(graph.dominates(head, impl.getBlock("latch")));
        assertFalse(graph.dominates(impl.getBlock("body"), impl.getBlock("done")));
        assertTrue(graph.isBackEdge(impl.getBlock("latch"), head));
        assertFalse(graph.isBackEdge(impl.getBlock("entry"), head));
    }

    @Test
    public void branchControlsOnlyOneSide() {
        Implementation impl = parse(LOOP);
        BlockGraph graph = new BlockGraph(impl);
        assertTrue(graph.getControllingBlocks(impl.getBlock("body")).contains(impl.getBlock("head")));
        assertTrue(graph.getControllingBlocks(impl.getBlock("entry")).isEmpty());
    }
}
