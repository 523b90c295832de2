package ivl.transforms;

import ivl.analysis.BlockGraph;
import ivl.base.ProgramParser;
import ivl.hir.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class LoopUnrollerTest {

    private static final String LOOP =
            "var i: bv32;\n"
            + "procedure p();\n"
            + "  modifies i;\n"
            + "implementation p()\n"
            + "{\n"
            + "entry:\n"
            + "  goto head;\n"
            + "head:\n"
            + "  goto body, done;\n"
            + "body:\n"
            + "  i := i;\n"
            + "  goto head;\n"
            + "done:\n"
            + "  return;\n"
            + "}\n";

    private static List<String> labels(Implementation impl) {
        List<String> ret = new ArrayList<String>();
        for (Block b : impl.getBlocks()) {
            ret.add(b.getLabel());
        }
        return ret;
    }

    @Test
    public void unrollsLoopIntoCopies() {
        Program program = ProgramParser.parse(LOOP, "loop.gbpl");
        Implementation impl = program.getImplementation("p");
        new LoopUnroller(program, 2).unroll(impl);

        List<String> labels = labels(impl);
        assertThat(labels.contains("head#0"), is(true));
        assertThat(labels.contains("body#1"), is(true));
        assertThat(labels.contains("head#cut"), is(true));
        assertThat(labels.contains("head"), is(false));
        assertThat(impl.getBlock("entry").getSuccessorLabels(), is(Arrays.asList("head#0")));
        assertThat(impl.getBlock("body#0").getSuccessorLabels(), is(Arrays.asList("head#1")));
        assertThat(impl.getBlock("body#1").getSuccessorLabels(), is(Arrays.asList("head#cut")));

        assertTrue(new BlockGraph(impl).getLoopHeaders().isEmpty());
        AssumeCmd cut = (AssumeCmd)impl.getBlock("head#cut").getCmds().get(0);
        assertTrue(((LiteralExpr)cut.getExpr()).isFalse());
    }

    @Test
    public void originalLabelStripsCopySuffix() {
        assertThat(LoopUnroller.originalLabel("head#1"), is("head"));
        assertThat(LoopUnroller.originalLabel("head#0#1"), is("head"));
        assertThat(LoopUnroller.originalLabel("entry"), is("entry"));
    }
}
