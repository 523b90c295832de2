package ivl.model;

import ivl.base.ParseException;
import ivl.base.ProgramParser;
import ivl.hir.Program;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;

public class CounterexampleReaderTest {

    private static final String PROGRAM =
            "var x: bv32;\n"
            + "procedure q(a: bv32);\n"
            + "  requires a == 0bv32;\n"
            + "  requires {:race} a == 1bv32;\n"
            + "procedure p();\n"
            + "  modifies x;\n"
            + "  ensures x == 0bv32;\n"
            + "implementation p()\n"
            + "{\n"
            + "entry:\n"
            + "  x := 1bv32;\n"
            + "  assume {:captureState \"s\"} true;\n"
            + "  call q(x);\n"
            + "  assert x == 1bv32;\n"
            + "  goto exit;\n"
            + "exit:\n"
            + "  return;\n"
            + "}\n";

    private Program program;

    @Before
    public void setUp() {
        program = ProgramParser.parse(PROGRAM, "p.gbpl");
    }

    private List<Counterexample> read(String text) throws IOException {
        return new CounterexampleReader(program, "p.cex").read(new StringReader(text));
    }

    @Test
    public void readsCallFailureWithModelAndStates() throws IOException {
        List<Counterexample> cexs = read("*** COUNTEREXAMPLE\n"
                + "implementation p\n"
                + "failure call entry 2 requires 1\n"
                + "trace entry\n"
                + "*** MODEL\n"
                + "x -> 7bv32\n"
                + "flag -> true\n"
                + "n -> -3\n"
                + "*** STATE s\n"
                + "x -> 1bv32\n"
                + "*** END_STATE\n"
                + "*** STATE s\n"
                + "x -> 2bv32\n"
                + "*** END_STATE\n"
                + "*** END_MODEL\n");
        assertThat(cexs.size(), is(1));
        CallCounterexample cex = (CallCounterexample)cexs.get(0);
        assertThat(cex.getImplementation().getName(), is("p"));
        assertThat(cex.getFailingCall().getCallee(), is("q"));
        assertTrue(cex.getFailingRequires().getAttributes().findBool("race"));
        assertThat(cex.getTrace().size(), is(1));

        Model model = cex.getModel();
        assertThat(model.tryGet("x"), is((Element)new BitVectorElement(BigInteger.valueOf(7), 32)));
        assertTrue(model.tryGet("flag").asBoolean());
        assertThat(model.tryGet("n").asNumber(), is(BigInteger.valueOf(-3)));
        assertThat(model.getStates().size(), is(2));
        assertThat(model.getState("s").tryGet("x").asNumber(), is(BigInteger.valueOf(2)));
        assertNull(model.getState("missing"));
    }

    @Test
    public void readsSeveralCounterexamples() throws IOException {
        List<Counterexample> cexs = read("# comment\n"
                + "*** COUNTEREXAMPLE\n"
                + "implementation p\n"
                + "failure return exit ensures 0\n"
                + "trace entry exit\n"
                + "\n"
                + "*** COUNTEREXAMPLE\n"
                + "implementation p\n"
                + "failure assert entry 3 loop_entry\n"
                + "trace entry\n");
        assertThat(cexs.size(), is(2));
        assertThat(cexs.get(0), instanceOf(ReturnCounterexample.class));
        assertThat(cexs.get(0).getTrace().size(), is(2));
        AssertCounterexample second = (AssertCounterexample)cexs.get(1);
        assertThat(second.getLoopInvariantFailure(), is(AssertCounterexample.LoopInvariantFailure.ENTRY));
        assertTrue(second.getModel().getValues().isEmpty());
    }

    @Test(expected = ParseException.class)
    public void rejectsCommandThatIsNotACall() throws IOException {
        read("*** COUNTEREXAMPLE\n"
                + "implementation p\n"
                + "failure call entry 0 requires 0\n"
                + "trace entry\n");
    }

    @Test(expected = ParseException.class)
    public void rejectsUnknownBlock() throws IOException {
        read("*** COUNTEREXAMPLE\n"
                + "implementation p\n"
                + "failure assert nowhere 0\n"
                + "trace entry\n");
    }

    @Test
    public void unterminatedModelReportsLine() throws IOException {
        try {
            read("*** COUNTEREXAMPLE\n"
                    + "implementation p\n"
                    + "failure assert entry 3\n"
                    + "*** MODEL\n"
                    + "x -> 1bv32\n");
            fail("expected a parse error");
        } catch (ParseException e) {
            assertThat(e.getMessage(), containsString("END_MODEL"));
            assertThat(e.getPosition().getFile(), is("p.cex"));
        }
    }

    @Test
    public void elementParsing() {
        assertThat(Element.parse("false"), instanceOf(BooleanElement.class));
        assertThat(Element.parse("12bv8"), instanceOf(BitVectorElement.class));
        assertThat(Element.parse("42"), instanceOf(NumberElement.class));
        assertThat(Element.parse("T@U!val!3"), instanceOf(UninterpretedElement.class));
        assertThat(((BitVectorElement)Element.parse("255bv8")).asSigned(8), is(BigInteger.valueOf(-1)));
    }
}
