package ivl.base;

import ivl.hir.*;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class ProgramParserTest {

    private static final String PROGRAM =
            "type _SIZE_T_TYPE = bv32;\n"
            + "const {:local_id} local_id_x: bv32;\n"
            + "var {:source_name \"A\"} {:global} $$A: [bv32]bv32;\n"
            + "function {:bvbuiltin \"bvadd\"} BV32_ADD(bv32, bv32) : bv32;\n"
            + "procedure {:kernel} k(x: bv32) returns (r: bv32);\n"
            + "  requires x == 0bv32;\n"
            + "  modifies $$A;\n"
            + "implementation k(x: bv32) returns (r: bv32)\n"
            + "{\n"
            + "  var t: bv32;\n"
            + "entry:\n"
            + "  t := BV32_ADD(x, local_id_x);\n"
            + "  $$A[t] := t;\n"
            + "  assert {:sourceloc_num 3} t == t;\n"
            + "  goto exit;\n"
            + "exit:\n"
            + "  r := $$A[t];\n"
            + "  return;\n"
            + "}\n";

    @Test
    public void readsDeclarationsAndAttributes() {
        Program program = ProgramParser.parse(PROGRAM, "k.gbpl");
        assertThat(program.getDeclarations(TypeSynonym.class).size(), is(1));
        Variable a = program.getTopLevelVariable("$$A");
        assertThat(a, instanceOf(GlobalVariable.class));
        assertThat(a.getAttributes().findString("source_name"), is("A"));
        assertTrue(a.getAttributes().findBool("global"));
        assertThat(program.getTopLevelVariable("local_id_x"), instanceOf(Constant.class));
        assertThat(program.getFunction("BV32_ADD").getAttributes().findString("bvbuiltin"), is("bvadd"));

        Procedure k = program.getProcedure("k");
        assertTrue(k.getAttributes().findBool("kernel"));
        assertThat(k.getInParams().size(), is(1));
        assertThat(k.getOutParams().size(), is(1));
        assertThat(k.getRequires().size(), is(1));
        assertThat(k.getModifies().size(), is(1));

        Implementation impl = program.getImplementation("k");
        assertThat(impl.getBlocks().size(), is(2));
        assertThat(impl.getBlock("entry").getCmds().size(), is(3));
        assertThat(impl.getBlock("entry").getSuccessorLabels().get(0), is("exit"));
        AssertCmd check = (AssertCmd)impl.getBlock("entry").getCmds().get(2);
        assertThat(check.getAttributes().findInt("sourceloc_num", -1), is(3));
    }

    @Test
    public void printedProgramParsesToTheSameText() {
        Program program = ProgramParser.parse(PROGRAM, "k.gbpl");
        String printed = program.toString();
        assertThat(ProgramParser.parse(printed, "printed.gbpl").toString(), is(printed));
    }

    @Test
    public void syntaxErrorCarriesPosition() {
        try {
            ProgramParser.parse("var x: bv32\nvar y: bv32;\n", "bad.gbpl");
            fail("expected a parse error");
        } catch (ParseException e) {
            assertThat(e.getMessage(), containsString("bad.gbpl"));
        }
    }

    @Test(expected = ParseException.class)
    public void undeclaredVariableIsRejected() {
        ProgramParser.parse("procedure p();\n"
                + "implementation p()\n"
                + "{\n"
                + "entry:\n"
                + "  assert y;\n"
                + "  return;\n"
                + "}\n", "undeclared.gbpl");
    }

    @Test
    public void callToUndeclaredProcedureIsKept() {
        Program program = ProgramParser.parse("procedure p();\n"
                + "implementation p()\n"
                + "{\n"
                + "entry:\n"
                + "  call q();\n"
                + "  return;\n"
                + "}\n", "call.gbpl");
        CallCmd call = (CallCmd)program.getImplementation("p").getBlocks().get(0).getCmds().get(0);
        assertThat(call.getCallee(), is("q"));
    }
}
