package gpurace.transforms;

import ivl.base.ProgramParser;
import ivl.hir.*;
import ivl.transforms.TransformPass;

import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class ConstantWriteInstrumenterTest
{
	private static final String PROGRAM =
			"var {:global} {:constant} $$C: [bv32]bv32;\n"
			+ "var {:global} $$A: [bv32]bv32;\n"
			+ "procedure k(p: bool);\n"
			+ "implementation k(p: bool)\n"
			+ "{\n"
			+ "entry:\n"
			+ "  call _LOG_READ_$$C(p, 0bv32, $$C[0bv32]);\n"
			+ "  call _CHECK_READ_$$C(p, 0bv32, $$C[0bv32]);\n"
			+ "  call _LOG_WRITE_$$C(p, 1bv32, 2bv32, $$C[1bv32]);\n"
			+ "  call {:sourceloc_num 4} _CHECK_WRITE_$$C(p, 1bv32, 2bv32);\n"
			+ "  call _LOG_WRITE_$$A(p, 1bv32, 2bv32, $$A[1bv32]);\n"
			+ "  call _CHECK_WRITE_$$A(p, 1bv32, 2bv32);\n"
			+ "  return;\n"
			+ "}\n";

	@Test
	public void constantArrayAccessesBecomeWriteAssertions()
	{
		Program program = ProgramParser.parse(PROGRAM, "constant.gbpl");
		TransformPass.run(new ConstantWriteInstrumenter(program));
		List<Cmd> cmds = program.getImplementation("k").getBlock("entry").getCmds();
		assertThat(cmds.size(), is(3));

		assertThat(cmds.get(0), instanceOf(AssertCmd.class));
		AssertCmd check = (AssertCmd)cmds.get(0);
		assertTrue(check.getAttributes().findBool("constant_write"));
		assertThat(check.getAttributes().findInt("sourceloc_num", -1), is(4));
		assertThat(check.getExpr().toString(), is("!p"));

		assertThat(((CallCmd)cmds.get(1)).getCallee(), is("_LOG_WRITE_$$A"));
		assertThat(((CallCmd)cmds.get(2)).getCallee(), is("_CHECK_WRITE_$$A"));
	}
}
