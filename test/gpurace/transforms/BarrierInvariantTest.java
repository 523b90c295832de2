package gpurace.transforms;

import gpurace.KernelFixtures;
import gpurace.exec.GPURaceOptions;
import gpurace.exec.ToolExitCodes;
import gpurace.exec.UserErrorException;
import ivl.base.ProgramParser;
import ivl.hir.*;

import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class BarrierInvariantTest
{
	private static final String DECLS =
			"var {:group_shared} {:source_name \"S\"} {:elem_width 32} {:source_elem_width 32}"
			+ " {:source_dimensions \"*\"} $$S: [bv32]bv32;\n"
			+ "procedure {:barrier_invariant} $bugle_barrier_invariant(inv: bv1, i0: bv32);\n"
			+ "procedure {:binary_barrier_invariant} $bugle_binary_barrier_invariant(inv: bv1, i0: bv32, i1: bv32);\n"
			+ "procedure {:barrier} $bugle_barrier(local_fence: bv1, global_fence: bv1);\n"
			+ "procedure {:kernel} k();\n"
			+ "  modifies $$S;\n";

	private static String kernel(String header, String invariant_call)
	{
		return header + DECLS
				+ "implementation k()\n"
				+ "{\n"
				+ "  var t: bv32;\n"
				+ "entry:\n"
				+ "  t := local_id_x;\n"
				+ "  $$S[local_id_x] := local_id_x;\n"
				+ invariant_call
				+ "  call {:sourceloc_num 1} $bugle_barrier(1bv1, 0bv1);\n"
				+ "  return;\n"
				+ "}\n";
	}

	private static final String UNARY = "  call {:sourceloc_num 0} $bugle_barrier_invariant("
			+ "if $$S[local_id_x] == local_id_x then 1bv1 else 0bv1, BV32_ADD(local_id_x, 1bv32));\n";

	private static final String BINARY = "  call {:sourceloc_num 0} $bugle_binary_barrier_invariant("
			+ "if $$S[local_id_x] == local_id_x then 1bv1 else 0bv1, local_id_x, BV32_ADD(local_id_x, 1bv32));\n";

	private static List<Cmd> entry(Program program)
	{
		return program.getImplementation("k").getBlock("entry").getCmds();
	}

	private static int indexOfBarrierCall(List<Cmd> cmds)
	{
		for( int i = 0; i < cmds.size(); i++ ) {
			if( cmds.get(i) instanceof CallCmd && ((CallCmd)cmds.get(i)).getCallee().equals("$bugle_barrier") ) {
				return i;
			}
		}
		return -1;
	}

	@Test
	public void unaryInvariantIsAssertedThenAssumedForBothThreads()
	{
		Program program = KernelFixtures.transform(kernel(KernelFixtures.HEADER, UNARY), new GPURaceOptions())
				.getProgram();
		assertNull(program.getProcedure("$bugle_barrier_invariant"));

		List<Cmd> cmds = entry(program);
		int barrier = indexOfBarrierCall(cmds);
		assertThat(barrier, not(is(-1)));

		Cmd before = cmds.get(barrier - 1);
		assertThat(before, instanceOf(AssertCmd.class));
		assertTrue(before.getAttributes().findBool("barrier_invariant"));
		assertThat(before.getAttributes().findInt("thread", 0), is(1));
		assertThat(before.getAttributes().findInt("sourceloc_num", -1), is(0));

		assertThat(cmds.size(), is(barrier + 3));
		String first = ((AssumeCmd)cmds.get(barrier + 1)).getExpr().toString();
		String second = ((AssumeCmd)cmds.get(barrier + 2)).getExpr().toString();
		assertThat(first, containsString("local_id_x$1"));
		assertThat(first, containsString("group_size_x"));
		assertThat(first, containsString("BV32_SLE"));
		assertThat(second, containsString("local_id_x$2"));
		assertNotNull(program.getFunction("BV32_SLT"));
	}

	@Test
	public void binaryInvariantIsInstantiatedPerPair()
	{
		Program program = KernelFixtures.transform(kernel(KernelFixtures.HEADER, BINARY), new GPURaceOptions())
				.getProgram();
		List<Cmd> cmds = entry(program);
		int barrier = indexOfBarrierCall(cmds);
		assertThat(cmds.size(), is(barrier + 3));
		assertThat(cmds.get(barrier + 1), instanceOf(AssumeCmd.class));
	}

	@Test
	public void accessChecksPrecedeTheBarrierWhenRequested()
	{
		GPURaceOptions options = new GPURaceOptions();
		options.barrier_access_checks = true;
		Program program = KernelFixtures.transform(kernel(KernelFixtures.HEADER, UNARY), options).getProgram();
		List<Cmd> cmds = entry(program);
		int barrier = indexOfBarrierCall(cmds);
		Cmd check = cmds.get(barrier - 1);
		assertTrue(check.getAttributes().findBool("barrier_invariant_access_check"));
		assertThat(((AssertCmd)check).getExpr().toString(), containsString("_READ_HAS_OCCURRED_$$S$1"));
		assertTrue(cmds.get(barrier - 2).getAttributes().findBool("barrier_invariant"));
	}

	@Test
	public void missingGroupSizeIsAUserError()
	{
		String header = KernelFixtures.HEADER.replace("const group_size_x: bv32;\n", "");
		try {
			KernelFixtures.transform(kernel(header, UNARY), new GPURaceOptions());
			fail("expected a user error");
		} catch (UserErrorException e) {
			assertThat(e.getExitCode(), is(ToolExitCodes.OTHER_ERROR));
			assertThat(e.getMessage(), containsString("group_size_x"));
		}
	}

	@Test
	public void threadLocalVariableCannotBeInstantiated()
	{
		String call = "  call {:sourceloc_num 0} $bugle_barrier_invariant("
				+ "if t == local_id_x then 1bv1 else 0bv1, local_id_x);\n";
		try {
			KernelFixtures.transform(kernel(KernelFixtures.HEADER, call), new GPURaceOptions());
			fail("expected a user error");
		} catch (UserErrorException e) {
			assertThat(e.getExitCode(), is(ToolExitCodes.OTHER_ERROR));
			assertThat(e.getMessage(), containsString("not valid as part of a barrier invariant"));
		}
	}

	private static final String SIBLING_BLOCKS = KernelFixtures.HEADER + DECLS
			+ "implementation k()\n"
			+ "{\n"
			+ "entry:\n"
			+ "  goto stated, synced;\n"
			+ "stated:\n"
			+ UNARY
			+ "  return;\n"
			+ "synced:\n"
			+ "  call {:sourceloc_num 1} $bugle_barrier(1bv1, 0bv1);\n"
			+ "  return;\n"
			+ "}\n";

	@Test
	public void invariantDoesNotReachBarrierOfAnotherBlock()
	{
		Implementation impl = KernelFixtures.transform(SIBLING_BLOCKS, new GPURaceOptions()).getProgram()
				.getImplementation("k");
		for( String label : new String[] { "stated", "synced" } ) {
			for( Cmd c : impl.getBlock(label).getCmds() ) {
				assertFalse(label, c instanceof AssumeCmd);
				assertFalse(label, c.getAttributes().findBool("barrier_invariant"));
			}
		}
		assertThat(indexOfBarrierCall(impl.getBlock("synced").getCmds()), not(is(-1)));
	}

	@Test
	public void invariantIsConsumedByTheFirstBarrierOnly()
	{
		String calls = UNARY
				+ "  call {:sourceloc_num 1} $bugle_barrier(1bv1, 0bv1);\n";
		List<Cmd> cmds = entry(KernelFixtures.transform(kernel(KernelFixtures.HEADER, calls), new GPURaceOptions())
				.getProgram());
		int asserts = 0;
		int barriers = 0;
		for( Cmd c : cmds ) {
			if( c.getAttributes().findBool("barrier_invariant") ) {
				asserts++;
			}
			if( c instanceof CallCmd && ((CallCmd)c).getCallee().equals("$bugle_barrier") ) {
				barriers++;
			}
		}
		assertThat(barriers, is(2));
		assertThat(asserts, is(1));
		// the two assumptions follow the first barrier, none the second
		assertThat(cmds.get(cmds.size() - 1), instanceOf(CallCmd.class));
	}

	private static final String OTHER_HEADER = KernelFixtures.HEADER + "function __other_bv32(bv32) : bv32;\n";

	private static final String BINARY_OTHER = "  call {:sourceloc_num 0} $bugle_binary_barrier_invariant("
			+ "if $$S[local_id_x] != $$S[__other_bv32(local_id_x)] then 1bv1 else 0bv1,"
			+ " local_id_x, BV32_ADD(local_id_x, 1bv32));\n";

	private static Expr instantiatedForFirstThread(List<Cmd> cmds)
	{
		Expr assumed = ((AssumeCmd)cmds.get(indexOfBarrierCall(cmds) + 1)).getExpr();
		assertThat(((BinaryExpr)assumed).getOperator(), is(BinaryOperator.IMPLIES));
		return ((BinaryExpr)assumed).getRHS();
	}

	@Test
	public void otherThreadInBinaryInvariantTakesSecondOfPair()
	{
		GPURaceOptions options = new GPURaceOptions();
		options.only_intra_group = true;
		Program program = KernelFixtures.transform(kernel(OTHER_HEADER, BINARY_OTHER), options).getProgram();
		List<Cmd> cmds = entry(program);
		String inst = instantiatedForFirstThread(cmds).toString();
		assertThat(inst, containsString("$$S[local_id_x$1] != $$S[BV32_ADD(local_id_x$1, 1bv32)]"));
		assertThat(inst, not(containsString("__other")));
		assertThat(inst, not(containsString("local_id_x$2")));

		// before the barrier the other thread is the real second thread
		String asserted = ((AssertCmd)cmds.get(indexOfBarrierCall(cmds) - 1)).getExpr().toString();
		assertThat(asserted, containsString("$$S[local_id_x$2]"));
	}

	@Test
	public void unaryInstantiationReplacesTheLocalId()
	{
		GPURaceOptions options = new GPURaceOptions();
		options.only_intra_group = true;
		String text = kernel(KernelFixtures.HEADER, UNARY);
		CallCmd stated = null;
		for( Cmd c : ProgramParser.parse(text, "k.gbpl").getImplementation("k").getBlock("entry").getCmds() ) {
			if( c instanceof CallCmd && ((CallCmd)c).getCallee().equals("$bugle_barrier_invariant") ) {
				stated = (CallCmd)c;
			}
		}
		assertNotNull(stated);
		String expected = Expr.neq(stated.getIns().get(0), LiteralExpr.bv(0, 1)).toString()
				.replace("local_id_x", "BV32_ADD(local_id_x$1, 1bv32)");

		List<Cmd> cmds = entry(KernelFixtures.transform(text, options).getProgram());
		assertThat(instantiatedForFirstThread(cmds).toString(), is(expected));
	}
}
