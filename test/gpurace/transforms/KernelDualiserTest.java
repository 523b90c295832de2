package gpurace.transforms;

import gpurace.KernelFixtures;
import gpurace.exec.GPURaceOptions;
import ivl.hir.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class KernelDualiserTest
{
	private static final String KERNEL = KernelFixtures.HEADER
			+ "var {:group_shared} {:source_name \"S\"} $$S: [bv32]bv32;\n"
			+ "var flag: bool;\n"
			+ "procedure {:kernel} {:source_name \"k\"} k($n: bv32);\n"
			+ "  modifies $$A, $$S, flag;\n"
			+ "implementation {:source_name \"k\"} k($n: bv32)\n"
			+ "{\n"
			+ "  var u: bv32;\n"
			+ "  var t: bv32;\n"
			+ "entry:\n"
			+ "  u := $n;\n"
			+ "  t := local_id_x;\n"
			+ "  $$S[t] := u;\n"
			+ "  flag := true;\n"
			+ "  assert {:sourceloc_num 0} t != BV32_ADD(t, 1bv32);\n"
			+ "  assert u == $n;\n"
			+ "  return;\n"
			+ "}\n";

	private static Program transform(GPURaceOptions options)
	{
		return KernelFixtures.transform(KERNEL, options).getProgram();
	}

	private static List<String> names(List<? extends Declaration> decls)
	{
		List<String> ret = new ArrayList<String>();
		for( Declaration d : decls ) {
			ret.add(d.getName());
		}
		return ret;
	}

	private static <T extends Cmd> List<T> commands(Implementation impl, Class<T> c)
	{
		List<T> ret = new ArrayList<T>();
		for( Block b : impl.getBlocks() ) {
			for( Cmd cmd : b.getCmds() ) {
				if( c.isInstance(cmd) ) {
					ret.add(c.cast(cmd));
				}
			}
		}
		return ret;
	}

	@Test
	public void threadIdentifiersAreDuplicated()
	{
		Program program = transform(new GPURaceOptions());
		assertThat(program.getTopLevelVariable("local_id_x$1"), instanceOf(Constant.class));
		assertThat(program.getTopLevelVariable("local_id_x$2"), instanceOf(Constant.class));
		assertThat(program.getTopLevelVariable("group_id_x$2"), instanceOf(Constant.class));
		assertNull(program.getTopLevelVariable("local_id_x"));
		assertNotNull(program.getTopLevelVariable("group_size_x"));
	}

	@Test
	public void groupIdStaysSingleWithinOneGroup()
	{
		GPURaceOptions options = new GPURaceOptions();
		options.only_intra_group = true;
		Program program = transform(options);
		assertNotNull(program.getTopLevelVariable("group_id_x"));
		assertNull(program.getTopLevelVariable("group_id_x$1"));
		assertNotNull(program.getTopLevelVariable("$$S"));
		assertThat(program.getTopLevelVariable("$$S").getType(), instanceOf(MapType.class));
		assertThat(((MapType)program.getTopLevelVariable("$$S").getType()).getResult(), not(instanceOf(MapType.class)));
	}

	@Test
	public void sharedStateAndPerThreadGlobals()
	{
		Program program = transform(new GPURaceOptions());
		assertNotNull(program.getTopLevelVariable("$$A"));
		assertNull(program.getTopLevelVariable("$$A$1"));
		// one copy of a group-shared array per group
		MapType s = (MapType)program.getTopLevelVariable("$$S").getType();
		assertThat(s.getArguments().get(0).toString(), is("bv1"));
		assertThat(s.getResult(), instanceOf(MapType.class));
		assertNotNull(program.getTopLevelVariable("flag$1"));
		assertNotNull(program.getTopLevelVariable("flag$2"));
		assertNull(program.getTopLevelVariable("flag"));
	}

	@Test
	public void uniformLocalsStaySingle()
	{
		Program program = transform(new GPURaceOptions());
		Implementation impl = program.getImplementation("k");
		List<String> locals = names(impl.getLocals());
		assertThat(locals.contains("u"), is(true));
		assertThat(locals.contains("t$1"), is(true));
		assertThat(locals.contains("t$2"), is(true));
		assertThat(locals.contains("t"), is(false));
		assertThat(names(impl.getInParams()), is(names(program.getProcedure("k").getInParams())));
		assertThat(impl.getInParams().get(0).getName(), is("$n"));

		int assigns_to_u = 0;
		for( AssignCmd a : commands(impl, AssignCmd.class) ) {
			for( AssignLhs lhs : a.getLhss() ) {
				if( lhs.getAssignedVariable().getName().equals("u") ) {
					assigns_to_u++;
				}
			}
		}
		assertThat(assigns_to_u, is(1));
	}

	@Test
	public void assertionsAreCheckedPerThread()
	{
		Program program = transform(new GPURaceOptions());
		List<AssertCmd> asserts = commands(program.getImplementation("k"), AssertCmd.class);
		List<Integer> threads = new ArrayList<Integer>();
		for( AssertCmd a : asserts ) {
			threads.add(a.getAttributes().findInt("thread", 0));
		}
		// the non-uniform assertion for both threads, the uniform one once
		assertThat(asserts.size(), is(3));
		assertThat(threads.get(0), is(1));
		assertThat(threads.get(1), is(2));
		assertThat(asserts.get(0).getExpr().toString(), containsString("t$1"));
		assertThat(asserts.get(1).getExpr().toString(), containsString("t$2"));
		assertThat(asserts.get(0).getAttributes().findInt("sourceloc_num", -1), is(0));
	}

	@Test
	public void asymmetricAssertsKeepFirstThreadOnly()
	{
		GPURaceOptions options = new GPURaceOptions();
		options.asymmetric_asserts = true;
		List<AssertCmd> asserts = commands(transform(options).getImplementation("k"), AssertCmd.class);
		assertThat(asserts.size(), is(2));
	}

	@Test
	public void kernelGetsDistinctThreadPrecondition()
	{
		Program program = transform(new GPURaceOptions());
		boolean distinct = false;
		for( Requires r : program.getProcedure("k").getRequires() ) {
			String text = r.getCondition().toString();
			if( text.contains("local_id_x$1") && text.contains("local_id_x$2") ) {
				distinct = true;
			}
		}
		assertTrue(distinct);
	}

	@Test
	public void disabledUniformityDuplicatesEverything()
	{
		GPURaceOptions options = new GPURaceOptions();
		options.no_uniformity_analysis = true;
		Implementation impl = transform(options).getImplementation("k");
		List<String> locals = names(impl.getLocals());
		assertThat(locals.contains("u$1"), is(true));
		assertThat(locals.contains("u$2"), is(true));
		assertThat(impl.getInParams().size(), is(2));
	}

	private static final String RULES_KERNEL = KernelFixtures.HEADER
			+ "function __other_bv32(bv32) : bv32;\n"
			+ "procedure {:source_name \"f\"} f(n: bv32, x: bv32) returns (y: bv32);\n"
			+ "  requires n != 0bv32;\n"
			+ "  requires x != n;\n"
			+ "  ensures y != n;\n"
			+ "  ensures x == __other_bv32(x);\n"
			+ "procedure {:thread 1} g(x: bv32);\n"
			+ "procedure {:kernel} {:source_name \"k\"} k($n: bv32);\n"
			+ "  modifies $$A;\n"
			+ "implementation f(n: bv32, x: bv32) returns (y: bv32)\n"
			+ "{\n"
			+ "entry:\n"
			+ "  y := BV32_ADD(x, n);\n"
			+ "  return;\n"
			+ "}\n"
			+ "implementation k($n: bv32)\n"
			+ "{\n"
			+ "  var x: bv32;\n"
			+ "  var y: bv32;\n"
			+ "  var h: bv32;\n"
			+ "  var v: bv32;\n"
			+ "entry:\n"
			+ "  x := local_id_x;\n"
			+ "  call y := f($n, x);\n"
			+ "  call g(x);\n"
			+ "  havoc h;\n"
			+ "  assume h != x;\n"
			+ "  assume $n != 0bv32;\n"
			+ "  assume {:captureState \"user_state\"} true;\n"
			+ "  call {:arg1 x} _LOG_ATOMIC_$$A(true, x);\n"
			+ "  call {:arg1 x} _CHECK_ATOMIC_$$A(true, x);\n"
			+ "  assume {:atomic_refinement} {:variable v} {:offset x} {:arrayref \"$$A\"} true;\n"
			+ "  goto again, done;\n"
			+ "again:\n"
			+ "  assume {:backedge} x != 0bv32;\n"
			+ "  goto done;\n"
			+ "done:\n"
			+ "  return;\n"
			+ "}\n";

	private static Program transformRules()
	{
		return KernelFixtures.transform(RULES_KERNEL, new GPURaceOptions()).getProgram();
	}

	private static List<String> strings(List<?> items)
	{
		List<String> ret = new ArrayList<String>();
		for( Object o : items ) {
			ret.add(o.toString());
		}
		return ret;
	}

	private static CallCmd findCall(Implementation impl, String callee)
	{
		for( CallCmd c : commands(impl, CallCmd.class) ) {
			if( c.getCallee().equals(callee) ) {
				return c;
			}
		}
		throw new AssertionError("no call to " + callee);
	}

	private static HavocCmd findHavoc(Implementation impl, String var)
	{
		for( HavocCmd h : commands(impl, HavocCmd.class) ) {
			if( h.getVars().get(0).getName().startsWith(var + "$") ) {
				return h;
			}
		}
		throw new AssertionError("no havoc of " + var);
	}

	private static List<String> assumed(Implementation impl)
	{
		List<String> ret = new ArrayList<String>();
		for( AssumeCmd a : commands(impl, AssumeCmd.class) ) {
			ret.add(a.getExpr().toString());
		}
		return ret;
	}

	@Test
	public void havocCoversBothThreads()
	{
		HavocCmd havoc = findHavoc(transformRules().getImplementation("k"), "h");
		assertThat(strings(havoc.getVars()), is(Arrays.asList("h$1", "h$2")));
	}

	@Test
	public void assumptionsAreConjoinedUnlessUniform()
	{
		List<String> assumed = assumed(transformRules().getImplementation("k"));
		assertThat(assumed, hasItem("h$1 != x$1 && h$2 != x$2"));
		assertThat(assumed, hasItem("$n != 0bv32"));
		assertThat(assumed, not(hasItem("$n != 0bv32 && $n != 0bv32")));
	}

	@Test
	public void backEdgeIsTakenIfEitherThreadTakesIt()
	{
		Implementation impl = transformRules().getImplementation("k");
		AssumeCmd a = (AssumeCmd)impl.getBlock("again").getCmds().get(0);
		assertTrue(a.getAttributes().findBool("backedge"));
		assertThat(a.getExpr().toString(), is("x$1 != 0bv32 || x$2 != 0bv32"));
	}

	@Test
	public void capturedStatesPassThroughUnchanged()
	{
		int found = 0;
		for( AssumeCmd a : commands(transformRules().getImplementation("k"), AssumeCmd.class) ) {
			if( "user_state".equals(a.getAttributes().findString("captureState")) ) {
				found++;
				assertThat(a.getExpr().toString(), is("true"));
				assertThat(a.getAttributes().findInt("thread", 0), is(0));
			}
		}
		assertThat(found, is(1));
	}

	@Test
	public void atomicReturnValuesAreDistinctPerThread()
	{
		Program program = transformRules();
		Implementation impl = program.getImplementation("k");
		HavocCmd havoc = findHavoc(impl, "v");
		assertThat(strings(havoc.getVars()), is(Arrays.asList("v$1", "v$2")));

		Variable used = program.getTopLevelVariable("_USED_$$A");
		assertNotNull(used);
		assertTrue(used.getAttributes().findBool("atomic_usedmap"));
		assertThat(used.getType().toString(), is("[bv32][bv32]bool"));

		List<String> assumed = assumed(impl);
		assertThat(assumed, hasItem("!_USED_$$A[x$1][v$1]"));
		assertThat(assumed, hasItem("!_USED_$$A[x$2][v$2]"));
		List<String> assigned = new ArrayList<String>();
		for( AssignCmd a : commands(impl, AssignCmd.class) ) {
			assigned.add(a.getLhss().get(0).toString());
		}
		assertThat(assigned, hasItem("_USED_$$A[x$1][v$1]"));
		assertThat(assigned, hasItem("_USED_$$A[x$2][v$2]"));
		for( AssumeCmd a : commands(impl, AssumeCmd.class) ) {
			assertFalse(a.getAttributes().findBool("atomic_refinement"));
		}
	}

	@Test
	public void callArgumentsArePartitionedByUniformity()
	{
		Program program = transformRules();
		CallCmd call = findCall(program.getImplementation("k"), "f");
		assertThat(strings(call.getIns()), is(Arrays.asList("$n", "x$1", "x$2")));
		assertThat(strings(call.getOuts()), is(Arrays.asList("y$1", "y$2")));
		assertThat(names(program.getProcedure("f").getInParams()), is(Arrays.asList("n", "x$1", "x$2")));
		assertThat(names(program.getProcedure("f").getOutParams()), is(Arrays.asList("y$1", "y$2")));
		assertThat(names(program.getImplementation("f").getInParams()), is(Arrays.asList("n", "x$1", "x$2")));
	}

	@Test
	public void threadSpecificCalleeTakesOneThread()
	{
		Program program = transformRules();
		CallCmd call = findCall(program.getImplementation("k"), "g");
		assertThat(strings(call.getIns()), is(Arrays.asList("x$1")));
		assertThat(names(program.getProcedure("g").getInParams()), is(Arrays.asList("x$1")));
	}

	@Test
	public void atomicArgumentAttributesFollowTheAccessingThread()
	{
		Implementation impl = transformRules().getImplementation("k");
		Expr logged = findCall(impl, "_LOG_ATOMIC_$$A").getAttributes().findExpr("arg1");
		Expr checked = findCall(impl, "_CHECK_ATOMIC_$$A").getAttributes().findExpr("arg1");
		assertThat(logged.toString(), is("x$1"));
		assertThat(checked.toString(), is("x$2"));
	}

	@Test
	public void contractsAreDuplicatedOnlyWhenNonUniformAndSymmetric()
	{
		Procedure f = transformRules().getProcedure("f");
		List<String> requires = new ArrayList<String>();
		for( Requires r : f.getRequires() ) {
			requires.add(r.getCondition().toString());
		}
		List<String> ensures = new ArrayList<String>();
		for( Ensures e : f.getEnsures() ) {
			ensures.add(e.getCondition().toString());
		}
		assertThat(requires, is(Arrays.asList("n != 0bv32", "x$1 != n", "x$2 != n")));
		assertThat(ensures, is(Arrays.asList("y$1 != n", "y$2 != n", "x$1 == x$2")));
		assertThat(f.getRequires().get(2).getAttributes().findInt("thread", 0), is(2));
	}
}
