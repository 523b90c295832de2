package gpurace.analysis;

import ivl.base.ProgramParser;
import ivl.hir.Program;

import static org.junit.Assert.*;

import org.junit.Test;

public class UniformityAnalyserTest
{
	private static final String PROGRAM =
			"const local_id_x: bv32;\n"
			+ "const group_id_x: bv32;\n"
			+ "const group_size_x: bv32;\n"
			+ "var g: bv32;\n"
			+ "procedure helper(a: bv32) returns (r: bv32);\n"
			+ "procedure {:kernel} k(n: bv32);\n"
			+ "  modifies g;\n"
			+ "implementation helper(a: bv32) returns (r: bv32)\n"
			+ "{\n"
			+ "entry:\n"
			+ "  r := a;\n"
			+ "  return;\n"
			+ "}\n"
			+ "implementation k(n: bv32)\n"
			+ "{\n"
			+ "  var u: bv32;\n"
			+ "  var t: bv32;\n"
			+ "  var c: bv32;\n"
			+ "  var h: bv32;\n"
			+ "  var grp: bv32;\n"
			+ "  var from_global: bv32;\n"
			+ "entry:\n"
			+ "  u := n;\n"
			+ "  t := local_id_x;\n"
			+ "  grp := group_id_x;\n"
			+ "  from_global := g;\n"
			+ "  goto yes, no;\n"
			+ "yes:\n"
			+ "  assume t == 0bv32;\n"
			+ "  c := 1bv32;\n"
			+ "  goto join;\n"
			+ "no:\n"
			+ "  assume t != 0bv32;\n"
			+ "  goto join;\n"
			+ "join:\n"
			+ "  call h := helper(u);\n"
			+ "  return;\n"
			+ "}\n";

	private static UniformityAnalyser analyse(boolean only_intra_group, boolean disabled)
	{
		Program program = ProgramParser.parse(PROGRAM, "u.gbpl");
		UniformityAnalyser ua = new UniformityAnalyser(program, only_intra_group, disabled);
		ua.analyse();
		return ua;
	}

	@Test
	public void classifiesVariables()
	{
		UniformityAnalyser ua = analyse(false, false);
		assertTrue(ua.knowsOf("k"));
		assertFalse(ua.knowsOf("unknown"));
		assertTrue(ua.isUniform("k"));
		assertTrue(ua.isUniform("k", "n"));
		assertTrue(ua.isUniform("k", "u"));
		assertFalse(ua.isUniform("k", "t"));
		assertFalse(ua.isUniform("k", "grp"));
		assertFalse(ua.isUniform("k", "from_global"));
		assertFalse(ua.isUniform("k", "c"));
		assertTrue(ua.isUniform("k", "group_size_x"));
		assertFalse(ua.isUniform("k", "local_id_x"));
	}

	@Test
	public void uniformCallKeepsCalleeUniform()
	{
		UniformityAnalyser ua = analyse(false, false);
		assertTrue(ua.isUniform("helper"));
		assertTrue(ua.isUniform("helper", "a"));
		assertTrue(ua.isUniform("k", "h"));
		assertEquals("a", ua.getInParameter("helper", 0));
		assertEquals("r", ua.getOutParameter("helper", 0));
	}

	@Test
	public void groupIdsAreUniformWithinOneGroup()
	{
		UniformityAnalyser ua = analyse(true, false);
		assertTrue(ua.isUniform("k", "grp"));
		assertFalse(ua.isUniform("k", "t"));
	}

	@Test
	public void disabledAnalysisAnswersNonUniform()
	{
		UniformityAnalyser ua = analyse(false, true);
		assertTrue(ua.knowsOf("k"));
		assertFalse(ua.isUniform("k", "u"));
		assertFalse(ua.isUniform("k", "n"));
	}

	private static final String ATOMIC_PROGRAM =
			"const local_id_x: bv32;\n"
			+ "var $$A: [bv32]bv32;\n"
			+ "procedure {:kernel} k(n: bv32);\n"
			+ "implementation k(n: bv32)\n"
			+ "{\n"
			+ "  var v: bv32;\n"
			+ "entry:\n"
			+ "  assume {:atomic_refinement} {:variable v} {:offset n} {:arrayref \"$$A\"} true;\n"
			+ "  return;\n"
			+ "}\n";

	@Test
	public void atomicReturnValueWitnessIsNonUniform()
	{
		UniformityAnalyser ua = new UniformityAnalyser(ProgramParser.parse(ATOMIC_PROGRAM, "a.gbpl"), false, false);
		ua.analyse();
		assertTrue(ua.isUniform("k", "n"));
		assertFalse(ua.isUniform("k", "v"));
	}
}
