package gpurace.transforms;

import ivl.base.ProgramParser;
import ivl.hir.*;
import ivl.transforms.LoopUnroller;
import ivl.transforms.TransformPass;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class StateIdFixerTest
{
	private static final String PROGRAM =
			"procedure p();\n"
			+ "implementation p()\n"
			+ "{\n"
			+ "entry:\n"
			+ "  assume {:captureState \"check_state_7\"} {:check_id \"check_state_7\"} true;\n"
			+ "  call {:check_id \"check_state_7\"} q();\n"
			+ "  goto head;\n"
			+ "head:\n"
			+ "  assume {:captureState \"loop_head_state_0\"} true;\n"
			+ "  goto body, done;\n"
			+ "body:\n"
			+ "  assume {:captureState \"check_state_8\"} {:check_id \"check_state_8\"} true;\n"
			+ "  call {:check_id \"check_state_8\"} q();\n"
			+ "  assume {:captureState \"call_return_state_3\"} {:procedureName \"q\"} true;\n"
			+ "  goto head;\n"
			+ "done:\n"
			+ "  return;\n"
			+ "}\n";

	private static String label(Cmd c)
	{
		return c.getAttributes().findString("captureState");
	}

	@Test
	public void renumbersStatesInOrder()
	{
		Program program = ProgramParser.parse(PROGRAM, "p.gbpl");
		StateIdFixer.Context context = new StateIdFixer.Context();
		new StateIdFixer(program, context).fix();

		Implementation impl = program.getImplementation("p");
		List<Cmd> entry = impl.getBlock("entry").getCmds();
		assertThat(label(entry.get(0)), is("check_state_0"));
		assertThat(entry.get(0).getAttributes().findString("check_id"), is("check_state_0"));
		assertThat(entry.get(1).getAttributes().findString("check_id"), is("check_state_0"));
		assertThat(label(impl.getBlock("head").getCmds().get(0)), is("loop_head_state_0$0"));
		List<Cmd> body = impl.getBlock("body").getCmds();
		assertThat(label(body.get(0)), is("check_state_1"));
		assertThat(body.get(1).getAttributes().findString("check_id"), is("check_state_1"));
		assertThat(label(body.get(2)), is("call_return_state_0"));
		assertThat(body.get(2).getAttributes().findString("procedureName"), is("q"));

		assertThat(context.getCheckStates(), is(2));
		assertThat(context.getLoopHeadStates(), is(1));
		assertThat(context.getCallReturnStates(), is(1));
	}

	@Test
	public void unrolledCopiesGetDistinctLabels()
	{
		Program program = ProgramParser.parse(PROGRAM, "p.gbpl");
		TransformPass.run(new LoopUnroller(program, 3));
		new StateIdFixer(program, new StateIdFixer.Context()).fix();

		Set<String> labels = new HashSet<String>();
		Set<Cmd> seen = new HashSet<Cmd>();
		int states = 0;
		for( Block b : program.getImplementation("p").getBlocks() ) {
			for( Cmd c : b.getCmds() ) {
				assertTrue("command objects are shared between blocks", seen.add(c));
				if( label(c) != null ) {
					states++;
					labels.add(label(c));
				}
			}
		}
		assertThat(states, is(10));
		assertThat(labels.size(), is(10));
		assertTrue(labels.contains("loop_head_state_0$2"));
		assertTrue(labels.contains("check_state_3"));
	}

	@Test(expected = IllegalStateException.class)
	public void contextCannotBeReused()
	{
		Program program = ProgramParser.parse(PROGRAM, "p.gbpl");
		StateIdFixer.Context context = new StateIdFixer.Context();
		new StateIdFixer(program, context).fix();
		new StateIdFixer(program, context).fix();
	}

	@Test
	public void originalLabelDropsCopyNumber()
	{
		assertThat(StateIdFixer.getOriginalLabel("loop_head_state_4$12"), is("loop_head_state_4"));
		assertThat(StateIdFixer.getOriginalLabel("check_state_1"), is("check_state_1"));
	}
}
