package gpurace.transforms;

import ivl.hir.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Gives every state-capture point a unique label after loop unrolling has
 * duplicated blocks. Every command is replaced by a fresh copy so that no
 * two blocks share a command object afterwards.
 *
 * <ul>
 * <li><b>check_state*</b> becomes <b>check_state_N</b>, and the check call
 * that follows it is given the same <b>check_id</b>;</li>
 * <li><b>loop_head_state*</b> keeps its name with <b>$N</b> appended;</li>
 * <li><b>call_return_state*</b> becomes <b>call_return_state_N</b>.</li>
 * </ul>
 */
public class StateIdFixer
{
	private static final String pass_name = "[StateIdFixer]";

	public static final String CHECK_STATE = "check_state";
	public static final String LOOP_HEAD_STATE = "loop_head_state";
	public static final String CALL_RETURN_STATE = "call_return_state";

	/** Counters of one fix-up run. A context may be used once. */
	public static class Context
	{
		private int check_states = 0;
		private int loop_head_states = 0;
		private int call_return_states = 0;
		private boolean used = false;

		public int getCheckStates()
		{
			return check_states;
		}

		public int getLoopHeadStates()
		{
			return loop_head_states;
		}

		public int getCallReturnStates()
		{
			return call_return_states;
		}
	}

	private final Program program;
	private final Context context;

	public StateIdFixer(Program program, Context context)
	{
		this.program = program;
		this.context = context;
	}

	public void fix()
	{
		if( context.used ) {
			throw new IllegalStateException("[ERROR in StateIdFixer] state ids have already been fixed with this context");
		}
		context.used = true;
		for( Implementation impl : program.getImplementations() ) {
			for( Block b : impl.getBlocks() ) {
				b.setCmds(fixBlock(b.getCmds()));
			}
		}
		PrintTools.println(pass_name + " " + context.check_states + " check states, " + context.loop_head_states
				+ " loop head states, " + context.call_return_states + " call return states", 2);
	}

	private List<Cmd> fixBlock(List<Cmd> cmds)
	{
		List<Cmd> ret = new ArrayList<Cmd>(cmds.size());
		String old_check_id = null;
		String new_check_id = null;
		for( Cmd c : cmds ) {
			Cmd copy = c.clone();
			Attributes attrs = copy.getAttributes();
			String label = attrs.findString("captureState");
			if( copy instanceof AssumeCmd && label != null ) {
				if( label.startsWith(CHECK_STATE) ) {
					String fresh = CHECK_STATE + "_" + context.check_states++;
					attrs.put("captureState", fresh);
					String check_id = attrs.findString("check_id");
					if( check_id != null ) {
						attrs.put("check_id", fresh);
						old_check_id = check_id;
						new_check_id = fresh;
					}
				} else if( label.startsWith(LOOP_HEAD_STATE) ) {
					attrs.put("captureState", label + "$" + context.loop_head_states++);
				} else if( label.startsWith(CALL_RETURN_STATE) ) {
					attrs.put("captureState", CALL_RETURN_STATE + "_" + context.call_return_states++);
				}
			} else if( copy instanceof CallCmd && old_check_id != null
					&& old_check_id.equals(attrs.findString("check_id")) ) {
				attrs.put("check_id", new_check_id);
				old_check_id = null;
				new_check_id = null;
			}
			ret.add(copy);
		}
		return ret;
	}

	/** Removes the <b>$N</b> suffix added to loop head labels. */
	public static String getOriginalLabel(String label)
	{
		int dollar = label.lastIndexOf('$');
		return (dollar < 0) ? label : label.substring(0, dollar);
	}
}
