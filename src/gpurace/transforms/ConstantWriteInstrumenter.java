package gpurace.transforms;

import gpurace.hir.AccessType;
import ivl.hir.*;
import ivl.transforms.TransformPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns accesses to arrays in constant memory into checks that they are
 * never written. A write check becomes <b>assert {:constant_write} !P</b>;
 * every other log or check call on such an array is dropped, since
 * constant memory is never race-checked.
 */
public class ConstantWriteInstrumenter extends TransformPass
{
	private static final String pass_name = "[ConstantWriteInstrumenter]";

	private int num_writes = 0;

	public ConstantWriteInstrumenter(Program program)
	{
		super(program);
	}

	@Override
	public String getPassName()
	{
		return pass_name;
	}

	@Override
	public void start()
	{
		for( Implementation impl : program.getImplementations() ) {
			for( Block b : impl.getBlocks() ) {
				List<Cmd> cmds = new ArrayList<Cmd>();
				for( Cmd c : b.getCmds() ) {
					RaceInstrumentationUtil.AccessProcedure access = (c instanceof CallCmd)
							? RaceInstrumentationUtil.parseAccessProcedureName(((CallCmd)c).getCallee()) : null;
					if( access == null || !isConstantArray(access.array) ) {
						cmds.add(c);
					} else if( !access.is_log && access.access == AccessType.WRITE ) {
						cmds.add(makeConstantWriteAssert((CallCmd)c));
					}
				}
				b.setCmds(cmds);
			}
		}
		PrintTools.println(pass_name + " " + num_writes + " writes to constant memory", 2);
	}

	private boolean isConstantArray(String name)
	{
		Variable v = program.getTopLevelVariable(name);
		return v != null && v.getAttributes().findBool("constant");
	}

	private AssertCmd makeConstantWriteAssert(CallCmd call)
	{
		if( call.getIns().isEmpty() ) {
			throw new IllegalStateException("[ERROR in ConstantWriteInstrumenter] " + call.getCallee()
					+ " has no predicate argument");
		}
		Attributes attrs = call.getAttributes().clone().prepend("constant_write");
		AssertCmd ret = new AssertCmd(Expr.not(call.getIns().get(0).clone()), attrs);
		ret.setPosition(call.getPosition());
		num_writes++;
		return ret;
	}
}
