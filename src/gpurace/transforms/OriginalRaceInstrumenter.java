package gpurace.transforms;

import gpurace.exec.GPURaceOptions;
import gpurace.hir.AccessType;
import gpurace.hir.KernelIdentifiers;
import ivl.hir.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps one shadow slot per array and access. Each log call decides
 * nondeterministically, through a havoc'd <b>track</b> flag, whether the
 * access it records replaces the one in the slot.
 */
public class OriginalRaceInstrumenter extends AbstractRaceInstrumenter
{
	public OriginalRaceInstrumenter(Program program, GPURaceOptions options)
	{
		super(program, options);
	}

	@Override
	public void addLogAccessProcedure(Variable array, AccessType access)
	{
		String name = array.getName();
		List<Formal> params = makeLogParameters(array, access);
		LocalVariable track = new LocalVariable("track", BasicType.BOOL);

		List<Cmd> cmds = new ArrayList<Cmd>();
		cmds.add(new HavocCmd(Collections.singletonList(new IdentifierExpr(track))));

		Expr condition = Expr.and(new IdentifierExpr(findParameter(params, "_P")), new IdentifierExpr(track));
		if( isGroupShared(array) ) {
			condition = Expr.and(KernelIdentifiers.threadsInSameGroup(program, options.only_intra_group), condition);
		}
		cmds.add(makeConditionalAssignment(
				getShadow(RaceInstrumentationUtil.makeHasOccurredVariableName(name, access)),
				condition.clone(), LiteralExpr.TRUE));
		cmds.add(makeConditionalAssignment(
				getShadow(RaceInstrumentationUtil.makeOffsetVariableName(name, access)),
				condition.clone(), new IdentifierExpr(findParameter(params, "_offset"))));
		if( !options.no_benign && access.isReadOrWrite() ) {
			cmds.add(makeConditionalAssignment(
					getShadow(RaceInstrumentationUtil.makeValueVariableName(name, access)),
					condition.clone(), new IdentifierExpr(findParameter(params, "_value"))));
		}
		if( !options.no_benign && access == AccessType.WRITE ) {
			cmds.add(makeConditionalAssignment(
					getShadow(RaceInstrumentationUtil.makeBenignFlagVariableName(name)),
					condition.clone(), Expr.neq(new IdentifierExpr(findParameter(params, "_value")),
							new IdentifierExpr(findParameter(params, "_value_old")))));
		}
		Formal handle = findParameter(params, "_async_handle");
		if( handle != null ) {
			cmds.add(makeConditionalAssignment(
					getShadow(RaceInstrumentationUtil.makeAsyncHandleVariableName(name, access)),
					condition.clone(), new IdentifierExpr(handle)));
		}
		addLogProcedure(array, access, params, Collections.singletonList(track), cmds);
	}
}
