package gpurace.transforms;

import gpurace.exec.GPURaceOptions;
import gpurace.hir.AccessType;
import gpurace.hir.KernelIdentifiers;
import ivl.hir.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Watches a single, arbitrary offset per array and access: the offset and
 * value shadows are unconstrained constants, and a log call only records
 * an access that hits them while the global <b>_TRACKING</b> flag is set.
 */
public class WatchdogRaceInstrumenter extends AbstractRaceInstrumenter
{
	public WatchdogRaceInstrumenter(Program program, GPURaceOptions options)
	{
		super(program, options);
	}

	@Override
	public void addRaceCheckingDeclarations()
	{
		super.addRaceCheckingDeclarations();
		program.addDeclaration(new GlobalVariable(RaceInstrumentationUtil.TRACKING_VARIABLE, BasicType.BOOL,
				new Attributes().add(RaceInstrumentationUtil.RACE_CHECKING)));
	}

	@Override
	protected Variable makeOffsetVariable(String name, Type type, Attributes attrs)
	{
		return new Constant(name, type, attrs);
	}

	@Override
	protected Variable makeValueVariable(String name, Type type, Attributes attrs)
	{
		return new Constant(name, type, attrs);
	}

	@Override
	public void addLogAccessProcedure(Variable array, AccessType access)
	{
		String name = array.getName();
		List<Formal> params = makeLogParameters(array, access);

		Expr condition = Expr.and(new IdentifierExpr(getShadow(RaceInstrumentationUtil.TRACKING_VARIABLE)),
				Expr.eq(new IdentifierExpr(getShadow(RaceInstrumentationUtil.makeOffsetVariableName(name, access))),
						new IdentifierExpr(findParameter(params, "_offset"))));
		if( isGroupShared(array) ) {
			condition = Expr.and(KernelIdentifiers.threadsInSameGroup(program, options.only_intra_group), condition);
		}
		if( !options.no_benign && access.isReadOrWrite() ) {
			condition = Expr.and(condition, Expr.eq(
					new IdentifierExpr(getShadow(RaceInstrumentationUtil.makeValueVariableName(name, access))),
					new IdentifierExpr(findParameter(params, "_value"))));
		}
		condition = Expr.and(new IdentifierExpr(findParameter(params, "_P")), condition);

		List<Cmd> cmds = new ArrayList<Cmd>();
		cmds.add(makeConditionalAssignment(
				getShadow(RaceInstrumentationUtil.makeHasOccurredVariableName(name, access)),
				condition.clone(), LiteralExpr.TRUE));
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
		addLogProcedure(array, access, params, Collections.<LocalVariable>emptyList(), cmds);
	}
}
