package gpurace.transforms;

import gpurace.exec.GPURaceOptions;
import gpurace.hir.AccessType;
import ivl.hir.*;

import java.util.Collections;

/**
 * Used when race checking is off. Log and check calls still have to bind
 * to something, so they get bodiless procedures without contracts. Barriers
 * still get an implementation, which only checks barrier divergence since
 * there is no shadow state to reset.
 */
public class NullRaceInstrumenter extends AbstractRaceInstrumenter
{
	public NullRaceInstrumenter(Program program, GPURaceOptions options)
	{
		super(program, options);
	}

	@Override
	public void addRaceCheckingDeclarations()
	{
	}

	@Override
	public void addKernelPrecondition()
	{
	}

	@Override
	public void addCaptureStates()
	{
	}

	@Override
	public void addLogAccessProcedure(Variable array, AccessType access)
	{
		program.addDeclaration(new Procedure(RaceInstrumentationUtil.makeLogProcedureName(array.getName(), access),
				makeLogParameters(array, access), Collections.<Formal>emptyList(),
				new Attributes().add("thread", LiteralExpr.integer(1))));
	}

	@Override
	public void addCheckAccessProcedure(Variable array, AccessType access)
	{
		program.addDeclaration(new Procedure(RaceInstrumentationUtil.makeCheckProcedureName(array.getName(), access),
				makeCheckParameters(array, access), Collections.<Formal>emptyList(),
				new Attributes().add("thread", LiteralExpr.integer(2))));
	}
}
