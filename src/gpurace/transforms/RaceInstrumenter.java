package gpurace.transforms;

import gpurace.hir.AccessType;
import ivl.hir.Variable;

/**
 * Adds race-checking instrumentation to a kernel program. The first four
 * operations run before dualisation; the log and check procedures are
 * created on demand while the dualiser meets calls to them.
 */
public interface RaceInstrumenter
{
	/** Declares the shadow state of every race-checked array. */
	void addRaceCheckingDeclarations();

	/** Requires that no access has been recorded when a kernel starts. */
	void addKernelPrecondition();

	/** Gives every barrier procedure an implementation that resets shadow state. */
	void addBarrierImplementation();

	/** Adds the state-capture points used by counterexample diagnosis. */
	void addCaptureStates();

	void addLogAccessProcedure(Variable array, AccessType access);

	void addCheckAccessProcedure(Variable array, AccessType access);
}
