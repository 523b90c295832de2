package gpurace.analysis;

import ivl.hir.Expr;

/**
 * Tells which procedures, variables and expressions are guaranteed to have
 * the same value in every thread. All queries name procedures and variables
 * as they appear in the program before dualisation.
 */
public interface UniformityOracle
{
	/** Returns true if the oracle has facts about the procedure. */
	boolean knowsOf(String proc);

	/** Returns true if the procedure is only ever called under uniform control. */
	boolean isUniform(String proc);

	boolean isUniform(String proc, String var);

	boolean isUniform(String proc, Expr e);

	/** Returns the name of the i-th input parameter of a known procedure. */
	String getInParameter(String proc, int i);

	/** Returns the name of the i-th output parameter of a known procedure. */
	String getOutParameter(String proc, int i);
}
