package gpurace.transforms;

import gpurace.analysis.UniformityOracle;
import gpurace.analysis.VariablesOccurringInExpression;
import gpurace.exec.ToolExitCodes;
import gpurace.exec.UserErrorException;
import gpurace.hir.KernelIdentifiers;
import ivl.hir.*;

/**
 * Instantiates a barrier invariant for an arbitrary thread: the thread's
 * x id is replaced by the instantiation expression. Only expressions every
 * thread can evaluate may appear besides the id: constants, shared arrays
 * and variables uniform in the enclosing procedure.
 */
public class ThreadInstantiator extends ExprTransformer
{
	private final Expr instantiation;
	private final UniformityOracle oracle;
	private final String proc;

	public ThreadInstantiator(Expr instantiation, UniformityOracle oracle, String proc)
	{
		this.instantiation = instantiation;
		this.oracle = oracle;
		this.proc = proc;
	}

	@Override
	protected Expr transformIdentifier(IdentifierExpr e)
	{
		Variable decl = e.getDecl();
		if( decl == null ) {
			throw new IllegalStateException("[ERROR in ThreadInstantiator] unresolved identifier " + e);
		}
		if( isInstantiatedId(decl) ) {
			return instantiation.clone();
		}
		if( (decl instanceof Constant) || VariablesOccurringInExpression.isSharedArray(decl)
				|| (!(decl instanceof GlobalVariable) && oracle != null && oracle.isUniform(proc, decl.getName())) ) {
			return e.clone();
		}
		throw notInstantiable(e);
	}

	static boolean isInstantiatedId(Variable decl)
	{
		return KernelIdentifiers.isThreadLocalIdConstant(decl)
				&& decl.getName().equals(KernelIdentifiers.LOCAL_ID + KernelIdentifiers.DIMENSIONS[0]);
	}

	static UserErrorException notInstantiable(Expr e)
	{
		String sep = PrintTools.line_sep;
		return new UserErrorException("Expression " + e
				+ " is not valid as part of a barrier invariant: it cannot be instantiated by arbitrary threads." + sep
				+ "Check that it is not a thread local variable, or a thread local (rather than __local or __global) array."
				+ sep
				+ "In particular, if you have a local variable called tid, which you initialise to e.g. get_local_id(0),"
				+ " this will not work:" + sep
				+ "  you need to use get_local_id(0) directly.",
				ToolExitCodes.OTHER_ERROR);
	}
}
