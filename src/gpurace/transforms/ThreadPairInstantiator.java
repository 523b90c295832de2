package gpurace.transforms;

import gpurace.analysis.VariablesOccurringInExpression;
import gpurace.hir.KernelIdentifiers;
import ivl.hir.*;

/**
 * Instantiates a binary barrier invariant for a pair of threads. The x id
 * stands for the first thread of the pair; under an other-thread function
 * the pair is swapped, so <b>__other_bv32(e)</b> is e seen by the second
 * thread. Thread-uniform locals are rejected.
 */
public class ThreadPairInstantiator extends ExprTransformer
{
	private final Expr first;
	private final Expr second;

	public ThreadPairInstantiator(Expr first, Expr second)
	{
		this.first = first;
		this.second = second;
	}

	@Override
	protected Expr transformIdentifier(IdentifierExpr e)
	{
		Variable decl = e.getDecl();
		if( decl == null ) {
			throw new IllegalStateException("[ERROR in ThreadPairInstantiator] unresolved identifier " + e);
		}
		if( ThreadInstantiator.isInstantiatedId(decl) ) {
			return first.clone();
		}
		if( (decl instanceof Constant) || VariablesOccurringInExpression.isSharedArray(decl) ) {
			return e.clone();
		}
		throw ThreadInstantiator.notInstantiable(e);
	}

	@Override
	protected Expr transformFunctionCall(FunctionCallExpr e)
	{
		if( KernelIdentifiers.isOtherFunction(e.getName()) ) {
			return new ThreadPairInstantiator(second, first).transform(e.getArguments().get(0));
		}
		return super.transformFunctionCall(e);
	}
}
