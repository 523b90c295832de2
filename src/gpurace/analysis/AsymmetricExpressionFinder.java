package gpurace.analysis;

import gpurace.hir.KernelIdentifiers;
import ivl.hir.*;

/**
 * Detects expressions whose meaning depends on which thread evaluates them:
 * those reading race-checking shadow state, which exists once for thread 1,
 * and those applying an other-thread function. A second, thread-2 copy of
 * such an expression would not express the same fact.
 */
public final class AsymmetricExpressionFinder
{
	private AsymmetricExpressionFinder()
	{
	}

	public static boolean isAsymmetric(Expr e)
	{
		DepthFirstIterator<Traversable> iter = new DepthFirstIterator<Traversable>(e);
		while( iter.hasNext() ) {
			Traversable t = iter.next();
			if( t instanceof IdentifierExpr ) {
				Variable decl = ((IdentifierExpr)t).getDecl();
				if( decl != null && decl.getAttributes().findBool("race_checking") ) {
					return true;
				}
			} else if( t instanceof FunctionCallExpr ) {
				if( KernelIdentifiers.isOtherFunction(((FunctionCallExpr)t).getName()) ) {
					return true;
				}
			}
		}
		return false;
	}
}
