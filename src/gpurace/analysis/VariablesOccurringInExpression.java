package gpurace.analysis;

import ivl.hir.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the variables an expression refers to, and the reads it makes
 * from shared (global or group-shared) arrays.
 */
public class VariablesOccurringInExpression
{
	private final Set<Variable> variables = new LinkedHashSet<Variable>();
	private final List<MapSelectExpr> shared_reads = new ArrayList<MapSelectExpr>();

	public VariablesOccurringInExpression(Expr e)
	{
		DepthFirstIterator<Traversable> iter = new DepthFirstIterator<Traversable>(e);
		while( iter.hasNext() ) {
			Traversable t = iter.next();
			if( t instanceof IdentifierExpr ) {
				Variable decl = ((IdentifierExpr)t).getDecl();
				if( decl != null ) {
					variables.add(decl);
				}
			} else if( t instanceof MapSelectExpr ) {
				MapSelectExpr select = (MapSelectExpr)t;
				if( select.getMap() instanceof IdentifierExpr && isSharedArray(((IdentifierExpr)select.getMap()).getDecl()) ) {
					shared_reads.add(select);
				}
			}
		}
	}

	public Set<Variable> getVariables()
	{
		return variables;
	}

	/** Reads A[i] from global or group-shared arrays, in pre-order. */
	public List<MapSelectExpr> getSharedArrayReads()
	{
		return shared_reads;
	}

	public static boolean isSharedArray(Variable v)
	{
		return (v instanceof GlobalVariable)
				&& (v.getAttributes().findBool("global") || v.getAttributes().findBool("group_shared"));
	}
}
