package gpurace.transforms;

import gpurace.analysis.UniformityOracle;
import gpurace.exec.GPURaceOptions;
import ivl.hir.*;

import java.util.ArrayList;
import java.util.List;

/**
 * A barrier invariant relating two distinct threads. Each instantiation is
 * a pair; inside the invariant the other-thread functions name the second
 * thread of the pair.
 */
public class BinaryBarrierInvariantDescriptor extends BarrierInvariantDescriptor
{
	private final List<Expr[]> instantiations = new ArrayList<Expr[]>();

	public BinaryBarrierInvariantDescriptor(Expr predicate, Expr invariant, Attributes attributes, String proc,
			UniformityOracle oracle, Program program, GPURaceOptions options)
	{
		super(predicate, invariant, attributes, proc, oracle, program, options);
	}

	public void addInstantiationExprPair(Expr first, Expr second)
	{
		instantiations.add(new Expr[] { first, second });
	}

	public int getInstantiationCount()
	{
		return instantiations.size();
	}

	private Expr pairCondition(Expr[] pair)
	{
		return Expr.and(Expr.and(inRange(pair[0]), inRange(pair[1])), Expr.neq(pair[0].clone(), pair[1].clone()));
	}

	@Override
	protected List<Expr> getInstantiatedFacts()
	{
		List<Expr> ret = new ArrayList<Expr>();
		for( Expr[] pair : instantiations ) {
			Expr inst = new ThreadPairInstantiator(pair[0], pair[1]).transform(invariant);
			ret.add(Expr.implies(pairCondition(pair), inst));
		}
		return ret;
	}

	@Override
	protected List<Expr> getAccessChecks()
	{
		List<Expr> ret = new ArrayList<Expr>();
		for( Expr[] pair : instantiations ) {
			for( Expr[] order : new Expr[][] { pair, { pair[1], pair[0] } } ) {
				ThreadPairInstantiator instantiator = new ThreadPairInstantiator(order[0], order[1]);
				for( MapSelectExpr read : getSharedArrayReads() ) {
					Expr accessed = makeAccessCondition(read, instantiator.transform(read.getIndexes().get(0)));
					if( accessed != null ) {
						ret.add(Expr.implies(pairCondition(pair), accessed));
					}
				}
			}
		}
		return ret;
	}
}
