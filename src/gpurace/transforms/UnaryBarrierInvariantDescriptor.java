package gpurace.transforms;

import gpurace.analysis.UniformityOracle;
import gpurace.exec.GPURaceOptions;
import ivl.hir.*;

import java.util.ArrayList;
import java.util.List;

/** A barrier invariant stated for single threads, each named by an instantiation. */
public class UnaryBarrierInvariantDescriptor extends BarrierInvariantDescriptor
{
	private final List<Expr> instantiations = new ArrayList<Expr>();

	public UnaryBarrierInvariantDescriptor(Expr predicate, Expr invariant, Attributes attributes, String proc,
			UniformityOracle oracle, Program program, GPURaceOptions options)
	{
		super(predicate, invariant, attributes, proc, oracle, program, options);
	}

	public void addInstantiationExpr(Expr e)
	{
		instantiations.add(e);
	}

	public List<Expr> getInstantiationExprs()
	{
		return instantiations;
	}

	@Override
	protected List<Expr> getInstantiatedFacts()
	{
		List<Expr> ret = new ArrayList<Expr>();
		for( Expr e : instantiations ) {
			Expr inst = new ThreadInstantiator(e, oracle, proc).transform(invariant);
			ret.add(Expr.implies(inRange(e), inst));
		}
		return ret;
	}

	@Override
	protected List<Expr> getAccessChecks()
	{
		List<Expr> ret = new ArrayList<Expr>();
		for( Expr e : instantiations ) {
			ThreadInstantiator instantiator = new ThreadInstantiator(e, oracle, proc);
			for( MapSelectExpr read : getSharedArrayReads() ) {
				Expr accessed = makeAccessCondition(read, instantiator.transform(read.getIndexes().get(0)));
				if( accessed != null ) {
					ret.add(Expr.implies(inRange(e), accessed));
				}
			}
		}
		return ret;
	}
}
