package gpurace.transforms;

import gpurace.analysis.UniformityOracle;
import gpurace.analysis.VariablesOccurringInExpression;
import gpurace.exec.GPURaceOptions;
import gpurace.exec.ToolExitCodes;
import gpurace.exec.UserErrorException;
import gpurace.hir.AccessType;
import gpurace.hir.BvBuiltins;
import gpurace.hir.KernelIdentifiers;
import ivl.hir.*;

import java.util.ArrayList;
import java.util.List;

/**
 * A barrier invariant met in the body of a procedure and held until the
 * next barrier. Before the barrier it is asserted for thread 1; after the
 * barrier each declared instantiation is assumed for both threads.
 * Expressions are kept in their original form and rewritten per thread only
 * when the commands are built.
 */
public abstract class BarrierInvariantDescriptor
{
	protected final Expr predicate;
	protected final Expr invariant;
	protected final Attributes attributes;
	protected final String proc;
	protected final UniformityOracle oracle;
	protected final Program program;
	protected final GPURaceOptions options;

	protected BarrierInvariantDescriptor(Expr predicate, Expr invariant, Attributes attributes, String proc,
			UniformityOracle oracle, Program program, GPURaceOptions options)
	{
		this.predicate = predicate;
		this.invariant = invariant;
		this.attributes = attributes;
		this.proc = proc;
		this.oracle = oracle;
		this.program = program;
		this.options = options;
	}

	/** Returns <b>assert {:barrier_invariant} {:thread 1} P ==> Inv</b> for thread 1. */
	public AssertCmd getAssertCmd()
	{
		Attributes attrs = ThreadRewriter.makeThreadSpecificAttributes(attributes, ThreadTag.ONE)
				.prepend("barrier_invariant");
		return new AssertCmd(dualise(ThreadTag.ONE, Expr.implies(predicate.clone(), invariant.clone())), attrs);
	}

	/** Returns the assumptions holding after the barrier, for both threads. */
	public List<Cmd> getInstantiationCmds()
	{
		List<Cmd> ret = new ArrayList<Cmd>();
		for( Expr fact : getInstantiatedFacts() ) {
			for( ThreadTag t : ThreadTag.values() ) {
				ret.add(new AssumeCmd(dualise(t, Expr.implies(predicate.clone(), fact.clone()))));
			}
		}
		return ret;
	}

	/**
	 * Returns the assertions that thread 1 accessed every shared array
	 * element the invariant reads, in the barrier interval now ending.
	 */
	public List<Cmd> getAccessCheckCmds()
	{
		List<Cmd> ret = new ArrayList<Cmd>();
		for( Expr check : getAccessChecks() ) {
			Attributes attrs = ThreadRewriter.makeThreadSpecificAttributes(attributes, ThreadTag.ONE)
					.prepend("barrier_invariant_access_check");
			ret.add(new AssertCmd(dualise(ThreadTag.ONE, Expr.implies(predicate.clone(), check)), attrs));
		}
		return ret;
	}

	/** The instantiated invariants, each guarded by its range condition. */
	protected abstract List<Expr> getInstantiatedFacts();

	/** The access conditions, each guarded by its range condition. */
	protected abstract List<Expr> getAccessChecks();

	protected Expr dualise(ThreadTag thread, Expr e)
	{
		return new ThreadRewriter(thread, oracle, proc, program, options.only_intra_group).transform(e);
	}

	/** <b>0 &lt;= e &amp;&amp; e &lt; group_size_x</b>, signed. */
	protected Expr inRange(Expr e)
	{
		Variable size = KernelIdentifiers.getIdConstant(program, KernelIdentifiers.GROUP_SIZE,
				KernelIdentifiers.DIMENSIONS[0]);
		if( size == null ) {
			throw new UserErrorException("barrier invariants need " + KernelIdentifiers.GROUP_SIZE
					+ KernelIdentifiers.DIMENSIONS[0] + " to be declared", ToolExitCodes.OTHER_ERROR);
		}
		Type t = e.getType();
		Expr zero;
		if( t != null && t.isBv() ) {
			zero = LiteralExpr.bv(0, t.getBvBits());
		} else if( t != null && t.isInt() ) {
			zero = LiteralExpr.integer(0);
		} else {
			throw new IllegalStateException("[ERROR in BarrierInvariantDescriptor] instantiation " + e
					+ " must be an integer or a bit-vector");
		}
		return Expr.and(BvBuiltins.sle(program, zero, e.clone()),
				BvBuiltins.slt(program, e.clone(), new IdentifierExpr(size)));
	}

	/**
	 * <b>(READ_HO &amp;&amp; READ_OFF == i) || (WRITE_HO &amp;&amp; WRITE_OFF == i)</b>
	 * for a read <b>A[...]</b> whose instantiated index is i, or null when
	 * the array has no shadow state.
	 */
	protected Expr makeAccessCondition(MapSelectExpr read, Expr index)
	{
		String array = ((IdentifierExpr)read.getMap()).getName();
		Expr ret = null;
		for( AccessType access : new AccessType[] { AccessType.READ, AccessType.WRITE } ) {
			Variable ho = program.getTopLevelVariable(RaceInstrumentationUtil.makeHasOccurredVariableName(array, access));
			Variable off = program.getTopLevelVariable(RaceInstrumentationUtil.makeOffsetVariableName(array, access));
			if( ho == null || off == null ) {
				continue;
			}
			Expr accessed = Expr.and(new IdentifierExpr(ho), Expr.eq(new IdentifierExpr(off), index.clone()));
			ret = (ret == null) ? accessed : Expr.or(ret, accessed);
		}
		return ret;
	}

	protected List<MapSelectExpr> getSharedArrayReads()
	{
		return new VariablesOccurringInExpression(invariant).getSharedArrayReads();
	}

	public String getProcedureName()
	{
		return proc;
	}
}
