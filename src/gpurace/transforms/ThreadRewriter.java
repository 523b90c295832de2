package gpurace.transforms;

import gpurace.analysis.UniformityOracle;
import gpurace.hir.KernelIdentifiers;
import ivl.hir.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rewrites an expression as seen by one thread. Thread ids and non-uniform
 * locals and formals are renamed to the thread's copy, other-thread
 * functions are replaced by the other thread's view of their argument, and
 * reads from group-shared arrays select the slot of the thread's group.
 * Renamed identifiers are left unbound; names are resolved again once the
 * dualised program is complete.
 */
public class ThreadRewriter extends ExprTransformer
{
	private final ThreadTag thread;
	private final UniformityOracle oracle;
	private final String proc;
	private final Program program;
	private final boolean only_intra_group;

	/**
	 * @param oracle uniformity facts, or null to treat every local as non-uniform.
	 * @param proc the procedure owning the expressions.
	 */
	public ThreadRewriter(ThreadTag thread, UniformityOracle oracle, String proc, Program program,
			boolean only_intra_group)
	{
		this.thread = thread;
		this.oracle = oracle;
		this.proc = proc;
		this.program = program;
		this.only_intra_group = only_intra_group;
	}

	public ThreadTag getThread()
	{
		return thread;
	}

	private ThreadRewriter forOtherThread()
	{
		return new ThreadRewriter(thread.other(), oracle, proc, program, only_intra_group);
	}

	@Override
	protected Expr transformIdentifier(IdentifierExpr e)
	{
		Variable decl = e.getDecl();
		String name = e.getName();
		if( decl instanceof Constant ) {
			if( KernelIdentifiers.isThreadLocalIdConstant(decl)
					|| (KernelIdentifiers.isGroupIdConstant(decl) && !only_intra_group) ) {
				return rename(e, thread.getId());
			}
			return e.clone();
		}
		if( decl instanceof GlobalVariable ) {
			Attributes attrs = decl.getAttributes();
			if( attrs.findBool("global") || attrs.findBool("group_shared") || attrs.findBool("atomic_usedmap")
					|| name.contains("_NOT_ACCESSED_") || name.contains("_ARRAY_OFFSET") ) {
				return e.clone();
			}
			if( attrs.findBool("race_checking") ) {
				return rename(e, 1);
			}
			return rename(e, thread.getId());
		}
		if( oracle != null && oracle.isUniform(proc, name) ) {
			return e.clone();
		}
		return rename(e, thread.getId());
	}

	private static Expr rename(IdentifierExpr e, int t)
	{
		return new IdentifierExpr(KernelIdentifiers.makeThreadName(e.getName(), t));
	}

	@Override
	protected Expr transformFunctionCall(FunctionCallExpr e)
	{
		if( KernelIdentifiers.isOtherFunction(e.getName()) ) {
			if( e.getArguments().size() != 1 ) {
				throw new IllegalStateException("[ERROR in ThreadRewriter] " + e.getName()
						+ " expects one argument: " + e);
			}
			return forOtherThread().transform(e.getArguments().get(0));
		}
		return super.transformFunctionCall(e);
	}

	@Override
	protected Expr transformMapSelect(MapSelectExpr e)
	{
		if( isGroupSharedArray(e.getMap()) && !only_intra_group ) {
			Expr slot = new MapSelectExpr(e.getMap().clone(), groupIndex());
			return new MapSelectExpr(slot, transform(e.getIndexes()));
		}
		return super.transformMapSelect(e);
	}

	@Override
	protected Expr transformMapStore(MapStoreExpr e)
	{
		if( isGroupSharedArray(e.getMap()) && !only_intra_group ) {
			Expr slot = new MapSelectExpr(e.getMap().clone(), groupIndex());
			Expr stored = new MapStoreExpr(slot, transform(e.getIndexes()), transform(e.getValue()));
			return new MapStoreExpr(e.getMap().clone(), Collections.singletonList(groupIndex()), stored);
		}
		return super.transformMapStore(e);
	}

	/** Rewrites the left-hand side of an assignment. */
	public AssignLhs transformLhs(AssignLhs lhs)
	{
		if( lhs instanceof SimpleAssignLhs ) {
			return new SimpleAssignLhs((IdentifierExpr)transformIdentifier(lhs.getAssignedVariable()));
		}
		MapAssignLhs m = (MapAssignLhs)lhs;
		AssignLhs base = transformLhs(m.getMap());
		if( m.getMap() instanceof SimpleAssignLhs && !only_intra_group
				&& isGroupSharedArray(m.getMap().getAssignedVariable()) ) {
			base = new MapAssignLhs(base, Collections.singletonList(groupIndex()));
		}
		return new MapAssignLhs(base, transform(m.getIndexes()));
	}

	private static boolean isGroupSharedArray(Expr map)
	{
		if( !(map instanceof IdentifierExpr) ) {
			return false;
		}
		Variable decl = ((IdentifierExpr)map).getDecl();
		return (decl instanceof GlobalVariable) && decl.getAttributes().findBool("group_shared");
	}

	/**
	 * Slot of the group-shared copy used by this thread: thread 1 owns slot
	 * 0; thread 2 shares it only when both threads are in the same group.
	 */
	private Expr groupIndex()
	{
		if( thread == ThreadTag.ONE ) {
			return LiteralExpr.bv(0, 1);
		}
		Expr same_group = sameGroupDualised(program);
		if( Expr.isTrue(same_group) ) {
			return LiteralExpr.bv(0, 1);
		}
		return Expr.ite(same_group, LiteralExpr.bv(0, 1), LiteralExpr.bv(1, 1));
	}

	/**
	 * <b>group_id_x$1 == group_id_x$2 &amp;&amp; ...</b> over the declared
	 * group ids, already in dualised form.
	 */
	public static Expr sameGroupDualised(Program program)
	{
		Expr ret = LiteralExpr.TRUE;
		for( String dim : KernelIdentifiers.DIMENSIONS ) {
			if( KernelIdentifiers.getIdConstant(program, KernelIdentifiers.GROUP_ID, dim) != null ) {
				String name = KernelIdentifiers.GROUP_ID + dim;
				ret = Expr.and(ret, Expr.eq(new IdentifierExpr(KernelIdentifiers.makeThreadName(name, 1)),
						new IdentifierExpr(KernelIdentifiers.makeThreadName(name, 2))));
			}
		}
		return ret;
	}

	/** Returns a copy of the attributes tagged with <b>{:thread N}</b>. */
	public static Attributes makeThreadSpecificAttributes(Attributes attrs, ThreadTag thread)
	{
		return attrs.clone().put("thread", LiteralExpr.integer(thread.getId()));
	}

	/** Rewrites the expression parameters of the attributes whose key starts with "arg". */
	public Attributes rewriteArgAttributes(Attributes attrs)
	{
		List<Attributes.Entry> entries = new ArrayList<Attributes.Entry>();
		for( Attributes.Entry entry : attrs.clone().getEntries() ) {
			List<Object> params = entry.getParams();
			if( entry.getKey().startsWith("arg") && params.size() == 1 && params.get(0) instanceof Expr ) {
				List<Object> rewritten = new ArrayList<Object>();
				rewritten.add(transform((Expr)params.get(0)));
				entries.add(new Attributes.Entry(entry.getKey(), rewritten));
			} else {
				entries.add(entry);
			}
		}
		return new Attributes(entries);
	}
}
