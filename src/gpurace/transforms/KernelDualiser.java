package gpurace.transforms;

import gpurace.analysis.AsymmetricExpressionFinder;
import gpurace.analysis.UniformityOracle;
import gpurace.exec.GPURaceOptions;
import gpurace.hir.KernelIdentifiers;
import ivl.hir.*;
import ivl.transforms.TransformPass;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Two-thread reduction of a kernel program. Every declaration, clause and
 * command is rewritten so that the program describes two arbitrary threads
 * running side by side: per-thread state is split into a <b>$1</b> and a
 * <b>$2</b> copy, uniform state stays shared, and shared arrays stay single.
 *
 * <p>
 * Log and check procedures of the race instrumentation are created on
 * demand when their first call is met. Barrier invariants are collected
 * per block and turned into assertions and assumptions around the next
 * barrier call of the same block.
 */
public class KernelDualiser extends TransformPass
{
	private static final String pass_name = "[KernelDualiser]";

	private final UniformityOracle oracle;
	private final RaceInstrumenter instrumenter;
	private final GPURaceOptions options;

	/** Name of the procedure whose body is being rewritten. */
	private String proc_name;
	/** Threads the current body is rewritten for. */
	private List<ThreadTag> threads;

	public KernelDualiser(Program program, UniformityOracle oracle, RaceInstrumenter instrumenter,
			GPURaceOptions options)
	{
		super(program);
		this.oracle = oracle;
		this.instrumenter = instrumenter;
		this.options = options;
	}

	@Override
	public String getPassName()
	{
		return pass_name;
	}

	@Override
	public void start()
	{
		List<Declaration> decls = program.getDeclarations();
		List<Declaration> dualised = new ArrayList<Declaration>();
		// Declarations appended while rewriting (log and check procedures,
		// helper functions) are visited by the same loop.
		for( int i = 0; i < decls.size(); i++ ) {
			Declaration d = decls.get(i);
			if( isBarrierInvariantProcedure(d.getName()) ) {
				continue;
			}
			if( d instanceof Procedure ) {
				dualiseProcedure((Procedure)d);
				dualised.add(d);
			} else if( d instanceof Implementation ) {
				dualiseImplementation((Implementation)d);
				dualised.add(d);
			} else if( d instanceof Variable ) {
				dualised.addAll(dualiseTopLevelVariable((Variable)d));
			} else if( d instanceof Axiom ) {
				dualised.addAll(dualiseAxiom((Axiom)d));
			} else {
				dualised.add(d);
			}
		}
		program.setDeclarations(dualised);
		PrintTools.println(pass_name + " " + dualised.size() + " declarations after dualisation", 2);
	}

	private boolean isBarrierInvariantProcedure(String name)
	{
		Procedure proc = program.getProcedure(name);
		if( proc == null ) {
			return false;
		}
		Attributes attrs = proc.getAttributes();
		return attrs.findBool("barrier_invariant") || attrs.findBool("binary_barrier_invariant");
	}

	/** Returns the single thread named by <b>{:thread N}</b>, or both threads. */
	private static List<ThreadTag> getThreads(Attributes attrs)
	{
		int thread = attrs.findInt("thread", 0);
		if( thread == 0 ) {
			return Arrays.asList(ThreadTag.ONE, ThreadTag.TWO);
		}
		return Collections.singletonList(ThreadTag.fromId(thread));
	}

	private ThreadRewriter rewriter(ThreadTag thread)
	{
		return new ThreadRewriter(thread, oracle, proc_name, program, options.only_intra_group);
	}

	private boolean isUniformParameter(String proc, int index, boolean incoming)
	{
		if( !oracle.knowsOf(proc) ) {
			return false;
		}
		String name = incoming ? oracle.getInParameter(proc, index) : oracle.getOutParameter(proc, index);
		return oracle.isUniform(proc, name);
	}

	/**
	 * Uniform parameters first, in their original order, then the copies of
	 * the others for each thread in turn.
	 */
	private List<Formal> dualiseParameters(String proc, List<Formal> params, List<ThreadTag> threads,
			boolean incoming)
	{
		List<Formal> ret = new ArrayList<Formal>();
		List<Formal> non_uniform = new ArrayList<Formal>();
		for( int i = 0; i < params.size(); i++ ) {
			if( isUniformParameter(proc, i, incoming) ) {
				ret.add(params.get(i));
			} else {
				non_uniform.add(params.get(i));
			}
		}
		for( ThreadTag t : threads ) {
			for( Formal f : non_uniform ) {
				ret.add(f.copy(KernelIdentifiers.makeThreadName(f.getName(), t.getId()), f.getType()));
			}
		}
		return ret;
	}

	private void dualiseProcedure(Procedure proc)
	{
		proc_name = proc.getName();
		threads = getThreads(proc.getAttributes());

		List<Requires> requires = new ArrayList<Requires>();
		for( Requires r : proc.getRequires() ) {
			for( ThreadTag t : getClauseThreads(r.getCondition()) ) {
				Requires dual = new Requires(r.isFree(), rewriter(t).transform(r.getCondition()),
						ThreadRewriter.makeThreadSpecificAttributes(r.getAttributes(), t));
				dual.setPosition(r.getPosition());
				requires.add(dual);
			}
		}
		List<Ensures> ensures = new ArrayList<Ensures>();
		for( Ensures e : proc.getEnsures() ) {
			for( ThreadTag t : getClauseThreads(e.getCondition()) ) {
				Ensures dual = new Ensures(e.isFree(), rewriter(t).transform(e.getCondition()),
						ThreadRewriter.makeThreadSpecificAttributes(e.getAttributes(), t));
				dual.setPosition(e.getPosition());
				ensures.add(dual);
			}
		}
		Map<String, IdentifierExpr> modifies = new LinkedHashMap<String, IdentifierExpr>();
		for( IdentifierExpr m : proc.getModifies() ) {
			for( ThreadTag t : getClauseThreads(m) ) {
				IdentifierExpr dual = (IdentifierExpr)rewriter(t).transform(m);
				if( !modifies.containsKey(dual.getName()) ) {
					modifies.put(dual.getName(), dual);
				}
			}
		}
		proc.setRequires(requires);
		proc.setEnsures(ensures);
		proc.setModifies(new ArrayList<IdentifierExpr>(modifies.values()));
		proc.setInParams(dualiseParameters(proc_name, proc.getInParams(), threads, true));
		proc.setOutParams(dualiseParameters(proc_name, proc.getOutParams(), threads, false));
	}

	/**
	 * A clause is always kept for the first thread; the second thread gets
	 * its own copy unless the clause is uniform or mentions state that exists
	 * once for both threads.
	 */
	private List<ThreadTag> getClauseThreads(Expr condition)
	{
		if( threads.size() == 1 || AsymmetricExpressionFinder.isAsymmetric(condition)
				|| oracle.isUniform(proc_name, condition) ) {
			return threads.subList(0, 1);
		}
		return threads;
	}

	private void dualiseImplementation(Implementation impl)
	{
		proc_name = impl.getName();
		Procedure proc = program.getProcedure(proc_name);
		threads = getThreads((proc != null) ? proc.getAttributes() : impl.getAttributes());

		impl.setInParams(dualiseParameters(proc_name, impl.getInParams(), threads, true));
		impl.setOutParams(dualiseParameters(proc_name, impl.getOutParams(), threads, false));

		List<LocalVariable> locals = new ArrayList<LocalVariable>();
		List<LocalVariable> non_uniform = new ArrayList<LocalVariable>();
		for( LocalVariable v : impl.getLocals() ) {
			if( oracle.isUniform(proc_name, v.getName()) ) {
				locals.add(v);
			} else {
				non_uniform.add(v);
			}
		}
		for( ThreadTag t : threads ) {
			for( LocalVariable v : non_uniform ) {
				locals.add(v.copy(KernelIdentifiers.makeThreadName(v.getName(), t.getId()), v.getType()));
			}
		}
		impl.setLocals(locals);

		for( Block b : impl.getBlocks() ) {
			List<Cmd> cmds = new ArrayList<Cmd>();
			// barrier invariants stated in this block and not yet followed by a barrier
			List<BarrierInvariantDescriptor> pending = new ArrayList<BarrierInvariantDescriptor>();
			for( Cmd c : b.getCmds() ) {
				makeDual(cmds, c, pending);
			}
			b.setCmds(cmds);
			if( !pending.isEmpty() ) {
				PrintTools.printlnWarning(pending.size() + " barrier invariant(s) in block " + b.getLabel() + " of "
						+ proc_name + " are not followed by a barrier and are ignored");
			}
		}
	}

	private List<Declaration> dualiseTopLevelVariable(Variable v)
	{
		List<Declaration> ret = new ArrayList<Declaration>();
		Attributes attrs = v.getAttributes();
		String name = v.getName();
		boolean per_thread_constant = KernelIdentifiers.isThreadLocalIdConstant(v)
				|| (KernelIdentifiers.isGroupIdConstant(v) && !options.only_intra_group);
		if( v instanceof Constant && !per_thread_constant ) {
			ret.add(v);
			return ret;
		}
		if( name.contains("_NOT_ACCESSED_") || name.contains("_ARRAY_OFFSET") || attrs.findBool("atomic_usedmap")
				|| attrs.findBool("global") ) {
			ret.add(v);
			return ret;
		}
		if( attrs.findBool("group_shared") ) {
			if( options.only_intra_group ) {
				ret.add(v);
			} else {
				// One copy of the array per group the two threads may belong to.
				Variable per_group = v.copy(name, new MapType(Type.getBvType(1), v.getType()));
				ret.add(per_group);
			}
			return ret;
		}
		ret.add(v.copy(KernelIdentifiers.makeThreadName(name, 1), v.getType()));
		if( !attrs.findBool(RaceInstrumentationUtil.RACE_CHECKING) ) {
			ret.add(v.copy(KernelIdentifiers.makeThreadName(name, 2), v.getType()));
		}
		return ret;
	}

	private List<Declaration> dualiseAxiom(Axiom axiom)
	{
		List<Declaration> ret = new ArrayList<Declaration>();
		Expr e1 = new ThreadRewriter(ThreadTag.ONE, null, null, program, options.only_intra_group)
				.transform(axiom.getExpr());
		Expr e2 = new ThreadRewriter(ThreadTag.TWO, null, null, program, options.only_intra_group)
				.transform(axiom.getExpr());
		Axiom a1 = new Axiom(e1, axiom.getAttributes().clone());
		a1.setPosition(axiom.getPosition());
		ret.add(a1);
		if( !e1.toString().equals(e2.toString()) ) {
			Axiom a2 = new Axiom(e2, axiom.getAttributes().clone());
			a2.setPosition(axiom.getPosition());
			ret.add(a2);
		}
		return ret;
	}

	private void makeDual(List<Cmd> cmds, Cmd c, List<BarrierInvariantDescriptor> pending)
	{
		int first = cmds.size();
		if( c instanceof CallCmd ) {
			makeDualCall(cmds, (CallCmd)c, pending);
		} else if( c instanceof AssignCmd ) {
			makeDualAssign(cmds, (AssignCmd)c);
		} else if( c instanceof HavocCmd ) {
			makeDualHavoc(cmds, (HavocCmd)c);
		} else if( c instanceof AssertCmd ) {
			makeDualAssert(cmds, (AssertCmd)c);
		} else if( c instanceof AssumeCmd ) {
			makeDualAssume(cmds, (AssumeCmd)c);
		} else {
			throw new IllegalStateException("[ERROR in KernelDualiser] unexpected command " + c);
		}
		for( int i = first; i < cmds.size(); i++ ) {
			if( cmds.get(i).getPosition() == Position.NONE ) {
				cmds.get(i).setPosition(c.getPosition());
			}
		}
	}

	private void makeDualAssign(List<Cmd> cmds, AssignCmd assign)
	{
		Map<ThreadTag, List<AssignLhs>> lhss = new LinkedHashMap<ThreadTag, List<AssignLhs>>();
		Map<ThreadTag, List<Expr>> rhss = new LinkedHashMap<ThreadTag, List<Expr>>();
		for( ThreadTag t : threads ) {
			lhss.put(t, new ArrayList<AssignLhs>());
			rhss.put(t, new ArrayList<Expr>());
		}
		ThreadTag first = threads.get(0);
		for( int i = 0; i < assign.getLhss().size(); i++ ) {
			AssignLhs lhs = assign.getLhss().get(i);
			Expr rhs = assign.getRhss().get(i);
			if( lhs instanceof SimpleAssignLhs
					&& oracle.isUniform(proc_name, lhs.getAssignedVariable().getName()) ) {
				lhss.get(first).add(lhs.clone());
				rhss.get(first).add(rhs.clone());
				continue;
			}
			for( ThreadTag t : threads ) {
				ThreadRewriter r = rewriter(t);
				lhss.get(t).add(r.transformLhs(lhs));
				rhss.get(t).add(r.transform(rhs));
			}
		}
		for( ThreadTag t : threads ) {
			if( !lhss.get(t).isEmpty() ) {
				cmds.add(new AssignCmd(lhss.get(t), rhss.get(t), assign.getAttributes().clone()));
			}
		}
	}

	private void makeDualHavoc(List<Cmd> cmds, HavocCmd havoc)
	{
		Map<String, IdentifierExpr> vars = new LinkedHashMap<String, IdentifierExpr>();
		for( IdentifierExpr v : havoc.getVars() ) {
			for( ThreadTag t : threads ) {
				IdentifierExpr dual = (IdentifierExpr)rewriter(t).transform(v);
				if( !vars.containsKey(dual.getName()) ) {
					vars.put(dual.getName(), dual);
				}
			}
		}
		cmds.add(new HavocCmd(new ArrayList<IdentifierExpr>(vars.values()), havoc.getAttributes().clone()));
	}

	private void makeDualAssert(List<Cmd> cmds, AssertCmd a)
	{
		Attributes attrs = a.getAttributes();
		Expr e = a.getExpr();
		if( attrs.findBool("sourceloc") || attrs.findBool("block_sourceloc") || attrs.findBool("array_bounds") ) {
			// location marker, kept once
			cmds.add(new AssertCmd(rewriter(threads.get(0)).transform(e), attrs.clone()));
			return;
		}
		boolean single = options.asymmetric_asserts || AsymmetricExpressionFinder.isAsymmetric(e)
				|| oracle.isUniform(proc_name, e);
		for( ThreadTag t : single ? threads.subList(0, 1) : threads ) {
			cmds.add(new AssertCmd(rewriter(t).transform(e), ThreadRewriter.makeThreadSpecificAttributes(attrs, t)));
		}
	}

	private void makeDualAssume(List<Cmd> cmds, AssumeCmd a)
	{
		Attributes attrs = a.getAttributes();
		Expr e = a.getExpr();
		if( attrs.findString("captureState") != null ) {
			cmds.add(a.clone());
		} else if( attrs.findBool("backedge") ) {
			Expr taken = LiteralExpr.FALSE;
			for( ThreadTag t : threads ) {
				taken = Expr.or(taken, rewriter(t).transform(e));
			}
			cmds.add(new AssumeCmd(taken, attrs.clone()));
		} else if( attrs.findBool("atomic_refinement") ) {
			makeAtomicRefinement(cmds, a);
		} else {
			boolean single = AsymmetricExpressionFinder.isAsymmetric(e) || oracle.isUniform(proc_name, e);
			Expr assumed = LiteralExpr.TRUE;
			for( ThreadTag t : single ? threads.subList(0, 1) : threads ) {
				assumed = Expr.and(assumed, rewriter(t).transform(e));
			}
			cmds.add(new AssumeCmd(assumed, attrs.clone()));
		}
	}

	/**
	 * Expands the choice of an atomic's return value into
	 * <pre>
	 * havoc v$1, v$2;
	 * assume !_USED_A[offset$1][v$1];
	 * _USED_A[offset$1][v$1] := true;
	 * assume !_USED_A[offset$2][v$2];
	 * _USED_A[offset$2][v$2] := true;
	 * </pre>
	 * so that the two threads never observe the same value at the same offset.
	 */
	private void makeAtomicRefinement(List<Cmd> cmds, AssumeCmd a)
	{
		Attributes attrs = a.getAttributes();
		Expr variable = attrs.findExpr("variable");
		Expr offset = attrs.findExpr("offset");
		String array = attrs.findString("arrayref");
		if( !(variable instanceof IdentifierExpr) || offset == null || array == null ) {
			throw new IllegalStateException("[ERROR in KernelDualiser] atomic refinement needs variable, offset"
					+ " and arrayref attributes: " + a);
		}
		Variable used = findOrCreateUsedMap(array, offset.getType(), variable.getType());
		Map<String, IdentifierExpr> havocked = new LinkedHashMap<String, IdentifierExpr>();
		for( ThreadTag t : threads ) {
			IdentifierExpr dual = (IdentifierExpr)rewriter(t).transform(variable);
			if( !havocked.containsKey(dual.getName()) ) {
				havocked.put(dual.getName(), dual);
			}
		}
		cmds.add(new HavocCmd(new ArrayList<IdentifierExpr>(havocked.values())));
		for( ThreadTag t : threads ) {
			ThreadRewriter r = rewriter(t);
			Expr off = r.transform(offset);
			Expr v = r.transform(variable);
			Expr slot = new MapSelectExpr(new MapSelectExpr(new IdentifierExpr(used), off), v);
			cmds.add(new AssumeCmd(Expr.not(slot)));
			AssignLhs lhs = new MapAssignLhs(new MapAssignLhs(new SimpleAssignLhs(new IdentifierExpr(used)),
					Collections.singletonList(off.clone())), Collections.singletonList(v.clone()));
			cmds.add(new AssignCmd(Collections.singletonList(lhs), Collections.<Expr>singletonList(LiteralExpr.TRUE)));
		}
	}

	private Variable findOrCreateUsedMap(String array, Type offset_type, Type value_type)
	{
		String name = "_USED_" + array;
		Variable ret = program.getTopLevelVariable(name);
		if( ret == null ) {
			if( offset_type == null || value_type == null ) {
				throw new IllegalStateException("[ERROR in KernelDualiser] cannot type the used map of " + array);
			}
			ret = new GlobalVariable(name, new MapType(offset_type, new MapType(value_type, BasicType.BOOL)),
					new Attributes().add("atomic_usedmap"));
			program.addDeclaration(ret);
		}
		return ret;
	}

	/**
	 * Rewrites a call. A barrier invariant call only joins pending; a
	 * barrier call is preceded by the assertions of the pending invariants
	 * and followed by their instantiations, after which pending is emptied.
	 */
	private void makeDualCall(List<Cmd> cmds, CallCmd call, List<BarrierInvariantDescriptor> pending)
	{
		String callee_name = call.getCallee();
		Procedure callee = program.getProcedure(callee_name);
		if( callee == null ) {
			callee = addAccessProcedure(callee_name);
		}
		Attributes callee_attrs = callee.getAttributes();

		if( callee_attrs.findBool("barrier_invariant") || callee_attrs.findBool("binary_barrier_invariant") ) {
			pending.add(makeDescriptor(call, callee));
			return;
		}

		boolean barrier = callee_attrs.findBool("barrier");
		if( barrier ) {
			for( BarrierInvariantDescriptor d : pending ) {
				cmds.add(d.getAssertCmd());
				if( options.barrier_access_checks && options.race_checking != RaceCheckingMethod.NONE ) {
					cmds.addAll(d.getAccessCheckCmds());
				}
			}
		}

		int callee_thread = callee_attrs.findInt("thread", 0);
		List<Expr> ins = new ArrayList<Expr>();
		List<Expr> non_uniform_ins = new ArrayList<Expr>();
		for( ThreadTag t : ThreadTag.values() ) {
			if( callee_thread != 0 && callee_thread != t.getId() ) {
				continue;
			}
			ThreadRewriter r = rewriter(t);
			for( int i = 0; i < call.getIns().size(); i++ ) {
				if( !isUniformParameter(callee_name, i, true) ) {
					non_uniform_ins.add(r.transform(call.getIns().get(i)));
				}
			}
		}
		for( int i = 0; i < call.getIns().size(); i++ ) {
			if( isUniformParameter(callee_name, i, true) ) {
				ins.add(call.getIns().get(i).clone());
			}
		}
		ins.addAll(non_uniform_ins);

		List<IdentifierExpr> outs = new ArrayList<IdentifierExpr>();
		List<IdentifierExpr> non_uniform_outs = new ArrayList<IdentifierExpr>();
		for( int i = 0; i < call.getOuts().size(); i++ ) {
			if( isUniformParameter(callee_name, i, false) ) {
				outs.add(call.getOuts().get(i).clone());
			}
		}
		for( ThreadTag t : ThreadTag.values() ) {
			if( callee_thread != 0 && callee_thread != t.getId() ) {
				continue;
			}
			ThreadRewriter r = rewriter(t);
			for( int i = 0; i < call.getOuts().size(); i++ ) {
				if( !isUniformParameter(callee_name, i, false) ) {
					non_uniform_outs.add((IdentifierExpr)r.transform(call.getOuts().get(i)));
				}
			}
		}
		outs.addAll(non_uniform_outs);

		Attributes attrs = call.getAttributes().clone();
		if( callee_name.startsWith("_LOG_ATOMIC") ) {
			attrs = rewriter(ThreadTag.ONE).rewriteArgAttributes(attrs);
		} else if( callee_name.startsWith("_CHECK_ATOMIC") ) {
			attrs = rewriter(ThreadTag.TWO).rewriteArgAttributes(attrs);
		}
		CallCmd dual = new CallCmd(callee_name, ins, outs, attrs);
		dual.setProc(callee);
		dual.setPosition(call.getPosition());
		cmds.add(dual);

		if( barrier ) {
			for( BarrierInvariantDescriptor d : pending ) {
				cmds.addAll(d.getInstantiationCmds());
			}
			pending.clear();
		}
	}

	/** Creates the log or check procedure a call refers to. */
	private Procedure addAccessProcedure(String name)
	{
		RaceInstrumentationUtil.AccessProcedure access = RaceInstrumentationUtil.parseAccessProcedureName(name);
		if( access != null ) {
			Variable array = program.getTopLevelVariable(access.array);
			if( array == null ) {
				throw new IllegalStateException("[ERROR in KernelDualiser] " + name + " refers to unknown array "
						+ access.array);
			}
			if( access.is_log ) {
				instrumenter.addLogAccessProcedure(array, access.access);
			} else {
				instrumenter.addCheckAccessProcedure(array, access.access);
			}
		}
		Procedure ret = program.getProcedure(name);
		if( ret == null ) {
			throw new IllegalStateException("[ERROR in KernelDualiser] call to undeclared procedure " + name);
		}
		return ret;
	}

	/**
	 * The arguments of a barrier invariant call are the predicate, when the
	 * procedure has one, the invariant as a bv1, and the instantiations:
	 * single expressions for a unary invariant, pairs for a binary one.
	 */
	private BarrierInvariantDescriptor makeDescriptor(CallCmd call, Procedure callee)
	{
		List<Formal> params = callee.getInParams();
		boolean predicated = !params.isEmpty() && params.get(0).getType().isBool();
		List<Expr> ins = call.getIns();
		int first = predicated ? 1 : 0;
		boolean binary = callee.getAttributes().findBool("binary_barrier_invariant");
		int instantiations = ins.size() - first - 1;
		if( instantiations < 1 || (binary && instantiations % 2 != 0) ) {
			throw new IllegalStateException("[ERROR in KernelDualiser] malformed barrier invariant call " + call);
		}
		Expr predicate = predicated ? ins.get(0) : LiteralExpr.TRUE;
		Expr invariant = Expr.neq(ins.get(first), LiteralExpr.bv(0, 1));
		Attributes attrs = call.getAttributes().clone();
		if( binary ) {
			BinaryBarrierInvariantDescriptor ret = new BinaryBarrierInvariantDescriptor(predicate, invariant, attrs,
					proc_name, oracle, program, options);
			for( int i = first + 1; i + 1 < ins.size(); i += 2 ) {
				ret.addInstantiationExprPair(ins.get(i), ins.get(i + 1));
			}
			return ret;
		}
		UnaryBarrierInvariantDescriptor ret = new UnaryBarrierInvariantDescriptor(predicate, invariant, attrs,
				proc_name, oracle, program, options);
		for( int i = first + 1; i < ins.size(); i++ ) {
			ret.addInstantiationExpr(ins.get(i));
		}
		return ret;
	}
}
