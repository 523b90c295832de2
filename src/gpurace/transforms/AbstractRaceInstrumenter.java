package gpurace.transforms;

import gpurace.exec.GPURaceOptions;
import gpurace.hir.AccessType;
import gpurace.hir.KernelIdentifiers;
import ivl.analysis.BlockGraph;
import ivl.hir.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared part of the race instrumentation strategies: shadow-state
 * declarations, check procedures, kernel preconditions, barrier
 * implementations and capture states. Subclasses decide how log procedures
 * record an access.
 *
 * <p>
 * For an array <b>A</b> and access <b>ACC</b> the shadow state is
 * <ul>
 * <li><b>_ACC_HAS_OCCURRED_A</b>: thread 1 made such an access;</li>
 * <li><b>_ACC_OFFSET_A</b>: the element it accessed;</li>
 * <li><b>_ACC_VALUE_A</b>: the value read or written, unless benign races are reported;</li>
 * <li><b>_WRITE_READ_BENIGN_FLAG_A</b>: the write changed the element;</li>
 * <li><b>_ACC_ASYNC_HANDLE_A</b>: the handle of an asynchronous group copy.</li>
 * </ul>
 */
public abstract class AbstractRaceInstrumenter implements RaceInstrumenter
{
	protected static final String pass_name = "[RaceInstrumenter]";

	private static final String[] COPIED_ATTRIBUTES = {
		"elem_width", "source_elem_width", "source_dimensions", "source_name"
	};

	protected final Program program;
	protected final GPURaceOptions options;

	private Map<AccessType, Set<String>> async_arrays;

	protected AbstractRaceInstrumenter(Program program, GPURaceOptions options)
	{
		this.program = program;
		this.options = options;
	}

	/** Global and group-shared arrays that are not in constant memory. */
	public List<GlobalVariable> getRaceCheckedArrays()
	{
		List<GlobalVariable> ret = new ArrayList<GlobalVariable>();
		for( GlobalVariable v : program.getDeclarations(GlobalVariable.class) ) {
			Attributes attrs = v.getAttributes();
			if( (attrs.findBool("global") || attrs.findBool("group_shared")) && !attrs.findBool("constant")
					&& v.getType() instanceof MapType ) {
				ret.add(v);
			}
		}
		return ret;
	}

	protected static boolean isGroupShared(Variable array)
	{
		return array.getAttributes().findBool("group_shared");
	}

	/**
	 * Returns true if the array is the source (READ) or destination (WRITE)
	 * of an asynchronous group copy somewhere in the program.
	 */
	protected boolean isAccessedAsynchronously(Variable array, AccessType access)
	{
		if( async_arrays == null ) {
			async_arrays = new EnumMap<AccessType, Set<String>>(AccessType.class);
			async_arrays.put(AccessType.READ, new HashSet<String>());
			async_arrays.put(AccessType.WRITE, new HashSet<String>());
			for( Implementation impl : program.getImplementations() ) {
				for( CallCmd call : IRTools.getCallCmds(impl.getBlocks()) ) {
					Procedure callee = program.getProcedure(call.getCallee());
					if( callee == null || !callee.getAttributes().findBool("async_work_group_copy") ) {
						continue;
					}
					String dst = call.getAttributes().findString("dst");
					String src = call.getAttributes().findString("src");
					if( dst != null ) {
						async_arrays.get(AccessType.WRITE).add(dst);
					}
					if( src != null ) {
						async_arrays.get(AccessType.READ).add(src);
					}
				}
			}
		}
		Set<String> names = async_arrays.get(access);
		return names != null && names.contains(array.getName());
	}

	protected Type getSizeTType()
	{
		return Type.getBvType(KernelIdentifiers.getSizeTBits(program));
	}

	protected static MapType getArrayType(Variable array)
	{
		if( !(array.getType() instanceof MapType) ) {
			throw new IllegalStateException("[ERROR in RaceInstrumenter] " + array.getName() + " is not an array");
		}
		MapType mt = (MapType)array.getType();
		if( mt.getArguments().size() != 1 || mt.getResult() instanceof MapType ) {
			throw new IllegalStateException("[ERROR in RaceInstrumenter] " + array.getName()
					+ " must be a one-dimensional map, found " + mt);
		}
		return mt;
	}

	protected Attributes makeShadowAttributes(Variable array)
	{
		Attributes ret = new Attributes().add(RaceInstrumentationUtil.RACE_CHECKING);
		for( String key : COPIED_ATTRIBUTES ) {
			List<Object> params = array.getAttributes().getParams(key);
			if( params != null ) {
				ret.add(key, params.toArray());
			}
		}
		return ret;
	}

	@Override
	public void addRaceCheckingDeclarations()
	{
		Type size_t = getSizeTType();
		for( GlobalVariable array : getRaceCheckedArrays() ) {
			String name = array.getName();
			Type elem = getArrayType(array).getResult();
			for( AccessType access : AccessType.values() ) {
				program.addDeclaration(new GlobalVariable(
						RaceInstrumentationUtil.makeHasOccurredVariableName(name, access), BasicType.BOOL,
						makeShadowAttributes(array)));
				program.addDeclaration(makeOffsetVariable(
						RaceInstrumentationUtil.makeOffsetVariableName(name, access), size_t,
						makeShadowAttributes(array)));
				if( !options.no_benign && access.isReadOrWrite() ) {
					program.addDeclaration(makeValueVariable(
							RaceInstrumentationUtil.makeValueVariableName(name, access), elem,
							makeShadowAttributes(array)));
				}
				if( !options.no_benign && access == AccessType.WRITE ) {
					program.addDeclaration(new GlobalVariable(
							RaceInstrumentationUtil.makeBenignFlagVariableName(name), BasicType.BOOL,
							makeShadowAttributes(array)));
				}
				if( access.isReadOrWrite() && isAccessedAsynchronously(array, access) ) {
					program.addDeclaration(new GlobalVariable(
							RaceInstrumentationUtil.makeAsyncHandleVariableName(name, access), size_t,
							makeShadowAttributes(array)));
				}
			}
		}
		PrintTools.println(pass_name + " declared shadow state for " + getRaceCheckedArrays().size() + " arrays", 2);
	}

	/** Declares the offset shadow variable; strategies may make it a constant. */
	protected Variable makeOffsetVariable(String name, Type type, Attributes attrs)
	{
		return new GlobalVariable(name, type, attrs);
	}

	/** Declares the value shadow variable; strategies may make it a constant. */
	protected Variable makeValueVariable(String name, Type type, Attributes attrs)
	{
		return new GlobalVariable(name, type, attrs);
	}

	/** Returns a shadow variable, which must have been declared. */
	protected Variable getShadow(String name)
	{
		Variable v = program.getTopLevelVariable(name);
		if( v == null ) {
			throw new IllegalStateException("[ERROR in RaceInstrumenter] missing shadow variable " + name);
		}
		return v;
	}

	protected Variable findShadow(String name)
	{
		return program.getTopLevelVariable(name);
	}

	/** Builds <b>v := if condition then value else v</b>. */
	protected static AssignCmd makeConditionalAssignment(Variable v, Expr condition, Expr value)
	{
		return new AssignCmd(new IdentifierExpr(v), Expr.ite(condition, value, new IdentifierExpr(v)));
	}

	/** Parameters of the log procedure, in call order. */
	protected List<Formal> makeLogParameters(Variable array, AccessType access)
	{
		MapType mt = getArrayType(array);
		List<Formal> ret = new ArrayList<Formal>();
		ret.add(new Formal("_P", BasicType.BOOL, true));
		ret.add(new Formal("_offset", mt.getArguments().get(0), true));
		if( access.isReadOrWrite() ) {
			ret.add(new Formal("_value", mt.getResult(), true));
		}
		if( access == AccessType.WRITE ) {
			ret.add(new Formal("_value_old", mt.getResult(), true));
		}
		if( access.isReadOrWrite() && isAccessedAsynchronously(array, access) ) {
			ret.add(new Formal("_async_handle", getSizeTType(), true));
		}
		return ret;
	}

	/** Parameters of the check procedure, in call order. */
	protected List<Formal> makeCheckParameters(Variable array, AccessType access)
	{
		MapType mt = getArrayType(array);
		List<Formal> ret = new ArrayList<Formal>();
		ret.add(new Formal("_P", BasicType.BOOL, true));
		ret.add(new Formal("_offset", mt.getArguments().get(0), true));
		if( access.isReadOrWrite() ) {
			ret.add(new Formal("_value", mt.getResult(), true));
		}
		return ret;
	}

	protected static Formal findParameter(List<Formal> params, String name)
	{
		for( Formal f : params ) {
			if( f.getName().equals(name) ) {
				return f;
			}
		}
		return null;
	}

	/**
	 * Builds the inlined log procedure from the commands of its single
	 * block. The procedure runs on thread 1 only.
	 */
	protected void addLogProcedure(Variable array, AccessType access, List<Formal> params,
			List<LocalVariable> locals, List<Cmd> cmds)
	{
		String name = RaceInstrumentationUtil.makeLogProcedureName(array.getName(), access);
		Set<String> modified = new LinkedHashSet<String>();
		List<IdentifierExpr> modifies = new ArrayList<IdentifierExpr>();
		for( Cmd c : cmds ) {
			if( c instanceof AssignCmd ) {
				for( AssignLhs lhs : ((AssignCmd)c).getLhss() ) {
					IdentifierExpr id = lhs.getAssignedVariable();
					if( id.getDecl() instanceof GlobalVariable && modified.add(id.getName()) ) {
						modifies.add(new IdentifierExpr(id.getDecl()));
					}
				}
			}
		}
		Procedure proc = new Procedure(name, params, Collections.<Formal>emptyList(),
				Collections.<Requires>emptyList(), Collections.<Ensures>emptyList(), modifies,
				new Attributes().add("inline", LiteralExpr.integer(1)).add("thread", LiteralExpr.integer(1)));
		Block block = new Block("_LOG_" + access, cmds, new ReturnCmd());
		Implementation impl = new Implementation(name, params, Collections.<Formal>emptyList(), locals,
				Collections.singletonList(block), new Attributes().add("inline", LiteralExpr.integer(1)));
		impl.setProc(proc);
		program.addDeclaration(proc);
		program.addDeclaration(impl);
		PrintTools.println(pass_name + " added " + name, 2);
	}

	@Override
	public void addCheckAccessProcedure(Variable array, AccessType access)
	{
		List<Formal> params = makeCheckParameters(array, access);
		Procedure proc = new Procedure(RaceInstrumentationUtil.makeCheckProcedureName(array.getName(), access),
				params, Collections.<Formal>emptyList(), new Attributes().add("thread", LiteralExpr.integer(2)));
		switch( access ) {
		case READ:
			addCheck(proc, array, params, AccessType.WRITE, "write_read");
			addCheck(proc, array, params, AccessType.ATOMIC, "atomic_read");
			break;
		case WRITE:
			addCheck(proc, array, params, AccessType.WRITE, "write_write");
			addCheck(proc, array, params, AccessType.READ, "read_write");
			addCheck(proc, array, params, AccessType.ATOMIC, "atomic_write");
			break;
		case ATOMIC:
			addCheck(proc, array, params, AccessType.WRITE, "write_atomic");
			addCheck(proc, array, params, AccessType.READ, "read_atomic");
			break;
		default:
			throw new IllegalStateException("[ERROR in RaceInstrumenter] unexpected access " + access);
		}
		program.addDeclaration(proc);
		PrintTools.println(pass_name + " added " + proc.getName(), 2);
	}

	/**
	 * Adds <b>requires !(_P &amp;&amp; HO &amp;&amp; OFF == _offset &amp;&amp; ...)</b>
	 * stating that the access does not conflict with an earlier access of
	 * kind prev by the other thread.
	 */
	private void addCheck(Procedure proc, Variable array, List<Formal> params, AccessType prev, String kind)
	{
		String name = array.getName();
		Formal p = findParameter(params, "_P");
		Formal offset = findParameter(params, "_offset");
		Formal value = findParameter(params, "_value");
		Expr guard = Expr.and(new IdentifierExpr(p),
				new IdentifierExpr(getShadow(RaceInstrumentationUtil.makeHasOccurredVariableName(name, prev))));
		guard = Expr.and(guard, Expr.eq(
				new IdentifierExpr(getShadow(RaceInstrumentationUtil.makeOffsetVariableName(name, prev))),
				new IdentifierExpr(offset)));
		if( !options.no_benign ) {
			if( kind.equals("write_read") ) {
				guard = Expr.and(guard,
						new IdentifierExpr(getShadow(RaceInstrumentationUtil.makeBenignFlagVariableName(name))));
			} else if( kind.equals("write_write") && value != null ) {
				guard = Expr.and(guard, Expr.neq(
						new IdentifierExpr(getShadow(RaceInstrumentationUtil.makeValueVariableName(name, AccessType.WRITE))),
						new IdentifierExpr(value)));
			}
		}
		if( isGroupShared(array) ) {
			guard = Expr.and(guard, KernelIdentifiers.threadsInSameGroup(program, options.only_intra_group));
		}
		Attributes attrs = new Attributes().add("race").add(kind).add("array", name);
		String source_name = array.getAttributes().findString("source_name");
		if( source_name != null ) {
			attrs.add("source_name", source_name);
		}
		proc.getRequires().add(new Requires(false, Expr.not(guard), attrs));
	}

	@Override
	public void addKernelPrecondition()
	{
		for( Procedure proc : program.getProcedures() ) {
			if( !proc.getAttributes().findBool("kernel") ) {
				continue;
			}
			for( GlobalVariable array : getRaceCheckedArrays() ) {
				for( AccessType access : AccessType.values() ) {
					Variable ho = findShadow(RaceInstrumentationUtil.makeHasOccurredVariableName(array.getName(), access));
					if( ho != null ) {
						proc.getRequires().add(new Requires(false, Expr.not(new IdentifierExpr(ho)), null));
					}
				}
			}
		}
	}

	@Override
	public void addBarrierImplementation()
	{
		for( Procedure proc : program.getProcedures() ) {
			if( !proc.getAttributes().findBool("barrier") || program.getImplementation(proc.getName()) != null ) {
				continue;
			}
			List<Formal> ins = proc.getInParams();
			boolean predicated = !ins.isEmpty() && ins.get(0).getType().isBool();
			int first_fence = predicated ? 1 : 0;
			if( ins.size() != first_fence + 2 ) {
				throw new IllegalStateException("[ERROR in RaceInstrumenter] barrier " + proc.getName()
						+ " must take a local and a global fence argument");
			}
			List<Formal> impl_ins = new ArrayList<Formal>();
			for( Formal f : ins ) {
				impl_ins.add(f.copy(f.getName(), f.getType()));
			}
			Expr predicate = predicated ? new IdentifierExpr(impl_ins.get(0)) : LiteralExpr.TRUE;
			Expr local_fence = Expr.eq(new IdentifierExpr(impl_ins.get(first_fence)), LiteralExpr.bv(1, 1));
			Expr global_fence = Expr.eq(new IdentifierExpr(impl_ins.get(first_fence + 1)), LiteralExpr.bv(1, 1));

			List<Cmd> cmds = new ArrayList<Cmd>();
			for( GlobalVariable array : getRaceCheckedArrays() ) {
				Expr reset = isGroupShared(array)
						? Expr.and(predicate, local_fence)
						: Expr.and(Expr.and(predicate, global_fence),
								KernelIdentifiers.threadsInSameGroup(program, options.only_intra_group));
				for( AccessType access : AccessType.values() ) {
					Variable ho = findShadow(RaceInstrumentationUtil.makeHasOccurredVariableName(array.getName(), access));
					if( ho == null ) {
						continue;
					}
					cmds.add(makeConditionalAssignment(ho, reset.clone(), LiteralExpr.FALSE));
					proc.getModifies().add(new IdentifierExpr(ho));
				}
			}
			if( predicated ) {
				Expr p = new IdentifierExpr(ins.get(0));
				proc.getRequires().add(new Requires(false, Expr.eq(p, KernelIdentifiers.makeOther(program, p.clone())),
						new Attributes().add("barrier_divergence")));
			}
			Implementation impl = new Implementation(proc.getName(), impl_ins, Collections.<Formal>emptyList(),
					Collections.<LocalVariable>emptyList(),
					Collections.singletonList(new Block("_BARRIER", cmds, new ReturnCmd())),
					new Attributes().add("inline", LiteralExpr.integer(1)));
			impl.setProc(proc);
			program.addDeclaration(impl);
			PrintTools.println(pass_name + " added an implementation of barrier " + proc.getName(), 2);
		}
	}

	@Override
	public void addCaptureStates()
	{
		int loop_heads = 0;
		int call_returns = 0;
		for( Implementation impl : program.getImplementations() ) {
			List<Block> headers = new BlockGraph(impl).getLoopHeaders();
			for( Block b : impl.getBlocks() ) {
				List<Cmd> cmds = new ArrayList<Cmd>();
				if( headers.contains(b) ) {
					cmds.add(new AssumeCmd(LiteralExpr.TRUE,
							new Attributes().add("captureState", "loop_head_state_" + loop_heads++)));
				}
				for( Cmd c : b.getCmds() ) {
					cmds.add(c);
					if( c instanceof CallCmd && isUserProcedure(((CallCmd)c).getCallee()) ) {
						String callee = ((CallCmd)c).getCallee();
						AssumeCmd capture = new AssumeCmd(LiteralExpr.TRUE, new Attributes()
								.add("captureState", "call_return_state_" + call_returns++)
								.add("procedureName", callee));
						capture.setPosition(c.getPosition());
						cmds.add(capture);
					}
				}
				b.setCmds(cmds);
			}
		}
		PrintTools.println(pass_name + " added " + loop_heads + " loop head and " + call_returns
				+ " call return capture states", 2);
	}

	private boolean isUserProcedure(String name)
	{
		Procedure proc = program.getProcedure(name);
		return proc != null && program.getImplementation(name) != null
				&& !proc.getAttributes().findBool("barrier");
	}
}
