package gpurace.analysis;

import gpurace.hir.KernelIdentifiers;
import ivl.analysis.BlockGraph;
import ivl.hir.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inter-procedural uniformity analysis.
 *
 * <p>
 * Every implemented procedure starts uniform, and so do all of its formals
 * and locals. The following rules are applied until nothing changes:
 * <ul>
 * <li>a variable assigned a non-uniform expression, havoc'd, or bound to a
 *     non-uniform output of a call becomes non-uniform;</li>
 * <li>a variable assigned in a block that is control dependent on a
 *     non-uniform branch becomes non-uniform, and so does every variable
 *     assigned by a non-uniform procedure;</li>
 * <li>a formal becomes non-uniform when some call site passes a non-uniform
 *     argument for it;</li>
 * <li>a procedure becomes non-uniform when some call to it is under
 *     non-uniform control or inside a non-uniform procedure.</li>
 * </ul>
 * A branch is a block with two or more successors where some successor
 * starts with an assumption of a non-uniform condition. Local ids are
 * non-uniform, group ids are too unless only intra-group races are
 * checked. Mutable globals and map reads are never uniform.
 * <p>
 * Outputs of calls to procedures without implementation are non-uniform.
 */
public class UniformityAnalyser implements UniformityOracle
{
	private static final String pass_name = "[UniformityAnalyser]";

	private final Program program;
	private final boolean only_intra_group;
	private final boolean disabled;

	private final Map<String, Boolean> proc_uniformity = new LinkedHashMap<String, Boolean>();
	private final Map<String, Map<String, Boolean>> var_uniformity = new LinkedHashMap<String, Map<String, Boolean>>();
	private final Map<String, List<String>> in_params = new HashMap<String, List<String>>();
	private final Map<String, List<String>> out_params = new HashMap<String, List<String>>();

	private boolean changed;

	/**
	 * @param program the program to analyse; names must be resolved.
	 * @param only_intra_group true if group ids are shared by both threads.
	 * @param disabled true to answer "non-uniform" for every variable and expression.
	 */
	public UniformityAnalyser(Program program, boolean only_intra_group, boolean disabled)
	{
		this.program = program;
		this.only_intra_group = only_intra_group;
		this.disabled = disabled;
	}

	/** Computes the fixpoint. */
	public void analyse()
	{
		long timer = System.nanoTime();
		PrintTools.println(pass_name + " begin", 1);
		for( Implementation impl : program.getImplementations() ) {
			proc_uniformity.put(impl.getName(), true);
			Map<String, Boolean> vars = new LinkedHashMap<String, Boolean>();
			for( Formal f : impl.getInParams() ) {
				vars.put(f.getName(), true);
			}
			for( Formal f : impl.getOutParams() ) {
				vars.put(f.getName(), true);
			}
			for( LocalVariable v : impl.getLocals() ) {
				vars.put(v.getName(), true);
			}
			var_uniformity.put(impl.getName(), vars);
			in_params.put(impl.getName(), IRTools.getNames(impl.getInParams()));
			out_params.put(impl.getName(), IRTools.getNames(impl.getOutParams()));
		}
		if( !disabled ) {
			Map<Implementation, BlockGraph> graphs = new HashMap<Implementation, BlockGraph>();
			for( Implementation impl : program.getImplementations() ) {
				graphs.put(impl, new BlockGraph(impl));
			}
			int iterations = 0;
			do {
				changed = false;
				iterations++;
				for( Implementation impl : program.getImplementations() ) {
					analyseImplementation(impl, graphs.get(impl));
				}
			} while( changed );
			PrintTools.println(pass_name + " fixpoint reached after " + iterations + " iterations", 2);
		}
		PrintTools.println(pass_name + " end in "
				+ String.format("%.2f seconds", (System.nanoTime() - timer) / 1e9), 1);
	}

	private void analyseImplementation(Implementation impl, BlockGraph graph)
	{
		String proc = impl.getName();
		for( Block b : impl.getBlocks() ) {
			boolean controlled = !proc_uniformity.get(proc) || isUnderNonUniformControl(proc, graph, b);
			for( Cmd c : b.getCmds() ) {
				if( c instanceof AssignCmd ) {
					AssignCmd assign = (AssignCmd)c;
					for( int i = 0; i < assign.getLhss().size(); i++ ) {
						AssignLhs lhs = assign.getLhss().get(i);
						boolean uniform = !controlled && isUniform(proc, assign.getRhss().get(i));
						if( lhs instanceof MapAssignLhs ) {
							uniform = uniform && indexesUniform(proc, (MapAssignLhs)lhs);
						}
						if( !uniform ) {
							setNonUniform(proc, lhs.getAssignedVariable().getName());
						}
					}
				} else if( c instanceof HavocCmd ) {
					for( IdentifierExpr id : ((HavocCmd)c).getVars() ) {
						setNonUniform(proc, id.getName());
					}
				} else if( c instanceof CallCmd ) {
					analyseCall(proc, (CallCmd)c, controlled);
				} else if( c instanceof AssumeCmd && c.getAttributes().findBool("atomic_refinement") ) {
					// the witness of an atomic's return value is chosen per thread, like a havoc
					Expr witness = c.getAttributes().findExpr("variable");
					if( witness instanceof IdentifierExpr ) {
						setNonUniform(proc, ((IdentifierExpr)witness).getName());
					}
				}
			}
		}
	}

	private void analyseCall(String proc, CallCmd call, boolean controlled)
	{
		String callee = call.getCallee();
		boolean known = knowsOf(callee);
		if( known ) {
			if( controlled && proc_uniformity.get(callee) ) {
				proc_uniformity.put(callee, false);
				changed = true;
			}
			List<String> formals = in_params.get(callee);
			for( int i = 0; i < call.getIns().size() && i < formals.size(); i++ ) {
				if( !isUniform(proc, call.getIns().get(i)) ) {
					setNonUniform(callee, formals.get(i));
				}
			}
		}
		List<String> outs = known ? out_params.get(callee) : null;
		for( int i = 0; i < call.getOuts().size(); i++ ) {
			boolean uniform = known && !controlled && i < outs.size() && isUniform(callee, outs.get(i));
			if( !uniform ) {
				setNonUniform(proc, call.getOuts().get(i).getName());
			}
		}
	}

	private boolean indexesUniform(String proc, MapAssignLhs lhs)
	{
		for( Expr e : lhs.getIndexes() ) {
			if( !isUniform(proc, e) ) {
				return false;
			}
		}
		return !(lhs.getMap() instanceof MapAssignLhs) || indexesUniform(proc, (MapAssignLhs)lhs.getMap());
	}

	private boolean isUnderNonUniformControl(String proc, BlockGraph graph, Block b)
	{
		Set<Block> controlling = graph.getControllingBlocks(b);
		for( Block x : controlling ) {
			if( isNonUniformBranch(proc, graph, x) ) {
				return true;
			}
		}
		return false;
	}

	private boolean isNonUniformBranch(String proc, BlockGraph graph, Block x)
	{
		List<Block> succs = graph.getSuccessors(x);
		if( succs.size() < 2 ) {
			return false;
		}
		for( Block s : succs ) {
			if( !s.getCmds().isEmpty() && s.getCmds().get(0) instanceof AssumeCmd ) {
				if( !isUniform(proc, ((AssumeCmd)s.getCmds().get(0)).getExpr()) ) {
					return true;
				}
			}
		}
		return false;
	}

	private void setNonUniform(String proc, String var)
	{
		Map<String, Boolean> vars = var_uniformity.get(proc);
		if( vars != null && Boolean.TRUE.equals(vars.get(var)) ) {
			vars.put(var, false);
			changed = true;
		}
	}

	@Override
	public boolean knowsOf(String proc)
	{
		return proc_uniformity.containsKey(proc);
	}

	@Override
	public boolean isUniform(String proc)
	{
		Boolean ret = proc_uniformity.get(proc);
		return ret != null && ret;
	}

	@Override
	public boolean isUniform(String proc, String var)
	{
		if( disabled || !isUniform(proc) ) {
			return false;
		}
		Boolean ret = var_uniformity.get(proc).get(var);
		if( ret != null ) {
			return ret;
		}
		Variable v = program.getTopLevelVariable(var);
		return (v instanceof Constant) && isUniformConstant(v);
	}

	@Override
	public boolean isUniform(String proc, Expr e)
	{
		if( disabled || !isUniform(proc) ) {
			return false;
		}
		DepthFirstIterator<Traversable> iter = new DepthFirstIterator<Traversable>(e);
		while( iter.hasNext() ) {
			Traversable t = iter.next();
			if( t instanceof MapSelectExpr ) {
				return false;
			} else if( t instanceof FunctionCallExpr ) {
				if( KernelIdentifiers.isOtherFunction(((FunctionCallExpr)t).getName()) ) {
					return false;
				}
			} else if( t instanceof IdentifierExpr ) {
				IdentifierExpr id = (IdentifierExpr)t;
				Variable decl = id.getDecl();
				if( decl instanceof Constant ) {
					if( !isUniformConstant(decl) ) {
						return false;
					}
				} else if( decl instanceof GlobalVariable ) {
					return false;
				} else if( !isUniform(proc, id.getName()) ) {
					return false;
				}
			}
		}
		return true;
	}

	private boolean isUniformConstant(Variable v)
	{
		if( KernelIdentifiers.isThreadLocalIdConstant(v) ) {
			return false;
		}
		return !KernelIdentifiers.isGroupIdConstant(v) || only_intra_group;
	}

	@Override
	public String getInParameter(String proc, int i)
	{
		return in_params.get(proc).get(i);
	}

	@Override
	public String getOutParameter(String proc, int i)
	{
		return out_params.get(proc).get(i);
	}

	/** Prints the table, one procedure per paragraph. */
	public void dump()
	{
		StringBuilder sb = new StringBuilder();
		for( Map.Entry<String, Boolean> proc : proc_uniformity.entrySet() ) {
			sb.append("Procedure ").append(proc.getKey()).append(": ")
					.append(proc.getValue() ? "uniform" : "nonuniform").append(PrintTools.line_sep);
			List<String> uniform = new ArrayList<String>();
			List<String> nonuniform = new ArrayList<String>();
			for( Map.Entry<String, Boolean> v : var_uniformity.get(proc.getKey()).entrySet() ) {
				if( v.getValue() && !disabled ) {
					uniform.add(v.getKey());
				} else {
					nonuniform.add(v.getKey());
				}
			}
			sb.append("  uniform: ").append(PrintTools.listToString(uniform, ", ")).append(PrintTools.line_sep);
			sb.append("  nonuniform: ").append(PrintTools.listToString(nonuniform, ", ")).append(PrintTools.line_sep);
		}
		PrintTools.println(sb.toString(), 0);
	}
}
