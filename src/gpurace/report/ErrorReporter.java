package gpurace.report;

import gpurace.exec.GPURaceOptions;
import gpurace.hir.AccessType;
import gpurace.hir.KernelIdentifiers;
import gpurace.hir.SourceLocationInfo;
import gpurace.hir.SourceLocationTable;
import gpurace.transforms.RaceCheckingMethod;
import gpurace.transforms.RaceInstrumentationUtil;
import gpurace.transforms.StateIdFixer;
import ivl.analysis.BlockGraph;
import ivl.hir.*;
import ivl.model.*;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Explains counterexamples of the verified program in source terms: which
 * accesses race and by which threads, or which barrier, assertion or
 * contract fails. Messages follow the <b>file:line:col: error: ...</b>
 * layout of compiler diagnostics.
 * <p>
 * Two programs are involved. The final program is the one the
 * counterexamples refer to. The original program is the dualised program
 * before loop unrolling and state renaming; loop headers and callee bodies
 * are looked up there when the source of the first access of a race has to
 * be recovered.
 */
public class ErrorReporter
{
	private static final String pass_name = "[ErrorReporter]";

	private final Program final_program;
	private final Program original_program;
	private final SourceLocationTable locations;
	private final GPURaceOptions options;
	private final PrintStream out;
	private final int size_t_bits;

	private int reported = 0;

	public ErrorReporter(Program final_program, Program original_program, SourceLocationTable locations,
			GPURaceOptions options, PrintStream out)
	{
		this.final_program = final_program;
		this.original_program = (original_program == null) ? final_program : original_program;
		this.locations = locations;
		this.options = options;
		this.out = out;
		this.size_t_bits = KernelIdentifiers.getSizeTBits(final_program);
	}

	/** Number of counterexamples reported so far. */
	public int getReportedCount()
	{
		return reported;
	}

	public void report(Counterexample cex)
	{
		PrintTools.println(pass_name + " reporting a counterexample of " + cex.getImplementation().getName(), 2);
		if( cex instanceof CallCounterexample ) {
			CallCounterexample call_cex = (CallCounterexample)cex;
			Attributes requires_attrs = call_cex.getFailingRequires().getAttributes();
			if( requires_attrs.findBool("barrier_divergence") ) {
				reportBarrierDivergence(call_cex.getFailingCall());
			} else if( requires_attrs.findBool("race") ) {
				reportRace(call_cex);
			} else {
				reportRequiresFailure(call_cex.getFailingCall(), call_cex.getFailingRequires());
			}
		} else if( cex instanceof ReturnCounterexample ) {
			reportEnsuresFailure(((ReturnCounterexample)cex).getFailingEnsures());
		} else if( cex instanceof AssertCounterexample ) {
			AssertCounterexample assert_cex = (AssertCounterexample)cex;
			Attributes attrs = assert_cex.getFailingAssert().getAttributes();
			switch( assert_cex.getLoopInvariantFailure() ) {
			case ENTRY:
				reportThreadSpecificFailure(assert_cex, "loop invariant might not hold on entry");
				break;
			case MAINTENANCE:
				reportThreadSpecificFailure(assert_cex, "loop invariant might not be maintained by the loop");
				break;
			default:
				if( attrs.findBool("barrier_invariant") ) {
					reportThreadSpecificFailure(assert_cex, "this barrier invariant might not hold");
				} else if( attrs.findBool("barrier_invariant_access_check") ) {
					reportThreadSpecificFailure(assert_cex,
							"insufficient permission may be held for evaluation of this barrier invariant");
				} else if( attrs.findBool("constant_write") ) {
					reportThreadSpecificFailure(assert_cex, "possible attempt to modify constant memory");
				} else if( attrs.findBool("bad_pointer_access") ) {
					reportThreadSpecificFailure(assert_cex, "possible null pointer access");
				} else if( attrs.findBool("array_bounds") ) {
					reportArrayBounds(assert_cex);
				} else {
					reportThreadSpecificFailure(assert_cex, "this assertion might not hold");
				}
				break;
			}
		} else {
			throw new IllegalStateException("[ERROR in ErrorReporter] unknown counterexample kind "
					+ cex.getClass().getSimpleName());
		}
		displayParameterValues(cex);
		reported++;
	}

	private void errorWriteLine(String loc_info, String message)
	{
		out.println(loc_info + " error: " + message);
	}

	private void noteWriteLine(String loc_info, String message)
	{
		out.println(loc_info + " note: " + message);
	}

	private SourceLocationInfo getLocation(Attributes attrs, Position pos)
	{
		return locations.get(attrs, pos);
	}

	private String describeThread(Model model, int thread, boolean with_spaces)
	{
		return new ThreadDetails(model, options).describe(thread, with_spaces);
	}

	/* Races */

	private void reportRace(CallCounterexample cex)
	{
		Attributes requires_attrs = cex.getFailingRequires().getAttributes();
		RaceKind kind = RaceKind.classify(requires_attrs);
		if( kind == null ) {
			throw new IllegalStateException("[ERROR in ErrorReporter] race requires without a race kind: "
					+ requires_attrs);
		}
		String array = requires_attrs.findString("array");
		if( array == null ) {
			throw new IllegalStateException("[ERROR in ErrorReporter] race requires without an array: "
					+ requires_attrs);
		}
		String source_name = requires_attrs.findString("source_name");
		if( source_name == null ) {
			source_name = array;
		}
		String racey_state = getStateName(cex.getFailingCall().getAttributes(), cex);

		Collection<SourceLocationInfo> first_sources =
				getPossibleSourcesOfFirstAccess(cex, array, kind.getFirstAccess(), racey_state);
		CallCmd call = cex.getFailingCall();
		SourceLocationInfo second_source = getLocation(call.getAttributes(), call.getPosition());

		out.println();
		errorWriteLine(second_source.getTop().getFile() + ":", "possible " + kind.getDisplayName()
				+ " race on " + getRaceOffsetString(cex, array, kind.getFirstAccess(), racey_state, source_name)
				+ ":");
		out.println();

		out.println(kind.getSecondAccess().getDisplayName() + " by " + describeThread(cex.getModel(), 2, true)
				+ ", " + second_source.getTop() + ":");
		second_source.printStackTrace(out);

		out.print(kind.getFirstAccess().getDisplayName() + " by " + describeThread(cex.getModel(), 1, true) + ", ");
		if( first_sources.size() == 1 ) {
			SourceLocationInfo sli = first_sources.iterator().next();
			out.println(sli.getTop() + ":");
			sli.printStackTrace(out);
		} else if( first_sources.isEmpty() ) {
			out.println("from external source location");
			out.println();
		} else {
			out.println("possible sources are:");
			List<SourceLocationInfo> sorted = new ArrayList<SourceLocationInfo>(first_sources);
			Collections.sort(sorted);
			for( SourceLocationInfo sli : sorted ) {
				out.println(sli.getTop() + ":");
				sli.printStackTrace(out);
			}
			out.println();
		}
	}

	/**
	 * Returns the label of the state captured just before the failing check,
	 * found through the <b>check_id</b> it shares with the check; null if
	 * there is none.
	 */
	private static String getStateName(Attributes attrs, Counterexample cex)
	{
		String check_id = attrs.findString("check_id");
		List<Block> trace = cex.getTrace();
		if( check_id == null || trace.isEmpty() ) {
			return null;
		}
		for( Cmd c : trace.get(trace.size() - 1).getCmds() ) {
			if( c instanceof AssumeCmd && check_id.equals(c.getAttributes().findString("check_id")) ) {
				return c.getAttributes().findString("captureState");
			}
		}
		return null;
	}

	/** Finds a race-checking variable under its thread 1 name or, for constants, its plain name. */
	private Variable findRaceVariable(String name)
	{
		Variable v = final_program.getTopLevelVariable(KernelIdentifiers.makeThreadName(name, 1));
		return (v != null) ? v : final_program.getTopLevelVariable(name);
	}

	private static Element lookup(Model model, CapturedState state, Variable v)
	{
		if( v == null ) {
			return null;
		}
		if( v instanceof Constant || state == null ) {
			return model.tryGet(v.getName());
		}
		return state.tryGet(v.getName());
	}

	private Element getOffsetElement(Model model, CapturedState state, Variable offset)
	{
		if( offset == null ) {
			return null;
		}
		if( options.race_checking == RaceCheckingMethod.WATCHDOG ) {
			return model.tryGet(offset.getName());
		}
		return lookup(model, state, offset);
	}

	private String getRaceOffsetString(CallCounterexample cex, String array, AccessType access, String state_name,
			String source_name)
	{
		Variable has_occurred = findRaceVariable(RaceInstrumentationUtil.makeHasOccurredVariableName(array, access));
		Variable offset = findRaceVariable(RaceInstrumentationUtil.makeOffsetVariableName(array, access));
		CapturedState state = (state_name == null) ? null : cex.getModel().getState(state_name);
		Element e = getOffsetElement(cex.getModel(), state, offset);
		Attributes info = (has_occurred != null) ? has_occurred.getAttributes() : new Attributes();
		return formatArrayAccess(e, source_name, info);
	}

	/**
	 * Formats an access from the element width metadata of an array; the
	 * plain offset is shown when the metadata or the offset is missing.
	 */
	private String formatArrayAccess(Element offset_element, String source_name, Attributes info)
	{
		Long offset = (offset_element == null) ? null : OffsetDecoder.parseOffset(offset_element, size_t_bits);
		if( offset == null ) {
			return source_name + "[?]";
		}
		int elem_width = info.findInt("elem_width", -1);
		int source_elem_width = info.findInt("source_elem_width", -1);
		String dims = info.findString("source_dimensions");
		if( elem_width <= 0 || source_elem_width <= 0 || dims == null ) {
			PrintTools.printlnWarning("no element width metadata for " + source_name);
			return source_name + "[" + offset + "]";
		}
		try {
			return OffsetDecoder.getArrayAccess(offset, source_name, elem_width, source_elem_width, dims.split(","));
		} catch (IllegalArgumentException e) {
			PrintTools.printlnWarning("cannot decode offset " + offset + " of " + source_name + ": " + e.getMessage());
			return source_name + "[" + offset + "]";
		}
	}

	private Collection<SourceLocationInfo> getPossibleSourcesOfFirstAccess(CallCounterexample cex, String array,
			AccessType access, String racey_state)
	{
		Variable has_occurred = findRaceVariable(RaceInstrumentationUtil.makeHasOccurredVariableName(array, access));
		Variable offset = findRaceVariable(RaceInstrumentationUtil.makeOffsetVariableName(array, access));
		AssumeCmd conflicting = determineConflictingAction(cex, racey_state, has_occurred, offset);
		if( conflicting == null ) {
			throw new IllegalStateException("[ERROR in ErrorReporter] no captured state logs the earlier "
					+ access.getDisplayName().toLowerCase() + " of the race on " + array);
		}
		String state = conflicting.getAttributes().findString("captureState");
		String check_proc = RaceInstrumentationUtil.makeCheckProcedureName(array, access);
		if( state.startsWith(StateIdFixer.LOOP_HEAD_STATE) ) {
			return getSourcesInLoop(cex.getImplementation().getName(), StateIdFixer.getOriginalLabel(state),
					check_proc);
		} else if( state.startsWith(StateIdFixer.CALL_RETURN_STATE) ) {
			Set<SourceLocationInfo> ret = new LinkedHashSet<SourceLocationInfo>();
			collectFromCall(check_proc, conflicting.getAttributes().findString("procedureName"), ret,
					new HashSet<String>());
			return ret;
		}
		return Collections.singleton(getLocation(conflicting.getAttributes(), conflicting.getPosition()));
	}

	/**
	 * Walks the captured states of the trace up to the racey one and returns
	 * the capture point at which the first access was last logged, i.e. the
	 * last state where the access flag became set or its offset changed.
	 */
	private AssumeCmd determineConflictingAction(CallCounterexample cex, String racey_state, Variable has_occurred,
			Variable offset)
	{
		Model model = cex.getModel();
		AssumeCmd last_log = null;
		Element last_offset = null;
		for( Block b : cex.getTrace() ) {
			for( Cmd c : b.getCmds() ) {
				if( !(c instanceof AssumeCmd) ) {
					continue;
				}
				String state_name = c.getAttributes().findString("captureState");
				if( state_name == null ) {
					continue;
				}
				CapturedState state = model.getState(state_name);
				Element ho = (state == null) ? null : lookup(model, state, has_occurred);
				if( ho instanceof BooleanElement ) {
					Element off = getOffsetElement(model, state, offset);
					if( !ho.asBoolean() ) {
						last_log = null;
						last_offset = null;
					} else if( last_log == null || off == null || !off.equals(last_offset) ) {
						last_log = (AssumeCmd)c;
						last_offset = off;
					}
				}
				if( state_name.equals(racey_state) ) {
					return last_log;
				}
			}
		}
		return last_log;
	}

	private Collection<SourceLocationInfo> getSourcesInLoop(String impl_name, String state_name, String check_proc)
	{
		Implementation impl = original_program.getImplementation(impl_name);
		Set<SourceLocationInfo> ret = new LinkedHashSet<SourceLocationInfo>();
		if( impl == null ) {
			PrintTools.printlnWarning("no implementation " + impl_name + " in the original program");
			return ret;
		}
		BlockGraph graph = new BlockGraph(impl);
		for( Block header : graph.getLoopHeaders() ) {
			if( !hasCaptureState(header, state_name) ) {
				continue;
			}
			Set<String> visited = new HashSet<String>();
			visited.add(impl_name);
			collectFromBlocks(check_proc, graph.getNaturalLoop(header), ret, visited);
			return ret;
		}
		PrintTools.printlnWarning("no loop header captures state " + state_name);
		return ret;
	}

	private static boolean hasCaptureState(Block b, String state_name)
	{
		for( Cmd c : b.getCmds() ) {
			if( c instanceof AssumeCmd && state_name.equals(c.getAttributes().findString("captureState")) ) {
				return true;
			}
		}
		return false;
	}

	private void collectFromCall(String check_proc, String callee, Set<SourceLocationInfo> ret, Set<String> visited)
	{
		if( callee == null || !visited.add(callee) ) {
			return;
		}
		Implementation impl = original_program.getImplementation(callee);
		if( impl != null ) {
			collectFromBlocks(check_proc, impl.getBlocks(), ret, visited);
		}
	}

	private void collectFromBlocks(String check_proc, Collection<Block> blocks, Set<SourceLocationInfo> ret,
			Set<String> visited)
	{
		for( Block b : blocks ) {
			for( Cmd c : b.getCmds() ) {
				if( !(c instanceof CallCmd) ) {
					continue;
				}
				CallCmd call = (CallCmd)c;
				if( call.getCallee().equals(check_proc) ) {
					ret.add(getLocation(call.getAttributes(), call.getPosition()));
				} else {
					collectFromCall(check_proc, call.getCallee(), ret, visited);
				}
			}
		}
	}

	/* Other failures */

	private void reportThreadSpecificFailure(AssertCounterexample cex, String message)
	{
		AssertCmd failing = cex.getFailingAssert();
		out.println();
		SourceLocationInfo sli = getLocation(failing.getAttributes(), failing.getPosition());
		int thread = failing.getAttributes().findInt("thread", -1);
		if( thread != 1 && thread != 2 ) {
			PrintTools.printlnWarning("failing assertion carries no thread; reporting for thread 1");
			thread = 1;
		}
		errorWriteLine(sli.getTop() + ":", message + " for " + describeThread(cex.getModel(), thread, true));
		sli.printStackTrace(out);
		out.println();
	}

	private void reportArrayBounds(AssertCounterexample cex)
	{
		AssertCmd failing = cex.getFailingAssert();
		String array = failing.getAttributes().findString("array_name");
		String state_name = getStateName(failing.getAttributes(), cex);
		CapturedState state = (state_name == null) ? null : cex.getModel().getState(state_name);
		Element offset = null;
		if( array != null ) {
			String name = "_ARRAY_OFFSET_" + array;
			offset = (state != null) ? state.tryGet(name) : cex.getModel().tryGet(name);
		}
		Attributes info = findArrayInfo(array);
		String source_name = info.findString("source_name");
		if( source_name == null ) {
			source_name = (array == null) ? "?" : array;
		}
		String access = formatArrayAccess(offset, source_name, info);

		SourceLocationInfo sli = getLocation(failing.getAttributes(), failing.getPosition());
		errorWriteLine(sli.getTop() + ":", "possible array out-of-bounds access on array " + access + " by "
				+ describeThread(cex.getModel(), 2, false) + ":");
		sli.printStackTrace(out);
		out.println();
	}

	private Attributes findArrayInfo(String array)
	{
		if( array != null ) {
			for( Axiom a : original_program.getDeclarations(Axiom.class) ) {
				if( array.equals(a.getAttributes().findString("array_info")) ) {
					return a.getAttributes();
				}
			}
		}
		PrintTools.printlnWarning("no array_info axiom for array " + array);
		return new Attributes();
	}

	private void reportEnsuresFailure(Ensures ensures)
	{
		out.println();
		SourceLocationInfo sli = getLocation(ensures.getAttributes(), ensures.getPosition());
		errorWriteLine(sli.getTop() + ":", "postcondition might not hold on all return paths");
		sli.printStackTrace(out);
	}

	private void reportBarrierDivergence(CallCmd call)
	{
		out.println();
		SourceLocationInfo sli = getLocation(call.getAttributes(), call.getPosition());
		errorWriteLine(sli.getTop() + ":", "barrier may be reached by non-uniform control flow");
		sli.printStackTrace(out);
	}

	private void reportRequiresFailure(CallCmd call, Requires requires)
	{
		out.println();
		SourceLocationInfo call_sli = getLocation(call.getAttributes(), call.getPosition());
		SourceLocationInfo requires_sli = getLocation(requires.getAttributes(), requires.getPosition());
		errorWriteLine(call_sli.getTop() + ":", "a precondition for this call might not hold");
		call_sli.printStackTrace(out);
		noteWriteLine(requires_sli.getTop() + ":", "this is the precondition that might not hold");
		requires_sli.printStackTrace(out);
	}

	/* Parameter values */

	private void displayParameterValues(Counterexample cex)
	{
		Implementation impl = cex.getImplementation();
		if( impl.getInParams().isEmpty() ) {
			return;
		}
		String fun_name = impl.getAttributes().findString("source_name");
		if( fun_name == null ) {
			PrintTools.println(pass_name + " " + impl.getName() + " has no source_name; parameter values skipped", 1);
			return;
		}
		out.println("Bitwise values of parameters of '" + fun_name + "':");
		for( Formal p : impl.getInParams() ) {
			int id = KernelIdentifiers.getThreadId(p.getName());
			out.print("  " + cleanVariableName(p.getName()) + " = ");
			out.print(getValueString(cex.getModel(), p.getName()));
			out.println((id == 1 || id == 2) ? " (" + describeThread(cex.getModel(), id, false) + ")" : "");
		}
		out.println();
	}

	private String cleanVariableName(String name)
	{
		String stripped = KernelIdentifiers.stripThreadId(name);
		Variable global = final_program.getTopLevelVariable(stripped);
		if( global instanceof GlobalVariable ) {
			String source_name = global.getAttributes().findString("source_name");
			if( source_name != null ) {
				return source_name;
			}
		}
		int start = 0;
		while( start < stripped.length() && stripped.charAt(start) == '$' ) {
			start++;
		}
		String ret = stripped.substring(start);
		int dot = ret.indexOf('.');
		return (dot < 0) ? ret : ret.substring(0, dot);
	}

	static String getValueString(Model model, String name)
	{
		if( !model.getValues().containsKey(name) ) {
			return "<unknown>";
		}
		Element e = model.tryGet(name);
		if( e instanceof BitVectorElement ) {
			return ((BitVectorElement)e).asNumber().toString();
		} else if( e instanceof UninterpretedElement ) {
			return "<irrelevant>";
		} else if( e == null ) {
			return "<null>";
		}
		return e.toString();
	}
}
