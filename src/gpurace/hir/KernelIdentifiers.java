package gpurace.hir;

import gpurace.exec.ToolExitCodes;
import gpurace.exec.UserErrorException;
import ivl.hir.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Naming conventions shared by the front end, the two-thread reduction and
 * the diagnosis: thread and group identifiers, thread-suffixed copies of
 * variables, and the "other thread" functions.
 */
public final class KernelIdentifiers
{
	public static final String[] DIMENSIONS = { "x", "y", "z" };

	public static final String LOCAL_ID = "local_id_";
	public static final String GROUP_ID = "group_id_";
	public static final String GROUP_SIZE = "group_size_";
	public static final String NUM_GROUPS = "num_groups_";

	/** Type synonym giving the width of offsets and pointers. */
	public static final String SIZE_T_TYPE = "_SIZE_T_TYPE";

	public static final String OTHER_PREFIX = "__other_";

	private KernelIdentifiers()
	{
	}

	public static boolean isThreadLocalIdConstant(Variable v)
	{
		return (v instanceof Constant) && isDimensioned(v.getName(), LOCAL_ID);
	}

	public static boolean isGroupIdConstant(Variable v)
	{
		return (v instanceof Constant) && isDimensioned(v.getName(), GROUP_ID);
	}

	private static boolean isDimensioned(String name, String prefix)
	{
		if( !name.startsWith(prefix) || name.length() != prefix.length() + 1 ) {
			return false;
		}
		char d = name.charAt(prefix.length());
		return d == 'x' || d == 'y' || d == 'z';
	}

	/** Returns the name of the copy of a variable owned by the given thread. */
	public static String makeThreadName(String name, int thread)
	{
		return name + "$" + thread;
	}

	/** Returns 1 or 2 if the name is a thread copy, 0 otherwise. */
	public static int getThreadId(String name)
	{
		if( name.endsWith("$1") ) {
			return 1;
		} else if( name.endsWith("$2") ) {
			return 2;
		}
		return 0;
	}

	/** Removes a thread suffix added by {@link #makeThreadName}, if any. */
	public static String stripThreadId(String name)
	{
		return (getThreadId(name) == 0) ? name : name.substring(0, name.length() - 2);
	}

	public static boolean isOtherFunction(String name)
	{
		return name.startsWith(OTHER_PREFIX);
	}

	public static String getOtherFunctionName(Type type)
	{
		if( type.isBool() ) {
			return OTHER_PREFIX + "bool";
		} else if( type.isBv() ) {
			return OTHER_PREFIX + "bv" + type.getBvBits();
		} else if( type.isInt() ) {
			return OTHER_PREFIX + "int";
		}
		throw new IllegalStateException("[ERROR in KernelIdentifiers] no other-thread function for type " + type);
	}

	/**
	 * Builds <b>__other_T(e)</b>, the value of e in the other thread,
	 * declaring the function the first time it is needed.
	 */
	public static Expr makeOther(Program program, Expr e)
	{
		Type type = e.getType();
		if( type == null ) {
			throw new IllegalStateException("[ERROR in KernelIdentifiers] cannot determine the type of " + e);
		}
		String name = getOtherFunctionName(type);
		Function f = program.getFunction(name);
		if( f == null ) {
			f = new Function(name, Collections.singletonList(new Formal("", type, true)), type, null, null);
			program.addDeclaration(f);
		}
		return new FunctionCallExpr(name, Collections.<Expr>singletonList(e), f);
	}

	/** Returns the identifier constant prefix+dim, or null if undeclared. */
	public static Variable getIdConstant(Program program, String prefix, String dim)
	{
		Variable v = program.getTopLevelVariable(prefix + dim);
		return (v instanceof Constant) ? v : null;
	}

	/**
	 * Condition under which the two threads belong to the same group:
	 * <b>group_id_x == __other_bvN(group_id_x) &amp;&amp; ...</b> over the
	 * declared dimensions. It is trivially true when only intra-group races
	 * are checked, since both threads then share one group.
	 */
	public static Expr threadsInSameGroup(Program program, boolean only_intra_group)
	{
		Expr ret = LiteralExpr.TRUE;
		if( only_intra_group ) {
			return ret;
		}
		for( String dim : DIMENSIONS ) {
			Variable g = getIdConstant(program, GROUP_ID, dim);
			if( g != null ) {
				ret = Expr.and(ret, Expr.eq(new IdentifierExpr(g), makeOther(program, new IdentifierExpr(g))));
			}
		}
		return ret;
	}

	/**
	 * Condition under which the two threads are distinct: some local id
	 * differs or, unless only intra-group races are checked, some group id.
	 */
	public static Expr distinctThreads(Program program, boolean only_intra_group)
	{
		Expr ret = LiteralExpr.FALSE;
		for( String dim : DIMENSIONS ) {
			Variable l = getIdConstant(program, LOCAL_ID, dim);
			if( l != null ) {
				ret = Expr.or(ret, Expr.neq(new IdentifierExpr(l), makeOther(program, new IdentifierExpr(l))));
			}
		}
		if( !only_intra_group ) {
			for( String dim : DIMENSIONS ) {
				Variable g = getIdConstant(program, GROUP_ID, dim);
				if( g != null ) {
					ret = Expr.or(ret, Expr.neq(new IdentifierExpr(g), makeOther(program, new IdentifierExpr(g))));
				}
			}
		}
		return ret;
	}

	/**
	 * Returns the width of <b>_SIZE_T_TYPE</b>.
	 *
	 * @throws UserErrorException if the synonym is not declared exactly once
	 *         as a bit-vector type.
	 */
	public static int getSizeTBits(Program program)
	{
		List<TypeSynonym> candidates = new ArrayList<TypeSynonym>();
		for( TypeSynonym t : program.getDeclarations(TypeSynonym.class) ) {
			if( t.getName().equals(SIZE_T_TYPE) ) {
				candidates.add(t);
			}
		}
		if( candidates.size() != 1 || candidates.get(0).getBody() == null
				|| !candidates.get(0).getBody().isBv() ) {
			throw new UserErrorException("the program must declare " + SIZE_T_TYPE
					+ " exactly once, as a bit-vector type (found " + candidates.size() + " declarations)",
					ToolExitCodes.OTHER_ERROR);
		}
		return candidates.get(0).getBody().getBvBits();
	}
}
