package gpurace.hir;

import ivl.hir.*;

import java.util.Arrays;

/**
 * Comparisons on bit-vectors. The IVL has no relational operators over
 * bit-vectors, so they are expressed with functions bound to solver
 * builtins, e.g. <b>function {:bvbuiltin "bvslt"} BV32_SLT(bv32, bv32) : bool;</b>,
 * which are declared on first use. Integer operands use the plain operators.
 */
public final class BvBuiltins
{
	public static final String BUILTIN_ATTR = "bvbuiltin";

	private BvBuiltins()
	{
	}

	/** Unsigned a &lt; b. */
	public static Expr ult(Program program, Expr a, Expr b)
	{
		return compare(program, "ULT", BinaryOperator.LT, a, b);
	}

	/** Signed a &lt; b. */
	public static Expr slt(Program program, Expr a, Expr b)
	{
		return compare(program, "SLT", BinaryOperator.LT, a, b);
	}

	/** Signed a &lt;= b. */
	public static Expr sle(Program program, Expr a, Expr b)
	{
		return compare(program, "SLE", BinaryOperator.LE, a, b);
	}

	private static Expr compare(Program program, String op, BinaryOperator int_op, Expr a, Expr b)
	{
		Type t = (a.getType() != null) ? a.getType() : b.getType();
		if( t == null || !t.isBv() ) {
			return new BinaryExpr(int_op, a, b);
		}
		int bits = t.getBvBits();
		String name = "BV" + bits + "_" + op;
		Function f = program.getFunction(name);
		if( f == null ) {
			Type bv = Type.getBvType(bits);
			f = new Function(name, Arrays.asList(new Formal("", bv, true), new Formal("", bv, true)),
					BasicType.BOOL, null, new Attributes().add(BUILTIN_ATTR, "bv" + op.toLowerCase()));
			program.addDeclaration(f);
		}
		return new FunctionCallExpr(name, Arrays.asList(a, b), f);
	}

	/** Returns the builtin a function is bound to, or null. */
	public static String getBuiltin(Function f)
	{
		return (f == null) ? null : f.getAttributes().findString(BUILTIN_ATTR);
	}
}
