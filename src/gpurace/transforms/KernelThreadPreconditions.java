package gpurace.transforms;

import gpurace.exec.GPURaceOptions;
import gpurace.hir.BvBuiltins;
import gpurace.hir.KernelIdentifiers;
import ivl.hir.*;
import ivl.transforms.TransformPass;

/**
 * Constrains the thread identities on entry to every kernel: each id lies
 * within its bounds, and the two threads of the reduction are distinct.
 */
public class KernelThreadPreconditions extends TransformPass
{
	private static final String pass_name = "[KernelThreadPreconditions]";

	private final GPURaceOptions options;

	public KernelThreadPreconditions(Program program, GPURaceOptions options)
	{
		super(program);
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
		for( Procedure proc : program.getProcedures() ) {
			if( !proc.getAttributes().findBool("kernel") ) {
				continue;
			}
			for( String dim : KernelIdentifiers.DIMENSIONS ) {
				addBound(proc, KernelIdentifiers.LOCAL_ID, KernelIdentifiers.GROUP_SIZE, dim);
				addBound(proc, KernelIdentifiers.GROUP_ID, KernelIdentifiers.NUM_GROUPS, dim);
			}
			Expr distinct = KernelIdentifiers.distinctThreads(program, options.only_intra_group);
			if( !Expr.isFalse(distinct) ) {
				proc.getRequires().add(new Requires(false, distinct, null));
			} else {
				PrintTools.printlnWarning("kernel " + proc.getName() + " declares no thread identifiers");
			}
		}
	}

	/** Adds <b>requires id &lt; bound</b> when both constants are declared. */
	private void addBound(Procedure proc, String id_prefix, String bound_prefix, String dim)
	{
		Variable id = KernelIdentifiers.getIdConstant(program, id_prefix, dim);
		Variable bound = KernelIdentifiers.getIdConstant(program, bound_prefix, dim);
		if( id == null || bound == null ) {
			return;
		}
		proc.getRequires().add(new Requires(false,
				BvBuiltins.ult(program, new IdentifierExpr(id), new IdentifierExpr(bound)), null));
	}
}
