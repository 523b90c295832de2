package gpurace.report;

import gpurace.exec.GPURaceOptions;
import gpurace.hir.KernelIdentifiers;
import ivl.model.BitVectorElement;
import ivl.model.Element;
import ivl.model.Model;
import ivl.model.NumberElement;

import java.math.BigInteger;

/**
 * Describes one of the two threads of a counterexample in the terms of the
 * source language: CUDA threads and blocks, or OpenCL work items and work
 * groups. Dimensions beyond the configured highest ones are left out.
 */
public class ThreadDetails
{
	private static final String UNKNOWN = "?";

	private final Model model;
	private final GPURaceOptions options;

	public ThreadDetails(Model model, GPURaceOptions options)
	{
		this.model = model;
		this.options = options;
	}

	public String describe(int thread, boolean with_spaces)
	{
		String local_id = format(thread, with_spaces, options.block_highest_dim, Kind.LOCAL);
		String group_id = format(thread, with_spaces, options.grid_highest_dim, Kind.GROUP);
		String global_id = format(thread, with_spaces, options.block_highest_dim, Kind.GLOBAL);
		if( options.cuda ) {
			return "thread " + local_id + " in thread block " + group_id + " (global id " + global_id + ")";
		}
		return "work item " + global_id + " with local id " + local_id + " in work group " + group_id;
	}

	private enum Kind
	{
		LOCAL, GROUP, GLOBAL
	}

	private String format(int thread, boolean with_spaces, int highest_dim, Kind kind)
	{
		if( highest_dim == 0 ) {
			return value(thread, KernelIdentifiers.DIMENSIONS[0], kind);
		}
		StringBuilder sb = new StringBuilder("(");
		for( int d = 0; d <= highest_dim; d++ ) {
			if( d > 0 ) {
				sb.append(with_spaces ? ", " : ",");
			}
			sb.append(value(thread, KernelIdentifiers.DIMENSIONS[d], kind));
		}
		return sb.append(")").toString();
	}

	private String value(int thread, String dim, Kind kind)
	{
		BigInteger v;
		switch( kind ) {
		case LOCAL:
			v = getLocalId(thread, dim);
			break;
		case GROUP:
			v = getGroupId(thread, dim);
			break;
		default:
			BigInteger group = getGroupId(thread, dim);
			BigInteger size = getNumber(KernelIdentifiers.GROUP_SIZE + dim);
			BigInteger local = getLocalId(thread, dim);
			v = (group == null || size == null || local == null) ? null : group.multiply(size).add(local);
			break;
		}
		return (v == null) ? UNKNOWN : v.toString();
	}

	private BigInteger getLocalId(int thread, String dim)
	{
		return getNumber(KernelIdentifiers.makeThreadName(KernelIdentifiers.LOCAL_ID + dim, thread));
	}

	private BigInteger getGroupId(int thread, String dim)
	{
		String name = KernelIdentifiers.GROUP_ID + dim;
		if( !options.only_intra_group ) {
			name = KernelIdentifiers.makeThreadName(name, thread);
		}
		return getNumber(name);
	}

	private BigInteger getNumber(String name)
	{
		Element e = model.tryGet(name);
		if( e instanceof BitVectorElement || e instanceof NumberElement ) {
			return e.asNumber();
		}
		return null;
	}
}
