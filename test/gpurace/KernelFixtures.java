package gpurace;

import gpurace.exec.GPURaceOptions;
import gpurace.exec.KernelVerifier;
import ivl.base.ProgramParser;
import ivl.hir.Block;
import ivl.hir.CallCmd;
import ivl.hir.Cmd;
import ivl.hir.Implementation;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/** Kernel programs and helpers shared by the transformation and diagnosis tests. */
public final class KernelFixtures
{
	private KernelFixtures()
	{
	}

	public static final String HEADER =
			"type _SIZE_T_TYPE = bv32;\n"
			+ "function {:bvbuiltin \"bvadd\"} BV32_ADD(bv32, bv32) : bv32;\n"
			+ "const local_id_x: bv32;\n"
			+ "const group_size_x: bv32;\n"
			+ "const group_id_x: bv32;\n"
			+ "var {:source_name \"A\"} {:global} {:elem_width 32} {:source_elem_width 32}"
			+ " {:source_dimensions \"*\"} $$A: [bv32]bv32;\n";

	/** Logs, performs and checks a write of A[offset] at the given source location and check state. */
	public static String write(String offset, int sourceloc, int state)
	{
		String check = "\"check_state_" + state + "\"";
		return "  call {:sourceloc_num " + sourceloc + "} _LOG_WRITE_$$A(true, " + offset
				+ ", local_id_x, $$A[" + offset + "]);\n"
				+ "  $$A[" + offset + "] := local_id_x;\n"
				+ "  assume {:captureState " + check + "} {:check_id " + check + "} {:sourceloc_num "
				+ sourceloc + "} true;\n"
				+ "  call {:check_id " + check + "} {:sourceloc_num " + sourceloc + "} _CHECK_WRITE_$$A(true, "
				+ offset + ", local_id_x);\n";
	}

	/** A kernel whose two writes, at lines 2 and 3 of kernel.cl, may race. */
	public static final String RACE_KERNEL = HEADER
			+ "procedure {:kernel} {:source_name \"race\"} race();\n"
			+ "  modifies $$A;\n"
			+ "implementation race()\n"
			+ "{\n"
			+ "entry:\n"
			+ write("local_id_x", 0, 0)
			+ write("BV32_ADD(local_id_x, 1bv32)", 1, 1)
			+ "  return;\n"
			+ "}\n";

	/** As {@link #RACE_KERNEL}, with the first write inside a called procedure. */
	public static final String CALL_KERNEL = HEADER
			+ "procedure {:source_name \"store\"} store();\n"
			+ "  modifies $$A;\n"
			+ "procedure {:kernel} {:source_name \"race\"} race();\n"
			+ "  modifies $$A;\n"
			+ "implementation store()\n"
			+ "{\n"
			+ "entry:\n"
			+ write("local_id_x", 0, 0)
			+ "  return;\n"
			+ "}\n"
			+ "implementation race()\n"
			+ "{\n"
			+ "entry:\n"
			+ "  call {:sourceloc_num 2} store();\n"
			+ write("BV32_ADD(local_id_x, 1bv32)", 1, 1)
			+ "  return;\n"
			+ "}\n";

	/** Source lines matching the locations of the kernels above. */
	public static final String KERNEL_SOURCE =
			"__kernel void race(__global int *A) {\n"
			+ "    A[get_local_id(0)] = get_local_id(0);\n"
			+ "    A[get_local_id(0) + 1] = get_local_id(0);\n"
			+ "    barrier(CLK_GLOBAL_MEM_FENCE);\n"
			+ "}\n";

	/** A .loc table entry for line of kernel.cl, column 5, in directory dir. */
	public static String location(int line, File dir)
	{
		return line + "\u001F5\u001Fkernel.cl\u001F" + dir.getPath();
	}

	/** Writes kernel.cl and a kernel.loc whose entry n points at line n + 2. */
	public static void writeSources(File dir, int entries) throws IOException
	{
		writeFile(new File(dir, "kernel.cl"), KERNEL_SOURCE);
		StringBuilder sb = new StringBuilder();
		for( int i = 0; i < entries; i++ ) {
			if( i > 0 ) {
				sb.append("\u001D");
			}
			sb.append(location(i + 2, dir));
		}
		writeFile(new File(dir, "kernel.loc"), sb.append("\n").toString());
	}

	public static File writeFile(File f, String text) throws IOException
	{
		try( Writer w = new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8) ) {
			w.write(text);
		}
		return f;
	}

	/** Parses and transforms a kernel program. */
	public static KernelVerifier transform(String text, GPURaceOptions options)
	{
		KernelVerifier verifier = new KernelVerifier(ProgramParser.parse(text, "kernel.gbpl"), options,
				"kernel.gbpl");
		verifier.transform();
		return verifier;
	}

	/** Returns "BLOCK INDEX" of the call to callee carrying the given check_id, or null. */
	public static String findCheckCall(Implementation impl, String callee, String check_id)
	{
		for( Block b : impl.getBlocks() ) {
			for( int i = 0; i < b.getCmds().size(); i++ ) {
				Cmd c = b.getCmds().get(i);
				if( c instanceof CallCmd && ((CallCmd)c).getCallee().equals(callee)
						&& check_id.equals(c.getAttributes().findString("check_id")) ) {
					return b.getLabel() + " " + i;
				}
			}
		}
		return null;
	}
}
