package gpurace.hir;

import ivl.hir.Attributes;
import ivl.hir.LiteralExpr;
import ivl.hir.Position;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class SourceLocationTableTest
{
	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private static String record(int line, int col, String file, String dir)
	{
		return line + "\u001F" + col + "\u001F" + file + "\u001F" + dir;
	}

	private File write(String name, String text) throws IOException
	{
		File f = new File(tmp.getRoot(), name);
		try( Writer w = new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8) ) {
			w.write(text);
		}
		return f;
	}

	private static Attributes sourceloc(int n)
	{
		return new Attributes().add(SourceLocationTable.SOURCELOC_NUM, LiteralExpr.integer(n));
	}

	@Test
	public void looksUpEntriesByNumber() throws IOException
	{
		String dir = tmp.getRoot().getPath();
		File loc = write("k.loc", record(2, 5, "k.cl", dir) + "\u001D"
				+ record(7, 3, "k.cl", dir) + "\u001E" + record(12, 1, "main.cl", dir) + "\n");
		SourceLocationTable table = new SourceLocationTable(loc);

		SourceLocationInfo first = table.get(sourceloc(0), Position.NONE);
		assertThat(first.getCount(), is(1));
		assertThat(first.toString(), is("k.cl:2:5"));

		SourceLocationInfo second = table.get(sourceloc(1), Position.NONE);
		assertThat(second.getCount(), is(2));
		assertThat(second.getRecords().get(1).getFile(), is("main.cl"));
		assertTrue(first.compareTo(second) < 0);
	}

	@Test
	public void fallsBackToPositionWhenNumberIsMissing() throws IOException
	{
		File loc = write("k.loc", record(2, 5, "k.cl", "") + "\n");
		SourceLocationTable table = new SourceLocationTable(loc);
		SourceLocationInfo info = table.get(sourceloc(4), new Position("k.gbpl", 10, 3));
		assertThat(info.toString(), is("k.gbpl:10:3"));
		info = table.get(new Attributes(), new Position("k.gbpl", 11, 1));
		assertThat(info.toString(), is("k.gbpl:11:1"));
	}

	@Test
	public void unreadableTableFallsBack()
	{
		SourceLocationTable table = new SourceLocationTable(new File(tmp.getRoot(), "missing.loc"));
		assertThat(table.get(sourceloc(0), new Position("k.gbpl", 1, 1)).toString(), is("k.gbpl:1:1"));
	}

	@Test
	public void dropsFrontEndHeaderRecords()
	{
		SourceLocationInfo info = SourceLocationTable.parseEntry(
				record(40, 1, "/usr/include-blang/cl.h", "") + "\u001E" + record(3, 9, "k.cl", ""));
		assertThat(info.getCount(), is(1));
		assertThat(info.getTop().getFile(), is("k.cl"));

		info = SourceLocationTable.parseEntry(record(40, 1, "/usr/include-blang/cl.h", ""));
		assertThat(info.getTop().getLine(), is(40));
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsMalformedRecord()
	{
		SourceLocationTable.parseEntry("1\u001F2\u001Fk.cl");
	}

	@Test
	public void tableNextToProgram()
	{
		assertThat(SourceLocationTable.forProgram("dir" + File.separator + "kernel.gbpl").getFile().getPath(),
				is("dir" + File.separator + "kernel.loc"));
	}

	@Test
	public void printsCodeLinesOfTheChain() throws IOException
	{
		String dir = tmp.getRoot().getPath();
		write("k.cl", "void f() {\n      x = y;\n}\nvoid main() {\n   f();\n}\n");
		SourceLocationInfo info = SourceLocationTable.parseEntry(
				record(2, 7, "k.cl", dir) + "\u001E" + record(5, 4, "k.cl", dir) + "\u001E" + record(99, 1, "k.cl", dir));
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true, "UTF-8");
		info.printStackTrace(out);
		String nl = System.lineSeparator();
		assertThat(bytes.toString("UTF-8"), is("  x = y;" + nl
				+ "invoked from k.cl:5:4:" + nl
				+ "  f();" + nl
				+ "invoked from k.cl:99:1:" + nl
				+ "  " + SourceLocationInfo.UNKNOWN_LINE + nl
				+ nl));
	}
}
