package gpurace.hir;

import ivl.hir.PrintTools;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The source location of a command, as a chain of records. The first record
 * is the line of code itself; each later record is a call site through
 * which the code was inlined. Ordering is positional over (directory, file,
 * line, column) and then by chain length.
 */
public class SourceLocationInfo implements Comparable<SourceLocationInfo>
{
	public static final String UNKNOWN_LINE = "<unknown line of code>";

	/** One element of a location chain. */
	public static class Record implements Comparable<Record>
	{
		private final int line;
		private final int column;
		private final String file;
		private final String directory;

		public Record(int line, int column, String file, String directory)
		{
			this.line = line;
			this.column = column;
			this.file = (file == null) ? "" : file;
			this.directory = (directory == null) ? "" : directory;
		}

		public int getLine()
		{
			return line;
		}

		public int getColumn()
		{
			return column;
		}

		public String getFile()
		{
			return file;
		}

		public String getDirectory()
		{
			return directory;
		}

		@Override
		public int compareTo(Record other)
		{
			int c = directory.compareTo(other.directory);
			if( c == 0 ) {
				c = file.compareTo(other.file);
			}
			if( c == 0 ) {
				c = Integer.compare(line, other.line);
			}
			if( c == 0 ) {
				c = Integer.compare(column, other.column);
			}
			return c;
		}

		@Override
		public boolean equals(Object o)
		{
			if( !(o instanceof Record) ) {
				return false;
			}
			return compareTo((Record)o) == 0;
		}

		@Override
		public int hashCode()
		{
			return ((directory.hashCode() * 31 + file.hashCode()) * 31 + line) * 31 + column;
		}

		/** file:line:column */
		@Override
		public String toString()
		{
			return file + ":" + line + ":" + column;
		}
	}

	private final List<Record> records;

	public SourceLocationInfo(List<Record> records)
	{
		if( records.isEmpty() ) {
			throw new IllegalStateException("[ERROR in SourceLocationInfo] empty location chain");
		}
		this.records = Collections.unmodifiableList(new ArrayList<Record>(records));
	}

	public SourceLocationInfo(Record record)
	{
		this(Collections.singletonList(record));
	}

	public List<Record> getRecords()
	{
		return records;
	}

	/** The innermost record, i.e. the line of code itself. */
	public Record getTop()
	{
		return records.get(0);
	}

	public int getCount()
	{
		return records.size();
	}

	/**
	 * Prints the code line of the innermost record followed by the chain of
	 * call sites it was inlined through, and a blank line.
	 */
	public void printStackTrace(PrintStream out)
	{
		out.println(trimLeadingSpaces(fetchCodeLine(getTop()), 2));
		for( int i = 1; i < records.size(); i++ ) {
			Record r = records.get(i);
			out.println("invoked from " + r + ":");
			out.println(trimLeadingSpaces(fetchCodeLine(r), 2));
		}
		out.println();
	}

	/**
	 * Reads line r.getLine() of the record's file, trying the file name on
	 * its own first and then relative to the directory.
	 */
	public static String fetchCodeLine(Record r)
	{
		String line = readLine(new File(r.getFile()), r.getLine());
		if( line == null && r.getDirectory().length() > 0 ) {
			line = readLine(new File(r.getDirectory(), new File(r.getFile()).getName()), r.getLine());
		}
		return (line == null) ? UNKNOWN_LINE : line;
	}

	private static String readLine(File f, int line_number)
	{
		if( line_number < 1 || !f.isFile() ) {
			return null;
		}
		try( BufferedReader br = new BufferedReader(new FileReader(f)) ) {
			String line = null;
			for( int i = 0; i < line_number; i++ ) {
				line = br.readLine();
				if( line == null ) {
					return null;
				}
			}
			return line;
		} catch (IOException e) {
			PrintTools.println("could not read " + f + ": " + e.getMessage(), 2);
			return null;
		}
	}

	/** Replaces the leading white space of s by exactly n spaces. */
	public static String trimLeadingSpaces(String s, int n)
	{
		int i = 0;
		while( i < s.length() && Character.isWhitespace(s.charAt(i)) ) {
			i++;
		}
		StringBuilder sb = new StringBuilder();
		for( int k = 0; k < n; k++ ) {
			sb.append(' ');
		}
		return sb.append(s.substring(i)).toString();
	}

	@Override
	public int compareTo(SourceLocationInfo other)
	{
		int n = Math.min(records.size(), other.records.size());
		for( int i = 0; i < n; i++ ) {
			int c = records.get(i).compareTo(other.records.get(i));
			if( c != 0 ) {
				return c;
			}
		}
		return Integer.compare(records.size(), other.records.size());
	}

	@Override
	public boolean equals(Object o)
	{
		return (o instanceof SourceLocationInfo) && records.equals(((SourceLocationInfo)o).records);
	}

	@Override
	public int hashCode()
	{
		return records.hashCode();
	}

	@Override
	public String toString()
	{
		return getTop().toString();
	}
}
