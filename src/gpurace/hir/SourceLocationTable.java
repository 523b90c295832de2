package gpurace.hir;

import ivl.hir.Attributes;
import ivl.hir.Position;
import ivl.hir.PrintTools;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Side table mapping the <b>sourceloc_num</b> attribute of commands to
 * {@link SourceLocationInfo} chains. The table is the first line of a
 * <b>.loc</b> file: entries are separated by 0x1D, the records of a chain by
 * 0x1E, and the fields of a record (line, column, file, directory) by 0x1F.
 * The file is read on first lookup.
 */
public class SourceLocationTable
{
	public static final String SOURCELOC_NUM = "sourceloc_num";

	private static final String ENTRY_SEP = "\u001D";
	private static final String CHAIN_SEP = "\u001E";
	private static final String FIELD_SEP = "\u001F";

	/** Header files of the front end that never make a useful location. */
	private static final String INCLUDE_BLANG = "include-blang";

	private final File loc_file;
	private String[] entries;
	private String load_error;

	public SourceLocationTable(File loc_file)
	{
		this.loc_file = loc_file;
	}

	/** Returns the table that sits next to the given program file. */
	public static SourceLocationTable forProgram(String program_file)
	{
		String name = program_file;
		int dot = name.lastIndexOf('.');
		int sep = name.lastIndexOf(File.separatorChar);
		if( dot > sep ) {
			name = name.substring(0, dot);
		}
		return new SourceLocationTable(new File(name + ".loc"));
	}

	public File getFile()
	{
		return loc_file;
	}

	/**
	 * Returns the location chain of a command or specification, or, if it
	 * cannot be determined, a single record made from the fallback position.
	 */
	public SourceLocationInfo get(Attributes attrs, Position fallback)
	{
		try {
			return lookup(attrs);
		} catch (IllegalArgumentException e) {
			PrintTools.println("warning: getting source loc info failed with: " + e.getMessage(), 0);
			Position pos = (fallback == null) ? Position.NONE : fallback;
			return new SourceLocationInfo(new SourceLocationInfo.Record(pos.getLine(), pos.getColumn(),
					pos.getFile(), ""));
		}
	}

	private SourceLocationInfo lookup(Attributes attrs)
	{
		int num = attrs.findInt(SOURCELOC_NUM, -1);
		if( num < 0 ) {
			throw new IllegalArgumentException("no " + SOURCELOC_NUM + " attribute");
		}
		load();
		if( entries == null ) {
			throw new IllegalArgumentException(load_error);
		}
		if( num >= entries.length ) {
			throw new IllegalArgumentException("no source location number " + num + " in " + loc_file);
		}
		return parseEntry(entries[num]);
	}

	/** Parses one table entry; chains into include-blang are dropped unless nothing else remains. */
	public static SourceLocationInfo parseEntry(String entry)
	{
		List<SourceLocationInfo.Record> all = new ArrayList<SourceLocationInfo.Record>();
		List<SourceLocationInfo.Record> kept = new ArrayList<SourceLocationInfo.Record>();
		for( String chain : entry.split(CHAIN_SEP) ) {
			if( chain.length() == 0 ) {
				continue;
			}
			String[] fields = chain.split(FIELD_SEP, -1);
			if( fields.length != 4 ) {
				throw new IllegalArgumentException("malformed location record \"" + chain.replace(FIELD_SEP, ",") + "\"");
			}
			SourceLocationInfo.Record r;
			try {
				r = new SourceLocationInfo.Record(Integer.parseInt(fields[0].trim()),
						Integer.parseInt(fields[1].trim()), fields[2], fields[3]);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("malformed line or column in location record: " + e.getMessage(), e);
			}
			all.add(r);
			if( !r.getFile().contains(INCLUDE_BLANG) ) {
				kept.add(r);
			}
		}
		if( all.isEmpty() ) {
			throw new IllegalArgumentException("empty location record");
		}
		return new SourceLocationInfo(kept.isEmpty() ? all : kept);
	}

	private void load()
	{
		if( entries != null || load_error != null ) {
			return;
		}
		try( BufferedReader br = new BufferedReader(new FileReader(loc_file)) ) {
			String line = br.readLine();
			if( line == null ) {
				load_error = "empty source location file " + loc_file;
			} else {
				entries = line.split(ENTRY_SEP, -1);
			}
		} catch (IOException e) {
			load_error = "could not read " + loc_file + ": " + e.getMessage();
		}
	}
}
