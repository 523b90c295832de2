package gpurace.hir;

/**
 * The kinds of memory access that race instrumentation distinguishes. The
 * name of each constant is the infix used in shadow-state and log/check
 * procedure names, e.g. <b>_WRITE_HAS_OCCURRED_A</b>.
 */
public enum AccessType
{
	READ("Read"),
	WRITE("Write"),
	ATOMIC("Atomic");

	private final String display_name;

	AccessType(String display_name)
	{
		this.display_name = display_name;
	}

	/** Returns true for the accesses that carry a value. */
	public boolean isReadOrWrite()
	{
		return this == READ || this == WRITE;
	}

	/** Capitalized name used in race reports, e.g. "Write". */
	public String getDisplayName()
	{
		return display_name;
	}

	/** Returns the access type with the given upper-case name, or null. */
	public static AccessType fromName(String name)
	{
		for( AccessType t : values() ) {
			if( t.name().equals(name) ) {
				return t;
			}
		}
		return null;
	}
}
