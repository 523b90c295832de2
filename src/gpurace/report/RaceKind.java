package gpurace.report;

import gpurace.hir.AccessType;
import ivl.hir.Attributes;

/**
 * The seven kinds of race a check procedure reports, named by the pair of
 * accesses: the earlier access of thread 1 and the access of thread 2 that
 * conflicts with it.
 */
public enum RaceKind
{
	WRITE_READ("write_read", "write-read", AccessType.WRITE, AccessType.READ),
	READ_WRITE("read_write", "read-write", AccessType.READ, AccessType.WRITE),
	WRITE_WRITE("write_write", "write-write", AccessType.WRITE, AccessType.WRITE),
	ATOMIC_READ("atomic_read", "atomic-read", AccessType.ATOMIC, AccessType.READ),
	ATOMIC_WRITE("atomic_write", "atomic-write", AccessType.ATOMIC, AccessType.WRITE),
	READ_ATOMIC("read_atomic", "read-atomic", AccessType.READ, AccessType.ATOMIC),
	WRITE_ATOMIC("write_atomic", "write-atomic", AccessType.WRITE, AccessType.ATOMIC);

	private final String attribute;
	private final String display_name;
	private final AccessType first;
	private final AccessType second;

	RaceKind(String attribute, String display_name, AccessType first, AccessType second)
	{
		this.attribute = attribute;
		this.display_name = display_name;
		this.first = first;
		this.second = second;
	}

	/** The attribute tagging the requires clause that checks this kind. */
	public String getAttribute()
	{
		return attribute;
	}

	public String getDisplayName()
	{
		return display_name;
	}

	/** The access recorded earlier, by thread 1. */
	public AccessType getFirstAccess()
	{
		return first;
	}

	/** The access being checked, by thread 2. */
	public AccessType getSecondAccess()
	{
		return second;
	}

	/** Returns the kind tagged in the attributes of a failing requires, or null. */
	public static RaceKind classify(Attributes attrs)
	{
		for( RaceKind k : values() ) {
			if( attrs.findBool(k.attribute) ) {
				return k;
			}
		}
		return null;
	}
}
