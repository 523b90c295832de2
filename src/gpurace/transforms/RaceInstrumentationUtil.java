package gpurace.transforms;

import gpurace.hir.AccessType;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Names of race-checking shadow state and of the log and check procedures.
 */
public final class RaceInstrumentationUtil
{
	public static final String RACE_CHECKING = "race_checking";
	public static final String TRACKING_VARIABLE = "_TRACKING";

	private static final Pattern ACCESS_PROCEDURE = Pattern.compile("_(LOG|CHECK)_(READ|WRITE|ATOMIC)_(.+)");

	private RaceInstrumentationUtil()
	{
	}

	public static String makeHasOccurredVariableName(String array, AccessType access)
	{
		return "_" + access + "_HAS_OCCURRED_" + array;
	}

	public static String makeOffsetVariableName(String array, AccessType access)
	{
		return "_" + access + "_OFFSET_" + array;
	}

	public static String makeValueVariableName(String array, AccessType access)
	{
		return "_" + access + "_VALUE_" + array;
	}

	public static String makeBenignFlagVariableName(String array)
	{
		return "_WRITE_READ_BENIGN_FLAG_" + array;
	}

	public static String makeAsyncHandleVariableName(String array, AccessType access)
	{
		return "_" + access + "_ASYNC_HANDLE_" + array;
	}

	public static String makeLogProcedureName(String array, AccessType access)
	{
		return "_LOG_" + access + "_" + array;
	}

	public static String makeCheckProcedureName(String array, AccessType access)
	{
		return "_CHECK_" + access + "_" + array;
	}

	/** A parsed log or check procedure name. */
	public static final class AccessProcedure
	{
		public final boolean is_log;
		public final AccessType access;
		public final String array;

		AccessProcedure(boolean is_log, AccessType access, String array)
		{
			this.is_log = is_log;
			this.access = access;
			this.array = array;
		}
	}

	/** Returns the parts of a log or check procedure name, or null for other names. */
	public static AccessProcedure parseAccessProcedureName(String name)
	{
		Matcher m = ACCESS_PROCEDURE.matcher(name);
		if( !m.matches() ) {
			return null;
		}
		return new AccessProcedure(m.group(1).equals("LOG"), AccessType.valueOf(m.group(2)), m.group(3));
	}
}
