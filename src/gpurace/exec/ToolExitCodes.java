package gpurace.exec;

/**
 * Process exit statuses of the tool.
 */
public enum ToolExitCodes
{
	SUCCESS(0),
	/** One or more counterexamples were reported. */
	VERIFICATION_ERROR(1),
	INTERNAL_ERROR(2),
	/** Modeling errors in the input, such as a malformed size type or barrier invariant. */
	OTHER_ERROR(3),
	COMMAND_LINE_ERROR(4);

	private final int status;

	ToolExitCodes(int status)
	{
		this.status = status;
	}

	public int getStatus()
	{
		return status;
	}
}
