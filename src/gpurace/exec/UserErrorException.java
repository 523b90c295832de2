package gpurace.exec;

/**
 * Raised for problems in the input that the user has to fix. The driver
 * prints the message and exits with the carried status.
 */
public class UserErrorException extends RuntimeException
{
	private static final long serialVersionUID = 1L;

	private final ToolExitCodes exit_code;

	public UserErrorException(String message, ToolExitCodes exit_code)
	{
		super(message);
		this.exit_code = exit_code;
	}

	public ToolExitCodes getExitCode()
	{
		return exit_code;
	}
}
