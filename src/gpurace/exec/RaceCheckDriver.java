package gpurace.exec;

import ivl.base.ParseException;
import ivl.exec.Driver;
import ivl.hir.PrintTools;
import ivl.hir.Tools;

import java.io.FileOutputStream;
import java.io.FileReader;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Command line front end. It reads a kernel program, applies the two-thread
 * reduction and prints the result; with <b>-diagnose</b> it also explains
 * the counterexamples the solver produced for that result.
 * <p>
 * Users may extend this class by overriding {@link #runPasses}.
 */
public class RaceCheckDriver extends Driver
{
	private GPURaceOptions race_options;
	private KernelVerifier verifier;
	private int reported = 0;

	public RaceCheckDriver()
	{
		super();

		options.add(options.TRANSFORM, "raceChecking", "METHOD",
				"Race instrumentation: ORIGINAL (default), WATCHDOG or NONE");
		options.add(options.TRANSFORM, "noBenign",
				"Report write-write races that write the same value, and write-read races that do not change it");
		options.add(options.TRANSFORM, "asymmetricAsserts",
				"Emit assertions for the first thread only");
		options.add(options.TRANSFORM, "onlyIntraGroupRaceChecking",
				"Assume both threads are in the same group; group ids are not duplicated");
		options.add(options.TRANSFORM, "barrierAccessChecks",
				"Check that barrier invariants only read memory the thread may access");
		options.add(options.ANALYSIS, "noUniformityAnalysis",
				"Treat every variable as non-uniform");
		options.add(options.ANALYSIS, "showUniformityAnalysis",
				"Print the result of the uniformity analysis");
		options.add(options.TRANSFORM, "loopUnroll", "N",
				"Unroll every loop N times before state ids are fixed");
		options.add(options.DIAGNOSIS, "diagnose", "FILE",
				"Report the counterexamples in FILE against the transformed program");
		options.add(options.DIAGNOSIS, "originalProgram", "FILE",
				"Program used to map loops and calls back to source (default: the dualised program before unrolling)");
		options.add(options.DIAGNOSIS, "sourceLocFile", "FILE",
				"Source location table (default: the .loc file next to the input)");
		options.add(options.DIAGNOSIS, "sourceLanguage", "cl|cu",
				"Language of the kernel source, for thread names in reports (default: cl)");
		options.add(options.DIAGNOSIS, "blockHighestDim", "N",
				"Highest dimension (0-2) of local ids shown in reports");
		options.add(options.DIAGNOSIS, "gridHighestDim", "N",
				"Highest dimension (0-2) of group ids shown in reports");
	}

	@Override
	protected void commandLineError(String msg)
	{
		throw new UserErrorException(msg, ToolExitCodes.COMMAND_LINE_ERROR);
	}

	@Override
	protected String getToolName()
	{
		return "gpurace";
	}

	@Override
	protected String getVersion()
	{
		return BuildConfig.getBuildConfig().getProperty("version");
	}

	@Override
	public void runPasses()
	{
		verifier = new KernelVerifier(program, race_options, filenames.get(0));
		verifier.transform();
	}

	/**
	 * Runs this driver with args as the command line.
	 *
	 * @return the exit status.
	 */
	public ToolExitCodes run(String[] args)
	{
		try {
			parseCommandLine(args);
			parseOptionsFile();
			if( !handleUtilityOptions() ) {
				return ToolExitCodes.SUCCESS;
			}
			race_options = GPURaceOptions.fromDriver();
			parseFiles();
			runPasses();
			printProgram();
			if( race_options.diagnose != null ) {
				try( Reader in = new FileReader(race_options.diagnose) ) {
					reported = verifier.diagnose(in, race_options.diagnose, System.err);
				}
				if( reported > 0 ) {
					return ToolExitCodes.VERIFICATION_ERROR;
				}
			}
			return ToolExitCodes.SUCCESS;
		} catch (UserErrorException e) {
			System.err.println("[ERROR] " + e.getMessage());
			return e.getExitCode();
		} catch (ParseException e) {
			System.err.println("[ERROR] " + e.getMessage());
			return ToolExitCodes.COMMAND_LINE_ERROR;
		} catch (IOException e) {
			System.err.println("[ERROR] " + e.getMessage());
			return ToolExitCodes.COMMAND_LINE_ERROR;
		} catch (IllegalStateException e) {
			System.err.println("[INTERNAL ERROR] " + e.getMessage());
			if( PrintTools.getVerbosity() > 1 ) {
				e.printStackTrace();
			}
			return ToolExitCodes.INTERNAL_ERROR;
		}
	}

	/** Number of counterexamples reported by the last run. */
	public int getReportedCount()
	{
		return reported;
	}

	private void printProgram() throws IOException
	{
		PrintTools.println("Printing...", 1);
		if( race_options.outfile == null ) {
			Writer w = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
			program.print(w);
			w.flush();
			return;
		}
		try( Writer w = new OutputStreamWriter(new FileOutputStream(race_options.outfile), StandardCharsets.UTF_8) ) {
			program.print(w);
		}
	}

	/**
	 * Entry point; creates a new driver and calls run on it with args.
	 *
	 * @param args Command line options.
	 */
	public static void main(String[] args)
	{
		ToolExitCodes status = new RaceCheckDriver().run(args);
		Tools.exit(status.getStatus());
	}
}
