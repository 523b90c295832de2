package gpurace.exec;

import gpurace.transforms.RaceCheckingMethod;
import ivl.exec.Driver;

/**
 * The settings that steer the transformation and the diagnosis. Instances
 * are normally built from the command line with {@link #fromDriver()};
 * tests set the fields directly.
 */
public class GPURaceOptions
{
	public RaceCheckingMethod race_checking = RaceCheckingMethod.ORIGINAL;
	public boolean no_benign = false;
	public boolean asymmetric_asserts = false;
	public boolean only_intra_group = false;
	public boolean barrier_access_checks = false;
	public boolean no_uniformity_analysis = false;
	public boolean show_uniformity_analysis = false;
	/** Unroll factor, 0 for no unrolling. */
	public int loop_unroll = 0;
	public String outfile = null;
	public String diagnose = null;
	public String original_program = null;
	public String source_loc_file = null;
	/** True for CUDA sources, false for OpenCL. */
	public boolean cuda = false;
	public int block_highest_dim = 2;
	public int grid_highest_dim = 2;

	/**
	 * Reads the options registered by {@link RaceCheckDriver}.
	 *
	 * @throws UserErrorException with {@link ToolExitCodes#COMMAND_LINE_ERROR}
	 *         if a value is malformed.
	 */
	public static GPURaceOptions fromDriver()
	{
		GPURaceOptions o = new GPURaceOptions();
		String value = Driver.getOptionValue("raceChecking");
		if( value != null ) {
			try {
				o.race_checking = RaceCheckingMethod.valueOf(value.toUpperCase());
			} catch (IllegalArgumentException e) {
				throw new UserErrorException("unknown race checking method " + value
						+ " (expected ORIGINAL, WATCHDOG or NONE)", ToolExitCodes.COMMAND_LINE_ERROR);
			}
		}
		o.no_benign = isSet("noBenign");
		o.asymmetric_asserts = isSet("asymmetricAsserts");
		o.only_intra_group = isSet("onlyIntraGroupRaceChecking");
		o.barrier_access_checks = isSet("barrierAccessChecks");
		o.no_uniformity_analysis = isSet("noUniformityAnalysis");
		o.show_uniformity_analysis = isSet("showUniformityAnalysis");
		o.loop_unroll = intValue("loopUnroll", 0);
		o.outfile = Driver.getOptionValue("outfile");
		o.diagnose = Driver.getOptionValue("diagnose");
		o.original_program = Driver.getOptionValue("originalProgram");
		o.source_loc_file = Driver.getOptionValue("sourceLocFile");
		value = Driver.getOptionValue("sourceLanguage");
		if( value != null ) {
			if( value.equals("cu") ) {
				o.cuda = true;
			} else if( !value.equals("cl") ) {
				throw new UserErrorException("unknown source language " + value + " (expected cl or cu)",
						ToolExitCodes.COMMAND_LINE_ERROR);
			}
		}
		o.block_highest_dim = intValue("blockHighestDim", 2);
		o.grid_highest_dim = intValue("gridHighestDim", 2);
		if( o.block_highest_dim > 2 || o.grid_highest_dim > 2 ) {
			throw new UserErrorException("dimension limits must be 0, 1 or 2", ToolExitCodes.COMMAND_LINE_ERROR);
		}
		return o;
	}

	private static boolean isSet(String name)
	{
		String value = Driver.getOptionValue(name);
		return value != null && !value.equals("0");
	}

	private static int intValue(String name, int dflt)
	{
		String value = Driver.getOptionValue(name);
		if( value == null ) {
			return dflt;
		}
		try {
			int ret = Integer.parseInt(value);
			if( ret < 0 ) {
				throw new UserErrorException("-" + name + " expects a non-negative integer, found " + value,
						ToolExitCodes.COMMAND_LINE_ERROR);
			}
			return ret;
		} catch (NumberFormatException e) {
			throw new UserErrorException("-" + name + " expects an integer, found " + value,
					ToolExitCodes.COMMAND_LINE_ERROR);
		}
	}
}
