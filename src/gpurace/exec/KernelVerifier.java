package gpurace.exec;

import gpurace.analysis.UniformityAnalyser;
import gpurace.hir.KernelIdentifiers;
import gpurace.hir.SourceLocationTable;
import gpurace.report.ErrorReporter;
import gpurace.transforms.*;
import ivl.base.NameResolver;
import ivl.base.ProgramParser;
import ivl.hir.Cmd;
import ivl.hir.Implementation;
import ivl.hir.PrintTools;
import ivl.hir.Program;
import ivl.model.Counterexample;
import ivl.model.CounterexampleReader;
import ivl.transforms.LoopUnroller;
import ivl.transforms.TransformPass;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.util.List;

/**
 * Runs the two-thread reduction on a kernel program and, on request,
 * explains the counterexamples the solver found for the result. The
 * passes run in this order:
 * <ol>
 * <li>constant memory checks;</li>
 * <li>race-checking declarations, barrier bodies and kernel preconditions;</li>
 * <li>thread identity preconditions;</li>
 * <li>state capture points;</li>
 * <li>uniformity analysis;</li>
 * <li>dualisation;</li>
 * <li>optional loop unrolling;</li>
 * <li>state id fixing.</li>
 * </ol>
 */
public class KernelVerifier
{
	private static final String pass_name = "[KernelVerifier]";

	private final Program program;
	private final GPURaceOptions options;
	private final String input_file;

	/**
	 * The dualised program before unrolling; diagnosis maps loops and calls
	 * through it. Parsed back from the printed program, its commands carry
	 * the positions of the input file.
	 */
	private Program original_program;
	private boolean transformed = false;

	public KernelVerifier(Program program, GPURaceOptions options, String input_file)
	{
		this.program = program;
		this.options = options;
		this.input_file = input_file;
	}

	public Program getProgram()
	{
		return program;
	}

	public Program getOriginalProgram()
	{
		return original_program;
	}

	/**
	 * Transforms the program in place.
	 *
	 * @throws UserErrorException for modeling errors in the input.
	 */
	public Program transform()
	{
		if( transformed ) {
			throw new IllegalStateException("[ERROR in KernelVerifier] the program has already been transformed");
		}
		transformed = true;
		KernelIdentifiers.getSizeTBits(program);

		TransformPass.run(new ConstantWriteInstrumenter(program));

		RaceInstrumenter instrumenter = makeRaceInstrumenter(program, options);
		instrumenter.addRaceCheckingDeclarations();
		instrumenter.addBarrierImplementation();
		instrumenter.addKernelPrecondition();
		TransformPass.run(new KernelThreadPreconditions(program, options));
		instrumenter.addCaptureStates();
		PrintTools.println(pass_name + " instrumented for " + options.race_checking + " race checking", 1);

		NameResolver.resolve(program);
		UniformityAnalyser uniformity = new UniformityAnalyser(program, options.only_intra_group,
				options.no_uniformity_analysis);
		uniformity.analyse();
		if( options.show_uniformity_analysis ) {
			uniformity.dump();
		}

		TransformPass.run(new KernelDualiser(program, uniformity, instrumenter, options));

		if( options.original_program != null ) {
			try {
				original_program = ProgramParser.parseFile(new File(options.original_program));
			} catch (IOException e) {
				throw new UserErrorException("could not read " + options.original_program + ": " + e.getMessage(),
						ToolExitCodes.COMMAND_LINE_ERROR);
			}
		} else {
			original_program = ProgramParser.parse(program.toString(), input_file);
			copyPositions(program, original_program);
		}

		if( options.loop_unroll > 0 ) {
			TransformPass.run(new LoopUnroller(program, options.loop_unroll));
		}
		new StateIdFixer(program, new StateIdFixer.Context()).fix();
		return program;
	}

	/**
	 * Gives the commands of a program parsed from the printed form of
	 * another the positions of their counterparts, so that positions point
	 * into the input file rather than into the printed text.
	 */
	private static void copyPositions(Program from, Program to)
	{
		for( Implementation impl : from.getImplementations() ) {
			Implementation copy = to.getImplementation(impl.getName());
			if( copy == null || copy.getBlocks().size() != impl.getBlocks().size() ) {
				throw new IllegalStateException("[ERROR in KernelVerifier] printed form of " + impl.getName()
						+ " does not parse back to the same blocks");
			}
			for( int i = 0; i < impl.getBlocks().size(); i++ ) {
				List<Cmd> cmds = impl.getBlocks().get(i).getCmds();
				List<Cmd> copied = copy.getBlocks().get(i).getCmds();
				if( cmds.size() != copied.size() ) {
					throw new IllegalStateException("[ERROR in KernelVerifier] printed form of block "
							+ impl.getBlocks().get(i).getLabel() + " of " + impl.getName()
							+ " does not parse back to the same commands");
				}
				for( int j = 0; j < cmds.size(); j++ ) {
					copied.get(j).setPosition(cmds.get(j).getPosition());
				}
			}
		}
	}

	/** Returns the instrumenter for the selected race checking method. */
	public static RaceInstrumenter makeRaceInstrumenter(Program program, GPURaceOptions options)
	{
		switch( options.race_checking ) {
		case WATCHDOG:
			return new WatchdogRaceInstrumenter(program, options);
		case NONE:
			return new NullRaceInstrumenter(program, options);
		default:
			return new OriginalRaceInstrumenter(program, options);
		}
	}

	/** The source location side table: -sourceLocFile, or the .loc file next to the input. */
	public SourceLocationTable getSourceLocations()
	{
		if( options.source_loc_file != null ) {
			return new SourceLocationTable(new File(options.source_loc_file));
		}
		return SourceLocationTable.forProgram(input_file);
	}

	/**
	 * Reads the counterexamples of the transformed program and reports each
	 * of them.
	 *
	 * @return the number of counterexamples reported.
	 * @throws ivl.base.ParseException if the counterexamples are malformed
	 *         or refer to code that does not exist.
	 */
	public int diagnose(Reader counterexamples, String file_name, PrintStream out) throws IOException
	{
		if( !transformed ) {
			throw new IllegalStateException("[ERROR in KernelVerifier] diagnosis requires a transformed program");
		}
		List<Counterexample> cexs = new CounterexampleReader(program, file_name).read(counterexamples);
		ErrorReporter reporter = new ErrorReporter(program, original_program, getSourceLocations(), options, out);
		for( Counterexample cex : cexs ) {
			reporter.report(cex);
		}
		PrintTools.println(pass_name + " reported " + reporter.getReportedCount() + " counterexample(s)", 1);
		return reporter.getReportedCount();
	}
}
