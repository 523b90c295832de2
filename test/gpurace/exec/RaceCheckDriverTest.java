package gpurace.exec;

import gpurace.KernelFixtures;
import gpurace.report.RaceKind;
import ivl.base.ProgramParser;
import ivl.hir.Procedure;
import ivl.hir.Program;
import ivl.hir.Requires;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class RaceCheckDriverTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File input;
	private File output;

	@Before
	public void setUp() throws IOException
	{
		KernelFixtures.writeSources(folder.getRoot(), 3);
		input = KernelFixtures.writeFile(new File(folder.getRoot(), "kernel.gbpl"), KernelFixtures.RACE_KERNEL);
		output = new File(folder.getRoot(), "out.gbpl");
	}

	private String outfile()
	{
		return "-outfile=" + output.getPath();
	}

	@Test
	public void writesTransformedProgram() throws IOException
	{
		RaceCheckDriver driver = new RaceCheckDriver();
		assertThat(driver.run(new String[] { outfile(), input.getPath() }), is(ToolExitCodes.SUCCESS));
		assertTrue(output.isFile());
		Program printed = ProgramParser.parseFile(output);
		assertNotNull(printed.getProcedure("_CHECK_WRITE_$$A"));
		assertNotNull(printed.getTopLevelVariable("local_id_x$2"));
		assertThat(driver.getReportedCount(), is(0));
	}

	@Test
	public void optionsReachTheTransformation() throws IOException
	{
		RaceCheckDriver driver = new RaceCheckDriver();
		ToolExitCodes status = driver.run(new String[] { "-raceChecking=watchdog", "-noBenign", outfile(),
				input.getPath() });
		assertThat(status, is(ToolExitCodes.SUCCESS));
		Program printed = ProgramParser.parseFile(output);
		assertNotNull(printed.getTopLevelVariable("_TRACKING$1"));
		assertNull(printed.getTopLevelVariable("_WRITE_VALUE_$$A"));
	}

	@Test
	public void missingSizeTypeIsAModelingError() throws IOException
	{
		String kernel = KernelFixtures.RACE_KERNEL.replace("type _SIZE_T_TYPE = bv32;\n", "");
		KernelFixtures.writeFile(input, kernel);
		assertThat(new RaceCheckDriver().run(new String[] { outfile(), input.getPath() }),
				is(ToolExitCodes.OTHER_ERROR));
	}

	@Test
	public void commandLineErrors()
	{
		assertThat(new RaceCheckDriver().run(new String[] { "-noSuchOption", input.getPath() }),
				is(ToolExitCodes.COMMAND_LINE_ERROR));
		assertThat(new RaceCheckDriver().run(new String[] { "-raceChecking=eager", input.getPath() }),
				is(ToolExitCodes.COMMAND_LINE_ERROR));
		assertThat(new RaceCheckDriver().run(new String[] { "-loopUnroll=two", input.getPath() }),
				is(ToolExitCodes.COMMAND_LINE_ERROR));
		assertThat(new RaceCheckDriver().run(new String[] { outfile() }), is(ToolExitCodes.COMMAND_LINE_ERROR));
		assertThat(new RaceCheckDriver().run(new String[] { outfile(), new File(folder.getRoot(), "none.gbpl").getPath() }),
				is(ToolExitCodes.COMMAND_LINE_ERROR));
	}

	@Test
	public void versionStopsEarly()
	{
		assertThat(new RaceCheckDriver().run(new String[] { "-version" }), is(ToolExitCodes.SUCCESS));
		assertFalse(output.exists());
	}

	@Test
	public void optionsFileIsRead() throws IOException
	{
		File cfg = KernelFixtures.writeFile(new File(folder.getRoot(), "options.cfg"),
				"# race checking\n-raceChecking=NONE\n\n" + outfile() + "\n");
		assertThat(new RaceCheckDriver().run(new String[] { "-optionsFile=" + cfg.getPath(), input.getPath() }),
				is(ToolExitCodes.SUCCESS));
		Program printed = ProgramParser.parseFile(output);
		assertNull(printed.getTopLevelVariable("_WRITE_HAS_OCCURRED_$$A$1"));
	}

	@Test
	public void diagnosedRaceIsAVerificationError() throws IOException
	{
		RaceCheckDriver first = new RaceCheckDriver();
		assertThat(first.run(new String[] { outfile(), input.getPath() }), is(ToolExitCodes.SUCCESS));
		Program program = first.getProgram();
		String call = KernelFixtures.findCheckCall(program.getImplementation("race"), "_CHECK_WRITE_$$A",
				"check_state_1");
		Procedure check = program.getProcedure("_CHECK_WRITE_$$A");
		List<Requires> requires = check.getRequires();
		int index = -1;
		for( int i = 0; i < requires.size(); i++ ) {
			if( RaceKind.classify(requires.get(i).getAttributes()) == RaceKind.WRITE_WRITE ) {
				index = i;
			}
		}
		String state = "_WRITE_HAS_OCCURRED_$$A$1 -> true\n_WRITE_OFFSET_$$A$1 -> 5bv32\n";
		File cex = KernelFixtures.writeFile(new File(folder.getRoot(), "kernel.cex"),
				"*** COUNTEREXAMPLE\n"
				+ "implementation race\n"
				+ "failure call " + call + " requires " + index + "\n"
				+ "trace entry\n"
				+ "*** MODEL\n"
				+ "local_id_x$1 -> 5bv32\n"
				+ "local_id_x$2 -> 4bv32\n"
				+ "*** STATE check_state_0\n" + state + "*** END_STATE\n"
				+ "*** STATE check_state_1\n" + state + "*** END_STATE\n"
				+ "*** END_MODEL\n");

		RaceCheckDriver second = new RaceCheckDriver();
		ToolExitCodes status = second.run(new String[] { outfile(), "-diagnose=" + cex.getPath(), input.getPath() });
		assertThat(status, is(ToolExitCodes.VERIFICATION_ERROR));
		assertThat(second.getReportedCount(), is(1));
	}

	@Test
	public void emptyCounterexampleFileMeansSuccess() throws IOException
	{
		File cex = KernelFixtures.writeFile(new File(folder.getRoot(), "kernel.cex"), "");
		assertThat(new RaceCheckDriver().run(new String[] { outfile(), "-diagnose=" + cex.getPath(), input.getPath() }),
				is(ToolExitCodes.SUCCESS));
	}

	@Test
	public void malformedCounterexampleIsReported() throws IOException
	{
		File cex = KernelFixtures.writeFile(new File(folder.getRoot(), "kernel.cex"),
				"*** COUNTEREXAMPLE\nimplementation nowhere\n");
		assertThat(new RaceCheckDriver().run(new String[] { outfile(), "-diagnose=" + cex.getPath(), input.getPath() }),
				is(ToolExitCodes.COMMAND_LINE_ERROR));
		assertThat(new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8), containsString("_LOG_WRITE_$$A"));
	}
}
