package gpurace.report;

import gpurace.hir.AccessType;
import ivl.hir.Attributes;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class RaceKindTest
{
	@Test
	public void classifiesRequiresAttributes()
	{
		Attributes attrs = new Attributes().add("race").add("read_write").add("array", "$$A");
		assertThat(RaceKind.classify(attrs), is(RaceKind.READ_WRITE));
		assertThat(RaceKind.classify(new Attributes().add("write_atomic")), is(RaceKind.WRITE_ATOMIC));
		assertNull(RaceKind.classify(new Attributes().add("race")));
	}

	@Test
	public void accessesAreOrderedFirstThreadFirst()
	{
		assertThat(RaceKind.ATOMIC_READ.getFirstAccess(), is(AccessType.ATOMIC));
		assertThat(RaceKind.ATOMIC_READ.getSecondAccess(), is(AccessType.READ));
		assertThat(RaceKind.WRITE_READ.getDisplayName(), is("write-read"));
		assertThat(RaceKind.WRITE_READ.getAttribute(), is("write_read"));
	}
}
