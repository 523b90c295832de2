package gpurace.report;

import gpurace.exec.GPURaceOptions;
import ivl.model.BitVectorElement;
import ivl.model.CapturedState;
import ivl.model.Element;
import ivl.model.Model;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;

public class ThreadDetailsTest
{
	private Map<String, Element> values;
	private GPURaceOptions options;

	@Before
	public void setUp()
	{
		values = new HashMap<String, Element>();
		put("local_id_x$1", 3);
		put("local_id_y$1", 1);
		put("local_id_z$1", 0);
		put("group_id_x$1", 2);
		put("group_id_y$1", 0);
		put("group_id_z$1", 0);
		put("group_size_x", 8);
		put("group_size_y", 4);
		put("group_size_z", 1);
		options = new GPURaceOptions();
	}

	private void put(String name, long v)
	{
		values.put(name, new BitVectorElement(BigInteger.valueOf(v), 32));
	}

	private ThreadDetails details()
	{
		return new ThreadDetails(new Model(values, new ArrayList<CapturedState>()), options);
	}

	@Test
	public void openClThreeDimensions()
	{
		assertThat(details().describe(1, true),
				is("work item (19, 1, 0) with local id (3, 1, 0) in work group (2, 0, 0)"));
		assertThat(details().describe(1, false),
				is("work item (19,1,0) with local id (3,1,0) in work group (2,0,0)"));
	}

	@Test
	public void cudaFirstDimensionOnly()
	{
		options.cuda = true;
		options.block_highest_dim = 0;
		options.grid_highest_dim = 0;
		assertThat(details().describe(1, true), is("thread 3 in thread block 2 (global id 19)"));
	}

	@Test
	public void missingValuesAreShownAsUnknown()
	{
		options.block_highest_dim = 0;
		options.grid_highest_dim = 0;
		assertThat(details().describe(2, true), is("work item ? with local id ? in work group ?"));
	}

	@Test
	public void intraGroupUsesSharedGroupId()
	{
		options.only_intra_group = true;
		options.block_highest_dim = 0;
		options.grid_highest_dim = 0;
		put("group_id_x", 5);
		assertThat(details().describe(1, true), is("work item 43 with local id 3 in work group 5"));
	}
}
