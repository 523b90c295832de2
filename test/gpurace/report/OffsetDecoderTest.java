package gpurace.report;

import ivl.model.BitVectorElement;
import ivl.model.BooleanElement;
import ivl.model.NumberElement;

import java.math.BigInteger;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class OffsetDecoderTest
{
	@Test
	public void decodesRowMajorIndices()
	{
		String[] dims = { "4", "4" };
		assertThat(OffsetDecoder.getArrayAccess(5, "A", 32, 32, dims), is("A[1][1]"));
		assertThat(OffsetDecoder.getArrayAccess(15, "A", 32, 32, dims), is("A[3][3]"));
		assertThat(OffsetDecoder.getArrayAccess(7, "B", 32, 32, new String[] { "*" }), is("B[7]"));
	}

	@Test
	public void toleratesSpacesInDimensions()
	{
		String[] dims = { "*", " 8", " 2" };
		assertThat(OffsetDecoder.getArrayAccess(19, "C", 32, 32, dims), is("C[1][1][1]"));
	}

	@Test
	public void reportsByteWithinWiderSourceElement()
	{
		String[] dims = { "*" };
		assertThat(OffsetDecoder.getArrayAccess(5, "A", 8, 32, dims), is("A[1] (byte 1)"));
		assertThat(OffsetDecoder.getArrayAccess(3, "A", 16, 32, dims), is("A[1] (bytes 2..3)"));
	}

	@Test
	public void zeroSizedDimension()
	{
		String[] dims = { "*", "0" };
		assertThat(OffsetDecoder.getArrayAccess(3, "Z", 32, 32, dims), is("0-sized array Z"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsWidthThatIsNotWholeBytes()
	{
		OffsetDecoder.getArrayAccess(0, "A", 12, 32, new String[] { "*" });
	}

	@Test
	public void offsetsAreSignedInSizeT()
	{
		assertThat(OffsetDecoder.parseOffset(new BitVectorElement(BigInteger.valueOf(5), 32), 32), is(5L));
		assertThat(OffsetDecoder.parseOffset(new BitVectorElement(new BigInteger("4294967295"), 32), 32),
				is(-1L));
		assertThat(OffsetDecoder.parseOffset(new NumberElement(BigInteger.valueOf(65534)), 16), is(-2L));
		assertThat(OffsetDecoder.parseOffset(new NumberElement(BigInteger.valueOf(12)), 64), is(12L));
		assertNull(OffsetDecoder.parseOffset(new BooleanElement(true), 32));
	}
}
