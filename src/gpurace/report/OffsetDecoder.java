package gpurace.report;

import ivl.model.BitVectorElement;
import ivl.model.Element;
import ivl.model.NumberElement;

import java.math.BigInteger;

/**
 * Turns the element offset recorded by race instrumentation back into a
 * source-level array access such as <b>A[1][2] (bytes 4..7)</b>.
 */
public final class OffsetDecoder
{
	private OffsetDecoder()
	{
	}

	/**
	 * Reads a model offset as a two's complement number of the size_t width.
	 *
	 * @return the offset, or null if the element is not a number.
	 */
	public static Long parseOffset(Element e, int size_t_bits)
	{
		BigInteger value;
		if( e instanceof BitVectorElement ) {
			value = ((BitVectorElement)e).asSigned(size_t_bits);
		} else if( e instanceof NumberElement ) {
			value = e.asNumber();
			BigInteger half = BigInteger.ONE.shiftLeft(size_t_bits - 1);
			if( value.compareTo(half) >= 0 ) {
				value = value.subtract(BigInteger.ONE.shiftLeft(size_t_bits));
			}
		} else {
			return null;
		}
		return value.longValue();
	}

	/**
	 * Formats the access at an element offset.
	 *
	 * @param offset offset in units of elem_width.
	 * @param elem_width width in bits of the elements the program accesses.
	 * @param source_elem_width width in bits of the elements of the source array.
	 * @param dims extents of the source dimensions, outermost first.
	 */
	public static String getArrayAccess(long offset, String name, int elem_width, int source_elem_width,
			String[] dims)
	{
		if( elem_width <= 0 || elem_width % 8 != 0 || source_elem_width <= 0 || source_elem_width % 8 != 0 ) {
			throw new IllegalArgumentException("bad element widths " + elem_width + "/" + source_elem_width
					+ " for " + name);
		}
		long el_bytes = elem_width / 8;
		long src_el_bytes = source_elem_width / 8;

		long[] strides = new long[dims.length];
		strides[dims.length - 1] = 1;
		for( int i = dims.length - 2; i >= 0; i-- ) {
			strides[i] = strides[i + 1] * Long.parseLong(dims[i + 1].trim());
		}

		long offset_in_bytes = offset * el_bytes;
		long leftover_bytes = offset_in_bytes % src_el_bytes;

		StringBuilder sb = new StringBuilder(name);
		long remainder = offset_in_bytes / src_el_bytes;
		for( long stride : strides ) {
			if( stride == 0 ) {
				return "0-sized array " + name;
			}
			sb.append("[").append(remainder / stride).append("]");
			remainder %= stride;
		}
		if( el_bytes != src_el_bytes ) {
			if( el_bytes == 1 ) {
				sb.append(" (byte ").append(leftover_bytes).append(")");
			} else {
				sb.append(" (bytes ").append(leftover_bytes).append("..").append(leftover_bytes + el_bytes - 1)
						.append(")");
			}
		}
		return sb.toString();
	}
}
