package gpurace.transforms;

/** The two symbolic threads of the two-thread reduction. */
public enum ThreadTag
{
	ONE(1),
	TWO(2);

	private final int id;

	ThreadTag(int id)
	{
		this.id = id;
	}

	public int getId()
	{
		return id;
	}

	public ThreadTag other()
	{
		return (this == ONE) ? TWO : ONE;
	}

	public static ThreadTag fromId(int id)
	{
		if( id == 1 ) {
			return ONE;
		} else if( id == 2 ) {
			return TWO;
		}
		throw new IllegalStateException("[ERROR in ThreadTag] no thread " + id);
	}
}
