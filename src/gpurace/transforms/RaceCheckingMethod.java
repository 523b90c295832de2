package gpurace.transforms;

/** Selects the race instrumentation strategy. */
public enum RaceCheckingMethod
{
	/** One shadow slot per array, chosen nondeterministically at each access. */
	ORIGINAL,
	/** Shadow state tracks a single watched offset per array. */
	WATCHDOG,
	/** No race checking. */
	NONE
}
