package ivl.transforms;

import ivl.base.NameResolver;
import ivl.base.ParseException;
import ivl.hir.PrintTools;
import ivl.hir.Program;

/**
 * Base class of all transformation passes. For consistency, all passes
 * should be run through {@link #run}, which times the pass and re-resolves
 * the names of the transformed program.
 */
public abstract class TransformPass {

    /** The associated program */
    protected Program program;

    /** Verbosity level at which the pass reports its begin and end */
    protected int verbosity = 1;

    /** Constructs a transform pass with the given program */
    protected TransformPass(Program program) {
        this.program = program;
    }

    /** Returns the name of the transform pass */
    public abstract String getPassName();

    /**
    * Invokes the specified transform pass.
    * @param pass the transform pass that is to be run.
    */
    public static void run(TransformPass pass) {
        long timer = System.nanoTime();
        PrintTools.println(pass.getPassName() + " begin", pass.verbosity);
        pass.start();
        PrintTools.println(pass.getPassName() + " end in "
                + String.format("%.2f seconds", (System.nanoTime() - timer) / 1e9), pass.verbosity);
        try {
            NameResolver.resolve(pass.program);
        } catch (ParseException e) {
            throw new IllegalStateException("[ERROR in TransformPass] inconsistent IR after "
                    + pass.getPassName() + ": " + e.getMessage(), e);
        }
    }

    /** Starts a transform pass */
    public abstract void start();
}
