package ivl.hir;

import java.util.ArrayList;
import java.util.List;

/**
 * The body of a procedure. Parameters are declared again, as in Boogie, so
 * that an implementation may rename them.
 */
public class Implementation extends Declaration {

    private final String name;
    private List<Formal> in_params;
    private List<Formal> out_params;
    private List<LocalVariable> locals;
    private List<Block> blocks;
    private Procedure proc;

    public Implementation(String name, List<Formal> in_params, List<Formal> out_params,
            List<LocalVariable> locals, List<Block> blocks, Attributes attributes) {
        super(attributes);
        this.name = name;
        this.in_params = new ArrayList<Formal>(in_params);
        this.out_params = new ArrayList<Formal>(out_params);
        this.locals = new ArrayList<LocalVariable>(locals);
        this.blocks = new ArrayList<Block>(blocks);
    }

    @Override
    public String getName() {
        return name;
    }

    public List<Formal> getInParams() {
        return in_params;
    }

    public void setInParams(List<Formal> in_params) {
        this.in_params = new ArrayList<Formal>(in_params);
    }

    public List<Formal> getOutParams() {
        return out_params;
    }

    public void setOutParams(List<Formal> out_params) {
        this.out_params = new ArrayList<Formal>(out_params);
    }

    public List<LocalVariable> getLocals() {
        return locals;
    }

    public void setLocals(List<LocalVariable> locals) {
        this.locals = new ArrayList<LocalVariable>(locals);
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    public void setBlocks(List<Block> blocks) {
        this.blocks = new ArrayList<Block>(blocks);
    }

    /** Returns the block with the given label, or null. */
    public Block getBlock(String label) {
        for (Block b : blocks) {
            if (b.getLabel().equals(label)) {
                return b;
            }
        }
        return null;
    }

    public Procedure getProc() {
        return proc;
    }

    public void setProc(Procedure proc) {
        this.proc = proc;
    }

    @Override
    public List<Block> getChildren() {
        return blocks;
    }

    @Override
    public void print(StringBuilder sb) {
        String sep = PrintTools.line_sep;
        sb.append("implementation ").append(getAttributes()).append(name);
        IRTools.printSignature(sb, in_params, out_params);
        sb.append(sep).append("{").append(sep);
        for (LocalVariable v : locals) {
            sb.append("  ");
            v.print(sb);
            sb.append(sep);
        }
        if (!locals.isEmpty()) {
            sb.append(sep);
        }
        for (Block b : blocks) {
            b.print(sb);
        }
        sb.append("}");
    }
}
