package ivl.hir;

import java.util.ArrayList;
import java.util.List;

/** A labelled basic block: a command list ending in a transfer command. */
public class Block implements Traversable {

    private final String label;
    private List<Cmd> cmds;
    private TransferCmd transfer;

    public Block(String label, List<Cmd> cmds, TransferCmd transfer) {
        this.label = label;
        this.cmds = new ArrayList<Cmd>(cmds);
        this.transfer = transfer;
    }

    public String getLabel() {
        return label;
    }

    public List<Cmd> getCmds() {
        return cmds;
    }

    public void setCmds(List<Cmd> cmds) {
        this.cmds = new ArrayList<Cmd>(cmds);
    }

    public TransferCmd getTransfer() {
        return transfer;
    }

    public void setTransfer(TransferCmd transfer) {
        this.transfer = transfer;
    }

    /** Returns the labels this block may jump to. */
    public List<String> getSuccessorLabels() {
        if (transfer instanceof GotoCmd) {
            return ((GotoCmd)transfer).getTargets();
        }
        return new ArrayList<String>();
    }

    @Override
    public List<Cmd> getChildren() {
        return cmds;
    }

    public void print(StringBuilder sb) {
        String sep = PrintTools.line_sep;
        sb.append("  ").append(label).append(":").append(sep);
        for (Cmd c : cmds) {
            sb.append("    ");
            c.print(sb);
            sb.append(sep);
        }
        sb.append("    ");
        transfer.print(sb);
        sb.append(sep);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }
}
