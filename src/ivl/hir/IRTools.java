package ivl.hir;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Queries and small helpers over the IR. */
public final class IRTools {

    private IRTools() {
    }

    static void printList(StringBuilder sb, List<?> list) {
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            Object o = list.get(i);
            if (o instanceof Expr) {
                ((Expr)o).print(sb);
            } else {
                sb.append(o);
            }
        }
    }

    static void printSignature(StringBuilder sb, List<Formal> ins, List<Formal> outs) {
        sb.append("(");
        for (int i = 0; i < ins.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            ins.get(i).print(sb);
        }
        sb.append(")");
        if (!outs.isEmpty()) {
            sb.append(" returns (");
            for (int i = 0; i < outs.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                outs.get(i).print(sb);
            }
            sb.append(")");
        }
    }

    /** Returns every identifier occurring under t, in pre-order. */
    public static List<IdentifierExpr> getIdentifiers(Traversable t) {
        return new DepthFirstIterator<Traversable>(t).getList(IdentifierExpr.class);
    }

    /** Returns the distinct names of the identifiers occurring under t. */
    public static Set<String> getIdentifierNames(Traversable t) {
        Set<String> ret = new LinkedHashSet<String>();
        for (IdentifierExpr id : getIdentifiers(t)) {
            ret.add(id.getName());
        }
        return ret;
    }

    /** Returns the call commands of the given blocks, in order. */
    public static List<CallCmd> getCallCmds(List<Block> blocks) {
        List<CallCmd> ret = new ArrayList<CallCmd>();
        for (Block b : blocks) {
            for (Cmd c : b.getCmds()) {
                if (c instanceof CallCmd) {
                    ret.add((CallCmd)c);
                }
            }
        }
        return ret;
    }

    public static List<IdentifierExpr> toIdentifiers(List<? extends Variable> vars) {
        List<IdentifierExpr> ret = new ArrayList<IdentifierExpr>(vars.size());
        for (Variable v : vars) {
            ret.add(new IdentifierExpr(v));
        }
        return ret;
    }

    /** Returns the names of the given variables, in order. */
    public static List<String> getNames(List<? extends Variable> vars) {
        List<String> ret = new ArrayList<String>(vars.size());
        for (Variable v : vars) {
            ret.add(v.getName());
        }
        return ret;
    }
}
