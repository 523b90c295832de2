package ivl.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** <b>call {:attrs} o1, ..., om := p(e1, ..., en);</b> */
public class CallCmd extends Cmd {

    private final String callee;
    private final List<Expr> ins;
    private final List<IdentifierExpr> outs;
    private Procedure proc;

    public CallCmd(String callee, List<Expr> ins, List<IdentifierExpr> outs, Attributes attributes) {
        super(attributes);
        this.callee = callee;
        this.ins = new ArrayList<Expr>(ins);
        this.outs = new ArrayList<IdentifierExpr>(outs);
    }

    public String getCallee() {
        return callee;
    }

    public List<Expr> getIns() {
        return Collections.unmodifiableList(ins);
    }

    public List<IdentifierExpr> getOuts() {
        return Collections.unmodifiableList(outs);
    }

    /** Returns the called procedure, bound by name resolution. */
    public Procedure getProc() {
        return proc;
    }

    public void setProc(Procedure proc) {
        this.proc = proc;
    }

    @Override
    public List<Expr> getChildren() {
        List<Expr> ret = new ArrayList<Expr>(ins);
        ret.addAll(outs);
        return ret;
    }

    @Override
    public CallCmd clone() {
        List<Expr> i = new ArrayList<Expr>(ins.size());
        for (Expr e : ins) {
            i.add(e.clone());
        }
        List<IdentifierExpr> o = new ArrayList<IdentifierExpr>(outs.size());
        for (IdentifierExpr e : outs) {
            o.add(e.clone());
        }
        CallCmd c = new CallCmd(callee, i, o, getAttributes().clone());
        c.setProc(proc);
        return finishClone(c);
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("call ").append(getAttributes());
        if (!outs.isEmpty()) {
            IRTools.printList(sb, outs);
            sb.append(" := ");
        }
        sb.append(callee).append("(");
        IRTools.printList(sb, ins);
        sb.append(");");
    }
}
