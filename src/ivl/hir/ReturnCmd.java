package ivl.hir;

public class ReturnCmd extends TransferCmd {

    @Override
    public ReturnCmd clone() {
        ReturnCmd r = new ReturnCmd();
        r.setPosition(getPosition());
        return r;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("return;");
    }
}
