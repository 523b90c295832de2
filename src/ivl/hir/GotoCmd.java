package ivl.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Non-deterministic jump to one of the target blocks. */
public class GotoCmd extends TransferCmd {

    private final List<String> targets;

    public GotoCmd(List<String> targets) {
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("[ERROR in GotoCmd] goto without targets");
        }
        this.targets = new ArrayList<String>(targets);
    }

    public List<String> getTargets() {
        return Collections.unmodifiableList(targets);
    }

    @Override
    public GotoCmd clone() {
        GotoCmd g = new GotoCmd(targets);
        g.setPosition(getPosition());
        return g;
    }

    @Override
    public void print(StringBuilder sb) {
        sb.append("goto ");
        for (int i = 0; i < targets.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(targets.get(i));
        }
        sb.append(";");
    }
}
