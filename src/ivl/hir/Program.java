package ivl.hir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Root of the IR: an ordered list of top-level declarations. Transformations
 * append to and replace this list; lookups are by name.
 */
public class Program implements Traversable {

    private List<Declaration> declarations;

    public Program() {
        declarations = new ArrayList<Declaration>();
    }

    public Program(List<Declaration> declarations) {
        this.declarations = new ArrayList<Declaration>(declarations);
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    public void setDeclarations(List<Declaration> declarations) {
        this.declarations = new ArrayList<Declaration>(declarations);
    }

    public void addDeclaration(Declaration d) {
        declarations.add(d);
    }

    public void addDeclarations(List<? extends Declaration> ds) {
        declarations.addAll(ds);
    }

    public void removeDeclaration(Declaration d) {
        declarations.remove(d);
    }

    @Override
    public List<Declaration> getChildren() {
        return declarations;
    }

    /** Returns all declarations of the given kind, in program order. */
    public <T extends Declaration> List<T> getDeclarations(Class<T> c) {
        List<T> ret = new ArrayList<T>();
        for (Declaration d : declarations) {
            if (c.isInstance(d)) {
                ret.add(c.cast(d));
            }
        }
        return ret;
    }

    public List<Procedure> getProcedures() {
        return getDeclarations(Procedure.class);
    }

    public List<Implementation> getImplementations() {
        return getDeclarations(Implementation.class);
    }

    /** Returns mutable globals and constants. */
    public List<Variable> getTopLevelVariables() {
        List<Variable> ret = new ArrayList<Variable>();
        for (Declaration d : declarations) {
            if (d instanceof GlobalVariable || d instanceof Constant) {
                ret.add((Variable)d);
            }
        }
        return ret;
    }

    public Procedure getProcedure(String name) {
        return find(Procedure.class, name);
    }

    public Implementation getImplementation(String name) {
        return find(Implementation.class, name);
    }

    public Function getFunction(String name) {
        return find(Function.class, name);
    }

    /** Returns the global variable or constant with the given name, or null. */
    public Variable getTopLevelVariable(String name) {
        for (Declaration d : declarations) {
            if ((d instanceof GlobalVariable || d instanceof Constant) && name.equals(d.getName())) {
                return (Variable)d;
            }
        }
        return null;
    }

    private <T extends Declaration> T find(Class<T> c, String name) {
        for (Declaration d : declarations) {
            if (c.isInstance(d) && name.equals(d.getName())) {
                return c.cast(d);
            }
        }
        return null;
    }

    /** Prints the whole program in IVL syntax. */
    public void print(Writer w) throws IOException {
        PrintWriter out = new PrintWriter(w);
        String sep = PrintTools.line_sep;
        for (Declaration d : declarations) {
            StringBuilder sb = new StringBuilder();
            d.print(sb);
            out.print(sb);
            out.print(sep);
            if (d instanceof Procedure || d instanceof Implementation) {
                out.print(sep);
            }
        }
        out.flush();
        if (out.checkError()) {
            throw new IOException("error writing program");
        }
    }

    @Override
    public String toString() {
        java.io.StringWriter sw = new java.io.StringWriter();
        try {
            print(sw);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return sw.toString();
    }
}
