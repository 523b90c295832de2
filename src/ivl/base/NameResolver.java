package ivl.base;

import ivl.hir.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds identifiers to variables, function applications to functions, calls
 * to procedures and implementations to their procedures. Runs after parsing
 * and again after every transformation that introduces renamed declarations.
 *
 * <p>Calls to undeclared procedures are left unbound, since the race
 * instrumentation synthesizes some procedures on demand. An unknown variable
 * or function is an error.</p>
 */
public class NameResolver {

    private final Program program;
    private final Map<String, Variable> globals = new HashMap<String, Variable>();
    private final Map<String, Function> functions = new HashMap<String, Function>();
    private final Map<String, Procedure> procedures = new HashMap<String, Procedure>();

    public NameResolver(Program program) {
        this.program = program;
    }

    /** Resolves all names of the program in place. */
    public static void resolve(Program program) {
        new NameResolver(program).run();
    }

    public void run() {
        for (Declaration d : program.getDeclarations()) {
            if (d instanceof GlobalVariable || d instanceof Constant) {
                declare(globals, d.getName(), (Variable)d, d.getPosition());
            } else if (d instanceof Function) {
                declare(functions, d.getName(), (Function)d, d.getPosition());
            } else if (d instanceof Procedure) {
                declare(procedures, d.getName(), (Procedure)d, d.getPosition());
            }
        }
        for (Declaration d : program.getDeclarations()) {
            if (d instanceof Axiom) {
                resolve(d, new HashMap<String, Variable>());
            } else if (d instanceof Function) {
                Map<String, Variable> scope = new HashMap<String, Variable>();
                for (Formal f : ((Function)d).getParameters()) {
                    if (f.getName() != null && !f.getName().isEmpty()) {
                        scope.put(f.getName(), f);
                    }
                }
                resolve(d, scope);
            } else if (d instanceof Procedure) {
                Procedure proc = (Procedure)d;
                Map<String, Variable> scope = new HashMap<String, Variable>();
                addAll(scope, proc.getInParams());
                addAll(scope, proc.getOutParams());
                resolve(proc, scope);
            } else if (d instanceof Implementation) {
                resolveImplementation((Implementation)d);
            }
        }
    }

    private void resolveImplementation(Implementation impl) {
        impl.setProc(procedures.get(impl.getName()));
        Map<String, Variable> scope = new HashMap<String, Variable>();
        addAll(scope, impl.getInParams());
        addAll(scope, impl.getOutParams());
        for (LocalVariable v : impl.getLocals()) {
            if (scope.containsKey(v.getName())) {
                throw new ParseException("duplicate local " + v.getName() + " in " + impl.getName(),
                        v.getPosition());
            }
            scope.put(v.getName(), v);
        }
        for (Block b : impl.getBlocks()) {
            for (Cmd c : b.getCmds()) {
                if (c instanceof CallCmd) {
                    CallCmd call = (CallCmd)c;
                    call.setProc(procedures.get(call.getCallee()));
                }
                resolve(c, scope);
                resolveAttributes(c.getAttributes(), scope);
            }
        }
    }

    /**
     * Binds the expression parameters of command attributes where their
     * names are in scope. Attributes are annotations, so names that do not
     * resolve are left unbound.
     */
    private void resolveAttributes(Attributes attrs, Map<String, Variable> scope) {
        for (Attributes.Entry entry : attrs.getEntries()) {
            for (Object param : entry.getParams()) {
                if (!(param instanceof Expr)) {
                    continue;
                }
                DepthFirstIterator<Traversable> iter = new DepthFirstIterator<Traversable>((Expr)param);
                while (iter.hasNext()) {
                    Traversable o = iter.next();
                    if (o instanceof IdentifierExpr) {
                        IdentifierExpr id = (IdentifierExpr)o;
                        Variable v = scope.containsKey(id.getName()) ? scope.get(id.getName()) : globals.get(id.getName());
                        if (v != null) {
                            id.setDecl(v);
                        }
                    } else if (o instanceof FunctionCallExpr) {
                        FunctionCallExpr call = (FunctionCallExpr)o;
                        if (functions.containsKey(call.getName())) {
                            call.setDecl(functions.get(call.getName()));
                        }
                    }
                }
            }
        }
    }

    private void resolve(Traversable t, Map<String, Variable> scope) {
        DepthFirstIterator<Traversable> iter = new DepthFirstIterator<Traversable>(t);
        while (iter.hasNext()) {
            Traversable o = iter.next();
            if (o instanceof IdentifierExpr) {
                IdentifierExpr id = (IdentifierExpr)o;
                Variable v = scope.get(id.getName());
                if (v == null) {
                    v = globals.get(id.getName());
                }
                if (v == null) {
                    throw new ParseException("undeclared identifier " + id.getName(), id.getPosition());
                }
                id.setDecl(v);
            } else if (o instanceof FunctionCallExpr) {
                FunctionCallExpr call = (FunctionCallExpr)o;
                Function f = functions.get(call.getName());
                if (f == null) {
                    throw new ParseException("undeclared function " + call.getName(), call.getPosition());
                }
                call.setDecl(f);
            }
        }
    }

    private static void addAll(Map<String, Variable> scope, List<? extends Variable> vars) {
        for (Variable v : vars) {
            scope.put(v.getName(), v);
        }
    }

    private static <T> void declare(Map<String, T> map, String name, T decl, Position pos) {
        if (map.put(name, decl) != null) {
            throw new ParseException("duplicate declaration of " + name, pos);
        }
    }
}
