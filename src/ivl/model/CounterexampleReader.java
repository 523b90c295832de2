package ivl.model;

import ivl.base.ParseException;
import ivl.hir.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the counterexample file produced by the solver and binds every
 * counterexample to the program that was verified. The file is a sequence
 * of sections of the form:
 * <pre>
 * *** COUNTEREXAMPLE
 * implementation IMPL
 * failure call BLOCK CMD_INDEX requires REQUIRES_INDEX
 * failure return BLOCK ensures ENSURES_INDEX
 * failure assert BLOCK CMD_INDEX [loop_entry|loop_maintained]
 * trace BLOCK BLOCK ...
 * *** MODEL
 * name -> value
 * *** STATE label
 * name -> value
 * *** END_STATE
 * *** END_MODEL
 * </pre>
 * Exactly one failure line is expected per section. Blank lines and lines
 * starting with <b>#</b> are ignored.
 */
public class CounterexampleReader {

    private final Program program;
    private final String file_name;
    private int line_number;

    // state of the section being read
    private Implementation impl;
    private String[] failure;
    private int failure_line;
    private List<String> trace;

    public CounterexampleReader(Program program, String file_name) {
        this.program = program;
        this.file_name = file_name;
    }

    /**
     * Reads all counterexamples of the given input.
     *
     * @throws ParseException if the input is malformed or refers to code
     *         that does not exist in the program.
     */
    public List<Counterexample> read(Reader input) throws IOException {
        List<Counterexample> ret = new ArrayList<Counterexample>();
        BufferedReader br = new BufferedReader(input);
        line_number = 0;
        String line = next(br);
        while (line != null) {
            if (!line.equals("*** COUNTEREXAMPLE")) {
                throw error("expected *** COUNTEREXAMPLE, found " + line);
            }
            impl = null;
            failure = null;
            trace = new ArrayList<String>();
            Model model = null;
            while ((line = next(br)) != null && !line.equals("*** COUNTEREXAMPLE")) {
                String[] tokens = line.split("\\s+");
                if (tokens[0].equals("implementation") && tokens.length == 2) {
                    impl = program.getImplementation(tokens[1]);
                    if (impl == null) {
                        throw error("unknown implementation " + tokens[1]);
                    }
                } else if (tokens[0].equals("failure")) {
                    if (failure != null) {
                        throw error("more than one failure in a counterexample");
                    }
                    failure = tokens;
                    failure_line = line_number;
                } else if (tokens[0].equals("trace")) {
                    for (int i = 1; i < tokens.length; i++) {
                        trace.add(tokens[i]);
                    }
                } else if (line.equals("*** MODEL")) {
                    model = readModel(br);
                } else {
                    throw error("unexpected line " + line);
                }
            }
            if (impl == null || failure == null) {
                throw error("counterexample without implementation or failure");
            }
            ret.add(build(model == null ? new Model(new LinkedHashMap<String, Element>(),
                    new ArrayList<CapturedState>()) : model));
        }
        return ret;
    }

    private Model readModel(BufferedReader br) throws IOException {
        Map<String, Element> values = new LinkedHashMap<String, Element>();
        List<CapturedState> states = new ArrayList<CapturedState>();
        String line;
        while ((line = next(br)) != null) {
            if (line.equals("*** END_MODEL")) {
                return new Model(values, states);
            } else if (line.startsWith("*** STATE ")) {
                String label = line.substring("*** STATE ".length()).trim();
                Map<String, Element> state = new LinkedHashMap<String, Element>();
                while ((line = next(br)) != null && !line.equals("*** END_STATE")) {
                    readValue(line, state);
                }
                if (line == null) {
                    break;
                }
                states.add(new CapturedState(label, state));
            } else {
                readValue(line, values);
            }
        }
        throw error("model is not terminated by *** END_MODEL");
    }

    private void readValue(String line, Map<String, Element> values) {
        int arrow = line.indexOf("->");
        if (arrow < 0) {
            throw error("expected name -> value, found " + line);
        }
        values.put(line.substring(0, arrow).trim(), Element.parse(line.substring(arrow + 2).trim()));
    }

    private Counterexample build(Model model) {
        line_number = failure_line;
        List<Block> path = new ArrayList<Block>();
        for (String label : trace) {
            path.add(block(label));
        }
        if (failure.length == 6 && failure[1].equals("call") && failure[4].equals("requires")) {
            Cmd cmd = command(block(failure[2]), failure[3]);
            if (!(cmd instanceof CallCmd)) {
                throw error("command " + failure[3] + " of " + failure[2] + " is not a call");
            }
            CallCmd call = (CallCmd)cmd;
            Procedure callee = program.getProcedure(call.getCallee());
            if (callee == null) {
                throw error("call to undeclared procedure " + call.getCallee());
            }
            Requires req = callee.getRequires().get(index(failure[5], callee.getRequires().size()));
            return new CallCounterexample(impl, path, model, call, req);
        }
        if (failure.length == 5 && failure[1].equals("return") && failure[3].equals("ensures")) {
            Block b = block(failure[2]);
            Procedure proc = program.getProcedure(impl.getName());
            if (proc == null) {
                throw error("implementation " + impl.getName() + " has no procedure");
            }
            Ensures ens = proc.getEnsures().get(index(failure[4], proc.getEnsures().size()));
            return new ReturnCounterexample(impl, path, model, b, ens);
        }
        if ((failure.length == 4 || failure.length == 5) && failure[1].equals("assert")) {
            Cmd cmd = command(block(failure[2]), failure[3]);
            if (!(cmd instanceof AssertCmd)) {
                throw error("command " + failure[3] + " of " + failure[2] + " is not an assertion");
            }
            AssertCounterexample.LoopInvariantFailure kind = AssertCounterexample.LoopInvariantFailure.NONE;
            if (failure.length == 5) {
                if (failure[4].equals("loop_entry")) {
                    kind = AssertCounterexample.LoopInvariantFailure.ENTRY;
                } else if (failure[4].equals("loop_maintained")) {
                    kind = AssertCounterexample.LoopInvariantFailure.MAINTENANCE;
                } else {
                    throw error("unknown assertion failure kind " + failure[4]);
                }
            }
            return new AssertCounterexample(impl, path, model, (AssertCmd)cmd, kind);
        }
        throw error("malformed failure line");
    }

    private Block block(String label) {
        Block b = impl.getBlock(label);
        if (b == null) {
            throw error("unknown block " + label + " in " + impl.getName());
        }
        return b;
    }

    private Cmd command(Block b, String idx) {
        return b.getCmds().get(index(idx, b.getCmds().size()));
    }

    private int index(String token, int size) {
        int i;
        try {
            i = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw error("expected an index, found " + token);
        }
        if (i < 0 || i >= size) {
            throw error("index " + i + " out of range");
        }
        return i;
    }

    private String next(BufferedReader br) throws IOException {
        String line;
        while ((line = br.readLine()) != null) {
            line_number++;
            line = line.trim();
            if (line.length() > 0 && line.charAt(0) != '#') {
                return line;
            }
        }
        return null;
    }

    private ParseException error(String msg) {
        return new ParseException(msg, new Position(file_name, line_number, 1));
    }
}
