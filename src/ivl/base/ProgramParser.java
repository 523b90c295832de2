package ivl.base;

import ivl.base.grammars.IVLLexer;
import ivl.base.grammars.IVLParser;
import ivl.hir.Position;
import ivl.hir.PrintTools;
import ivl.hir.Program;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Entry point for reading IVL programs. The text is parsed with the ANTLR
 * generated parser, converted to HIR by {@link ProgramBuilder} and finally
 * name-resolved.
 */
public final class ProgramParser {

    private ProgramParser() {
    }

    /** Error listener that aborts on the first syntax error. */
    private static class ThrowingErrorListener extends BaseErrorListener {

        private final String file_name;

        ThrowingErrorListener(String file_name) {
            this.file_name = file_name;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offending_symbol,
                int line, int column, String msg, RecognitionException e) {
            throw new ParseException(msg, new Position(file_name, line, column + 1));
        }
    }

    /**
     * Parses the given program text.
     *
     * @param text the program.
     * @param file_name the name used in positions and messages.
     * @return the resolved program.
     * @throws ParseException on syntax or name-resolution errors.
     */
    public static Program parse(String text, String file_name) {
        ThrowingErrorListener listener = new ThrowingErrorListener(file_name);
        IVLLexer lexer = new IVLLexer(CharStreams.fromString(text, file_name));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
        IVLParser parser = new IVLParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(listener);
        Program program = new ProgramBuilder(file_name).visitProgram(parser.program());
        NameResolver.resolve(program);
        return program;
    }

    /** Reads and parses a program file. */
    public static Program parseFile(File file) throws IOException {
        PrintTools.println("Parsing " + file, 2);
        String text = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
        return parse(text, file.getPath());
    }
}
