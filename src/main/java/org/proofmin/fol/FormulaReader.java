package org.proofmin.fol;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.proofmin.antlr.FofLexer;
import org.proofmin.antlr.FofParser;

/**
 * Lettura di formule FOF testuali in alberi {@link Formula}.
 *
 * Lexer e parser generati da ANTLR sono configurati per interrompere la
 * lettura al primo errore sintattico, segnalato come {@link FormulaParseException}.
 */
public final class FormulaReader {

    private FormulaReader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param text formula in sintassi FOF
     * @return albero immutabile della formula
     * @throws FormulaParseException se il testo non è una formula valida
     */
    public static Formula parse(String text) {
        if (text == null || text.isBlank()) {
            throw new FormulaParseException("Formula vuota");
        }

        FofLexer lexer = new FofLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailingListener.INSTANCE);

        FofParser parser = new FofParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FailingListener.INSTANCE);

        ParseTree tree = parser.formula();
        return new FormulaBuilder().visit(tree);
    }

    /**
     * Listener che trasforma il primo errore in eccezione.
     */
    private static final class FailingListener extends BaseErrorListener {

        static final FailingListener INSTANCE = new FailingListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new FormulaParseException("Errore sintattico a " + line + ":" + charPositionInLine + " - " + msg, e);
        }
    }
}
