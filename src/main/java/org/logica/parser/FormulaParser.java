package org.logica.parser;

import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.logica.antlr.LogicFormulaLexer;
import org.logica.antlr.LogicFormulaParser;
import org.logica.core.Formula;
import org.logica.parser.FormulaSyntaxException.Kind;

import java.util.logging.Logger;

/**
 * PARSER FORMULE - Pipeline ANTLR da stringa ad albero {@link Formula}
 *
 * PIPELINE:
 * 1. Lexing completo della stringa (spazi ignorati, un token per carattere significativo)
 * 2. Rifiuto del primo carattere non riconosciuto dalla grammatica
 * 3. Parsing a discesa ricorsiva con strategia di errore senza recupero
 * 4. Traversal visitor per la costruzione dell'albero
 *
 * Nessuna validazione semantica: verificare che una formula sia in CNF, ad esempio,
 * resta responsabilità del chiamante.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Analizza una formula testuale.
     *
     * @param text formula in notazione infissa (¬ ∧ ∨ → ↔ ⊤ ⊥, variabili a-z)
     * @return albero sintattico astratto della formula
     * @throws FormulaSyntaxException alla prima anomalia lessicale o sintattica
     */
    public static Formula parse(String text) {
        if (text == null) {
            throw new FormulaSyntaxException(Kind.UNEXPECTED_END, "", 0);
        }
        LOGGER.fine("Parsing formula: " + text);

        // Fase 1: lexing completo, caratteri estranei rifiutati prima del parsing
        LogicFormulaLexer lexer = new LogicFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        for (Token token : tokens.getTokens()) {
            if (token.getType() == LogicFormulaLexer.INVALID_CHARACTER) {
                throw new FormulaSyntaxException(Kind.INVALID_CHARACTER, token.getText(), token.getStartIndex());
            }
        }

        // Fase 2: parsing senza recupero
        LogicFormulaParser parser = new LogicFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());

        try {
            return new FormulaTreeBuilder().visit(parser.formula());
        } catch (ParseCancellationException e) {
            throw translate(e, text);
        }
    }

    /**
     * Traduce l'eccezione di ANTLR nella categoria di errore corrispondente.
     *
     * CLASSIFICAZIONE:
     * - Fine input dove era attesa ')' → parentesi di chiusura mancante
     * - Fine input altrove → fine inattesa della formula
     * - Token presente dove era attesa ')' → parentesi di chiusura mancante
     * - Token presente dove era atteso solo EOF → token in eccesso
     * - Altri token → token inatteso
     */
    private static FormulaSyntaxException translate(ParseCancellationException e, String text) {
        if (!(e.getCause() instanceof RecognitionException)) {
            return new FormulaSyntaxException(Kind.UNEXPECTED_TOKEN, text, 0);
        }

        RecognitionException cause = (RecognitionException) e.getCause();
        Token offending = cause.getOffendingToken();
        IntervalSet expected = cause.getExpectedTokens();
        boolean expectsClosing = expected != null && expected.contains(LogicFormulaLexer.RPAR);

        if (offending == null || offending.getType() == Token.EOF) {
            return expectsClosing
                    ? new FormulaSyntaxException(Kind.MISSING_CLOSING_PARENTHESIS, "", text.length())
                    : new FormulaSyntaxException(Kind.UNEXPECTED_END, "", text.length());
        }

        if (expectsClosing) {
            return new FormulaSyntaxException(Kind.MISSING_CLOSING_PARENTHESIS,
                    offending.getText(), offending.getStartIndex());
        }
        if (expected != null && expected.size() == 1 && expected.contains(Token.EOF)) {
            return new FormulaSyntaxException(Kind.TRAILING_TOKENS,
                    text.substring(offending.getStartIndex()).trim(), offending.getStartIndex());
        }
        return new FormulaSyntaxException(Kind.UNEXPECTED_TOKEN, offending.getText(), offending.getStartIndex());
    }
}
