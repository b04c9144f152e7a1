package org.logica.modules;

import org.logica.cnf.ClauseSet;
import org.logica.cnf.PropagationResult;
import org.logica.cnf.UnitPropagationEngine;
import org.logica.cnf.UnitPropagationEngine.ContradictionPolicy;

import java.util.List;
import java.util.logging.Logger;

/**
 * DETERMINISMO - Stabilisce se la sola propagazione unitaria decide la soddisfacibilità
 *
 * DECISIONE:
 * 1. Nessuna clausola unitaria in input → propagazione non applicabile
 * 2. Propagazione che svuota l'insieme di clausole → soddisfacibile
 * 3. Propagazione che produce una clausola vuota → insoddisfacibile
 * 4. Propagazione bloccata ma con tutte le variabili assegnate → soddisfacibile
 * 5. Altrimenti → non determinabile
 *
 * Le due varianti condividono la decisione e differiscono solo nei testi:
 * CNF parla di "the formula" con quattro enunciati, GENERAL di "the set of formulas"
 * con tre enunciati in cui soddisfacibile e insoddisfacibile coincidono.
 */
public class DeterminismChecker implements Calculator {

    private static final Logger LOGGER = Logger.getLogger(DeterminismChecker.class.getName());

    /**
     * Variante del controllo, selezionabile anche con il campo type della richiesta.
     */
    public enum Variant {
        CNF("cnf"),
        GENERAL("general");

        private final String key;

        Variant(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }

        /**
         * @throws IllegalArgumentException se la chiave non è "cnf" né "general"
         */
        public static Variant fromKey(String key) {
            for (Variant variant : values()) {
                if (variant.key.equalsIgnoreCase(key.trim())) {
                    return variant;
                }
            }
            throw new IllegalArgumentException("Tipo di determinismo sconosciuto: " + key);
        }
    }

    /**
     * Classificazione dell'esito della propagazione.
     */
    public enum Verdict {
        NO_UNIT_CLAUSES,
        SATISFIABLE,
        UNDETERMINED,
        UNSATISFIABLE;

        /** Vero se la propagazione decide la soddisfacibilità */
        public boolean isDeterministic() {
            return this == SATISFIABLE || this == UNSATISFIABLE;
        }
    }

    private static final List<String> CNF_STATEMENTS = List.of(
            "Unit propagation cannot be used within the formula",
            "Using only unit propagation exhaustively can determine that the formula is satisfiable",
            "Unit propagation can be used within the formula, but the satisfiability cannot be determined using only unit propagation",
            "Using only unit propagation exhaustively can determine that the formula is unsatisfiable");

    private static final List<String> GENERAL_STATEMENTS = List.of(
            "Satisfiability of S can be determined using only unit propagation",
            "Satisfiability of S cannot be determined using only unit propagation",
            "Unit propagation cannot be used within S");

    private final Variant defaultVariant;
    private final UnitPropagationEngine engine = new UnitPropagationEngine(ContradictionPolicy.REPORT);

    public DeterminismChecker(Variant defaultVariant) {
        if (defaultVariant == null) {
            throw new IllegalArgumentException("Variante non può essere null");
        }
        this.defaultVariant = defaultVariant;
    }

    @Override
    public Algorithm algorithm() {
        return defaultVariant == Variant.CNF ? Algorithm.CNF_DETERMINISM : Algorithm.GENERAL_DETERMINISM;
    }

    @Override
    public DeterminismResult calculate(CalculationRequest request) {
        Variant variant = request.type() == null || request.type().isBlank()
                ? defaultVariant
                : Variant.fromKey(request.type());
        LOGGER.fine("Controllo determinismo (" + variant.key() + ") su: " + request.formula());

        ClauseSet clauses = ClauseSet.parse(request.formula());
        PropagationResult propagation = null;
        Verdict verdict;

        if (!clauses.hasUnitClause()) {
            verdict = Verdict.NO_UNIT_CLAUSES;
        } else {
            propagation = engine.propagate(clauses);
            verdict = classify(propagation, clauses);
        }

        LOGGER.fine("Verdetto: " + verdict);
        return new DeterminismResult(
                algorithm(),
                request.formula(),
                variant,
                verdict,
                explanation(verdict, variant),
                statements(variant),
                correctStatement(verdict, variant),
                propagation);
    }

    //region CLASSIFICAZIONE

    static Verdict classify(PropagationResult propagation, ClauseSet original) {
        return switch (propagation.outcome()) {
            case EMPTY -> Verdict.SATISFIABLE;
            case CONTRADICTION -> Verdict.UNSATISFIABLE;
            case STALLED -> propagation.assignsAll(original.variables())
                    ? Verdict.SATISFIABLE
                    : Verdict.UNDETERMINED;
        };
    }

    static String explanation(Verdict verdict, Variant variant) {
        String subject = variant == Variant.CNF ? "the formula" : "the set of formulas";
        return switch (verdict) {
            case NO_UNIT_CLAUSES -> "Unit propagation cannot be used within " + subject;
            case SATISFIABLE -> "Unit propagation determines that " + subject + " is satisfiable";
            case UNSATISFIABLE -> "Unit propagation determines that " + subject + " is unsatisfiable";
            case UNDETERMINED -> "Unit propagation can be used but cannot determine satisfiability";
        };
    }

    static List<String> statements(Variant variant) {
        return variant == Variant.CNF ? CNF_STATEMENTS : GENERAL_STATEMENTS;
    }

    /**
     * Numero (da 1) dell'enunciato corretto per il verdetto.
     */
    static int correctStatement(Verdict verdict, Variant variant) {
        if (variant == Variant.CNF) {
            return switch (verdict) {
                case NO_UNIT_CLAUSES -> 1;
                case SATISFIABLE -> 2;
                case UNDETERMINED -> 3;
                case UNSATISFIABLE -> 4;
            };
        }
        return switch (verdict) {
            case SATISFIABLE, UNSATISFIABLE -> 1;
            case UNDETERMINED -> 2;
            case NO_UNIT_CLAUSES -> 3;
        };
    }

    //endregion
}
