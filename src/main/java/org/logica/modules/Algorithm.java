package org.logica.modules;

import java.util.function.Supplier;

/**
 * Registro statico delle analisi disponibili.
 *
 * Ogni voce associa la chiave usata dalla riga di comando, un titolo descrittivo
 * e la factory del relativo {@link Calculator}.
 */
public enum Algorithm {
    TRUTH_TABLE("truth-table", "Tavola di verità", TruthTableGenerator::new),
    SATISFIABILITY("satisfiability", "Soddisfacibilità", SatisfiabilityChecker::new),
    SUBFORMULA("subformula", "Estrazione sottoformula", SubformulaExtractor::new),
    UNIT_PROPAGATION("unit-propagation", "Propagazione unitaria", UnitPropagationAnalyzer::new),
    INTERPRETATION("interpretation", "Verifica interpretazione", InterpretationTester::new),
    POLARITY("polarity", "Polarità", PolarityCalculator::new),
    CNF_DETERMINISM("cnf-determinism", "Determinismo CNF",
            () -> new DeterminismChecker(DeterminismChecker.Variant.CNF)),
    PURE_ATOM("pure-atom", "Semplificazione atomi puri", PureAtomSimplifier::new),
    GENERAL_DETERMINISM("general-determinism", "Determinismo insieme di formule",
            () -> new DeterminismChecker(DeterminismChecker.Variant.GENERAL)),
    TSEYTIN("tseytin", "Trasformazione di Tseytin", TseytinTransformer::new);

    private final String key;
    private final String title;
    private final Supplier<Calculator> factory;

    Algorithm(String key, String title, Supplier<Calculator> factory) {
        this.key = key;
        this.title = title;
        this.factory = factory;
    }

    public String key() {
        return key;
    }

    public String title() {
        return title;
    }

    /**
     * Nuova istanza del calcolatore associato.
     */
    public Calculator newCalculator() {
        return factory.get();
    }

    /**
     * Risolve la chiave testuale di un'analisi.
     *
     * @param key chiave, es. "truth-table"
     * @throws IllegalArgumentException se la chiave non corrisponde ad alcuna analisi
     */
    public static Algorithm fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase();
            for (Algorithm algorithm : values()) {
                if (algorithm.key.equals(normalized)) {
                    return algorithm;
                }
            }
        }
        throw new IllegalArgumentException("Modulo sconosciuto: " + key);
    }
}
