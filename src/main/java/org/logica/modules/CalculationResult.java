package org.logica.modules;

/**
 * Risultato strutturato di un'analisi, con rappresentazione testuale per la riga di comando.
 */
public interface CalculationResult {

    Algorithm algorithm();

    /**
     * Resoconto leggibile del risultato, su più righe.
     */
    String toDisplayString();
}
