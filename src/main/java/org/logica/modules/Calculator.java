package org.logica.modules;

/**
 * Punto di ingresso comune a tutte le analisi.
 *
 * Ogni invocazione di {@link #calculate} è autonoma: analizza la formula della richiesta,
 * costruisce strutture proprie e restituisce un risultato completo. Un input malformato
 * produce un'eccezione e mai un risultato parziale.
 */
public interface Calculator {

    Algorithm algorithm();

    /**
     * Esegue l'analisi sulla richiesta.
     *
     * @param request parametri della chiamata
     * @return risultato strutturato dell'analisi
     * @throws IllegalArgumentException per formule, posizioni o asserzioni non valide
     */
    CalculationResult calculate(CalculationRequest request);
}
