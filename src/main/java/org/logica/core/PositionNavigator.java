package org.logica.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * INDIRIZZAMENTO PER POSIZIONE - Navigazione dell'albero tramite percorsi puntati
 *
 * Una posizione è la stringa vuota (radice) oppure una sequenza di passi separati
 * da punto, ciascuno 1 o 2:
 * - 1: operando della negazione oppure figlio sinistro di un binario
 * - 2: figlio destro di un binario
 *
 * Entrare in una foglia, usare il passo 2 su una negazione o qualsiasi passo
 * diverso da 1/2 rende la posizione non valida.
 */
public final class PositionNavigator {

    private static final Logger LOGGER = Logger.getLogger(PositionNavigator.class.getName());

    /** Posizione della radice */
    public static final String ROOT = "";

    /** Ordine di enumerazione: lunghezza crescente, poi lessicografico */
    public static final Comparator<String> POSITION_ORDER =
            Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());

    private PositionNavigator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region RICERCA SOTTOFORMULA

    /**
     * Percorre il cammino indicato dalla posizione.
     *
     * @param tree radice dell'albero
     * @param position percorso puntato, null o vuoto per la radice
     * @return nodo individuato, vuoto se un passo non è valido
     */
    public static Optional<Formula> subformulaAt(Formula tree, String position) {
        if (tree == null) return Optional.empty();
        if (position == null || position.isEmpty()) return Optional.of(tree);

        Formula current = tree;
        for (String step : position.split("\\.", -1)) {
            if ("1".equals(step) && current.isUnary()) {
                current = current.getOperand();
            } else if ("1".equals(step) && current.isBinary()) {
                current = current.getLeft();
            } else if ("2".equals(step) && current.isBinary()) {
                current = current.getRight();
            } else {
                LOGGER.finest("Passo '" + step + "' non valido in posizione " + position);
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /**
     * Come {@link #subformulaAt} ma solleva eccezione se la posizione non è valida.
     *
     * @throws InvalidPositionException se la posizione non individua un nodo
     */
    public static Formula requireSubformulaAt(Formula tree, String position) {
        return subformulaAt(tree, position)
                .orElseThrow(() -> new InvalidPositionException(position));
    }

    //endregion

    //region ENUMERAZIONE POSIZIONI

    /**
     * Tutte le posizioni valide, radice inclusa, in ordine di lunghezza e poi lessicografico.
     */
    public static List<String> allPositions(Formula tree) {
        List<String> positions = new ArrayList<>();
        if (tree == null) return positions;

        collectPositions(tree, ROOT, positions);
        positions.sort(POSITION_ORDER);
        return positions;
    }

    private static void collectPositions(Formula node, String position, List<String> positions) {
        positions.add(position);
        List<Formula> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            collectPositions(children.get(i), child(position, i + 1), positions);
        }
    }

    /**
     * Posizione del figlio raggiunto con il passo indicato.
     */
    public static String child(String position, int step) {
        return position == null || position.isEmpty() ? String.valueOf(step) : position + "." + step;
    }

    //endregion
}
