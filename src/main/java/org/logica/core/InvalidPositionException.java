package org.logica.core;

/**
 * Posizione che non individua alcun nodo dell'albero.
 *
 * Sollevata solo dai chiamanti che necessitano di una sottoformula; la ricerca
 * di base ({@link PositionNavigator#subformulaAt}) restituisce un Optional vuoto.
 */
public class InvalidPositionException extends IllegalArgumentException {

    private final String position;

    public InvalidPositionException(String position) {
        super("Posizione non valida: \"" + position + "\"");
        this.position = position;
    }

    public String getPosition() {
        return position;
    }
}
