package org.logica.cnf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * INSIEME DI CLAUSOLE - Rappresentazione a liste di una formula già in CNF
 *
 * Interpreta stringhe della forma (l∨l∨…)∧(l)∧… senza costruire un albero sintattico:
 * la formula è separata sui ∧, ogni congiunto perde un livello di parentesi esterne
 * e viene diviso sui ∨. Un congiunto senza ∨ è una clausola unitaria.
 *
 * INVARIANTI:
 * - Ordine delle clausole = ordine di lettura da sinistra a destra
 * - Ordine dei letterali = ordine di inserimento nella clausola
 * - Ogni letterale ha forma ¬?x con x lettera minuscola
 * - Struttura immutabile dopo la costruzione
 */
public final class ClauseSet {

    private static final Logger LOGGER = Logger.getLogger(ClauseSet.class.getName());

    private static final Pattern LITERAL = Pattern.compile("¬?[a-z]");

    private final List<List<String>> clauses;

    //region COSTRUZIONE

    public ClauseSet(List<List<String>> clauses) {
        if (clauses == null || clauses.contains(null)) {
            throw new IllegalArgumentException("Lista clausole non può essere null o contenere null");
        }
        List<List<String>> copy = new ArrayList<>();
        for (List<String> clause : clauses) {
            copy.add(List.copyOf(clause));
        }
        this.clauses = Collections.unmodifiableList(copy);
    }

    /**
     * Interpreta una formula CNF testuale.
     *
     * @param cnf formula nella forma (a∨¬b)∧(c)∧…
     * @return insieme di clausole nell'ordine di lettura
     * @throws FormulaFormatException se la formula è vuota o un letterale non è ben formato
     */
    public static ClauseSet parse(String cnf) {
        if (cnf == null || cnf.isBlank()) {
            throw new FormulaFormatException("Formula CNF vuota", String.valueOf(cnf));
        }

        List<List<String>> clauses = new ArrayList<>();
        for (String conjunct : cnf.split("∧", -1)) {
            String clauseText = conjunct.trim();
            if (clauseText.startsWith("(") && clauseText.endsWith(")")) {
                clauseText = clauseText.substring(1, clauseText.length() - 1);
            }

            List<String> clause = new ArrayList<>();
            for (String literal : clauseText.split("∨", -1)) {
                String trimmed = literal.trim();
                if (!LITERAL.matcher(trimmed).matches()) {
                    throw new FormulaFormatException("Letterale non valido '" + trimmed + "' nella clausola", conjunct.trim());
                }
                clause.add(trimmed);
            }
            clauses.add(clause);
        }

        ClauseSet result = new ClauseSet(clauses);
        LOGGER.fine("Clausole estratte: " + result.size() + ", variabili: " + result.variables().size());
        return result;
    }

    //endregion

    //region INTERROGAZIONE

    public List<List<String>> clauses() {
        return clauses;
    }

    public int size() {
        return clauses.size();
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    public boolean hasUnitClause() {
        return clauses.stream().anyMatch(clause -> clause.size() == 1);
    }

    /**
     * Variabili di tutte le clausole, nell'ordine di prima apparizione.
     */
    public Set<String> variables() {
        Set<String> variables = new LinkedHashSet<>();
        for (List<String> clause : clauses) {
            for (String literal : clause) {
                variables.add(Literals.variableOf(literal));
            }
        }
        return variables;
    }

    /**
     * Clausole come stringhe di letterali separati da virgola, es. "a,¬b".
     */
    public List<String> joined() {
        return join(clauses);
    }

    public static List<String> join(List<List<String>> clauses) {
        return clauses.stream()
                .map(clause -> String.join(",", clause))
                .collect(Collectors.toList());
    }

    //endregion

    //region FORMATO DI OUTPUT

    /**
     * Formato di output: (l,l,…);(l,…);… con negazione resa da '-'.
     *
     * @param clauses clausole con letterali già in notazione di output
     */
    public static String formatOutput(List<List<String>> clauses) {
        return clauses.stream()
                .map(clause -> "(" + String.join(",", clause) + ")")
                .collect(Collectors.joining(";"));
    }

    //endregion

    @Override
    public String toString() {
        return clauses.stream()
                .map(clause -> "(" + String.join("∨", clause) + ")")
                .collect(Collectors.joining("∧"));
    }
}
