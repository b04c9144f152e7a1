package org.logica.modules;

import org.logica.cnf.ClauseSet;
import org.logica.cnf.Literals;
import org.logica.core.Formula;
import org.logica.core.FormulaFormatter;
import org.logica.core.PositionNavigator;
import org.logica.parser.FormulaParser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * TRASFORMAZIONE DI TSEYTIN - CNF definizionale con nomi ausiliari n0, n1, ...
 *
 * ORDINE DI VISITA:
 * • Post-ordine da destra a sinistra: prima i figli dal più a destra, poi il nodo
 * • Sottoformule strutturalmente identiche sono visitate e nominate una sola volta
 * • Ricevono un nome i binari e le negazioni il cui operando non è una foglia
 *
 * CLAUSOLE DEFINITORIE (N nome della sottoformula, L e R i suoi operandi):
 * • L∧R: (-L,-R,N)
 * • L∨R: (L,R,-N)
 * • L→R: (R,-L,-N)
 * • L↔R: (-L,R,-N), (L,-R,-N), (L,R,N), (-L,-R,N)
 * • ¬X:  (-N,-X), (N,X)
 * Un operando già nominato compare con il suo nome; infine una clausola unitaria
 * afferma il nome della formula intera, o la formula stessa se è un letterale.
 *
 * FORMATO:
 * • Clausole duplicate rimosse confrontando i letterali ordinati
 * • Letterali in ordine canonico: costanti, variabili, nomi ausiliari; positivo prima del negato
 * • Risultato (l,l,l);(l);...
 */
public class TseytinTransformer implements Calculator {

    private static final Logger LOGGER = Logger.getLogger(TseytinTransformer.class.getName());

    /** Prefisso dei nomi ausiliari */
    public static final String AUXILIARY_PREFIX = "n";

    @Override
    public Algorithm algorithm() {
        return Algorithm.TSEYTIN;
    }

    @Override
    public TseytinResult calculate(CalculationRequest request) {
        LOGGER.fine("Trasformazione di Tseytin per: " + request.formula());

        Formula formula = FormulaParser.parse(request.formula());
        TransformationContext context = new TransformationContext();

        // Fase 1: nomi e clausole definitorie nell'ordine di visita
        List<List<String>> clauses = new ArrayList<>();
        for (Formula subformula : orderedSubformulas(formula)) {
            String name = context.assignName(subformula);
            clauses.addAll(defineName(name, subformula, context));
        }

        // Fase 2: clausola che afferma la formula intera
        clauses.add(List.of(context.literalOf(formula)));

        // Fase 3: deduplicazione e ordinamento canonico
        List<List<String>> canonical = canonicalize(clauses);
        List<String> clauseStrings = canonical.stream()
                .map(clause -> "(" + String.join(",", clause) + ")")
                .toList();
        String cnfFormula = canonical.stream()
                .map(clause -> "(" + String.join("∨", clause) + ")")
                .collect(Collectors.joining("∧"));

        LOGGER.fine("Nomi ausiliari: " + context.auxiliaryVariables.size() + ", clausole: " + canonical.size());
        return new TseytinResult(
                request.formula(),
                cnfFormula,
                context.auxiliaryVariables,
                clauseStrings,
                ClauseSet.formatOutput(canonical),
                canonical);
    }

    //region ORDINE DI VISITA

    /**
     * Sottoformule da nominare, in post-ordine da destra a sinistra, senza duplicati strutturali.
     */
    static List<Formula> orderedSubformulas(Formula formula) {
        Set<Formula> visited = new LinkedHashSet<>();
        visit(formula, PositionNavigator.ROOT, visited);
        return visited.stream()
                .filter(TseytinTransformer::needsName)
                .toList();
    }

    private static void visit(Formula node, String position, Set<Formula> visited) {
        List<Formula> children = node.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            visit(children.get(i), PositionNavigator.child(position, i + 1), visited);
        }
        if (visited.add(node)) {
            LOGGER.finest("Visita " + (position.isEmpty() ? "radice" : position) + ": " + node);
        }
    }

    /**
     * Vero per i binari e per le negazioni di sottoformule non atomiche.
     */
    static boolean needsName(Formula node) {
        return node.isBinary() || (node.isUnary() && !node.getOperand().isLeaf());
    }

    //endregion

    //region CLAUSOLE DEFINITORIE

    private static List<List<String>> defineName(String name, Formula subformula, TransformationContext context) {
        String negatedName = negate(name);

        if (subformula.isUnary()) {
            String operand = context.literalOf(subformula.getOperand());
            return List.of(
                    List.of(negatedName, negate(operand)),
                    List.of(name, operand));
        }

        String left = context.literalOf(subformula.getLeft());
        String right = context.literalOf(subformula.getRight());

        return switch (subformula.getOperator()) {
            case AND -> List.of(List.of(negate(left), negate(right), name));
            case OR -> List.of(List.of(left, right, negatedName));
            case IMPLIES -> List.of(List.of(right, negate(left), negatedName));
            case IFF -> List.of(
                    List.of(negate(left), right, negatedName),
                    List.of(left, negate(right), negatedName),
                    List.of(left, right, name),
                    List.of(negate(left), negate(right), name));
            case NOT -> throw new IllegalStateException("Negazione in nodo binario");
        };
    }

    /**
     * Letterale complementare in notazione di output; le costanti si scambiano.
     */
    static String negate(String literal) {
        if (Formula.TOP.equals(literal)) return Formula.BOTTOM;
        if (Formula.BOTTOM.equals(literal)) return Formula.TOP;
        return Literals.complementOutput(literal);
    }

    //endregion

    //region FORMATO CANONICO

    static List<List<String>> canonicalize(List<List<String>> clauses) {
        Map<String, List<String>> unique = new LinkedHashMap<>();
        for (List<String> clause : clauses) {
            List<String> sorted = clause.stream().sorted(Literals.CANONICAL).toList();
            unique.putIfAbsent(String.join(",", sorted), sorted);
        }
        return new ArrayList<>(unique.values());
    }

    //endregion

    /**
     * Stato di una singola trasformazione: contatore dei nomi e corrispondenza
     * sottoformula → nome. Creato a ogni chiamata e mai condiviso.
     */
    private static final class TransformationContext {

        private int nextIndex = 0;
        private final Map<Formula, String> names = new HashMap<>();
        private final Map<String, String> auxiliaryVariables = new LinkedHashMap<>();

        String assignName(Formula subformula) {
            String name = AUXILIARY_PREFIX + nextIndex++;
            names.put(subformula, name);
            auxiliaryVariables.put(name, FormulaFormatter.toText(subformula));
            LOGGER.finest(name + " ≡ " + subformula);
            return name;
        }

        /**
         * Letterale che rappresenta il nodo: il suo nome se nominato, altrimenti
         * la variabile, la costante o la negazione di una foglia.
         */
        String literalOf(Formula node) {
            String name = names.get(node);
            if (name != null) {
                return name;
            }
            return switch (node.getType()) {
                case VARIABLE, CONSTANT -> node.getValue();
                case UNARY -> negate(literalOf(node.getOperand()));
                case BINARY -> throw new IllegalStateException("Sottoformula binaria senza nome: " + node);
            };
        }
    }
}
