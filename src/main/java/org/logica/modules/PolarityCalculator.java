package org.logica.modules;

import org.logica.core.Formula;
import org.logica.core.FormulaFormatter;
import org.logica.core.Operator;
import org.logica.core.PositionNavigator;
import org.logica.parser.FormulaParser;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * POLARITÀ - Segno con cui una sottoformula influenza il valore della formula
 *
 * Il segno parte positivo dalla radice e si inverte:
 * • entrando nell'antecedente (figlio sinistro) di →
 * • entrando nell'operando di ¬
 * Tutte le altre discese lo conservano.
 *
 * Oltre alla polarità della posizione richiesta, annota l'intero albero e ne produce
 * una rappresentazione a rami, una riga per nodo.
 */
public class PolarityCalculator implements Calculator {

    private static final Logger LOGGER = Logger.getLogger(PolarityCalculator.class.getName());

    @Override
    public Algorithm algorithm() {
        return Algorithm.POLARITY;
    }

    @Override
    public PolarityResult calculate(CalculationRequest request) {
        String position = request.positionOrRoot();
        LOGGER.fine("Calcolo polarità in posizione '" + position + "' di: " + request.formula());

        Formula tree = FormulaParser.parse(request.formula());
        Formula subformula = PositionNavigator.requireSubformulaAt(tree, position);
        Polarity polarity = polarityAt(tree, position);

        AnnotatedNode annotated = annotate(tree, Polarity.POSITIVE, PositionNavigator.ROOT);
        String formattedTree = formatTree(annotated);

        LOGGER.fine("Polarità di " + subformula + ": " + polarity.label());
        return new PolarityResult(
                request.formula(),
                position,
                polarity,
                FormulaFormatter.toText(subformula),
                FormulaFormatter.toLatex(subformula),
                annotated,
                formattedTree);
    }

    //region POLARITÀ PER POSIZIONE

    /**
     * Ripercorre il cammino dalla radice alla posizione accumulando il segno.
     *
     * @throws org.logica.core.InvalidPositionException se la posizione non è valida
     */
    public static Polarity polarityAt(Formula tree, String position) {
        PositionNavigator.requireSubformulaAt(tree, position);
        if (position == null || position.isEmpty()) {
            return Polarity.POSITIVE;
        }

        Polarity polarity = Polarity.POSITIVE;
        Formula current = tree;
        for (String step : position.split("\\.")) {
            if (current.isUnary()) {
                polarity = polarity.flip();
                current = current.getOperand();
            } else if ("1".equals(step)) {
                if (current.getOperator() == Operator.IMPLIES) {
                    polarity = polarity.flip();
                }
                current = current.getLeft();
            } else {
                current = current.getRight();
            }
        }
        return polarity;
    }

    //endregion

    //region ANNOTAZIONE ALBERO

    /**
     * Nodo dell'albero annotato con posizione e polarità.
     */
    public record AnnotatedNode(Formula formula, String position, Polarity polarity, List<AnnotatedNode> children) {
        public AnnotatedNode {
            children = List.copyOf(children);
        }
    }

    static AnnotatedNode annotate(Formula node, Polarity polarity, String position) {
        List<AnnotatedNode> children = new ArrayList<>();
        if (node.isUnary()) {
            children.add(annotate(node.getOperand(), polarity.flip(), PositionNavigator.child(position, 1)));
        } else if (node.isBinary()) {
            Polarity leftPolarity = node.getOperator() == Operator.IMPLIES ? polarity.flip() : polarity;
            children.add(annotate(node.getLeft(), leftPolarity, PositionNavigator.child(position, 1)));
            children.add(annotate(node.getRight(), polarity, PositionNavigator.child(position, 2)));
        }
        return new AnnotatedNode(node, position, polarity, children);
    }

    /**
     * Rappresentazione a rami dell'albero annotato.
     *
     * La prima riga è la radice, "formula [polarità]"; ogni altro nodo è reso come
     * "posizione: formula [polarità]" preceduto dai rami ├── o └── (ultimo figlio).
     */
    public static String formatTree(AnnotatedNode root) {
        List<String> lines = new ArrayList<>();
        lines.add(FormulaFormatter.toText(root.formula()) + " [" + root.polarity().label() + "]");
        formatChildren(root, "", lines);
        return String.join("\n", lines);
    }

    private static void formatChildren(AnnotatedNode node, String prefix, List<String> lines) {
        List<AnnotatedNode> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            AnnotatedNode child = children.get(i);
            boolean last = i == children.size() - 1;
            lines.add(prefix + (last ? "└── " : "├── ") + child.position() + ": "
                    + FormulaFormatter.toText(child.formula()) + " [" + child.polarity().label() + "]");
            formatChildren(child, prefix + (last ? "    " : "│   "), lines);
        }
    }

    //endregion
}
