package org.logica.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.logica.antlr.LogicFormulaBaseVisitor;
import org.logica.antlr.LogicFormulaParser.AndContext;
import org.logica.antlr.LogicFormulaParser.FalseContext;
import org.logica.antlr.LogicFormulaParser.FormulaContext;
import org.logica.antlr.LogicFormulaParser.IdContext;
import org.logica.antlr.LogicFormulaParser.IffContext;
import org.logica.antlr.LogicFormulaParser.ImpliesContext;
import org.logica.antlr.LogicFormulaParser.NotContext;
import org.logica.antlr.LogicFormulaParser.OrContext;
import org.logica.antlr.LogicFormulaParser.ParContext;
import org.logica.antlr.LogicFormulaParser.TrueContext;
import org.logica.antlr.LogicFormulaParser.VarContext;
import org.logica.core.Formula;
import org.logica.core.Operator;

import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE DELL'ALBERO - Visitor dall'albero sintattico ANTLR all'AST {@link Formula}
 *
 * Ogni metodo visit gestisce un costrutto della grammatica LogicFormula, dal più
 * debole al più forte:
 *
 * OPERATORI (precedenza crescente):
 * - Biimplicazione (↔): catena associativa a sinistra
 * - Implicazione (→): catena associativa a sinistra
 * - Disgiunzione (∨): catena associativa a sinistra
 * - Congiunzione (∧): catena associativa a sinistra
 * - Negazione (¬): prefissa, ricorsiva a destra
 * - Atomi: variabili, costanti, espressioni tra parentesi
 *
 * A differenza di una conversione in CNF, l'albero prodotto rispecchia fedelmente
 * la formula scritta: nessun connettivo viene eliminato o riscritto.
 */
public class FormulaTreeBuilder extends LogicFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaTreeBuilder.class.getName());

    //region PUNTO DI INGRESSO

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        Formula formula = visit(ctx.biconditional());
        LOGGER.finest("Albero costruito: " + formula);
        return formula;
    }

    //endregion

    //region CATENE BINARIE

    @Override
    public Formula visitIff(IffContext ctx) {
        return foldLeft(Operator.IFF, ctx.implication());
    }

    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        return foldLeft(Operator.IMPLIES, ctx.disjunction());
    }

    @Override
    public Formula visitOr(OrContext ctx) {
        return foldLeft(Operator.OR, ctx.conjunction());
    }

    @Override
    public Formula visitAnd(AndContext ctx) {
        return foldLeft(Operator.AND, ctx.negation());
    }

    /**
     * Costruisce la catena associativa a sinistra: A op B op C → ((A op B) op C).
     * Con un solo operando restituisce direttamente l'operando.
     */
    private Formula foldLeft(Operator operator, List<? extends ParserRuleContext> operands) {
        Formula result = visit(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            result = Formula.binary(operator, result, visit(operands.get(i)));
        }
        if (operands.size() > 1) {
            LOGGER.finest("Catena " + operator.symbol() + " con " + operands.size() + " operandi");
        }
        return result;
    }

    //endregion

    //region NEGAZIONE E PARENTESI

    @Override
    public Formula visitNot(NotContext ctx) {
        return Formula.not(visit(ctx.negation()));
    }

    @Override
    public Formula visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.biconditional());
    }

    //endregion

    //region ATOMI E COSTANTI

    @Override
    public Formula visitId(IdContext ctx) {
        return Formula.variable(ctx.VARIABLE().getText());
    }

    @Override
    public Formula visitTrue(TrueContext ctx) {
        return Formula.top();
    }

    @Override
    public Formula visitFalse(FalseContext ctx) {
        return Formula.bottom();
    }

    //endregion
}
