package org.proofmin.fol;

import org.proofmin.antlr.FofBaseVisitor;
import org.proofmin.antlr.FofParser.AndContext;
import org.proofmin.antlr.FofParser.ApplicationContext;
import org.proofmin.antlr.FofParser.AtomicContext;
import org.proofmin.antlr.FofParser.EquationContext;
import org.proofmin.antlr.FofParser.FalseContext;
import org.proofmin.antlr.FofParser.FormulaContext;
import org.proofmin.antlr.FofParser.IffContext;
import org.proofmin.antlr.FofParser.ImpliesContext;
import org.proofmin.antlr.FofParser.NotContext;
import org.proofmin.antlr.FofParser.OrContext;
import org.proofmin.antlr.FofParser.ParContext;
import org.proofmin.antlr.FofParser.PredicateContext;
import org.proofmin.antlr.FofParser.QuantifiedContext;
import org.proofmin.antlr.FofParser.TermContext;
import org.proofmin.antlr.FofParser.TrueContext;
import org.proofmin.antlr.FofParser.UnaryContext;
import org.proofmin.antlr.FofParser.VariableContext;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE FORMULE - Visitor dall'albero sintattico ANTLR a {@link Formula}
 *
 * Ogni metodo visit gestisce una alternativa etichettata della grammatica Fof.
 * La conversione è bottom-up e non applica alcuna trasformazione logica: la
 * struttura prodotta rispecchia il testo, perché il matching è strutturale.
 *
 * CONVENZIONI:
 * - {@code a != b} diventa {@code ~(a = b)}
 * - catene di & e | diventano nodi n-ari
 * - un termine in posizione di formula è un atomo proposizionale o un predicato
 */
public class FormulaBuilder extends FofBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaBuilder.class.getName());

    //region PUNTO DI INGRESSO

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        Formula result = visit(ctx.biconditional());
        LOGGER.finest("Formula costruita: " + result);
        return result;
    }

    //endregion

    //region CONNETTIVI

    @Override
    public Formula visitIff(IffContext ctx) {
        if (ctx.IFF() == null) {
            return visit(ctx.implication(0));
        }
        return Formula.iff(visit(ctx.implication(0)), visit(ctx.implication(1)));
    }

    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        if (ctx.IMPLIES() == null) {
            return visit(ctx.disjunction(0));
        }
        return Formula.implies(visit(ctx.disjunction(0)), visit(ctx.disjunction(1)));
    }

    @Override
    public Formula visitOr(OrContext ctx) {
        if (ctx.conjunction().size() == 1) {
            return visit(ctx.conjunction(0));
        }
        List<Formula> operands = new ArrayList<>();
        ctx.conjunction().forEach(c -> operands.add(visit(c)));
        return Formula.or(operands);
    }

    @Override
    public Formula visitAnd(AndContext ctx) {
        if (ctx.unary().size() == 1) {
            return visit(ctx.unary(0));
        }
        List<Formula> operands = new ArrayList<>();
        for (UnaryContext u : ctx.unary()) {
            operands.add(visit(u));
        }
        return Formula.and(operands);
    }

    @Override
    public Formula visitNot(NotContext ctx) {
        return Formula.not(visit(ctx.unary()));
    }

    @Override
    public Formula visitQuantified(QuantifiedContext ctx) {
        List<String> variables = new ArrayList<>();
        for (TerminalNode v : ctx.VARIABLE()) {
            variables.add(v.getText());
        }
        Formula body = visit(ctx.unary());
        return ctx.FORALL() != null ? Formula.forall(variables, body) : Formula.exists(variables, body);
    }

    @Override
    public Formula visitAtomic(AtomicContext ctx) {
        return visit(ctx.atom());
    }

    //endregion

    //region ATOMI

    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.biconditional());
    }

    @Override
    public Formula visitTrue(TrueContext ctx) {
        return Formula.truth();
    }

    @Override
    public Formula visitFalse(FalseContext ctx) {
        return Formula.falsity();
    }

    @Override
    public Formula visitEquation(EquationContext ctx) {
        Formula equation = Formula.equality(buildTerm(ctx.term(0)), buildTerm(ctx.term(1)));
        return ctx.NEQ() != null ? Formula.not(equation) : equation;
    }

    @Override
    public Formula visitPredicate(PredicateContext ctx) {
        Term term = buildTerm(ctx.term());
        return Formula.predicate(term.label(), term.args());
    }

    //endregion

    //region TERMINI

    /**
     * Converte un sottoalbero di termine; i termini non sono formule e
     * quindi non passano dal visitor generico.
     */
    Term buildTerm(TermContext ctx) {
        if (ctx instanceof VariableContext variable) {
            return new Term(variable.VARIABLE().getText());
        }
        ApplicationContext application = (ApplicationContext) ctx;
        List<Term> args = new ArrayList<>();
        for (TermContext arg : application.term()) {
            args.add(buildTerm(arg));
        }
        return new Term(application.FUNCTOR().getText(), args);
    }

    //endregion
}
