package org.folprover.base.util.fol.transforms;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folprover.base.util.fol.FolUtils;
import org.folprover.base.util.fol.grammar.FolFormula;
import org.folprover.base.util.fol.grammar.FolLiteral;
import org.folprover.base.util.fol.grammar.FolPool;
import org.folprover.base.util.fol.grammar.FolVariable;
import org.folprover.base.util.fol.model.ScopeCounter;
import org.folprover.base.util.prover.exceptions.InvalidFormulaException;
import org.folprover.base.validator.StaticValidator;

/**
 * Converts formulas to clausal form.
 *
 * Each formula goes through the same stages, in order:
 * <ol>
 * <li>universal closure of any free variables;
 * <li>{@link ImplicationEliminator};
 * <li>{@link NegationNormalizer};
 * <li>{@link VariableStandardizer};
 * <li>{@link Skolemizer};
 * <li>{@link QuantifierDropper};
 * <li>{@link Distributor};
 * <li>{@link ClauseSplitter}.
 * </ol>
 *
 * All formulas converted by one call share a scope counter and a Skolem symbol generator, so variables and Skolem
 * symbols never clash between formulas.  The clause set produced is satisfiable if and only if the conjunction of the
 * input formulas is.
 */
public class CnfConverter
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final ScopeCounter mCounter;

  /**
   * @param xiCounter - source of fresh variable scope ids.
   */
  public CnfConverter(ScopeCounter xiCounter)
  {
    mCounter = xiCounter;
  }

  /**
   * Convert a knowledge base and the negation of a query, ready for refutation.
   *
   * Free variables in the query are universally closed before it is negated.
   *
   * @return the literals of each clause, knowledge base first, in input order.
   *
   * @param xiKnowledgeBase - the knowledge base.
   * @param xiQuery         - the query.
   *
   * @throws InvalidFormulaException if any formula is malformed.
   */
  public List<List<FolLiteral>> toClauses(List<FolFormula> xiKnowledgeBase,
                                          FolFormula xiQuery) throws InvalidFormulaException
  {
    List<FolFormula> lAll = new ArrayList<>(xiKnowledgeBase);
    lAll.add(xiQuery);
    StaticValidator.validateFormulas(lAll);

    // Closing the query can nest a quantifier for x around one the caller already wrote for x.  That's fine for the
    // later stages, so the closed form isn't validated again.
    List<FolFormula> lFormulas = new ArrayList<>(xiKnowledgeBase);
    lFormulas.add(FolPool.getNot(close(xiQuery)));
    return convertAll(lFormulas);
  }

  /**
   * Convert the conjunction of a list of formulas.
   *
   * @return the literals of each clause, in input order.
   *
   * @param xiFormulas - the formulas.
   *
   * @throws InvalidFormulaException if any formula is malformed.
   */
  public List<List<FolLiteral>> toClauses(List<FolFormula> xiFormulas) throws InvalidFormulaException
  {
    StaticValidator.validateFormulas(xiFormulas);
    return convertAll(xiFormulas);
  }

  private List<List<FolLiteral>> convertAll(List<FolFormula> xiFormulas)
  {
    Set<String> lSignature = new HashSet<>();
    for (FolFormula lFormula : xiFormulas)
    {
      FolUtils.addSymbols(lFormula, lSignature);
    }
    SkolemSymbolGenerator lGenerator = new SkolemSymbolGenerator(lSignature);

    List<List<FolLiteral>> lClauses = new ArrayList<>();
    for (FolFormula lFormula : xiFormulas)
    {
      List<List<FolLiteral>> lFormulaClauses = convert(lFormula, lGenerator);
      LOGGER.debug("Converted " + lFormula + " to " + lFormulaClauses);
      lClauses.addAll(lFormulaClauses);
    }

    LOGGER.debug("Produced " + lClauses.size() + " clauses from " + xiFormulas.size() + " formulas, using " +
                 lGenerator.getGeneratedCount() + " Skolem symbols");
    return lClauses;
  }

  private List<List<FolLiteral>> convert(FolFormula xiFormula, SkolemSymbolGenerator xiGenerator)
  {
    FolFormula lFormula = close(xiFormula);
    lFormula = ImplicationEliminator.run(lFormula);
    lFormula = NegationNormalizer.run(lFormula);
    lFormula = VariableStandardizer.run(lFormula, mCounter);
    lFormula = Skolemizer.run(lFormula, xiGenerator);
    lFormula = QuantifierDropper.run(lFormula);
    lFormula = Distributor.run(lFormula);
    return ClauseSplitter.run(lFormula);
  }

  /**
   * @return the universal closure of a formula.
   */
  private static FolFormula close(FolFormula xiFormula)
  {
    List<FolVariable> lFree = new ArrayList<>(FolUtils.getFreeVariables(xiFormula));
    FolFormula lClosed = xiFormula;
    for (int lii = lFree.size() - 1; lii >= 0; lii--)
    {
      lClosed = FolPool.getForAll(lFree.get(lii), lClosed);
    }
    return lClosed;
  }
}
