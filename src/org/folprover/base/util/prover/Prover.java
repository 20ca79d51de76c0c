package org.folprover.base.util.prover;

import java.util.List;

import org.folprover.base.util.fol.grammar.FolFormula;
import org.folprover.base.util.prover.exceptions.InvalidFormulaException;

public interface Prover
{
  public ProofResult prove(List<FolFormula> knowledgeBase, FolFormula query) throws InvalidFormulaException;
  public ProofResult prove(List<FolFormula> knowledgeBase,
                           FolFormula query,
                           ResourceLimits limits) throws InvalidFormulaException;
  public boolean entails(List<FolFormula> knowledgeBase, FolFormula query) throws InvalidFormulaException;
}
