package com.vcalc.latex.parser;

import com.vcalc.latex.EvaluationException;

/**
 * Computes the value an assignment statement binds.
 *
 * Implementations must not mutate {@code env}: the caller binds the returned
 * value only when evaluation succeeds, so a failed statement leaves no trace.
 */
public interface Evaluator {

    /**
     * @param stmt an {@link Statement.AssignStmt} or {@link Statement.AugAssignStmt}
     *             with a single plain-name target
     * @return the new value of the target
     * @throws EvaluationException for any runtime error (undefined name, bad operand types, zero division, ...)
     */
    Value evaluate(Statement.Stmt stmt, Environment env) throws EvaluationException;
}
