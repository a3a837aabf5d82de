package d20;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

abstract class ErrorCollectingValidator extends VoidDefaultASTVisitor {
  private final List<DiceException> errors = new ArrayList<>();

  protected ImmutableList<DiceException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(DiceException ex) {
    errors.add(ex);
  }

  public final ImmutableList<DiceException> computeErrors(Expression expression) {
    expression.accept(this, null);
    return errors();
  }

  // Throws the first error found in source order, if any.
  public final void throwFirstError(Expression expression) throws DiceException {
    ImmutableList<DiceException> found = computeErrors(expression);
    if (!found.isEmpty()) throw found.get(0);
  }
}
