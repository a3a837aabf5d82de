package d20;

/** Child traversal helpers called from the generated {@code visitChildren} methods. */
public final class ASTNodeUtils {
  public static <V> V accept(ASTNodeInterface obj, ASTVisitor<V> visitor, V value) {
    return obj.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends ASTNodeInterface> obj, ASTVisitor<V> visitor, V value) {
    for (ASTNodeInterface o : obj) {
      value = accept(o, visitor, value);
    }
    return value;
  }

  private ASTNodeUtils() {}
}
