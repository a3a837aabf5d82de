package d20.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a node of the expression tree. The class must implement the generated
 * {@code <Outer>_<Class>_ASTNode} interface, which supplies {@code accept} and {@code
 * visitChildren}.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface ASTNode {}
