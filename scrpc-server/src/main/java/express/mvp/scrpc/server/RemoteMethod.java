package express.mvp.scrpc.server;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a public method for {@link FunctionRegistry#registerAnnotated(Object)}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface RemoteMethod {

    /**
     * The name clients call the method by. Defaults to the method name.
     *
     * @return the remote name, or empty for the method name
     */
    String value() default "";
}
