package org.xgen.generators.dispatch;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a public method as a named hook for {@link GenerationDispatcher#registerAll(Object)}.
 *
 * <p>Hook names follow {@code <LanguageId><NodeKind>}, e.g. {@code "JavaComplexType"}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface GenerationHook {

    /** Hook name; defaults to the method name. */
    String value() default "";
}
