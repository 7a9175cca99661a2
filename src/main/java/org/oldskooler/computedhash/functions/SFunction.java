package org.oldskooler.computedhash.functions;

import java.io.Serializable;

/**
 * Getter reference such as {@code Document::getContentHash}. Serializable so the
 * referenced method name can be recovered; see {@code LambdaUtils#propertyName}.
 */
@FunctionalInterface
public interface SFunction<T, R> extends Serializable {
    R apply(T t);
}
