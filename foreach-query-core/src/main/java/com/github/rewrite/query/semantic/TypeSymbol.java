package com.github.rewrite.query.semantic;

import lombok.Value;

/**
 * A resolved type, identified by the fully qualified name of its original definition
 * (for example {@code System.Collections.Generic.List`1} or {@code java.util.List}).
 */
@Value
public class TypeSymbol {
    String fullyQualifiedName;
}
