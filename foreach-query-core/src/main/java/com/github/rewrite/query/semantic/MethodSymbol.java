package com.github.rewrite.query.semantic;

import lombok.Value;

@Value
public class MethodSymbol {
    String name;
    TypeSymbol containingType;
    int parameterCount;
}
