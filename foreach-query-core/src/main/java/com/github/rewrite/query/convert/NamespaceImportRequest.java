package com.github.rewrite.query.convert;

import lombok.Value;

/**
 * Asks the host to import the namespace that provides the query operators.
 * Hosts apply it only if the import is still missing.
 */
@Value
public class NamespaceImportRequest {
    String namespace;
}
