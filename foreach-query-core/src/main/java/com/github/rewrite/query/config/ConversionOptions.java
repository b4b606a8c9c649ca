/*
 * Copyright 2021 - 2023 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.rewrite.query.config;

import com.github.rewrite.query.analysis.StrategyKind;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Settings for foreach-to-query conversion.
 * <p>
 * If no query-conversion.yaml exists in the project root, defaults are used.
 * <p>
 * Example query-conversion.yaml:
 * <pre>
 * conversion:
 *   queryNamespace: System.Linq       # namespace that must be imported for query operators
 *   convertLocalDeclarations: true    # turn local declarations into let clauses
 *   listAddMethod: Add                # method of the generic list type that appends one item
 *   strategies:                       # rewrites that may be offered
 *     - default
 *     - count
 *     - toList
 *     - yieldReturn
 * </pre>
 * A strategy missing from the list is never chosen; loops that would use it fall back
 * to the default strategy (or are not converted at all when {@code default} is missing too).
 *
 * @see ConversionOptionsLoader
 */
public class ConversionOptions {

    public static final String DEFAULT_QUERY_NAMESPACE = "System.Linq";

    public static final String DEFAULT_LIST_ADD_METHOD = "Add";

    private static final Set<StrategyKind> ALL_STRATEGIES =
            Collections.unmodifiableSet(EnumSet.allOf(StrategyKind.class));

    private final String queryNamespace;
    private final boolean convertLocalDeclarations;
    private final String listAddMethod;
    private final Set<StrategyKind> enabledStrategies;

    /**
     * Creates options; {@code null} arguments take their defaults.
     */
    public ConversionOptions(String queryNamespace,
                             Boolean convertLocalDeclarations,
                             String listAddMethod,
                             Collection<StrategyKind> enabledStrategies) {
        if (queryNamespace != null && queryNamespace.isBlank()) {
            throw new ConfigurationException("queryNamespace must not be blank");
        }
        if (listAddMethod != null && listAddMethod.isBlank()) {
            throw new ConfigurationException("listAddMethod must not be blank");
        }
        this.queryNamespace = queryNamespace != null ? queryNamespace.trim() : DEFAULT_QUERY_NAMESPACE;
        this.convertLocalDeclarations = convertLocalDeclarations == null || convertLocalDeclarations;
        this.listAddMethod = listAddMethod != null ? listAddMethod.trim() : DEFAULT_LIST_ADD_METHOD;
        this.enabledStrategies = enabledStrategies != null
                ? Collections.unmodifiableSet(enabledStrategies.isEmpty()
                        ? EnumSet.noneOf(StrategyKind.class)
                        : EnumSet.copyOf(enabledStrategies))
                : ALL_STRATEGIES;
    }

    /**
     * All strategies enabled, local declarations converted, {@code System.Linq} as query namespace.
     */
    public static ConversionOptions defaults() {
        return new ConversionOptions(null, null, null, null);
    }

    public ConversionOptions withQueryNamespace(String queryNamespace) {
        return new ConversionOptions(queryNamespace, convertLocalDeclarations, listAddMethod, enabledStrategies);
    }

    public ConversionOptions withConvertLocalDeclarations(boolean convertLocalDeclarations) {
        return new ConversionOptions(queryNamespace, convertLocalDeclarations, listAddMethod, enabledStrategies);
    }

    public ConversionOptions withEnabledStrategies(Collection<StrategyKind> enabledStrategies) {
        return new ConversionOptions(queryNamespace, convertLocalDeclarations, listAddMethod, enabledStrategies);
    }

    /**
     * The namespace providing the query operators.
     *
     * @return the namespace (default: System.Linq)
     */
    public String getQueryNamespace() {
        return queryNamespace;
    }

    /**
     * Whether local declarations inside the loop become let clauses.
     *
     * @return the flag (default: true)
     */
    public boolean isConvertLocalDeclarations() {
        return convertLocalDeclarations;
    }

    public ConversionOptions withListAddMethod(String listAddMethod) {
        return new ConversionOptions(queryNamespace, convertLocalDeclarations, listAddMethod, enabledStrategies);
    }

    /**
     * Name of the single-argument list method whose calls select the to-list rewrite.
     *
     * @return the method name (default: Add)
     */
    public String getListAddMethod() {
        return listAddMethod;
    }

    public Set<StrategyKind> getEnabledStrategies() {
        return enabledStrategies;
    }

    public boolean isEnabled(StrategyKind kind) {
        return enabledStrategies.contains(kind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConversionOptions)) {
            return false;
        }
        ConversionOptions that = (ConversionOptions) o;
        return convertLocalDeclarations == that.convertLocalDeclarations &&
               queryNamespace.equals(that.queryNamespace) &&
               listAddMethod.equals(that.listAddMethod) &&
               enabledStrategies.equals(that.enabledStrategies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queryNamespace, convertLocalDeclarations, listAddMethod, enabledStrategies);
    }

    @Override
    public String toString() {
        return "ConversionOptions{" +
               "queryNamespace='" + queryNamespace + '\'' +
               ", convertLocalDeclarations=" + convertLocalDeclarations +
               ", listAddMethod='" + listAddMethod + '\'' +
               ", enabledStrategies=" + enabledStrategies +
               '}';
    }
}
