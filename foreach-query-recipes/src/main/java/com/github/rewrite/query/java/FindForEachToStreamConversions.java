package com.github.rewrite.query.java;

import com.github.rewrite.query.ForEachToQueryConverter;
import com.github.rewrite.query.config.ConversionOptions;
import com.github.rewrite.query.config.ConversionOptionsLoader;
import com.github.rewrite.query.convert.ConversionResult;
import com.github.rewrite.query.semantic.CancellationToken;
import com.github.rewrite.query.syntax.ForEachStatement;
import lombok.EqualsAndHashCode;
import lombok.Value;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.openrewrite.ExecutionContext;
import org.openrewrite.Option;
import org.openrewrite.Recipe;
import org.openrewrite.TreeVisitor;
import org.openrewrite.java.JavaIsoVisitor;
import org.openrewrite.java.tree.J;
import org.openrewrite.marker.SearchResult;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Marks enhanced {@code for} loops that can be written as a {@code java.util.stream} pipeline.
 * <p>
 * The loop body is classified into {@code filter}, {@code map} and {@code flatMap} steps; the last
 * statement decides the terminal operation:
 * <ul>
 *   <li>{@code counter++;} becomes {@code counter += ....count();}</li>
 *   <li>{@code list.add(item);} on a {@link java.util.List} becomes {@code list.addAll(....collect(Collectors.toList()));}</li>
 *   <li>anything else stays in a {@code forEach} lambda</li>
 * </ul>
 * The suggested statement is attached as a search result; the source itself is left unchanged.
 * <p>
 * Settings are read from {@code query-conversion.yaml} in the project root:
 * <pre>
 * conversion:
 *   convertLocalDeclarations: true
 *   strategies: [default, count, toList]
 * </pre>
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class FindForEachToStreamConversions extends Recipe {

    private static final Logger logger = LogManager.getLogger(FindForEachToStreamConversions.class);

    @Option(displayName = "Convert local declarations",
            description = "Override query-conversion.yaml: whether initialized local variables inside the loop " +
                          "become map steps. If not set, query-conversion.yaml (or the default, true) is used.",
            example = "false",
            required = false)
    @Nullable
    Boolean convertLocalDeclarations;

    public FindForEachToStreamConversions() {
        this.convertLocalDeclarations = null;
    }

    public FindForEachToStreamConversions(@Nullable Boolean convertLocalDeclarations) {
        this.convertLocalDeclarations = convertLocalDeclarations;
    }

    @Override
    public String getDisplayName() {
        return "Find for-each loops convertible to streams";
    }

    @Override
    public String getDescription() {
        return "Marks enhanced for loops whose body is a chain of nested loops, conditions and local " +
               "variables and suggests the equivalent java.util.stream pipeline. Counting loops and loops " +
               "adding to a list are turned into count() and collect() terminals.";
    }

    @Override
    public TreeVisitor<?, ExecutionContext> getVisitor() {
        return new ForEachToStreamVisitor();
    }

    private ConversionOptions optionsFor(@Nullable Path sourcePath) {
        ConversionOptions options = ConversionOptionsLoader.load(extractProjectRoot(sourcePath))
                .withQueryNamespace(StreamPipelinePrinter.COLLECTORS)
                .withListAddMethod("add");
        if (convertLocalDeclarations != null) {
            options = options.withConvertLocalDeclarations(convertLocalDeclarations);
        }
        return options;
    }

    private static Path extractProjectRoot(@Nullable Path sourcePath) {
        if (sourcePath == null) {
            return Paths.get(System.getProperty("user.dir"));
        }
        Path current = sourcePath.toAbsolutePath().getParent();
        while (current != null) {
            if (Files.exists(current.resolve("pom.xml")) ||
                Files.exists(current.resolve("build.gradle")) ||
                Files.exists(current.resolve(ConversionOptionsLoader.CONFIG_FILE))) {
                return current;
            }
            current = current.getParent();
        }
        return Paths.get(System.getProperty("user.dir"));
    }

    private class ForEachToStreamVisitor extends JavaIsoVisitor<ExecutionContext> {

        private ForEachToQueryConverter converter = new ForEachToQueryConverter();
        private J.@Nullable CompilationUnit compilationUnit;

        @Override
        public J.CompilationUnit visitCompilationUnit(J.CompilationUnit cu, ExecutionContext ctx) {
            converter = new ForEachToQueryConverter(optionsFor(cu.getSourcePath()));
            compilationUnit = cu;
            return super.visitCompilationUnit(cu, ctx);
        }

        @Override
        public J.ForEachLoop visitForEachLoop(J.ForEachLoop forEachLoop, ExecutionContext ctx) {
            Optional<StreamSuggestion> suggestion = suggest(forEachLoop);
            if (suggestion.isPresent()) {
                logger.debug("Suggesting '{}'", suggestion.get().getCode());
                // The suggestion covers the nested loops too
                return SearchResult.found(forEachLoop, suggestion.get().describe());
            }
            return super.visitForEachLoop(forEachLoop, ctx);
        }

        private Optional<StreamSuggestion> suggest(J.ForEachLoop forEachLoop) {
            JavaSyntaxAdapter adapter = new JavaSyntaxAdapter(getCursor());
            ForEachStatement statement = adapter.adapt(forEachLoop);
            JavaTypeSemanticModel semanticModel = new JavaTypeSemanticModel(adapter, compilationUnit);
            Optional<ConversionResult> result = converter.convert(statement, semanticModel, CancellationToken.NONE);
            if (result.isEmpty()) {
                return Optional.empty();
            }
            return new StreamPipelinePrinter(adapter, semanticModel).print(result.get());
        }
    }
}
