package com.github.rewrite.query;

import com.github.rewrite.query.analysis.ConversionStrategy;
import com.github.rewrite.query.analysis.ForEachChain;
import com.github.rewrite.query.analysis.ForEachChainClassifier;
import com.github.rewrite.query.analysis.StrategyKind;
import com.github.rewrite.query.analysis.TerminalMatcher;
import com.github.rewrite.query.config.ConversionOptions;
import com.github.rewrite.query.config.ConversionOptionsLoader;
import com.github.rewrite.query.convert.AbstractQueryConverter;
import com.github.rewrite.query.convert.ConversionResult;
import com.github.rewrite.query.convert.QueryBuilder;
import com.github.rewrite.query.semantic.AnalysisCanceledException;
import com.github.rewrite.query.semantic.CancellationToken;
import com.github.rewrite.query.semantic.SemanticModel;
import com.github.rewrite.query.syntax.ForEachStatement;
import lombok.Value;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Entry point for hosts: classifies a loop, picks a strategy and builds the replacement.
 * <p>
 * A loop is converted when the matcher selects a specialized strategy, or when the
 * default strategy has at least one clause to contribute besides the root {@code from}.
 * Loops with errors, canceled analyses and loops without any clause yield an empty result.
 * <pre>
 * ForEachToQueryConverter converter = ForEachToQueryConverter.forProject(projectRoot);
 * converter.convert(loop, semanticModel, cancellationToken)
 *          .map(new QueryPrinter()::print)
 *          .ifPresent(replacement -> ...);
 * </pre>
 */
public class ForEachToQueryConverter {

    private static final Logger logger = LogManager.getLogger(ForEachToQueryConverter.class);

    private final ConversionOptions options;
    private final ForEachChainClassifier classifier;
    private final TerminalMatcher matcher;
    private final QueryBuilder builder;

    public ForEachToQueryConverter() {
        this(ConversionOptions.defaults());
    }

    public ForEachToQueryConverter(ConversionOptions options) {
        this.options = options;
        this.classifier = new ForEachChainClassifier(options);
        this.matcher = new TerminalMatcher(options);
        this.builder = new QueryBuilder(options);
    }

    /**
     * Converter configured from {@code query-conversion.yaml} in {@code projectRoot}, if present.
     */
    public static ForEachToQueryConverter forProject(@Nullable Path projectRoot) {
        return new ForEachToQueryConverter(ConversionOptionsLoader.load(projectRoot));
    }

    public ConversionOptions getOptions() {
        return options;
    }

    /**
     * Classification and strategy of a loop, without building the replacement.
     */
    public Optional<Analysis> analyze(ForEachStatement forEachStatement, SemanticModel semanticModel,
                                      CancellationToken cancellationToken) {
        if (semanticModel.containsErrors(forEachStatement)) {
            logger.debug("Skipping loop over '{}': it contains errors", forEachStatement.getExpression());
            return Optional.empty();
        }
        try {
            ForEachChain chain = classifier.classify(forEachStatement, semanticModel);
            ConversionStrategy strategy = matcher.match(chain, cancellationToken);
            if (strategy.getKind() == StrategyKind.DEFAULT && chain.getConvertingNodes().isEmpty()) {
                logger.debug("Loop over '{}' has no clause to convert", forEachStatement.getExpression());
                return Optional.empty();
            }
            if (!options.isEnabled(strategy.getKind())) {
                logger.debug("Strategy {} is disabled", strategy.getKind());
                return Optional.empty();
            }
            return Optional.of(new Analysis(chain, strategy));
        } catch (AnalysisCanceledException e) {
            logger.debug("Analysis of loop over '{}' was canceled", forEachStatement.getExpression());
            return Optional.empty();
        }
    }

    public Optional<ConversionResult> convert(ForEachStatement forEachStatement, SemanticModel semanticModel,
                                              CancellationToken cancellationToken) {
        return analyze(forEachStatement, semanticModel, cancellationToken)
                .map(analysis -> AbstractQueryConverter
                        .create(analysis.getChain(), analysis.getStrategy(), builder)
                        .convert());
    }

    public Optional<ConversionResult> convert(ForEachStatement forEachStatement, SemanticModel semanticModel) {
        return convert(forEachStatement, semanticModel, CancellationToken.NONE);
    }

    @Value
    public static class Analysis {
        ForEachChain chain;
        ConversionStrategy strategy;
    }
}
