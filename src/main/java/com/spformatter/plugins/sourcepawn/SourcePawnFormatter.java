package com.spformatter.plugins.sourcepawn;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.spformatter.api.error.FormattingException;
import com.spformatter.api.error.SyntaxError;
import com.spformatter.config.FormattingOptions;
import com.spformatter.plugins.sourcepawn.diagnostics.DiagnosticsCollector;
import com.spformatter.plugins.sourcepawn.parser.SourcePawnParser;
import com.spformatter.plugins.sourcepawn.recovery.FragmentFormatter;
import com.spformatter.plugins.sourcepawn.recovery.TerminatorPolicy;
import com.spformatter.plugins.sourcepawn.render.RenderTracer;
import com.spformatter.plugins.sourcepawn.render.Renderer;
import com.spformatter.syntax.SourceParser;
import com.spformatter.syntax.SyntaxTree;
import com.spformatter.util.LoggerUtil;

/**
 * Formats SourcePawn source text.
 *
 * <p>Each call parses the input and runs the strategy chain: direct rendering for clean
 * trees, recovery of misclassified shapes for malformed ones, then fragment wrapping. The
 * first strategy that produces text wins. When none does, a {@link FormattingException}
 * carries the syntax errors of the input.
 *
 * <p>An instance owns its parser and is not meant to be shared between threads.
 */
public class SourcePawnFormatter implements AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(SourcePawnFormatter.class);

    private final FormattingOptions options;
    private final SourceParser parser;
    private final List<FormattingStrategy> strategies;
    private final DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    private volatile boolean closed = false;

    public SourcePawnFormatter(FormattingOptions options) {
        this(options, new SourcePawnParser(), RenderTracer.NONE);
    }

    public SourcePawnFormatter(FormattingOptions options, SourceParser parser, RenderTracer tracer) {
        this.options = options;
        this.parser = parser;
        Renderer renderer = new Renderer(options, tracer);
        this.strategies = List.of(
                new DirectRenderingStrategy(renderer),
                new RecoveryStrategy(renderer),
                new FragmentFormatter(renderer));
    }

    /**
     * Formats the source.
     *
     * @throws FormattingException when no strategy can format the input
     * @throws com.spformatter.syntax.ParseFailureException when the parser produces no tree
     * @throws IllegalStateException after {@link #close()}
     */
    public String format(String source) {
        return formatWithReport(source).getText();
    }

    /**
     * Formats the source and reports which strategy produced the text.
     */
    public FormatOutcome formatWithReport(String source) {
        _ensureOpen();
        String normalized = _normalizeLineEndings(source);
        if (normalized.isBlank()) {
            return new FormatOutcome("", FormatOutcome.Strategy.DIRECT, List.of());
        }

        try (SyntaxTree tree = parser.parse(normalized)) {
            FormattingRequest request = new FormattingRequest(normalized, tree, parser);
            for (FormattingStrategy strategy : strategies) {
                if (!strategy.accepts(request)) {
                    continue;
                }
                Optional<String> result = strategy.apply(request);
                if (result.isPresent()) {
                    String text = TerminatorPolicy.apply(normalized, tree == null ? null : tree.getRoot(),
                            result.get());
                    List<SyntaxError> errors = strategy.kind() == FormatOutcome.Strategy.DIRECT
                            ? List.of()
                            : diagnostics.collectErrors(tree, normalized);
                    logger.fine(() -> "Formatted with strategy " + strategy.kind());
                    return new FormatOutcome(_applyLineEnding(text), strategy.kind(), errors);
                }
            }

            List<SyntaxError> errors = diagnostics.collectErrors(tree, normalized);
            String report = errors.stream()
                    .map(SyntaxError::getDetailedDescription)
                    .collect(Collectors.joining("\n\n"));
            throw new FormattingException(
                    errors.isEmpty() ? "Unable to format source" : "Unable to format source:\n" + report, errors);
        }
    }

    /**
     * Syntax errors of the source without formatting it.
     */
    public List<SyntaxError> getSyntaxErrors(String source) {
        _ensureOpen();
        String normalized = _normalizeLineEndings(source);
        if (normalized.isBlank()) {
            return List.of();
        }
        try (SyntaxTree tree = parser.parse(normalized)) {
            return diagnostics.collectErrors(tree, normalized);
        }
    }

    public FormattingOptions getOptions() {
        return options;
    }

    public boolean isClosed() {
        return closed;
    }

    private void _ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Formatter has been closed");
        }
    }

    private static String _normalizeLineEndings(String source) {
        if (source == null) {
            return "";
        }
        return source.replace("\r\n", "\n").replace('\r', '\n');
    }

    private String _applyLineEnding(String text) {
        String ending = options.getLineEnding();
        return "\n".equals(ending) ? text : text.replace("\n", ending);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        parser.close();
    }
}
