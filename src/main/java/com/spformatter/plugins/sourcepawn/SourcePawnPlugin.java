package com.spformatter.plugins.sourcepawn;

import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.spformatter.api.FormatterPlugin;
import com.spformatter.api.FormatterResult;
import com.spformatter.api.error.FormatterError;
import com.spformatter.api.error.FormattingException;
import com.spformatter.api.error.Severity;
import com.spformatter.api.error.SyntaxError;
import com.spformatter.config.FormatterConfig;
import com.spformatter.config.FormattingOptions;
import com.spformatter.plugins.sourcepawn.parser.SourcePawnParser;
import com.spformatter.plugins.sourcepawn.render.RenderTracer;
import com.spformatter.syntax.ParseFailureException;
import com.spformatter.util.LoggerUtil;

/**
 * SourcePawn formatter plugin. Every call formats with its own {@link SourcePawnFormatter},
 * so one plugin instance can serve several worker threads.
 */
public class SourcePawnPlugin implements FormatterPlugin, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(SourcePawnPlugin.class);

    private final RenderTracer tracer;
    private volatile FormattingOptions options = FormattingOptions.defaults();

    public SourcePawnPlugin() {
        this(RenderTracer.NONE);
    }

    /**
     * @param tracer called for every rendered node; must be safe to call from several threads
     */
    public SourcePawnPlugin(RenderTracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void initialize(FormatterConfig config) {
        this.options = FormattingOptions.fromConfig(config);
    }

    public FormattingOptions getOptions() {
        return options;
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        try (SourcePawnFormatter formatter = new SourcePawnFormatter(options, new SourcePawnParser(), tracer)) {
            FormatOutcome outcome = formatter.formatWithReport(sourceCode);
            String formatted = _preserveTrailingNewline(sourceCode, outcome.getText(), options.getLineEnding());

            FormatterResult.Builder result = FormatterResult.builder()
                    .successful(true)
                    .formattedCode(formatted)
                    .recovered(outcome.isRecovered());
            if (outcome.isRecovered()) {
                logger.fine(() -> filePath + " formatted through " + outcome.getStrategy());
                result.addError(new FormatterError(Severity.WARNING,
                        "Source has syntax errors; output was rebuilt by " + _describe(outcome.getStrategy()),
                        1, 1, "Review the formatted output"));
                for (SyntaxError error : outcome.getSyntaxErrors()) {
                    result.addError(FormatterError.fromSyntaxError(Severity.INFO, error, null));
                }
            }
            return result.build();
        } catch (FormattingException e) {
            FormatterResult.Builder result = FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode);
            for (SyntaxError error : e.getSyntaxErrors()) {
                result.addError(FormatterError.fromSyntaxError(Severity.ERROR, error, "Fix the syntax error"));
            }
            if (e.getSyntaxErrors().isEmpty()) {
                result.addError(new FormatterError(Severity.ERROR, e.getMessage(), 1, 1));
            }
            return result.build();
        } catch (ParseFailureException e) {
            logger.log(Level.WARNING, "Parser failure for " + filePath, e);
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(Severity.FATAL, e.getMessage(), 1, 1))
                    .build();
        }
    }

    private static String _preserveTrailingNewline(String source, String formatted, String ending) {
        boolean hadNewline = source.endsWith("\n") || source.endsWith("\r");
        if (formatted.isEmpty() || !hadNewline || formatted.endsWith(ending)) {
            return formatted;
        }
        return formatted + ending;
    }

    private static String _describe(FormatOutcome.Strategy strategy) {
        return switch (strategy) {
            case DIRECT -> "direct rendering";
            case RECOVERY -> "error recovery";
            case FRAGMENT -> "fragment formatting";
        };
    }

    @Override
    public void close() {
        logger.fine("SourcePawn plugin closed");
    }
}
