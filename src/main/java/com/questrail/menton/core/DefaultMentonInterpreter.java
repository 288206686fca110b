package com.questrail.menton.core;

import com.questrail.menton.api.MentonException;
import com.questrail.menton.api.MentonInterpreter;
import com.questrail.menton.api.RunResult;
import com.questrail.menton.config.MentonContext;
import com.questrail.menton.exec.DecoderExecutor;
import com.questrail.menton.exec.ExecutionResult;
import com.questrail.menton.model.Program;
import com.questrail.menton.observability.MentonObservabilitySink;
import com.questrail.menton.observability.RunCompletedEvent;
import com.questrail.menton.observability.RunFailedEvent;
import com.questrail.menton.observability.Slf4jMentonObservabilitySink;
import com.questrail.menton.parse.BlockParser;
import com.questrail.menton.source.LogicalLine;
import com.questrail.menton.source.SourcePreprocessor;
import com.questrail.menton.source.SourceText;
import com.questrail.menton.source.impl.DefaultSourcePreprocessor;

import java.util.List;
import java.util.Objects;

/**
 * DefaultMentonInterpreter
 * =============================================================================
 * Standard {@link MentonInterpreter}: preprocessor, block parser and
 * decoder/executor wired over one immutable {@link MentonContext}.
 *
 * <p>Every collaborator is immutable or stateless, and every piece of
 * per-run state is created inside the call. Two runs never observe each
 * other, whether they are sequential or concurrent.</p>
 */
public final class DefaultMentonInterpreter implements MentonInterpreter {

    private final MentonContext context;
    private final SourcePreprocessor preprocessor;
    private final BlockParser parser;
    private final DecoderExecutor executor;
    private final MentonObservabilitySink observabilitySink;

    private DefaultMentonInterpreter(Builder builder) {
        this.context = Objects.requireNonNull(builder.context, "context");
        this.preprocessor = Objects.requireNonNull(builder.preprocessor, "preprocessor");
        this.observabilitySink = Objects.requireNonNull(builder.observabilitySink, "observabilitySink");
        this.parser = new BlockParser(context.config().markers());
        this.executor = new DecoderExecutor();
    }

    /**
     * Returns an interpreter over the standard context that logs via SLF4J.
     */
    public static DefaultMentonInterpreter withDefaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public MentonContext context() {
        return context;
    }

    @Override
    public RunResult run(String sourceText) {
        Objects.requireNonNull(sourceText, "sourceText");
        try {
            return new RunResult.Decoded(execute(sourceText));
        }
        catch (MentonException e) {
            return new RunResult.Failed(e);
        }
    }

    @Override
    public RunResult run(byte[] utf8Source) {
        Objects.requireNonNull(utf8Source, "utf8Source");
        final String sourceText;
        try {
            sourceText = SourceText.decodeUtf8(utf8Source);
        }
        catch (MentonException e) {
            reportFailure(e);
            return new RunResult.Failed(e);
        }
        return run(sourceText);
    }

    @Override
    public String execute(String sourceText) {
        Objects.requireNonNull(sourceText, "sourceText");
        try {
            List<LogicalLine> lines = preprocessor.preprocess(sourceText);
            Program program = parser.parse(lines);
            ExecutionResult result = executor.execute(program, context);

            observabilitySink.onRunCompleted(new RunCompletedEvent(
                context.config().wallClock().now(),
                lines.size(),
                result.utterances(),
                result.steps(),
                result.output().length()));

            return result.output();
        }
        catch (MentonException e) {
            reportFailure(e);
            throw e;
        }
    }

    private void reportFailure(MentonException e) {
        observabilitySink.onRunFailed(new RunFailedEvent(context.config().wallClock().now(), e));
    }

    public static final class Builder {
        private MentonContext context = MentonContext.standard();
        private SourcePreprocessor preprocessor = new DefaultSourcePreprocessor();
        private MentonObservabilitySink observabilitySink = new Slf4jMentonObservabilitySink();

        public Builder withContext(MentonContext context) {
            this.context = context;
            return this;
        }

        public Builder withPreprocessor(SourcePreprocessor preprocessor) {
            this.preprocessor = preprocessor;
            return this;
        }

        public Builder withObservabilitySink(MentonObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public DefaultMentonInterpreter build() {
            return new DefaultMentonInterpreter(this);
        }
    }
}
