package com.questrail.menton.exec;

import com.questrail.menton.api.ArithmeticOverflowException;
import com.questrail.menton.api.StepLimitExceededException;
import com.questrail.menton.api.UnknownGlyphPatternException;
import com.questrail.menton.config.MentonContext;
import com.questrail.menton.model.AddValue;
import com.questrail.menton.model.ControlAnnotation;
import com.questrail.menton.model.GlyphLine;
import com.questrail.menton.model.IfBlock;
import com.questrail.menton.model.MultiplyValue;
import com.questrail.menton.model.Operand;
import com.questrail.menton.model.OutputMode;
import com.questrail.menton.model.Program;
import com.questrail.menton.model.Register;
import com.questrail.menton.model.Registers;
import com.questrail.menton.model.ResetValue;
import com.questrail.menton.model.SelectRegister;
import com.questrail.menton.model.SetValue;
import com.questrail.menton.model.Statement;
import com.questrail.menton.model.SubtractValue;
import com.questrail.menton.model.Utterance;
import com.questrail.menton.model.WhileBlock;
import com.questrail.menton.symbol.GlyphRun;
import com.questrail.menton.symbol.Numerals;
import com.questrail.menton.symbol.SymbolTable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.function.LongSupplier;

/**
 * DecoderExecutor
 * ============================================================================
 * Final stage of a run: turns a parsed {@link Program} into output text.
 *
 * <h2>Phases</h2>
 * <ol>
 *   <li><b>Validation.</b> Every character line of every utterance, in source
 *       order and including branches that will never run, must resolve.
 *       Nothing executes until the whole program has passed.</li>
 *   <li><b>Execution.</b> Statements run in order against a fresh register
 *       file; utterances append to a fresh output buffer.</li>
 * </ol>
 *
 * <h2>Resolution rules</h2>
 * <ul>
 *   <li>{@link OutputMode#CHARACTER}: the symbol table entry, appended as one
 *       code point</li>
 *   <li>{@link OutputMode#NUMERIC}: a register token prints its value, a
 *       numeral prints itself, anything else falls back to the symbol table
 *       (so {@code ~} still prints a space)</li>
 * </ul>
 *
 * <p>Failure is all-or-nothing: an exception escapes and the partially filled
 * buffer is discarded with the run.</p>
 *
 * <p>The executor keeps no state between calls. All per-run state lives in
 * {@link Run}.</p>
 */
public final class DecoderExecutor
{
    /**
     * Validates and executes a program.
     *
     * @param program parsed program
     * @param context symbol table and configuration for this run
     * @return the complete output and run statistics
     *
     * @throws UnknownGlyphPatternException  if any character line does not resolve
     * @throws ArithmeticOverflowException   if register arithmetic overflows
     * @throws StepLimitExceededException    if the configured step limit is reached
     */
    public ExecutionResult execute(Program program, MentonContext context) {
        Objects.requireNonNull(program, "program");
        Objects.requireNonNull(context, "context");

        final SymbolTable table = context.symbolTable();
        final List<Utterance> utterances = program.utterances();

        validate(utterances, table);

        Run run = new Run(table, context.config().stepLimit());
        run.executeAll(program.statements());

        return new ExecutionResult(run.output.toString(), run.steps, utterances.size());
    }

    // ========================================================================
    // Validation
    // ========================================================================

    private static void validate(List<Utterance> utterances, SymbolTable table) {
        for (Utterance utterance : utterances) {
            for (ControlAnnotation annotation : utterance.annotations()) {
                checkAnnotation(annotation);
            }
            for (GlyphLine line : utterance.glyphLines()) {
                if (!resolvable(utterance.mode(), line.glyphRun(), table)) {
                    throw new UnknownGlyphPatternException(line.lineNumber(), line.glyphRun().text());
                }
            }
        }
    }

    private static void checkAnnotation(ControlAnnotation annotation) {
        // Placement was enforced by the parser; inert annotations have no effect.
        if (annotation instanceof ControlAnnotation.Inert) {
            return;
        }
        throw new IllegalStateException("Unsupported control annotation: " + annotation);
    }

    private static boolean resolvable(OutputMode mode, GlyphRun run, SymbolTable table) {
        return switch (mode) {
            case CHARACTER -> table.contains(run);
            case NUMERIC -> Registers.lookup(run.text()).isPresent()
                    || Numerals.parse(run.text()).isPresent()
                    || table.contains(run);
        };
    }

    // ========================================================================
    // Execution
    // ========================================================================

    /**
     * Position within one statement list. A cursor owned by a while loop
     * re-tests the loop condition when it runs out of statements.
     */
    private static final class Cursor {
        final List<Statement> statements;
        final WhileBlock loop;
        private int next;

        Cursor(List<Statement> statements, WhileBlock loop) {
            this.statements = statements;
            this.loop = loop;
        }

        boolean hasNext() {
            return next < statements.size();
        }

        Statement next() {
            return statements.get(next++);
        }

        void rewind() {
            next = 0;
        }
    }

    private static final class Run {
        private final SymbolTable table;
        private final long stepLimit;
        private final RegisterFile registers = new RegisterFile();
        private final OutputBuffer output = new OutputBuffer();
        private long steps;

        Run(SymbolTable table, long stepLimit) {
            this.table = table;
            this.stepLimit = stepLimit;
        }

        /**
         * Runs the statements with an explicit cursor stack, so block
         * nesting depth is bounded by heap rather than by the call stack.
         */
        void executeAll(List<Statement> statements) {
            Deque<Cursor> cursors = new ArrayDeque<>();
            cursors.push(new Cursor(statements, null));

            while (!cursors.isEmpty()) {
                Cursor cursor = cursors.peek();
                if (!cursor.hasNext()) {
                    if (cursor.loop != null) {
                        // Each re-test of a while condition counts as a step.
                        step(cursor.loop.lineNumber());
                        if (cursor.loop.condition().test(registers.currentValue())) {
                            cursor.rewind();
                            continue;
                        }
                    }
                    cursors.pop();
                    continue;
                }

                Statement statement = cursor.next();
                step(statement.lineNumber());

                if (statement instanceof IfBlock b) {
                    List<Statement> branch = b.condition().test(registers.currentValue())
                            ? b.thenBranch() : b.elseBranch();
                    cursors.push(new Cursor(branch, null));
                }
                else if (statement instanceof WhileBlock w) {
                    if (w.condition().test(registers.currentValue())) {
                        cursors.push(new Cursor(w.body(), w));
                    }
                }
                else {
                    execute(statement);
                }
            }
        }

        private void execute(Statement statement) {
            if (statement instanceof Utterance u) {
                emit(u);
            }
            else if (statement instanceof SelectRegister s) {
                registers.select(s.register());
            }
            else if (statement instanceof SetValue s) {
                registers.setCurrentValue(s.value());
            }
            else if (statement instanceof ResetValue) {
                registers.setCurrentValue(0L);
            }
            else if (statement instanceof AddValue s) {
                long current = registers.currentValue();
                registers.setCurrentValue(exact(s.lineNumber(), () -> Math.addExact(current, s.amount())));
            }
            else if (statement instanceof SubtractValue s) {
                long current = registers.currentValue();
                registers.setCurrentValue(exact(s.lineNumber(), () -> Math.subtractExact(current, s.amount())));
            }
            else if (statement instanceof MultiplyValue s) {
                long current = registers.currentValue();
                long factor = valueOf(s.factor());
                registers.setCurrentValue(exact(s.lineNumber(), () -> Math.multiplyExact(current, factor)));
            }
            else {
                throw new IllegalStateException("Unsupported statement: " + statement.getClass().getSimpleName());
            }
        }

        private void step(int lineNumber) {
            if (steps >= stepLimit) {
                throw new StepLimitExceededException(lineNumber, stepLimit);
            }
            steps++;
        }

        private long valueOf(Operand operand) {
            if (operand instanceof Operand.RegisterRef ref) {
                return registers.valueOf(ref.register());
            }
            return ((Operand.Literal) operand).value();
        }

        private void emit(Utterance utterance) {
            for (GlyphLine line : utterance.glyphLines()) {
                switch (utterance.mode()) {
                    case CHARACTER -> output.appendCharacter(resolveCharacter(line));
                    case NUMERIC -> emitNumeric(line);
                }
            }
        }

        private int resolveCharacter(GlyphLine line) {
            OptionalInt code = table.resolve(line.glyphRun());
            if (code.isEmpty()) {
                throw new UnknownGlyphPatternException(line.lineNumber(), line.glyphRun().text());
            }
            return code.getAsInt();
        }

        private void emitNumeric(GlyphLine line) {
            final String text = line.glyphRun().text();

            Optional<Register> register = Registers.lookup(text);
            if (register.isPresent()) {
                output.appendNumber(registers.valueOf(register.get()));
                return;
            }
            OptionalLong numeral = Numerals.parse(text);
            if (numeral.isPresent()) {
                output.appendNumber(numeral.getAsLong());
                return;
            }
            output.appendCharacter(resolveCharacter(line));
        }

        private static long exact(int lineNumber, LongSupplier operation) {
            try {
                return operation.getAsLong();
            }
            catch (ArithmeticException e) {
                throw new ArithmeticOverflowException(lineNumber, e);
            }
        }
    }
}
