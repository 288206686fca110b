package com.questrail.menton.parse;

import com.questrail.menton.api.InvalidOperandException;
import com.questrail.menton.api.MalformedBlockException;
import com.questrail.menton.api.UnterminatedBlockException;
import com.questrail.menton.api.UnterminatedUtteranceException;
import com.questrail.menton.config.MarkerSet;
import com.questrail.menton.model.AddValue;
import com.questrail.menton.model.Comparison;
import com.questrail.menton.model.Condition;
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
import com.questrail.menton.model.WordGroup;
import com.questrail.menton.source.LogicalLine;
import com.questrail.menton.symbol.GlyphRun;
import com.questrail.menton.symbol.Numerals;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * BlockParser
 * ============================================================================
 * Groups logical lines into a {@link Program}.
 *
 * <h2>Utterances</h2>
 * Utterances are recognised by a three-state machine:
 *
 * <pre>
 *   IDLE          + start marker      → IN_UTTERANCE   (new utterance, empty word group)
 *   IN_UTTERANCE  + character line    → IN_WORD_GROUP  (line appended)
 *   IN_WORD_GROUP + character line    → IN_WORD_GROUP  (line appended)
 *   IN_WORD_GROUP + word separator    → IN_UTTERANCE   (group closed)
 *   IN_*          + control marker    → unchanged      (annotation recorded; next line must end)
 *   IN_*          + end marker        → IDLE           (group and utterance closed)
 * </pre>
 *
 * Every other marker transition is a {@link MalformedBlockException} at the
 * offending line. End of input outside {@code IDLE} is an
 * {@link UnterminatedUtteranceException}.
 *
 * <h2>Statements</h2>
 * While {@code IDLE}, non-marker lines must be statements: a register token,
 * an arithmetic keyword, or a block keyword ({@code if}, {@code else},
 * {@code while}, {@code end}). Blocks nest; utterances may appear inside them.
 *
 * <h2>What this parser does NOT do</h2>
 * <ul>
 *   <li>Resolve glyph runs against a symbol table</li>
 *   <li>Evaluate conditions or arithmetic</li>
 * </ul>
 *
 * The parser is stateless between calls and may be shared across threads.
 */
public final class BlockParser
{
    /**
     * Utterance recognition state.
     */
    public enum State {
        IDLE,
        IN_UTTERANCE,
        IN_WORD_GROUP
    }

    private final MarkerSet markers;

    public BlockParser(MarkerSet markers) {
        this.markers = Objects.requireNonNull(markers, "markers");
    }

    /**
     * Parses a complete sequence of logical lines.
     *
     * @param lines preprocessed lines in source order
     * @return the parsed program
     * @throws MalformedBlockException          if a marker or statement is misplaced
     * @throws UnterminatedUtteranceException   if input ends inside an utterance
     * @throws UnterminatedBlockException       if input ends inside an if/while block
     * @throws InvalidOperandException          if a statement operand is unreadable
     */
    public Program parse(List<LogicalLine> lines) {
        Objects.requireNonNull(lines, "lines");

        Session session = new Session();
        for (LogicalLine line : lines) {
            session.accept(line);
        }
        return session.finish();
    }

    // ========================================================================
    // Per-call parse state
    // ========================================================================

    private enum BlockKind {
        IF("if"),
        WHILE("while");

        private final String label;

        BlockKind(String label) {
            this.label = label;
        }
    }

    private static final class Frame {
        final BlockKind kind;
        final int lineNumber;
        final Condition condition;
        final List<Statement> body = new ArrayList<>();
        List<Statement> elseBranch;

        Frame(BlockKind kind, int lineNumber, Condition condition) {
            this.kind = kind;
            this.lineNumber = lineNumber;
            this.condition = condition;
        }

        List<Statement> target() {
            return (elseBranch != null) ? elseBranch : body;
        }

        Statement close() {
            return switch (kind) {
                case IF -> new IfBlock(lineNumber, condition, body,
                        (elseBranch != null) ? elseBranch : List.of());
                case WHILE -> new WhileBlock(lineNumber, condition, body);
            };
        }
    }

    private final class Session {
        private final List<Statement> topLevel = new ArrayList<>();
        private final Deque<Frame> frames = new ArrayDeque<>();

        private State state = State.IDLE;
        private int utteranceStart;
        private List<WordGroup> groups;
        private List<GlyphLine> currentGroup;
        private ControlAnnotation pendingControl;

        void accept(LogicalLine line) {
            if (state == State.IDLE) {
                onIdleLine(line);
            }
            else {
                onUtteranceLine(line);
            }
        }

        Program finish() {
            if (state != State.IDLE) {
                throw new UnterminatedUtteranceException(utteranceStart);
            }
            if (!frames.isEmpty()) {
                Frame innermost = frames.peek();
                throw new UnterminatedBlockException(innermost.lineNumber, innermost.kind.label);
            }
            return new Program(topLevel);
        }

        private List<Statement> target() {
            return frames.isEmpty() ? topLevel : frames.peek().target();
        }

        // --------------------------------------------------------------------
        // Inside an utterance
        // --------------------------------------------------------------------

        private void onUtteranceLine(LogicalLine line) {
            final String text = line.text();
            final int n = line.lineNumber();

            if (pendingControl != null && !markers.isEndMarker(text)) {
                throw new MalformedBlockException(n,
                        "control marker on line " + pendingControl.lineNumber()
                                + " must be followed directly by an end marker");
            }

            if (text.equals(markers.utteranceStart())) {
                throw new MalformedBlockException(n,
                        "start marker inside the utterance opened on line " + utteranceStart);
            }
            if (text.equals(markers.characterEnd())) {
                closeUtterance(n, OutputMode.CHARACTER);
            }
            else if (text.equals(markers.numericEnd())) {
                closeUtterance(n, OutputMode.NUMERIC);
            }
            else if (text.equals(markers.wordSeparator())) {
                closeGroup();
                state = State.IN_UTTERANCE;
            }
            else if (text.equals(markers.controlMarker())) {
                pendingControl = new ControlAnnotation.Inert(n, text);
            }
            else {
                currentGroup.add(new GlyphLine(n, GlyphRun.of(text)));
                state = State.IN_WORD_GROUP;
            }
        }

        private void openUtterance(int lineNumber) {
            utteranceStart = lineNumber;
            groups = new ArrayList<>();
            currentGroup = new ArrayList<>();
            pendingControl = null;
            state = State.IN_UTTERANCE;
        }

        private void closeGroup() {
            if (!currentGroup.isEmpty()) {
                groups.add(new WordGroup(currentGroup));
            }
            currentGroup = new ArrayList<>();
        }

        private void closeUtterance(int endLine, OutputMode mode) {
            closeGroup();
            List<ControlAnnotation> annotations =
                    (pendingControl == null) ? List.of() : List.of(pendingControl);
            target().add(new Utterance(utteranceStart, endLine, mode, groups, annotations));

            groups = null;
            currentGroup = null;
            pendingControl = null;
            state = State.IDLE;
        }

        // --------------------------------------------------------------------
        // Outside utterances
        // --------------------------------------------------------------------

        private void onIdleLine(LogicalLine line) {
            final String text = line.text();
            final int n = line.lineNumber();

            if (text.equals(markers.utteranceStart())) {
                openUtterance(n);
                return;
            }
            if (markers.isEndMarker(text)) {
                throw new MalformedBlockException(n, "end marker without an open utterance");
            }
            if (text.equals(markers.wordSeparator())) {
                throw new MalformedBlockException(n, "word separator outside an utterance");
            }
            if (text.equals(markers.controlMarker())) {
                throw new MalformedBlockException(n, "control marker outside an utterance");
            }

            Optional<Register> register = Registers.lookup(text);
            if (register.isPresent()) {
                target().add(new SelectRegister(n, register.get()));
            }
            else if (text.startsWith(Keywords.IF)) {
                frames.push(new Frame(BlockKind.IF, n, readCondition(text, n)));
            }
            else if (text.equals(Keywords.ELSE)) {
                onElse(n);
            }
            else if (text.startsWith(Keywords.WHILE)) {
                frames.push(new Frame(BlockKind.WHILE, n, readCondition(text, n)));
            }
            else if (text.equals(Keywords.END)) {
                onEnd(n);
            }
            else if (text.startsWith(Keywords.SET)) {
                String rest = operandText(text, Keywords.SET);
                long value = rest.isEmpty() ? 0L : readNumeral(rest, n, "set expects a numeral");
                target().add(new SetValue(n, value));
            }
            else if (text.equals(Keywords.RESET)) {
                target().add(new ResetValue(n));
            }
            else if (text.startsWith(Keywords.ADD)) {
                String rest = operandText(text, Keywords.ADD);
                long amount = rest.isEmpty() ? 1L : readNumeral(rest, n, "add expects a numeral");
                target().add(new AddValue(n, amount));
            }
            else if (text.startsWith(Keywords.SUBTRACT)) {
                String rest = operandText(text, Keywords.SUBTRACT);
                long amount = rest.isEmpty() ? 1L : readNumeral(rest, n, "subtract expects a numeral");
                target().add(new SubtractValue(n, amount));
            }
            else if (text.startsWith(Keywords.MULTIPLY)) {
                target().add(new MultiplyValue(n, readFactor(operandText(text, Keywords.MULTIPLY), n)));
            }
            else {
                throw new MalformedBlockException(n, "unrecognised statement '" + text + "'");
            }
        }

        private void onElse(int n) {
            Frame frame = frames.peek();
            if (frame == null || frame.kind != BlockKind.IF) {
                throw new MalformedBlockException(n, "else without an open if block");
            }
            if (frame.elseBranch != null) {
                throw new MalformedBlockException(n,
                        "second else for the if block opened on line " + frame.lineNumber);
            }
            frame.elseBranch = new ArrayList<>();
        }

        private void onEnd(int n) {
            Frame frame = frames.poll();
            if (frame == null) {
                throw new MalformedBlockException(n, "end without an open block");
            }
            target().add(frame.close());
        }
    }

    // ========================================================================
    // Operand readers
    // ========================================================================

    private static String operandText(String line, String keyword) {
        return line.substring(keyword.length()).strip();
    }

    private static long readNumeral(String text, int lineNumber, String message) {
        OptionalLong value = Numerals.parse(text);
        if (value.isEmpty()) {
            throw new InvalidOperandException(lineNumber, text, message);
        }
        return value.getAsLong();
    }

    private static Operand readFactor(String text, int lineNumber) {
        if (text.isEmpty()) {
            throw new InvalidOperandException(lineNumber, text, "multiply requires an operand");
        }
        Optional<Register> register = Registers.lookup(text);
        if (register.isPresent()) {
            return new Operand.RegisterRef(register.get());
        }
        return new Operand.Literal(readNumeral(text, lineNumber, "multiply expects a register or numeral"));
    }

    /**
     * Reads {@code <keyword> <numeral> [comparator]}. Tokens after the
     * comparator are ignored.
     */
    private static Condition readCondition(String line, int lineNumber) {
        String[] parts = line.split("\\s+");
        if (parts.length < 2) {
            throw new InvalidOperandException(lineNumber, line, "condition is missing its numeral");
        }

        long operand = readNumeral(parts[1], lineNumber, "condition expects a numeral");

        Comparison comparison = Comparison.EQUAL;
        if (parts.length >= 3) {
            comparison = Comparison.forGlyph(parts[2])
                    .orElseThrow(() -> new InvalidOperandException(
                            lineNumber, parts[2], "unknown comparator"));
        }
        return new Condition(operand, comparison);
    }
}
