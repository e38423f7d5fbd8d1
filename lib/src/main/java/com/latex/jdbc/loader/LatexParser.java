package com.latex.jdbc.loader;

import com.latex.jdbc.loader.LoaderMessage.Category;
import com.latex.jdbc.loader.ast.Command;
import com.latex.jdbc.loader.ast.Environment;
import com.latex.jdbc.loader.ast.MathSpan;
import com.latex.jdbc.loader.ast.SourceLocation;
import com.latex.jdbc.loader.lexer.Token;
import com.latex.jdbc.loader.lexer.TokenKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Recognises command invocations, environment blocks and math spans in a token list.
 *
 * <p>Every command token yields a {@link Command}, including commands that sit inside another
 * command's argument, so a {@code \label} inside a {@code \caption} is still seen. Environments
 * are matched with an explicit stack of open frames; a block whose end never appears is dropped
 * with a warning and the blocks opened inside it are attached to the next enclosing frame.
 *
 * <p>Instances hold per-run state and must not be shared between threads.
 */
public final class LatexParser {

    /** Delimiter commands whose following bracket is part of the formula, not an argument. */
    private static final Set<String> NO_ARGUMENT_COMMANDS =
            Set.of(
                    "left", "right", "middle", "big", "Big", "bigg", "Bigg", "bigl", "bigr", "Bigl",
                    "Bigr", "biggl", "biggr", "Biggl", "Biggr");

    /**
     * Environments that take no arguments after their name, so a bracket or brace group right
     * after {@code \begin{name}} belongs to the body.
     */
    private static final Set<String> BARE_ENVIRONMENTS =
            Set.of(
                    "equation", "equation*", "align", "align*", "flalign", "flalign*", "eqnarray",
                    "eqnarray*", "gather", "gather*", "multline", "multline*", "split", "math",
                    "displaymath", "matrix", "pmatrix", "bmatrix", "Bmatrix", "vmatrix", "Vmatrix",
                    "smallmatrix", "cases", "document", "abstract", "center", "flushleft",
                    "flushright", "quote", "quotation", "verse", "verbatim", "verbatim*", "titlepage",
                    "appendix");

    private final String sourceName;
    private final LoaderOptions options;

    private List<Token> tokens;
    private String source;
    private int base;
    private List<Command> commands;
    private List<Environment> topLevel;
    private List<MathSpan> mathSpans;
    private List<LoaderMessage> messages;
    private Deque<Frame> frames;
    private Token openMath;

    public LatexParser(String sourceName, LoaderOptions options) {
        this.sourceName = sourceName == null ? "" : sourceName;
        this.options = Objects.requireNonNull(options, "options");
    }

    public ParseResult parse(List<Token> input) {
        this.tokens = List.copyOf(Objects.requireNonNull(input, "input"));
        StringBuilder text = new StringBuilder();
        for (Token token : tokens) {
            text.append(token.getText());
        }
        this.source = text.toString();
        this.base = tokens.isEmpty() ? 0 : tokens.get(0).getOffset();
        this.commands = new ArrayList<>();
        this.topLevel = new ArrayList<>();
        this.mathSpans = new ArrayList<>();
        this.messages = new ArrayList<>();
        this.frames = new ArrayDeque<>();
        this.openMath = null;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.getKind()) {
                case COMMAND -> handleCommand(i);
                case ENVIRONMENT_BEGIN -> handleBegin(i);
                case ENVIRONMENT_END -> handleEnd(i);
                case MATH_INLINE, MATH_DISPLAY -> handleMathDelimiter(token, token.getText(), token.getText());
                default -> {
                    // text, whitespace and structural tokens carry no meaning on their own here
                }
            }
        }
        finish();
        return new ParseResult(commands, topLevel, mathSpans, messages);
    }

    private void handleCommand(int index) {
        Token token = tokens.get(index);
        String text = token.getText();
        switch (text) {
            case "\\(" -> handleMathDelimiter(token, "\\(", "\\)");
            case "\\)" -> handleMathClose(token, "\\(");
            case "\\[" -> handleMathDelimiter(token, "\\[", "\\]");
            case "\\]" -> handleMathClose(token, "\\[");
            default -> commands.add(parseCommand(index, Shape.GENERIC));
        }
    }

    private void handleBegin(int index) {
        Command begin = parseCommand(index, Shape.BEGIN);
        commands.add(begin);
        String name = environmentName(begin);
        if (name == null) {
            messages.add(warning(Category.ENVIRONMENT, "\\begin without an environment name", begin.getLocation()));
            return;
        }
        if (frames.size() >= options.getMaxEnvironmentDepth()) {
            messages.add(
                    error(
                            Category.ENVIRONMENT,
                            "Environment nesting deeper than "
                                    + options.getMaxEnvironmentDepth()
                                    + " levels; ignoring \\begin{"
                                    + name
                                    + "}",
                            begin.getLocation()));
            frames.peek().skippedBegins.merge(name, 1, Integer::sum);
            return;
        }
        List<String> arguments = begin.getArguments();
        frames.push(new Frame(name, begin, arguments.subList(1, arguments.size()), begin.getEndOffset()));
    }

    private void handleEnd(int index) {
        Command end = parseCommand(index, Shape.END);
        commands.add(end);
        String name = environmentName(end);
        if (name == null) {
            messages.add(warning(Category.ENVIRONMENT, "\\end without an environment name", end.getLocation()));
            return;
        }
        // Skipped begins only ever sit on the innermost frame; their ends are swallowed first.
        Frame innermost = frames.peek();
        if (innermost != null && innermost.skippedBegins.getOrDefault(name, 0) > 0) {
            innermost.skippedBegins.merge(name, -1, Integer::sum);
            return;
        }
        if (!containsFrame(name)) {
            messages.add(
                    warning(
                            Category.ENVIRONMENT,
                            "\\end{" + name + "} has no matching \\begin{" + name + "}",
                            end.getLocation()));
            return;
        }
        while (!frames.peek().name.equals(name)) {
            Frame unclosed = frames.pop();
            messages.add(
                    warning(
                            Category.ENVIRONMENT,
                            "\\begin{" + unclosed.name + "} is not closed before \\end{" + name + "}; dropped",
                            unclosed.begin.getLocation()));
            Frame parent = frames.peek();
            parent.children.addAll(unclosed.children);
            unclosed.skippedBegins.forEach((skipped, count) -> parent.skippedBegins.merge(skipped, count, Integer::sum));
        }
        Frame frame = frames.pop();
        String content = slice(frame.contentStart, end.getOffset());
        Environment environment =
                new Environment(
                        name,
                        frame.beginArguments,
                        frame.begin.getOptionalArguments(),
                        content,
                        frame.begin.getLocation(),
                        end.getLocation(),
                        end.getEndOffset(),
                        frame.children);
        childrenOf(frames.peek()).add(environment);
    }

    private void finish() {
        while (!frames.isEmpty()) {
            Frame unclosed = frames.pop();
            messages.add(
                    warning(
                            Category.ENVIRONMENT,
                            "\\begin{" + unclosed.name + "} is never closed; dropped",
                            unclosed.begin.getLocation()));
            childrenOf(frames.peek()).addAll(unclosed.children);
        }
        if (openMath != null) {
            messages.add(
                    warning(
                            Category.MATH,
                            "Math delimiter " + openMath.getText() + " is never closed",
                            locationOf(openMath)));
            openMath = null;
        }
    }

    private void handleMathDelimiter(Token token, String opener, String closer) {
        if (openMath == null) {
            openMath = token;
            return;
        }
        if (openMath.getText().equals(opener) && opener.equals(closer)) {
            closeMath(token);
        }
        // a different opener inside an open span is formula content
    }

    private void handleMathClose(Token token, String opener) {
        if (openMath != null && openMath.getText().equals(opener)) {
            closeMath(token);
        } else if (openMath == null) {
            messages.add(
                    warning(Category.MATH, "Math delimiter " + token.getText() + " closes nothing", locationOf(token)));
        }
    }

    private void closeMath(Token closer) {
        String delimiter = openMath.getText();
        boolean display = !"$".equals(delimiter) && !"\\(".equals(delimiter);
        mathSpans.add(
                new MathSpan(
                        display,
                        delimiter,
                        slice(openMath.getEndOffset(), closer.getOffset()),
                        locationOf(openMath),
                        closer.getEndOffset()));
        openMath = null;
    }

    /**
     * Parses the command at {@code index} with its arguments. Optional bracket arguments are only
     * accepted before the first brace argument, except for {@code begin}, whose arguments after
     * the environment name may interleave but must stay on the same line. Environments in
     * {@link #BARE_ENVIRONMENTS} read nothing after their name.
     */
    private Command parseCommand(int index, Shape shape) {
        Token token = tokens.get(index);
        String raw = token.getText().substring(1);
        boolean letters = !raw.isEmpty() && isAsciiLetter(raw.charAt(0));
        boolean starForm = letters && raw.endsWith("*");
        String name = starForm ? raw.substring(0, raw.length() - 1) : raw;
        List<String> optional = new ArrayList<>();
        List<String> mandatory = new ArrayList<>();
        int endOffset = token.getEndOffset();
        if (!letters || NO_ARGUMENT_COMMANDS.contains(name)) {
            return new Command(name, mandatory, optional, starForm, locationOf(token), endOffset);
        }
        int cursor = index + 1;
        while (!(shape == Shape.END && mandatory.size() == 1)) {
            if (shape == Shape.BEGIN
                    && mandatory.size() == 1
                    && BARE_ENVIRONMENTS.contains(mandatory.get(0).trim())) {
                break;
            }
            int next = skipFiller(cursor, shape == Shape.GENERIC || mandatory.isEmpty());
            if (next < 0) {
                break;
            }
            TokenKind kind = tokens.get(next).getKind();
            boolean bracket = kind == TokenKind.BRACKET_OPEN && (mandatory.isEmpty() || shape == Shape.BEGIN);
            if (!bracket && kind != TokenKind.BRACE_OPEN) {
                break;
            }
            int close = bracket ? findBracketClose(next) : findBraceClose(next);
            if (close < 0) {
                messages.add(
                        warning(
                                Category.ARGUMENT,
                                "Unclosed " + (bracket ? "[" : "{") + " in argument of \\" + name,
                                locationOf(tokens.get(next))));
                break;
            }
            String value = slice(tokens.get(next).getEndOffset(), tokens.get(close).getOffset());
            if (bracket) {
                optional.add(value);
            } else {
                mandatory.add(value);
            }
            endOffset = tokens.get(close).getEndOffset();
            cursor = close + 1;
        }
        return new Command(name, mandatory, optional, starForm, locationOf(token), endOffset);
    }

    /**
     * Returns the index of the first token at or after {@code index} that is not whitespace or a
     * comment, or -1 when the input ends or a paragraph break (blank line) intervenes.
     */
    private int skipFiller(int index, boolean allowNewline) {
        int newlines = 0;
        int i = index;
        while (i < tokens.size()) {
            TokenKind kind = tokens.get(i).getKind();
            if (kind == TokenKind.NEWLINE) {
                newlines++;
                if (!allowNewline || newlines > 1) {
                    return -1;
                }
            } else if (kind != TokenKind.WHITESPACE && kind != TokenKind.COMMENT) {
                return i;
            }
            i++;
        }
        return -1;
    }

    private int findBraceClose(int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            TokenKind kind = tokens.get(i).getKind();
            if (kind == TokenKind.BRACE_OPEN) {
                depth++;
            } else if (kind == TokenKind.BRACE_CLOSE) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /** Brackets are only counted outside braces, so {@code [{]}]} closes at the last bracket. */
    private int findBracketClose(int open) {
        int brackets = 0;
        int braces = 0;
        for (int i = open; i < tokens.size(); i++) {
            switch (tokens.get(i).getKind()) {
                case BRACE_OPEN -> braces++;
                case BRACE_CLOSE -> braces = Math.max(0, braces - 1);
                case BRACKET_OPEN -> {
                    if (braces == 0) {
                        brackets++;
                    }
                }
                case BRACKET_CLOSE -> {
                    if (braces == 0) {
                        brackets--;
                        if (brackets == 0) {
                            return i;
                        }
                    }
                }
                default -> {
                    // content
                }
            }
        }
        return -1;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean containsFrame(String name) {
        Iterator<Frame> iterator = frames.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().name.equals(name)) {
                return true;
            }
        }
        return false;
    }

    private List<Environment> childrenOf(Frame frame) {
        return frame == null ? topLevel : frame.children;
    }

    private static String environmentName(Command command) {
        String first = command.firstArgument();
        if (first == null) {
            return null;
        }
        String name = first.trim();
        return name.isEmpty() ? null : name;
    }

    private String slice(int startOffset, int endOffset) {
        int start = Math.max(0, startOffset - base);
        int end = Math.max(start, Math.min(source.length(), endOffset - base));
        return source.substring(start, end);
    }

    private SourceLocation locationOf(Token token) {
        return new SourceLocation(sourceName, token.getLine(), token.getColumn(), token.getOffset());
    }

    private LoaderMessage warning(Category category, String message, SourceLocation location) {
        return LoaderMessage.warning(category, message, sourceName, location.getLine(), location.getColumn());
    }

    private LoaderMessage error(Category category, String message, SourceLocation location) {
        return LoaderMessage.error(category, message, sourceName, location.getLine(), location.getColumn());
    }

    private enum Shape {
        GENERIC,
        BEGIN,
        END
    }

    private static final class Frame {
        private final String name;
        private final Command begin;
        private final List<String> beginArguments;
        private final int contentStart;
        private final List<Environment> children = new ArrayList<>();
        private final Map<String, Integer> skippedBegins = new HashMap<>();

        private Frame(String name, Command begin, List<String> beginArguments, int contentStart) {
            this.name = name;
            this.begin = begin;
            this.beginArguments = List.copyOf(beginArguments);
            this.contentStart = contentStart;
        }
    }
}
