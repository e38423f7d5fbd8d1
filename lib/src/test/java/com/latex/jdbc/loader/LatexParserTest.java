package com.latex.jdbc.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.latex.jdbc.loader.ast.Command;
import com.latex.jdbc.loader.ast.Environment;
import com.latex.jdbc.loader.ast.MathSpan;
import com.latex.jdbc.loader.lexer.LatexTokenizer;
import com.latex.jdbc.testing.TestResources;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LatexParserTest {

    @Test
    void readsOptionalAndMandatoryArguments() {
        Command command = parse("\\includegraphics[width=2cm]{a.png}").getCommands().get(0);

        assertEquals("includegraphics", command.getName());
        assertEquals(List.of("width=2cm"), command.getOptionalArguments());
        assertEquals(List.of("a.png"), command.getArguments());
        assertEquals(34, command.getEndOffset());
    }

    @Test
    void emitsCommandsNestedInsideArguments() {
        List<Command> commands = parse("\\caption{See \\label{x}}").getCommands();

        assertEquals(List.of("caption", "label"), names(commands));
        assertEquals("See \\label{x}", commands.get(0).firstArgument());
        assertEquals("x", commands.get(1).firstArgument());
    }

    @Test
    void bracketAfterBraceArgumentIsText() {
        Command command = parse("\\section{A} [note]").getCommands().get(0);

        assertEquals(List.of("A"), command.getArguments());
        assertTrue(command.getOptionalArguments().isEmpty());
    }

    @Test
    void blankLineEndsArgumentScan() {
        Command command = parse("\\foo\n\n{bar}").getCommands().get(0);

        assertTrue(command.getArguments().isEmpty());
    }

    @Test
    void starFormIsRecorded() {
        Command command = parse("\\section*{Thanks}").getCommands().get(0);

        assertEquals("section", command.getName());
        assertTrue(command.isStarForm());
    }

    @Test
    void delimiterCommandsTakeNoArguments() {
        List<Command> commands = parse("\\left[ x \\right]").getCommands();

        assertEquals(List.of("left", "right"), names(commands));
        assertTrue(commands.get(0).getOptionalArguments().isEmpty());
    }

    @Test
    void unclosedArgumentIsReported() {
        ParseResult result = parse("\\textbf{abc");

        assertTrue(result.getCommands().get(0).getArguments().isEmpty());
        assertEquals(1, result.getMessages().size());
        assertEquals(LoaderMessage.Category.ARGUMENT, result.getMessages().get(0).getCategory());
    }

    @Test
    void matchesNestedEnvironments() {
        ParseResult result =
                parse("\\begin{itemize}\\begin{enumerate}\\item x\\end{enumerate}\\end{itemize}");

        assertEquals(1, result.getEnvironments().size());
        Environment itemize = result.getEnvironments().get(0);
        assertEquals("itemize", itemize.getName());
        assertEquals(1, itemize.getNestedEnvironments().size());
        assertEquals("\\item x", itemize.getNestedEnvironments().get(0).getContent());
        assertEquals(List.of("itemize", "enumerate"), environmentNames(result.getAllEnvironments()));
        assertTrue(result.getMessages().isEmpty());
    }

    @Test
    void keepsArgumentsOfBegin() {
        ParseResult result = parse("\\begin{figure}[ht]\\end{figure}\\begin{tabular}{ll}a&b\\end{tabular}");

        Environment figure = result.getEnvironments().get(0);
        Environment tabular = result.getEnvironments().get(1);
        assertEquals(List.of("ht"), figure.getBeginOptionalArguments());
        assertEquals(List.of("ll"), tabular.getBeginArguments());
        assertEquals("a&b", tabular.getContent());
    }

    @Test
    void unclosedEnvironmentYieldsNoEnvironmentAndOneWarning() {
        ParseResult result = parse("\\begin{equation} x = 1");

        assertTrue(result.getEnvironments().isEmpty());
        assertEquals(1, result.getMessages().size());
        LoaderMessage message = result.getMessages().get(0);
        assertEquals(LoaderMessage.Level.WARNING, message.getLevel());
        assertEquals(LoaderMessage.Category.ENVIRONMENT, message.getCategory());
    }

    @Test
    void strayEndIsReported() {
        ParseResult result = parse("text \\end{foo}");

        assertTrue(result.getEnvironments().isEmpty());
        assertEquals(1, result.getMessages().size());
        assertTrue(result.getMessages().get(0).getMessage().contains("no matching"));
    }

    @Test
    void unclosedInnerEnvironmentIsDroppedAndItsChildrenPromoted() {
        ParseResult result = parse("\\begin{a}\\begin{b}\\begin{c}\\end{c}\\end{a}");

        assertEquals(1, result.getEnvironments().size());
        Environment outer = result.getEnvironments().get(0);
        assertEquals("a", outer.getName());
        assertEquals(List.of("c"), environmentNames(outer.getNestedEnvironments()));
        assertEquals(1, result.getMessages().size());
        assertTrue(result.getMessages().get(0).getMessage().startsWith("\\begin{b}"));
    }

    @Test
    void nestingBeyondTheCapIsAnError() {
        LoaderOptions options = LoaderOptions.defaults().withMaxEnvironmentDepth(2);
        ParseResult result =
                parse("\\begin{a}\\begin{b}\\begin{c}\\end{c}\\end{b}\\end{a}", options);

        assertEquals(List.of("a", "b"), environmentNames(result.getAllEnvironments()));
        assertEquals(1, result.getMessages().size());
        assertEquals(LoaderMessage.Level.ERROR, result.getMessages().get(0).getLevel());
    }

    @Test
    void skippedBeginWithTheSameNameSwallowsItsOwnEnd() {
        LoaderOptions options = LoaderOptions.defaults().withMaxEnvironmentDepth(1);
        ParseResult result = parse("\\begin{a}1\\begin{a}2\\end{a}3\\end{a}", options);

        assertEquals(1, result.getEnvironments().size());
        assertEquals("1\\begin{a}2\\end{a}3", result.getEnvironments().get(0).getContent());
        assertEquals(1, result.getMessages().size());
        assertEquals(LoaderMessage.Level.ERROR, result.getMessages().get(0).getLevel());
    }

    @Test
    void mathEnvironmentKeepsLeadingBracketInItsBody() {
        ParseResult result = parse("\\begin{equation}[0,1]\\times[0,1]\\end{equation}");

        Environment equation = result.getEnvironments().get(0);
        assertEquals("[0,1]\\times[0,1]", equation.getContent());
        assertTrue(equation.getBeginOptionalArguments().isEmpty());
        assertTrue(equation.getBeginArguments().isEmpty());
    }

    @Test
    void nonAsciiControlSymbolTakesNoArguments() {
        Command command = parse("\\\u00e9{x}").getCommands().get(0);

        assertEquals("\u00e9", command.getName());
        assertTrue(command.getArguments().isEmpty());
    }

    @Test
    void pairsMathDelimiters() {
        List<MathSpan> spans = parse("$a$ and \\(b\\) and $$c$$ and \\[d\\]").getMathSpans();

        assertEquals(4, spans.size());
        List<String> contents = new ArrayList<>();
        List<Boolean> display = new ArrayList<>();
        for (MathSpan span : spans) {
            contents.add(span.getContent());
            display.add(span.isDisplay());
        }
        assertEquals(List.of("a", "b", "c", "d"), contents);
        assertEquals(List.of(false, false, true, true), display);
    }

    @Test
    void unmatchedMathDelimitersAreReported() {
        ParseResult unclosed = parse("$a + b");
        ParseResult stray = parse("x \\)");

        assertTrue(unclosed.getMathSpans().isEmpty());
        assertEquals(LoaderMessage.Category.MATH, unclosed.getMessages().get(0).getCategory());
        assertTrue(stray.getMessages().get(0).getMessage().contains("closes nothing"));
    }

    @Test
    void capturedArgumentsAreBalanced() {
        ParseResult result = parse(TestResources.readResource("documents/paper.tex"));

        for (Command command : result.getCommands()) {
            for (String argument : command.getArguments()) {
                assertEquals(count(argument, '{'), count(argument, '}'), "unbalanced argument of \\" + command.getName());
            }
            for (String argument : command.getOptionalArguments()) {
                assertEquals(count(argument, '['), count(argument, ']'), "unbalanced option of \\" + command.getName());
            }
        }
    }

    @Test
    void everyEnvironmentEndsWithItsOwnEndMarker() {
        String source = TestResources.readResource("documents/paper.tex");
        ParseResult result = parse(source);

        assertEquals(
                List.of("document", "equation", "align", "figure"), environmentNames(result.getAllEnvironments()));
        for (Environment environment : result.getAllEnvironments()) {
            String endMarker =
                    source.substring(environment.getEndLocation().getOffset(), environment.getEndOffset());
            assertEquals("\\end{" + environment.getName() + "}", endMarker);
        }
    }

    @Test
    void parsingTwiceYieldsEqualStructures() {
        String source = TestResources.readResource("documents/paper.tex");
        ParseResult first = parse(source);
        ParseResult second = parse(source);

        assertEquals(first.getCommands(), second.getCommands());
        assertEquals(first.getEnvironments(), second.getEnvironments());
        assertEquals(first.getMathSpans(), second.getMathSpans());
    }

    private static ParseResult parse(String source) {
        return parse(source, LoaderOptions.defaults());
    }

    private static ParseResult parse(String source, LoaderOptions options) {
        return new LatexParser("test.tex", options).parse(new LatexTokenizer().tokenize(source));
    }

    private static List<String> names(List<Command> commands) {
        List<String> names = new ArrayList<>();
        for (Command command : commands) {
            names.add(command.getName());
        }
        return names;
    }

    private static List<String> environmentNames(List<Environment> environments) {
        List<String> names = new ArrayList<>();
        for (Environment environment : environments) {
            names.add(environment.getName());
        }
        return names;
    }

    private static int count(String text, char c) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                count++;
            }
        }
        return count;
    }
}
