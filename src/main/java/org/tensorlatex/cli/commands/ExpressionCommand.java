package org.tensorlatex.cli.commands;

import org.tensorlatex.cli.CommandLineInterface;
import org.tensorlatex.compiler.Translator;
import org.tensorlatex.compiler.api.ParseOptions;
import org.tensorlatex.compiler.api.ParseResult;
import org.tensorlatex.compiler.config.SessionConfig;
import org.tensorlatex.compiler.frontend.semantics.TranslationSession;
import org.tensorlatex.symbolic.ExprPrinter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "expr", description = "Evaluates a single LaTeX expression, summing contracted indices.")
public class ExpressionCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "The expression.")
    private String expression;

    @Option(names = {"-s", "--setup"}, description = "Declarations and equations to run before the expression.")
    private String setup;

    @Option(names = "--json", description = "Print the value and diagnostics as JSON.")
    private boolean json;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        TranslationSession session = new TranslationSession(SessionConfig.fromConfig(parent.getConfig()));
        Translator translator = new Translator();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (setup != null) {
            ParseResult prepared = translator.parse(setup, session, ParseOptions.strict());
            if (prepared.hasErrors()) {
                prepared.diagnostics().forEach(err::println);
                return 1;
            }
        }
        ParseResult result = translator.parseExpression(expression, session);
        if (json) {
            out.println(TranslateCommand.toJson(result));
        } else if (result.expression() != null) {
            out.println(ExprPrinter.print(result.expression()));
        }
        result.diagnostics().forEach(err::println);
        out.flush();
        err.flush();
        return result.hasErrors() ? 1 : 0;
    }
}
