package org.tensorlatex.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.tensorlatex.cli.CommandLineInterface;
import org.tensorlatex.compiler.Translator;
import org.tensorlatex.compiler.api.ParseOptions;
import org.tensorlatex.compiler.api.ParseResult;
import org.tensorlatex.compiler.config.SessionConfig;
import org.tensorlatex.compiler.diagnostics.Diagnostic;
import org.tensorlatex.compiler.frontend.semantics.TranslationSession;
import org.tensorlatex.symbolic.ExprPrinter;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "translate", description = "Translates a LaTeX sentence and prints every bound component.")
public class TranslateCommand implements Callable<Integer> {

    static class Input {
        @Option(names = {"-f", "--file"}, required = true, description = "A file containing the sentence.")
        File file;

        @Option(names = {"-e", "--expression"}, required = true, description = "The sentence itself.")
        String sentence;
    }

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Input input;

    @Option(names = "--continue", description = "Skip failing structures instead of stopping at the first error.")
    private boolean continueOnError;

    @Option(names = "--json", description = "Print bindings and diagnostics as JSON.")
    private boolean json;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        String sentence = input.file != null
                ? Files.readString(input.file.toPath(), StandardCharsets.UTF_8)
                : input.sentence;
        SessionConfig config = SessionConfig.fromConfig(parent.getConfig());
        TranslationSession session = new TranslationSession(config);
        ParseOptions options = new ParseOptions(continueOnError || config.continueOnError());

        ParseResult result = new Translator().parse(sentence, session, options);

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(toJson(result));
        } else {
            result.bindings().forEach((name, value) -> out.println(name + " = " + ExprPrinter.print(value)));
            PrintWriter err = spec.commandLine().getErr();
            result.diagnostics().forEach(err::println);
        }
        out.flush();
        return result.hasErrors() ? 1 : 0;
    }

    static String toJson(ParseResult result) {
        Map<String, Object> document = new LinkedHashMap<>();
        Map<String, String> bindings = new LinkedHashMap<>();
        result.bindings().forEach((name, value) -> bindings.put(name, ExprPrinter.print(value)));
        document.put("bindings", bindings);
        if (result.expression() != null) {
            document.put("expression", ExprPrinter.print(result.expression()));
        }
        List<Map<String, Object>> diagnostics = new ArrayList<>();
        for (Diagnostic diagnostic : result.diagnostics()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("kind", diagnostic.kind().label());
            entry.put("message", diagnostic.message());
            entry.put("position", diagnostic.position());
            diagnostics.add(entry);
        }
        document.put("diagnostics", diagnostics);
        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        return gson.toJson(document);
    }
}
