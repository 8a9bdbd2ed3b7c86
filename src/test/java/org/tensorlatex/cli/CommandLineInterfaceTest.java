package org.tensorlatex.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tensorlatex.cli.config.LoggingConfigurator;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Runs the command line through picocli with captured output streams.
 */
public class CommandLineInterfaceTest {

    private CommandLine commandLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        commandLine = new CommandLine(new CommandLineInterface());
        out = new StringWriter();
        err = new StringWriter();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    @Test
    @Tag("unit")
    void testCliInitialization() {
        assertEquals("tensorlatex", commandLine.getCommandName());
        assertThat(commandLine.getSubcommands()).containsKeys("translate", "expr", "help");
    }

    /**
     * Verifies that {@code translate} prints one line per bound component, declarations first.
     */
    @Test
    @Tag("unit")
    void testTranslatePrintsBindings() {
        // Act
        int exitCode = commandLine.execute("translate", "-e", "% define nosym vU (2); w^a = 2 v^a");

        // Assert
        assertEquals(0, exitCode);
        assertThat(out.toString().lines()).containsExactly(
                "vU0 = vU0", "vU1 = vU1", "wU0 = 2*vU0", "wU1 = 2*vU1");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testTranslateReadsFile(@TempDir Path tempDir) throws Exception {
        // Arrange
        Path file = tempDir.resolve("trace.tex");
        Files.writeString(file, "% define nosym hUD (2)\n; h = h^\\mu{}_\\mu", StandardCharsets.UTF_8);

        // Act
        int exitCode = commandLine.execute("translate", "-f", file.toString());

        // Assert
        assertEquals(0, exitCode);
        assertThat(out.toString().lines()).contains("h = hUD00 + hUD11");
    }

    /**
     * Verifies the exit code and the diagnostic rendering of a failing translation.
     */
    @Test
    @Tag("unit")
    void testTranslateReportsErrors() {
        // Act
        int exitCode = commandLine.execute("translate", "-e", "a = )");

        // Assert
        assertEquals(1, exitCode);
        assertThat(err.toString()).contains("[ERROR] ParseError:").contains("a = )\n    ^");
    }

    @Test
    @Tag("unit")
    void testTranslateJsonOutput() {
        // Act
        int exitCode = commandLine.execute("translate", "--json", "--continue", "-e", "x = ) ; y = 3/4");

        // Assert
        assertEquals(1, exitCode);
        JsonObject document = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertEquals("3/4", document.getAsJsonObject("bindings").get("y").getAsString());
        JsonObject diagnostic = document.getAsJsonArray("diagnostics").get(0).getAsJsonObject();
        assertEquals("ParseError", diagnostic.get("kind").getAsString());
        assertEquals(4, diagnostic.get("position").getAsInt());
    }

    @Test
    @Tag("unit")
    void testExpressionWithSetup() {
        // Act
        int exitCode = commandLine.execute("expr", "-s", "% define nosym hUD (2)", "h^\\mu{}_\\mu");

        // Assert
        assertEquals(0, exitCode);
        assertEquals("hUD00 + hUD11", out.toString().trim());
    }

    @Test
    @Tag("unit")
    void testExpressionWithFreeIndexFails() {
        int exitCode = commandLine.execute("expr", "-s", "% define nosym vU (2)", "v^a");

        assertEquals(1, exitCode);
        assertThat(err.toString()).contains("free index in expression: 'a'");
    }

    @Test
    @Tag("unit")
    void testMissingConfigFileIsRejected(@TempDir Path tempDir) {
        int exitCode = commandLine.execute("--config", tempDir.resolve("absent.conf").toString(),
                "expr", "1 + 1");

        assertEquals(2, exitCode);
        assertThat(err.toString()).contains("Configuration file specified via --config was not found");
    }
}
