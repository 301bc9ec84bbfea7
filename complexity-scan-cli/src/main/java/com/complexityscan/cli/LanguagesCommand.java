package com.complexityscan.cli;

import com.complexityscan.ComplexityScanCLI;
import com.complexityscan.core.language.LanguageProfile;
import com.complexityscan.core.language.LanguageRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the supported languages.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * complexity-scan languages
 * }</pre>
 */
@Command(
    name = "languages",
    description = "List supported languages and their file extensions",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = ComplexityScanCLI.EXIT_USAGE
)
public class LanguagesCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<LanguageProfile> profiles = LanguageRegistry.fromClasspath().profiles();

        out.println("Supported Languages:");
        out.println();
        for (LanguageProfile profile : profiles) {
            out.printf("  • %s (ID: %s)%n", profile.displayName(), profile.id());
            out.printf("    Extensions: %s%n", String.join(", ", profile.extensions()));
            out.printf("    Grammar: %s%n", profile.grammarVersion());
            out.println();
        }
        out.flush();
        return ComplexityScanCLI.EXIT_OK;
    }
}
