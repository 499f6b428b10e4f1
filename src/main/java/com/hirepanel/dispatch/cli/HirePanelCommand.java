package com.hirepanel.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for HirePanel.
 * Routes to subcommands: evaluate, evaluate-batch, personas.
 */
@Command(
        name = "hirepanel",
        mixinStandardHelpOptions = true,
        version = "HirePanel 0.1.0",
        description = "Multi-persona candidate evaluation against a local LLM",
        subcommands = {
                EvaluateCommand.class,
                EvaluateBatchCommand.class,
                PersonasCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HirePanelCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
