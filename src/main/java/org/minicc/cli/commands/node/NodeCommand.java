package org.minicc.cli.commands.node;

import org.minicc.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "node",
    description = "Manages the minicc HTTP node",
    subcommands = {
        NodeRunCommand.class
    }
)
public class NodeCommand {
    @ParentCommand
    private CommandLineInterface parent;

    public CommandLineInterface getParent() {
        return parent;
    }
}
