package org.minicc.cli.commands.node;

import com.typesafe.config.Config;
import org.minicc.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the node in the foreground and serves the analysis UI until interrupted."
)
public class NodeRunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeRunCommand.class);

    @ParentCommand
    private NodeCommand parent;

    @Override
    public Integer call() {
        final Config config = parent.getParent().getConfig();

        final Node node = new Node(config);
        node.start();

        // The node's shutdown hook stops the processes on exit.
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.info("Interrupted, stopping node.");
            node.stop();
        }
        return 0;
    }
}
