package org.minicc.node.processes.compiler;

import com.typesafe.config.Config;
import org.minicc.compiler.Compiler;
import org.minicc.compiler.api.ICompiler;
import org.minicc.node.processes.AbstractProcess;
import org.minicc.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Owns the analysis pipeline and shares it with dependent processes.
 * The pipeline is stateless, so one instance serves all requests.
 */
public class CompilerProcess extends AbstractProcess implements IServiceProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(CompilerProcess.class);

    private final ICompiler compiler = new Compiler();

    public CompilerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
    }

    @Override
    public void start() {
        LOGGER.debug("Compiler process '{}' ready.", processName);
    }

    @Override
    public void stop() {
        LOGGER.debug("Compiler process '{}' stopped.", processName);
    }

    @Override
    public ICompiler getExposedService() {
        return compiler;
    }
}
