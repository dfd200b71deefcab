package io.imagexform.standalone.app;

import io.imagexform.core.builder.ImagePipeline;
import io.imagexform.core.spec.PipelineDefinition;
import io.imagexform.core.spec.PipelineDefinitionParser;
import io.imagexform.core.spi.EngineAdapter;
import io.imagexform.standalone.config.ConfigLoadException;
import io.imagexform.standalone.config.ConfigLoader;
import io.imagexform.standalone.config.XformConfig;
import java.nio.file.Path;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the standalone host: resolve and load the configuration, configure
 * logging, create the engine, parse the pipeline definition and run it once against the source.
 */
public final class XformApp {

    private static final Logger LOG = LoggerFactory.getLogger(XformApp.class);

    private final Function<String, String> envLookup;
    private final EngineFactory engineFactory;

    public XformApp() {
        this(System::getenv, new EngineFactory());
    }

    public XformApp(Function<String, String> envLookup, EngineFactory engineFactory) {
        this.envLookup = envLookup;
        this.engineFactory = engineFactory;
    }

    /**
     * Runs the pipeline and returns the written file.
     *
     * @throws IllegalArgumentException on invalid command-line arguments
     * @throws ConfigLoadException if the configuration is invalid or names no pipeline definition
     * @throws io.imagexform.core.error.ImageXformException if the pipeline fails
     */
    public Path run(String[] args) {
        CommandLine commandLine = CommandLine.parse(args);
        XformConfig config = ConfigLoader.load(ConfigLoader.resolveConfigPath(args), envLookup);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());

        Path definitionPath = commandLine.definition();
        if (definitionPath == null && config.pipelineDefinition() != null) {
            definitionPath = Path.of(config.pipelineDefinition());
        }
        if (definitionPath == null) {
            throw new ConfigLoadException(
                    "No pipeline definition: pass --definition or set pipeline.definition / PIPELINE_DEFINITION");
        }

        PipelineDefinition definition = new PipelineDefinitionParser().parse(definitionPath);
        EngineAdapter<?> engine = engineFactory.create(config);
        LOG.info(
                "Running pipeline: engine={}, definition={}, operations={}, source={}",
                engine.id(),
                definitionPath,
                definition.operations().size(),
                commandLine.source());

        return execute(engine, definition, commandLine);
    }

    private static <A> Path execute(EngineAdapter<A> engine, PipelineDefinition definition, CommandLine commandLine) {
        ImagePipeline<A> pipeline = definition.applyTo(ImagePipeline.using(engine));
        return commandLine.destination() != null
                ? pipeline.call(commandLine.source(), commandLine.destination())
                : pipeline.call(commandLine.source());
    }
}
