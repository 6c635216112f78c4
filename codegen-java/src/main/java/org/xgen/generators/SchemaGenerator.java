package org.xgen.generators;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xgen.core.Language;
import org.xgen.core.model.SchemaDocument;
import org.xgen.core.model.SchemaNode;
import org.xgen.generators.dispatch.GenerationDispatcher;
import org.xgen.generators.dispatch.GenerationException;
import org.xgen.generators.java.JavaRenderer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Drives code generation for one schema document.
 *
 * <p>Each node is dispatched to the hook named {@code <LanguageId><NodeKind>}
 * (for example {@code JavaSimpleType}) on the renderer registered for the
 * run's language. Nodes without a matching hook are skipped. A failing node
 * does not stop the run; every failure is collected into the
 * {@link GenerationReport}.
 *
 * <p>Only a Java renderer ships with the generator. Renderers for the other
 * languages are plugged in with {@link #registerRenderer}.
 */
public class SchemaGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SchemaGenerator.class);

    private final Map<Language, Function<GenerationContext, Object>> renderers = new EnumMap<>(Language.class);

    public SchemaGenerator() {
        registerRenderer(Language.JAVA, JavaRenderer::new);
    }

    /**
     * Register the renderer factory for {@code language}, replacing any previous one.
     * The factory is called once per run with that run's context; the object it
     * returns contributes its {@link org.xgen.generators.dispatch.GenerationHook} methods.
     */
    public SchemaGenerator registerRenderer(Language language, Function<GenerationContext, Object> factory) {
        renderers.put(language, factory);
        return this;
    }

    /**
     * Generate code for every node of {@code document}.
     *
     * @throws IOException if the output directory cannot be prepared
     */
    public GenerationReport generate(SchemaDocument document, GeneratorOptions options) throws IOException {
        SchemaSources.prepareOutputDir(options.outputDir());

        GenerationContext context = new GenerationContext(document, options);
        GenerationDispatcher dispatcher = new GenerationDispatcher();
        Function<GenerationContext, Object> factory = renderers.get(options.language());
        if (factory != null) {
            dispatcher.registerAll(factory.apply(context));
        } else {
            logger.info("No renderer registered for {}; all nodes will be skipped", options.language().id());
        }

        String prefix = options.language().id();
        List<GenerationReport.Failure> failures = new ArrayList<>();
        int dispatched = 0;
        for (SchemaNode node : document.nodes()) {
            String hook = prefix + node.kind().hookName();
            try {
                dispatcher.dispatch(hook, node);
            } catch (GenerationException e) {
                logger.warn("Failed to generate {} {}: {}", node.kind().hookName(), node.name(), e.getMessage());
                failures.add(new GenerationReport.Failure(node.name(), node.kind(), hook, e));
            }
            dispatched++;
        }

        GenerationReport report = new GenerationReport(dispatched, context.generatedFiles(), failures);
        logger.info("Generated {} file(s) for {} node(s) in {} ({} failure(s))",
            report.generatedFiles().size(), dispatched, prefix, failures.size());
        return report;
    }
}
