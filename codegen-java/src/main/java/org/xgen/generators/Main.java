package org.xgen.generators;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.xgen.core.Language;
import org.xgen.core.SchemaLoader;
import org.xgen.core.UnsupportedLanguageException;
import org.xgen.core.model.SchemaDocument;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI entry point.
 *
 * Usage:
 *   java -jar codegen-java.jar --schema <file|dir|url> --language <id> --package <pkg> --output <dir> [--file-comment <text>]
 *   java -jar codegen-java.jar --schema <file|dir|url> --config <options.json>
 *
 * Schema input is the JSON node document produced by the schema parser. A
 * directory is searched recursively for {@code *.json} files.
 */
public class Main {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String USAGE = "Usage: java -jar codegen-java.jar --schema <file|dir|url> "
        + "(--config <options.json> | --language <" + String.join("|", Language.ids()) + "> --package <pkg> --output <dir>) "
        + "[--file-comment <text>]";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        try {
            String schema = null;
            String configFile = null;
            String language = null;
            String packageName = null;
            String outputDir = null;
            String fileComment = null;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--schema":
                        schema = args[++i];
                        break;
                    case "--config":
                        configFile = args[++i];
                        break;
                    case "--language":
                        language = args[++i];
                        break;
                    case "--package":
                        packageName = args[++i];
                        break;
                    case "--output":
                        outputDir = args[++i];
                        break;
                    case "--file-comment":
                        fileComment = args[++i];
                        break;
                    default:
                        // Skip unknown args
                        break;
                }
            }

            boolean hasOptions = configFile != null || (language != null && packageName != null && outputDir != null);
            if (schema == null || !hasOptions) {
                System.err.println(USAGE);
                return 1;
            }

            GeneratorOptions options = configFile != null
                ? parseOptions(Files.readString(Path.of(configFile)))
                : new GeneratorOptions(Language.fromId(language), packageName, Path.of(outputDir), fileComment);

            List<SchemaDocument> documents = loadDocuments(schema);
            if (documents.isEmpty()) {
                System.err.println("Error: No schema documents found at " + schema);
                return 1;
            }

            SchemaGenerator generator = new SchemaGenerator();
            List<GenerationReport.Failure> failures = new ArrayList<>();
            int files = 0;
            for (SchemaDocument document : documents) {
                GenerationReport report = generator.generate(document, options);
                files += report.generatedFiles().size();
                failures.addAll(report.failures());
            }

            System.out.println("Generated " + files + " " + options.language().id() + " file(s) from "
                + documents.size() + " schema document(s) in " + options.outputDir());
            if (!failures.isEmpty()) {
                System.err.println(failures.size() + " node(s) failed:");
                for (GenerationReport.Failure failure : failures) {
                    System.err.println("  - " + failure.describe());
                }
                return 1;
            }
            return 0;

        } catch (UnsupportedLanguageException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return 1;
        } catch (ArrayIndexOutOfBoundsException e) {
            System.err.println(USAGE);
            return 1;
        } catch (Exception e) {
            Throwable cause = e.getCause();
            if (cause instanceof UnsupportedLanguageException) {
                System.err.println("Configuration error: " + cause.getMessage());
                return 1;
            }
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private static GeneratorOptions parseOptions(String json) throws Exception {
        return MAPPER.readValue(json, GeneratorOptions.class);
    }

    private static List<SchemaDocument> loadDocuments(String schema) throws Exception {
        List<SchemaDocument> documents = new ArrayList<>();
        if (SchemaSources.isValidUrl(schema)) {
            byte[] body = SchemaSources.fetchSchema(schema);
            if (body.length > 0) {
                documents.add(SchemaLoader.read(body));
            }
            return documents;
        }
        for (Path file : SchemaSources.listFiles(Path.of(schema))) {
            if (file.getFileName().toString().endsWith(".json")) {
                documents.add(SchemaLoader.load(file));
            }
        }
        return documents;
    }
}
