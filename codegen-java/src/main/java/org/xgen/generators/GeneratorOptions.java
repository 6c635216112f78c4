package org.xgen.generators;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.xgen.core.Language;

import java.nio.file.Path;

/**
 * Settings for one generation run. Read from the CLI or from a JSON config file:
 *
 * <pre>
 * { "language": "Java", "packageName": "com.acme.model", "outputDir": "build/generated",
 *   "fileComment": "Generated from pain.001.001.09.xsd. Do not edit." }
 * </pre>
 *
 * An unknown {@code language} fails with {@link org.xgen.core.UnsupportedLanguageException}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeneratorOptions(
    Language language,
    String packageName,
    Path outputDir,
    String fileComment
) {
    public GeneratorOptions {
        if (language == null) throw new IllegalArgumentException("language is required");
        if (packageName == null || packageName.isBlank()) throw new IllegalArgumentException("packageName is required");
        if (outputDir == null) throw new IllegalArgumentException("outputDir is required");
    }

    public GeneratorOptions(Language language, String packageName, Path outputDir) {
        this(language, packageName, outputDir, null);
    }

    @JsonCreator
    static GeneratorOptions fromJson(
        @JsonProperty("language") String language,
        @JsonProperty("packageName") String packageName,
        @JsonProperty("outputDir") String outputDir,
        @JsonProperty("fileComment") String fileComment
    ) {
        return new GeneratorOptions(
            Language.fromId(language),
            packageName,
            outputDir == null ? null : Path.of(outputDir),
            fileComment);
    }

    public GeneratorOptions withOutputDir(Path outputDir) {
        return new GeneratorOptions(language, packageName, outputDir, fileComment);
    }

    public boolean hasFileComment() {
        return fileComment != null && !fileComment.isEmpty();
    }
}
