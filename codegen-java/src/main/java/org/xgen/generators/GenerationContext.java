package org.xgen.generators;

import org.xgen.core.Language;
import org.xgen.core.QualifiedNames;
import org.xgen.core.TypeResolver;
import org.xgen.core.model.NodeKind;
import org.xgen.core.model.SchemaDocument;
import org.xgen.core.model.SchemaNode;
import org.xgen.generators.naming.FieldNameCounter;
import org.xgen.generators.naming.Identifiers;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one generation run.
 *
 * <p>Emitted type names are assigned up front, in document order, through this
 * run's {@link FieldNameCounter}, so a declaration and every reference to it
 * agree on the name. Simple and complex types share one symbol space; groups
 * and attribute groups share another.
 *
 * <p>A context belongs to a single run and must not be shared between runs.
 */
public final class GenerationContext {

    private final SchemaDocument document;
    private final GeneratorOptions options;
    private final TypeResolver resolver;
    private final FieldNameCounter counter = new FieldNameCounter();
    private final Map<String, String> typeNames = new HashMap<>();
    private final Map<String, String> groupNames = new HashMap<>();
    private final List<Path> generatedFiles = new ArrayList<>();

    public GenerationContext(SchemaDocument document, GeneratorOptions options) {
        this.document = document;
        this.options = options;
        this.resolver = new TypeResolver(document);
        assignNames();
    }

    private void assignNames() {
        for (SchemaNode node : document.nodes()) {
            if (node.name() != null && node.kind() != NodeKind.ELEMENT && node.kind() != NodeKind.ATTRIBUTE) {
                counter.reserve(baseName(node.name()));
            }
        }
        for (SchemaNode node : document.nodes()) {
            switch (node.kind()) {
                case SIMPLE_TYPE, COMPLEX_TYPE -> assign(typeNames, node.name());
                case GROUP, ATTRIBUTE_GROUP -> assign(groupNames, node.name());
                default -> {
                    // elements and attributes are fields, not types
                }
            }
        }
    }

    private void assign(Map<String, String> space, String schemaName) {
        if (schemaName == null) {
            return;
        }
        String local = QualifiedNames.trimNsPrefix(schemaName);
        if (!space.containsKey(local)) {
            space.put(local, counter.next(baseName(local)));
        }
    }

    private static String baseName(String schemaName) {
        return Identifiers.makeFirstUpperCase(Identifiers.toIdentifier(QualifiedNames.trimNsPrefix(schemaName)));
    }

    /** Emitted name of a simple or complex type; unknown names are normalized as-is. */
    public String typeName(String schemaName) {
        String local = QualifiedNames.trimNsPrefix(schemaName);
        String name = typeNames.get(local);
        return name != null ? name : baseName(schemaName);
    }

    /** Emitted name of a group or attribute group. */
    public String groupName(String schemaName) {
        String local = QualifiedNames.trimNsPrefix(schemaName);
        String name = groupNames.get(local);
        return name != null ? name : baseName(schemaName);
    }

    /** Emitted name of a declaration. */
    public String declaredName(SchemaNode node) {
        return switch (node.kind()) {
            case GROUP, ATTRIBUTE_GROUP -> groupName(node.name());
            default -> typeName(node.name());
        };
    }

    public SchemaDocument document() {
        return document;
    }

    public GeneratorOptions options() {
        return options;
    }

    public Language language() {
        return options.language();
    }

    public TypeResolver resolver() {
        return resolver;
    }

    public FieldNameCounter counter() {
        return counter;
    }

    public void recordGeneratedFile(Path file) {
        generatedFiles.add(file);
    }

    public List<Path> generatedFiles() {
        return Collections.unmodifiableList(generatedFiles);
    }
}
