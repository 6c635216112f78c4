package org.xgen.generators.java;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xgen.core.Language;
import org.xgen.core.QualifiedNames;
import org.xgen.core.ResolvedType;
import org.xgen.core.model.Attribute;
import org.xgen.core.model.AttributeGroup;
import org.xgen.core.model.ComplexType;
import org.xgen.core.model.Element;
import org.xgen.core.model.Group;
import org.xgen.core.model.NodeKind;
import org.xgen.core.model.Restriction;
import org.xgen.core.model.SchemaNode;
import org.xgen.core.model.SimpleType;
import org.xgen.generators.GenerationContext;
import org.xgen.generators.dispatch.GenerationException;
import org.xgen.generators.dispatch.GenerationHook;
import org.xgen.generators.naming.FieldNameCounter;
import org.xgen.generators.naming.Identifiers;
import org.xgen.generators.naming.SortedPairs;

import javax.lang.model.SourceVersion;
import javax.lang.model.element.Modifier;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Renders schema declarations as Java source with JavaPoet.
 *
 * <ul>
 *   <li>simple type with enumeration → {@code enum} carrying the literal value</li>
 *   <li>simple type with pattern or length facets → final value class with facet constants</li>
 *   <li>list simple type → class wrapping {@code List<item>}</li>
 *   <li>union simple type → class with one field per member</li>
 *   <li>unconstrained simple type → nothing; references use the resolved base</li>
 *   <li>complex type, group, attribute group → class with fields, getters and setters</li>
 * </ul>
 *
 * Top-level elements and attributes have no hook and are skipped.
 */
public class JavaRenderer {

    private static final Logger logger = LoggerFactory.getLogger(JavaRenderer.class);

    private static final ClassName STRING = ClassName.get(String.class);
    private static final ClassName ARRAY_LIST = ClassName.get(ArrayList.class);

    private final GenerationContext context;
    private final String pkg;

    /**
     * One field of a generated class.
     */
    private record Member(String fieldName, TypeName type, String doc, CodeBlock initializer) {}

    public JavaRenderer(GenerationContext context) {
        this.context = context;
        this.pkg = context.options().packageName();
    }

    // =========================================================================
    // Hooks
    // =========================================================================

    @GenerationHook("JavaSimpleType")
    public void simpleType(SimpleType simpleType) throws GenerationException {
        String className = context.declaredName(simpleType);
        Restriction restriction = simpleType.restriction();
        TypeSpec type;
        if (simpleType.list()) {
            type = listClass(className, simpleType);
        } else if (simpleType.union()) {
            type = unionClass(className, simpleType);
        } else if (!restriction.enumeration().isEmpty()) {
            type = enumType(className, simpleType);
        } else if (restriction.hasConstraints()) {
            type = constrainedValueClass(className, simpleType);
        } else {
            logger.debug("Simple type {} is an alias of {}, nothing to emit", simpleType.name(), simpleType.base());
            return;
        }
        write(type);
    }

    @GenerationHook("JavaComplexType")
    public void complexType(ComplexType complexType) throws GenerationException {
        String className = context.declaredName(complexType);
        TypeSpec.Builder tb = TypeSpec.classBuilder(className).addModifiers(Modifier.PUBLIC);
        addDoc(tb, complexType.doc());

        List<Member> members = new ArrayList<>();

        if (complexType.base() != null && !complexType.base().isEmpty()) {
            if (isComplexType(complexType.base())) {
                tb.superclass(ClassName.get(pkg, context.typeName(complexType.base())));
            } else {
                members.add(new Member("value", typeFor(complexType.base()), null, null));
            }
        }
        if (complexType.mixed()) {
            members.add(new Member("text", STRING, "Character content of the mixed type.", null));
        }
        for (Attribute attribute : complexType.attributes()) {
            members.add(attributeMember(attribute));
        }
        for (String ref : complexType.attributeGroups()) {
            ClassName groupType = ClassName.get(pkg, context.groupName(ref));
            members.add(new Member(fieldName(ref), groupType, null, null));
        }
        for (Element element : complexType.elements()) {
            members.add(elementMember(element));
        }
        for (String ref : complexType.groups()) {
            TypeName groupType = ClassName.get(pkg, context.groupName(ref));
            boolean plural = findGroup(ref).map(Group::plural).orElse(false);
            members.add(plural
                ? new Member(fieldName(ref), JavaTypeNames.listOf(groupType), null, newArrayList())
                : new Member(fieldName(ref), groupType, null, null));
        }

        addMembers(tb, members);
        write(tb.build());
    }

    @GenerationHook("JavaGroup")
    public void group(Group group) throws GenerationException {
        TypeSpec.Builder tb = TypeSpec.classBuilder(context.declaredName(group)).addModifiers(Modifier.PUBLIC);
        addDoc(tb, group.doc());
        List<Member> members = new ArrayList<>();
        for (Element element : group.elements()) {
            members.add(elementMember(element));
        }
        addMembers(tb, members);
        write(tb.build());
    }

    @GenerationHook("JavaAttributeGroup")
    public void attributeGroup(AttributeGroup attributeGroup) throws GenerationException {
        TypeSpec.Builder tb = TypeSpec.classBuilder(context.declaredName(attributeGroup)).addModifiers(Modifier.PUBLIC);
        addDoc(tb, attributeGroup.doc());
        List<Member> members = new ArrayList<>();
        for (Attribute attribute : attributeGroup.attributes()) {
            members.add(attributeMember(attribute));
        }
        addMembers(tb, members);
        write(tb.build());
    }

    // =========================================================================
    // Simple Types
    // =========================================================================

    private TypeSpec enumType(String className, SimpleType simpleType) {
        ClassName self = ClassName.get(pkg, className);
        TypeSpec.Builder eb = TypeSpec.enumBuilder(className).addModifiers(Modifier.PUBLIC);
        addDoc(eb, simpleType.doc());

        List<String> literals = simpleType.restriction().enumeration();
        FieldNameCounter constants = new FieldNameCounter();
        literals.forEach(literal -> constants.reserve(enumConstantName(literal)));
        for (String literal : literals) {
            eb.addEnumConstant(constants.next(enumConstantName(literal)),
                TypeSpec.anonymousClassBuilder("$S", literal).build());
        }

        eb.addField(FieldSpec.builder(STRING, "value", Modifier.PRIVATE, Modifier.FINAL).build());
        eb.addMethod(MethodSpec.constructorBuilder()
            .addParameter(STRING, "value")
            .addStatement("this.value = value")
            .build());
        eb.addMethod(MethodSpec.methodBuilder("getValue")
            .addModifiers(Modifier.PUBLIC)
            .returns(STRING)
            .addStatement("return value")
            .build());
        eb.addMethod(MethodSpec.methodBuilder("fromValue")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(self)
            .addParameter(STRING, "value")
            .beginControlFlow("for ($T candidate : values())", self)
            .beginControlFlow("if (candidate.value.equals(value))")
            .addStatement("return candidate")
            .endControlFlow()
            .endControlFlow()
            .addStatement("throw new $T($S + value)", IllegalArgumentException.class, "Unknown " + className + ": ")
            .build());
        return eb.build();
    }

    private TypeSpec constrainedValueClass(String className, SimpleType simpleType) {
        Restriction restriction = simpleType.restriction();
        TypeName valueType = typeFor(simpleType.base());
        boolean textual = STRING.equals(valueType);

        TypeSpec.Builder tb = TypeSpec.classBuilder(className).addModifiers(Modifier.PUBLIC, Modifier.FINAL);
        addDoc(tb, simpleType.doc());

        if (restriction.pattern() != null) {
            tb.addField(FieldSpec.builder(STRING, "PATTERN", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                .initializer("$S", restriction.pattern())
                .build());
        }
        if (restriction.hasMinLength()) {
            tb.addField(FieldSpec.builder(TypeName.INT, "MIN_LENGTH", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                .initializer("$L", restriction.minLength())
                .build());
        }
        if (restriction.hasMaxLength()) {
            tb.addField(FieldSpec.builder(TypeName.INT, "MAX_LENGTH", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                .initializer("$L", restriction.maxLength())
                .build());
        }
        tb.addField(FieldSpec.builder(valueType, "value", Modifier.PRIVATE, Modifier.FINAL).build());

        MethodSpec.Builder constructor = MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addParameter(valueType, "value")
            .addStatement("$T.requireNonNull(value, $S)", Objects.class, "value");
        if (textual) {
            addStringChecks(constructor, className, restriction);
        }
        constructor.addStatement("this.value = value");
        tb.addMethod(constructor.build());

        tb.addMethod(MethodSpec.methodBuilder("getValue")
            .addModifiers(Modifier.PUBLIC)
            .returns(valueType)
            .addStatement("return value")
            .build());
        addValueEquality(tb, ClassName.get(pkg, className));
        return tb.build();
    }

    private static void addStringChecks(MethodSpec.Builder constructor, String className, Restriction restriction) {
        if (restriction.pattern() != null) {
            constructor.beginControlFlow("if (!$T.matches(PATTERN, value))", Pattern.class)
                .addStatement("throw new $T($S + value)", IllegalArgumentException.class,
                    className + " does not match pattern " + restriction.pattern() + ": ")
                .endControlFlow();
        }
        if (restriction.hasMinLength()) {
            constructor.beginControlFlow("if (value.length() < MIN_LENGTH)")
                .addStatement("throw new $T($S + MIN_LENGTH)", IllegalArgumentException.class,
                    className + " is shorter than ")
                .endControlFlow();
        }
        if (restriction.hasMaxLength()) {
            constructor.beginControlFlow("if (value.length() > MAX_LENGTH)")
                .addStatement("throw new $T($S + MAX_LENGTH)", IllegalArgumentException.class,
                    className + " is longer than ")
                .endControlFlow();
        }
    }

    private TypeSpec listClass(String className, SimpleType simpleType) {
        TypeSpec.Builder tb = TypeSpec.classBuilder(className).addModifiers(Modifier.PUBLIC);
        addDoc(tb, simpleType.doc());
        TypeName itemType = typeFor(simpleType.base());
        addMembers(tb, List.of(new Member("values", JavaTypeNames.listOf(itemType), null, newArrayList())));
        return tb.build();
    }

    private TypeSpec unionClass(String className, SimpleType simpleType) {
        TypeSpec.Builder tb = TypeSpec.classBuilder(className).addModifiers(Modifier.PUBLIC);
        addDoc(tb, simpleType.doc());
        List<Member> members = new ArrayList<>();
        for (SortedPairs.Pair member : SortedPairs.toSortedPairs(simpleType.memberTypes())) {
            members.add(new Member(fieldName(member.key()), typeFor(member.value()), null, null));
        }
        addMembers(tb, members);
        return tb.build();
    }

    // =========================================================================
    // Members
    // =========================================================================

    private Member attributeMember(Attribute attribute) throws GenerationException {
        TypeName type = typeFor(attribute.type());
        CodeBlock initializer = defaultInitializer(attribute, type);
        return new Member(fieldName(attribute.name()), type, attribute.doc(), initializer);
    }

    private Member elementMember(Element element) {
        TypeName type = typeFor(element.type());
        String name = fieldName(element.name());
        if (element.plural()) {
            return new Member(name, JavaTypeNames.listOf(type), element.doc(), newArrayList());
        }
        return new Member(name, type, element.doc(), null);
    }

    /**
     * Private fields followed by a getter and setter for each. Repeated field
     * names are numbered, skipping names another member already declares.
     */
    private static void addMembers(TypeSpec.Builder tb, List<Member> declared) {
        FieldNameCounter fieldNames = new FieldNameCounter();
        declared.forEach(m -> fieldNames.reserve(m.fieldName()));
        List<Member> members = new ArrayList<>(declared.size());
        for (Member m : declared) {
            members.add(new Member(fieldNames.next(m.fieldName()), m.type(), m.doc(), m.initializer()));
        }

        for (Member m : members) {
            FieldSpec.Builder field = FieldSpec.builder(m.type(), m.fieldName(), Modifier.PRIVATE);
            if (m.doc() != null && !m.doc().isEmpty()) {
                field.addJavadoc("$L\n", m.doc());
            }
            if (m.initializer() != null) {
                field.initializer(m.initializer());
            }
            tb.addField(field.build());
        }
        for (Member m : members) {
            String suffix = Identifiers.makeFirstUpperCase(m.fieldName());
            tb.addMethod(MethodSpec.methodBuilder("get" + suffix)
                .addModifiers(Modifier.PUBLIC)
                .returns(m.type())
                .addStatement("return $L", m.fieldName())
                .build());
            tb.addMethod(MethodSpec.methodBuilder("set" + suffix)
                .addModifiers(Modifier.PUBLIC)
                .addParameter(m.type(), m.fieldName())
                .addStatement("this.$L = $L", m.fieldName(), m.fieldName())
                .build());
        }
    }

    private static void addValueEquality(TypeSpec.Builder tb, ClassName self) {
        tb.addMethod(MethodSpec.methodBuilder("equals")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(TypeName.BOOLEAN)
            .addParameter(Object.class, "o")
            .addStatement("if (this == o) return true")
            .addStatement("if (!(o instanceof $T)) return false", self)
            .addStatement("return value.equals((($T) o).value)", self)
            .build());
        tb.addMethod(MethodSpec.methodBuilder("hashCode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(TypeName.INT)
            .addStatement("return value.hashCode()")
            .build());
        tb.addMethod(MethodSpec.methodBuilder("toString")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(STRING)
            .addStatement("return $T.valueOf(value)", String.class)
            .build());
    }

    // =========================================================================
    // Type Resolution
    // =========================================================================

    /**
     * Java type for a schema type reference. The resolver flattens one alias
     * level per call, so references are re-resolved until they reach a
     * built-in or a generated type; a name seen twice ends the chain.
     */
    TypeName typeFor(String schemaType) {
        if (schemaType == null || schemaType.isEmpty()) {
            return ClassName.OBJECT;
        }
        Set<String> seen = new HashSet<>();
        seen.add(QualifiedNames.trimNsPrefix(schemaType));
        String current = schemaType;
        while (true) {
            ResolvedType resolved = context.resolver().resolve(current, Language.JAVA);
            if (resolved instanceof ResolvedType.Primitive primitive) {
                return JavaTypeNames.fromSpelling(primitive.spelling());
            }
            if (resolved instanceof ResolvedType.Reference reference && seen.add(reference.name())) {
                current = reference.name();
                continue;
            }
            // generated types and names nothing declares are referenced by their emitted name
            return ClassName.get(pkg, context.typeName(resolved.name()));
        }
    }

    private boolean isComplexType(String name) {
        String local = QualifiedNames.trimNsPrefix(name);
        return context.document().nodes().stream()
            .anyMatch(n -> n.kind() == NodeKind.COMPLEX_TYPE && local.equals(n.name()));
    }

    private Optional<Group> findGroup(String name) {
        String local = QualifiedNames.trimNsPrefix(name);
        for (SchemaNode node : context.document().nodes()) {
            if (node.kind() == NodeKind.GROUP && local.equals(node.name())) {
                return Optional.of((Group) node);
            }
        }
        return Optional.empty();
    }

    // =========================================================================
    // Naming & Literals
    // =========================================================================

    /**
     * Java field name for a schema name: namespace prefix dropped, camelCase,
     * all-caps names lowercased ({@code IBAN} → {@code iban}), keywords suffixed
     * with {@code _}.
     */
    static String fieldName(String schemaName) {
        String local = QualifiedNames.trimNsPrefix(schemaName);
        String name;
        if (local.length() > 1 && local.equals(local.toUpperCase(Locale.ROOT))
                && !local.contains("-") && !local.contains("_")) {
            name = local.toLowerCase(Locale.ROOT);
        } else {
            name = Identifiers.toCamelCase(local);
        }
        name = Identifiers.toIdentifier(name);
        return SourceVersion.isKeyword(name) ? name + "_" : name;
    }

    static String enumConstantName(String literal) {
        return Identifiers.toIdentifier(Identifiers.toConstantCase(literal));
    }

    /**
     * Field initializer for an attribute's default value. Only string, boolean
     * and integral/float types get one.
     */
    private static CodeBlock defaultInitializer(Attribute attribute, TypeName type) throws GenerationException {
        String value = attribute.defaultValue();
        if (value == null) {
            return null;
        }
        String simpleName = type instanceof ClassName cn && "java.lang".equals(cn.packageName()) ? cn.simpleName() : "";
        try {
            return switch (simpleName) {
                case "String"  -> CodeBlock.of("$S", value);
                case "Boolean" -> CodeBlock.of("$L", Boolean.parseBoolean(value.trim()));
                case "Integer" -> CodeBlock.of("$L", Integer.parseInt(value.trim()));
                case "Short"   -> CodeBlock.of("(short) $L", Short.parseShort(value.trim()));
                case "Byte"    -> CodeBlock.of("(byte) $L", Byte.parseByte(value.trim()));
                case "Long"    -> CodeBlock.of("$LL", Long.parseLong(value.trim()));
                case "Float"   -> CodeBlock.of("$Lf", Float.parseFloat(value.trim()));
                default        -> null;
            };
        } catch (NumberFormatException e) {
            throw new GenerationException(
                "Attribute " + attribute.name() + ": default value '" + value + "' is not a valid " + simpleName, e);
        }
    }

    private static CodeBlock newArrayList() {
        return CodeBlock.of("new $T<>()", ARRAY_LIST);
    }

    private static void addDoc(TypeSpec.Builder tb, String doc) {
        if (doc != null && !doc.isEmpty()) {
            tb.addJavadoc("$L\n", doc);
        }
    }

    // =========================================================================
    // Output
    // =========================================================================

    private void write(TypeSpec type) throws GenerationException {
        JavaFile.Builder file = JavaFile.builder(pkg, type).skipJavaLangImports(true);
        if (context.options().hasFileComment()) {
            file.addFileComment("$L", context.options().fileComment());
        }
        Path outDir = context.options().outputDir();
        try {
            file.build().writeTo(outDir);
        } catch (IOException e) {
            throw new GenerationException("Cannot write " + type.name + " to " + outDir + ": " + e.getMessage(), e);
        }
        Path written = outDir.resolve(pkg.replace('.', '/')).resolve(type.name + ".java");
        context.recordGeneratedFile(written);
        logger.debug("Wrote {}", written);
    }
}
