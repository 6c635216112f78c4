package org.xgen.generators.java;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;

import java.util.List;
import java.util.Set;

/**
 * Turns the Java column of {@link org.xgen.core.BuiltInTypes} into JavaPoet type names.
 *
 * <pre>
 *   "String"       → java.lang.String
 *   "Integer"      → java.lang.Integer
 *   "QName"        → javax.xml.namespace.QName
 *   "List&lt;Byte&gt;"   → java.util.List&lt;java.lang.Byte&gt;
 * </pre>
 */
final class JavaTypeNames {

    private static final Set<String> JAVA_LANG = Set.of(
        "String", "Boolean", "Byte", "Short", "Integer", "Long", "Float", "Double", "Object");

    private JavaTypeNames() {}

    static TypeName fromSpelling(String spelling) {
        if (JAVA_LANG.contains(spelling)) {
            return ClassName.get("java.lang", spelling);
        }
        if ("QName".equals(spelling)) {
            return ClassName.get("javax.xml.namespace", "QName");
        }
        if (spelling.startsWith("List<") && spelling.endsWith(">")) {
            String item = spelling.substring("List<".length(), spelling.length() - 1);
            return listOf(fromSpelling(item));
        }
        throw new IllegalArgumentException("No Java type for built-in spelling: " + spelling);
    }

    static TypeName listOf(TypeName item) {
        return ParameterizedTypeName.get(ClassName.get(List.class), item);
    }
}
