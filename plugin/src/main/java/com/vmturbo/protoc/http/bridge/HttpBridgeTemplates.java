package com.vmturbo.protoc.http.bridge;

import java.util.Arrays;
import java.util.stream.Collectors;

import javax.annotation.Nonnull;

import org.stringtemplate.v4.ST;

/**
 * The string templates of the per-file classes. Templates use '$' delimiters, since the
 * generated code is full of angle brackets.
 */
class HttpBridgeTemplates {

    private static final char DELIMITER = '$';

    private static final String IMPORTS =
            "import java.util.ArrayList;\n" +
            "import java.util.LinkedHashMap;\n" +
            "import java.util.List;\n" +
            "import java.util.Map;\n" +
            "import java.util.stream.Collectors;\n" +
            "\n" +
            "import com.fasterxml.jackson.annotation.JsonIgnoreProperties;\n" +
            "import com.fasterxml.jackson.annotation.JsonInclude;\n" +
            "import com.fasterxml.jackson.annotation.JsonInclude.Include;\n" +
            "import com.fasterxml.jackson.annotation.JsonProperty;\n" +
            "import com.fasterxml.jackson.databind.annotation.JsonDeserialize;\n" +
            "import com.fasterxml.jackson.databind.annotation.JsonSerialize;\n" +
            "import com.google.protobuf.ByteString;\n" +
            "\n" +
            "import org.springframework.web.servlet.function.RouterFunction;\n" +
            "import org.springframework.web.servlet.function.RouterFunctions;\n" +
            "import org.springframework.web.servlet.function.ServerResponse;\n" +
            "\n" +
            "import com.vmturbo.protoc.http.bridge.runtime.json.ClosedEnumValues;\n" +
            "import com.vmturbo.protoc.http.bridge.runtime.route.RpcRoute;";

    private static final String MESSAGE =
            "$if(javadoc)$\n" +
            "$javadoc$\n" +
            "$endif$\n" +
            "@JsonIgnoreProperties(ignoreUnknown = true)\n" +
            "public static class $className$ {\n" +
            "\n" +
            "    $fieldDeclarations; separator=\"\\n\\n\"$\n" +
            "\n" +
            "    $nestedDefinitions; separator=\"\\n\\n\"$\n" +
            "\n" +
            "    /**\n" +
            "     * Convert to the protobuf message.\n" +
            "     */\n" +
            "    public $originalProtoType$ toProto() {\n" +
            "        final $originalProtoType$.Builder builder = $originalProtoType$.newBuilder();\n" +
            "        $setBuilderFields; separator=\"\\n\"$\n" +
            "        return builder.build();\n" +
            "    }\n" +
            "\n" +
            "    /**\n" +
            "     * Convert from the protobuf message.\n" +
            "     */\n" +
            "    public static $className$ fromProto(final $originalProtoType$ proto) {\n" +
            "        final $className$ dto = new $className$();\n" +
            "        $setDtoFields; separator=\"\\n\"$\n" +
            "        return dto;\n" +
            "    }\n" +
            "}";

    private static final String FIELD_DECLARATION =
            "$if(javadoc)$\n" +
            "$javadoc$\n" +
            "$endif$\n" +
            "$annotations; separator=\"\\n\"$\n" +
            "public $type$ $name$$if(initializer)$ = $initializer$$endif$;";

    private static final String ADD_FIELD_TO_PROTO_BUILDER =
            "$if(isMap)$\n" +
            "if (this.$name$ != null) {\n" +
            "$if(bulk)$\n" +
            "    builder.putAll$accessor$(this.$name$);\n" +
            "$else$\n" +
            "    this.$name$.forEach((k, v) -> builder.put$accessor$(k, $element$));\n" +
            "$endif$\n" +
            "}\n" +
            "$elseif(isList)$\n" +
            "if (this.$name$ != null) {\n" +
            "$if(bulk)$\n" +
            "    builder.addAll$accessor$(this.$name$);\n" +
            "$else$\n" +
            "    this.$name$.forEach(v -> builder.add$accessor$($element$));\n" +
            "$endif$\n" +
            "}\n" +
            "$elseif(isNullable)$\n" +
            "if (this.$name$ != null) {\n" +
            "    builder.set$accessor$($element$);\n" +
            "}\n" +
            "$else$\n" +
            "builder.set$accessor$($element$);\n" +
            "$endif$";

    private static final String SET_FIELD_FROM_PROTO =
            "$if(isMap)$\n" +
            "$if(bulk)$\n" +
            "dto.$name$ = new LinkedHashMap<>(proto.get$accessor$Map());\n" +
            "$else$\n" +
            "proto.get$accessor$Map().forEach((k, v) -> dto.$name$.put(k, $element$));\n" +
            "$endif$\n" +
            "$elseif(isList)$\n" +
            "$if(bulk)$\n" +
            "dto.$name$ = new ArrayList<>(proto.get$accessor$List());\n" +
            "$else$\n" +
            "dto.$name$ = proto.get$accessor$List().stream()\n" +
            "        .map(v -> $element$)\n" +
            "        .collect(Collectors.toList());\n" +
            "$endif$\n" +
            "$elseif(presence)$\n" +
            "if ($presence$) {\n" +
            "    dto.$name$ = $element$;\n" +
            "}\n" +
            "$else$\n" +
            "dto.$name$ = $element$;\n" +
            "$endif$";

    private HttpBridgeTemplates() {}

    @Nonnull
    static String imports() {
        return IMPORTS;
    }

    /**
     * Attributes: javadoc, className, originalProtoType, fieldDeclarations, nestedDefinitions,
     * setBuilderFields, setDtoFields.
     */
    @Nonnull
    static ST message() {
        return new ST(MESSAGE, DELIMITER, DELIMITER);
    }

    /**
     * Attributes: javadoc, annotations, type, name, initializer.
     */
    @Nonnull
    static ST fieldDeclaration() {
        return new ST(FIELD_DECLARATION, DELIMITER, DELIMITER);
    }

    /**
     * Attributes: name, accessor, element, isMap, isList, isNullable, bulk.
     */
    @Nonnull
    static ST addFieldToProtoBuilder() {
        return new ST(ADD_FIELD_TO_PROTO_BUILDER, DELIMITER, DELIMITER);
    }

    /**
     * Attributes: name, accessor, element, presence, isMap, isList, bulk.
     */
    @Nonnull
    static ST setFieldFromProto() {
        return new ST(SET_FIELD_FROM_PROTO, DELIMITER, DELIMITER);
    }

    /**
     * Format a proto comment as a Javadoc block.
     *
     * @param comment The comment, possibly spanning several lines.
     * @return The Javadoc block, or an empty string for an empty comment.
     */
    @Nonnull
    static String javadoc(@Nonnull final String comment) {
        if (comment.trim().isEmpty()) {
            return "";
        }
        return "/**\n" + Arrays.stream(comment.replace("*/", "*&#47;").split("\n"))
                .map(line -> (" * " + line.trim()).replaceAll("\\s+$", ""))
                .collect(Collectors.joining("\n")) + "\n */";
    }
}
