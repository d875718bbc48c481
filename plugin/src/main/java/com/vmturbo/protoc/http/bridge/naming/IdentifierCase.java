package com.vmturbo.protoc.http.bridge.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import javax.annotation.Nonnull;
import javax.lang.model.SourceVersion;

import com.google.common.base.CaseFormat;

import org.apache.commons.lang3.StringUtils;

/**
 * Identifier casing conversions used across the generator.
 * <p>
 * {@link #toWordCase(String)} is the only TypeCase to word_case conversion in the plugin.
 * Everything that needs a word-cased identifier (binding ids, module paths) goes through it.
 */
public class IdentifierCase {

    private IdentifierCase() {}

    /**
     * Convert an identifier to word_case (lower case words joined by underscores).
     * <p>
     * Words are split on non-alphanumeric characters, at every lower-to-upper transition, and
     * before the last capital of an upper-case run that is followed by a lower-case letter,
     * so an acronym stays a single word: {@code XMLHttpRequest -> xml_http_request},
     * {@code APIKey -> api_key}, {@code AB -> ab}.
     *
     * @param identifier The identifier, in any casing.
     * @return The word-cased identifier. Empty for an empty input.
     */
    @Nonnull
    public static String toWordCase(@Nonnull final String identifier) {
        return splitWords(identifier).stream()
                .map(word -> word.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("_"));
    }

    /**
     * Convert a word_case identifier to UpperCamel, e.g. for a Java class name.
     * {@code serialize_hello_request_greeting_type_as_string ->
     * SerializeHelloRequestGreetingTypeAsString}.
     *
     * @param wordCase The word-cased identifier.
     * @return The UpperCamel identifier.
     */
    @Nonnull
    public static String toUpperCamel(@Nonnull final String wordCase) {
        return CaseFormat.LOWER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, wordCase);
    }

    /**
     * Convert a word_case identifier to lowerCamel.
     *
     * @param wordCase The word-cased identifier.
     * @return The lowerCamel identifier.
     */
    @Nonnull
    public static String toLowerCamel(@Nonnull final String wordCase) {
        return CaseFormat.LOWER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, wordCase);
    }

    /**
     * Camel-case a proto name the way protoc's Java generator does, so that we can refer to
     * the accessors and classes it generates. Non-alphanumeric characters are dropped and
     * capitalize the next letter; a digit also capitalizes the next letter.
     * <p>
     * {@code greeting_type -> GreetingType} (capitalized) or {@code greetingType}.
     *
     * @param name The proto name (field name, file base name).
     * @param capitalizeFirst Whether the first letter should be upper case.
     * @return The camel-cased name.
     */
    @Nonnull
    public static String toProtoCamelCase(@Nonnull final String name, final boolean capitalizeFirst) {
        final StringBuilder result = new StringBuilder(name.length());
        boolean capitalizeNext = capitalizeFirst;
        for (int i = 0; i < name.length(); ++i) {
            final char c = name.charAt(i);
            if (c >= 'a' && c <= 'z') {
                result.append(capitalizeNext ? Character.toUpperCase(c) : c);
                capitalizeNext = false;
            } else if (c >= 'A' && c <= 'Z') {
                if (i == 0 && !capitalizeFirst) {
                    result.append(Character.toLowerCase(c));
                } else {
                    result.append(c);
                }
                capitalizeNext = false;
            } else if (c >= '0' && c <= '9') {
                result.append(c);
                capitalizeNext = true;
            } else {
                capitalizeNext = true;
            }
        }
        return result.toString();
    }

    /**
     * The name of a Java field or local variable for a proto field. Java keywords get an
     * underscore suffix.
     *
     * @param protoFieldName The field name as declared in the .proto file.
     * @return A legal Java identifier.
     */
    @Nonnull
    public static String toJavaFieldName(@Nonnull final String protoFieldName) {
        final String camel = toProtoCamelCase(protoFieldName, false);
        return SourceVersion.isKeyword(camel) ? camel + "_" : camel;
    }

    /**
     * Whether a dotted-path segment names a message (TypeCase) rather than a package component.
     *
     * @param segment A segment of a dotted type reference.
     * @return True if the first character is an upper case letter.
     */
    public static boolean isMessageName(@Nonnull final String segment) {
        return !segment.isEmpty() && Character.isUpperCase(segment.charAt(0));
    }

    @Nonnull
    private static List<String> splitWords(@Nonnull final String identifier) {
        final List<String> words = new ArrayList<>();
        for (String chunk : StringUtils.split(identifier, "_")) {
            splitChunk(chunk, words);
        }
        return words;
    }

    private enum Mode {
        BOUNDARY,
        LOWERCASE,
        UPPERCASE
    }

    /**
     * Split one underscore-free chunk into words, appending them to {@code words}.
     */
    private static void splitChunk(@Nonnull final String chunk, @Nonnull final List<String> words) {
        int start = 0;
        Mode mode = Mode.BOUNDARY;
        for (int i = 0; i < chunk.length(); ++i) {
            final char c = chunk.charAt(i);
            if (!Character.isLetterOrDigit(c)) {
                addWord(chunk.substring(start, i), words);
                start = i + 1;
                mode = Mode.BOUNDARY;
                continue;
            }
            if (i + 1 >= chunk.length()) {
                addWord(chunk.substring(start), words);
                return;
            }
            final char next = chunk.charAt(i + 1);
            final Mode nextMode;
            if (Character.isLowerCase(c)) {
                nextMode = Mode.LOWERCASE;
            } else if (Character.isUpperCase(c)) {
                nextMode = Mode.UPPERCASE;
            } else {
                nextMode = mode;
            }

            if (nextMode == Mode.LOWERCASE && Character.isUpperCase(next)) {
                addWord(chunk.substring(start, i + 1), words);
                start = i + 1;
                mode = Mode.BOUNDARY;
            } else if (mode == Mode.UPPERCASE && Character.isUpperCase(c)
                    && Character.isLowerCase(next)) {
                addWord(chunk.substring(start, i), words);
                start = i;
                mode = Mode.BOUNDARY;
            } else {
                mode = nextMode;
            }
        }
        if (start < chunk.length()) {
            addWord(chunk.substring(start), words);
        }
    }

    private static void addWord(@Nonnull final String word, @Nonnull final List<String> words) {
        if (!word.isEmpty()) {
            words.add(word);
        }
    }
}
