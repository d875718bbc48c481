package com.vmturbo.protoc.http.bridge.naming;

import java.util.Arrays;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import javax.annotation.Nonnull;

import org.apache.commons.lang3.StringUtils;

/**
 * Resolves the dotted type reference of an enum field into the nested path under which the
 * generated code finds the enum, relative to the package.
 * <p>
 * Segments between the package and the enum name are treated as enclosing messages when they
 * start with an upper case letter, and as package components otherwise.
 */
public class EnumTypePathResolver {

    /**
     * How the enclosing message segments of a resolved path are rendered.
     */
    public enum NestedPathStyle {
        /**
         * Word-cased message modules joined by {@code ::}, e.g. {@code outer::inner::Status}.
         */
        MODULE("::", IdentifierCase::toWordCase),

        /**
         * Message names as declared joined by {@code .}, which is how protoc's Java output
         * nests classes, e.g. {@code Outer.Inner.Status}.
         */
        JAVA(".", UnaryOperator.identity());

        private final String separator;

        private final UnaryOperator<String> segmentFormatter;

        NestedPathStyle(@Nonnull final String separator,
                        @Nonnull final UnaryOperator<String> segmentFormatter) {
            this.separator = separator;
            this.segmentFormatter = segmentFormatter;
        }

        @Nonnull
        public String getSeparator() {
            return separator;
        }

        /**
         * Render a nested enum path in this style.
         *
         * @param messages The enclosing messages, outermost first. May be empty.
         * @param enumName The name of the enum.
         * @return The path, e.g. {@code outer::inner::Status}.
         */
        @Nonnull
        public String format(@Nonnull final List<String> messages, @Nonnull final String enumName) {
            if (messages.isEmpty()) {
                return enumName;
            }
            return messages.stream()
                    .map(segmentFormatter)
                    .collect(Collectors.joining(separator)) + separator + enumName;
        }
    }

    private EnumTypePathResolver() {}

    /**
     * Resolve a type reference in the {@link NestedPathStyle#MODULE} style.
     *
     * @param typeReference The dotted reference, e.g. {@code pkg.Outer.Status}. A leading dot
     *                      (as protoc writes references) is ignored.
     * @return The resolved path, e.g. {@code outer::Status}.
     */
    @Nonnull
    public static String resolveEnumTypePath(@Nonnull final String typeReference) {
        return resolveEnumTypePath(typeReference, NestedPathStyle.MODULE);
    }

    /**
     * Resolve a type reference in the requested style.
     * <ul>
     *     <li>No dot: the reference is already a bare enum name and is returned as is.</li>
     *     <li>{@code package.EnumName}: a package-level enum, {@code EnumName}.</li>
     *     <li>Three or more segments: the message-like segments between the first and the
     *     last one, formatted and joined by the style separator, followed by the enum
     *     name. Without any message-like segment, just the enum name.</li>
     * </ul>
     *
     * @param typeReference The dotted reference.
     * @param style The rendering style.
     * @return The resolved path. Empty for an empty reference.
     */
    @Nonnull
    public static String resolveEnumTypePath(@Nonnull final String typeReference,
                                             @Nonnull final NestedPathStyle style) {
        final String reference = StringUtils.removeStart(typeReference, ".");
        if (!reference.contains(".")) {
            return reference;
        }

        final List<String> segments = Arrays.asList(reference.split("\\.", -1));
        final String enumName = segments.get(segments.size() - 1);
        if (segments.size() == 2) {
            return enumName;
        }

        return style.format(segments.subList(1, segments.size() - 1).stream()
                .filter(IdentifierCase::isMessageName)
                .collect(Collectors.toList()), enumName);
    }
}
