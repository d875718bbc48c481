package com.vmturbo.protoc.http.bridge.generator;

import java.util.stream.Collectors;

import javax.annotation.Nonnull;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;

/**
 * Parses generated sources before they are handed back to protoc, so that a broken template
 * fails the build here instead of surfacing as a compile error in generated code.
 */
public class JavaSourceValidator {

    private final JavaParser parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(LanguageLevel.JAVA_17));

    /**
     * Check that a generated source file is syntactically valid Java.
     *
     * @param fileName The name of the generated file, for the error message.
     * @param source The generated source.
     * @throws ProtocGenerationException If the source does not parse.
     */
    public void validate(@Nonnull final String fileName, @Nonnull final String source) {
        final ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful()) {
            throw new ProtocGenerationException("Generated file " + fileName + " is not valid Java: "
                    + result.getProblems().stream()
                        .map(Problem::getVerboseMessage)
                        .collect(Collectors.joining("; ")));
        }
    }
}
