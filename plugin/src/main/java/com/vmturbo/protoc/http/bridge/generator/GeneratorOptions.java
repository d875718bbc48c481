package com.vmturbo.protoc.http.bridge.generator;

import java.util.Optional;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import org.apache.commons.lang3.StringUtils;

/**
 * The options of a generation run, passed by protoc as the plugin parameter
 * (e.g. {@code --http-bridge_opt=enable_string_enums,descriptor_set_output_path=out/desc.pb}).
 */
@Immutable
public class GeneratorOptions {

    /**
     * Generate field-bound string enum codecs and JSON omission annotations.
     */
    public static final String ENABLE_STRING_ENUMS = "enable_string_enums";

    /**
     * Also write the request's descriptor set to this path.
     */
    public static final String DESCRIPTOR_SET_OUTPUT_PATH = "descriptor_set_output_path";

    private final boolean enableStringEnums;

    private final String descriptorSetOutputPath;

    public GeneratorOptions(final boolean enableStringEnums,
                            @Nullable final String descriptorSetOutputPath) {
        this.enableStringEnums = enableStringEnums;
        this.descriptorSetOutputPath = descriptorSetOutputPath;
    }

    /**
     * Parse the plugin parameter.
     *
     * @param parameter Comma-separated options, each either "key" or "key=value".
     * @return The parsed options.
     * @throws IllegalArgumentException If an option is unknown or has an invalid value.
     */
    @Nonnull
    public static GeneratorOptions parse(@Nonnull final String parameter) {
        boolean enableStringEnums = false;
        String descriptorSetOutputPath = null;
        for (String option : StringUtils.split(parameter, ',')) {
            final String key = StringUtils.substringBefore(option, "=").trim();
            final String value = option.contains("=")
                    ? StringUtils.substringAfter(option, "=").trim() : null;
            switch (key) {
                case ENABLE_STRING_ENUMS:
                    enableStringEnums = parseFlag(key, value);
                    break;
                case DESCRIPTOR_SET_OUTPUT_PATH:
                    if (StringUtils.isEmpty(value)) {
                        throw new IllegalArgumentException("Option " + key + " requires a path.");
                    }
                    descriptorSetOutputPath = value;
                    break;
                default:
                    if (!key.isEmpty()) {
                        throw new IllegalArgumentException("Unknown option: " + key);
                    }
            }
        }
        return new GeneratorOptions(enableStringEnums, descriptorSetOutputPath);
    }

    private static boolean parseFlag(@Nonnull final String key, @Nullable final String value) {
        if (value == null || value.equalsIgnoreCase("true")) {
            return true;
        } else if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("Option " + key + " expects true or false, got: " + value);
    }

    public boolean isEnableStringEnums() {
        return enableStringEnums;
    }

    @Nonnull
    public Optional<String> getDescriptorSetOutputPath() {
        return Optional.ofNullable(descriptorSetOutputPath);
    }
}
