package com.remit.matching.source;

import com.remit.matching.match.MatchingException;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Shared helpers for reading the YAML input documents.
 * Plain scalars load as strings, so invoice references such as {@code 0123} or {@code 1_000}
 * keep their literal text and amounts are parsed by {@link #toDecimal}.
 */
final class YamlDocuments {

    private YamlDocuments() {
    }

    static List<Object> loadList(String filePath, String rootKey) {
        Yaml yaml = newYaml();
        try (InputStream input = new FileInputStream(filePath)) {
            Object data = yaml.load(input);
            if (data == null) {
                return List.of();
            }
            if (!(data instanceof Map)) {
                throw new MatchingException("Expected a mapping with '" + rootKey + "' in " + filePath);
            }
            Object entries = ((Map<?, ?>) data).get(rootKey);
            if (entries == null) {
                return List.of();
            }
            if (!(entries instanceof List)) {
                throw new MatchingException("'" + rootKey + "' in " + filePath + " must be a list");
            }
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) entries;
            return list;
        } catch (IOException e) {
            throw new MatchingException("Failed to read " + filePath + ": " + e.getMessage(), e);
        }
    }

    private static Yaml newYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        DumperOptions dumperOptions = new DumperOptions();
        return new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions),
            dumperOptions, loaderOptions, new LiteralScalarResolver());
    }

    /**
     * Resolves only nulls and merge keys; numbers, booleans and timestamps stay strings.
     */
    private static final class LiteralScalarResolver extends Resolver {

        @Override
        protected void addImplicitResolvers() {
            addImplicitResolver(Tag.MERGE, MERGE, "<");
            addImplicitResolver(Tag.NULL, NULL, "~nN\0");
            addImplicitResolver(Tag.NULL, EMPTY, null);
        }
    }

    static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new MatchingException("Not a decimal amount: '" + value + "'", e);
        }
    }

    static String toText(Object value) {
        return value == null ? null : value.toString();
    }
}
