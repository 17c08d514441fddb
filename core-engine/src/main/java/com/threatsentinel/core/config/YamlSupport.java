package com.threatsentinel.core.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.function.Function;

/**
 * Shared plumbing for the YAML-backed loaders: typed parsing with duplicate
 * keys rejected, and uniform file / classpath error mapping.
 *
 * @since 1.0.0
 */
public final class YamlSupport {

    private YamlSupport() {
        // utility class, not instantiable
    }

    /**
     * Parse a YAML document into a JavaBean of the given type.
     *
     * @return the parsed bean, or {@code null} for an empty document
     */
    public static <T> T parse(InputStream is, Class<T> type) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(type, options));
        return yaml.load(is);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails
     */
    public static <T> T readFile(String path, Function<InputStream, T> reader) {
        Objects.requireNonNull(path, "File path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return reader.apply(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("File not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails
     */
    public static <T> T readClasspath(String resource, Function<InputStream, T> reader) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = YamlSupport.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return reader.apply(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }
}
