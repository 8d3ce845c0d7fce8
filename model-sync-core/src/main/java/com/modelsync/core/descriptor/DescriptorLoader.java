package com.modelsync.core.descriptor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link LanguageDescriptor}s from YAML.
 *
 * <p>Unlike configuration, a descriptor has no sensible default: a missing or malformed
 * file is reported to the caller.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LanguageDescriptor descriptor = DescriptorLoader.load(Paths.get("ecml.descriptor.yaml"));
 * }</pre>
 */
public class DescriptorLoader {

    private static final Logger log = LoggerFactory.getLogger(DescriptorLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private DescriptorLoader() {
    }

    /**
     * Loads a descriptor file.
     *
     * @param descriptorPath YAML file
     * @return loaded descriptor
     * @throws IOException if the file is missing or invalid
     */
    public static LanguageDescriptor load(Path descriptorPath) throws IOException {
        if (!Files.isRegularFile(descriptorPath)) {
            throw new IOException("Descriptor file not found: " + descriptorPath);
        }
        log.debug("Loading language descriptor from: {}", descriptorPath);
        LanguageDescriptor descriptor = parse(Files.readString(descriptorPath));
        log.info("Loaded language descriptor '{}' with {} node mappings and {} connection rules",
            descriptor.languageId(), descriptor.nodes().size(), descriptor.connectionRules().size());
        return descriptor;
    }

    /**
     * Loads a descriptor from a classpath resource.
     *
     * @param resource resource name
     * @return loaded descriptor
     * @throws IOException if the resource is missing or invalid
     */
    public static LanguageDescriptor loadResource(String resource) throws IOException {
        try (InputStream in = DescriptorLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Descriptor resource not found: " + resource);
            }
            return YAML_MAPPER.readValue(in, LanguageDescriptor.class);
        }
    }

    /**
     * Parses descriptor YAML.
     *
     * @param yaml descriptor content
     * @return parsed descriptor
     * @throws IOException if the content is empty or invalid
     */
    public static LanguageDescriptor parse(String yaml) throws IOException {
        LanguageDescriptor descriptor = YAML_MAPPER.readValue(yaml, LanguageDescriptor.class);
        if (descriptor == null) {
            throw new IOException("Descriptor is empty");
        }
        return descriptor;
    }
}
