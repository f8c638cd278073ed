package com.sdmarker.infrastructure.marker.loader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.sdmarker.domain.marker.exception.MarkerConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a YAML marker file into the raw nested map consumed by {@link MarkerSetLoader}.
 * Locations follow Spring resource syntax ("classpath:markers/x.yaml", "file:/etc/x.yaml").
 */
@Slf4j
@Component
public class MarkerConfigReader {

    private static final TypeReference<LinkedHashMap<String, Object>> RAW_CONFIG = new TypeReference<>() {};

    private final ResourceLoader resourceLoader;
    private final ObjectMapper yamlMapper;

    public MarkerConfigReader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    public Map<String, Object> read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new MarkerConfigException("Marker configuration not found: " + location);
        }
        try (InputStream is = resource.getInputStream()) {
            return read(is, location);
        } catch (IOException e) {
            throw new MarkerConfigException("Failed to read marker configuration " + location, e);
        }
    }

    public Map<String, Object> read(InputStream is, String sourceName) throws IOException {
        LinkedHashMap<String, Object> raw = yamlMapper.readValue(is, RAW_CONFIG);
        if (raw == null) {
            throw new MarkerConfigException("Marker configuration is empty: " + sourceName);
        }
        log.info("[MarkerConfigReader] Read marker configuration from {} ({} top-level sections)",
                sourceName, raw.size());
        return raw;
    }
}
