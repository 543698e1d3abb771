package dev.freelancematch.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads JSON arrays from Spring resource locations ({@code file:}, {@code classpath:}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonResourceReader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    /**
     * Read a JSON array.
     *
     * @throws IllegalStateException if the resource is missing or cannot be parsed
     */
    public <T> List<T> readList(String location, TypeReference<List<T>> type) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Resource not found: " + location);
        }

        try (InputStream in = resource.getInputStream()) {
            List<T> items = objectMapper.readValue(in, type);
            log.debug("Read {} records from {}", items != null ? items.size() : 0, location);
            return items != null ? items : List.of();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to read {}. Ensure it matches the required structure.", location, e);
            throw new IllegalStateException("Could not read " + location, e);
        }
    }
}
