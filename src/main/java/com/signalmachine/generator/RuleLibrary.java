package com.signalmachine.generator;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

/**
 * Built-in rule sets, loaded once from {@code classpath:rules/*.rules}.
 */
@Component
public class RuleLibrary {

    static final String LOCATION_PATTERN = "classpath*:rules/*.rules";
    private static final String EXTENSION = ".rules";
    private static final Logger log = LoggerFactory.getLogger(RuleLibrary.class);

    private final Map<String, String> ruleSets;

    public RuleLibrary() {
        this(LOCATION_PATTERN);
    }

    RuleLibrary(String locationPattern) {
        this.ruleSets = Collections.unmodifiableMap(load(locationPattern));
        log.info("Loaded {} built-in rule sets: {}", ruleSets.size(), ruleSets.keySet());
    }

    public List<String> names() {
        return List.copyOf(ruleSets.keySet());
    }

    public Optional<String> find(String name) {
        Objects.requireNonNull(name, "name");
        return Optional.ofNullable(ruleSets.get(name.trim()));
    }

    private static Map<String, String> load(String locationPattern) {
        Map<String, String> loaded = new TreeMap<>();
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(locationPattern);
            for (Resource resource : resources) {
                String fileName = resource.getFilename();
                if (fileName == null || !fileName.endsWith(EXTENSION)) {
                    continue;
                }
                String name = fileName.substring(0, fileName.length() - EXTENSION.length());
                try (InputStream in = resource.getInputStream()) {
                    loaded.put(name, StreamUtils.copyToString(in, StandardCharsets.UTF_8));
                }
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load rule sets from " + locationPattern, ex);
        }
        return loaded;
    }
}
