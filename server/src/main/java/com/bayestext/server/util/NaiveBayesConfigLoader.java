package com.bayestext.server.util;

import com.bayestext.server.ai.NaiveBayesConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

public class NaiveBayesConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(NaiveBayesConfigLoader.class);

    public static final String CONFIG_PROPERTY = "bayestext.config";
    public static final String DEFAULT_RESOURCE = "/nb_config.json";

    public static String resolveConfigResource() {
        String sysProp = System.getProperty(CONFIG_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp.startsWith("/") ? sysProp : "/" + sysProp;
        }
        return DEFAULT_RESOURCE;
    }

    public static NaiveBayesConfig loadOrDefault() {
        return loadOrDefault(resolveConfigResource());
    }

    /**
     * Reads the classifier config from a classpath resource.
     * Falls back to {@link NaiveBayesConfig#defaults()} if the resource is
     * missing, unreadable or holds invalid values.
     */
    public static NaiveBayesConfig loadOrDefault(String resource) {
        ObjectMapper mapper = new ObjectMapper();
        try (InputStream is = NaiveBayesConfigLoader.class.getResourceAsStream(resource)) {
            if (is == null) {
                logger.warn("Config resource {} not found, using defaults", resource);
                return NaiveBayesConfig.defaults();
            }
            NaiveBayesConfig config = mapper.readValue(is, NaiveBayesConfig.class);
            if (config.delta < 0.0 || config.vocabularySizing == null) {
                logger.warn("Invalid classifier config in {}: {}, using defaults", resource, config);
                return NaiveBayesConfig.defaults();
            }
            logger.info("Loaded classifier config from {}: {}", resource, config);
            return config;
        } catch (IOException e) {
            logger.warn("Failed to load classifier config from {}, using defaults. Error: {}", resource,
                    e.getMessage());
            return NaiveBayesConfig.defaults();
        }
    }
}
