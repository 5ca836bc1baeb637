package com.layeredcrf.server.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class DataPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(DataPathResolver.class);

    public static String resolveDataDirectory() {
        // 1. Check System Property
        String sysProp = System.getProperty("layeredcrf.data.dir");
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Check Config File
        ObjectMapper mapper = new ObjectMapper();
        try (InputStream is = DataPathResolver.class.getResourceAsStream("/crf_config.json")) {
            if (is != null) {
                JsonNode root = mapper.readTree(is);
                if (root.has("data_directory")) {
                    String configDir = root.get("data_directory").asText();
                    if (configDir != null && !configDir.isEmpty()) {
                        return configDir;
                    }
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to read data_directory from config: {}", e.getMessage());
        }

        // 3. Default
        return ".";
    }

    public static String resolveDbPath() {
        return resolveDataDirectory() + File.separator + "edge_models.db";
    }
}
