package com.sourcesurvey.surveyor.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class SurveyConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a survey.json file.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public SurveyConfig read(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            SurveyConfig config = GSON.fromJson(reader, SurveyConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            if (config.isSkipInstall() && config.isForceInstall()) {
                throw new ConfigReadException(
                        "skip_install and force_install are mutually exclusive in " + configPath);
            }
            return config;
        } catch (JsonParseException e) {
            throw new ConfigReadException("Malformed config file " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
