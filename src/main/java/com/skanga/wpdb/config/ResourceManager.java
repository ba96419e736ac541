package com.skanga.wpdb.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.Properties;

/**
 * Central access to externalized user-facing messages.
 * Messages live in {@code messages.properties} on the classpath and use {@link MessageFormat} placeholders.
 */
public final class ResourceManager {
    private static final Logger logger = LoggerFactory.getLogger(ResourceManager.class);
    private static final String MESSAGES_RESOURCE = "/messages.properties";
    private static final Properties messages = loadMessages();

    private ResourceManager() {
    }

    /**
     * Looks up a message by key and formats it with the supplied arguments.
     * Unknown keys resolve to the key itself so a missing entry never hides the original error.
     *
     * @param messageKey Key in messages.properties
     * @param messageArgs Values for the {0}, {1}, ... placeholders
     * @return The formatted message
     */
    public static String getErrorMessage(String messageKey, Object... messageArgs) {
        String messagePattern = messages.getProperty(messageKey);
        if (messagePattern == null) {
            logger.warn("Missing message key: {}", messageKey);
            return messageKey;
        }
        if (messageArgs == null || messageArgs.length == 0) {
            return messagePattern;
        }
        return MessageFormat.format(messagePattern, messageArgs);
    }

    private static Properties loadMessages() {
        Properties loadedMessages = new Properties();
        try (InputStream inputStream = ResourceManager.class.getResourceAsStream(MESSAGES_RESOURCE)) {
            if (inputStream == null) {
                logger.error("Message resource {} not found on classpath", MESSAGES_RESOURCE);
                return loadedMessages;
            }
            loadedMessages.load(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        } catch (IOException e) {
            logger.error("Failed to load message resource {}", MESSAGES_RESOURCE, e);
        }
        return loadedMessages;
    }
}
