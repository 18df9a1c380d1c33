package me.golemcore.courier.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Loads the help payload sent in reply to {@code help}. The text is passed
 * through unmodified.
 */
@Component
@Slf4j
public class HelpTextProvider {

    private final BotProperties properties;
    private final ResourceLoader resourceLoader;

    private volatile String helpText;

    public HelpTextProvider(BotProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    public String getHelpText() {
        String text = helpText;
        if (text == null) {
            text = load();
            helpText = text;
        }
        return text;
    }

    private String load() {
        String location = properties.getHelp().getPath();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Help text not found at {}", location);
            return "";
        }
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read help text from {}: {}", location, e.getMessage());
            return "";
        }
    }
}
