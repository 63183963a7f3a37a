/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.rubygrapefruit.triggers.validation;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

/**
 * Validates a YAML or JSON definition file by parsing it and comparing the parsed content with the last
 * valid content. Formatting, comment and key order changes do not count as changes. Switching between the short and
 * long form of an intrinsic function is not a change either, switching to another function is.
 */
@ThreadSafe
public class YamlDefinitionValidator implements DefinitionValidator {
    private static final Logger LOGGER = Logger.getLogger(YamlDefinitionValidator.class.getName());
    private static final DefinitionValidatorFactory FACTORY = new DefinitionValidatorFactory() {
        @Override
        public DefinitionValidator create(File definitionFile) {
            return new YamlDefinitionValidator(definitionFile);
        }
    };

    private final File path;
    private final boolean detectChange;
    // Protected by this
    private JsonNode data;

    public YamlDefinitionValidator(File path) {
        this(path, true, true);
    }

    /**
     * @param detectChange when {@code false}, any valid content is reported as a change.
     * @param initializeData whether to read the current content now, so that the first call to {@link #validate()}
     * compares against it.
     */
    public YamlDefinitionValidator(File path, boolean detectChange, boolean initializeData) {
        this.path = path;
        this.detectChange = detectChange;
        if (initializeData) {
            validate();
        }
    }

    /**
     * Creates validators with change detection, initialized with the content at creation time.
     */
    public static DefinitionValidatorFactory factory() {
        return FACTORY;
    }

    public File getPath() {
        return path;
    }

    @Override
    public synchronized boolean validate() {
        JsonNode previous = data;
        JsonNode current = parse();
        if (current == null) {
            return false;
        }
        data = current;
        return !detectChange || !current.equals(previous);
    }

    @Nullable
    private JsonNode parse() {
        try {
            JsonNode node = TemplateReader.read(path);
            if (node == null || node.isNull()) {
                LOGGER.fine("Definition file " + path + " is empty.");
                return null;
            }
            return node;
        } catch (IOException e) {
            LOGGER.fine("Failed to parse definition file " + path + ": " + e.getMessage());
            return null;
        }
    }
}
