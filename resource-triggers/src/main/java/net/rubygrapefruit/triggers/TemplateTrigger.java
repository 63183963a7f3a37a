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

package net.rubygrapefruit.triggers;

import net.rubygrapefruit.triggers.file.FileChangeCallback;
import net.rubygrapefruit.triggers.file.WatchTarget;
import net.rubygrapefruit.triggers.validation.DefinitionValidatorFactory;
import net.rubygrapefruit.triggers.validation.YamlDefinitionValidator;

import java.io.File;
import java.util.Collections;
import java.util.List;

/**
 * Watches a template file. Changes are reported only while the template parses and differs from the last valid
 * version, so saving a broken template or reformatting it does not trigger anything.
 */
public class TemplateTrigger implements ResourceTrigger {
    private final String templateFile;
    private final WatchTarget watchTarget;

    public TemplateTrigger(String templateFile, FileChangeCallback onTemplateChange) {
        this(templateFile, onTemplateChange, YamlDefinitionValidator.factory());
    }

    /**
     * @throws IllegalArgumentException when the template path cannot be watched as a single file.
     */
    public TemplateTrigger(String templateFile, FileChangeCallback onTemplateChange, DefinitionValidatorFactory validatorFactory) {
        this.templateFile = templateFile;
        ValidatingCallback callback = new ValidatingCallback(validatorFactory.create(new File(templateFile)), onTemplateChange);
        this.watchTarget = WatchTargets.singleFile(templateFile, callback);
    }

    public String getTemplateFile() {
        return templateFile;
    }

    @Override
    public List<WatchTarget> resolve() {
        return Collections.singletonList(watchTarget);
    }
}
