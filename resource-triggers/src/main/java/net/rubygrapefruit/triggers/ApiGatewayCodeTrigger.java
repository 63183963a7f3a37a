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
import net.rubygrapefruit.triggers.stack.ResourceIdentifier;
import net.rubygrapefruit.triggers.stack.Stack;
import net.rubygrapefruit.triggers.stack.Stacks;
import net.rubygrapefruit.triggers.validation.DefinitionValidatorFactory;
import net.rubygrapefruit.triggers.validation.YamlDefinitionValidator;

import java.io.File;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Watches the definition file of an API. Like {@link TemplateTrigger}, changes are reported only while the definition
 * parses and differs from the last valid version.
 */
public class ApiGatewayCodeTrigger extends CodeResourceTrigger {
    private static final String DEFINITION_URI = "DefinitionUri";

    private final String definitionFile;
    private final WatchTarget watchTarget;

    public ApiGatewayCodeTrigger(ResourceIdentifier restApiIdentifier, List<Stack> stacks, FileChangeCallback onCodeChange) {
        this(restApiIdentifier, stacks, onCodeChange, YamlDefinitionValidator.factory());
    }

    /**
     * @throws ResourceNotFoundException when the resource cannot be found in the stacks.
     * @throws MissingDefinitionUriException when the API declares no local definition file.
     * @throws IllegalArgumentException when the definition file cannot be watched as a single file.
     */
    public ApiGatewayCodeTrigger(ResourceIdentifier restApiIdentifier, List<Stack> stacks, FileChangeCallback onCodeChange,
                                 DefinitionValidatorFactory validatorFactory) {
        this(restApiIdentifier, findResource(restApiIdentifier, stacks), onCodeChange, validatorFactory);
    }

    ApiGatewayCodeTrigger(ResourceIdentifier restApiIdentifier, Map<String, Object> resource, FileChangeCallback onCodeChange,
                          DefinitionValidatorFactory validatorFactory) {
        super(restApiIdentifier, resource, onCodeChange);
        // A DefinitionUri pointing at an S3 object is not a local file
        String definitionFile = Stacks.getString(Stacks.getProperties(getResource()), DEFINITION_URI);
        if (definitionFile == null || definitionFile.isEmpty()) {
            throw new MissingDefinitionUriException(String.format("API %s has no %s.", restApiIdentifier, DEFINITION_URI));
        }
        this.definitionFile = definitionFile;
        ValidatingCallback callback = new ValidatingCallback(validatorFactory.create(new File(definitionFile)), onCodeChange);
        this.watchTarget = WatchTargets.singleFile(definitionFile, callback);
    }

    public String getDefinitionFile() {
        return definitionFile;
    }

    @Override
    public List<WatchTarget> resolve() {
        return Collections.singletonList(watchTarget);
    }
}
