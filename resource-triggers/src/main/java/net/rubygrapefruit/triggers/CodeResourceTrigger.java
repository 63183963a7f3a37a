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
import net.rubygrapefruit.triggers.stack.ResourceIdentifier;
import net.rubygrapefruit.triggers.stack.Stack;
import net.rubygrapefruit.triggers.stack.Stacks;

import java.util.List;
import java.util.Map;

/**
 * A trigger for a single resource of a template.
 */
public abstract class CodeResourceTrigger implements ResourceTrigger {
    private final ResourceIdentifier resourceIdentifier;
    private final Map<String, Object> resource;
    private final FileChangeCallback onCodeChange;

    /**
     * @throws ResourceNotFoundException when the resource cannot be found in the stacks.
     */
    protected CodeResourceTrigger(ResourceIdentifier resourceIdentifier, List<Stack> stacks, FileChangeCallback onCodeChange) {
        this(resourceIdentifier, findResource(resourceIdentifier, stacks), onCodeChange);
    }

    /**
     * @param resource the record the identifier resolves to.
     */
    protected CodeResourceTrigger(ResourceIdentifier resourceIdentifier, Map<String, Object> resource, FileChangeCallback onCodeChange) {
        this.resourceIdentifier = resourceIdentifier;
        this.resource = resource;
        this.onCodeChange = onCodeChange;
    }

    static Map<String, Object> findResource(ResourceIdentifier resourceIdentifier, List<Stack> stacks) {
        Map<String, Object> resource = Stacks.getResourceById(stacks, resourceIdentifier);
        if (resource == null) {
            throw new ResourceNotFoundException(String.format("Resource %s cannot be found.", resourceIdentifier));
        }
        return resource;
    }

    public ResourceIdentifier getResourceIdentifier() {
        return resourceIdentifier;
    }

    /**
     * The resource record, owned by its stack. Must not be modified.
     */
    protected Map<String, Object> getResource() {
        return resource;
    }

    public FileChangeCallback getOnCodeChange() {
        return onCodeChange;
    }
}
