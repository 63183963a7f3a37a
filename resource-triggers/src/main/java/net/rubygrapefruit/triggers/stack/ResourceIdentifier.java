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

package net.rubygrapefruit.triggers.stack;

import javax.annotation.concurrent.Immutable;

/**
 * Identifies a resource within a possibly nested stack, in the form {@code Parent/Child/LogicalId}.
 */
@Immutable
public class ResourceIdentifier {
    private static final char SEPARATOR = '/';

    private final String stackPath;
    private final String resourceIacId;

    public ResourceIdentifier(String identifier) {
        if (identifier.isEmpty()) {
            throw new IllegalArgumentException("Resource identifier must not be empty");
        }
        int index = identifier.lastIndexOf(SEPARATOR);
        this.stackPath = index < 0 ? "" : identifier.substring(0, index);
        this.resourceIacId = identifier.substring(index + 1);
    }

    public ResourceIdentifier(String stackPath, String resourceIacId) {
        this.stackPath = stackPath;
        this.resourceIacId = resourceIacId;
    }

    /**
     * The path of the stack owning the resource, empty for the root stack.
     */
    public String getStackPath() {
        return stackPath;
    }

    /**
     * The resource id within its stack.
     */
    public String getResourceIacId() {
        return resourceIacId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceIdentifier)) {
            return false;
        }
        return toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        return Stacks.joinPath(stackPath, resourceIacId);
    }
}
