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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A snapshot of one stack: its resources, keyed by logical id in declaration order.
 * Nested stacks are separate {@code Stack} instances carrying the path of their parent.
 */
@Immutable
public class Stack {
    private final String parentStackPath;
    private final String name;
    private final String location;
    private final Map<String, Map<String, Object>> resources;

    public Stack(String parentStackPath, String name, String location, Map<String, Map<String, Object>> resources) {
        this.parentStackPath = parentStackPath;
        this.name = name;
        this.location = location;
        this.resources = Collections.unmodifiableMap(new LinkedHashMap<String, Map<String, Object>>(resources));
    }

    /**
     * Creates the root stack of a template.
     */
    public static Stack root(String location, Map<String, Map<String, Object>> resources) {
        return new Stack("", "", location, resources);
    }

    public String getParentStackPath() {
        return parentStackPath;
    }

    public String getName() {
        return name;
    }

    /**
     * The path of the template file this stack was read from.
     */
    public String getLocation() {
        return location;
    }

    /**
     * The path of this stack, made of the names of its ancestors and its own name. Empty for the root stack.
     */
    public String getStackPath() {
        return Stacks.joinPath(parentStackPath, name);
    }

    public Map<String, Map<String, Object>> getResources() {
        return resources;
    }

    @Override
    public String toString() {
        return "Stack{path=" + getStackPath() + ", location=" + location + '}';
    }
}
