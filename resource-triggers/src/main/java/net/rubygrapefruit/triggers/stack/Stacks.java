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

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * Lookups over a list of {@link Stack}s and accessors for resource records.
 */
public class Stacks {
    static final String METADATA_KEY = "Metadata";
    static final String PROPERTIES_KEY = "Properties";
    static final String TYPE_KEY = "Type";
    static final String SAM_RESOURCE_ID_KEY = "SamResourceId";

    private Stacks() {
    }

    /**
     * Finds a resource record. An identifier without a stack path is looked up in every stack, first match wins.
     *
     * @return the resource record, or {@code null} when there is no such resource.
     */
    @Nullable
    public static Map<String, Object> getResourceById(List<Stack> stacks, ResourceIdentifier identifier) {
        boolean searchAllStacks = identifier.getStackPath().isEmpty();
        for (Stack stack : stacks) {
            if (!searchAllStacks && !stack.getStackPath().equals(identifier.getStackPath())) {
                continue;
            }
            for (Map.Entry<String, Map<String, Object>> entry : stack.getResources().entrySet()) {
                String logicalId = entry.getKey();
                Map<String, Object> resource = entry.getValue();
                if (getResourceId(resource, logicalId).equals(identifier.getResourceIacId())
                    || (searchAllStacks && logicalId.equals(identifier.getResourceIacId()))) {
                    return resource;
                }
            }
        }
        return null;
    }

    /**
     * The id a resource is known by: {@code Metadata.SamResourceId} when present, otherwise its logical id.
     */
    public static String getResourceId(Map<String, Object> resource, String logicalId) {
        String samResourceId = getString(getMetadata(resource), SAM_RESOURCE_ID_KEY);
        return samResourceId == null || samResourceId.isEmpty() ? logicalId : samResourceId;
    }

    @Nullable
    public static String getType(Map<String, Object> resource) {
        return getString(resource, TYPE_KEY);
    }

    /**
     * @return the {@code Properties} block, or {@code null} when absent or not a mapping.
     */
    @Nullable
    public static Map<String, Object> getProperties(Map<String, Object> resource) {
        return getMap(resource, PROPERTIES_KEY);
    }

    @Nullable
    public static Map<String, Object> getMetadata(Map<String, Object> resource) {
        return getMap(resource, METADATA_KEY);
    }

    /**
     * @return the value for the key when it is a string, otherwise {@code null}.
     */
    @Nullable
    public static String getString(@Nullable Map<String, Object> map, String key) {
        if (map == null) {
            return null;
        }
        Object value = map.get(key);
        return value instanceof String ? (String) value : null;
    }

    @Nullable
    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(@Nullable Map<String, Object> map, String key) {
        if (map == null) {
            return null;
        }
        Object value = map.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    static String joinPath(String parent, String child) {
        if (parent.isEmpty()) {
            return child;
        }
        if (child.isEmpty()) {
            return parent;
        }
        return parent + "/" + child;
    }
}
