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

package net.rubygrapefruit.triggers.testfixture;

import net.rubygrapefruit.triggers.stack.Stack;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds resource records and stacks the way a parsed template presents them.
 */
public class Resources {
    private final Map<String, Map<String, Object>> resources = new LinkedHashMap<String, Map<String, Object>>();

    public static Map<String, Object> resource(String type, Map<String, Object> properties) {
        Map<String, Object> resource = new LinkedHashMap<String, Object>();
        resource.put("Type", type);
        resource.put("Properties", properties);
        return resource;
    }

    public static Map<String, Object> map(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    public Resources add(String logicalId, Map<String, Object> resource) {
        resources.put(logicalId, resource);
        return this;
    }

    public Stack rootStack() {
        return Stack.root("template.yaml", resources);
    }

    public Stack childStack(String parentStackPath, String name) {
        return new Stack(parentStackPath, name, name + "/template.yaml", resources);
    }
}
