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
import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Resolves {@code AWS::Serverless::LayerVersion} and {@code AWS::Lambda::LayerVersion} resources.
 */
@Immutable
public class SamLayerProvider implements LayerProvider {
    private static final String CONTENT_URI = "ContentUri";
    private static final String CONTENT = "Content";
    private static final String COMPATIBLE_RUNTIMES = "CompatibleRuntimes";

    private final List<LayerVersion> layers;

    public SamLayerProvider(List<Stack> stacks) {
        List<LayerVersion> layers = new ArrayList<LayerVersion>();
        for (Stack stack : stacks) {
            for (Map.Entry<String, Map<String, Object>> entry : stack.getResources().entrySet()) {
                LayerVersion layer = toLayer(stack, entry.getKey(), entry.getValue());
                if (layer != null) {
                    layers.add(layer);
                }
            }
        }
        this.layers = Collections.unmodifiableList(layers);
    }

    public List<LayerVersion> getAll() {
        return layers;
    }

    @Nullable
    @Override
    public LayerVersion get(String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Layer name is required");
        }
        for (LayerVersion layer : layers) {
            if (layer.getFullPath().equals(name)) {
                return layer;
            }
        }
        for (LayerVersion layer : layers) {
            if (layer.getLayerId().equals(name) || layer.getName().equals(name)) {
                return layer;
            }
        }
        return null;
    }

    @Nullable
    private static LayerVersion toLayer(Stack stack, String logicalId, Map<String, Object> resource) {
        String type = Stacks.getType(resource);
        String codeKey;
        if (ResourceTypes.AWS_SERVERLESS_LAYERVERSION.equals(type)) {
            codeKey = CONTENT_URI;
        } else if (ResourceTypes.AWS_LAMBDA_LAYERVERSION.equals(type)) {
            codeKey = CONTENT;
        } else {
            return null;
        }
        Map<String, Object> properties = Stacks.getProperties(resource);
        return new LayerVersion(
            logicalId,
            Stacks.getResourceId(resource, logicalId),
            stack.getStackPath(),
            Stacks.getString(properties, codeKey),
            compatibleRuntimes(properties)
        );
    }

    private static List<String> compatibleRuntimes(@Nullable Map<String, Object> properties) {
        List<String> runtimes = new ArrayList<String>();
        Object value = properties == null ? null : properties.get(COMPATIBLE_RUNTIMES);
        if (value instanceof List) {
            for (Object runtime : (List<?>) value) {
                if (runtime instanceof String) {
                    runtimes.add((String) runtime);
                }
            }
        }
        return runtimes;
    }
}
