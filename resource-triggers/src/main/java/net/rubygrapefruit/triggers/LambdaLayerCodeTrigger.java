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
import net.rubygrapefruit.triggers.stack.LayerProvider;
import net.rubygrapefruit.triggers.stack.LayerVersion;
import net.rubygrapefruit.triggers.stack.ResourceIdentifier;
import net.rubygrapefruit.triggers.stack.SamLayerProvider;
import net.rubygrapefruit.triggers.stack.Stack;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Watches the content folder of a layer version, including the folder itself being created or deleted.
 */
public class LambdaLayerCodeTrigger extends CodeResourceTrigger {
    private final LayerVersion layer;
    private final String codeUri;
    private final WatchTarget watchTarget;

    public LambdaLayerCodeTrigger(ResourceIdentifier layerIdentifier, List<Stack> stacks, FileChangeCallback onCodeChange) {
        this(layerIdentifier, stacks, onCodeChange, new SamLayerProvider(stacks));
    }

    /**
     * @throws ResourceNotFoundException when the resource cannot be found in the stacks or cannot be resolved as a layer.
     * @throws MissingCodeUriException when the layer declares no local content.
     * @throws IllegalArgumentException when the content location is not a valid path.
     */
    public LambdaLayerCodeTrigger(ResourceIdentifier layerIdentifier, List<Stack> stacks, FileChangeCallback onCodeChange,
                                  LayerProvider layerProvider) {
        this(layerIdentifier, findResource(layerIdentifier, stacks), onCodeChange, layerProvider);
    }

    LambdaLayerCodeTrigger(ResourceIdentifier layerIdentifier, Map<String, Object> resource, FileChangeCallback onCodeChange,
                           LayerProvider layerProvider) {
        super(layerIdentifier, resource, onCodeChange);
        LayerVersion layer = layerProvider.get(layerIdentifier.toString());
        if (layer == null) {
            // Not a layer specific failure, unlike functions
            throw new ResourceNotFoundException(String.format("Layer %s cannot be found.", layerIdentifier));
        }
        String codeUri = layer.getCodeUri();
        if (codeUri == null || codeUri.isEmpty()) {
            throw new MissingCodeUriException(String.format("Layer %s has no content location.", layerIdentifier));
        }
        this.layer = layer;
        this.codeUri = codeUri;
        this.watchTarget = WatchTargets.directory(codeUri, onCodeChange, onCodeChange, onCodeChange);
    }

    public LayerVersion getLayer() {
        return layer;
    }

    public String getCodeUri() {
        return codeUri;
    }

    @Override
    public List<WatchTarget> resolve() {
        return Collections.singletonList(watchTarget);
    }
}
