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

/**
 * A layer version resource, as resolved from a stack.
 */
@Immutable
public class LayerVersion {
    private final String name;
    private final String layerId;
    private final String stackPath;
    private final String codeUri;
    private final List<String> compatibleRuntimes;

    public LayerVersion(String name, String layerId, String stackPath, @Nullable String codeUri, List<String> compatibleRuntimes) {
        this.name = name;
        this.layerId = layerId;
        this.stackPath = stackPath;
        this.codeUri = codeUri;
        this.compatibleRuntimes = Collections.unmodifiableList(new ArrayList<String>(compatibleRuntimes));
    }

    public String getName() {
        return name;
    }

    public String getLayerId() {
        return layerId;
    }

    public String getStackPath() {
        return stackPath;
    }

    public String getFullPath() {
        return Stacks.joinPath(stackPath, layerId);
    }

    @Nullable
    public String getCodeUri() {
        return codeUri;
    }

    public List<String> getCompatibleRuntimes() {
        return compatibleRuntimes;
    }

    @Override
    public String toString() {
        return "LayerVersion{" + getFullPath() + ", codeUri=" + codeUri + '}';
    }
}
