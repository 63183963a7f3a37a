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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A function resource, as resolved from a stack.
 */
@Immutable
public class Function {
    private final String name;
    private final String functionId;
    private final String functionName;
    private final String stackPath;
    private final String packageType;
    private final String codeUri;
    private final String imageUri;
    private final Map<String, Object> metadata;

    public Function(String name, String functionId, String functionName, String stackPath, String packageType,
                    @Nullable String codeUri, @Nullable String imageUri, @Nullable Map<String, Object> metadata) {
        this.name = name;
        this.functionId = functionId;
        this.functionName = functionName;
        this.stackPath = stackPath;
        this.packageType = packageType;
        this.codeUri = codeUri;
        this.imageUri = imageUri;
        this.metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(metadata));
    }

    /**
     * The logical id of the function within its stack.
     */
    public String getName() {
        return name;
    }

    public String getFunctionId() {
        return functionId;
    }

    /**
     * The deployed name of the function, {@code FunctionName} when declared, otherwise the logical id.
     */
    public String getFunctionName() {
        return functionName;
    }

    public String getStackPath() {
        return stackPath;
    }

    /**
     * The function id prefixed by the path of its stack.
     */
    public String getFullPath() {
        return Stacks.joinPath(stackPath, functionId);
    }

    /**
     * {@link ResourceTypes#ZIP} or {@link ResourceTypes#IMAGE}.
     */
    public String getPackageType() {
        return packageType;
    }

    /**
     * The local code location, {@code null} when the function declares none or the code lives remotely.
     */
    @Nullable
    public String getCodeUri() {
        return codeUri;
    }

    @Nullable
    public String getImageUri() {
        return imageUri;
    }

    @Nullable
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "Function{" + getFullPath() + ", packageType=" + packageType + ", codeUri=" + codeUri + '}';
    }
}
