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
 * Resolves {@code AWS::Serverless::Function} and {@code AWS::Lambda::Function} resources.
 *
 * <p>A code location is only reported for {@link ResourceTypes#ZIP} functions whose code is a local path.
 * Code stored as an S3 object, inline code and image functions have no local code location.</p>
 */
@Immutable
public class SamFunctionProvider implements FunctionProvider {
    private static final String CODE_URI = "CodeUri";
    private static final String CODE = "Code";
    private static final String IMAGE_URI = "ImageUri";
    private static final String PACKAGE_TYPE = "PackageType";
    private static final String FUNCTION_NAME = "FunctionName";

    private final List<Function> functions;

    public SamFunctionProvider(List<Stack> stacks) {
        List<Function> functions = new ArrayList<Function>();
        for (Stack stack : stacks) {
            for (Map.Entry<String, Map<String, Object>> entry : stack.getResources().entrySet()) {
                Function function = toFunction(stack, entry.getKey(), entry.getValue());
                if (function != null) {
                    functions.add(function);
                }
            }
        }
        this.functions = Collections.unmodifiableList(functions);
    }

    public List<Function> getAll() {
        return functions;
    }

    @Nullable
    @Override
    public Function get(String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Function name is required");
        }
        for (Function function : functions) {
            if (function.getFullPath().equals(name)) {
                return function;
            }
        }
        for (Function function : functions) {
            if (function.getFunctionId().equals(name)) {
                return function;
            }
        }
        for (Function function : functions) {
            if (function.getName().equals(name) || function.getFunctionName().equals(name)) {
                return function;
            }
        }
        return null;
    }

    @Nullable
    private static Function toFunction(Stack stack, String logicalId, Map<String, Object> resource) {
        String type = Stacks.getType(resource);
        boolean serverless = ResourceTypes.AWS_SERVERLESS_FUNCTION.equals(type);
        if (!serverless && !ResourceTypes.AWS_LAMBDA_FUNCTION.equals(type)) {
            return null;
        }
        Map<String, Object> properties = Stacks.getProperties(resource);
        String packageType = Stacks.getString(properties, PACKAGE_TYPE);
        if (packageType == null) {
            packageType = ResourceTypes.ZIP;
        }
        String functionName = Stacks.getString(properties, FUNCTION_NAME);

        String codeUri = null;
        String imageUri;
        if (serverless) {
            if (ResourceTypes.ZIP.equals(packageType)) {
                codeUri = Stacks.getString(properties, CODE_URI);
            }
            imageUri = Stacks.getString(properties, IMAGE_URI);
        } else {
            if (ResourceTypes.ZIP.equals(packageType)) {
                codeUri = Stacks.getString(properties, CODE);
            }
            imageUri = Stacks.getString(Stacks.getMap(properties, CODE), IMAGE_URI);
        }

        return new Function(
            logicalId,
            Stacks.getResourceId(resource, logicalId),
            functionName == null ? logicalId : functionName,
            stack.getStackPath(),
            packageType,
            codeUri,
            imageUri,
            Stacks.getMetadata(resource)
        );
    }
}
