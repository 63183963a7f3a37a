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
import net.rubygrapefruit.triggers.stack.ResourceTypes;
import net.rubygrapefruit.triggers.stack.SamFunctionProvider;
import net.rubygrapefruit.triggers.stack.SamLayerProvider;
import net.rubygrapefruit.triggers.stack.Stack;
import net.rubygrapefruit.triggers.stack.Stacks;
import net.rubygrapefruit.triggers.validation.YamlDefinitionValidator;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Creates the {@link CodeResourceTrigger} matching the type of a resource.
 *
 * <table>
 *     <caption>Supported resource types</caption>
 *     <tr><th>Type</th><th>Trigger</th></tr>
 *     <tr><td>{@code AWS::Serverless::Function}, {@code AWS::Lambda::Function}</td>
 *     <td>{@link LambdaFunctionCodeTrigger} for the function's {@code PackageType}</td></tr>
 *     <tr><td>{@code AWS::Serverless::LayerVersion}, {@code AWS::Lambda::LayerVersion}</td>
 *     <td>{@link LambdaLayerCodeTrigger}</td></tr>
 *     <tr><td>{@code AWS::Serverless::Api}, {@code AWS::Serverless::HttpApi}, {@code AWS::ApiGateway::RestApi},
 *     {@code AWS::ApiGatewayV2::Api}</td><td>{@link ApiGatewayCodeTrigger}</td></tr>
 * </table>
 */
public class CodeTriggerFactory {
    private static final Logger LOGGER = Logger.getLogger(CodeTriggerFactory.class.getName());
    private static final String PACKAGE_TYPE = "PackageType";

    private final List<Stack> stacks;
    private final SamFunctionProvider functionProvider;
    private final SamLayerProvider layerProvider;

    public CodeTriggerFactory(List<Stack> stacks) {
        this.stacks = Collections.unmodifiableList(new ArrayList<Stack>(stacks));
        this.functionProvider = new SamFunctionProvider(this.stacks);
        this.layerProvider = new SamLayerProvider(this.stacks);
    }

    public List<Stack> getStacks() {
        return stacks;
    }

    /**
     * @return the trigger, or {@code null} when the resource does not exist or its type has no code to watch.
     * @throws ResourceTriggerException when the trigger for the resource type cannot be constructed.
     */
    @Nullable
    public CodeResourceTrigger createTrigger(ResourceIdentifier resourceIdentifier, FileChangeCallback onCodeChange) {
        Map<String, Object> resource = Stacks.getResourceById(stacks, resourceIdentifier);
        if (resource == null) {
            LOGGER.fine("Resource " + resourceIdentifier + " cannot be found, it will not be watched.");
            return null;
        }
        String resourceType = Stacks.getType(resource);
        if (ResourceTypes.AWS_SERVERLESS_FUNCTION.equals(resourceType) || ResourceTypes.AWS_LAMBDA_FUNCTION.equals(resourceType)) {
            return createFunctionTrigger(resourceIdentifier, resource, onCodeChange);
        }
        if (ResourceTypes.AWS_SERVERLESS_LAYERVERSION.equals(resourceType) || ResourceTypes.AWS_LAMBDA_LAYERVERSION.equals(resourceType)) {
            return new LambdaLayerCodeTrigger(resourceIdentifier, resource, onCodeChange, layerProvider);
        }
        if (ResourceTypes.AWS_SERVERLESS_API.equals(resourceType)
            || ResourceTypes.AWS_SERVERLESS_HTTPAPI.equals(resourceType)
            || ResourceTypes.AWS_APIGATEWAY_RESTAPI.equals(resourceType)
            || ResourceTypes.AWS_APIGATEWAY_V2_API.equals(resourceType)) {
            return new ApiGatewayCodeTrigger(resourceIdentifier, resource, onCodeChange, YamlDefinitionValidator.factory());
        }
        LOGGER.fine("Resource " + resourceIdentifier + " of type " + resourceType + " has no code to watch.");
        return null;
    }

    @Nullable
    private CodeResourceTrigger createFunctionTrigger(ResourceIdentifier resourceIdentifier, Map<String, Object> resource,
                                                      FileChangeCallback onCodeChange) {
        String packageType = Stacks.getString(Stacks.getProperties(resource), PACKAGE_TYPE);
        if (packageType == null || ResourceTypes.ZIP.equals(packageType)) {
            return new LambdaFunctionCodeTrigger(resourceIdentifier, resource, onCodeChange, FunctionCodeLocation.ZIP, functionProvider);
        }
        if (ResourceTypes.IMAGE.equals(packageType)) {
            return new LambdaFunctionCodeTrigger(resourceIdentifier, resource, onCodeChange, FunctionCodeLocation.IMAGE, functionProvider);
        }
        LOGGER.fine("Function " + resourceIdentifier + " has unsupported package type " + packageType + ".");
        return null;
    }
}
