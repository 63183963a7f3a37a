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
import net.rubygrapefruit.triggers.stack.Function;
import net.rubygrapefruit.triggers.stack.FunctionProvider;
import net.rubygrapefruit.triggers.stack.ResourceIdentifier;
import net.rubygrapefruit.triggers.stack.SamFunctionProvider;
import net.rubygrapefruit.triggers.stack.Stack;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Watches the code folder of a function. The folder is selected by a {@link CodeLocationStrategy}, see
 * {@link #zip(ResourceIdentifier, List, FileChangeCallback)} and {@link #image(ResourceIdentifier, List, FileChangeCallback)}.
 *
 * <p>The callback is notified for changes within the folder and for the folder itself being created or deleted.</p>
 */
public class LambdaFunctionCodeTrigger extends CodeResourceTrigger {
    private final Function function;
    private final CodeLocationStrategy codeLocationStrategy;
    private final String codeUri;
    private final WatchTarget watchTarget;

    public LambdaFunctionCodeTrigger(ResourceIdentifier functionIdentifier, List<Stack> stacks, FileChangeCallback onCodeChange,
                                     CodeLocationStrategy codeLocationStrategy) {
        this(functionIdentifier, stacks, onCodeChange, codeLocationStrategy, new SamFunctionProvider(stacks));
    }

    /**
     * @throws ResourceNotFoundException when the resource cannot be found in the stacks.
     * @throws FunctionNotFoundException when the resource cannot be resolved as a function.
     * @throws MissingCodeUriException when the strategy finds no code location for the function.
     * @throws IllegalArgumentException when the code location is not a valid path.
     */
    public LambdaFunctionCodeTrigger(ResourceIdentifier functionIdentifier, List<Stack> stacks, FileChangeCallback onCodeChange,
                                     CodeLocationStrategy codeLocationStrategy, FunctionProvider functionProvider) {
        this(functionIdentifier, findResource(functionIdentifier, stacks), onCodeChange, codeLocationStrategy, functionProvider);
    }

    LambdaFunctionCodeTrigger(ResourceIdentifier functionIdentifier, Map<String, Object> resource, FileChangeCallback onCodeChange,
                              CodeLocationStrategy codeLocationStrategy, FunctionProvider functionProvider) {
        super(functionIdentifier, resource, onCodeChange);
        Function function = functionProvider.get(functionIdentifier.toString());
        if (function == null) {
            throw new FunctionNotFoundException(String.format("Function %s cannot be found.", functionIdentifier));
        }
        String codeUri = codeLocationStrategy.getCodeLocation(function);
        if (codeUri == null || codeUri.isEmpty()) {
            throw new MissingCodeUriException(String.format("Function %s has no %s.", functionIdentifier, codeLocationStrategy.getLocationName()));
        }
        this.function = function;
        this.codeLocationStrategy = codeLocationStrategy;
        this.codeUri = codeUri;
        this.watchTarget = WatchTargets.directory(codeUri, onCodeChange, onCodeChange, onCodeChange);
    }

    /**
     * Watches the code uri of a zip packaged function.
     */
    public static LambdaFunctionCodeTrigger zip(ResourceIdentifier functionIdentifier, List<Stack> stacks, FileChangeCallback onCodeChange) {
        return new LambdaFunctionCodeTrigger(functionIdentifier, stacks, onCodeChange, FunctionCodeLocation.ZIP);
    }

    /**
     * Watches the Docker context of an image packaged function.
     */
    public static LambdaFunctionCodeTrigger image(ResourceIdentifier functionIdentifier, List<Stack> stacks, FileChangeCallback onCodeChange) {
        return new LambdaFunctionCodeTrigger(functionIdentifier, stacks, onCodeChange, FunctionCodeLocation.IMAGE);
    }

    public Function getFunction() {
        return function;
    }

    public CodeLocationStrategy getCodeLocationStrategy() {
        return codeLocationStrategy;
    }

    public String getCodeUri() {
        return codeUri;
    }

    @Override
    public List<WatchTarget> resolve() {
        return Collections.singletonList(watchTarget);
    }
}
