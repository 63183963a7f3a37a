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

/**
 * Resolves function resources of a set of stacks.
 */
public interface FunctionProvider {
    /**
     * @param name the full path, function id, logical id or function name of the function.
     * @return the function, or {@code null} when no function is known by that name.
     */
    @Nullable
    Function get(String name);
}
