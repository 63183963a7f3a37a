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

import net.rubygrapefruit.triggers.stack.Function;
import net.rubygrapefruit.triggers.stack.Stacks;

import javax.annotation.Nullable;

public enum FunctionCodeLocation implements CodeLocationStrategy {
    /**
     * The declared code uri of a zip packaged function.
     */
    ZIP("CodeUri") {
        @Nullable
        @Override
        public String getCodeLocation(Function function) {
            return function.getCodeUri();
        }
    },

    /**
     * The Docker build context of an image packaged function, taken from its metadata.
     */
    IMAGE("Metadata.DockerContext") {
        @Nullable
        @Override
        public String getCodeLocation(Function function) {
            return Stacks.getString(function.getMetadata(), DOCKER_CONTEXT);
        }
    };

    private static final String DOCKER_CONTEXT = "DockerContext";

    private final String locationName;

    FunctionCodeLocation(String locationName) {
        this.locationName = locationName;
    }

    @Override
    public String getLocationName() {
        return locationName;
    }
}
