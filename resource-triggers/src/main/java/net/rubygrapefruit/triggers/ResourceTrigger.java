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

import net.rubygrapefruit.triggers.file.WatchTarget;

import java.util.List;

/**
 * Resolves a resource into the locations to watch for changes to it.
 *
 * <p>All resolution happens when the trigger is constructed, and construction fails when something required is missing.
 * A constructed trigger is immutable: {@link #resolve()} can be called any number of times and returns equivalent
 * targets each time. A trigger is never updated, create a new one when the stacks change.</p>
 */
public interface ResourceTrigger {
    /**
     * @return the watch targets for the resource. Never empty.
     */
    List<WatchTarget> resolve();
}
