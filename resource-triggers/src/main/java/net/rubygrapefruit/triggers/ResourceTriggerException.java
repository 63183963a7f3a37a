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

/**
 * Base class of the failures to resolve a resource into watch targets. Always thrown while constructing a trigger.
 */
public class ResourceTriggerException extends RuntimeException {
    public ResourceTriggerException(String message, Throwable throwable) {
        super(message, throwable);
    }

    public ResourceTriggerException(String message) {
        super(message);
    }
}
