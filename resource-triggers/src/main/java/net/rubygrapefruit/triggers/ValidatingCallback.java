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
import net.rubygrapefruit.triggers.file.FileWatchEvent;
import net.rubygrapefruit.triggers.validation.DefinitionValidator;

import javax.annotation.Nullable;

/**
 * Forwards an event to a callback only when the definition file still validates and has changed meaningfully.
 */
public class ValidatingCallback implements FileChangeCallback {
    private final DefinitionValidator validator;
    private final FileChangeCallback delegate;

    public ValidatingCallback(DefinitionValidator validator, FileChangeCallback delegate) {
        this.validator = validator;
        this.delegate = delegate;
    }

    public DefinitionValidator getValidator() {
        return validator;
    }

    public FileChangeCallback getDelegate() {
        return delegate;
    }

    @Override
    public void pathChanged(@Nullable FileWatchEvent event) {
        if (validator.validate()) {
            delegate.pathChanged(event);
        }
    }
}
