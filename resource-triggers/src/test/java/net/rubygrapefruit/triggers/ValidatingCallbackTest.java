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

import net.rubygrapefruit.triggers.file.FileWatchEvent;
import net.rubygrapefruit.triggers.file.FileWatchEvents;
import net.rubygrapefruit.triggers.testfixture.RecordingCallback;
import net.rubygrapefruit.triggers.testfixture.StubDefinitionValidator;
import org.junit.Test;

import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ValidatingCallbackTest {
    private final StubDefinitionValidator validator = new StubDefinitionValidator();
    private final RecordingCallback delegate = new RecordingCallback();
    private final ValidatingCallback callback = new ValidatingCallback(validator, delegate);

    @Test
    public void suppressesEventWhenValidationFails() {
        validator.result = false;

        callback.pathChanged(FileWatchEvents.modified("/project/template.yaml"));

        assertEquals(1, validator.validations);
        assertTrue(delegate.events.isEmpty());
    }

    @Test
    public void forwardsSameEventOnceWhenValidationPasses() {
        validator.result = true;
        FileWatchEvent event = FileWatchEvents.modified("/project/template.yaml");

        callback.pathChanged(event);

        assertEquals(1, validator.validations);
        assertEquals(1, delegate.events.size());
        assertSame(event, delegate.events.get(0));
    }

    @Test
    public void forwardsMissingEvent() {
        validator.result = true;

        callback.pathChanged(null);

        assertEquals(Collections.<FileWatchEvent>singletonList(null), delegate.events);
    }

    @Test
    public void validatesOnEveryEvent() {
        validator.result = false;
        callback.pathChanged(FileWatchEvents.modified("/project/template.yaml"));
        validator.result = true;
        callback.pathChanged(FileWatchEvents.modified("/project/template.yaml"));

        assertEquals(2, validator.validations);
        assertEquals(1, delegate.events.size());
        assertSame(validator, callback.getValidator());
        assertSame(delegate, callback.getDelegate());
    }
}
