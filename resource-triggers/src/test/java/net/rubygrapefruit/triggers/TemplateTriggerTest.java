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
import net.rubygrapefruit.triggers.file.WatchTarget;
import net.rubygrapefruit.triggers.file.WatchTargetDispatcher;
import net.rubygrapefruit.triggers.testfixture.RecordingCallback;
import net.rubygrapefruit.triggers.testfixture.StubDefinitionValidator;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TemplateTriggerTest {
    @Rule
    public TemporaryFolder tmpDir = new TemporaryFolder();

    private final RecordingCallback onTemplateChange = new RecordingCallback();
    private final StubDefinitionValidator.Factory validators = new StubDefinitionValidator.Factory();

    @Test
    public void watchesTemplateFile() {
        File template = new File(tmpDir.getRoot(), "template.yaml");
        TemplateTrigger trigger = new TemplateTrigger(template.getPath(), onTemplateChange, validators);

        List<WatchTarget> targets = trigger.resolve();

        assertEquals(1, targets.size());
        WatchTarget target = targets.get(0);
        assertEquals(template.getAbsoluteFile().getParentFile(), target.getPath());
        assertFalse(target.isRecursive());
        assertTrue(target.getMatchRule().matches(template.getAbsolutePath()));
        assertEquals(Collections.singletonList(template), validators.definitionFiles);
    }

    @Test
    public void forwardsEventsOnlyWhenTemplateValidates() {
        TemplateTrigger trigger = new TemplateTrigger(new File(tmpDir.getRoot(), "template.yaml").getPath(), onTemplateChange, validators);
        WatchTarget target = trigger.resolve().get(0);
        FileWatchEvent event = FileWatchEvents.modified(new File(tmpDir.getRoot(), "template.yaml").getAbsolutePath());

        validators.validator.result = false;
        target.getOnEvent().pathChanged(event);
        assertTrue(onTemplateChange.events.isEmpty());

        validators.validator.result = true;
        target.getOnEvent().pathChanged(event);
        assertEquals(1, onTemplateChange.events.size());
        assertSame(event, onTemplateChange.events.get(0));
    }

    @Test
    public void resolveIsRepeatable() {
        TemplateTrigger trigger = new TemplateTrigger("template.yaml", onTemplateChange, validators);

        WatchTarget first = trigger.resolve().get(0);
        WatchTarget second = trigger.resolve().get(0);

        assertEquals(first.getPath(), second.getPath());
        assertSame(first.getOnEvent(), second.getOnEvent());
        assertEquals(1, validators.definitionFiles.size());
        assertEquals(0, validators.validator.validations);
    }

    @Test(expected = IllegalArgumentException.class)
    public void templateAtFileSystemRootFailsAtConstruction() {
        new TemplateTrigger(File.listRoots()[0].getPath(), onTemplateChange, validators);
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidTemplatePathFailsAtConstruction() {
        new TemplateTrigger("tem\0plate.yaml", onTemplateChange, validators);
    }

    @Test
    public void onlyMeaningfulTemplateEditsReachTheCallback() throws IOException {
        File template = write("Resources:\n  Fn:\n    Type: AWS::Serverless::Function\n    Properties:\n      CodeUri: src/\n");
        WatchTargetDispatcher dispatcher = new WatchTargetDispatcher();
        dispatcher.register(new TemplateTrigger(template.getPath(), onTemplateChange).resolve());
        FileWatchEvent modified = FileWatchEvents.modified(template.getAbsolutePath());

        write("Resources:\n  Fn:\n    Type: AWS::Serverless::Function\n    Properties:\n      CodeUri: src/   # trailing comment\n");
        assertEquals(1, dispatcher.dispatch(modified));
        assertTrue(onTemplateChange.events.isEmpty());

        write("Resources:\n  Fn:\n    Type: AWS::Serverless::Function\n    Properties:\n      CodeUri: [broken\n");
        assertEquals(1, dispatcher.dispatch(modified));
        assertTrue(onTemplateChange.events.isEmpty());

        write("Resources:\n  Fn:\n    Type: AWS::Serverless::Function\n    Properties:\n      CodeUri: lib/\n");
        assertEquals(1, dispatcher.dispatch(modified));
        assertEquals(Collections.singletonList(modified), onTemplateChange.events);

        assertEquals(0, dispatcher.dispatch(FileWatchEvents.modified(new File(tmpDir.getRoot(), "other.yaml").getAbsolutePath())));
    }

    private File write(String content) throws IOException {
        File file = new File(tmpDir.getRoot(), "template.yaml");
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return file;
    }
}
