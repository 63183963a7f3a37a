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
import net.rubygrapefruit.triggers.stack.ResourceIdentifier;
import net.rubygrapefruit.triggers.stack.ResourceTypes;
import net.rubygrapefruit.triggers.stack.Stack;
import net.rubygrapefruit.triggers.testfixture.RecordingCallback;
import net.rubygrapefruit.triggers.testfixture.Resources;
import org.junit.Test;

import java.io.File;
import java.util.Collections;
import java.util.List;

import static net.rubygrapefruit.triggers.testfixture.Resources.map;
import static net.rubygrapefruit.triggers.testfixture.Resources.resource;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class LambdaLayerCodeTriggerTest {
    private final RecordingCallback onCodeChange = new RecordingCallback();
    private final List<Stack> stacks = Collections.singletonList(new Resources()
        .add("Layer", resource(ResourceTypes.AWS_SERVERLESS_LAYERVERSION, map("ContentUri", "layers/shared")))
        .add("LambdaLayer", resource(ResourceTypes.AWS_LAMBDA_LAYERVERSION, map("Content", "layers/lambda")))
        .add("EmptyLayer", resource(ResourceTypes.AWS_SERVERLESS_LAYERVERSION, map("ContentUri", "")))
        .add("RemoteLayer", resource(ResourceTypes.AWS_LAMBDA_LAYERVERSION, map("Content", map("S3Bucket", "bucket", "S3Key", "key"))))
        .add("InvalidLayer", resource(ResourceTypes.AWS_SERVERLESS_LAYERVERSION, map("ContentUri", "layers/\0")))
        .add("Fn", resource(ResourceTypes.AWS_SERVERLESS_FUNCTION, map("CodeUri", "src/")))
        .rootStack());

    @Test
    public void watchesLayerContent() {
        LambdaLayerCodeTrigger trigger = new LambdaLayerCodeTrigger(new ResourceIdentifier("Layer"), stacks, onCodeChange);
        List<WatchTarget> targets = trigger.resolve();

        assertEquals(1, targets.size());
        WatchTarget target = targets.get(0);
        File workingDir = new File(System.getProperty("user.dir")).getAbsoluteFile();
        assertEquals(new File(new File(workingDir, "layers"), "shared"), target.getPath());
        assertTrue(target.isRecursive());
        assertTrue(target.isStaticFolder());
        assertSame(onCodeChange, target.getOnEvent());
        assertSame(onCodeChange, target.getOnCreate());
        assertSame(onCodeChange, target.getOnDelete());
        assertEquals("layers/shared", trigger.getLayer().getCodeUri());
    }

    @Test
    public void watchesLambdaLayerContent() {
        LambdaLayerCodeTrigger trigger = new LambdaLayerCodeTrigger(new ResourceIdentifier("LambdaLayer"), stacks, onCodeChange);

        assertEquals("layers/lambda", trigger.getCodeUri());
    }

    @Test(expected = ResourceNotFoundException.class)
    public void unknownResourceIsNotFound() {
        new LambdaLayerCodeTrigger(new ResourceIdentifier("Other"), stacks, onCodeChange);
    }

    @Test
    public void resourceThatIsNotALayerIsResourceNotFound() {
        try {
            new LambdaLayerCodeTrigger(new ResourceIdentifier("Fn"), stacks, onCodeChange);
            fail();
        } catch (ResourceNotFoundException e) {
            assertEquals("Layer Fn cannot be found.", e.getMessage());
        }
    }

    @Test(expected = MissingCodeUriException.class)
    public void layerWithEmptyContentUriIsMissingCodeUri() {
        new LambdaLayerCodeTrigger(new ResourceIdentifier("EmptyLayer"), stacks, onCodeChange);
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidContentPathFailsAtConstruction() {
        new LambdaLayerCodeTrigger(new ResourceIdentifier("InvalidLayer"), stacks, onCodeChange);
    }

    @Test(expected = MissingCodeUriException.class)
    public void layerWithRemoteContentIsMissingCodeUri() {
        new LambdaLayerCodeTrigger(new ResourceIdentifier("RemoteLayer"), stacks, onCodeChange);
    }
}
