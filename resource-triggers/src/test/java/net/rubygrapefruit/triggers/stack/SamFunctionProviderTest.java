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

import net.rubygrapefruit.triggers.testfixture.Resources;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static net.rubygrapefruit.triggers.testfixture.Resources.map;
import static net.rubygrapefruit.triggers.testfixture.Resources.resource;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

public class SamFunctionProviderTest {

    @Test
    public void readsServerlessZipFunction() {
        SamFunctionProvider provider = provider(new Resources()
            .add("HelloFunction", resource(ResourceTypes.AWS_SERVERLESS_FUNCTION, map("CodeUri", "hello/", "FunctionName", "hello-world"))));

        Function function = provider.get("HelloFunction");
        assertEquals("HelloFunction", function.getName());
        assertEquals("HelloFunction", function.getFunctionId());
        assertEquals("hello-world", function.getFunctionName());
        assertEquals(ResourceTypes.ZIP, function.getPackageType());
        assertEquals("hello/", function.getCodeUri());
        assertNull(function.getImageUri());
        assertNull(function.getMetadata());
    }

    @Test
    public void readsLambdaFunctionWithLocalCode() {
        SamFunctionProvider provider = provider(new Resources()
            .add("Fn", resource(ResourceTypes.AWS_LAMBDA_FUNCTION, map("Code", "build/Fn"))));

        assertEquals("build/Fn", provider.get("Fn").getCodeUri());
    }

    @Test
    public void codeStoredInS3HasNoCodeUri() {
        SamFunctionProvider provider = provider(new Resources()
            .add("Serverless", resource(ResourceTypes.AWS_SERVERLESS_FUNCTION, map("CodeUri", map("Bucket", "b", "Key", "k"))))
            .add("Lambda", resource(ResourceTypes.AWS_LAMBDA_FUNCTION, map("Code", map("S3Bucket", "b", "S3Key", "k")))));

        assertNull(provider.get("Serverless").getCodeUri());
        assertNull(provider.get("Lambda").getCodeUri());
    }

    @Test
    public void imageFunctionsHaveImageUriAndMetadataButNoCodeUri() {
        Map<String, Object> serverless = resource(ResourceTypes.AWS_SERVERLESS_FUNCTION,
            map("PackageType", "Image", "ImageUri", "hello:latest", "CodeUri", "ignored/"));
        serverless.put("Metadata", map("DockerContext", "app/", "Dockerfile", "Dockerfile"));
        Map<String, Object> lambda = resource(ResourceTypes.AWS_LAMBDA_FUNCTION,
            map("PackageType", "Image", "Code", map("ImageUri", "lambda:latest")));
        SamFunctionProvider provider = provider(new Resources().add("Serverless", serverless).add("Lambda", lambda));

        Function function = provider.get("Serverless");
        assertEquals(ResourceTypes.IMAGE, function.getPackageType());
        assertEquals("hello:latest", function.getImageUri());
        assertNull(function.getCodeUri());
        assertEquals("app/", function.getMetadata().get("DockerContext"));

        assertEquals("lambda:latest", provider.get("Lambda").getImageUri());
    }

    @Test
    public void ignoresOtherResourceTypes() {
        SamFunctionProvider provider = provider(new Resources()
            .add("Layer", resource(ResourceTypes.AWS_SERVERLESS_LAYERVERSION, map("ContentUri", "layer/")))
            .add("Api", resource(ResourceTypes.AWS_SERVERLESS_API, map("DefinitionUri", "api.yaml"))));

        assertEquals(0, provider.getAll().size());
        assertNull(provider.get("Layer"));
    }

    @Test
    public void looksUpByFullPathBeforeLogicalId() {
        SamFunctionProvider provider = new SamFunctionProvider(Arrays.asList(
            new Resources().add("Fn", resource(ResourceTypes.AWS_SERVERLESS_FUNCTION, map("CodeUri", "root/"))).rootStack(),
            new Resources().add("Fn", resource(ResourceTypes.AWS_SERVERLESS_FUNCTION, map("CodeUri", "child/"))).childStack("", "Child")
        ));

        assertEquals("child/", provider.get("Child/Fn").getCodeUri());
        assertEquals("Child/Fn", provider.get("Child/Fn").getFullPath());
        assertEquals("root/", provider.get("Fn").getCodeUri());
        assertNull(provider.get("Other/Fn"));
    }

    @Test
    public void looksUpByFunctionName() {
        SamFunctionProvider provider = provider(new Resources()
            .add("Fn", resource(ResourceTypes.AWS_SERVERLESS_FUNCTION, map("CodeUri", "src/", "FunctionName", "deployed-name"))));

        assertSame(provider.get("Fn"), provider.get("deployed-name"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsEmptyName() {
        provider(new Resources()).get("");
    }

    private static SamFunctionProvider provider(Resources resources) {
        return new SamFunctionProvider(Collections.singletonList(resources.rootStack()));
    }
}
