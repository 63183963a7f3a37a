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

public class ResourceTypes {
    public static final String AWS_LAMBDA_FUNCTION = "AWS::Lambda::Function";
    public static final String AWS_SERVERLESS_FUNCTION = "AWS::Serverless::Function";
    public static final String AWS_LAMBDA_LAYERVERSION = "AWS::Lambda::LayerVersion";
    public static final String AWS_SERVERLESS_LAYERVERSION = "AWS::Serverless::LayerVersion";
    public static final String AWS_SERVERLESS_API = "AWS::Serverless::Api";
    public static final String AWS_SERVERLESS_HTTPAPI = "AWS::Serverless::HttpApi";
    public static final String AWS_APIGATEWAY_RESTAPI = "AWS::ApiGateway::RestApi";
    public static final String AWS_APIGATEWAY_V2_API = "AWS::ApiGatewayV2::Api";

    public static final String ZIP = "Zip";
    public static final String IMAGE = "Image";

    private ResourceTypes() {
    }
}
