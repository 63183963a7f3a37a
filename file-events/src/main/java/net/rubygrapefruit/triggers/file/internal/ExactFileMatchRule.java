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

package net.rubygrapefruit.triggers.file.internal;

import net.rubygrapefruit.triggers.file.MatchRule;

import java.util.regex.Pattern;

public class ExactFileMatchRule implements MatchRule {
    private final String absolutePath;
    private final Pattern pattern;

    public ExactFileMatchRule(String absolutePath) {
        this.absolutePath = absolutePath;
        this.pattern = Pattern.compile("^" + Pattern.quote(absolutePath) + "$");
    }

    public String getAbsolutePath() {
        return absolutePath;
    }

    @Override
    public boolean matches(String path) {
        return pattern.matcher(path).matches();
    }

    @Override
    public String toString() {
        return "exact file " + absolutePath;
    }
}
