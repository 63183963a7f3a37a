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

package net.rubygrapefruit.triggers.file;

import net.rubygrapefruit.triggers.file.internal.AnyInTreeMatchRule;
import net.rubygrapefruit.triggers.file.internal.ExactFileMatchRule;

import java.io.File;

public class MatchRules {
    private MatchRules() {
    }

    /**
     * Matches the absolute path of the given file and nothing else. Characters in the path
     * that have a meaning in regular expressions are matched literally. Matching is case sensitive.
     */
    public static MatchRule exactFile(File file) {
        return new ExactFileMatchRule(file.getAbsolutePath());
    }

    /**
     * Matches any path. The dispatcher only offers paths within the target's tree.
     */
    public static MatchRule anyInTree() {
        return AnyInTreeMatchRule.INSTANCE;
    }
}
