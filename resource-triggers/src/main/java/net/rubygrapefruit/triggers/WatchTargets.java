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
import net.rubygrapefruit.triggers.file.MatchRules;
import net.rubygrapefruit.triggers.file.WatchTarget;

import javax.annotation.Nullable;
import java.io.File;

/**
 * Builds the {@link WatchTarget}s shared by the triggers.
 */
public class WatchTargets {
    private WatchTargets() {
    }

    /**
     * Watches a single file through its parent directory, so that the file being created or renamed into place is
     * observed even when it does not exist yet.
     *
     * @throws IllegalArgumentException when the path is not valid or names a file system root.
     */
    public static WatchTarget singleFile(String filePath, FileChangeCallback onEvent) {
        File file = toAbsoluteFile(filePath);
        File folder = file.getParentFile();
        if (folder == null) {
            throw new IllegalArgumentException(String.format("Cannot watch %s as a single file.", file));
        }
        return WatchTarget.builder(folder, MatchRules.exactFile(file), onEvent)
            .recursive(false)
            .staticFolder(false)
            .build();
    }

    /**
     * Watches everything under a directory as one static folder.
     */
    public static WatchTarget directory(String directoryPath, FileChangeCallback onEvent,
                                        @Nullable FileChangeCallback onCreate, @Nullable FileChangeCallback onDelete) {
        return WatchTarget.builder(toAbsoluteFile(directoryPath), MatchRules.anyInTree(), onEvent)
            .recursive(true)
            .staticFolder(true)
            .onCreate(onCreate)
            .onDelete(onDelete)
            .build();
    }

    /**
     * Resolves the path against the working directory and removes {@code .} and {@code ..} segments.
     *
     * @throws IllegalArgumentException when the path is not valid on this file system.
     */
    static File toAbsoluteFile(String path) {
        return new File(path).toPath().toAbsolutePath().normalize().toFile();
    }
}
