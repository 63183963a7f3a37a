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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.io.File;

/**
 * Describes one location to watch and the callbacks to notify when it changes.
 *
 * <ul>
 *     <li>A single file is watched through its parent directory, non recursively, with a
 *     {@link MatchRule} selecting the file itself.</li>
 *     <li>A directory is watched recursively. When it is a static folder, its own creation and
 *     removal are reported to {@link #getOnCreate()} and {@link #getOnDelete()}.</li>
 * </ul>
 */
@Immutable
public class WatchTarget {
    private final File path;
    private final boolean recursive;
    private final boolean staticFolder;
    private final MatchRule matchRule;
    private final FileChangeCallback onEvent;
    private final FileChangeCallback onCreate;
    private final FileChangeCallback onDelete;

    private WatchTarget(Builder builder) {
        this.path = builder.path;
        this.recursive = builder.recursive;
        this.staticFolder = builder.staticFolder;
        this.matchRule = builder.matchRule;
        this.onEvent = builder.onEvent;
        this.onCreate = builder.onCreate;
        this.onDelete = builder.onDelete;
    }

    public static Builder builder(File path, MatchRule matchRule, FileChangeCallback onEvent) {
        return new Builder(path, matchRule, onEvent);
    }

    /**
     * The absolute directory to subscribe to.
     */
    public File getPath() {
        return path;
    }

    public boolean isRecursive() {
        return recursive;
    }

    /**
     * Whether the whole subtree under {@link #getPath()} is one logical unit.
     */
    public boolean isStaticFolder() {
        return staticFolder;
    }

    public MatchRule getMatchRule() {
        return matchRule;
    }

    public FileChangeCallback getOnEvent() {
        return onEvent;
    }

    @Nullable
    public FileChangeCallback getOnCreate() {
        return onCreate;
    }

    @Nullable
    public FileChangeCallback getOnDelete() {
        return onDelete;
    }

    @Override
    public String toString() {
        return "WatchTarget{" +
            "path=" + path +
            ", recursive=" + recursive +
            ", staticFolder=" + staticFolder +
            ", matchRule=" + matchRule +
            '}';
    }

    public static class Builder {
        private final File path;
        private final MatchRule matchRule;
        private final FileChangeCallback onEvent;
        private boolean recursive;
        private boolean staticFolder;
        private FileChangeCallback onCreate;
        private FileChangeCallback onDelete;

        private Builder(File path, MatchRule matchRule, FileChangeCallback onEvent) {
            if (!path.isAbsolute()) {
                throw new IllegalArgumentException(String.format("Watch target path must be absolute: %s", path));
            }
            this.path = path;
            this.matchRule = matchRule;
            this.onEvent = onEvent;
        }

        public Builder recursive(boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        public Builder staticFolder(boolean staticFolder) {
            this.staticFolder = staticFolder;
            return this;
        }

        public Builder onCreate(@Nullable FileChangeCallback onCreate) {
            this.onCreate = onCreate;
            return this;
        }

        public Builder onDelete(@Nullable FileChangeCallback onDelete) {
            this.onDelete = onDelete;
            return this;
        }

        public WatchTarget build() {
            return new WatchTarget(this);
        }
    }
}
