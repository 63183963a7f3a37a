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

/**
 * Creates {@link FileWatchEvent} instances.
 */
public class FileWatchEvents {
    private FileWatchEvents() {
    }

    public static FileWatchEvent created(String absolutePath) {
        return new ChangeEvent(FileWatchEvent.Type.CREATED, absolutePath);
    }

    public static FileWatchEvent removed(String absolutePath) {
        return new ChangeEvent(FileWatchEvent.Type.REMOVED, absolutePath);
    }

    public static FileWatchEvent modified(String absolutePath) {
        return new ChangeEvent(FileWatchEvent.Type.MODIFIED, absolutePath);
    }

    public static FileWatchEvent invalidated(String absolutePath) {
        return new ChangeEvent(FileWatchEvent.Type.INVALIDATED, absolutePath);
    }

    public static FileWatchEvent overflowed(@Nullable String absolutePath) {
        return new ChangeEvent(FileWatchEvent.Type.OVERFLOWED, absolutePath);
    }

    @Immutable
    private static class ChangeEvent implements FileWatchEvent {
        private final Type type;
        private final String path;

        public ChangeEvent(Type type, @Nullable String path) {
            this.type = type;
            this.path = path;
        }

        @Override
        public Type getType() {
            return type;
        }

        @Nullable
        @Override
        public String getPath() {
            return path;
        }

        @Override
        public String toString() {
            return type + " " + path;
        }
    }
}
