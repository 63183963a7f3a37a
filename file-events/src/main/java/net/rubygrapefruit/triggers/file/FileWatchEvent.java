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

/**
 * A change observed by a file watcher, as delivered to a {@link FileChangeCallback}.
 */
public interface FileWatchEvent {

    /**
     * The type of the change. When {@link Type#OVERFLOWED}, {@link #getPath()} may return {@code null}.
     */
    Type getType();

    /**
     * The absolute path that has been changed. Can be {@code null} when {@link #getType()} is
     * {@link Type#OVERFLOWED}.
     */
    @Nullable
    String getPath();

    enum Type {
        /**
         * An item with the given path has been created.
         */
        CREATED,

        /**
         * An item with the given path has been removed.
         */
        REMOVED,

        /**
         * An item with the given path has been modified.
         */
        MODIFIED,

        /**
         * Some undisclosed changes happened under the given path,
         * all information about descendants must be discarded.
         */
        INVALIDATED,

        /**
         * Events have been lost, all information about the watched locations must be discarded.
         */
        OVERFLOWED
    }
}
