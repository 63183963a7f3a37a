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
 * A callback that is invoked whenever a watched path has changed.
 */
public interface FileChangeCallback {
    /**
     * The watched path has changed.
     *
     * Invoked on whatever thread delivers file events to the {@link WatchTargetDispatcher}.
     * Implementations must not assume they are called from a single thread.
     *
     * @param event the change, or {@code null} when the caller has no event to report.
     */
    void pathChanged(@Nullable FileWatchEvent event);
}
