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

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.File;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes file events to the callbacks of the registered {@link WatchTarget}s.
 *
 * <h3>Remarks:</h3>
 *
 * <ul>
 *     <li>The dispatcher owns no threads. Callbacks run on the thread calling {@link #dispatch(FileWatchEvent)}
 *     and any exception they throw propagates to that caller.</li>
 *     <li>Subscribing to {@link #getWatchedDirectories()} is the job of the file watcher feeding the events.</li>
 * </ul>
 */
@ThreadSafe
public class WatchTargetDispatcher {
    private static final Logger LOGGER = Logger.getLogger(WatchTargetDispatcher.class.getName());

    private final Object lock = new Object();
    // Protected by lock
    private final Set<WatchTarget> targets = new LinkedHashSet<WatchTarget>();

    public void register(Collection<WatchTarget> watchTargets) {
        synchronized (lock) {
            targets.addAll(watchTargets);
        }
    }

    /**
     * @return whether any of the given targets was registered.
     */
    public boolean unregister(Collection<WatchTarget> watchTargets) {
        synchronized (lock) {
            return targets.removeAll(watchTargets);
        }
    }

    public List<WatchTarget> getWatchTargets() {
        synchronized (lock) {
            return new ArrayList<WatchTarget>(targets);
        }
    }

    /**
     * The directories a file watcher must subscribe to so that every registered target receives its events.
     * Static folders contribute their parent as well, so that the folder itself being created or removed is observed.
     */
    public Set<File> getWatchedDirectories() {
        Set<File> directories = new LinkedHashSet<File>();
        for (WatchTarget target : getWatchTargets()) {
            directories.add(target.getPath());
            if (target.isStaticFolder()) {
                File parent = target.getPath().getParentFile();
                if (parent != null) {
                    directories.add(parent);
                }
            }
        }
        return directories;
    }

    /**
     * Delivers the event to every matching callback.
     *
     * @return the number of callbacks invoked.
     */
    @CheckReturnValue
    public int dispatch(FileWatchEvent event) {
        int notified = 0;
        for (WatchTarget target : getWatchTargets()) {
            FileChangeCallback callback = selectCallback(target, event);
            if (callback != null) {
                if (LOGGER.isLoggable(Level.FINEST)) {
                    LOGGER.finest("Delivering " + event + " to " + target);
                }
                callback.pathChanged(event);
                notified++;
            }
        }
        return notified;
    }

    @Nullable
    private static FileChangeCallback selectCallback(WatchTarget target, FileWatchEvent event) {
        String path = event.getPath();
        if (path == null) {
            // Nothing is known about what changed
            return target.getOnEvent();
        }
        File changed = new File(path);
        if (target.isStaticFolder() && changed.equals(target.getPath())) {
            switch (event.getType()) {
                case CREATED:
                    return target.getOnCreate();
                case REMOVED:
                    return target.getOnDelete();
                default:
                    break;
            }
        }
        if (event.getType() == FileWatchEvent.Type.INVALIDATED && isSameOrAncestor(changed, target.getPath())) {
            return target.getOnEvent();
        }
        if (isInside(target, changed) && target.getMatchRule().matches(path)) {
            return target.getOnEvent();
        }
        return null;
    }

    private static boolean isInside(WatchTarget target, File changed) {
        File parent = changed.getParentFile();
        if (!target.isRecursive()) {
            return target.getPath().equals(parent);
        }
        while (parent != null) {
            if (parent.equals(target.getPath())) {
                return true;
            }
            parent = parent.getParentFile();
        }
        return false;
    }

    private static boolean isSameOrAncestor(File candidate, File path) {
        for (File current = path; current != null; current = current.getParentFile()) {
            if (current.equals(candidate)) {
                return true;
            }
        }
        return false;
    }
}
