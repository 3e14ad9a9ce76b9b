/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.walkv.wal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A segment file of the log, identified by a number that grows with every rotation.
 * <p>
 * The id is zero-padded into the file name, so creation order can be rebuilt from a
 * directory listing alone.
 *
 * @param id   segment number, starting at 1
 * @param path file location
 */
record Segment(long id, Path path) {

    private static final Logger LOG = LoggerFactory.getLogger(Segment.class);

    private static final String PREFIX = "segment-";
    private static final String SUFFIX = ".wal";
    private static final Pattern NAME = Pattern.compile("segment-(\\d{20})\\.wal");

    static Segment of(Path dir, long id) {
        return new Segment(id, dir.resolve(fileName(id)));
    }

    static String fileName(long id) {
        return PREFIX + String.format("%020d", id) + SUFFIX;
    }

    /**
     * Lists the segment files in a directory, oldest first. Other files, and segment
     * names whose id does not fit in a {@code long}, are ignored.
     */
    static List<Segment> list(Path dir) throws IOException {
        List<Segment> segments = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, PREFIX + "*" + SUFFIX)) {
            for (Path path : stream) {
                Matcher m = NAME.matcher(path.getFileName().toString());
                if (!m.matches() || !Files.isRegularFile(path)) {
                    continue;
                }
                try {
                    segments.add(new Segment(Long.parseLong(m.group(1)), path));
                } catch (NumberFormatException e) {
                    LOG.warn("Ignoring {}: segment id out of range", path.getFileName());
                }
            }
        }
        segments.sort(Comparator.comparingLong(Segment::id));
        return segments;
    }

    Segment next() {
        return of(path.getParent(), id + 1);
    }
}
