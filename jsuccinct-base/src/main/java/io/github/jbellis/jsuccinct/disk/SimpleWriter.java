/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jbellis.jsuccinct.disk;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Path;

/**
 * A buffered IndexWriter that writes a new file, replacing any existing file at the same path.
 */
public class SimpleWriter extends DataOutputStream implements IndexWriter {
    private final FileOutputStream fos;

    public SimpleWriter(Path path) throws IOException {
        this(new FileOutputStream(path.toFile()));
    }

    private SimpleWriter(FileOutputStream fos) {
        super(new BufferedOutputStream(fos));
        this.fos = fos;
    }

    /**
     * Flushes buffered output and returns the file position.
     */
    @Override
    public long position() throws IOException {
        flush();
        return fos.getChannel().position();
    }
}
