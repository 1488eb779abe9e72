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

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ReaderSupplierFactory {
    private static final Logger LOG = Logger.getLogger(ReaderSupplierFactory.class.getName());

    private ReaderSupplierFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Opens {@code path} for loading serialized structures. The file is memory mapped when possible,
     * otherwise read through a {@link SimpleReader}.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     */
    public static ReaderSupplier open(Path path) throws IOException {
        var supplier = new MappedChunkReader.Supplier(path);
        try {
            // map eagerly so an unmappable file falls back here rather than failing in the caller
            supplier.get().close();
            return supplier;
        } catch (IOException | UnsupportedOperationException e) {
            supplier.close();
            LOG.log(Level.WARNING, "MappedChunkReader not available for {0}, falling back to SimpleReader. Reason: {1}: {2}",
                    new Object[]{path, e.getClass().getName(), e.getMessage()});
            return new SimpleReader.Supplier(path);
        }
    }
}
