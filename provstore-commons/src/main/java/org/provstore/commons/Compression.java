/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.provstore.commons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.jetbrains.annotations.NotNull;

/**
 * The compression formats a record store can write, and the detection of
 * the format a stored blob was written with.
 */
public interface Compression {

    Compression NONE = new Compression() {
        @Override
        public InputStream getInputStream(InputStream in) {
            return in;
        }

        @Override
        public OutputStream getOutputStream(OutputStream out) {
            return out;
        }

        @Override
        public boolean matches(byte[] header) {
            return !GZIP.matches(header);
        }

        @Override
        public String toString() {
            return "none";
        }
    };

    Compression GZIP = new Compression() {
        @Override
        public InputStream getInputStream(InputStream in) throws IOException {
            return new GZIPInputStream(in, 2048);
        }

        @Override
        public OutputStream getOutputStream(OutputStream out) throws IOException {
            return new GZIPOutputStream(out, 2048) {
                {
                    def.setLevel(Deflater.BEST_SPEED);
                }
            };
        }

        @Override
        public boolean matches(byte[] header) {
            return header.length >= 2
                    && (header[0] & 0xff) == 0x1f
                    && (header[1] & 0xff) == 0x8b;
        }

        @Override
        public String toString() {
            return "gzip";
        }
    };

    InputStream getInputStream(InputStream in) throws IOException;

    OutputStream getOutputStream(OutputStream out) throws IOException;

    /**
     * @param header the leading bytes of a blob, possibly fewer than two
     * @return whether the blob was written with this compression
     */
    boolean matches(byte[] header);

    /**
     * Detects the compression of a blob from its leading bytes.
     *
     * @param header the leading bytes of a blob
     * @return {@link #GZIP} if the gzip magic number is present, {@link #NONE} otherwise
     */
    @NotNull
    static Compression detect(byte[] header) {
        return GZIP.matches(header) ? GZIP : NONE;
    }
}
