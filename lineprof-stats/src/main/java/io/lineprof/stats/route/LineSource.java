package io.lineprof.stats.route;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
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

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/// A blocking, forward-only sequence of text lines.
///
/// Lines end at `\n`, `\r\n` or `\r`. A final line without a terminator is still returned.
/// Byte input is decoded as strict UTF-8, so malformed bytes surface as an [IOException]
/// instead of being replaced.
public final class LineSource implements Closeable {

    private final BufferedReader reader;
    private long linesRead = 0;

    private LineSource(BufferedReader reader) {
        this.reader = reader;
    }

    /// @param in a UTF-8 byte stream, closed together with this source
    /// @return a line source over the stream
    public static LineSource of(InputStream in) {
        InputStreamReader decoder = new InputStreamReader(in, StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT));
        return new LineSource(new BufferedReader(decoder));
    }

    /// @param reader a character stream, closed together with this source
    /// @return a line source over the reader
    public static LineSource of(Reader reader) {
        return new LineSource(reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader));
    }

    /// @param text in-memory content
    /// @return a line source over the text
    public static LineSource ofText(String text) {
        return of(new StringReader(text));
    }

    /// Read the next line, blocking until it is available.
    ///
    /// @return the line without its terminator, or null at end of input
    /// @throws IOException if the underlying stream fails
    public String nextLine() throws IOException {
        String line = reader.readLine();
        if (line != null) {
            linesRead++;
        }
        return line;
    }

    /// @return the number of lines returned so far
    public long getLinesRead() {
        return linesRead;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
