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

import io.lineprof.stats.accumulate.NumberAccumulator;
import io.lineprof.stats.cardinality.ExactCappedCardinality;
import io.lineprof.stats.profile.ColumnProfile;
import io.lineprof.stats.profile.NumberProfile;
import io.lineprof.stats.profile.StringProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.CharacterCodingException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GroupRouter")
class GroupRouterTest {

    private final GroupRouter router = new GroupRouter(',');

    @Nested
    @DisplayName("grouped routing")
    class Grouped {

        @Test
        @DisplayName("should split groups and absorb malformed lines")
        void shouldSplitGroupsAndAbsorbMalformedLines() throws IOException {
            GroupTable<NumberProfile> table = router.routeGrouped(
                LineSource.ofText("g1,10\ng1,20\ng2,30\nmalformed_line\n"), () -> new NumberProfile(false));

            NumberAccumulator g1 = table.get("g1").orElseThrow().numbers();
            assertThat(g1.getCount()).isEqualTo(2);
            assertThat(g1.getMean()).isEqualTo(15.0);
            assertThat(g1.getMin()).hasValue(10.0);
            assertThat(g1.getMax()).hasValue(20.0);

            NumberAccumulator g2 = table.get("g2").orElseThrow().numbers();
            assertThat(g2.getCount()).isEqualTo(1);
            assertThat(g2.getMean()).isEqualTo(30.0);

            NumberAccumulator invalid = table.get(GroupKey.INVALID_NAME).orElseThrow().numbers();
            assertThat(invalid.getErrorCount()).isEqualTo(1);
            assertThat(invalid.getCount()).isZero();
            assertThat(table.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("should anchor the split on the last delimiter")
        void shouldAnchorOnLastDelimiter() throws IOException {
            GroupTable<NumberProfile> table = router.routeGrouped(
                LineSource.ofText("a,b,1\na,b,3\na,2\n"), () -> new NumberProfile(false));

            assertThat(table.get("a,b").orElseThrow().numbers().getMean()).isEqualTo(2.0);
            assertThat(table.get("a").orElseThrow().numbers().getCount()).isEqualTo(1);
            assertThat(table.snapshot().get(0).key().components()).containsExactly("a", "b");
        }

        @Test
        @DisplayName("should count every malformed line")
        void shouldCountEveryMalformedLine() throws IOException {
            GroupTable<NumberProfile> table = router.routeGrouped(
                LineSource.ofText("x\ny\nz"), () -> new NumberProfile(false));

            assertThat(table.size()).isEqualTo(1);
            assertThat(table.get(GroupKey.INVALID_NAME).orElseThrow().numbers().getErrorCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should classify empty, zero and unparseable values")
        void shouldClassifyValues() throws IOException {
            GroupTable<NumberProfile> table = router.routeGrouped(
                LineSource.ofText("k,\nk,0\nk,abc\nk,5\n"), () -> new NumberProfile(true));

            NumberAccumulator k = table.get("k").orElseThrow().numbers();
            assertThat(k.getCount()).isEqualTo(1);
            assertThat(k.getEmptyCount()).isEqualTo(2);
            assertThat(k.getErrorCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should allow an empty group key")
        void shouldAllowEmptyKey() throws IOException {
            GroupTable<NumberProfile> table = router.routeGrouped(
                LineSource.ofText(",4\n"), () -> new NumberProfile(false));

            assertThat(table.get("").orElseThrow().numbers().getCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should profile string values with their lengths")
        void shouldProfileStrings() throws IOException {
            GroupTable<StringProfile> table = router.routeGrouped(
                LineSource.ofText("k,apple\nk,fig\nk,\nk,apple\nbroken\n"),
                () -> new StringProfile(new ExactCappedCardinality(100)));

            StringProfile k = table.get("k").orElseThrow();
            assertThat(k.values().getCount()).isEqualTo(3);
            assertThat(k.values().getEmptyCount()).isEqualTo(1);
            assertThat(k.values().getCardinality()).isEqualTo(2);
            assertThat(k.values().getMin()).contains("apple");
            assertThat(k.values().getMax()).contains("fig");
            assertThat(k.lengths().getMin()).hasValue(3.0);
            assertThat(k.lengths().getMax()).hasValue(5.0);
            assertThat(k.lengths().getEmptyCount()).isEqualTo(1);

            assertThat(table.get(GroupKey.INVALID_NAME).orElseThrow().values().getErrorCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should order the snapshot by descending raw key")
        void shouldOrderSnapshotDescending() throws IOException {
            GroupTable<NumberProfile> table = router.routeGrouped(
                LineSource.ofText("b,1\nnope\na,1\nc,1\n"), () -> new NumberProfile(false));

            assertThat(table.snapshot()).extracting(e -> e.key().raw())
                .containsExactly("c", "b", "a", "<INVALID>");
        }

        @Test
        @DisplayName("should produce an empty table for empty input")
        void shouldHandleEmptyInput() throws IOException {
            GroupTable<NumberProfile> table = router.routeGrouped(
                LineSource.ofText(""), () -> new NumberProfile(false));

            assertThat(table.isEmpty()).isTrue();
            assertThat(table.snapshot()).isEmpty();
        }
    }

    @Nested
    @DisplayName("column routing")
    class Columns {

        @Test
        @DisplayName("should profile each column three ways")
        void shouldProfileEachColumn() throws IOException {
            ColumnTable table = router.routeColumns(LineSource.ofText("a,b\n1,2\n"),
                () -> new ColumnProfile(new ExactCappedCardinality(10), false));

            assertThat(table.columns()).extracting(ColumnTable.Column::header).containsExactly("a", "b");
            ColumnProfile a = table.columns().get(0).profile();
            assertThat(a.strings().getCount()).isEqualTo(1);
            assertThat(a.strings().getMin()).contains("1");
            assertThat(a.strings().getMax()).contains("1");
            assertThat(a.numbers().getCount()).isEqualTo(1);
            assertThat(a.numbers().getMin()).hasValue(1.0);
            assertThat(a.numbers().getMax()).hasValue(1.0);
            assertThat(a.lengths().getMin()).hasValue(1.0);
            assertThat(a.lengths().getMax()).hasValue(1.0);

            ColumnProfile b = table.columns().get(1).profile();
            assertThat(b.numbers().getMin()).hasValue(2.0);
        }

        @Test
        @DisplayName("should truncate long rows and skip missing trailing fields")
        void shouldZipTruncating() throws IOException {
            ColumnTable table = router.routeColumns(LineSource.ofText("a,b,c\n1\n1,2,3,4,5\n"),
                () -> new ColumnProfile(new ExactCappedCardinality(10), false));

            List<ColumnTable.Column> columns = table.columns();
            assertThat(columns).hasSize(3);
            assertThat(columns.get(0).profile().strings().getCount()).isEqualTo(2);
            assertThat(columns.get(1).profile().strings().getCount()).isEqualTo(1);
            assertThat(columns.get(2).profile().strings().getCount()).isEqualTo(1);
            assertThat(columns.get(2).profile().numbers().getMax()).hasValue(3.0);
        }

        @Test
        @DisplayName("should count empty and text fields")
        void shouldCountEmptyAndText() throws IOException {
            ColumnTable table = router.routeColumns(LineSource.ofText("name,score\nann,\n,x\n"),
                () -> new ColumnProfile(new ExactCappedCardinality(10), false));

            ColumnProfile name = table.columns().get(0).profile();
            assertThat(name.strings().getEmptyCount()).isEqualTo(1);
            assertThat(name.numbers().getErrorCount()).isEqualTo(1);
            assertThat(name.numbers().getEmptyCount()).isEqualTo(1);

            ColumnProfile score = table.columns().get(1).profile();
            assertThat(score.strings().getEmptyCount()).isEqualTo(1);
            assertThat(score.numbers().getErrorCount()).isEqualTo(1);
            assertThat(score.lengths().getCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep duplicate header names apart")
        void shouldKeepDuplicateHeaders() throws IOException {
            ColumnTable table = router.routeColumns(LineSource.ofText("x,x\n1,2\n"),
                () -> new ColumnProfile(new ExactCappedCardinality(10), false));

            assertThat(table.size()).isEqualTo(2);
            assertThat(table.columns().get(1).profile().numbers().getMax()).hasValue(2.0);
        }

        @Test
        @DisplayName("should accept a header-only stream")
        void shouldAcceptHeaderOnly() throws IOException {
            ColumnTable table = router.routeColumns(LineSource.ofText("a,b"),
                () -> new ColumnProfile(new ExactCappedCardinality(10), false));

            assertThat(table.size()).isEqualTo(2);
            assertThat(table.columns().get(0).profile().strings().getCount()).isZero();
        }

        @Test
        @DisplayName("should fail when there is no header")
        void shouldFailWithoutHeader() {
            assertThatThrownBy(() -> router.routeColumns(LineSource.ofText(""),
                () -> new ColumnProfile(new ExactCappedCardinality(10), false)))
                .isInstanceOf(MissingHeaderException.class)
                .hasMessageContaining("header");
        }
    }

    @Nested
    @DisplayName("series routing and input handling")
    class Series {

        @Test
        @DisplayName("should treat every line as one value")
        void shouldTreatLinesAsValues() throws IOException {
            NumberProfile profile = router.routeSeries(LineSource.ofText("1\n2\n\nx\n3,5"), new NumberProfile(false));

            NumberAccumulator numbers = profile.numbers();
            assertThat(numbers.getCount()).isEqualTo(2);
            assertThat(numbers.getEmptyCount()).isEqualTo(1);
            assertThat(numbers.getErrorCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should read a final line without terminator and CRLF endings")
        void shouldReadLineEndings() throws IOException {
            LineSource lines = LineSource.ofText("1\r\n2\r\n3");
            NumberProfile profile = router.routeSeries(lines, new NumberProfile(false));

            assertThat(profile.numbers().getCount()).isEqualTo(3);
            assertThat(lines.getLinesRead()).isEqualTo(3);
        }

        @Test
        @DisplayName("should surface malformed UTF-8 as an I/O failure")
        void shouldRejectMalformedUtf8() {
            InputStream in = new ByteArrayInputStream(new byte[]{'1', '\n', (byte) 0xC3, (byte) 0x28, '\n'});

            assertThatThrownBy(() -> router.routeSeries(LineSource.of(in), new NumberProfile(false)))
                .isInstanceOf(CharacterCodingException.class);
        }

        @Test
        @DisplayName("should propagate reader failures")
        void shouldPropagateReaderFailures() {
            Reader failing = new Reader() {
                @Override
                public int read(char[] cbuf, int off, int len) throws IOException {
                    throw new IOException("disk gone");
                }

                @Override
                public void close() {
                }
            };

            assertThatThrownBy(() -> router.routeGrouped(LineSource.of(failing), () -> new NumberProfile(false)))
                .isInstanceOf(IOException.class)
                .hasMessage("disk gone");
        }
    }
}
