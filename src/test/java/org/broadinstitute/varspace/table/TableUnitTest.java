package org.broadinstitute.varspace.table;

import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.testutils.BaseTest;
import org.broadinstitute.varspace.testutils.TableTestUtils;
import org.broadinstitute.varspace.utils.tsv.TableFormat;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

public final class TableUnitTest extends BaseTest {

    @Test
    public void testNullCellsBecomeEmpty() {
        final Table table = new Table(Arrays.asList("a", "b"), Collections.singletonList(Arrays.asList("1", null)));
        Assert.assertEquals(table.cell(0, 1), "");
    }

    @Test(expectedExceptions = UserException.ValidationError.class)
    public void testRowLengthMismatch() {
        TableTestUtils.table(Arrays.asList("a", "b"), new String[]{"1"});
    }

    @Test(expectedExceptions = UserException.ValidationError.class)
    public void testRepeatedColumn() {
        TableTestUtils.table(Arrays.asList("a", "a"), new String[]{"1", "2"});
    }

    @Test
    public void testRequireColumn() {
        final Table table = TableTestUtils.singleColumn("x", "1");
        Assert.assertEquals(table.requireColumn("x"), 0);
        Assert.assertThrows(UserException.ValidationError.class, () -> table.requireColumn("y"));
    }

    @Test
    public void testRowsAreImmutable() {
        final Table table = TableTestUtils.singleColumn("x", "1");
        Assert.assertThrows(UnsupportedOperationException.class, () -> table.rows().add(Arrays.asList("2")));
        Assert.assertThrows(UnsupportedOperationException.class, () -> table.row(0).set(0, "2"));
    }

    @Test
    public void testWithRowsReplaced() {
        final Table table = TableTestUtils.singleColumn("x", "a", "b", "c", "d");
        final Table replaced = table.withRowsReplaced(Arrays.asList(3, 1), Arrays.asList("renamed"),
                Arrays.asList(Arrays.asList("D"), Arrays.asList("B")));
        Assert.assertEquals(replaced.header(), Arrays.asList("renamed"));
        Assert.assertEquals(TableTestUtils.column(replaced, "renamed"), Arrays.asList("a", "B", "c", "D"));
        Assert.assertEquals(TableTestUtils.column(table, "x"), Arrays.asList("a", "b", "c", "d"));
    }

    @Test(expectedExceptions = UserException.ValidationError.class)
    public void testWithRowsReplacedWrongHeaderSize() {
        TableTestUtils.singleColumn("x", "a").withRowsReplaced(Collections.singletonList(0), Arrays.asList("x", "y"),
                Collections.singletonList(Arrays.asList("a", "b")));
    }

    @Test
    public void testFileRoundTrip() throws IOException {
        final Path dir = createTempDir("tableFiles");
        final Table table = TableTestUtils.table(Arrays.asList("gen_pos", "note"),
                new String[]{"6-1-A-G", "has, comma"}, new String[]{"", "\"quoted\""});
        TableTestUtils.writeTable(dir, "t.csv", table);
        final Table read = TableTestUtils.readTable(dir, "t.csv");
        Assert.assertEquals(read.header(), table.header());
        Assert.assertEquals(read.rows(), table.rows());
    }

    @Test
    public void testReadFromReader() throws IOException {
        final Table table = TableFiles.read("inline", new StringReader("a\tb\n1\t2\n"), TableFormat.TSV);
        Assert.assertEquals(table.rows(), Collections.singletonList(Arrays.asList("1", "2")));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testReadMissingFile() {
        TableFiles.read(createTempDir("missing").resolve("none.csv"), TableFormat.CSV);
    }

    @Test(expectedExceptions = UserException.ValidationError.class)
    public void testReadMalformedFile() throws IOException {
        final Path file = createTempDir("malformed").resolve("bad.csv");
        Files.write(file, "a,b\n1,2,3\n".getBytes(StandardCharsets.UTF_8));
        TableFiles.read(file, TableFormat.CSV);
    }
}
