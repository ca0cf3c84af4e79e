package settingsd.shell;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import settingsd.ConfigParseException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShellConfigDocumentTest {

    private static final String LOCALE_ENV = "src/test/resources/settingsd/shell/locale.env";
    private static final String MACHINE_INFO = "src/test/resources/settingsd/shell/machine-info";

    @TempDir
    Path tmp;

    @Test
    void parse_serializeReproducesInput() throws Exception {
        for (String file : List.of(LOCALE_ENV, MACHINE_INFO)) {
            var text = Files.readString(Paths.get(file));
            assertEquals(text, ShellConfigDocument.parse(Paths.get(file), text).serialize());
        }
    }

    @Test
    void parse_isIdempotent() throws Exception {
        var text = Files.readString(Paths.get(LOCALE_ENV));
        var first = ShellConfigDocument.parse(null, text);
        var second = ShellConfigDocument.parse(null, first.serialize());
        assertEquals(first.getTokens(), second.getTokens());
    }

    @Test
    void get_returnsUnquotedValues() throws Exception {
        var doc = ShellConfigDocument.parse(Paths.get(LOCALE_ENV));
        assertEquals(Optional.of("en_US.UTF-8"), doc.get("LANG"));
        assertEquals(Optional.of("C"), doc.get("LC_COLLATE"));
        assertEquals(Optional.of("de_DE.UTF-8"), doc.get("LC_TIME"));
        assertEquals(Optional.of("en_GB"), doc.get("LC_MESSAGES"));
        assertEquals(Optional.empty(), doc.get("LC_PAPER"));
    }

    @Test
    void get_lastAssignmentWins() {
        var doc = ShellConfigDocument.parse(null, "A=1\nA=2\n");
        assertEquals(Optional.of("2"), doc.get("A"));
    }

    @Test
    void get_emptyValue() {
        var doc = ShellConfigDocument.parse(null, "FOO=\nBAR=1\n");
        assertEquals(Optional.of(""), doc.get("FOO"));
        assertEquals("FOO=\nBAR=1\n", doc.serialize());
    }

    @Test
    void set_rewritesExistingAssignmentOnly() {
        var doc = ShellConfigDocument.parse(null, "FOO=bar\nBAZ=\"a b\"\n");
        assertTrue(doc.set("FOO", "baz2", false));
        assertEquals(Optional.of("baz2"), doc.get("FOO"));
        assertEquals("FOO='baz2'\nBAZ=\"a b\"\n", doc.serialize());
    }

    @Test
    void set_withoutAddLeavesMissingVariable() {
        var doc = ShellConfigDocument.parse(null, "FOO=bar\n");
        assertFalse(doc.set("NEW", "x", false));
        assertEquals("FOO=bar\n", doc.serialize());
    }

    @Test
    void set_keepsExportKeyword() throws Exception {
        var doc = ShellConfigDocument.parse(Paths.get(LOCALE_ENV));
        doc.set("LANG", "de_DE.UTF-8", false);
        assertTrue(doc.serialize().contains("\nexport LANG='de_DE.UTF-8'\n"));
    }

    @Test
    void set_appendsWithSeparators() {
        var doc = ShellConfigDocument.parse(null, "A=1");
        doc.set("B", "2", true);
        assertEquals("A=1\nB='2'\n", doc.serialize());

        doc = ShellConfigDocument.parse(null, "# only a comment");
        doc.set("B", "2", true);
        assertEquals("# only a comment\nB='2'\n", doc.serialize());

        doc = ShellConfigDocument.parse(null, "# header\n");
        doc.set("B", "2", true);
        assertEquals("# header\nB='2'\n", doc.serialize());
    }

    @Test
    void set_valuesSurviveReparse() {
        for (String value : List.of("it's", "a b", "${FOO}", "tab\there", "")) {
            var doc = ShellConfigDocument.parse(null, "X=old\n");
            doc.set("X", value, true);
            assertEquals(Optional.of(value), doc.get("X"));
            assertEquals(Optional.of(value), ShellConfigDocument.parse(null, doc.serialize()).get("X"));
        }
    }

    @Test
    void setEither_prefersExistingName() {
        var doc = ShellConfigDocument.parse(null, "HOSTNAME=old\n");
        doc.setEither("hostname", "HOSTNAME", "new");
        assertEquals("HOSTNAME='new'\n", doc.serialize());

        doc = ShellConfigDocument.parse(null, "");
        doc.setEither("hostname", "HOSTNAME", "new");
        assertEquals("hostname='new'\n", doc.serialize());
    }

    @Test
    void save_writesNewFile() throws Exception {
        var file = tmp.resolve("hostname");
        var doc = ShellConfigDocument.parse(file);
        assertTrue(doc.isEmpty());
        doc.set("HOSTNAME", "box1", true);
        doc.save();
        assertEquals("HOSTNAME='box1'\n", Files.readString(file));
    }

    @Test
    void sourceVar_absentFileIsEmpty() throws Exception {
        assertEquals(Optional.empty(), ShellConfigDocument.sourceVar(tmp.resolve("missing"), "FOO"));
        assertEquals(Optional.of("computer-laptop"), ShellConfigDocument.sourceVar(Paths.get(MACHINE_INFO), "ICON_NAME"));
    }

    @Test
    void clear_removesFollowingSeparator() {
        var doc = ShellConfigDocument.parse(null, "A=1\nB=2\nC=3\n");
        doc.clear("B");
        assertEquals("A=1\nC=3\n", doc.serialize());
        assertEquals(Optional.empty(), doc.get("B"));
    }

    @Test
    void clear_removesPrecedingSeparatorAtEnd() {
        var doc = ShellConfigDocument.parse(null, "A=1\nB=2");
        doc.clear("B");
        assertEquals("A=1", doc.serialize());
    }

    @Test
    void clear_keepsNeighbouringComment() {
        var doc = ShellConfigDocument.parse(null, "A=1 # note\nB=2\n");
        doc.clear("A");
        assertEquals(" # note\nB=2\n", doc.serialize());
    }

    @Test
    void clear_removesEveryAssignment() {
        var doc = ShellConfigDocument.parse(null, "A=1\nB=2\nA=3\n");
        doc.clear("A");
        assertEquals("B=2\n", doc.serialize());
    }

    @Test
    void clear_isolatedAssignmentLeavesEmptyDocument() {
        var doc = ShellConfigDocument.parse(null, "A=1");
        doc.clear("A");
        assertTrue(doc.isEmpty());
        assertEquals("", doc.serialize());

        doc = ShellConfigDocument.parse(null, "A=1\n");
        doc.clear("A");
        assertTrue(doc.isEmpty());
    }

    @Test
    void parse_rejectsCommandSubstitution() {
        var path = Paths.get("/etc/conf.d/evil");
        var ex = assertThrows(ConfigParseException.class, () -> ShellConfigDocument.parse(path, "FOO=$(rm -rf /)"));
        assertEquals(QuoteCodec.COMMAND_SUBSTITUTION, ex.getDetail());
        assertEquals(4, ex.getOffset());
        assertEquals(path, ex.getPath());
        assertTrue(ex.getMessage().contains("/etc/conf.d/evil"));

        ex = assertThrows(ConfigParseException.class, () -> ShellConfigDocument.parse(null, "FOO=`id`\n"));
        assertEquals(QuoteCodec.COMMAND_SUBSTITUTION, ex.getDetail());

        ex = assertThrows(ConfigParseException.class, () -> ShellConfigDocument.parse(null, "FOO=\"a$(id)\"\n"));
        assertEquals(QuoteCodec.COMMAND_SUBSTITUTION, ex.getDetail());
    }

    @Test
    void parse_rejectsTwoAssignmentsInOneStatement() {
        var ex = assertThrows(ConfigParseException.class, () -> ShellConfigDocument.parse(null, "FOO=bar BAZ=1\n"));
        assertEquals(8, ex.getOffset());
    }

    @Test
    void parse_rejectsCommands() {
        var ex = assertThrows(ConfigParseException.class, () -> ShellConfigDocument.parse(null, "echo hi\n"));
        assertEquals(0, ex.getOffset());
    }

    @Test
    void parse_rejectsUnterminatedQuote() {
        var ex = assertThrows(ConfigParseException.class, () -> ShellConfigDocument.parse(null, "FOO='abc\n"));
        assertEquals(QuoteCodec.UNTERMINATED_SINGLE, ex.getDetail());
        assertEquals(4, ex.getOffset());
    }

    @Test
    void parse_rejectsInvalidUtf8WithoutTouchingFile() throws Exception {
        var file = tmp.resolve("02locale");
        byte[] data = {'#', ' ', 'c', 'a', 'f', (byte) 0xE9, '\n', 'A', '=', '1', '\n'};
        Files.write(file, data);
        var ex = assertThrows(ConfigParseException.class, () -> ShellConfigDocument.parse(file));
        assertEquals(5, ex.getOffset());
        assertEquals(file, ex.getPath());
        assertTrue(ex.getMessage().contains("at byte 5"));
        assertArrayEquals(data, Files.readAllBytes(file));
    }

    @Test
    void save_keepsNonAsciiCommentOnUnrelatedEdit() throws Exception {
        var file = tmp.resolve("02locale");
        Files.writeString(file, "# café\nA=1\n");
        var doc = ShellConfigDocument.parse(file);
        doc.set("A", "2", false);
        doc.save();
        assertEquals("# café\nA='2'\n", Files.readString(file));
    }

    @Test
    void parse_reportsByteOffset() {
        var ex = assertThrows(ConfigParseException.class, () -> ShellConfigDocument.parse(null, "# é\nFOO=$x"));
        assertEquals(9, ex.getOffset());
    }
}
