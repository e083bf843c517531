package org.propcheck.input;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.propcheck.expression.BinaryExpression;
import org.propcheck.expression.BinaryOperator;
import org.propcheck.expression.Constant;
import org.propcheck.expression.Variable;
import org.propcheck.parser.TooManyVariablesException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PropositionFileReaderTest {

    private PropositionFileReader reader;

    @BeforeEach
    void setUp() {
        reader = new PropositionFileReader();
    }

    @Nested
    @DisplayName("Righe saltate")
    class SkippedLineTests {

        @Test
        @DisplayName("Commenti e righe vuote non producono proposizioni")
        void commentsAndBlankLinesSkipped() {
            PropositionSet set = reader.read("input", List.of(
                    "// assiomi",
                    "[P]",
                    "",
                    "   \t ",
                    "//([P] and",
                    "([P] or [Q])"));

            assertAll(
                    () -> assertEquals(2, set.propositions().size()),
                    () -> assertEquals(List.of(new Variable(0)), set.axioms()),
                    () -> assertEquals(new BinaryExpression(BinaryOperator.OR, new Variable(0), new Variable(1)),
                            set.conjecture()),
                    () -> assertEquals(List.of("P", "Q"), set.registry().names())
            );
        }

        @Test
        @DisplayName("Un commento vale solo in prima colonna")
        void indentedCommentIsSyntaxError() {
            PropositionSyntaxException error = assertThrows(PropositionSyntaxException.class,
                    () -> reader.read("input", List.of("T", "  // non un commento")));
            assertEquals(2, error.getLineNumber());
        }

        @Test
        @DisplayName("isSkipped riconosce commenti e spaziatura")
        void isSkipped() {
            assertAll(
                    () -> assertTrue(PropositionFileReader.isSkipped("")),
                    () -> assertTrue(PropositionFileReader.isSkipped(" \t\r")),
                    () -> assertTrue(PropositionFileReader.isSkipped("//")),
                    () -> assertTrue(PropositionFileReader.isSkipped("// [P]")),
                    () -> assertFalse(PropositionFileReader.isSkipped("/ [P]")),
                    () -> assertFalse(PropositionFileReader.isSkipped(" [P]"))
            );
        }
    }

    @Nested
    @DisplayName("Errori fatali")
    class ErrorTests {

        @Test
        @DisplayName("L'errore di sintassi riporta il numero di riga contando anche le righe saltate")
        void syntaxErrorLineNumber() {
            PropositionSyntaxException error = assertThrows(PropositionSyntaxException.class,
                    () -> reader.read("assiomi.txt", List.of("// intestazione", "", "[P]", "([P] nand [Q])", "[Q]")));

            assertAll(
                    () -> assertEquals(4, error.getLineNumber()),
                    () -> assertEquals("assiomi.txt", error.getSourceName()),
                    () -> assertEquals("([P] nand [Q])", error.getLine()),
                    () -> assertTrue(error.getMessage().contains("riga 4"))
            );
        }

        @Test
        @DisplayName("Input senza proposizioni")
        void emptyInput() {
            assertAll(
                    () -> assertThrows(EmptyInputException.class, () -> reader.read("vuoto", List.of())),
                    () -> assertThrows(EmptyInputException.class,
                            () -> reader.read("vuoto", List.of("// solo commenti", "  ")))
            );
        }

        @Test
        @DisplayName("33 variabili distinte nel file interrompono la lettura")
        void tooManyVariablesAcrossLines() {
            List<String> lines = new ArrayList<>();
            for (int i = 0; i < 33; i++) {
                lines.add("[V" + i + "]");
            }
            // La riga successiva è errata ma non viene mai raggiunta
            lines.add("(((");

            TooManyVariablesException error = assertThrows(TooManyVariablesException.class,
                    () -> reader.read("troppe", lines));
            assertEquals("V32", error.getVariableName());
        }
    }

    @Nested
    @DisplayName("Lettura da file")
    class FileTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("File UTF-8 con terminatori CRLF")
        void readsFileWithCrlf() throws IOException {
            Path file = tempDir.resolve("teorema.txt");
            Files.writeString(file, "// modus ponens\r\n[piove]\r\n([piove] => [città bagnata])\r\n[città bagnata]\r\n",
                    StandardCharsets.UTF_8);

            PropositionSet set = reader.read(file);

            assertAll(
                    () -> assertEquals(file.toString(), set.sourceName()),
                    () -> assertEquals(3, set.propositions().size()),
                    () -> assertEquals(List.of("piove", "città bagnata"), set.registry().names()),
                    () -> assertEquals(new Variable(1), set.conjecture())
            );
        }

        @Test
        @DisplayName("Byte non UTF-8 in un commento non bloccano la lettura")
        void readsLatin1Comment() throws IOException {
            Path file = tempDir.resolve("latin1.txt");
            Files.write(file, "// verità\n[P]\n([P] => [P])\n".getBytes(StandardCharsets.ISO_8859_1));

            PropositionSet set = reader.read(file);

            assertAll(
                    () -> assertEquals(2, set.propositions().size()),
                    () -> assertEquals(List.of("P"), set.registry().names())
            );
        }

        @Test
        @DisplayName("Un \\r isolato non separa le righe")
        void loneCarriageReturnKeepsLineNumbers() throws IOException {
            Path file = tempDir.resolve("cr.txt");
            Files.write(file, "T\r\r\n(((\n".getBytes(StandardCharsets.UTF_8));

            PropositionSyntaxException error = assertThrows(PropositionSyntaxException.class,
                    () -> reader.read(file));

            assertEquals(2, error.getLineNumber());
        }

        @Test
        @DisplayName("File inesistente")
        void missingFile() {
            assertThrows(NoSuchFileException.class, () -> reader.read(tempDir.resolve("assente.txt")));
        }
    }

    @Test
    @DisplayName("PropositionSet rifiuta insiemi vuoti ed è immutabile")
    void propositionSetInvariants() {
        PropositionSet set = reader.read("input", List.of("T"));

        assertAll(
                () -> assertTrue(set.axioms().isEmpty()),
                () -> assertEquals(Constant.TRUE, set.conjecture()),
                () -> assertThrows(UnsupportedOperationException.class, () -> set.propositions().add(Constant.FALSE)),
                () -> assertThrows(IllegalArgumentException.class,
                        () -> new PropositionSet("x", List.of(), set.registry()))
        );
    }
}
