package org.propcheck.check;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.propcheck.expression.Constant;
import org.propcheck.expression.Expression;
import org.propcheck.input.PropositionFileReader;
import org.propcheck.input.PropositionSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValidityCheckerTest {

    private ValidityChecker checker;

    @BeforeEach
    void setUp() {
        checker = new ValidityChecker();
    }

    private CheckResult check(String... lines) {
        PropositionSet propositions = new PropositionFileReader().read("test", Arrays.asList(lines));
        return checker.check(propositions.propositions(), propositions.registry().names());
    }

    @Nested
    @DisplayName("Scenari di riferimento")
    class ScenarioTests {

        @Test
        @DisplayName("[P] |- ([P] => [P]) è verificato")
        void reflexiveImplication() {
            CheckResult result = check("[P]", "([P] => [P])");

            assertAll(
                    () -> assertEquals(CheckResult.Outcome.VERIFIED, result.getOutcome()),
                    () -> assertEquals(1, result.getStatistics().getAxiomModels()),
                    () -> assertEquals(2, result.getStatistics().getAssignmentsEvaluated()),
                    () -> assertTrue(result.getCounterExample().isEmpty())
            );
        }

        @Test
        @DisplayName("[P], [Q] |- ([P] and [Q]) è verificato")
        void conjunctionIntroduction() {
            CheckResult result = check("[P]", "[Q]", "([P] and [Q])");

            assertAll(
                    () -> assertTrue(result.isVerified()),
                    () -> assertEquals(1, result.getStatistics().getAxiomModels()),
                    () -> assertEquals(4, result.getStatistics().getAssignmentsEvaluated())
            );
        }

        @Test
        @DisplayName("[P], ![P] sono inconsistenti")
        void contradictoryAxioms() {
            CheckResult result = check("[P]", "![P]", "[P]");

            assertAll(
                    () -> assertTrue(result.isInconsistent()),
                    () -> assertFalse(result.isCounterExample()),
                    () -> assertEquals(0, result.getStatistics().getAxiomModels()),
                    () -> assertThrows(IllegalStateException.class, result::getCounterExampleMask)
            );
        }

        @Test
        @DisplayName("T |- ([P] <=> [Q]) ha controesempio P=vero, Q=falso")
        void biconditionalCounterExample() {
            CheckResult result = check("T", "([P] <=> [Q])");

            assertAll(
                    () -> assertTrue(result.isCounterExample()),
                    () -> assertEquals(1L, result.getCounterExampleMask()),
                    () -> assertEquals(List.of(new VariableAssignment("P", true), new VariableAssignment("Q", false)),
                            result.getCounterExample()),
                    () -> assertEquals(2, result.getStatistics().getAssignmentsEvaluated())
            );
        }
    }

    @Nested
    @DisplayName("Ordine di enumerazione")
    class EnumerationOrderTests {

        @Test
        @DisplayName("Viene riportato il controesempio numericamente più piccolo")
        void smallestCounterExample() {
            // Falsificano la congettura 0b001, 0b010, 0b011 sotto l'assioma: la prima è 1
            CheckResult result = check("([A] or [B])", "[C]");

            assertAll(
                    () -> assertEquals(1L, result.getCounterExampleMask()),
                    () -> assertEquals(List.of(new VariableAssignment("A", true),
                            new VariableAssignment("B", false),
                            new VariableAssignment("C", false)), result.getCounterExample())
            );
        }

        @Test
        @DisplayName("L'assegnamento nullo è il primo esaminato")
        void zeroMaskFirst() {
            CheckResult result = check("T", "([A] and [B])");

            assertAll(
                    () -> assertEquals(0L, result.getCounterExampleMask()),
                    () -> assertEquals(1, result.getStatistics().getAssignmentsEvaluated())
            );
        }

        @Test
        @DisplayName("Assegnamenti che violano gli assiomi non sono controesempi")
        void axiomsFilterAssignments() {
            // Solo A=1,B=1 soddisfa gli assiomi (mask 3) e lì la congettura è falsa
            CheckResult result = check("[A]", "[B]", "([A] xor [B])");

            assertAll(
                    () -> assertEquals(3L, result.getCounterExampleMask()),
                    () -> assertEquals(4, result.getStatistics().getAssignmentsEvaluated()),
                    () -> assertEquals(1, result.getStatistics().getAxiomModels())
            );
        }
    }

    @Nested
    @DisplayName("Casi limite")
    class EdgeCaseTests {

        @Test
        @DisplayName("Senza variabili si valuta un solo assegnamento")
        void noVariables() {
            CheckResult verified = check("T");
            CheckResult falsified = check("F");
            CheckResult inconsistent = check("F", "T");

            assertAll(
                    () -> assertTrue(verified.isVerified()),
                    () -> assertEquals(1, verified.getStatistics().getAssignmentsEvaluated()),
                    () -> assertTrue(falsified.isCounterExample()),
                    () -> assertEquals(0L, falsified.getCounterExampleMask()),
                    () -> assertTrue(falsified.getCounterExample().isEmpty()),
                    () -> assertTrue(inconsistent.isInconsistent())
            );
        }

        @Test
        @DisplayName("Una sola congettura: tautologia e non tautologia")
        void conjectureOnly() {
            assertAll(
                    () -> assertTrue(check("([P] or ![P])").isVerified()),
                    () -> assertEquals(List.of(new VariableAssignment("P", false)), check("[P]").getCounterExample())
            );
        }

        @Test
        @DisplayName("Variabili che compaiono solo negli assiomi sono enumerate")
        void variablesOnlyInAxioms() {
            CheckResult result = check("([P] => [Q])", "([Q] => [R])", "([P] => [R])");

            assertAll(
                    () -> assertTrue(result.isVerified()),
                    () -> assertEquals(8, result.getStatistics().getAssignmentsEvaluated()),
                    () -> assertEquals(4, result.getStatistics().getAxiomModels())
            );
        }

        @Test
        @DisplayName("Input non validi")
        void invalidInput() {
            List<String> tooManyNames = new ArrayList<>();
            for (int i = 0; i < 33; i++) {
                tooManyNames.add("V" + i);
            }

            assertAll(
                    () -> assertThrows(IllegalArgumentException.class, () -> checker.check(List.of(), List.of())),
                    () -> assertThrows(IllegalArgumentException.class, () -> checker.check(null, List.of())),
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> checker.check(List.<Expression>of(Constant.TRUE), null)),
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> checker.check(List.<Expression>of(Constant.TRUE), tooManyNames))
            );
        }
    }

    @Test
    @DisplayName("Traduzione di un assegnamento in valori per variabile")
    void describeAssignment() {
        assertEquals(List.of(new VariableAssignment("X", false),
                        new VariableAssignment("Y", true),
                        new VariableAssignment("Z", true)),
                ValidityChecker.describeAssignment(0b110L, List.of("X", "Y", "Z")));
    }
}
