package dev.execgraph.format;

import dev.execgraph.error.SyntaxException;
import dev.execgraph.error.ValidationException;
import dev.execgraph.model.ConversionOptions;
import dev.execgraph.model.Structure;
import org.junit.jupiter.api.Test;

import static dev.execgraph.model.Structure.leaf;
import static dev.execgraph.model.Structure.parallel;
import static dev.execgraph.model.Structure.sequence;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class CustomFormatParserTest {

    @Test
    void parsesNestedBlocks() {
        String text = """
            Sequence {
              q1,
              Parallel {
                Sequence {
                  q2,
                  q4,
                },
                q3,
              },
              q5,
            }
            """;

        Structure structure = CustomFormatParser.parse(text);

        assertThat(structure).isEqualTo(sequence(
            leaf("q1"),
            parallel(sequence(leaf("q2"), leaf("q4")), leaf("q3")),
            leaf("q5")));
    }

    @Test
    void whitespaceAndTrailingCommaAreOptional() {
        assertThat(CustomFormatParser.parse("Sequence{a,b}"))
            .isEqualTo(CustomFormatParser.parse("Sequence {\n  a,\n\n  b,\n}\n"));
    }

    @Test
    void keywordWithoutBraceIsATaskName() {
        assertThat(CustomFormatParser.parse("Parallel { Sequence, a }"))
            .isEqualTo(parallel(leaf("Sequence"), leaf("a")));
    }

    @Test
    void missingCommaIsSyntaxError() {
        assertThatThrownBy(() -> CustomFormatParser.parse("Sequence { task1 task2 }"))
            .isInstanceOf(SyntaxException.class)
            .hasMessage("line 1, column 18: expected ',' or '}' but found 'task2'");
    }

    @Test
    void missingIdentifierIsSyntaxError() {
        assertThatThrownBy(() -> CustomFormatParser.parse("Sequence { a, , b }"))
            .isInstanceOf(SyntaxException.class)
            .hasMessageContaining("expected a task identifier but found ','");
    }

    @Test
    void unmatchedOpeningBraceIsSyntaxError() {
        assertThatThrownBy(() -> CustomFormatParser.parse("Sequence {\n  a,\n  b,\n"))
            .isInstanceOf(SyntaxException.class)
            .hasMessageContaining("unmatched '{'");
    }

    @Test
    void extraClosingBraceIsSyntaxError() {
        assertThatThrownBy(() -> CustomFormatParser.parse("Sequence { a }}"))
            .isInstanceOf(SyntaxException.class)
            .hasMessageContaining("after the closing '}'");
    }

    @Test
    void documentMustStartWithBlock() {
        var error = (SyntaxException) catchThrowable(
            () -> CustomFormatParser.parse("\n  task1"));

        assertThat(error).hasMessageContaining("expected 'Sequence' or 'Parallel'");
        assertThat(error.line()).isEqualTo(2);
        assertThat(error.column()).isEqualTo(3);
    }

    @Test
    void emptyBlockIsValidationError() {
        assertThatThrownBy(() -> CustomFormatParser.parse("Parallel {}"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Empty Parallel block");
        assertThatThrownBy(() -> CustomFormatParser.parse("Sequence { a, Sequence { }, }"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Empty Sequence block");
    }

    @Test
    void duplicateTaskAnywhereInTreeIsValidationError() {
        assertThatThrownBy(() -> CustomFormatParser.parse("Sequence { a, Parallel { b, a, }, }"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Duplicate task identifier 'a'");
    }

    @Test
    void rejectsIdentifierWithDot() {
        assertThatThrownBy(() -> CustomFormatParser.parse("Sequence { a.b }"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Invalid task identifier 'a.b'");
    }

    @Test
    void rejectsNestingBeyondLimit() {
        var options = ConversionOptions.defaults().withMaxNestingDepth(2);

        assertThat(CustomFormatParser.parse("Sequence { Parallel { a, b } }", options))
            .isEqualTo(sequence(parallel(leaf("a"), leaf("b"))));
        assertThatThrownBy(() -> CustomFormatParser.parse("Sequence { Parallel { Sequence { a } } }", options))
            .isInstanceOf(SyntaxException.class)
            .hasMessageContaining("nested deeper than 2 levels");
    }

    @Test
    void deeplyNestedInputFailsCleanly() {
        String text = "Sequence { ".repeat(5_000) + "a" + " }".repeat(5_000);

        assertThatThrownBy(() -> CustomFormatParser.parse(text))
            .isInstanceOf(SyntaxException.class)
            .hasMessageContaining("nested deeper than 64 levels");
    }
}
