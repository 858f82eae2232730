package uk.co.farowl.cfront.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Test the translation-time values and the constant arithmetic on them.
 */
@DisplayName("Translation-time values")
class ValueTest {

    @Nested
    @DisplayName("format as C printf would")
    class Formatting {

        @Test
        void intAsDecimal() {
            assertEquals("-42", Value.of(-42).toString());
        }

        @Test
        void floatWithSixPlaces() {
            assertEquals("1.500000", Value.of(1.5f).toString());
            assertEquals("0.000000", Value.of(0.0f).toString());
        }

        @Test
        void charAsCharacter() {
            assertEquals("q", Value.of('q').toString());
        }
    }

    @Nested
    @DisplayName("convert implicitly")
    class Conversion {

        @Test
        @DisplayName("float to int truncates")
        void floatToInt() {
            assertEquals(Value.of(3), Value.of(3.75f).convertTo(DataType.INT));
            assertEquals(Value.of(-3), Value.of(-3.75f).convertTo(DataType.INT));
        }

        @Test
        @DisplayName("int to char takes the code point")
        void intToChar() {
            assertEquals(Value.of('A'), Value.of(65).convertTo(DataType.CHAR));
        }

        @Test
        @DisplayName("char to float takes the code point")
        void charToFloat() {
            assertEquals(Value.of(66.0f), Value.of('B').convertTo(DataType.FLOAT));
        }

        @Test
        @DisplayName("to the same type is the identity")
        void sameType() {
            Value v = Value.of(7);
            assertSame(v, v.convertTo(DataType.INT));
        }

        @Test
        @DisplayName("to void is not possible")
        void toVoid() {
            assertThrows(IllegalArgumentException.class,
                    () -> Value.of(1).convertTo(DataType.VOID));
        }
    }

    @Nested
    @DisplayName("identify narrowing conversions")
    class Narrowing {

        @Test
        void hazardous() {
            assertTrue(DataType.FLOAT.isNarrowingTo(DataType.INT));
            assertTrue(DataType.CHAR.isNarrowingTo(DataType.FLOAT));
            assertTrue(DataType.FLOAT.isNarrowingTo(DataType.CHAR));
        }

        @Test
        void harmless() {
            assertFalse(DataType.INT.isNarrowingTo(DataType.FLOAT));
            assertFalse(DataType.INT.isNarrowingTo(DataType.INT));
            assertFalse(DataType.CHAR.isNarrowingTo(DataType.INT));
            assertFalse(DataType.INT.isNarrowingTo(DataType.CHAR));
        }
    }

    @Nested
    @DisplayName("evaluate constant expressions")
    class Arithmetic {

        @Test
        @DisplayName("int division truncates")
        void intDivision() {
            assertEquals(Value.of(3), Operators.binary("/", Value.of(7), Value.of(2)));
            assertEquals(Value.of(1), Operators.binary("%", Value.of(7), Value.of(2)));
        }

        @Test
        @DisplayName("a float operand makes float arithmetic")
        void floatPromotion() {
            assertEquals(Value.of(3.5f), Operators.binary("/", Value.of(7), Value.of(2.0f)));
            assertEquals(DataType.FLOAT,
                    Operators.binaryType("*", DataType.INT, DataType.FLOAT));
        }

        @Test
        @DisplayName("char operands promote to int")
        void charPromotion() {
            assertEquals(Value.of(131), Operators.binary("+", Value.of('A'), Value.of('B')));
            assertEquals(DataType.INT, Operators.binaryType("+", DataType.CHAR, DataType.CHAR));
            assertEquals(DataType.INT, Operators.unaryType("-", DataType.CHAR));
        }

        @Test
        @DisplayName("comparisons give 0 or 1")
        void comparisons() {
            assertEquals(Value.of(1), Operators.binary("<", Value.of(1), Value.of(2.5f)));
            assertEquals(Value.of(0), Operators.binary("==", Value.of('a'), Value.of(98)));
            assertEquals(DataType.INT,
                    Operators.binaryType(">=", DataType.FLOAT, DataType.FLOAT));
        }

        @Test
        @DisplayName("unary operators")
        void unary() {
            assertEquals(Value.of(-2.5f), Operators.unary("-", Value.of(2.5f)));
            assertEquals(Value.of(1), Operators.unary("!", Value.of(0)));
            assertEquals(Value.of(-1), Operators.unary("~", Value.of(0)));
            assertEquals(Value.of('b'), Operators.unary("++", Value.of('a')));
        }

        @Test
        @DisplayName("an unknown operand gives an unknown result")
        void unknown() {
            assertNull(Operators.binary("+", null, Value.of(1)));
            assertNull(Operators.unary("-", null));
        }
    }
}
