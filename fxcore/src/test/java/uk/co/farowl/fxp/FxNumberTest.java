// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.fxp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests of {@link FxNumber} construction, conversion, arithmetic and
 * comparison. The elementary functions and text forms have their own
 * tests.
 */
@DisplayName("FxNumber")
class FxNumberTest extends UnitTestSupport {

    @Nested
    @DisplayName("is constructed")
    class ConstructionTest {

        @ParameterizedTest(name = "fromInt({0})")
        @ValueSource(longs = {0, 1, -1, 42, 127, -128})
        void fromIntRoundTrip(long v) {
            FxNumber x = Q8_8.fromInt(v);
            assertEquals(v, x.longValue());
            assertEquals((int)v, x.intValue());
            assertSame(Q8_8, x.getFormat());
        }

        @Test
        void fromIntOverflow() {
            assertThrows(OverflowError.class, () -> Q8_8.fromInt(128));
            assertThrows(OverflowError.class, () -> Q8_8.fromInt(-129));
        }

        @Test
        void fromRational() {
            assertScaled(85, Q8_8.fromRational(1, 3));
            assertScaled(171, Q8_8.fromRational(2, 3));
            assertScaled(-85, Q8_8.fromRational(-1, 3));
            assertScaled(-85, Q8_8.fromRational(1, -3));
            assertScaled(85, FxNumber.fromRational(Q8_8, 1, 3));
            assertThrows(ZeroDivisionError.class,
                    () -> Q8_8.fromRational(1, 0));
        }

        @ParameterizedTest(name = "{0}/{1} rounds to {2}")
        @CsvSource({"1, 2, 1", "-1, 2, -1", "3, 2, 2", "-3, 2, -2",
                "1, 3, 0", "2, 3, 1", "-2, 3, -1"})
        void halvesRoundAway(long num, long den, long expected) {
            assertScaled(expected, FxFormat.of(0).fromRational(num, den));
        }

        @ParameterizedTest(name = "fromString(\"{0}\")")
        @CsvSource(delimiter = '|', value = {"1.5|384", " -2.25 |-576",
                "1e1|2560", "+.5|128", "5.|1280", "0.001953125|1",
                "-0.001953125|-1", "25E-2|64", "0|0"})
        void fromString(String text, long scaled) {
            assertScaled(scaled, Q8_8.fromString(text));
        }

        @ParameterizedTest(name = "fromString(\"{0}\") fails")
        @ValueSource(strings = {"", ".", "1.2.3", "abc", "1e", "--1",
                "1 2", "0x10", "1e100001"})
        void fromStringInvalid(String text) {
            assertThrows(ValueError.class, () -> Q8_8.fromString(text));
        }

        @Test
        void fromStringOverflow() {
            assertThrows(OverflowError.class, () -> Q8_8.fromString("1e3"));
        }

        @Test
        void fromDouble() {
            assertScaled(384, Q8_8.fromDouble(1.5));
            assertScaled(26, Q8_8.fromDouble(0.1));
            assertScaled(-26, Q8_8.fromDouble(-0.1));
            assertScaled(0, F8.fromDouble(Double.MIN_VALUE));
            assertScaled(0, F8.fromDouble(-0.0));
            assertEquals(0.1, F64.fromDouble(0.1).doubleValue());
        }

        @Test
        void fromDoubleInvalid() {
            assertThrows(ValueError.class, () -> Q8_8.fromDouble(Double.NaN));
            assertThrows(OverflowError.class,
                    () -> F64.fromDouble(Double.POSITIVE_INFINITY));
            assertThrows(OverflowError.class,
                    () -> F64.fromDouble(Double.NEGATIVE_INFINITY));
            assertThrows(OverflowError.class, () -> Q8_8.fromDouble(1e10));
        }

        @Test
        void fromScaled() {
            FxNumber x = Q8_8.fromScaled(BigInteger.valueOf(-32768));
            assertEquals(-128, x.longValue());
            assertThrows(OverflowError.class,
                    () -> Q8_8.fromScaled(BigInteger.valueOf(32768)));
        }
    }

    @Nested
    @DisplayName("is converted")
    class ConversionTest {

        @Test
        void truncatesTowardZero() {
            FxNumber x = F8.fromRational(-7, 2);
            assertEquals(-3, x.longValue());
            assertEquals(-3, x.intValue());
            assertEquals(BigInteger.valueOf(-3), x.toBigInteger());
            assertEquals(3, F8.fromRational(7, 2).longValue());
        }

        @Test
        void longValueExact() {
            assertEquals(-12, F8.fromInt(-12).longValueExact());
            FxNumber big = F8.fromInt(BigInteger.ONE.shiftLeft(70));
            assertThrows(OverflowError.class, () -> big.longValueExact());
        }

        @Test
        void toBigDecimal() {
            assertEquals(0, new BigDecimal("0.25")
                    .compareTo(F8.fromRational(1, 4).toBigDecimal()));
            assertEquals(0, new BigDecimal("-0.00390625")
                    .compareTo(F8.fromScaled(BigInteger.ONE.negate())
                            .toBigDecimal()));
        }

        @Test
        void toDouble() {
            assertEquals(-2.5, Q8_8.fromRational(-5, 2).doubleValue());
            assertEquals(0.75f, Q8_8.fromRational(3, 4).floatValue());
        }

        @Test
        void convertRounds() {
            FxNumber third = Q8_8.fromRational(1, 3); // 85/256
            FxNumber c = third.convert(FxFormat.of(4)); // 5.3125 -> 5
            assertScaled(5, c);
            assertEquals(FxFormat.of(4), c.getFormat());
        }

        @Test
        void convertExtends() {
            FxNumber third = Q8_8.fromRational(1, 3);
            assertScaled(85 << 8, third.convert(FxFormat.of(16)));
        }

        @Test
        void convertSameFormat() {
            FxNumber x = Q8_8.fromInt(3);
            assertSame(x, x.convert(Q8_8));
        }

        @Test
        void convertEqualFormat() {
            FxNumber x = Q8_8.fromInt(3);
            FxFormat q = FxFormat.of(8, 8);
            FxNumber y = x.convert(q);
            assertNotSame(x, y);
            assertSame(q, y.getFormat());
            assertEquals(x, y);
        }

        @Test
        void convertOverflow() {
            FxNumber x = Q8_8.fromInt(100);
            assertThrows(OverflowError.class,
                    () -> x.convert(FxFormat.of(4, 8)));
        }
    }

    @Nested
    @DisplayName("does arithmetic")
    class ArithmeticTest {

        @Test
        void immutable() {
            FxNumber a = Q8_8.fromInt(3), b = Q8_8.fromInt(4);
            a.add(b);
            a.multiply(b);
            a.negate();
            a.shiftLeft(2);
            assertScaled(3 * 256, a);
            assertScaled(4 * 256, b);
        }

        @ParameterizedTest(name = "{0} and {1}")
        @CsvSource({"1.5, 2.25", "-3.75, 0.125", "0, 7", "-1, -1",
                "0.33, 12.1"})
        void commutative(String as, String bs) {
            FxNumber a = F64.fromString(as), b = F64.fromString(bs);
            assertEquals(a.add(b), b.add(a));
            assertEquals(a.multiply(b), b.multiply(a));
        }

        @ParameterizedTest(name = "{0}, {1} and {2}")
        @CsvSource({"1.5, 2.25, -3", "0.1, 0.2, 0.3", "-3.7, 1.1, 2.9",
                "3.14159, 2.71828, 1.41421"})
        void associative(String as, String bs, String cs) {
            FxFormat f = FxFormat.of(32);
            FxNumber a = f.fromString(as), b = f.fromString(bs),
                    c = f.fromString(cs);
            // Exact in addition
            assertEquals(a.add(b).add(c), a.add(b.add(c)));
            // Within rounding in multiplication
            assertWithinUlps(a.multiply(b).multiply(c),
                    a.multiply(b.multiply(c)), 8);
        }

        @ParameterizedTest(name = "a = {0}")
        @ValueSource(strings = {"1", "-1", "0.00390625", "3.3", "-127.5",
                "100"})
        void selfInverse(String as) {
            FxNumber a = Q8_8.fromString(as);
            assertEquals(Q8_8.one(), a.divide(a));
            assertTrue(a.subtract(a).isZero());
        }

        @Test
        void add() {
            FxNumber a = Q8_8.fromString("1.5"), b = Q8_8.fromString("2.25");
            assertScaled(960, a.add(b));
            assertScaled(-192, a.subtract(b));
            assertScaled(896, a.add(2));
            assertScaled(-128, a.subtract(2));
        }

        @Test
        void addOverflow() {
            FxNumber a = Q8_8.fromInt(100);
            assertThrows(OverflowError.class, () -> a.add(a));
            assertThrows(OverflowError.class, () -> a.negate().subtract(a));
            assertThrows(OverflowError.class, () -> a.add(28));
        }

        @Test
        void multiply() {
            FxNumber a = Q8_8.fromString("1.5"), b = Q8_8.fromString("2.25");
            assertScaled(864, a.multiply(b)); // 3.375
            assertScaled(-768, a.multiply(-2));
            assertThrows(OverflowError.class,
                    () -> Q8_8.fromInt(16).multiply(Q8_8.fromInt(8)));
        }

        @Test
        void thirdTimesThree() {
            FxNumber third = Q8_8.fromRational(1, 3);
            FxNumber r = third.multiply(Q8_8.fromInt(3));
            assertScaled(255, r);
            assertEquals("1.00", r.toDecimalString(2));
            assertEquals(r, third.multiply(3));
        }

        @Test
        void divide() {
            FxNumber one = Q8_8.one(), three = Q8_8.fromInt(3);
            assertScaled(85, one.divide(three));
            assertScaled(-85, one.negate().divide(three));
            assertScaled(171, Q8_8.fromInt(2).divide(three));
            assertScaled(128, one.divide(2));
            assertScaled(-43, one.divide(-6)); // -42.67
        }

        @Test
        void divideByZero() {
            FxNumber one = Q8_8.one();
            assertThrows(ZeroDivisionError.class,
                    () -> one.divide(Q8_8.zero()));
            assertThrows(ZeroDivisionError.class, () -> one.divide(0));
        }

        @Test
        void divideOverflow() {
            FxNumber a = Q8_8.fromInt(100);
            assertThrows(OverflowError.class,
                    () -> a.divide(Q8_8.fromRational(1, 4)));
        }

        @Test
        void divideIntoFormat() {
            FxNumber one = Q8_8.one(), three = Q8_8.fromInt(3);
            FxNumber r = one.divide(three, FxFormat.of(16));
            assertScaled(21845, r); // 65536/3
            assertEquals(FxFormat.of(16), r.getFormat());
        }

        @ParameterizedTest(name = "{0} mod {1} = {2}")
        @CsvSource({"7, 3, 1", "-7, 3, 2", "7, -3, -2", "-7, -3, -1",
                "5.5, 2, 1.5", "-5.5, 2, 0.5", "6, 3, 0", "0.75, 0.5, 0.25"})
        void floorMod(String as, String bs, String expected) {
            FxNumber a = F8.fromString(as), b = F8.fromString(bs);
            assertEquals(F8.fromString(expected), a.mod(b));
        }

        @Test
        void modByZero() {
            assertThrows(ZeroDivisionError.class,
                    () -> F8.fromInt(3).mod(F8.zero()));
        }

        @Test
        void unary() {
            FxNumber a = Q8_8.fromString("-2.5");
            assertScaled(640, a.negate());
            assertScaled(640, a.abs());
            assertSame(a, a.plus());
            FxNumber b = Q8_8.fromString("2.5");
            assertSame(b, b.abs());
        }

        @Test
        void unaryOverflow() {
            FxNumber least = Q8_8.fromInt(-128);
            assertThrows(OverflowError.class, () -> least.negate());
            assertThrows(OverflowError.class, () -> least.abs());
        }

        @Test
        void shifts() {
            FxNumber three = F8.fromInt(3);
            assertEquals(F8.fromInt(12), three.shiftLeft(2));
            assertEquals(F8.fromString("1.5"), three.shiftRight(1));
            assertEquals(three.shiftRight(1), three.shiftLeft(-1));
            assertEquals(three.shiftLeft(3), three.shiftRight(-3));
        }

        @Test
        void shiftRightRounds() {
            FxFormat f = FxFormat.of(0);
            assertScaled(2, f.fromInt(3).shiftRight(1)); // 1.5
            assertScaled(-2, f.fromInt(-3).shiftRight(1)); // -1.5
            assertScaled(1, f.fromInt(5).shiftRight(2)); // 1.25
        }

        @Test
        void shiftOverflow() {
            assertThrows(OverflowError.class,
                    () -> Q8_8.fromInt(64).shiftLeft(1));
        }
    }

    @Nested
    @DisplayName("combines different formats")
    class MixedFormatTest {

        @Test
        void dominantFormat() {
            FxNumber a = Q8_8.fromString("1.5");
            FxNumber b = FxFormat.of(4, 4).fromString("2.25");
            FxNumber sum = a.add(b);
            assertSame(Q8_8, sum.getFormat());
            assertEquals(a.add(b.convert(Q8_8)), sum);
            assertEquals(a.multiply(b.convert(Q8_8)), a.multiply(b));
            assertEquals(a.divide(b.convert(Q8_8)), a.divide(b));
        }

        @Test
        void widenedFormat() {
            FxNumber a = FxFormat.of(8, 4).fromString("100.5");
            FxNumber b = FxFormat.of(4, 8).fromString("0.00390625");
            FxNumber sum = a.add(b);
            assertEquals(Q8_8, sum.getFormat());
            assertScaled(100 * 256 + 128 + 1, sum);
            assertEquals(a.convert(Q8_8).add(b.convert(Q8_8)), sum);
        }

        @Test
        void explicitResultFormat() {
            FxNumber a = F8.fromString("1.5"), b = F8.fromString("0.25");
            FxNumber p = a.multiply(b, FxFormat.of(1));
            // 0.375 rounds to 0.5
            assertScaled(1, p);
            assertEquals(FxFormat.of(1), p.getFormat());
            assertThrows(OverflowError.class,
                    () -> a.add(b, FxFormat.of(1, 4)));
        }
    }

    @Nested
    @DisplayName("compares")
    class ComparisonTest {

        @Test
        void acrossFormats() {
            FxNumber a = F8.fromString("1.5");
            FxNumber b = FxFormat.of(4, 4).fromString("1.5");
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertEquals(0, a.compareTo(b));
        }

        @Test
        void integersAcrossFormats() {
            FxNumber a = FxFormat.of(0).fromInt(-6);
            FxNumber b = FxFormat.of(10).fromInt(-6);
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
        }

        @Test
        void ordering() {
            FxNumber a = F8.fromString("-0.5"), b = Q8_8.fromString("0.25");
            assertTrue(a.compareTo(b) < 0);
            assertTrue(b.compareTo(a) > 0);
            assertNotEquals(a, b);
            assertSame(a, a.min(b));
            assertSame(b, a.max(b));
        }

        @Test
        void signs() {
            assertEquals(-1, F8.fromString("-0.5").signum());
            assertEquals(0, F8.zero().signum());
            assertEquals(1, F8.fromString("0.5").signum());
            assertTrue(F8.zero().isZero());
            assertFalse(F8.fromScaled(BigInteger.ONE).isZero());
        }

        @Test
        void notEqualToOtherTypes() {
            assertNotEquals(F8.fromInt(1), Integer.valueOf(1));
        }

        @Test
        void integerTest() {
            assertTrue(F8.fromInt(-4).isInteger());
            assertTrue(F8.zero().isInteger());
            assertFalse(F8.fromString("2.5").isInteger());
        }
    }

    @Nested
    @DisplayName("is serialized")
    class SerializationTest {

        @Test
        void roundTrip() throws Exception {
            FxNumber x = Q8_8.fromRational(-4, 3);
            FxNumber y = (FxNumber)deserialize(serialize(x));
            assertEquals(x, y);
            assertEquals(Q8_8, y.getFormat());
            assertScaled(x.getScaledValue().longValueExact(), y);
        }

        @Test
        void formatUsable() throws Exception {
            FxNumber x = F64.getPi();
            FxNumber y = (FxNumber)deserialize(serialize(x));
            // The constant cache is rebuilt on demand.
            assertEquals(x, y.getFormat().getPi());
            assertEquals(F64.fromInt(2).sqrt(), y.getFormat().fromInt(2).sqrt());
        }

        @Test
        void sharedFormat() throws Exception {
            FxNumber[] a = {Q8_8.one(), Q8_8.fromInt(-5)};
            FxNumber[] b = (FxNumber[])deserialize(serialize(a));
            assertSame(b[0].getFormat(), b[1].getFormat());
            assertEquals(a[1], b[1]);
        }

        @Test
        void outOfRange() throws Exception {
            FxNumber bad = new FxNumber(Q8_8, BigInteger.ONE.shiftLeft(20));
            byte[] data = serialize(bad);
            assertThrows(InvalidObjectException.class, () -> deserialize(data));
        }

        private byte[] serialize(Object obj) throws IOException {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
                out.writeObject(obj);
            }
            return bytes.toByteArray();
        }

        private Object deserialize(byte[] data)
                throws IOException, ClassNotFoundException {
            try (ObjectInputStream in = new ObjectInputStream(
                    new ByteArrayInputStream(data))) {
                return in.readObject();
            }
        }
    }
}
