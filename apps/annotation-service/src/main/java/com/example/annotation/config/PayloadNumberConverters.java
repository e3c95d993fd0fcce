package com.example.annotation.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.lang.NonNull;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Keeps numbers inside case payloads exact between JSON and MongoDB.
 *
 * <p>Requests bind decimals as {@link BigDecimal} and oversized integers as
 * {@link BigInteger}. Both are stored as BSON {@code decimal128} instead of the
 * store's default string form, and read back as {@link BigDecimal}. A value needs
 * at most 34 significant digits to fit.
 */
public final class PayloadNumberConverters {

    private PayloadNumberConverters() {}

    public static List<Converter<?, ?>> converters() {
        return List.of(
                BigDecimalToDecimal128Converter.INSTANCE,
                BigIntegerToDecimal128Converter.INSTANCE,
                Decimal128ToBigDecimalConverter.INSTANCE);
    }

    /**
     * @throws NumberFormatException when the value does not fit in decimal128 exactly
     */
    @NonNull
    public static Decimal128 toDecimal128(@NonNull BigDecimal value) {
        return new Decimal128(value);
    }

    /**
     * Serializes a raw {@link Decimal128} as a plain JSON number.
     */
    public static SimpleModule jacksonModule() {
        SimpleModule module = new SimpleModule("payload-numbers");
        module.addSerializer(Decimal128.class, new StdSerializer<>(Decimal128.class) {
            @Override
            public void serialize(Decimal128 value, JsonGenerator gen, SerializerProvider provider) throws IOException {
                gen.writeNumber(value.bigDecimalValue());
            }
        });
        return module;
    }

    @WritingConverter
    enum BigDecimalToDecimal128Converter implements Converter<BigDecimal, Decimal128> {
        INSTANCE;

        @Override
        public Decimal128 convert(BigDecimal source) {
            return toDecimal128(source);
        }
    }

    @WritingConverter
    enum BigIntegerToDecimal128Converter implements Converter<BigInteger, Decimal128> {
        INSTANCE;

        @Override
        public Decimal128 convert(BigInteger source) {
            return toDecimal128(new BigDecimal(source));
        }
    }

    @ReadingConverter
    enum Decimal128ToBigDecimalConverter implements Converter<Decimal128, BigDecimal> {
        INSTANCE;

        @Override
        public BigDecimal convert(Decimal128 source) {
            return source.bigDecimalValue();
        }
    }
}
