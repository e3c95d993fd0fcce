package com.example.annotation.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.types.Decimal128;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PayloadNumberConverters")
class PayloadNumberConvertersTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .registerModule(PayloadNumberConverters.jacksonModule());
    }

    @Test
    @DisplayName("should bind payload decimals and oversized integers without losing digits")
    void shouldBindExactNumbers() throws Exception {
        Map<?, ?> payload = objectMapper.readValue(
                "{\"ratio\": 0.10, \"big\": 123456789012345678901234567890}", Map.class);

        assertThat(payload.get("ratio")).isEqualTo(new BigDecimal("0.10"));
        assertThat(payload.get("big")).isEqualTo(new BigInteger("123456789012345678901234567890"));
    }

    @Test
    @DisplayName("should store big numbers as decimal128 and read them back unchanged")
    void shouldRoundTripThroughDecimal128() {
        BigDecimal ratio = new BigDecimal("0.10");
        Decimal128 stored = PayloadNumberConverters.BigDecimalToDecimal128Converter.INSTANCE.convert(ratio);

        assertThat(PayloadNumberConverters.Decimal128ToBigDecimalConverter.INSTANCE.convert(stored))
                .isEqualTo(ratio);

        BigInteger big = new BigInteger("123456789012345678901234567890");
        Decimal128 storedBig = PayloadNumberConverters.BigIntegerToDecimal128Converter.INSTANCE.convert(big);
        assertThat(storedBig.bigDecimalValue().toBigIntegerExact()).isEqualTo(big);
    }

    @Test
    @DisplayName("should refuse numbers beyond 34 significant digits")
    void shouldRejectTooPrecise() {
        BigDecimal tooPrecise = new BigDecimal("1.2345678901234567890123456789012345678");

        assertThatThrownBy(() -> PayloadNumberConverters.toDecimal128(tooPrecise))
                .isInstanceOf(NumberFormatException.class);
    }

    @Test
    @DisplayName("should write raw decimal128 values as plain JSON numbers")
    void shouldSerializeDecimal128AsNumber() throws Exception {
        String json = objectMapper.writeValueAsString(
                List.of(new Decimal128(new BigDecimal("2.50")), 7));

        assertThat(json).isEqualTo("[2.50,7]");
    }

    @Test
    @DisplayName("should register both writing converters and the reading converter")
    void shouldExposeConverters() {
        assertThat(PayloadNumberConverters.converters()).hasSize(3);
    }
}
