package com.dealplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackSignalsTest {

    @Nested
    @DisplayName("extractPrice()")
    class ExtractPrice {

        @Test
        @DisplayName("plain integer figure")
        void plainFigure() {
            assertEquals(Optional.of(28500.0), FeedbackSignals.extractPrice("I could go to 28500 max"));
        }

        @Test
        @DisplayName("thousands separators: space, comma and dot")
        void separators() {
            assertEquals(Optional.of(28500.0), FeedbackSignals.extractPrice("28 500 euros"));
            assertEquals(Optional.of(28500.0), FeedbackSignals.extractPrice("$28,500"));
            assertEquals(Optional.of(28500.0), FeedbackSignals.extractPrice("28.500 EUR"));
        }

        @Test
        @DisplayName("k suffix multiplies by a thousand")
        void kSuffix() {
            assertEquals(Optional.of(28500.0), FeedbackSignals.extractPrice("around 28.5k"));
            assertEquals(Optional.of(30000.0), FeedbackSignals.extractPrice("30K and we have a deal"));
        }

        @Test
        @DisplayName("small figures such as durations are skipped")
        void durationsSkipped() {
            assertEquals(Optional.of(29000.0), FeedbackSignals.extractPrice("over 36 months, 29000 total"));
            assertTrue(FeedbackSignals.extractPrice("36 months is too long").isEmpty());
        }

        @Test
        @DisplayName("bare model years are not read as prices")
        void modelYearsSkipped() {
            assertTrue(FeedbackSignals.extractPrice("I'd prefer the 2021 model").isEmpty());
            assertEquals(Optional.of(27000.0), FeedbackSignals.extractPrice("a 2019 car for 27000 would work"));
            assertEquals(Optional.of(1500.0), FeedbackSignals.extractPrice("1500 off and we talk"));
        }

        @Test
        @DisplayName("null and blank feedback yield nothing")
        void emptyInput() {
            assertTrue(FeedbackSignals.extractPrice(null).isEmpty());
            assertTrue(FeedbackSignals.extractPrice("   ").isEmpty());
        }
    }

    @Nested
    @DisplayName("isAgreement() / isPushback()")
    class Sentiment {

        @Test
        @DisplayName("agreement phrases are recognised")
        void agreement() {
            assertTrue(FeedbackSignals.isAgreement("OK, I accept these terms"));
            assertTrue(FeedbackSignals.isAgreement("Deal."));
            assertTrue(FeedbackSignals.isAgreement("sounds good to me"));
        }

        @Test
        @DisplayName("negated agreement is not agreement")
        void negatedAgreement() {
            assertFalse(FeedbackSignals.isAgreement("I do not accept this"));
            assertFalse(FeedbackSignals.isAgreement("no deal"));
            assertTrue(FeedbackSignals.isPushback("no deal"));
        }

        @Test
        @DisplayName("words containing 'ok' do not count as agreement")
        void wordBoundaries() {
            assertFalse(FeedbackSignals.isAgreement("I booked a test drive elsewhere"));
        }

        @Test
        @DisplayName("price complaints are pushback")
        void pushback() {
            assertTrue(FeedbackSignals.isPushback("This is too expensive for me"));
            assertTrue(FeedbackSignals.isPushback("Can you make it cheaper?"));
            assertFalse(FeedbackSignals.isPushback("Let me think about the colour"));
        }
    }
}
