package com.chatpulse.unit.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chatpulse.auth.PhoneNumberValidator;
import com.chatpulse.exception.ErrorCode;
import com.chatpulse.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PhoneNumberValidatorTest {

    private static void assertRejected(String input) {
        assertThatThrownBy(() -> PhoneNumberValidator.normalize(input))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_PHONE_NUMBER);
    }

    @Test
    @DisplayName("Strips separators and the leading plus")
    void stripsSeparators() {
        assertThat(PhoneNumberValidator.normalize("+1 (415) 555-0132")).isEqualTo("14155550132");
        assertThat(PhoneNumberValidator.normalize("44.20.7946.0958")).isEqualTo("442079460958");
    }

    @Test
    @DisplayName("Rejects missing input")
    void rejectsBlank() {
        assertRejected(null);
        assertRejected("");
        assertRejected("   ");
    }

    @Test
    @DisplayName("Rejects numbers that are too short, too long or start with zero")
    void rejectsBadLength() {
        assertRejected("12345");
        assertRejected("1234567890123456");
        assertRejected("0123456789");
    }

    @Test
    @DisplayName("Rejects letters")
    void rejectsLetters() {
        assertRejected("+1 415 CALL NOW");
    }
}
