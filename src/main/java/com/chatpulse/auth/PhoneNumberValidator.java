package com.chatpulse.auth;

import com.chatpulse.exception.ErrorCode;
import com.chatpulse.exception.ValidationException;
import java.util.regex.Pattern;

/** Normalizes phone numbers for the pairing flow: international digits only, no separators. */
public final class PhoneNumberValidator {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s+\\-().]");
    private static final Pattern VALID = Pattern.compile("[1-9]\\d{6,14}");

    private PhoneNumberValidator() {}

    /**
     * Strips separators and validates the remainder.
     *
     * @return the digits-only number
     * @throws ValidationException with INVALID_PHONE_NUMBER
     */
    public static String normalize(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_PHONE_NUMBER, "Phone number is required");
        }
        String digits = SEPARATORS.matcher(phoneNumber).replaceAll("");
        if (!VALID.matcher(digits).matches()) {
            throw new ValidationException(
                    ErrorCode.INVALID_PHONE_NUMBER,
                    "Phone number must be 7-15 digits without a leading zero: " + phoneNumber);
        }
        return digits;
    }
}
