package org.scharp.fits;

/**
 * A class with utility methods for validating arguments.
 */
abstract class ArgumentUtil {
    /**
     * Throws an exception if {@code argument} is {@code null}.
     *
     * @param argument
     *     The argument to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     */
    static void checkNotNull(Object argument, String argumentName) {
        if (argument == null) {
            throw new NullPointerException(argumentName + " must not be null");
        }
    }

    /**
     * Throws an exception if {@code argument} is longer than a given number of characters or if it contains a
     * character that cannot be written into a FITS header or a character column.
     *
     * @param argument
     *     The string to check
     * @param maximumLength
     *     The maximum number of characters {@code argument} may have.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is longer than {@code maximumLength} or if it is not printable ASCII.
     */
    static void checkAscii(String argument, int maximumLength, String argumentName) {
        assert 0 <= maximumLength : "maximumLength must not be negative";
        assert argumentName != null : "argumentName must not be null";

        if (maximumLength < argument.length()) {
            throw new IllegalArgumentException(
                argumentName + " must not be longer than " + maximumLength + " characters");
        }
        for (int i = 0; i < argument.length(); i++) {
            char c = argument.charAt(i);
            if (c < 0x20 || 0x7E < c) {
                throw new IllegalArgumentException(
                    argumentName + " must only contain printable ASCII characters");
            }
        }
    }

    /**
     * Throws an exception if {@code argument} is negative (less than zero).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is negative
     */
    static void checkNotNegative(long argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (argument < 0) {
            throw new IllegalArgumentException(argumentName + " must not be negative");
        }
    }
}
