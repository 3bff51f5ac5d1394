/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.core;

import java.nio.charset.StandardCharsets;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.TimeZone;

import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;

/**
 * A collection of various utility methods that are helpful for working with
 * the ledger: hex encoding, SHA-256 and a clock that tests can replace.
 */
public class Utils {

    /** Hex encoding used throughout the ledger. */
    public static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    /**
     * If non-null, overrides the return value of now().
     */
    private static volatile Date mockTime;

    private Utils() {
    }

    public static byte[] sha256(byte[] input) {
        return Hashing.sha256().hashBytes(input).asBytes();
    }

    public static String sha256Hex(byte[] input) {
        return HEX.encode(sha256(input));
    }

    public static String sha256Hex(String input) {
        return sha256Hex(input.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Advances (or rewinds) the mock clock by the given number of seconds.
     */
    public static Date rollMockClock(int seconds) {
        return rollMockClockMillis(seconds * 1000L);
    }

    /**
     * Advances (or rewinds) the mock clock by the given number of milliseconds.
     */
    public static Date rollMockClockMillis(long millis) {
        if (mockTime == null)
            throw new IllegalStateException("You need to use setMockClock() first.");
        mockTime = new Date(mockTime.getTime() + millis);
        return mockTime;
    }

    /**
     * Sets the mock clock to the current time.
     */
    public static void setMockClock() {
        mockTime = new Date();
    }

    /**
     * Sets the mock clock to the given time (in seconds).
     */
    public static void setMockClock(long mockClockSeconds) {
        mockTime = new Date(mockClockSeconds * 1000);
    }

    /**
     * Clears the mock clock and sleep.
     */
    public static void resetMocking() {
        mockTime = null;
    }

    /**
     * Returns the current time, or a mocked out equivalent.
     */
    public static Date now() {
        return mockTime != null ? mockTime : new Date();
    }

    /** Returns the current time in milliseconds since the epoch, or a mocked out equivalent. */
    public static long currentTimeMillis() {
        return mockTime != null ? mockTime.getTime() : System.currentTimeMillis();
    }

    public static long currentTimeSeconds() {
        return currentTimeMillis() / 1000;
    }

    /**
     * Formats a given date+time value to an ISO 8601 string.
     */
    public static String dateTimeFormat(long dateTime) {
        SimpleDateFormat iso8601 = new SimpleDateFormat("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'");
        iso8601.setTimeZone(TimeZone.getTimeZone("UTC"));
        return iso8601.format(dateTime);
    }
}
